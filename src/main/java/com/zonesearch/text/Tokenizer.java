package com.zonesearch.text;

import java.util.List;

public interface Tokenizer {

    /**
     * 将输入文本切分为词项列表。
     */
    List<Token> tokenize(String text);

    /**
     * 对单个查询词执行与 tokenize 相同的归一化，结果为空串表示该词被丢弃。
     */
    String normalize(String word);
}
