package com.zonesearch.document;

/**
 * 文档中的一个命名区域，例如 title 或 body。
 *
 * @param name 区域名
 * @param content 原始文本，可能为 null 或空串，由索引构建器负责校验
 */
public record Zone(String name, String content) {

    public boolean isEmpty() {
        return content == null || content.isEmpty();
    }
}
