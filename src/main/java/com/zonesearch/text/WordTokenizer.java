package com.zonesearch.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class WordTokenizer implements Tokenizer {

    /** 以 Unicode 空白（含不换行空格、全角空格）切分的词 */
    public static final Pattern WORD_PATTERN = Pattern.compile("\\S+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern PUNCTUATION_PATTERN =
        Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * 按空白切分，去除标点并转小写，输出原文偏移。
     */
    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        Matcher wordMatcher = WORD_PATTERN.matcher(text);
        int nextPosition = 0;

        while (wordMatcher.find()) {
            String normalizedTerm = normalize(wordMatcher.group());
            if (normalizedTerm.isEmpty()) {
                continue;
            }
            tokens.add(new Token(normalizedTerm, nextPosition, wordMatcher.start(), wordMatcher.end()));
            nextPosition++;
        }

        return List.copyOf(tokens);
    }

    /**
     * 判断字符是否为切分用的空白，与 {@link #WORD_PATTERN} 的定义一致。
     */
    public static boolean isWhitespace(char ch) {
        return WHITESPACE_PATTERN.matcher(String.valueOf(ch)).matches();
    }

    @Override
    public String normalize(String word) {
        if (word == null || word.isEmpty()) {
            return "";
        }
        return PUNCTUATION_PATTERN.matcher(word).replaceAll("").toLowerCase(Locale.ROOT);
    }
}
