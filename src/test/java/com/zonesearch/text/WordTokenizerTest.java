package com.zonesearch.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WordTokenizerTest {

    private final WordTokenizer tokenizer = new WordTokenizer();

    @Test
    @DisplayName("WordTokenizer: 去除标点并转小写")
    void testStripsPunctuationAndLowercases() {
        List<Token> tokens = tokenizer.tokenize("Hello, World! It's fox_1");

        assertEquals(4, tokens.size());
        assertToken(tokens.get(0), "hello", 0, 0, 6);
        assertToken(tokens.get(1), "world", 1, 7, 13);
        assertToken(tokens.get(2), "its", 2, 14, 18);
        assertToken(tokens.get(3), "fox_1", 3, 19, 24);
    }

    @Test
    @DisplayName("WordTokenizer: 纯标点词不占用位置")
    void testPunctuationOnlyWordsDoNotConsumePositions() {
        List<Token> tokens = tokenizer.tokenize("a -- b");

        assertEquals(2, tokens.size());
        assertToken(tokens.get(0), "a", 0, 0, 1);
        assertToken(tokens.get(1), "b", 1, 5, 6);
    }

    @Test
    @DisplayName("WordTokenizer: 保留非 ASCII 字母")
    void testKeepsUnicodeLetters() {
        List<Token> tokens = tokenizer.tokenize("Café  Ünïcode\t搜索");

        assertEquals(List.of("café", "ünïcode", "搜索"), tokens.stream().map(Token::term).toList());
    }

    @Test
    @DisplayName("WordTokenizer: 不换行空格与全角空格同样切分")
    void testSplitsOnUnicodeWhitespace() {
        List<Token> nbsp = tokenizer.tokenize("fox\u00a0jumps");
        List<Token> emSpace = tokenizer.tokenize("Fox\u2003Runs\u3000fast");

        assertEquals(2, nbsp.size());
        assertToken(nbsp.get(0), "fox", 0, 0, 3);
        assertToken(nbsp.get(1), "jumps", 1, 4, 9);
        assertEquals(List.of("fox", "runs", "fast"), emSpace.stream().map(Token::term).toList());
        assertTrue(WordTokenizer.isWhitespace('\u00a0'));
        assertTrue(WordTokenizer.isWhitespace('\u2003'));
    }

    @Test
    @DisplayName("WordTokenizer: 同一输入多次切分结果一致")
    void testRestartable() {
        String text = "The quick brown fox";

        assertEquals(tokenizer.tokenize(text), tokenizer.tokenize(text));
    }

    @Test
    @DisplayName("WordTokenizer: 边界情况")
    void testEdgeCases() {
        assertTrue(tokenizer.tokenize(null).isEmpty());
        assertTrue(tokenizer.tokenize("").isEmpty());
        assertTrue(tokenizer.tokenize("   ").isEmpty());
        assertTrue(tokenizer.tokenize("...,,, !!!").isEmpty());
    }

    @ParameterizedTest
    @CsvSource({
        "Fox, fox",
        "'jumps!', jumps",
        "'e-mail', email",
        "'?!', ''",
        "MiXeD42, mixed42"
    })
    @DisplayName("normalize 与 tokenize 使用同一规则")
    void testNormalize(String word, String expected) {
        assertEquals(expected, tokenizer.normalize(word));
    }

    private void assertToken(Token token, String term, int position, int startOffset, int endOffset) {
        assertEquals(term, token.term());
        assertEquals(position, token.position());
        assertEquals(startOffset, token.startOffset());
        assertEquals(endOffset, token.endOffset());
    }
}
