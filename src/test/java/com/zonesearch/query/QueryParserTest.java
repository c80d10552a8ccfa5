package com.zonesearch.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.zonesearch.ErrorKind;
import com.zonesearch.text.WordTokenizer;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class QueryParserTest {

    @Test
    void testBareKeywords() {
        ParsedQuery query = parse("fox jumps");

        assertEquals(List.of(new QueryAtom.Keyword("fox"), new QueryAtom.Keyword("jumps")), query.atoms());
        assertFalse(query.hasPhrases());
    }

    @Test
    void testPhrase() {
        ParsedQuery query = parse(":fox jumps:");

        assertEquals(List.of(new QueryAtom.Phrase(List.of("fox", "jumps"))), query.atoms());
        assertEquals(List.of("fox", "jumps"), query.keywords());
    }

    @Test
    void testSingleWordPhrase() {
        ParsedQuery query = parse(":fox:");

        assertEquals(List.of(new QueryAtom.Phrase(List.of("fox"))), query.atoms());
    }

    @Test
    void testMixedKeywordsAndPhrases() {
        ParsedQuery query = parse("lazy :quick brown fox: dog :over the:");

        assertEquals(List.of(
            new QueryAtom.Keyword("lazy"),
            new QueryAtom.Phrase(List.of("quick", "brown", "fox")),
            new QueryAtom.Keyword("dog"),
            new QueryAtom.Phrase(List.of("over", "the"))), query.atoms());
        assertEquals(List.of("lazy", "quick", "brown", "fox", "dog", "over", "the"), query.keywords());
        assertEquals(2, query.phrases().size());
    }

    @Test
    void testKeywordRepeatedInsidePhraseCountsTwice() {
        ParsedQuery query = parse("fox :fox jumps:");

        assertEquals(List.of("fox", "fox", "jumps"), query.keywords());
    }

    @Test
    void testWordsAreNormalized() {
        ParsedQuery query = parse("Fox, :Jumps! Over:  ?!");

        assertEquals(List.of(
            new QueryAtom.Keyword("fox"),
            new QueryAtom.Phrase(List.of("jumps", "over"))), query.atoms());
    }

    @Test
    void testCustomDelimiters() {
        QueryParser parser = new QueryParser('[', ']', new WordTokenizer());

        ParsedQuery query = parser.parse("[fox jumps] runs");

        assertEquals(List.of(
            new QueryAtom.Phrase(List.of("fox", "jumps")),
            new QueryAtom.Keyword("runs")), query.atoms());
        assertThrows(QueryParseException.class, () -> parser.parse("fox] jumps"));
        assertThrows(QueryParseException.class, () -> parser.parse("[fox [jumps]"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        ": fox jumps:",
        ":fox jumps :",
        ":fox : jumps:",
        ":",
        "::",
        ":fox jumps",
        "fox jumps:",
        "fo:x",
        ":fox::",
        ":fox :jumps:",
        ":?!:"
    })
    void testMalformedPhraseDelimiter(String query) {
        QueryParseException exception = assertThrows(QueryParseException.class, () -> parse(query));

        assertEquals(ErrorKind.MALFORMED_PHRASE_DELIMITER, exception.getKind());
    }

    @Test
    void testErrorPositionPointsAtDelimiter() {
        QueryParseException exception = assertThrows(QueryParseException.class, () -> parse("fox : jumps:"));

        assertEquals(4, exception.getPosition());
        assertTrue(exception.getMessage().contains("fox : jumps:"));
        assertTrue(exception.getMessage().contains("    ^"));
    }

    @Test
    void testBlankQueryRejected() {
        QueryParseException exception = assertThrows(QueryParseException.class, () -> parse("   "));

        assertEquals(ErrorKind.INVALID_ARGUMENT_COUNT, exception.getKind());
        assertEquals("请输入非空查询", exception.getSuggestion());
    }

    private ParsedQuery parse(String query) {
        return new QueryParser().parse(query);
    }
}
