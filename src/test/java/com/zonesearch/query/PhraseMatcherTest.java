package com.zonesearch.query;

import com.zonesearch.index.CorpusIndex;
import com.zonesearch.index.IndexFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.zonesearch.index.IndexFixtures.doc;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PhraseMatcherTest {

    private final CorpusIndex index = IndexFixtures.index(
        doc(1, "x a b y"),
        doc(2, "x b a y"),
        doc(3, "a x b"),
        doc(4, "b y", "a b"),
        doc(5, "a a a b"));

    @Test
    @DisplayName("没有短语时候选集为全部文档")
    void testNoPhrasesKeepsAllDocuments() {
        PhraseResolution resolution = new PhraseMatcher(index).resolve(List.of());

        assertEquals(List.of(1, 2, 3, 4, 5), List.copyOf(resolution.candidates()));
        assertEquals(5, resolution.documentsConsidered());
        assertFalse(resolution.phraseFiltered());
    }

    @Test
    @DisplayName("短语匹配区分顺序且要求相邻")
    void testPhraseIsOrderSensitiveAndContiguous() {
        PhraseResolution resolution = resolve(List.of("a", "b"));

        // doc2 顺序相反，doc3 中间隔了 x
        assertEquals(List.of(1, 4, 5), List.copyOf(resolution.candidates()));
        assertTrue(resolution.phraseFiltered());
    }

    @Test
    @DisplayName("短语可以跨越区域边界")
    void testPhraseAcrossZoneBoundary() {
        PhraseResolution resolution = resolve(List.of("y", "a"));

        assertEquals(List.of(4), List.copyOf(resolution.candidates()));
    }

    @Test
    @DisplayName("重复词短语")
    void testRepeatedTermPhrase() {
        assertEquals(List.of(5), List.copyOf(resolve(List.of("a", "a", "b")).candidates()));
        assertTrue(resolve(List.of("a", "a", "a", "a")).candidates().isEmpty());
    }

    @Test
    @DisplayName("多个短语取交集")
    void testMultiplePhrasesIntersect() {
        PhraseResolution resolution = new PhraseMatcher(index).resolve(List.of(
            new QueryAtom.Phrase(List.of("a", "b")),
            new QueryAtom.Phrase(List.of("x", "a"))));

        assertEquals(List.of(1), List.copyOf(resolution.candidates()));
        assertEquals(1, resolution.documentsConsidered());
    }

    @Test
    @DisplayName("短语中有不存在的词时无候选")
    void testUnknownTermEmptiesCandidates() {
        PhraseResolution resolution = resolve(List.of("a", "zzz"));

        assertTrue(resolution.candidates().isEmpty());
        assertEquals(0, resolution.documentsConsidered());
    }

    @Test
    @DisplayName("单词短语等价于包含该词")
    void testSingleTermPhrase() {
        assertEquals(List.of(1, 2, 3), List.copyOf(resolve(List.of("x")).candidates()));
    }

    private PhraseResolution resolve(List<String> terms) {
        return new PhraseMatcher(index).resolve(List.of(new QueryAtom.Phrase(terms)));
    }
}
