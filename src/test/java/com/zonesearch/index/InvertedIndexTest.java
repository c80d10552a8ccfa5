package com.zonesearch.index;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InvertedIndexTest {

    private final InvertedIndex index = IndexFixtures.foxCorpus().invertedIndex();

    @Test
    @DisplayName("精确查找词条")
    void testLookup() {
        Optional<TermEntry> fox = index.lookup("fox");

        assertTrue(fox.isPresent());
        assertEquals(2, fox.get().docFreq());
        assertEquals(Optional.empty(), index.lookup("zebra"));
    }

    @Test
    @DisplayName("倒排列表与文档频率通过词条查找获得")
    void testPostingsAndDocFreq() {
        assertEquals(new PostingList(new int[] {1, 3}, new int[][] {{1}, {0}}), index.getPostings("jumps"));
        assertEquals(2, index.getDocFreq("runs"));
        assertNull(index.getPostings("zebra"));
        assertEquals(0, index.getDocFreq("zebra"));
    }

    @Test
    @DisplayName("词项按字典序排列")
    void testTermsSorted() {
        assertEquals(List.of("fox", "jumps", "runs"), List.copyOf(index.terms()));
        assertEquals(3, index.getTermCount());
    }

    @Test
    @DisplayName("词条键必须与词项一致")
    void testKeyMismatchRejected() {
        TermEntry entry = new TermEntry("fox", new PostingList(new int[] {1}, new int[][] {{0}}));

        assertThrows(IllegalArgumentException.class, () -> new InvertedIndex(Map.of("dog", entry)));
    }
}
