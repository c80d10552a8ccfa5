package com.zonesearch.index;

import java.util.List;

/**
 * 同一次构建产出的倒排索引与文档索引。
 */
public record CorpusIndex(InvertedIndex invertedIndex, DocumentIndex documentIndex) {

    public CorpusIndex {
        if (invertedIndex == null || documentIndex == null) {
            throw new IllegalArgumentException("invertedIndex与documentIndex不能为null");
        }
    }

    public IndexStatus status() {
        return new IndexStatus(documentIndex.getDocCount(), invertedIndex.getTermCount(),
            documentIndex.getTotalTokenCount());
    }

    /**
     * 校验两个索引互相一致：倒排中的每个 (docId, position) 在文档索引中对应同一词项，
     * 且文档索引中的每个词项都恰好被一个倒排位置覆盖。
     *
     * @throws IllegalStateException 存在悬空引用或位置不一致时抛出
     */
    public void verifyConsistency() {
        long coveredPositions = 0;
        for (TermEntry entry : invertedIndex.entries()) {
            PostingList postings = entry.postings();
            for (int index = 0; index < postings.size(); index++) {
                int docId = postings.docId(index);
                List<String> tokens = documentIndex.getTokens(docId);
                if (tokens == null) {
                    throw new IllegalStateException("倒排引用了不存在的文档: term=" + entry.term() + ", docId=" + docId);
                }
                for (int position : postings.positions(index)) {
                    if (position >= tokens.size() || !entry.term().equals(tokens.get(position))) {
                        throw new IllegalStateException("倒排位置与文档词项不一致: term=" + entry.term()
                            + ", docId=" + docId + ", position=" + position);
                    }
                }
                coveredPositions += postings.termFreq(index);
            }
        }
        if (coveredPositions != documentIndex.getTotalTokenCount()) {
            throw new IllegalStateException("文档索引包含倒排未覆盖的词项: covered=" + coveredPositions
                + ", total=" + documentIndex.getTotalTokenCount());
        }
    }
}
