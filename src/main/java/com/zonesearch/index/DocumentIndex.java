package com.zonesearch.index;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.TreeMap;

/**
 * 只读文档索引：docID 到文档完整词项序列的映射，按 docID 升序排列。
 * 文档长度即词项数，供余弦归一化使用。
 */
public final class DocumentIndex {
    private final NavigableMap<Integer, List<String>> tokensByDocId;
    private final long totalTokenCount;

    public DocumentIndex(Map<Integer, List<String>> tokensByDocId) {
        if (tokensByDocId == null) {
            throw new IllegalArgumentException("tokensByDocId不能为null");
        }
        TreeMap<Integer, List<String>> sorted = new TreeMap<>();
        long tokenCount = 0;
        for (Map.Entry<Integer, List<String>> entry : tokensByDocId.entrySet()) {
            List<String> tokens = entry.getValue();
            if (tokens == null || tokens.isEmpty()) {
                throw new IllegalArgumentException("文档词项序列不能为空, docId=" + entry.getKey());
            }
            sorted.put(entry.getKey(), List.copyOf(tokens));
            tokenCount += tokens.size();
        }
        this.tokensByDocId = Collections.unmodifiableNavigableMap(sorted);
        this.totalTokenCount = tokenCount;
    }

    /**
     * 获取文档的词项序列，文档不存在时返回 null。
     */
    public List<String> getTokens(int docId) {
        return tokensByDocId.get(docId);
    }

    /**
     * 获取文档长度（词项数），文档不存在时返回 0。
     */
    public int getLength(int docId) {
        List<String> tokens = tokensByDocId.get(docId);
        return tokens == null ? 0 : tokens.size();
    }

    public boolean contains(int docId) {
        return tokensByDocId.containsKey(docId);
    }

    public NavigableSet<Integer> docIds() {
        return tokensByDocId.navigableKeySet();
    }

    public NavigableMap<Integer, List<String>> asMap() {
        return tokensByDocId;
    }

    public int getDocCount() {
        return tokensByDocId.size();
    }

    public long getTotalTokenCount() {
        return totalTokenCount;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof DocumentIndex that && tokensByDocId.equals(that.tokensByDocId);
    }

    @Override
    public int hashCode() {
        return tokensByDocId.hashCode();
    }

    @Override
    public String toString() {
        return "DocumentIndex[docs=" + tokensByDocId.size() + ", tokens=" + totalTokenCount + "]";
    }
}
