package com.zonesearch.index;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 只读倒排索引：词项到文档频率与倒排列表的映射，按词序排列。
 */
public final class InvertedIndex {
    private final NavigableMap<String, TermEntry> entriesByTerm;

    public InvertedIndex(Map<String, TermEntry> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("entries不能为null");
        }
        TreeMap<String, TermEntry> sorted = new TreeMap<>();
        for (Map.Entry<String, TermEntry> entry : entries.entrySet()) {
            if (!entry.getKey().equals(entry.getValue().term())) {
                throw new IllegalArgumentException("词条键与词项不一致: key=" + entry.getKey()
                    + ", term=" + entry.getValue().term());
            }
            sorted.put(entry.getKey(), entry.getValue());
        }
        this.entriesByTerm = Collections.unmodifiableNavigableMap(sorted);
    }

    /**
     * 精确查找词项对应词条。
     *
     * @param term 词项
     * @return 命中的词条或空
     */
    public Optional<TermEntry> lookup(String term) {
        return Optional.ofNullable(entriesByTerm.get(term));
    }

    /**
     * 获取词项的倒排列表，词项不存在时返回 null。
     */
    public PostingList getPostings(String term) {
        return lookup(term).map(TermEntry::postings).orElse(null);
    }

    public int getDocFreq(String term) {
        return lookup(term).map(TermEntry::docFreq).orElse(0);
    }

    public boolean contains(String term) {
        return entriesByTerm.containsKey(term);
    }

    public NavigableSet<String> terms() {
        return entriesByTerm.navigableKeySet();
    }

    /**
     * 按词序返回全部词条。
     */
    public Collection<TermEntry> entries() {
        return entriesByTerm.values();
    }

    public int getTermCount() {
        return entriesByTerm.size();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof InvertedIndex that && entriesByTerm.equals(that.entriesByTerm);
    }

    @Override
    public int hashCode() {
        return entriesByTerm.hashCode();
    }

    @Override
    public String toString() {
        return "InvertedIndex[terms=" + entriesByTerm.size() + "]";
    }
}
