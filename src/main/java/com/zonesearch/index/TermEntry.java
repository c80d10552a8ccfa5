package com.zonesearch.index;

/**
 * 倒排索引词条：词项、文档频率与倒排列表。文档频率始终等于倒排列表长度。
 */
public record TermEntry(String term, int docFreq, PostingList postings) {

    public TermEntry {
        if (term == null || term.isEmpty()) {
            throw new IllegalArgumentException("term 不能为空");
        }
        if (postings == null) {
            throw new IllegalArgumentException("postings 不能为null, term=" + term);
        }
        if (docFreq != postings.size()) {
            throw new IllegalArgumentException("docFreq与倒排列表长度不一致: term=" + term
                + ", docFreq=" + docFreq + ", postings=" + postings.size());
        }
    }

    public TermEntry(String term, PostingList postings) {
        this(term, postings == null ? 0 : postings.size(), postings);
    }
}
