package com.zonesearch.query;

import java.util.NavigableSet;

/**
 * 短语过滤结果。
 *
 * @param candidates 满足全部短语的文档（无短语时为全部文档），按 docID 升序
 * @param phraseFiltered 是否执行了短语过滤
 */
public record PhraseResolution(NavigableSet<Integer> candidates, boolean phraseFiltered) {

    public int documentsConsidered() {
        return candidates.size();
    }
}
