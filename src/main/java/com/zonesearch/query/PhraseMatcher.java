package com.zonesearch.query;

import com.zonesearch.index.CorpusIndex;
import com.zonesearch.index.DocumentIndex;
import com.zonesearch.index.InvertedIndex;
import com.zonesearch.index.PostingList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * 短语解析器：把候选文档过滤为包含所有短语（按位置连续匹配）的文档。
 */
public class PhraseMatcher {
    private static final Logger logger = LoggerFactory.getLogger(PhraseMatcher.class);

    private final InvertedIndex invertedIndex;
    private final DocumentIndex documentIndex;

    public PhraseMatcher(CorpusIndex corpusIndex) {
        this.invertedIndex = corpusIndex.invertedIndex();
        this.documentIndex = corpusIndex.documentIndex();
    }

    /**
     * 求满足全部短语的文档交集；没有短语时返回全部文档。
     */
    public PhraseResolution resolve(List<QueryAtom.Phrase> phrases) {
        if (phrases == null || phrases.isEmpty()) {
            return new PhraseResolution(Collections.unmodifiableNavigableSet(new TreeSet<>(documentIndex.docIds())), false);
        }

        NavigableSet<Integer> candidates = null;
        for (QueryAtom.Phrase phrase : phrases) {
            NavigableSet<Integer> matches = matchingDocuments(phrase.terms(), candidates);
            logger.debug("短语 {} 命中 {} 篇文档", phrase.terms(), matches.size());
            candidates = matches;
            if (candidates.isEmpty()) {
                break;
            }
        }
        return new PhraseResolution(Collections.unmodifiableNavigableSet(candidates), true);
    }

    /**
     * 返回包含该短语的文档；restrictTo 非空时只在其中查找。
     */
    public NavigableSet<Integer> matchingDocuments(List<String> terms, NavigableSet<Integer> restrictTo) {
        List<PostingList> postingsByTerm = new ArrayList<>(terms.size());
        for (String term : terms) {
            PostingList postings = invertedIndex.getPostings(term);
            if (postings == null) {
                return new TreeSet<>();
            }
            postingsByTerm.add(postings);
        }

        // 以最短倒排列表驱动文档交集，其余列表二分查找
        PostingList shortest = Collections.min(postingsByTerm, Comparator.comparingInt(PostingList::size));
        NavigableSet<Integer> matches = new TreeSet<>();
        for (int index = 0; index < shortest.size(); index++) {
            int docId = shortest.docId(index);
            if (restrictTo != null && !restrictTo.contains(docId)) {
                continue;
            }
            if (containsAll(postingsByTerm, docId) && matchesPhraseInDoc(postingsByTerm, docId)) {
                matches.add(docId);
            }
        }
        return matches;
    }

    private boolean containsAll(List<PostingList> postingsByTerm, int docId) {
        for (PostingList postings : postingsByTerm) {
            if (!postings.contains(docId)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 存在起始位置 p，使第 i 个词出现在 p + i。
     */
    boolean matchesPhraseInDoc(List<PostingList> postingsByTerm, int docId) {
        int[] startPositions = postingsByTerm.get(0).positionsFor(docId);
        for (int start : startPositions) {
            boolean matched = true;
            for (int offset = 1; offset < postingsByTerm.size(); offset++) {
                if (!postingsByTerm.get(offset).hasPosition(docId, start + offset)) {
                    matched = false;
                    break;
                }
            }
            if (matched) {
                return true;
            }
        }
        return false;
    }
}
