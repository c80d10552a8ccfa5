package com.zonesearch.scoring;

import com.zonesearch.index.CorpusIndex;
import com.zonesearch.index.DocumentIndex;
import com.zonesearch.index.InvertedIndex;
import com.zonesearch.index.PostingList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;

/**
 * FastCosineScore 变体：每次关键词出现的权重为 1/n，文档累加命中关键词的权重后除以文档长度。
 */
public class CosineScorer {
    private final InvertedIndex invertedIndex;
    private final DocumentIndex documentIndex;

    public CosineScorer(CorpusIndex corpusIndex) {
        this.invertedIndex = corpusIndex.invertedIndex();
        this.documentIndex = corpusIndex.documentIndex();
    }

    /**
     * 计算每次关键词出现的权重，n 为出现总数（短语展开后的词同样计入）。
     */
    public static List<Double> weights(List<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            return List.of();
        }
        double weight = 1.0 / keywords.size();
        return Collections.nCopies(keywords.size(), weight);
    }

    /**
     * 对候选文档打分，仅返回分数严格大于 0 的文档，按 docID 升序排列。
     *
     * @param keywords 全部关键词出现，按查询顺序
     * @param candidates 短语过滤后的候选文档
     * @return docID 到余弦分数的映射
     */
    public Map<Integer, Double> score(List<String> keywords, NavigableSet<Integer> candidates) {
        if (keywords == null || keywords.isEmpty() || candidates == null || candidates.isEmpty()) {
            return Map.of();
        }

        List<Double> weights = weights(keywords);
        Map<Integer, Double> accumulated = new LinkedHashMap<>();
        for (int keywordIndex = 0; keywordIndex < keywords.size(); keywordIndex++) {
            PostingList postings = invertedIndex.getPostings(keywords.get(keywordIndex));
            if (postings == null) {
                continue;
            }
            double weight = weights.get(keywordIndex);
            for (int docId : intersect(postings, candidates)) {
                accumulated.merge(docId, weight, Double::sum);
            }
        }

        Map<Integer, Double> scores = new LinkedHashMap<>();
        for (int docId : candidates) {
            Double total = accumulated.get(docId);
            if (total == null || total <= 0.0) {
                continue;
            }
            int length = documentIndex.getLength(docId);
            if (length <= 0) {
                continue;
            }
            scores.put(docId, total / length);
        }
        return scores;
    }

    /**
     * 倒排列表与候选集合求交，遍历较小的一侧。
     */
    private List<Integer> intersect(PostingList postings, NavigableSet<Integer> candidates) {
        List<Integer> result = new ArrayList<>();
        if (postings.size() <= candidates.size()) {
            for (int index = 0; index < postings.size(); index++) {
                int docId = postings.docId(index);
                if (candidates.contains(docId)) {
                    result.add(docId);
                }
            }
        } else {
            for (int docId : candidates) {
                if (postings.contains(docId)) {
                    result.add(docId);
                }
            }
        }
        return result;
    }
}
