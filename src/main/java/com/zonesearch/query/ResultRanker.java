package com.zonesearch.query;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 结果排序器：按分数降序排列，分数相同按 docID 升序，截取前 k 个。
 */
public class ResultRanker {

    static final Comparator<SearchHit> RANK_ORDER = Comparator
        .comparingDouble(SearchHit::score).reversed()
        .thenComparingInt(SearchHit::docId);

    public List<SearchHit> rank(Map<Integer, Double> scores, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit 不能为负数: " + limit);
        }
        if (scores == null || scores.isEmpty() || limit == 0) {
            return List.of();
        }
        List<SearchHit> hits = new ArrayList<>(scores.size());
        for (Map.Entry<Integer, Double> entry : scores.entrySet()) {
            if (entry.getValue() > 0.0) {
                hits.add(new SearchHit(entry.getKey(), entry.getValue()));
            }
        }
        hits.sort(RANK_ORDER);
        return List.copyOf(hits.subList(0, Math.min(limit, hits.size())));
    }
}
