package com.zonesearch.query;

import java.util.List;

public record SearchResult(
        List<SearchHit> hits,
        int documentsConsidered,
        int nonZeroScoreCount,
        long elapsedMs,
        String query
) {
}
