package com.zonesearch.query;

public record SearchHit(
        int docId,
        double score
) {
}
