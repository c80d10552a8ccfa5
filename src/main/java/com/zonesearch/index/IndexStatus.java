package com.zonesearch.index;

public record IndexStatus(
    int docCount,
    int termCount,
    long tokenCount
) {
}
