package com.zonesearch.query;

import com.zonesearch.config.EngineConfig;
import com.zonesearch.index.CorpusIndex;
import com.zonesearch.scoring.CosineScorer;
import com.zonesearch.text.WordTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * 查询引擎：解析查询 → 短语过滤 → 余弦打分 → 排序截取。
 */
public class QueryEngine {
    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    private final QueryParser parser;
    private final PhraseMatcher phraseMatcher;
    private final CosineScorer scorer;
    private final ResultRanker ranker;

    /**
     * 使用默认短语分隔符构造查询引擎。
     */
    public QueryEngine(CorpusIndex corpusIndex) {
        this(corpusIndex, EngineConfig.defaults());
    }

    /**
     * 使用 EngineConfig 注入短语分隔符构造查询引擎。
     */
    public QueryEngine(CorpusIndex corpusIndex, EngineConfig config) {
        if (corpusIndex == null) {
            throw new IllegalArgumentException("corpusIndex不能为null");
        }
        this.parser = new QueryParser(config.getPhraseStart(), config.getPhraseEnd(), new WordTokenizer());
        this.phraseMatcher = new PhraseMatcher(corpusIndex);
        this.scorer = new CosineScorer(corpusIndex);
        this.ranker = new ResultRanker();
    }

    public SearchResult search(String queryString, int limit) {
        long startNanos = System.nanoTime();
        ParsedQuery parsedQuery = parser.parse(queryString);
        List<String> keywords = parsedQuery.keywords();

        PhraseResolution resolution = phraseMatcher.resolve(parsedQuery.phrases());
        Map<Integer, Double> scores = scorer.score(keywords, resolution.candidates());
        List<SearchHit> hits = ranker.rank(scores, limit);

        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.debug("查询完成: query=\"{}\", keywords={}, considered={}, nonZero={}, returned={}, {}ms",
            queryString, keywords.size(), resolution.documentsConsidered(), scores.size(), hits.size(), elapsedMs);
        return new SearchResult(hits, resolution.documentsConsidered(), scores.size(), elapsedMs, queryString);
    }
}
