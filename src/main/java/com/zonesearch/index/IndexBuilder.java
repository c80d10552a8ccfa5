package com.zonesearch.index;

import com.zonesearch.ErrorKind;
import com.zonesearch.config.Constants;
import com.zonesearch.document.Document;
import com.zonesearch.document.Zone;
import com.zonesearch.text.Token;
import com.zonesearch.text.Tokenizer;
import com.zonesearch.text.WordTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 单遍索引构建器：逐篇接收文档，增量填充倒排索引与文档索引，
 * 调用 {@link #build()} 后冻结为只读的 {@link CorpusIndex}。
 * 非线程安全，构建期间由单一线程独占。
 */
public final class IndexBuilder {
    private static final Logger logger = LoggerFactory.getLogger(IndexBuilder.class);

    private final Tokenizer tokenizer;
    private final Map<String, TreeMap<Integer, int[]>> postingsByTerm = new HashMap<>();
    private final Map<Integer, List<String>> tokensByDocId = new HashMap<>();
    private int documentOrdinal;
    private long tokenCount;
    private boolean built;

    public IndexBuilder() {
        this(new WordTokenizer());
    }

    public IndexBuilder(Tokenizer tokenizer) {
        if (tokenizer == null) {
            throw new IllegalArgumentException("tokenizer不能为null");
        }
        this.tokenizer = tokenizer;
    }

    /**
     * 校验并索引一篇文档。校验失败时抛出 {@link IndexBuildException}，该文档不会被索引。
     *
     * @param document 语料文档
     * @return 文档的 docID
     */
    public int add(Document document) {
        ensureNotBuilt();
        int ordinal = documentOrdinal++;
        if (document == null) {
            throw new IndexBuildException(ErrorKind.INSUFFICIENT_ZONES, ordinal, "文档不能为null");
        }
        int docId = validate(document, ordinal);

        List<String> documentTokens = new ArrayList<>();
        for (Zone zone : document.contentZones()) {
            for (Token token : tokenizer.tokenize(zone.content())) {
                documentTokens.add(token.term());
            }
        }
        if (documentTokens.isEmpty()) {
            throw new IndexBuildException(ErrorKind.EMPTY_ZONE_CONTENT, ordinal,
                "文档内容区域未产生任何词项, docId=" + docId);
        }

        Map<String, List<Integer>> positionsByTerm = new LinkedHashMap<>();
        for (int position = 0; position < documentTokens.size(); position++) {
            positionsByTerm.computeIfAbsent(documentTokens.get(position), term -> new ArrayList<>()).add(position);
        }
        for (Map.Entry<String, List<Integer>> entry : positionsByTerm.entrySet()) {
            int[] positions = entry.getValue().stream().mapToInt(Integer::intValue).toArray();
            postingsByTerm.computeIfAbsent(entry.getKey(), term -> new TreeMap<>()).put(docId, positions);
        }
        tokensByDocId.put(docId, documentTokens);
        tokenCount += documentTokens.size();

        logger.debug("已索引文档 docId={}, zones={}, tokens={}, distinctTerms={}",
            docId, document.zoneCount(), documentTokens.size(), positionsByTerm.size());
        return docId;
    }

    /**
     * 冻结当前状态为只读索引，之后构建器不可再用。
     */
    public CorpusIndex build() {
        ensureNotBuilt();
        built = true;

        Map<String, TermEntry> entries = new HashMap<>(postingsByTerm.size());
        for (Map.Entry<String, TreeMap<Integer, int[]>> entry : postingsByTerm.entrySet()) {
            TreeMap<Integer, int[]> postings = entry.getValue();
            int[] docIds = new int[postings.size()];
            int[][] positions = new int[postings.size()][];
            int index = 0;
            for (Map.Entry<Integer, int[]> posting : postings.entrySet()) {
                docIds[index] = posting.getKey();
                positions[index] = posting.getValue();
                index++;
            }
            entries.put(entry.getKey(), new TermEntry(entry.getKey(), new PostingList(docIds, positions)));
        }

        CorpusIndex corpusIndex = new CorpusIndex(new InvertedIndex(entries), new DocumentIndex(tokensByDocId));
        postingsByTerm.clear();
        tokensByDocId.clear();
        logger.info("索引构建完成: 文档数={}, 词条数={}, 词项总数={}",
            corpusIndex.documentIndex().getDocCount(), corpusIndex.invertedIndex().getTermCount(), tokenCount);
        return corpusIndex;
    }

    private int validate(Document document, int ordinal) {
        if (document.zoneCount() < Constants.MIN_ZONES) {
            throw new IndexBuildException(ErrorKind.INSUFFICIENT_ZONES, ordinal,
                "文档必须包含 docID 与至少一个内容区域，实际区域数=" + document.zoneCount());
        }
        for (Zone zone : document.zones()) {
            if (zone.isEmpty()) {
                throw new IndexBuildException(ErrorKind.EMPTY_ZONE_CONTENT, ordinal,
                    "区域内容不能为空, zone=" + zone.name());
            }
        }

        Zone docIdZone = document.docIdZone();
        if (!Constants.DOC_ID_ZONE.equals(docIdZone.name())) {
            throw new IndexBuildException(ErrorKind.DUPLICATE_OR_MISSING_DOC_ID, ordinal, "缺少 docID 区域");
        }
        int docId = parseDocId(docIdZone.content(), ordinal);
        if (tokensByDocId.containsKey(docId)) {
            throw new IndexBuildException(ErrorKind.DUPLICATE_OR_MISSING_DOC_ID, ordinal, "docID 重复: " + docId);
        }
        return docId;
    }

    private int parseDocId(String rawDocId, int ordinal) {
        try {
            int docId = Integer.parseInt(rawDocId.trim());
            if (docId < 0) {
                throw new IndexBuildException(ErrorKind.DUPLICATE_OR_MISSING_DOC_ID, ordinal,
                    "docID 不能为负数: " + rawDocId);
            }
            return docId;
        } catch (NumberFormatException exception) {
            throw new IndexBuildException(ErrorKind.DUPLICATE_OR_MISSING_DOC_ID, ordinal,
                "docID 不是整数: " + rawDocId);
        }
    }

    private void ensureNotBuilt() {
        if (built) {
            throw new IllegalStateException("IndexBuilder 已冻结");
        }
    }
}
