package com.zonesearch.storage;

import com.zonesearch.config.Constants;
import com.zonesearch.index.CorpusIndex;
import com.zonesearch.index.DocumentIndex;
import com.zonesearch.index.InvertedIndex;
import com.zonesearch.index.PostingList;
import com.zonesearch.index.TermEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 索引文件读取器，启动时全量加载 index.tsv 与 docIndex.tsv 并校验两者一致。
 */
public final class IndexFileReader {
    private static final Logger logger = LoggerFactory.getLogger(IndexFileReader.class);

    /**
     * 加载索引目录。
     *
     * @param indexFolder build 生成的索引目录
     * @return 只读索引
     * @throws IndexFilesNotFoundException 缺少索引文件时抛出
     * @throws IOException 文件损坏或解析失败时抛出
     */
    public CorpusIndex read(Path indexFolder) throws IOException {
        if (indexFolder == null) {
            throw new IllegalArgumentException("索引目录不能为空");
        }
        requireIndexFiles(indexFolder);
        Path indexFile = indexFolder.resolve(Constants.INDEX_FILE_NAME);
        Path docIndexFile = indexFolder.resolve(Constants.DOC_INDEX_FILE_NAME);

        DocumentIndex documentIndex = readDocumentIndex(docIndexFile);
        InvertedIndex invertedIndex = readInvertedIndex(indexFile);
        CorpusIndex corpusIndex = new CorpusIndex(invertedIndex, documentIndex);
        try {
            corpusIndex.verifyConsistency();
        } catch (IllegalStateException exception) {
            throw new IOException("索引文件互相不一致: " + indexFolder + " - " + exception.getMessage(), exception);
        }

        logger.info("索引已加载: {}，文档数={}，词条数={}", indexFolder,
            documentIndex.getDocCount(), invertedIndex.getTermCount());
        return corpusIndex;
    }

    /**
     * 确认 index.tsv 与 docIndex.tsv 均存在。
     *
     * @throws IndexFilesNotFoundException 列出全部缺失的文件
     */
    public void requireIndexFiles(Path indexFolder) throws IndexFilesNotFoundException {
        List<Path> missingFiles = new ArrayList<>();
        for (String fileName : List.of(Constants.INDEX_FILE_NAME, Constants.DOC_INDEX_FILE_NAME)) {
            Path file = indexFolder.resolve(fileName);
            if (!Files.isRegularFile(file)) {
                missingFiles.add(file);
            }
        }
        if (!missingFiles.isEmpty()) {
            throw new IndexFilesNotFoundException(missingFiles);
        }
    }

    /**
     * 读取 meta.json，文件不存在时返回空。
     */
    public Optional<IndexMeta> readMeta(Path indexFolder) throws IOException {
        Path metaFile = indexFolder.resolve(Constants.META_FILE_NAME);
        if (!Files.isRegularFile(metaFile)) {
            return Optional.empty();
        }
        return Optional.of(IndexMeta.readFrom(metaFile.toFile()));
    }

    private DocumentIndex readDocumentIndex(Path file) throws IOException {
        Map<Integer, List<String>> tokensByDocId = new HashMap<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                String[] columns = line.split(String.valueOf(Constants.COLUMN_SEPARATOR), -1);
                if (columns.length != 2) {
                    throw corrupted(file, lineNumber, "列数应为2，实际为" + columns.length);
                }
                int docId = parseNonNegativeInt(columns[0], file, lineNumber, "docID");
                List<String> tokens = splitTokens(columns[1]);
                if (tokens.isEmpty()) {
                    throw corrupted(file, lineNumber, "文档词项序列为空, docId=" + docId);
                }
                if (tokensByDocId.put(docId, tokens) != null) {
                    throw corrupted(file, lineNumber, "docID 重复: " + docId);
                }
            }
        }
        return new DocumentIndex(tokensByDocId);
    }

    private InvertedIndex readInvertedIndex(Path file) throws IOException {
        Map<String, TermEntry> entries = new HashMap<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                String[] columns = line.split(String.valueOf(Constants.COLUMN_SEPARATOR), -1);
                if (columns.length != 3) {
                    throw corrupted(file, lineNumber, "列数应为3，实际为" + columns.length);
                }
                String term = columns[0];
                int docFreq = parseNonNegativeInt(columns[1], file, lineNumber, "文档频率");
                TermEntry entry;
                try {
                    entry = new TermEntry(term, docFreq, parsePostings(columns[2], file, lineNumber));
                } catch (IllegalArgumentException exception) {
                    throw corrupted(file, lineNumber, exception.getMessage());
                }
                if (entries.put(term, entry) != null) {
                    throw corrupted(file, lineNumber, "词项重复: " + term);
                }
            }
        }
        return new InvertedIndex(entries);
    }

    /**
     * 解析 {@code docID:pos,pos;docID:pos} 形式的倒排列表。
     */
    static PostingList parsePostings(String text, Path file, int lineNumber) throws IOException {
        if (text.isEmpty()) {
            throw corrupted(file, lineNumber, "倒排列表为空");
        }
        String[] postings = text.split(String.valueOf(Constants.POSTING_SEPARATOR), -1);
        int[] docIds = new int[postings.length];
        int[][] positions = new int[postings.length][];
        for (int index = 0; index < postings.length; index++) {
            int separatorIndex = postings[index].indexOf(Constants.DOC_POSITIONS_SEPARATOR);
            if (separatorIndex < 0) {
                throw corrupted(file, lineNumber, "倒排项缺少位置列表: " + postings[index]);
            }
            docIds[index] = parseNonNegativeInt(postings[index].substring(0, separatorIndex), file, lineNumber, "docID");
            String[] rawPositions = postings[index].substring(separatorIndex + 1)
                .split(String.valueOf(Constants.POSITION_SEPARATOR), -1);
            positions[index] = new int[rawPositions.length];
            for (int positionIndex = 0; positionIndex < rawPositions.length; positionIndex++) {
                positions[index][positionIndex] = parseNonNegativeInt(rawPositions[positionIndex], file, lineNumber, "位置");
            }
        }
        try {
            return new PostingList(docIds, positions);
        } catch (IllegalArgumentException exception) {
            throw corrupted(file, lineNumber, exception.getMessage());
        }
    }

    private static List<String> splitTokens(String text) {
        if (text.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(text.split(String.valueOf(Constants.TOKEN_SEPARATOR)));
    }

    private static int parseNonNegativeInt(String text, Path file, int lineNumber, String field) throws IOException {
        try {
            int value = Integer.parseInt(text);
            if (value < 0) {
                throw corrupted(file, lineNumber, field + "不能为负数: " + text);
            }
            return value;
        } catch (NumberFormatException exception) {
            throw corrupted(file, lineNumber, field + "不是整数: " + text);
        }
    }

    private static IOException corrupted(Path file, int lineNumber, String message) {
        return new IOException("索引文件已损坏: " + file.getFileName() + " 第 " + lineNumber + " 行 - " + message);
    }
}
