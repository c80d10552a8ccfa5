package com.zonesearch.storage;

import com.zonesearch.config.Constants;
import com.zonesearch.index.CorpusIndex;
import com.zonesearch.index.PostingList;
import com.zonesearch.index.TermEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * 索引文件写入器：在输出父目录下创建 index 目录，写入 index.tsv、docIndex.tsv 与 meta.json。
 */
public final class IndexFileWriter {
    private static final Logger logger = LoggerFactory.getLogger(IndexFileWriter.class);

    private final Clock clock;

    public IndexFileWriter() {
        this(Clock.systemUTC());
    }

    public IndexFileWriter(Clock clock) {
        this.clock = clock;
    }

    /**
     * 创建索引目录并写入全部索引文件。目录已存在时失败；写入中途失败会删除已创建的目录。
     *
     * @param outputParent 索引目录的父目录
     * @param corpusIndex 构建完成的索引
     * @return 新建的索引目录
     * @throws IOException 目录已存在或写入失败时抛出
     */
    public Path write(Path outputParent, CorpusIndex corpusIndex) throws IOException {
        if (outputParent == null || corpusIndex == null) {
            throw new IllegalArgumentException("outputParent与corpusIndex不能为null");
        }
        if (!Files.isDirectory(outputParent)) {
            throw new NoSuchFileException(outputParent.toString(), null, "输出目录不存在");
        }

        Path indexFolder = Files.createDirectory(outputParent.resolve(Constants.INDEX_FOLDER_NAME));
        try {
            writeDocumentIndex(indexFolder.resolve(Constants.DOC_INDEX_FILE_NAME), corpusIndex);
            writeInvertedIndex(indexFolder.resolve(Constants.INDEX_FILE_NAME), corpusIndex);
            IndexMeta.of(corpusIndex.status(), clock.instant())
                .writeTo(indexFolder.resolve(Constants.META_FILE_NAME).toFile());
        } catch (IOException exception) {
            deletePartialFolder(indexFolder, exception);
            throw exception;
        }

        logger.info("索引文件已写入: {}", indexFolder);
        return indexFolder;
    }

    private void writeDocumentIndex(Path file, CorpusIndex corpusIndex) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (Map.Entry<Integer, List<String>> entry : corpusIndex.documentIndex().asMap().entrySet()) {
                writer.write(Integer.toString(entry.getKey()));
                writer.write(Constants.COLUMN_SEPARATOR);
                writer.write(String.join(String.valueOf(Constants.TOKEN_SEPARATOR), entry.getValue()));
                writer.newLine();
            }
        }
    }

    private void writeInvertedIndex(Path file, CorpusIndex corpusIndex) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (TermEntry entry : corpusIndex.invertedIndex().entries()) {
                writer.write(entry.term());
                writer.write(Constants.COLUMN_SEPARATOR);
                writer.write(Integer.toString(entry.docFreq()));
                writer.write(Constants.COLUMN_SEPARATOR);
                writer.write(formatPostings(entry.postings()));
                writer.newLine();
            }
        }
    }

    /**
     * 序列化倒排列表，例如 {@code 1:0,4;3:2}。
     */
    static String formatPostings(PostingList postings) {
        StringBuilder builder = new StringBuilder();
        for (int index = 0; index < postings.size(); index++) {
            if (index > 0) {
                builder.append(Constants.POSTING_SEPARATOR);
            }
            builder.append(postings.docId(index)).append(Constants.DOC_POSITIONS_SEPARATOR);
            int[] positions = postings.positions(index);
            for (int positionIndex = 0; positionIndex < positions.length; positionIndex++) {
                if (positionIndex > 0) {
                    builder.append(Constants.POSITION_SEPARATOR);
                }
                builder.append(positions[positionIndex]);
            }
        }
        return builder.toString();
    }

    private void deletePartialFolder(Path indexFolder, IOException cause) {
        try (var paths = Files.list(indexFolder)) {
            for (Path path : (Iterable<Path>) paths::iterator) {
                Files.deleteIfExists(path);
            }
            Files.deleteIfExists(indexFolder);
        } catch (IOException cleanupException) {
            cause.addSuppressed(cleanupException);
            logger.warn("清理未完成的索引目录失败: {} - {}", indexFolder, cleanupException.getMessage());
        }
    }
}
