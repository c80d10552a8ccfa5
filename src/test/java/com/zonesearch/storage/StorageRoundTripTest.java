package com.zonesearch.storage;

import com.zonesearch.config.Constants;
import com.zonesearch.index.CorpusIndex;
import com.zonesearch.index.IndexFixtures;
import com.zonesearch.index.PostingList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.zonesearch.index.IndexFixtures.doc;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 索引文件格式测试，覆盖写入内容、round-trip 与损坏文件检测。
 */
class StorageRoundTripTest {
    private static final Instant CREATED = Instant.parse("2024-05-01T08:30:00Z");

    @TempDir
    Path tempDir;

    private final IndexFileWriter writer = new IndexFileWriter(Clock.fixed(CREATED, ZoneOffset.UTC));
    private final IndexFileReader reader = new IndexFileReader();

    @Test
    @DisplayName("写入的 TSV 文件按 term 与 docID 排序")
    void testWrittenFileContents() throws IOException {
        Path indexFolder = writer.write(tempDir, IndexFixtures.foxCorpus());

        assertEquals(tempDir.resolve(Constants.INDEX_FOLDER_NAME), indexFolder);
        assertEquals(List.of(
            "fox\t2\t1:0;2:0",
            "jumps\t2\t1:1;3:0",
            "runs\t2\t2:1;3:1"), Files.readAllLines(indexFolder.resolve(Constants.INDEX_FILE_NAME)));
        assertEquals(List.of(
            "1\tfox jumps",
            "2\tfox runs",
            "3\tjumps runs"), Files.readAllLines(indexFolder.resolve(Constants.DOC_INDEX_FILE_NAME)));
    }

    @Test
    @DisplayName("写入后读取得到相同的索引结构")
    void testRoundTrip() throws IOException {
        CorpusIndex original = IndexFixtures.index(
            doc(10, "The quick brown fox", "jumps over the lazy dog"),
            doc(3, "the the the"),
            doc(7, "Über café, naïve résumé!"));

        Path indexFolder = writer.write(tempDir, original);
        CorpusIndex loaded = reader.read(indexFolder);

        assertEquals(original, loaded);
        assertEquals(original.status(), loaded.status());
        assertEquals(List.of(3, 7, 10), List.copyOf(loaded.documentIndex().docIds()));
    }

    @Test
    @DisplayName("meta.json 记录统计与创建时间")
    void testMetaRoundTrip() throws IOException {
        Path indexFolder = writer.write(tempDir, IndexFixtures.foxCorpus());

        Optional<IndexMeta> meta = reader.readMeta(indexFolder);

        assertTrue(meta.isPresent());
        assertEquals(new IndexMeta(Constants.FORMAT_VERSION, 3, 3, 6, CREATED), meta.get());
        assertTrue(Files.readString(indexFolder.resolve(Constants.META_FILE_NAME)).contains("2024-05-01T08:30:00Z"));
    }

    @Test
    @DisplayName("meta.json 缺失时仍可加载索引")
    void testMissingMetaIsOptional() throws IOException {
        Path indexFolder = writer.write(tempDir, IndexFixtures.foxCorpus());
        Files.delete(indexFolder.resolve(Constants.META_FILE_NAME));

        assertEquals(Optional.empty(), reader.readMeta(indexFolder));
        assertEquals(IndexFixtures.foxCorpus(), reader.read(indexFolder));
    }

    @Test
    @DisplayName("索引目录已存在时拒绝覆盖")
    void testExistingIndexFolderRejected() throws IOException {
        writer.write(tempDir, IndexFixtures.foxCorpus());

        assertThrows(FileAlreadyExistsException.class, () -> writer.write(tempDir, IndexFixtures.foxCorpus()));
    }

    @Test
    @DisplayName("输出父目录不存在")
    void testMissingOutputParent() {
        Path missing = tempDir.resolve("missing");

        assertThrows(NoSuchFileException.class, () -> writer.write(missing, IndexFixtures.foxCorpus()));
        assertFalse(Files.exists(missing));
    }

    @Test
    @DisplayName("缺少索引文件时报告全部缺失文件")
    void testMissingIndexFiles() throws IOException {
        Path indexFolder = Files.createDirectory(tempDir.resolve("index"));
        Files.writeString(indexFolder.resolve(Constants.INDEX_FILE_NAME), "fox\t1\t1:0\n");

        IndexFilesNotFoundException exception = assertThrows(IndexFilesNotFoundException.class,
            () -> reader.read(indexFolder));

        assertEquals(List.of(indexFolder.resolve(Constants.DOC_INDEX_FILE_NAME)), exception.getMissingFiles());
        assertThrows(IndexFilesNotFoundException.class, () -> reader.read(tempDir.resolve("nowhere")));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "fox\t2\t1:0",
        "fox\t1\t1:0\textra",
        "fox\tone\t1:0",
        "fox\t1\tx:0",
        "fox\t1\t1",
        "fox\t1\t1:",
        "fox\t1\t1:-3",
        "fox\t2\t1:0;1:0",
        "fox\t1\t9:0",
        "fox\t1\t1:1",
        "fox\t1\t1:0\nfox\t1\t1:0"
    })
    @DisplayName("损坏的倒排文件行被拒绝")
    void testCorruptedInvertedIndexRejected(String indexContent) throws IOException {
        Path indexFolder = writeRawIndex(indexContent, "1\tfox");

        IOException exception = assertThrows(IOException.class, () -> reader.read(indexFolder));

        assertFalse(exception instanceof IndexFilesNotFoundException);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "1",
        "a\tfox",
        "1\t",
        "1\tfox\n1\tfox",
        "1\tfox\n2\tfox"
    })
    @DisplayName("损坏的文档索引行被拒绝")
    void testCorruptedDocumentIndexRejected(String docIndexContent) throws IOException {
        Path indexFolder = writeRawIndex("fox\t1\t1:0", docIndexContent);

        IOException exception = assertThrows(IOException.class, () -> reader.read(indexFolder));

        assertFalse(exception instanceof IndexFilesNotFoundException);
    }

    @Test
    @DisplayName("错误信息包含文件名与行号")
    void testCorruptionMessageNamesFileAndLine() throws IOException {
        Path indexFolder = writeRawIndex("fox\t1\t1:0\njumps\tbad\t1:1", "1\tfox jumps");

        IOException exception = assertThrows(IOException.class, () -> reader.read(indexFolder));

        assertTrue(exception.getMessage().contains(Constants.INDEX_FILE_NAME));
        assertTrue(exception.getMessage().contains("第 2 行"));
    }

    @Test
    @DisplayName("空行被忽略")
    void testBlankLinesIgnored() throws IOException {
        Path indexFolder = writeRawIndex("\nfox\t1\t1:0\n\n", "1\tfox\n\n");

        CorpusIndex loaded = reader.read(indexFolder);

        assertEquals(IndexFixtures.index(doc(1, "fox")), loaded);
    }

    @Test
    void testFormatPostings() {
        PostingList postings = new PostingList(new int[]{1, 4}, new int[][]{{0, 3, 7}, {2}});

        assertEquals("1:0,3,7;4:2", IndexFileWriter.formatPostings(postings));
    }

    private Path writeRawIndex(String indexContent, String docIndexContent) throws IOException {
        Path indexFolder = Files.createDirectory(tempDir.resolve(Constants.INDEX_FOLDER_NAME));
        Files.writeString(indexFolder.resolve(Constants.INDEX_FILE_NAME), indexContent + "\n", StandardCharsets.UTF_8);
        Files.writeString(indexFolder.resolve(Constants.DOC_INDEX_FILE_NAME), docIndexContent + "\n", StandardCharsets.UTF_8);
        return indexFolder;
    }
}
