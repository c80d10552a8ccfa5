package com.zonesearch;

import com.zonesearch.document.Document;
import com.zonesearch.document.Zone;
import com.zonesearch.index.CorpusIndex;
import com.zonesearch.index.IndexBuilder;
import com.zonesearch.query.QueryEngine;
import com.zonesearch.storage.IndexFileReader;
import com.zonesearch.storage.IndexFileWriter;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 索引性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class IndexBenchmark {

    @State(Scope.Thread)
    public static class IndexState {
        List<Document> documents;

        @Setup
        public void setup() {
            // 1000 篇三区域文档
            documents = new ArrayList<>();
            for (int i = 0; i < 1000; i++) {
                documents.add(generateDocument(i));
            }
        }

        private Document generateDocument(int index) {
            return new Document(List.of(
                new Zone("doc_id", Integer.toString(index)),
                new Zone("title", "Document " + index + " about search"),
                new Zone("body", "It contains various words like Java, Python, programming, "
                    + "search, index, document, file, content, data. "
                    + "The quick brown fox jumps over the lazy dog. "
                    + " repeated text to increase size.".repeat(5))));
        }
    }

    @Benchmark
    public CorpusIndex indexThroughput(IndexState state) {
        IndexBuilder builder = new IndexBuilder();
        for (Document document : state.documents) {
            builder.add(document);
        }
        return builder.build();
    }

    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    @State(Scope.Benchmark)
    public static class QueryLatencyState {
        Path tempDir;
        QueryEngine queryEngine;

        @Setup
        public void setup() throws IOException {
            tempDir = Files.createTempDirectory("benchmark");

            // 10000 篇文档，写盘后重新加载
            IndexBuilder builder = new IndexBuilder();
            for (int i = 0; i < 10000; i++) {
                String topic = i % 10 == 0 ? "Java programming"
                    : i % 10 == 1 ? "Python data science"
                    : i % 10 == 2 ? "machine learning"
                    : "general content";
                builder.add(new Document(List.of(
                    new Zone("doc_id", Integer.toString(i)),
                    new Zone("title", "Document " + i),
                    new Zone("body", "about " + topic + " with various keywords for search testing."))));
            }
            Path indexFolder = new IndexFileWriter().write(tempDir, builder.build());
            queryEngine = new QueryEngine(new IndexFileReader().read(indexFolder));
        }

        @TearDown
        public void tearDown() throws IOException {
            try (Stream<Path> paths = Files.walk(tempDir)) {
                for (Path path : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
                    Files.deleteIfExists(path);
                }
            }
        }
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public int queryLatencyKeyword(QueryLatencyState state) {
        return state.queryEngine.search("java programming", 10).nonZeroScoreCount();
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public int queryLatencyPhrase(QueryLatencyState state) {
        return state.queryEngine.search(":machine learning:", 10).nonZeroScoreCount();
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public int queryLatencyMixed(QueryLatencyState state) {
        return state.queryEngine.search("search :python data: science", 10).nonZeroScoreCount();
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(IndexBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
