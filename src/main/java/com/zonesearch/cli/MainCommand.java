package com.zonesearch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zonesearch.ErrorKind;
import com.zonesearch.config.Constants;
import com.zonesearch.config.EngineConfig;
import com.zonesearch.document.CorpusReader;
import com.zonesearch.index.CorpusIndex;
import com.zonesearch.index.IndexBuildException;
import com.zonesearch.index.IndexBuilder;
import com.zonesearch.index.IndexStatus;
import com.zonesearch.query.QueryEngine;
import com.zonesearch.query.QueryParseException;
import com.zonesearch.query.SearchHit;
import com.zonesearch.query.SearchResult;
import com.zonesearch.storage.IndexFileReader;
import com.zonesearch.storage.IndexFileWriter;
import com.zonesearch.storage.IndexFilesNotFoundException;
import com.zonesearch.storage.IndexMeta;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

@Command(
    name = "zsearch",
    description = "🔍 分区文档倒排索引与短语余弦检索",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.BuildSubcommand.class,
        MainCommand.QuerySubcommand.class,
        MainCommand.StatusSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * 创建命令行实例，缺少或多出参数时报告为 InvalidArgumentCount，其余参数错误按原因输出。
     */
    public static CommandLine createCommandLine() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        commandLine.setParameterExceptionHandler((exception, args) -> {
            CommandLine failed = exception.getCommandLine();
            PrintWriter err = failed.getErr();
            err.println("❌ " + describeParameterError(exception));
            failed.usage(err);
            return failed.getCommandSpec().exitCodeOnInvalidInput();
        });
        return commandLine;
    }

    static String describeParameterError(CommandLine.ParameterException exception) {
        if (exception instanceof CommandLine.MissingParameterException
            || exception instanceof CommandLine.UnmatchedArgumentException) {
            return ErrorKind.INVALID_ARGUMENT_COUNT.displayName() + ": " + exception.getMessage();
        }
        return "参数错误: " + exception.getMessage();
    }

    @Override
    public Integer call() {
        System.out.println("🔍 分区文档倒排索引与短语余弦检索");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    @Command(name = "build", description = "📂 从 JSON 语料构建索引")
    static class BuildSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "语料文件路径（JSON 对象数组）")
        private Path corpusPath;

        @Parameters(index = "1", description = "索引目录的父目录，将在其中创建 " + Constants.INDEX_FOLDER_NAME + " 目录")
        private Path outputParent;

        @Override
        public Integer call() {
            System.out.println("🚀 开始构建索引...");
            System.out.println("📄 语料: " + corpusPath);
            try {
                long start = System.currentTimeMillis();
                IndexBuilder builder = new IndexBuilder();
                new CorpusReader().read(corpusPath, builder::add);
                CorpusIndex corpusIndex = builder.build();
                Path indexFolder = new IndexFileWriter().write(outputParent, corpusIndex);
                long elapsed = System.currentTimeMillis() - start;
                IndexStatus status = corpusIndex.status();

                System.out.println("✅ 索引完成！");
                System.out.println("📁 索引目录: " + indexFolder);
                System.out.println("📊 统计:");
                System.out.println("   文档数: " + status.docCount());
                System.out.println("   词条数: " + status.termCount());
                System.out.println("   用时: " + elapsed + "ms");
                return 0;
            } catch (IndexBuildException exception) {
                System.err.println("❌ 构建失败: " + exception.getMessage());
                return 1;
            } catch (IOException exception) {
                System.err.println("❌ 构建失败: " + describe(exception));
                return 1;
            }
        }
    }

    @Command(name = "query", description = "🔎 执行关键词/短语查询")
    static class QuerySubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "build 生成的索引目录")
        private Path indexFolder;

        @Parameters(index = "1", description = "返回结果数量")
        private int limit;

        @Parameters(index = "2..*", arity = "1..*", description = "查询词，短语用分隔符包围，如 :quick fox:")
        private List<String> queryWords;

        @Option(names = {"--phrase-start"}, description = "短语起始分隔符", defaultValue = ":")
        private char phraseStart = Constants.DEFAULT_PHRASE_START;

        @Option(names = {"--phrase-end"}, description = "短语结束分隔符", defaultValue = ":")
        private char phraseEnd = Constants.DEFAULT_PHRASE_END;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format = "text";

        @Spec
        private CommandSpec spec;

        @Override
        public Integer call() {
            if (limit <= 0) {
                throw new CommandLine.ParameterException(spec.commandLine(), "返回结果数量必须为正整数: " + limit);
            }
            String query = String.join(" ", queryWords);

            EngineConfig config = EngineConfig.defaults();
            config.setIndexDir(indexFolder);
            config.setResultLimit(limit);
            config.setPhraseStart(phraseStart);
            config.setPhraseEnd(phraseEnd);

            try {
                CorpusIndex corpusIndex = new IndexFileReader().read(config.getIndexDir());
                SearchResult result = new QueryEngine(corpusIndex, config).search(query, config.getResultLimit());
                if ("json".equalsIgnoreCase(format)) {
                    printJsonResult(result);
                } else {
                    printTextResult(result);
                }
                return 0;
            } catch (QueryParseException exception) {
                System.err.println("❌ " + exception.getKind().displayName() + ": " + exception.getMessage());
                System.err.println("💡 " + exception.getSuggestion());
                return 1;
            } catch (IOException exception) {
                System.err.println("❌ 查询失败: " + describe(exception));
                return 1;
            }
        }

        private void printTextResult(SearchResult result) {
            System.out.println("Number of documents considered: " + result.documentsConsidered());
            System.out.println("Number of documents with non-zero cosine scores: " + result.nonZeroScoreCount());
            for (SearchHit hit : result.hits()) {
                System.out.println(hit.docId() + "\t" + hit.score());
            }
        }

        private void printJsonResult(SearchResult result) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        }
    }

    @Command(name = "status", description = "📊 查看索引统计信息")
    static class StatusSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "build 生成的索引目录")
        private Path indexFolder;

        @Override
        public Integer call() {
            try {
                IndexFileReader reader = new IndexFileReader();
                reader.requireIndexFiles(indexFolder);
                IndexMeta meta = reader.readMeta(indexFolder).orElse(null);
                IndexStatus status = meta == null
                    ? reader.read(indexFolder).status()
                    : new IndexStatus(meta.docCount(), meta.termCount(), meta.tokenCount());

                System.out.println("📊 索引状态");
                System.out.println("═══════════");
                System.out.println("📁 索引目录: " + indexFolder);
                System.out.println("📄 文档总数: " + status.docCount());
                System.out.println("🔤 词条总数: " + status.termCount());
                System.out.println("🧮 词项总数: " + status.tokenCount());
                if (meta != null) {
                    System.out.println("🕒 创建时间: " + meta.createTime());
                }
                System.out.println("💾 索引大小: " + formatBytes(folderSize(indexFolder)));
                return 0;
            } catch (IOException exception) {
                System.err.println("❌ 获取状态失败: " + describe(exception));
                return 1;
            }
        }

        private long folderSize(Path folder) throws IOException {
            long total = 0;
            try (Stream<Path> files = Files.list(folder)) {
                for (Path file : (Iterable<Path>) files::iterator) {
                    if (Files.isRegularFile(file)) {
                        total += Files.size(file);
                    }
                }
            }
            return total;
        }

        private String formatBytes(long bytes) {
            if (bytes < 1024) {
                return bytes + " B";
            }
            if (bytes < 1024 * 1024L) {
                return String.format("%.2f KB", bytes / 1024.0);
            }
            if (bytes < 1024 * 1024L * 1024L) {
                return String.format("%.2f MB", bytes / (1024.0 * 1024.0));
            }
            return String.format("%.2f GB", bytes / (1024.0 * 1024.0 * 1024.0));
        }
    }

    private static String describe(IOException exception) {
        if (exception instanceof IndexFilesNotFoundException notFound) {
            return notFound.getKind().displayName() + ": " + notFound.getMessage();
        }
        if (exception instanceof FileAlreadyExistsException) {
            return "索引目录已存在: " + exception.getMessage();
        }
        if (exception instanceof NoSuchFileException noSuchFile) {
            String reason = noSuchFile.getReason() == null ? "文件不存在" : noSuchFile.getReason();
            return reason + ": " + noSuchFile.getFile();
        }
        return exception.getMessage();
    }
}
