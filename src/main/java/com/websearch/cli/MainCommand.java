package com.websearch.cli;

import com.websearch.config.ConfigException;
import com.websearch.config.Constants;
import com.websearch.config.EngineConfig;
import com.websearch.document.DocumentMap;
import com.websearch.index.BuildReport;
import com.websearch.index.DocumentMapRebuilder;
import com.websearch.index.IndexBuilder;
import com.websearch.index.IndexLayout;
import com.websearch.index.IndexMissingException;
import com.websearch.index.IndexStatus;
import com.websearch.index.IndexStore;
import com.websearch.query.BatchQueryRunner;
import com.websearch.query.QueryEngine;
import com.websearch.query.QueryMode;
import com.websearch.query.QueryResultWriter;
import com.websearch.query.SearchHit;
import com.websearch.query.SearchResult;
import com.websearch.storage.IndexMeta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "wse",
    description = "🔍 网页语料倒排索引与 TF-IDF 搜索引擎",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.BuildSubcommand.class,
        MainCommand.SearchSubcommand.class,
        MainCommand.BatchSubcommand.class,
        MainCommand.InteractiveSubcommand.class,
        MainCommand.StatusSubcommand.class,
        MainCommand.RebuildDocMapSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(MainCommand.class);

    @Option(names = {"--index-dir"}, description = "索引目录路径", defaultValue = "./index")
    private Path indexDir;

    @Option(names = {"--threads"}, description = "索引线程数（默认取配置或 CPU 核数）")
    private Integer threads;

    @Option(names = {"--config"}, description = "JSON 配置文件路径")
    private Path configFile;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 网页语料倒排索引与 TF-IDF 搜索引擎");
        System.out.println("使用 --help 查看帮助信息");
        return ExitCodes.OK;
    }

    /**
     * 合并配置文件与命令行参数，命令行优先。
     */
    EngineConfig loadConfig() throws IOException {
        EngineConfig config = configFile == null ? EngineConfig.defaults() : EngineConfig.load(configFile);
        config.setIndexDir(indexDir);
        if (threads != null) {
            config.setIndexThreads(resolveThreadCount(threads));
        }
        return config.validate();
    }

    private int resolveThreadCount(int requested) {
        if (requested <= 0) {
            System.err.printf("⚠️ 非法线程数 %d，已回退为默认值 %d%n", requested, Constants.DEFAULT_INDEX_THREADS);
            return Constants.DEFAULT_INDEX_THREADS;
        }
        if (requested > Constants.MAX_INDEX_THREADS) {
            System.err.printf("⚠️ 线程数 %d 超过安全上限 %d，已自动限制%n", requested, Constants.MAX_INDEX_THREADS);
            return Constants.MAX_INDEX_THREADS;
        }
        return requested;
    }

    /**
     * 将异常映射为退出码并输出诊断信息。
     */
    static int handleFailure(String action, Exception exception) {
        if (exception instanceof ConfigException) {
            System.err.println("❌ 配置错误: " + exception.getMessage());
            return ExitCodes.CONFIG_ERROR;
        }
        if (exception instanceof IndexMissingException) {
            System.err.println("❌ " + exception.getMessage());
            System.err.println("请先执行 build 构建索引");
            return ExitCodes.INDEX_MISSING;
        }
        System.err.println("❌ " + action + "失败: " + exception.getMessage());
        logger.error("{}失败", action, exception);
        return ExitCodes.INTERNAL_ERROR;
    }

    static QueryMode resolveMode(String rawMode, EngineConfig config) {
        return rawMode == null ? config.getDefaultMode() : QueryMode.parse(rawMode);
    }

    static int resolveTopK(Integer rawTopK, EngineConfig config) {
        return rawTopK == null ? config.getDefaultTopK() : rawTopK;
    }

    static void printTextResult(SearchResult result) {
        System.out.println("🔍 查询: \"" + result.query() + "\" [" + result.mode() + "]");
        if (result.hits().isEmpty()) {
            System.out.println("⚠️ 未找到匹配结果");
        } else {
            int rank = 1;
            for (SearchHit hit : result.hits()) {
                System.out.printf("%d. %s (docId: %d, score: %.4f)%n", rank++, hit.url(), hit.docId(), hit.score());
            }
        }
        System.out.println("📊 共 " + result.totalMatches() + " 条匹配，用时 " + result.elapsedMs() + "ms");
    }

    @Command(name = "build", description = "📂 从语料目录构建索引（覆盖已有索引）")
    static class BuildSubcommand implements Callable<Integer> {

        @Parameters(description = "语料根目录（*.json 页面）", arity = "1")
        private Path corpusDir;

        @Option(names = {"--max-docs"}, description = "单个部分段缓冲文档上限，0 表示不限")
        private Integer maxDocs;

        @Option(names = {"--max-terms"}, description = "单个部分段缓冲词项上限，0 表示不限")
        private Integer maxTerms;

        @Option(names = {"--max-bytes"}, description = "单个部分段估算内存上限，0 表示不限")
        private Long maxBytes;

        @Option(names = {"--keep-segments"}, description = "构建完成后保留部分段文件")
        private boolean keepSegments;

        @Option(names = {"--no-stop-words"}, description = "不过滤停用词")
        private boolean noStopWords;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.loadConfig();
                if (maxDocs != null) {
                    config.setSegmentMaxDocs(maxDocs);
                }
                if (maxTerms != null) {
                    config.setSegmentMaxTerms(maxTerms);
                }
                if (maxBytes != null) {
                    config.setSegmentMaxBytes(maxBytes);
                }
                if (keepSegments) {
                    config.setRetainSegments(true);
                }
                if (noStopWords) {
                    config.setStopWordsEnabled(false);
                }
                config.validate();

                System.out.println("🚀 开始构建索引...");
                System.out.println("📁 索引目录: " + config.getIndexDir());
                System.out.println("📂 语料目录: " + corpusDir);
                System.out.println("🔧 线程数: " + config.getIndexThreads());

                BuildReport report = new IndexBuilder(config).build(corpusDir);

                System.out.println("✅ 索引完成！");
                System.out.println("📊 统计:");
                System.out.println("   文档数: " + report.docCount());
                System.out.println("   跳过文件: " + report.skippedDocuments());
                System.out.println("   部分段: " + report.segmentCount());
                System.out.println("   词条数: " + report.termCount());
                System.out.println("   倒排项: " + report.postingCount());
                System.out.println("   用时: " + report.elapsedMs() + "ms");
                return ExitCodes.OK;
            } catch (Exception exception) {
                return handleFailure("索引", exception);
            }
        }
    }

    @Command(name = "search", description = "🔎 执行单次查询")
    static class SearchSubcommand implements Callable<Integer> {

        @Parameters(description = "查询词", arity = "1..*")
        private List<String> queryWords;

        @Option(names = {"-m", "--mode"}, description = "组合方式 (AND|OR)")
        private String mode;

        @Option(names = {"-k", "--top-k"}, description = "返回结果数量")
        private Integer topK;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @Option(names = {"-o", "--output"}, description = "将 JSON 结果写入文件")
        private Path outputFile;

        @Option(names = {"--corpus-dir"}, description = "文档映射缺失时用于重建的语料目录")
        private Path corpusDir;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.loadConfig();
                QueryMode queryMode = resolveMode(mode, config);
                int limit = resolveTopK(topK, config);
                if (!"text".equalsIgnoreCase(format) && !"json".equalsIgnoreCase(format)) {
                    throw new ConfigException("未知输出格式: " + format + "（可选 text、json）");
                }
                try (IndexStore indexStore = IndexStore.open(config.getIndexDir(), corpusDir)) {
                    QueryEngine queryEngine = new QueryEngine(indexStore);
                    SearchResult result = queryEngine.search(String.join(" ", queryWords), queryMode, limit);

                    if ("json".equalsIgnoreCase(format)) {
                        System.out.println(QueryResultWriter.toJson(result));
                    } else {
                        printTextResult(result);
                    }
                    if (outputFile != null) {
                        Map<String, SearchResult> results = new LinkedHashMap<>();
                        results.put(result.query(), result);
                        QueryResultWriter.write(results, outputFile);
                        System.out.println("💾 结果已写入: " + outputFile);
                    }
                }
                return ExitCodes.OK;
            } catch (Exception exception) {
                return handleFailure("搜索", exception);
            }
        }
    }

    @Command(name = "batch", description = "📋 执行固定查询集合")
    static class BatchSubcommand implements Callable<Integer> {

        @Option(names = {"-m", "--mode"}, description = "组合方式 (AND|OR)")
        private String mode;

        @Option(names = {"-k", "--top-k"}, description = "每个查询返回结果数量")
        private Integer topK;

        @Option(names = {"-o", "--output"}, description = "将 JSON 结果写入文件")
        private Path outputFile;

        @Option(names = {"--corpus-dir"}, description = "文档映射缺失时用于重建的语料目录")
        private Path corpusDir;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.loadConfig();
                QueryMode queryMode = resolveMode(mode, config);
                int limit = resolveTopK(topK, config);
                try (IndexStore indexStore = IndexStore.open(config.getIndexDir(), corpusDir)) {
                    BatchQueryRunner runner = new BatchQueryRunner(new QueryEngine(indexStore));
                    Map<String, SearchResult> results = runner.runCanonical(queryMode, limit);
                    for (SearchResult result : results.values()) {
                        printTextResult(result);
                        System.out.println();
                    }
                    if (outputFile != null) {
                        QueryResultWriter.write(results, outputFile);
                        System.out.println("💾 结果已写入: " + outputFile);
                    }
                }
                return ExitCodes.OK;
            } catch (Exception exception) {
                return handleFailure("批量查询", exception);
            }
        }
    }

    @Command(name = "interactive", description = "💬 交互式查询，输入 exit 或 quit 退出")
    static class InteractiveSubcommand implements Callable<Integer> {

        @Option(names = {"-m", "--mode"}, description = "组合方式 (AND|OR)")
        private String mode;

        @Option(names = {"-k", "--top-k"}, description = "返回结果数量")
        private Integer topK;

        @Option(names = {"--corpus-dir"}, description = "文档映射缺失时用于重建的语料目录")
        private Path corpusDir;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.loadConfig();
                QueryMode queryMode = resolveMode(mode, config);
                int limit = resolveTopK(topK, config);
                try (IndexStore indexStore = IndexStore.open(config.getIndexDir(), corpusDir)) {
                    QueryEngine queryEngine = new QueryEngine(indexStore);
                    BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
                    System.out.println("💬 已加载 " + indexStore.totalDocuments() + " 个文档，输入 exit 退出");
                    while (true) {
                        System.out.print("wse> ");
                        System.out.flush();
                        String line = reader.readLine();
                        if (line == null || isExitCommand(line)) {
                            break;
                        }
                        if (line.isBlank()) {
                            continue;
                        }
                        try {
                            printTextResult(queryEngine.search(line, queryMode, limit));
                        } catch (ConfigException exception) {
                            System.err.println("❌ " + exception.getMessage());
                        }
                    }
                }
                return ExitCodes.OK;
            } catch (Exception exception) {
                return handleFailure("交互查询", exception);
            }
        }

        private static boolean isExitCommand(String line) {
            String command = line.trim();
            return "exit".equalsIgnoreCase(command) || "quit".equalsIgnoreCase(command);
        }
    }

    @Command(name = "status", description = "📊 查看索引统计信息")
    static class StatusSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.loadConfig();
                try (IndexStore indexStore = IndexStore.open(config.getIndexDir())) {
                    IndexStatus status = indexStore.status();
                    System.out.println("📊 索引状态");
                    System.out.println("═══════════");
                    System.out.println("📁 索引目录: " + status.indexDir());
                    System.out.println("📄 文档总数: " + status.docCount());
                    System.out.println("🔤 词条总数: " + status.termCount());
                    System.out.println("🔗 倒排项数: " + status.postingCount());
                    System.out.println("📦 部分段数: " + status.segmentCount());
                    System.out.println("⏭️ 跳过文件: " + status.skippedDocuments());
                    System.out.println("💾 索引大小: " + formatBytes(status.indexSizeBytes()));
                    System.out.println("🕒 构建时间: " + status.createdAt());
                }
                return ExitCodes.OK;
            } catch (Exception exception) {
                return handleFailure("获取状态", exception);
            }
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

    @Command(name = "rebuild-docmap", description = "🔄 从语料重新生成 docId → URL 映射")
    static class RebuildDocMapSubcommand implements Callable<Integer> {

        @Parameters(description = "构建索引时使用的语料目录", arity = "1")
        private Path corpusDir;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.loadConfig();
                IndexMeta meta = IndexStore.readMeta(config.getIndexDir());
                DocumentMap documentMap = DocumentMapRebuilder.rebuild(new IndexLayout(config.getIndexDir()), meta, corpusDir);
                System.out.println("✅ 文档映射已重建: " + documentMap.size() + " 个文档");
                return ExitCodes.OK;
            } catch (Exception exception) {
                return handleFailure("重建文档映射", exception);
            }
        }
    }
}
