package com.websearch.index;

import com.websearch.config.ConfigException;
import com.websearch.config.Constants;
import com.websearch.config.EngineConfig;
import com.websearch.document.CorpusScanner;
import com.websearch.document.CrawledPage;
import com.websearch.document.Document;
import com.websearch.document.DocumentMap;
import com.websearch.document.DocumentParseException;
import com.websearch.document.HtmlExtractor;
import com.websearch.document.TaggedText;
import com.websearch.storage.IndexMeta;
import com.websearch.storage.SegmentFile;
import com.websearch.text.NormalizedTerm;
import com.websearch.text.Normalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * 索引构建流水线：扫描 → 并行解析与部分索引 → k 路合并 → 提交。
 *
 * <p>调用线程负责扫描语料并按遍历顺序分配 docId，文档经有界队列分发给固定数量的索引线程；
 * 每个索引线程独占一个 {@link PartialIndexBuilder}，段编号来自共享的 {@link SegmentIdAllocator}。
 * 全部线程成功结束后才开始合并，任一线程失败则整个构建失败且不提交任何内容。
 *
 * <p>提交顺序：删除 index.json → 发布 documents.db → 发布 final_index.bin → 写入 index.json。
 * index.json 存在即表示三者一致。
 */
public class IndexBuilder {
    private static final Logger logger = LoggerFactory.getLogger(IndexBuilder.class);
    private static final long OFFER_TIMEOUT_MS = 100L;
    private static final long WORKER_SHUTDOWN_SECONDS = 30L;

    private final EngineConfig config;
    private final IndexLayout layout;
    private final Normalizer normalizer;
    private final HtmlExtractor htmlExtractor = new HtmlExtractor();

    public IndexBuilder(EngineConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("配置不能为空");
        }
        this.config = config.validate();
        this.layout = new IndexLayout(config.getIndexDir());
        this.normalizer = new Normalizer(config.getFieldWeights(), config.isStopWordsEnabled());
    }

    /**
     * 从语料目录完整构建并提交索引，覆盖索引目录中已有的索引。
     *
     * @param corpusDir 语料根目录
     * @return 构建结果
     * @throws ConfigException 语料目录不存在时抛出
     * @throws IOException 构建或提交失败时抛出
     */
    public BuildReport build(Path corpusDir) throws IOException {
        if (corpusDir == null || !Files.isDirectory(corpusDir)) {
            throw new ConfigException("语料目录不存在: " + corpusDir);
        }
        long start = System.currentTimeMillis();
        Files.createDirectories(layout.indexDir());
        deleteSegments();
        Files.deleteIfExists(layout.stagedFinalIndex());
        Files.deleteIfExists(layout.stagedDocumentsDb());

        SegmentIdAllocator segmentIdAllocator = new SegmentIdAllocator();
        FlushPolicy flushPolicy = FlushPolicy.from(config);
        List<Document> documents = new ArrayList<>();
        AtomicInteger unparsedContent = new AtomicInteger();
        boolean success = false;
        try {
            CorpusScanner scanner = new CorpusScanner(corpusDir);
            logger.info("开始构建索引: corpus={}, indexDir={}, threads={}",
                scanner.getCorpusDir(), layout.indexDir(), config.getIndexThreads());

            PipelineResult pipeline = runPipeline(scanner, segmentIdAllocator, flushPolicy, documents, unparsedContent);
            CorpusScanner.ScanSummary summary = pipeline.summary();
            List<Path> segmentPaths = new ArrayList<>();
            for (SegmentFile segmentFile : pipeline.segments()) {
                segmentPaths.add(segmentFile.path());
            }
            logger.info("部分索引完成: docs={}, skipped={}, segments={}",
                summary.documentCount(), summary.skippedCount(), segmentPaths.size());

            MergeStats mergeStats = new SegmentMerger().merge(segmentPaths, layout.stagedFinalIndex(), summary.documentCount());
            DocumentMap documentMap = DocumentMap.of(documents);
            documentMap.writeTo(layout.stagedDocumentsDb());

            IndexMeta meta = new IndexMeta(
                Constants.FORMAT_VERSION,
                summary.documentCount(),
                mergeStats.termCount(),
                mergeStats.postingCount(),
                segmentPaths.size(),
                summary.skippedCount(),
                normalizer.isStopWordsEnabled(),
                normalizer.getFieldWeights(),
                summary.fingerprint(),
                Instant.now()
            );
            commit(meta);
            success = true;

            long elapsed = System.currentTimeMillis() - start;
            logger.info("索引已提交: docs={}, terms={}, postings={}, elapsed={}ms",
                meta.docCount(), meta.termCount(), meta.postingCount(), elapsed);
            return new BuildReport(summary.documentCount(), summary.skippedCount(), unparsedContent.get(),
                segmentPaths.size(), mergeStats.termCount(), mergeStats.postingCount(), elapsed);
        } finally {
            if (!success) {
                cleanupAfterFailure();
            } else if (!config.isRetainSegments()) {
                discardSegmentsAfterCommit();
            }
        }
    }

    private PipelineResult runPipeline(CorpusScanner scanner, SegmentIdAllocator segmentIdAllocator,
                                       FlushPolicy flushPolicy, List<Document> documents,
                                       AtomicInteger unparsedContent) throws IOException {
        int threadCount = config.getIndexThreads();
        BlockingQueue<IngestTask> queue = new ArrayBlockingQueue<>(Constants.INGEST_QUEUE_CAPACITY);
        AtomicReference<Throwable> workerFailure = new AtomicReference<>();
        ExecutorService executor = Executors.newFixedThreadPool(threadCount, new IndexerThreadFactory());
        try {
            List<Future<List<SegmentFile>>> futures = new ArrayList<>(threadCount);
            for (int index = 0; index < threadCount; index++) {
                PartialIndexBuilder builder = new PartialIndexBuilder(layout, segmentIdAllocator, flushPolicy);
                futures.add(executor.submit(new IndexWorker(queue, builder, unparsedContent, workerFailure)));
            }

            CorpusScanner.ScanSummary summary = scanner.scan((document, page) -> {
                documents.add(document);
                enqueue(queue, new IngestTask(document, page), workerFailure);
            });
            for (int index = 0; index < threadCount; index++) {
                enqueue(queue, IngestTask.POISON, workerFailure);
            }

            List<SegmentFile> segments = new ArrayList<>();
            for (Future<List<SegmentFile>> future : futures) {
                segments.addAll(awaitWorker(future));
            }
            segments.sort(Comparator.comparingInt(SegmentFile::segmentId));
            return new PipelineResult(summary, segments);
        } finally {
            shutdown(executor);
        }
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(WORKER_SHUTDOWN_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("索引线程未能在 {} 秒内退出", WORKER_SHUTDOWN_SECONDS);
            }
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
        }
    }

    private static void enqueue(BlockingQueue<IngestTask> queue, IngestTask task,
                                AtomicReference<Throwable> workerFailure) throws IOException {
        try {
            while (!queue.offer(task, OFFER_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                throwIfFailed(workerFailure);
            }
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("投递文档时被中断");
        }
        throwIfFailed(workerFailure);
    }

    private static void throwIfFailed(AtomicReference<Throwable> workerFailure) throws IOException {
        Throwable failure = workerFailure.get();
        if (failure != null) {
            throw new IOException("索引线程失败: " + failure.getMessage(), failure);
        }
    }

    private static List<SegmentFile> awaitWorker(Future<List<SegmentFile>> future) throws IOException {
        try {
            return future.get();
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("等待索引线程时被中断");
        } catch (ExecutionException exception) {
            Throwable cause = exception.getCause();
            if (cause instanceof IOException ioException) {
                throw ioException;
            }
            throw new IOException("索引线程失败: " + cause.getMessage(), cause);
        }
    }

    private void commit(IndexMeta meta) throws IOException {
        Files.deleteIfExists(layout.metaFile());
        Files.move(layout.stagedDocumentsDb(), layout.documentsDb(),
            StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        Files.move(layout.stagedFinalIndex(), layout.finalIndex(),
            StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        meta.writeTo(layout.metaFile());
    }

    private void cleanupAfterFailure() {
        try {
            deleteSegments();
            Files.deleteIfExists(layout.stagedFinalIndex());
            Files.deleteIfExists(layout.stagedDocumentsDb());
        } catch (IOException exception) {
            logger.warn("清理失败构建的临时文件出错: {}", exception.getMessage());
        }
    }

    /**
     * 索引已提交，部分段删除失败只影响磁盘占用，下次构建开始时会再次清理。
     */
    private void discardSegmentsAfterCommit() {
        try {
            deleteSegments();
        } catch (IOException exception) {
            logger.warn("提交后清理部分段失败: {}", exception.getMessage());
        }
    }

    void deleteSegments() throws IOException {
        Path segmentsDir = layout.segmentsDir();
        if (!Files.isDirectory(segmentsDir)) {
            return;
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(segmentsDir)) {
            files = stream.toList();
        }
        for (Path file : files) {
            Files.deleteIfExists(file);
        }
        Files.deleteIfExists(segmentsDir);
    }

    /**
     * 索引线程：从队列取文档，解析正文并累加到自己的部分索引构建器。
     */
    private final class IndexWorker implements Callable<List<SegmentFile>> {
        private final BlockingQueue<IngestTask> queue;
        private final PartialIndexBuilder builder;
        private final AtomicInteger unparsedContent;
        private final AtomicReference<Throwable> workerFailure;

        IndexWorker(BlockingQueue<IngestTask> queue, PartialIndexBuilder builder,
                    AtomicInteger unparsedContent, AtomicReference<Throwable> workerFailure) {
            this.queue = queue;
            this.builder = builder;
            this.unparsedContent = unparsedContent;
            this.workerFailure = workerFailure;
        }

        @Override
        public List<SegmentFile> call() throws Exception {
            try {
                while (true) {
                    IngestTask task = queue.take();
                    if (task == IngestTask.POISON) {
                        return builder.finish();
                    }
                    builder.addDocument(task.document().docId(), extractTerms(task));
                }
            } catch (Exception | Error failure) {
                workerFailure.compareAndSet(null, failure);
                throw failure;
            }
        }

        private List<NormalizedTerm> extractTerms(IngestTask task) {
            List<TaggedText> fragments;
            try {
                fragments = htmlExtractor.extract(task.document().source(), task.page().content());
            } catch (DocumentParseException exception) {
                unparsedContent.incrementAndGet();
                logger.warn("页面正文解析失败，按空文档收录: {}", exception.getMessage());
                return List.of();
            }
            List<NormalizedTerm> occurrences = new ArrayList<>();
            for (TaggedText fragment : fragments) {
                occurrences.addAll(normalizer.normalizeText(fragment.text(), fragment.tag()));
            }
            return occurrences;
        }
    }

    private record IngestTask(Document document, CrawledPage page) {
        static final IngestTask POISON = new IngestTask(null, null);
    }

    private record PipelineResult(CorpusScanner.ScanSummary summary, List<SegmentFile> segments) {
    }

    private static final class IndexerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "wse-indexer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
