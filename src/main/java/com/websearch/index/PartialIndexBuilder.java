package com.websearch.index;

import com.websearch.storage.PostingList;
import com.websearch.storage.SegmentFile;
import com.websearch.storage.SegmentWriter;
import com.websearch.text.NormalizedTerm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 内存受限的部分索引构建器，每个索引线程独占一个实例。
 *
 * <p>按 (term, docId) 累加加权词频，达到 {@link FlushPolicy} 阈值后将缓冲状态按词序写成部分段。
 * 文档必须以 docId 严格递增的顺序加入，单个文档的全部词项总是落在同一个段中。
 */
public final class PartialIndexBuilder {
    private static final Logger logger = LoggerFactory.getLogger(PartialIndexBuilder.class);

    /** 新词项的估算开销：HashMap 节点 + String 对象 + 累加器对象 */
    private static final int TERM_OVERHEAD_BYTES = 96;
    /** 每个倒排项的估算开销：docId + weight */
    private static final int POSTING_BYTES = 2 * Integer.BYTES;

    private final IndexLayout layout;
    private final SegmentIdAllocator segmentIdAllocator;
    private final FlushPolicy flushPolicy;
    private final Map<String, TermAccumulator> accumulators = new HashMap<>();
    private final List<SegmentFile> writtenSegments = new ArrayList<>();
    private int bufferedDocs;
    private long estimatedBytes;
    private int lastDocId = -1;
    private boolean finished;

    public PartialIndexBuilder(IndexLayout layout, SegmentIdAllocator segmentIdAllocator, FlushPolicy flushPolicy) {
        if (layout == null || segmentIdAllocator == null || flushPolicy == null) {
            throw new IllegalArgumentException("layout、segmentIdAllocator、flushPolicy 不能为空");
        }
        this.layout = layout;
        this.segmentIdAllocator = segmentIdAllocator;
        this.flushPolicy = flushPolicy;
    }

    /**
     * 加入一个文档的全部词项出现，并按需刷写。
     *
     * @param docId 文档编号，必须大于此前加入的所有 docId
     * @param occurrences 规范化后的词项出现（可为空）
     * @throws IOException 刷写部分段失败时抛出
     */
    public void addDocument(int docId, List<NormalizedTerm> occurrences) throws IOException {
        ensureActive();
        if (docId <= lastDocId) {
            throw new IllegalArgumentException("docId 必须严格递增，last=" + lastDocId + ", current=" + docId);
        }
        if (occurrences == null) {
            throw new IllegalArgumentException("occurrences 不能为空");
        }
        for (NormalizedTerm occurrence : occurrences) {
            TermAccumulator accumulator = accumulators.get(occurrence.term());
            if (accumulator == null) {
                accumulator = new TermAccumulator();
                accumulators.put(occurrence.term(), accumulator);
                estimatedBytes += TERM_OVERHEAD_BYTES + 2L * occurrence.term().length();
            }
            if (accumulator.add(docId, occurrence.weight())) {
                estimatedBytes += POSTING_BYTES;
            }
        }
        lastDocId = docId;
        bufferedDocs++;
        if (flushPolicy.shouldFlush(bufferedDocs, accumulators.size(), estimatedBytes)) {
            flush();
        }
    }

    /**
     * 将缓冲状态写成一个部分段，无缓冲文档时不产生段。
     *
     * @throws IOException 写入失败时抛出
     */
    public void flush() throws IOException {
        ensureActive();
        if (bufferedDocs == 0) {
            return;
        }
        String[] terms = accumulators.keySet().toArray(new String[0]);
        Arrays.sort(terms);

        int segmentId = segmentIdAllocator.next();
        Path target = layout.segmentFile(segmentId);
        Files.createDirectories(target.getParent());
        SegmentFile segmentFile;
        try (SegmentWriter writer = new SegmentWriter(target, segmentId, bufferedDocs)) {
            for (String term : terms) {
                writer.writeTerm(term, accumulators.get(term).toPostingList());
            }
            segmentFile = writer.commit();
        }
        writtenSegments.add(segmentFile);
        logger.debug("刷写部分段: id={}, docs={}, terms={}, postings={}",
            segmentId, segmentFile.docCount(), segmentFile.termCount(), segmentFile.postingCount());

        accumulators.clear();
        bufferedDocs = 0;
        estimatedBytes = 0L;
    }

    /**
     * 刷写剩余缓冲并返回本构建器写出的全部段。
     *
     * @return 段文件列表（按写出顺序）
     * @throws IOException 刷写失败时抛出
     */
    public List<SegmentFile> finish() throws IOException {
        ensureActive();
        flush();
        finished = true;
        return List.copyOf(writtenSegments);
    }

    public int getBufferedTerms() {
        return accumulators.size();
    }

    public long getEstimatedBytes() {
        return estimatedBytes;
    }

    public List<SegmentFile> getWrittenSegments() {
        return List.copyOf(writtenSegments);
    }

    private void ensureActive() {
        if (finished) {
            throw new IllegalStateException("PartialIndexBuilder 已结束");
        }
    }

    /**
     * 单个词项的倒排累加器，依赖 docId 递增加入，同一文档的出现总是落在末尾槽位。
     */
    private static final class TermAccumulator {
        private int[] docIds = new int[4];
        private int[] weights = new int[4];
        private int size;

        /**
         * @return 新增了倒排项返回 true，累加到已有倒排项返回 false
         */
        boolean add(int docId, int weight) {
            if (size > 0 && docIds[size - 1] == docId) {
                weights[size - 1] = Math.addExact(weights[size - 1], weight);
                return false;
            }
            if (size == docIds.length) {
                docIds = Arrays.copyOf(docIds, size * 2);
                weights = Arrays.copyOf(weights, size * 2);
            }
            docIds[size] = docId;
            weights[size] = weight;
            size++;
            return true;
        }

        PostingList toPostingList() {
            return new PostingList(Arrays.copyOf(docIds, size), Arrays.copyOf(weights, size));
        }
    }
}
