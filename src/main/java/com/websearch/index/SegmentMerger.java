package com.websearch.index;

import com.websearch.storage.IndexFileWriter;
import com.websearch.storage.PostingList;
import com.websearch.storage.SegmentIOException;
import com.websearch.storage.SegmentReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * 将多个按词序排列的部分段 k 路合并为单个最终索引文件。
 *
 * <p>优先队列按 (当前词项, 段编号) 排序；每一步弹出所有持有最小词项的游标，合并其倒排后一次写出，
 * 因此总耗时为 O(总倒排项数 · log k)。同一 docId 出现在多个段中时加权词频相加。
 * 任何段缺失、截断或校验失败都会使合并失败，输出文件不会被提交。
 */
public final class SegmentMerger {
    private static final Logger logger = LoggerFactory.getLogger(SegmentMerger.class);

    private static final Comparator<SegmentReader> CURSOR_ORDER =
        Comparator.comparing(SegmentReader::currentTerm).thenComparingInt(SegmentReader::segmentId);

    /**
     * 合并段文件并提交最终索引。
     *
     * @param segmentFiles 段文件列表，顺序不影响输出
     * @param outputFile 最终索引文件
     * @param docCount 文档总数 N
     * @return 合并统计
     * @throws SegmentIOException 任一段缺失或损坏时抛出
     * @throws IOException 写出失败时抛出
     */
    public MergeStats merge(List<Path> segmentFiles, Path outputFile, int docCount) throws IOException {
        if (segmentFiles == null || outputFile == null) {
            throw new IllegalArgumentException("segmentFiles 与 outputFile 不能为空");
        }
        List<SegmentReader> readers = new ArrayList<>(segmentFiles.size());
        try {
            for (Path segmentFile : segmentFiles) {
                readers.add(SegmentReader.open(segmentFile));
            }
            MergeStats stats = mergeReaders(readers, outputFile, docCount);
            logger.info("合并完成: segments={}, terms={}, postings={}",
                stats.segmentCount(), stats.termCount(), stats.postingCount());
            return stats;
        } finally {
            closeAll(readers);
        }
    }

    private MergeStats mergeReaders(List<SegmentReader> readers, Path outputFile, int docCount) throws IOException {
        long declaredPostings = 0L;
        PriorityQueue<SegmentReader> queue = new PriorityQueue<>(Math.max(1, readers.size()), CURSOR_ORDER);
        for (SegmentReader reader : readers) {
            declaredPostings += reader.postingCount();
            if (reader.advance()) {
                queue.add(reader);
            }
        }

        long totalWeight = 0L;
        List<SegmentReader> contributors = new ArrayList<>();
        try (IndexFileWriter writer = new IndexFileWriter(outputFile, docCount)) {
            while (!queue.isEmpty()) {
                contributors.clear();
                SegmentReader first = queue.poll();
                String term = first.currentTerm();
                contributors.add(first);
                while (!queue.isEmpty() && queue.peek().currentTerm().equals(term)) {
                    contributors.add(queue.poll());
                }

                PostingList merged = mergePostings(contributors);
                checkDocIds(merged, docCount, term);
                writer.writeTerm(term, merged);
                totalWeight += merged.totalWeight();

                for (SegmentReader contributor : contributors) {
                    if (contributor.advance()) {
                        queue.add(contributor);
                    }
                }
            }

            long postingsRead = 0L;
            for (SegmentReader reader : readers) {
                postingsRead += reader.postingsRead();
            }
            if (postingsRead != declaredPostings) {
                throw new IOException("合并倒排项数量不守恒: declared=" + declaredPostings + ", read=" + postingsRead);
            }
            int termCount = writer.getTermCount();
            long postingCount = writer.getPostingCount();
            writer.commit();
            return new MergeStats(readers.size(), termCount, postingCount, postingsRead, totalWeight);
        }
    }

    /**
     * 合并同一词项在多个段中的倒排，按 docId 排序并累加重复 docId 的权重。
     */
    static PostingList mergePostings(List<SegmentReader> contributors) {
        if (contributors.size() == 1) {
            return contributors.get(0).currentPostings();
        }
        int total = 0;
        for (SegmentReader contributor : contributors) {
            total += contributor.currentPostings().size();
        }
        long[] packed = new long[total];
        int cursor = 0;
        for (SegmentReader contributor : contributors) {
            PostingList postings = contributor.currentPostings();
            for (int index = 0; index < postings.size(); index++) {
                packed[cursor++] = ((long) postings.docId(index) << 32) | Integer.toUnsignedLong(postings.weight(index));
            }
        }
        Arrays.sort(packed);

        int[] docIds = new int[total];
        int[] weights = new int[total];
        int size = 0;
        for (long entry : packed) {
            int docId = (int) (entry >>> 32);
            int weight = (int) entry;
            if (size > 0 && docIds[size - 1] == docId) {
                weights[size - 1] = Math.addExact(weights[size - 1], weight);
            } else {
                docIds[size] = docId;
                weights[size] = weight;
                size++;
            }
        }
        return new PostingList(Arrays.copyOf(docIds, size), Arrays.copyOf(weights, size));
    }

    private static void checkDocIds(PostingList postings, int docCount, String term) throws IOException {
        if (!postings.isEmpty() && postings.docId(postings.size() - 1) >= docCount) {
            throw new IOException("倒排 docId 超出文档总数: term=" + term
                + ", docId=" + postings.docId(postings.size() - 1) + ", N=" + docCount);
        }
    }

    private static void closeAll(List<SegmentReader> readers) throws IOException {
        IOException failure = null;
        for (SegmentReader reader : readers) {
            try {
                reader.close();
            } catch (IOException exception) {
                if (failure == null) {
                    failure = exception;
                } else {
                    failure.addSuppressed(exception);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
