package com.websearch.storage;

import com.websearch.config.Constants;

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 部分段顺序读取游标，供 k 路合并逐条消费记录。
 *
 * <p>打开时校验 CRC32 与文件头，之后以缓冲流顺序读取；任何缺失、截断或词序损坏都以
 * {@link SegmentIOException} 报告。
 */
public final class SegmentReader implements AutoCloseable {
    private final Path segmentFile;
    private final int segmentId;
    private final int docCount;
    private final int termCount;
    private final long postingCount;
    private final InputStream inputStream;
    private int recordsRead;
    private long postingsRead;
    private String currentTerm;
    private PostingList currentPostings;
    private boolean closed;

    private SegmentReader(Path segmentFile, int segmentId, int docCount, int termCount, long postingCount,
                          InputStream inputStream) {
        this.segmentFile = segmentFile;
        this.segmentId = segmentId;
        this.docCount = docCount;
        this.termCount = termCount;
        this.postingCount = postingCount;
        this.inputStream = inputStream;
    }

    /**
     * 打开段文件并校验完整性，游标位于第一条记录之前。
     *
     * @param segmentFile 段文件
     * @return 读取游标
     * @throws SegmentIOException 文件缺失、过短、CRC 或文件头不匹配时抛出
     */
    public static SegmentReader open(Path segmentFile) throws SegmentIOException {
        if (segmentFile == null) {
            throw new IllegalArgumentException("段文件不能为空");
        }
        if (!Files.isRegularFile(segmentFile)) {
            throw new SegmentIOException(segmentFile, "部分段文件不存在");
        }
        int segmentId;
        int docCount;
        int termCount;
        long postingCount;
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(segmentFile.toFile(), "r")) {
            long dataLength = StorageFileUtil.verifyCrc32Footer(randomAccessFile, segmentFile.getFileName().toString());
            if (dataLength < SegmentWriter.HEADER_LENGTH) {
                throw new SegmentIOException(segmentFile, "部分段文件头不完整");
            }
            StorageFileUtil.checkPreamble(randomAccessFile, Constants.SEGMENT_MAGIC, "部分段文件");
            segmentId = randomAccessFile.readInt();
            docCount = randomAccessFile.readInt();
            termCount = randomAccessFile.readInt();
            postingCount = randomAccessFile.readLong();
            if (segmentId < 0 || docCount < 0 || termCount < 0 || postingCount < 0) {
                throw new SegmentIOException(segmentFile, "部分段计数非法: segmentId=" + segmentId
                    + ", docCount=" + docCount + ", termCount=" + termCount + ", postingCount=" + postingCount);
            }
        } catch (SegmentIOException exception) {
            throw exception;
        } catch (IOException exception) {
            throw new SegmentIOException(segmentFile, "部分段文件损坏或截断", exception);
        }

        InputStream inputStream = null;
        try {
            inputStream = new BufferedInputStream(Files.newInputStream(segmentFile));
            inputStream.skipNBytes(SegmentWriter.HEADER_LENGTH);
            return new SegmentReader(segmentFile, segmentId, docCount, termCount, postingCount, inputStream);
        } catch (IOException exception) {
            SegmentIOException failure = new SegmentIOException(segmentFile, "打开部分段失败", exception);
            closeAfterFailure(inputStream, failure);
            throw failure;
        }
    }

    /**
     * 前进到下一条记录。
     *
     * @return 存在下一条记录返回 true，已读完返回 false
     * @throws SegmentIOException 记录损坏或词序未严格递增时抛出
     */
    public boolean advance() throws SegmentIOException {
        ensureOpen();
        if (recordsRead >= termCount) {
            currentTerm = null;
            currentPostings = null;
            return false;
        }
        try {
            int termLength = VarIntCodec.readRequiredVarInt(inputStream, "termLength");
            byte[] termBytes = inputStream.readNBytes(termLength);
            if (termBytes.length != termLength) {
                throw new EOFException("读取 term 时遇到 EOF");
            }
            String term = new String(termBytes, StandardCharsets.UTF_8);
            if (currentTerm != null && term.compareTo(currentTerm) <= 0) {
                throw new SegmentIOException(segmentFile, "部分段词序损坏，term 未严格递增: " + term);
            }
            int count = VarIntCodec.readRequiredVarInt(inputStream, "postingCount");
            PostingList postings = PostingBlockCodec.read(count, inputStream);
            currentTerm = term;
            currentPostings = postings;
            recordsRead++;
            postingsRead += count;
            return true;
        } catch (SegmentIOException exception) {
            throw exception;
        } catch (IOException exception) {
            throw new SegmentIOException(segmentFile, "读取部分段记录失败, record=" + recordsRead, exception);
        }
    }

    public String currentTerm() {
        return currentTerm;
    }

    public PostingList currentPostings() {
        return currentPostings;
    }

    public int segmentId() {
        return segmentId;
    }

    public int docCount() {
        return docCount;
    }

    public int termCount() {
        return termCount;
    }

    /**
     * 文件头声明的倒排项总数。
     */
    public long postingCount() {
        return postingCount;
    }

    /**
     * 已经读出的倒排项数量。
     */
    public long postingsRead() {
        return postingsRead;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        inputStream.close();
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("SegmentReader 已关闭");
        }
    }

    private static void closeAfterFailure(InputStream inputStream, IOException failure) {
        if (inputStream == null) {
            return;
        }
        try {
            inputStream.close();
        } catch (IOException closeException) {
            failure.addSuppressed(closeException);
        }
    }
}
