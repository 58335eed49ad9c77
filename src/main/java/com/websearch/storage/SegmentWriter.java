package com.websearch.storage;

import com.websearch.config.Constants;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 部分段写入器，按严格递增词序写入 (term, postings) 记录。
 *
 * <p>数据先写入同目录临时文件，{@link #commit()} 回填计数、追加 CRC32 后原子重命名；
 * 未提交即关闭时删除临时文件，因此段文件要么完整可见，要么不存在。
 */
public final class SegmentWriter implements AutoCloseable {
    /** magic(4) + version(2) + segmentId(4) + docCount(4) + termCount(4) + postingCount(8) */
    static final int HEADER_LENGTH = StorageFileUtil.PREAMBLE_LENGTH + Integer.BYTES * 3 + Long.BYTES;
    /** termCount 字段偏移，跳过 magic、version、segmentId、docCount */
    private static final long COUNTS_OFFSET = StorageFileUtil.PREAMBLE_LENGTH + Integer.BYTES * 2;

    private final Path targetFile;
    private final Path tempFile;
    private final RandomAccessFile randomAccessFile;
    private final int segmentId;
    private final int docCount;
    private final ByteArrayOutputStream recordBuffer = new ByteArrayOutputStream();
    private int termCount;
    private long postingCount;
    private String lastTerm;
    private boolean committed;
    private boolean closed;

    /**
     * 创建段写入器并写入文件头。
     *
     * @param targetFile 最终段文件路径
     * @param segmentId 段 ID
     * @param docCount 段内文档数
     * @throws IOException 初始化失败时抛出
     */
    public SegmentWriter(Path targetFile, int segmentId, int docCount) throws IOException {
        if (targetFile == null) {
            throw new IllegalArgumentException("段文件不能为空");
        }
        if (segmentId < 0 || docCount < 0) {
            throw new IllegalArgumentException("segmentId/docCount 不能为负数: " + segmentId + "/" + docCount);
        }
        this.targetFile = targetFile;
        this.tempFile = StorageFileUtil.tempPathFor(targetFile);
        this.segmentId = segmentId;
        this.docCount = docCount;
        this.randomAccessFile = new RandomAccessFile(tempFile.toFile(), "rw");
        this.randomAccessFile.setLength(0L);
        StorageFileUtil.writePreamble(this.randomAccessFile, Constants.SEGMENT_MAGIC);
        this.randomAccessFile.writeInt(segmentId);
        this.randomAccessFile.writeInt(docCount);
        this.randomAccessFile.writeInt(0);
        this.randomAccessFile.writeLong(0L);
    }

    /**
     * 写入一个词项的倒排记录，要求 term 按字典序严格递增且倒排非空。
     *
     * @param term 词项
     * @param postings 按 docId 递增的倒排列表
     * @throws IOException 写入失败时抛出
     */
    public void writeTerm(String term, PostingList postings) throws IOException {
        ensureWritable();
        if (term == null || term.isEmpty()) {
            throw new IllegalArgumentException("term 不能为空");
        }
        if (postings == null || postings.isEmpty()) {
            throw new IllegalArgumentException("倒排列表不能为空, term=" + term);
        }
        if (lastTerm != null && term.compareTo(lastTerm) <= 0) {
            throw new IllegalArgumentException("term 必须严格递增，last=" + lastTerm + ", current=" + term);
        }

        recordBuffer.reset();
        byte[] termBytes = term.getBytes(StandardCharsets.UTF_8);
        VarIntCodec.writeVarInt(termBytes.length, recordBuffer);
        recordBuffer.write(termBytes);
        VarIntCodec.writeVarInt(postings.size(), recordBuffer);
        PostingBlockCodec.write(postings, recordBuffer);
        randomAccessFile.write(recordBuffer.toByteArray());

        termCount++;
        postingCount += postings.size();
        lastTerm = term;
    }

    /**
     * 回填计数、追加 CRC32 并原子发布段文件。
     *
     * @return 已提交段的描述
     * @throws IOException 提交失败时抛出（临时文件会被删除）
     */
    public SegmentFile commit() throws IOException {
        ensureWritable();
        try {
            randomAccessFile.seek(COUNTS_OFFSET);
            randomAccessFile.writeInt(termCount);
            randomAccessFile.writeLong(postingCount);
            randomAccessFile.seek(randomAccessFile.length());
            StorageFileUtil.appendCrc32Footer(randomAccessFile);
            randomAccessFile.close();
            closed = true;
            StorageFileUtil.commitAtomically(tempFile, targetFile);
            committed = true;
        } catch (IOException exception) {
            close();
            throw new IOException("提交部分段失败: file=" + targetFile.getFileName() + ", termCount=" + termCount, exception);
        }
        return new SegmentFile(segmentId, targetFile, docCount, termCount, postingCount);
    }

    /**
     * 未提交时放弃写入并删除临时文件。
     */
    @Override
    public void close() throws IOException {
        if (!closed) {
            randomAccessFile.close();
            closed = true;
        }
        if (!committed) {
            Files.deleteIfExists(tempFile);
        }
    }

    private void ensureWritable() {
        if (closed || committed) {
            throw new IllegalStateException("SegmentWriter 已关闭");
        }
    }
}
