package com.websearch.storage;

import com.websearch.config.Constants;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 最终索引写入器，按严格递增词序写入 (term, df, postings) 记录。
 *
 * <p>与 {@link SegmentWriter} 相同，先写临时文件，{@link #commit()} 时原子发布；
 * 未提交即关闭视为放弃，临时文件被删除。
 */
public final class IndexFileWriter implements AutoCloseable {
    /** magic(4) + version(2) + termCount(4) + docCount(4) + postingCount(8) */
    static final int HEADER_LENGTH = StorageFileUtil.PREAMBLE_LENGTH + Integer.BYTES * 2 + Long.BYTES;
    private static final long TERM_COUNT_OFFSET = StorageFileUtil.PREAMBLE_LENGTH;

    private final Path targetFile;
    private final Path tempFile;
    private final RandomAccessFile randomAccessFile;
    private final ByteArrayOutputStream blockBuffer = new ByteArrayOutputStream();
    private final ByteArrayOutputStream recordBuffer = new ByteArrayOutputStream();
    private final int docCount;
    private int termCount;
    private long postingCount;
    private String lastTerm;
    private boolean committed;
    private boolean closed;

    /**
     * 创建最终索引写入器并写入文件头。
     *
     * @param targetFile 最终索引文件
     * @param docCount 语料文档总数 N
     * @throws IOException 初始化失败时抛出
     */
    public IndexFileWriter(Path targetFile, int docCount) throws IOException {
        if (targetFile == null) {
            throw new IllegalArgumentException("索引文件不能为空");
        }
        if (docCount < 0) {
            throw new IllegalArgumentException("docCount 不能为负数: " + docCount);
        }
        this.targetFile = targetFile;
        this.tempFile = StorageFileUtil.tempPathFor(targetFile);
        this.docCount = docCount;
        this.randomAccessFile = new RandomAccessFile(tempFile.toFile(), "rw");
        this.randomAccessFile.setLength(0L);
        StorageFileUtil.writePreamble(this.randomAccessFile, Constants.INDEX_MAGIC);
        this.randomAccessFile.writeInt(0);
        this.randomAccessFile.writeInt(docCount);
        this.randomAccessFile.writeLong(0L);
    }

    /**
     * 写入一个词项，文档频次取倒排列表长度。
     *
     * @param term 词项，必须严格大于上一个写入的词项
     * @param postings 非空且按 docId 严格递增的倒排列表
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

        blockBuffer.reset();
        PostingBlockCodec.write(postings, blockBuffer);

        recordBuffer.reset();
        byte[] termBytes = term.getBytes(StandardCharsets.UTF_8);
        VarIntCodec.writeVarInt(termBytes.length, recordBuffer);
        recordBuffer.write(termBytes);
        VarIntCodec.writeVarInt(postings.size(), recordBuffer);
        VarIntCodec.writeVarInt(blockBuffer.size(), recordBuffer);
        blockBuffer.writeTo(recordBuffer);
        randomAccessFile.write(recordBuffer.toByteArray());

        termCount++;
        postingCount += postings.size();
        lastTerm = term;
    }

    /**
     * 回填计数、追加并校验 CRC32，然后原子发布索引文件。
     *
     * @throws IOException 提交失败时抛出（临时文件会被删除）
     */
    public void commit() throws IOException {
        ensureWritable();
        try {
            randomAccessFile.seek(TERM_COUNT_OFFSET);
            randomAccessFile.writeInt(termCount);
            randomAccessFile.writeInt(docCount);
            randomAccessFile.writeLong(postingCount);
            randomAccessFile.seek(randomAccessFile.length());
            StorageFileUtil.appendCrc32Footer(randomAccessFile);
            StorageFileUtil.verifyCrc32Footer(randomAccessFile, tempFile.getFileName().toString());
            randomAccessFile.close();
            closed = true;
            StorageFileUtil.commitAtomically(tempFile, targetFile);
            committed = true;
        } catch (IOException exception) {
            close();
            throw new IOException("提交最终索引失败: file=" + targetFile.getFileName() + ", termCount=" + termCount, exception);
        }
    }

    public int getTermCount() {
        return termCount;
    }

    public long getPostingCount() {
        return postingCount;
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
            throw new IllegalStateException("IndexFileWriter 已关闭");
        }
    }
}
