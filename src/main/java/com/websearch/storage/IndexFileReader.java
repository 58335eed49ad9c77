package com.websearch.storage;

import com.websearch.config.Constants;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 最终索引读取器，打开时全量加载词典，之后按偏移读取倒排块。
 *
 * <p>倒排块通过 {@link FileChannel} 定位读取，不修改共享文件指针，可被多个查询线程并发调用。
 */
public final class IndexFileReader implements AutoCloseable {
    private final Path indexFile;
    private final FileChannel channel;
    private final TreeMap<String, TermEntry> entriesByTerm;
    private final int docCount;
    private final long postingCount;
    private volatile boolean closed;

    private IndexFileReader(Path indexFile, FileChannel channel, TreeMap<String, TermEntry> entriesByTerm,
                            int docCount, long postingCount) {
        this.indexFile = indexFile;
        this.channel = channel;
        this.entriesByTerm = entriesByTerm;
        this.docCount = docCount;
        this.postingCount = postingCount;
    }

    /**
     * 打开最终索引文件，校验 CRC32 与文件头并加载词典。
     *
     * @param indexFile 最终索引文件
     * @return 读取器
     * @throws IOException 文件缺失、截断、损坏或版本不兼容时抛出
     */
    public static IndexFileReader open(Path indexFile) throws IOException {
        if (indexFile == null) {
            throw new IllegalArgumentException("索引文件不能为空");
        }
        if (!Files.isRegularFile(indexFile)) {
            throw new IOException("最终索引文件不存在: " + indexFile);
        }
        long dataLength;
        int termCount;
        int docCount;
        long postingCount;
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(indexFile.toFile(), "r")) {
            dataLength = StorageFileUtil.verifyCrc32Footer(randomAccessFile, indexFile.getFileName().toString());
            if (dataLength < IndexFileWriter.HEADER_LENGTH) {
                throw new IOException("最终索引文件头不完整: " + indexFile.getFileName());
            }
            StorageFileUtil.checkPreamble(randomAccessFile, Constants.INDEX_MAGIC, "最终索引文件");
            termCount = randomAccessFile.readInt();
            docCount = randomAccessFile.readInt();
            postingCount = randomAccessFile.readLong();
            if (termCount < 0 || docCount < 0 || postingCount < 0) {
                throw new IOException("最终索引计数非法: termCount=" + termCount
                    + ", docCount=" + docCount + ", postingCount=" + postingCount);
            }
        }

        TreeMap<String, TermEntry> entries = loadDictionary(indexFile, dataLength, termCount, docCount, postingCount);
        FileChannel channel = FileChannel.open(indexFile, StandardOpenOption.READ);
        return new IndexFileReader(indexFile, channel, entries, docCount, postingCount);
    }

    private static TreeMap<String, TermEntry> loadDictionary(Path indexFile, long dataLength, int termCount,
                                                             int docCount, long postingCount) throws IOException {
        TreeMap<String, TermEntry> entries = new TreeMap<>();
        long position = IndexFileWriter.HEADER_LENGTH;
        long postingsSeen = 0L;
        String previousTerm = null;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(indexFile))) {
            in.skipNBytes(IndexFileWriter.HEADER_LENGTH);
            for (int index = 0; index < termCount; index++) {
                int termLength = VarIntCodec.readRequiredVarInt(in, "termLength");
                byte[] termBytes = in.readNBytes(termLength);
                if (termBytes.length != termLength) {
                    throw new EOFException("读取 term 时遇到 EOF, index=" + index);
                }
                String term = new String(termBytes, StandardCharsets.UTF_8);
                if (previousTerm != null && term.compareTo(previousTerm) <= 0) {
                    throw new IOException("最终索引词序损坏，term 未严格递增: " + term);
                }
                int docFreq = VarIntCodec.readRequiredVarInt(in, "docFreq");
                int blockLength = VarIntCodec.readRequiredVarInt(in, "blockLength");
                if (docFreq <= 0 || docFreq > docCount) {
                    throw new IOException("docFreq 非法: term=" + term + ", docFreq=" + docFreq + ", N=" + docCount);
                }
                position += VarIntCodec.varIntSize(termLength) + termLength
                    + VarIntCodec.varIntSize(docFreq) + VarIntCodec.varIntSize(blockLength);
                long blockOffset = position;
                if (blockOffset + blockLength > dataLength) {
                    throw new EOFException("倒排块越界: term=" + term + ", offset=" + blockOffset + ", length=" + blockLength);
                }
                in.skipNBytes(blockLength);
                position += blockLength;
                entries.put(term, new TermEntry(term, docFreq, blockOffset, blockLength));
                postingsSeen += docFreq;
                previousTerm = term;
            }
        }
        if (position != dataLength) {
            throw new IOException("最终索引包含未解析字节，可能已损坏: " + indexFile.getFileName());
        }
        if (postingsSeen != postingCount) {
            throw new IOException("最终索引倒排项数量与文件头不一致: header=" + postingCount + ", actual=" + postingsSeen);
        }
        return entries;
    }

    /**
     * 精确查找词项对应词条。
     */
    public Optional<TermEntry> lookup(String term) {
        return Optional.ofNullable(entriesByTerm.get(term));
    }

    /**
     * 返回词项的文档频次，词项不存在时返回 0。
     */
    public int docFrequency(String term) {
        TermEntry entry = entriesByTerm.get(term);
        return entry == null ? 0 : entry.docFreq();
    }

    /**
     * 读取词项的倒排列表，词项不存在时返回空列表。
     *
     * @param term 已规范化的词项
     * @return 倒排列表
     * @throws IOException 读取或解码失败时抛出
     */
    public PostingList postings(String term) throws IOException {
        TermEntry entry = entriesByTerm.get(term);
        if (entry == null) {
            return PostingList.empty();
        }
        return readBlock(entry);
    }

    /**
     * 按词条记录的偏移读取倒排块。
     *
     * @param entry 词条
     * @return 倒排列表
     * @throws IOException 读取或解码失败时抛出
     */
    public PostingList readBlock(TermEntry entry) throws IOException {
        ensureOpen();
        ByteBuffer buffer = ByteBuffer.allocate(entry.blockLength());
        long position = entry.blockOffset();
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, position);
            if (read < 0) {
                throw new EOFException("读取倒排块时遇到 EOF: term=" + entry.term());
            }
            position += read;
        }
        try {
            return PostingBlockCodec.read(entry.docFreq(), new ByteArrayInputStream(buffer.array()));
        } catch (IOException exception) {
            throw new IOException("倒排块解码失败: term=" + entry.term() + ", file=" + indexFile.getFileName(), exception);
        }
    }

    public int getTermCount() {
        return entriesByTerm.size();
    }

    public int getDocCount() {
        return docCount;
    }

    public long getPostingCount() {
        return postingCount;
    }

    /**
     * 返回全部词项（按字典序）。
     */
    public Collection<String> allTerms() {
        return List.copyOf(entriesByTerm.navigableKeySet());
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        channel.close();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("IndexFileReader 已关闭");
        }
    }
}
