package com.websearch.storage;

import com.websearch.config.Constants;

import java.io.EOFException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.zip.CRC32;

/**
 * 段文件与最终索引共用的文件骨架：
 * <pre>
 * magic(int) | version(short) | 各自的计数字段 | 记录区 | CRC32(int)
 * </pre>
 * 写入方先写临时文件，回填计数、追加页脚后再原子改名。
 */
final class StorageFileUtil {
    /** magic 与版本号所占字节 */
    static final int PREAMBLE_LENGTH = Integer.BYTES + Short.BYTES;
    private static final int CRC_BUFFER_SIZE = 16 * 1024;

    private StorageFileUtil() {
    }

    static void writePreamble(RandomAccessFile file, int magic) throws IOException {
        file.writeInt(magic);
        file.writeShort(Constants.FORMAT_VERSION);
    }

    /**
     * 从文件开头读取并校验 magic 与版本号，读完后文件指针停在计数字段处。
     *
     * @param description 文件描述，用于错误消息
     * @throws IOException magic 或版本不匹配时抛出
     */
    static void checkPreamble(RandomAccessFile file, int expectedMagic, String description) throws IOException {
        file.seek(0L);
        int magic = file.readInt();
        if (magic != expectedMagic) {
            throw new IOException(description + " magic 不匹配: 0x" + Integer.toHexString(magic));
        }
        short version = file.readShort();
        if (version != Constants.FORMAT_VERSION) {
            throw new IOException(description + "版本不支持: " + version);
        }
    }

    /**
     * 对 [0, length) 计算 CRC32，不改变文件指针。
     */
    static long crc32Of(RandomAccessFile file, long length) throws IOException {
        long pointer = file.getFilePointer();
        CRC32 crc32 = new CRC32();
        byte[] buffer = new byte[CRC_BUFFER_SIZE];
        file.seek(0L);
        for (long remaining = length; remaining > 0; ) {
            int read = file.read(buffer, 0, (int) Math.min(buffer.length, remaining));
            if (read < 0) {
                throw new EOFException("计算 CRC32 时遇到 EOF");
            }
            crc32.update(buffer, 0, read);
            remaining -= read;
        }
        file.seek(pointer);
        return crc32.getValue();
    }

    static void appendCrc32Footer(RandomAccessFile file) throws IOException {
        long dataLength = file.length();
        long crc = crc32Of(file, dataLength);
        file.seek(dataLength);
        file.writeInt((int) crc);
    }

    /**
     * 校验尾部 CRC32。
     *
     * @return 不含页脚的数据长度
     * @throws IOException 文件过短或校验值不符时抛出
     */
    static long verifyCrc32Footer(RandomAccessFile file, String fileName) throws IOException {
        long fileLength = file.length();
        if (fileLength < Integer.BYTES) {
            throw new IOException("文件过短，缺少 CRC32 页脚: " + fileName);
        }
        long dataLength = fileLength - Integer.BYTES;
        file.seek(dataLength);
        long expected = Integer.toUnsignedLong(file.readInt());
        long actual = crc32Of(file, dataLength);
        if (actual != expected) {
            throw new IOException("CRC32 校验失败: " + fileName + ", expected=" + expected + ", actual=" + actual);
        }
        return dataLength;
    }

    static Path tempPathFor(Path target) {
        return target.resolveSibling(target.getFileName() + ".tmp");
    }

    static void commitAtomically(Path tempFile, Path target) throws IOException {
        Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }
}
