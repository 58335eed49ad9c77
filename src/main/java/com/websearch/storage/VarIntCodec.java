package com.websearch.storage;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * 非负 int 的 LEB128 变长编码（低 7 位在前，最高位为续接标志），最长 5 字节。
 *
 * <p>段文件与最终索引中的词长、倒排数、docId 增量与加权词频都用这种编码。
 */
public final class VarIntCodec {
    static final int MAX_BYTES = 5;

    private VarIntCodec() {
    }

    /**
     * @throws IllegalArgumentException value 为负数时抛出
     */
    public static void writeVarInt(int value, OutputStream out) throws IOException {
        requireNonNegative(value);
        int remaining = value;
        while (remaining >= 0x80) {
            out.write(0x80 | (remaining & 0x7F));
            remaining >>>= 7;
        }
        out.write(remaining);
    }

    /**
     * 读取一个值。
     *
     * @return 解码结果；流在第一个字节前就已结束时返回 -1
     * @throws IOException 编码被截断、超过 5 字节或超出 int 非负范围时抛出
     */
    public static int readVarInt(InputStream in) throws IOException {
        int first = in.read();
        if (first < 0) {
            return -1;
        }
        int value = first & 0x7F;
        int current = first;
        for (int index = 1; (current & 0x80) != 0; index++) {
            if (index == MAX_BYTES) {
                throw new IOException("VarInt 长度超过 " + MAX_BYTES + " 字节");
            }
            current = in.read();
            if (current < 0) {
                throw new IOException("VarInt 在第 " + (index + 1) + " 个字节处被截断");
            }
            if (index == MAX_BYTES - 1 && (current & 0x78) != 0) {
                throw new IOException("VarInt 超出 int 非负范围");
            }
            value |= (current & 0x7F) << (7 * index);
        }
        return value;
    }

    /**
     * 读取一个必须存在的值。
     *
     * @param field 字段名，用于错误消息
     * @throws EOFException 流已结束时抛出
     */
    public static int readRequiredVarInt(InputStream in, String field) throws IOException {
        int value = readVarInt(in);
        if (value < 0) {
            throw new EOFException("读取 " + field + " 时遇到 EOF");
        }
        return value;
    }

    /**
     * 编码 value 需要的字节数，用于在不落盘的情况下推算记录偏移。
     */
    public static int varIntSize(int value) {
        requireNonNegative(value);
        return 1 + (31 - Integer.numberOfLeadingZeros(value | 1)) / 7;
    }

    private static void requireNonNegative(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("VarInt 不支持负数: " + value);
        }
    }
}
