package com.websearch.storage;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * 倒排块编解码，部分段与最终索引共用同一块格式：
 * <pre>
 * n 个 docId 增量（首项为绝对值）| n 个加权词频
 * </pre>
 * 全部为 VarInt。docId 严格递增，因此除首项外增量均大于 0。
 */
final class PostingBlockCodec {
    private PostingBlockCodec() {
    }

    static void write(PostingList postings, OutputStream out) throws IOException {
        int previous = 0;
        for (int index = 0; index < postings.size(); index++) {
            int docId = postings.docId(index);
            VarIntCodec.writeVarInt(index == 0 ? docId : docId - previous, out);
            previous = docId;
        }
        for (int weight : postings.weights()) {
            VarIntCodec.writeVarInt(weight, out);
        }
    }

    /**
     * 读取 count 条倒排项。
     *
     * @throws IOException 数据不足、增量为 0 或 docId 溢出时抛出
     */
    static PostingList read(int count, InputStream in) throws IOException {
        int[] docIds = new int[count];
        long docId = 0;
        for (int index = 0; index < count; index++) {
            int gap = VarIntCodec.readRequiredVarInt(in, "docId 增量[" + index + "]");
            if (index > 0 && gap == 0) {
                throw new IOException("倒排块损坏: docId 未严格递增, 位置 " + index);
            }
            docId += gap;
            if (docId > Integer.MAX_VALUE) {
                throw new IOException("倒排块损坏: docId 溢出, 位置 " + index);
            }
            docIds[index] = (int) docId;
        }
        int[] weights = new int[count];
        for (int index = 0; index < count; index++) {
            weights[index] = VarIntCodec.readRequiredVarInt(in, "weight[" + index + "]");
        }
        return new PostingList(docIds, weights);
    }
}
