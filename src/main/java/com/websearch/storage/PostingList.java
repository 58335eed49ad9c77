package com.websearch.storage;

import java.util.Arrays;

/**
 * 倒排列表，包含文档ID与对应的加权词频。
 *
 * @param docIds 严格递增文档ID数组
 * @param weights 与docIds同长度的加权词频数组
 */
public record PostingList(int[] docIds, int[] weights) {
    private static final PostingList EMPTY = new PostingList(new int[0], new int[0]);

    /**
     * 构造时执行防御性校验并复制输入数据，避免外部修改。
     */
    public PostingList {
        if (docIds == null || weights == null) {
            throw new IllegalArgumentException("docIds与weights不能为null");
        }
        if (docIds.length != weights.length) {
            throw new IllegalArgumentException("docIds与weights长度不一致: " + docIds.length + " vs " + weights.length);
        }
        for (int index = 0; index < docIds.length; index++) {
            if (docIds[index] < 0) {
                throw new IllegalArgumentException("docId不能为负数，位置=" + index + ", value=" + docIds[index]);
            }
            if (weights[index] < 0) {
                throw new IllegalArgumentException("weight不能为负数，位置=" + index + ", value=" + weights[index]);
            }
            if (index > 0 && docIds[index] <= docIds[index - 1]) {
                throw new IllegalArgumentException("docIds必须严格递增，位置=" + index + ", current=" + docIds[index]);
            }
        }
        docIds = Arrays.copyOf(docIds, docIds.length);
        weights = Arrays.copyOf(weights, weights.length);
    }

    /**
     * 返回空倒排列表。
     */
    public static PostingList empty() {
        return EMPTY;
    }

    /**
     * 返回倒排项数量。
     */
    public int size() {
        return docIds.length;
    }

    public boolean isEmpty() {
        return docIds.length == 0;
    }

    /**
     * 获取指定位置的文档ID。
     */
    public int docId(int index) {
        return docIds[index];
    }

    /**
     * 获取指定位置的加权词频。
     */
    public int weight(int index) {
        return weights[index];
    }

    /**
     * 二分查找文档所在位置，不存在返回负数。
     */
    public int indexOf(int docId) {
        return Arrays.binarySearch(docIds, docId);
    }

    /**
     * 二分查找文档的加权词频，不存在返回0。
     */
    public int weightOf(int docId) {
        int index = Arrays.binarySearch(docIds, docId);
        return index >= 0 ? weights[index] : 0;
    }

    /**
     * 全部倒排项加权词频之和。
     */
    public long totalWeight() {
        long total = 0;
        for (int weight : weights) {
            total += weight;
        }
        return total;
    }

    @Override
    public int[] docIds() {
        return Arrays.copyOf(docIds, docIds.length);
    }

    @Override
    public int[] weights() {
        return Arrays.copyOf(weights, weights.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PostingList that)) {
            return false;
        }
        return Arrays.equals(docIds, that.docIds) && Arrays.equals(weights, that.weights);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(docIds) + Arrays.hashCode(weights);
    }

    @Override
    public String toString() {
        return "PostingList{docIds=" + Arrays.toString(docIds) + ", weights=" + Arrays.toString(weights) + "}";
    }
}
