package com.websearch.scoring;

public class TfIdfScorer {
    private final int totalDocs;

    public TfIdfScorer(int totalDocs) {
        if (totalDocs < 0) {
            throw new IllegalArgumentException("文档总数不能为负数: " + totalDocs);
        }
        this.totalDocs = totalDocs;
    }

    /**
     * idf = ln(N / df)，df 为 0 或索引为空时返回 0。
     */
    public double computeIDF(int docFrequency) {
        if (docFrequency <= 0 || totalDocs == 0) {
            return 0.0;
        }
        int boundedDf = Math.min(docFrequency, totalDocs);
        return Math.log((double) totalDocs / boundedDf);
    }

    public double score(int weightedTermFrequency, int docFrequency) {
        if (weightedTermFrequency <= 0) {
            return 0.0;
        }
        return weightedTermFrequency * computeIDF(docFrequency);
    }
}
