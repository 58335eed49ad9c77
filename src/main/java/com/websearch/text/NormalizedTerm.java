package com.websearch.text;

/**
 * 归一化后的词项及其字段权重。
 */
public record NormalizedTerm(String term, int weight) {
}
