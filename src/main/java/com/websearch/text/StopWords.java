package com.websearch.text;

import java.util.Set;

/**
 * 英文停用词表。只用于过滤已转小写、去除符号后的原词，词干化之前判断。
 */
public final class StopWords {

    private static final Set<String> ENGLISH = Set.of(
        "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "he",
        "in", "is", "it", "its", "of", "on", "that", "the", "to", "was", "were", "will", "with"
    );

    private StopWords() {
    }

    public static boolean isStopWord(String cleanedWord) {
        return cleanedWord != null && ENGLISH.contains(cleanedWord);
    }
}
