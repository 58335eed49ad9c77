package com.websearch.text;

import opennlp.tools.stemmer.PorterStemmer;

/**
 * Porter 词干提取器封装。
 *
 * <p>PorterStemmer 内部持有可变缓冲区，因此每个线程复用独立实例。
 * 单次 Porter 处理对少数词并不幂等，这里迭代到不动点，保证 stem(stem(x)) == stem(x)。
 */
public final class TermStemmer {
    private static final int MAX_PASSES = 8;

    private static final ThreadLocal<PorterStemmer> STEMMER_CACHE = ThreadLocal.withInitial(PorterStemmer::new);

    private TermStemmer() {
    }

    /**
     * 对小写词项提取词干。
     *
     * @param word 已小写的字母数字词项
     * @return 词干，输入为空时原样返回
     */
    public static String stem(String word) {
        if (word == null || word.isEmpty()) {
            return word;
        }
        PorterStemmer stemmer = STEMMER_CACHE.get();
        String current = word;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String next = stemmer.stem(current);
            if (next.isEmpty() || next.equals(current)) {
                return current;
            }
            current = next;
        }
        return current;
    }
}
