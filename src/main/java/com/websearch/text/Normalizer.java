package com.websearch.text;

import com.websearch.config.FieldWeights;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 词项归一化器：小写、去除非字母数字字符、可选停用词过滤、Porter 词干化，并按字段赋权。
 *
 * <p>索引与查询必须使用同一配置的实例，否则查询词与索引词无法对齐。无可变状态，可并发调用。
 */
public final class Normalizer {
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final FieldWeights fieldWeights;
    private final boolean stopWordsEnabled;
    private final Tokenizer tokenizer;

    /**
     * 创建归一化器。
     *
     * @param fieldWeights 字段权重表
     * @param stopWordsEnabled 是否过滤停用词
     */
    public Normalizer(FieldWeights fieldWeights, boolean stopWordsEnabled) {
        if (fieldWeights == null) {
            throw new IllegalArgumentException("字段权重不能为空");
        }
        this.fieldWeights = fieldWeights;
        this.stopWordsEnabled = stopWordsEnabled;
        this.tokenizer = new EnglishTokenizer();
    }

    /**
     * 将单个原始词归一化为词项与权重。
     *
     * @param rawWord 原始词
     * @param sourceTag 原始词所在字段
     * @return 归一化结果，空词、纯符号或停用词返回空
     */
    public Optional<NormalizedTerm> normalize(String rawWord, FieldTag sourceTag) {
        if (rawWord == null || sourceTag == null) {
            return Optional.empty();
        }
        String cleaned = NON_ALPHANUMERIC.matcher(rawWord.toLowerCase(Locale.ROOT)).replaceAll("");
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        if (stopWordsEnabled && StopWords.isStopWord(cleaned)) {
            return Optional.empty();
        }
        return Optional.of(new NormalizedTerm(TermStemmer.stem(cleaned), fieldWeights.weightOf(sourceTag)));
    }

    /**
     * 对一段同字段文本分词并逐词归一化，保持原文顺序。
     */
    public List<NormalizedTerm> normalizeText(String text, FieldTag sourceTag) {
        List<NormalizedTerm> occurrences = new ArrayList<>();
        for (Token token : tokenizer.tokenize(text)) {
            normalize(token.term(), sourceTag).ifPresent(occurrences::add);
        }
        return occurrences;
    }

    /**
     * 将查询字符串按空白切分并归一化，保留重复词项与原始顺序。
     *
     * @param queryString 原始查询
     * @return 归一化后的查询词项
     */
    public List<String> normalizeQuery(String queryString) {
        if (queryString == null || queryString.isBlank()) {
            return List.of();
        }
        List<String> terms = new ArrayList<>();
        for (String rawToken : WHITESPACE.split(queryString.trim())) {
            for (NormalizedTerm normalized : normalizeText(rawToken, FieldTag.BODY)) {
                terms.add(normalized.term());
            }
        }
        return List.copyOf(terms);
    }

    public FieldWeights getFieldWeights() {
        return fieldWeights;
    }

    public boolean isStopWordsEnabled() {
        return stopWordsEnabled;
    }
}
