package com.websearch.text;

import com.websearch.config.FieldWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NormalizerTest {

    private final Normalizer normalizer = new Normalizer(FieldWeights.defaults(), true);

    @Test
    @DisplayName("大小写与标点不影响词项")
    void testCaseAndPunctuationFolding() {
        assertEquals(normalizer.normalize("learning", FieldTag.BODY), normalizer.normalize("LEARNING!", FieldTag.BODY));
        assertEquals("learn", normalizer.normalize("Learning", FieldTag.BODY).orElseThrow().term());
        assertEquals("run", normalizer.normalize("running", FieldTag.BODY).orElseThrow().term());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "!!!", "--", "é"})
    @DisplayName("空词与纯符号被丢弃")
    void testEmptyAfterCleaningIsDropped(String rawWord) {
        assertTrue(normalizer.normalize(rawWord, FieldTag.BODY).isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"the", "The", "of", "and", "with"})
    @DisplayName("停用词在启用时被丢弃")
    void testStopWordsDropped(String rawWord) {
        assertTrue(normalizer.normalize(rawWord, FieldTag.TITLE).isEmpty());

        Normalizer keepAll = new Normalizer(FieldWeights.defaults(), false);
        assertTrue(keepAll.normalize(rawWord, FieldTag.TITLE).isPresent());
    }

    @ParameterizedTest
    @ValueSource(strings = {"engineering", "generalizations", "relational", "conditional", "machine", "cristina", "lopes"})
    @DisplayName("词干化幂等")
    void testNormalizationIsIdempotent(String rawWord) {
        String once = normalizer.normalize(rawWord, FieldTag.BODY).orElseThrow().term();
        String twice = normalizer.normalize(once, FieldTag.BODY).orElseThrow().term();
        assertEquals(once, twice);
    }

    @Test
    @DisplayName("字段权重按来源字段赋值")
    void testWeightsFollowFieldTag() {
        FieldWeights weights = FieldWeights.defaults();

        assertEquals(weights.title(), weight("search", FieldTag.TITLE));
        assertEquals(weights.heading(), weight("search", FieldTag.HEADING));
        assertEquals(weights.bold(), weight("search", FieldTag.BOLD));
        assertEquals(weights.body(), weight("search", FieldTag.BODY));
    }

    @Test
    @DisplayName("查询规范化保留顺序与重复词")
    void testNormalizeQueryKeepsDuplicates() {
        List<String> terms = normalizer.normalizeQuery("  Learning the machine   learning ");

        String machine = normalizer.normalize("machine", FieldTag.BODY).orElseThrow().term();
        assertEquals(List.of("learn", machine, "learn"), terms);
        assertTrue(normalizer.normalizeQuery("the of and").isEmpty());
        assertTrue(normalizer.normalizeQuery(null).isEmpty());
    }

    @Test
    @DisplayName("查询中的复合词按分隔符拆分")
    void testNormalizeQuerySplitsCompoundTokens() {
        assertEquals(normalizer.normalizeQuery("state art"), normalizer.normalizeQuery("state-of-the-art"));
        assertEquals(2, normalizer.normalizeQuery("state-of-the-art").size());
    }

    @Test
    @DisplayName("FieldTag 元素映射与优先级")
    void testFieldTagMapping() {
        assertEquals(FieldTag.TITLE, FieldTag.fromElementName("TITLE"));
        assertEquals(FieldTag.HEADING, FieldTag.fromElementName("h2"));
        assertEquals(FieldTag.BODY, FieldTag.fromElementName("h4"));
        assertEquals(FieldTag.BOLD, FieldTag.fromElementName("strong"));
        assertEquals(FieldTag.BODY, FieldTag.fromElementName(null));
        assertEquals(FieldTag.HEADING, FieldTag.strongest(FieldTag.BOLD, FieldTag.HEADING));
        assertEquals(FieldTag.TITLE, FieldTag.strongest(FieldTag.TITLE, FieldTag.BODY));
    }

    private int weight(String rawWord, FieldTag tag) {
        Optional<NormalizedTerm> normalized = normalizer.normalize(rawWord, tag);
        return normalized.orElseThrow().weight();
    }
}
