package com.websearch.config;

import com.websearch.text.FieldTag;

/**
 * 各 HTML 结构字段的词项权重。
 *
 * @param title title 元素内词项权重
 * @param heading h1-h3 元素内词项权重
 * @param bold b/strong 元素内词项权重
 * @param body 其他可见文本词项权重
 */
public record FieldWeights(int title, int heading, int bold, int body) {

    /**
     * 构造时校验权重非负且满足 title >= heading >= bold >= body。
     */
    public FieldWeights {
        if (title < 0 || heading < 0 || bold < 0 || body < 0) {
            throw new ConfigException("字段权重不能为负数: title=" + title + ", heading=" + heading
                + ", bold=" + bold + ", body=" + body);
        }
        if (title < heading || heading < bold || bold < body) {
            throw new ConfigException("字段权重必须满足 title >= heading >= bold >= body: title=" + title
                + ", heading=" + heading + ", bold=" + bold + ", body=" + body);
        }
    }

    /**
     * 返回默认字段权重。
     */
    public static FieldWeights defaults() {
        return new FieldWeights(Constants.TITLE_WEIGHT, Constants.HEADING_WEIGHT, Constants.BOLD_WEIGHT, Constants.BODY_WEIGHT);
    }

    /**
     * 查询指定字段的权重。
     */
    public int weightOf(FieldTag tag) {
        return switch (tag) {
            case TITLE -> title;
            case HEADING -> heading;
            case BOLD -> bold;
            case BODY -> body;
        };
    }
}
