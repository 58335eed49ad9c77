package com.websearch.document;

import com.websearch.text.FieldTag;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 jsoup 的可见文本抽取器，按文本节点所在的最高优先级字段打标签。
 *
 * <p>script/style 内容在 jsoup 中为 DataNode，不会被抽取。
 */
public class HtmlExtractor {

    /**
     * 抽取 HTML 中全部非空文本节点。
     *
     * @param source 文档来源（用于错误消息）
     * @param html 原始 HTML
     * @return 按文档顺序排列的文本片段
     * @throws DocumentParseException HTML 缺失或解析失败时抛出
     */
    public List<TaggedText> extract(String source, String html) throws DocumentParseException {
        if (html == null) {
            throw new DocumentParseException(source, "页面缺少 HTML 内容");
        }
        org.jsoup.nodes.Document parsed;
        try {
            parsed = Jsoup.parse(html);
        } catch (RuntimeException exception) {
            throw new DocumentParseException(source, "HTML 解析失败", exception);
        }

        List<TaggedText> fragments = new ArrayList<>();
        parsed.traverse((node, depth) -> {
            if (node instanceof TextNode textNode && !textNode.isBlank()) {
                fragments.add(new TaggedText(textNode.text(), resolveTag(textNode)));
            }
        });
        return fragments;
    }

    /**
     * 沿祖先链取优先级最高的字段。
     */
    private FieldTag resolveTag(TextNode textNode) {
        FieldTag tag = FieldTag.BODY;
        for (Node ancestor = textNode.parent(); ancestor != null; ancestor = ancestor.parent()) {
            if (ancestor instanceof Element element) {
                tag = FieldTag.strongest(tag, FieldTag.fromElementName(element.normalName()));
            }
        }
        return tag;
    }
}
