package com.websearch.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 语料库中的单个抓取页面（JSON 文件），未知字段忽略。
 *
 * @param url 页面 URL
 * @param content 原始 HTML
 * @param encoding 抓取时记录的编码，可为空
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CrawledPage(String url, String content, String encoding) {
}
