package com.websearch.text;

import java.util.ArrayList;
import java.util.List;

/**
 * ASCII 字母数字连续串即为一个词，其余字符（包括下划线与非 ASCII 字母）均为分隔符。
 * 输出统一转为小写。
 */
public class EnglishTokenizer implements Tokenizer {

    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<Token> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int index = 0; index < text.length(); index++) {
            char ch = text.charAt(index);
            if (isWordChar(ch)) {
                current.append(toLowerAscii(ch));
            } else if (current.length() > 0) {
                tokens.add(new Token(current.toString(), tokens.size()));
                current.setLength(0);
            }
        }
        if (current.length() > 0) {
            tokens.add(new Token(current.toString(), tokens.size()));
        }
        return tokens;
    }

    static boolean isWordChar(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || (ch >= '0' && ch <= '9');
    }

    private static char toLowerAscii(char ch) {
        return ch >= 'A' && ch <= 'Z' ? (char) (ch + ('a' - 'A')) : ch;
    }
}
