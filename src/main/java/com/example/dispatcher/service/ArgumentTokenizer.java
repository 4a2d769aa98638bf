package com.example.dispatcher.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 将参数字符串切分为 argv：空白分隔，单/双引号包裹的内容作为一个参数，反斜杠转义下一个字符。
 * 不做变量展开、通配符等 shell 语义。
 */
public final class ArgumentTokenizer {

    private ArgumentTokenizer() {
    }

    public static List<String> tokenize(String line) {
        if (line == null || line.trim().isEmpty()) return Collections.emptyList();

        List<String> out = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean inToken = false;
        char quote = 0;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\\' && quote != '\'' && i + 1 < line.length()) {
                cur.append(line.charAt(++i));
                inToken = true;
            } else if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    cur.append(c);
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    out.add(cur.toString());
                    cur.setLength(0);
                    inToken = false;
                }
            } else {
                cur.append(c);
                inToken = true;
            }
        }
        if (quote != 0) {
            throw new IllegalArgumentException("Unterminated quote in arguments: " + line);
        }
        if (inToken) out.add(cur.toString());
        return out;
    }
}
