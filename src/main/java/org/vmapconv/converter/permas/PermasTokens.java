package org.vmapconv.converter.permas;

import java.util.ArrayList;
import java.util.List;

/**
 * PERMAS ASCII 行的分词工具。
 * <p>
 * 空白分隔，{@code =} 总是单独成词（{@code NAME=X} 与 {@code NAME = X} 等价）。
 */
final class PermasTokens {

    private static final String[] EMPTY = new String[0];

    private PermasTokens() {
    }

    static String[] tokenize(String line) {
        if (line == null || line.isBlank()) {
            return EMPTY;
        }
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (Character.isWhitespace(c) || c == '=') {
                if (current.length() > 0) {
                    tokens.add(current.toString());
                    current.setLength(0);
                }
                if (c == '=') {
                    tokens.add("=");
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            tokens.add(current.toString());
        }
        return tokens.toArray(EMPTY);
    }

    /**
     * 数据行：首个词全部由十进制数字组成。
     */
    static boolean isDataLine(String[] tokens) {
        if (tokens.length == 0 || tokens[0].isEmpty()) {
            return false;
        }
        String head = tokens[0];
        for (int i = 0; i < head.length(); i++) {
            if (!Character.isDigit(head.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    static boolean isContinuation(String[] tokens) {
        return tokens.length > 0 && tokens[0].startsWith("&");
    }

    /**
     * 取 {@code KEY = VALUE} 中的 VALUE（大小写不敏感；缺少等号时取紧随其后的词）。
     */
    static String keywordValue(String[] tokens, String key) {
        for (int i = 0; i < tokens.length; i++) {
            if (tokens[i].equalsIgnoreCase(key)) {
                int valueIndex = (i + 1 < tokens.length && "=".equals(tokens[i + 1])) ? i + 2 : i + 1;
                return valueIndex < tokens.length ? tokens[valueIndex] : null;
            }
        }
        return null;
    }

    static String last(String[] tokens) {
        return tokens.length == 0 ? null : tokens[tokens.length - 1];
    }

    static int parseInt(String token) {
        return Integer.parseInt(token.trim());
    }

    /**
     * 浮点数，兼容 Fortran 风格指数（{@code 1.0D+03}）。
     */
    static double parseDouble(String token) {
        return Double.parseDouble(token.trim().replace('D', 'E').replace('d', 'e'));
    }
}
