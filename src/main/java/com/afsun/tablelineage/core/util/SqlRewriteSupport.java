package com.afsun.tablelineage.core.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 方言改写用到的扫描工具，均跳过字符串与带引号标识符
 *
 * @author afsun
 */
public final class SqlRewriteSupport {

    private SqlRewriteSupport() {
    }

    /**
     * 从 from 开始查找括号深度为 0 处、位于单词边界上的关键字
     *
     * @param pattern 以关键字开头的模式（需自带大小写不敏感标志）
     * @return 关键字起始位置，未找到返回 -1
     */
    public static int findTopLevel(String sql, Pattern pattern, int from) {
        Matcher matcher = pattern.matcher(sql);
        int len = sql.length();
        int depth = 0;
        int i = Math.max(from, 0);
        while (i < len) {
            char c = sql.charAt(i);
            if (SqlScriptUtils.isQuote(c)) {
                i = SqlScriptUtils.skipQuoted(sql, i);
                continue;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && isWordStart(sql, i)) {
                matcher.region(i, len);
                if (matcher.lookingAt()) {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }

    /**
     * 不限括号深度查找单词边界上的关键字
     *
     * @return 关键字起始位置，未找到返回 -1
     */
    public static int findAnyLevel(String sql, Pattern pattern, int from) {
        Matcher matcher = pattern.matcher(sql);
        int len = sql.length();
        int i = Math.max(from, 0);
        while (i < len) {
            char c = sql.charAt(i);
            if (SqlScriptUtils.isQuote(c)) {
                i = SqlScriptUtils.skipQuoted(sql, i);
                continue;
            }
            if (isWordStart(sql, i)) {
                matcher.region(i, len);
                if (matcher.lookingAt()) {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }

    /**
     * 从 from 开始的子句在当前括号层的结束位置：同层出现 stop 关键字，或遇到关闭当前层的右括号
     *
     * @return 结束位置，子句延续到文本末尾时返回文本长度
     */
    public static int findClauseEnd(String sql, Pattern stop, int from) {
        Matcher matcher = stop.matcher(sql);
        int len = sql.length();
        int depth = 0;
        int i = Math.max(from, 0);
        while (i < len) {
            char c = sql.charAt(i);
            if (SqlScriptUtils.isQuote(c)) {
                i = SqlScriptUtils.skipQuoted(sql, i);
                continue;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            } else if (depth == 0 && isWordStart(sql, i)) {
                matcher.region(i, len);
                if (matcher.lookingAt()) {
                    return i;
                }
            }
            i++;
        }
        return len;
    }

    /**
     * 查找与 open 位置左括号匹配的右括号
     *
     * @return 右括号位置，不匹配返回 -1
     */
    public static int findClosingParen(String sql, int open) {
        int depth = 0;
        int i = open;
        int len = sql.length();
        while (i < len) {
            char c = sql.charAt(i);
            if (SqlScriptUtils.isQuote(c)) {
                i = SqlScriptUtils.skipQuoted(sql, i);
                continue;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }

    /**
     * 只在字面量之外做正则替换
     */
    public static String replaceOutsideLiterals(String sql, Pattern pattern, String replacement) {
        StringBuilder out = new StringBuilder(sql.length());
        int len = sql.length();
        int chunkStart = 0;
        int i = 0;
        while (i < len) {
            char c = sql.charAt(i);
            if (SqlScriptUtils.isQuote(c)) {
                out.append(pattern.matcher(sql.substring(chunkStart, i)).replaceAll(replacement));
                int end = SqlScriptUtils.skipQuoted(sql, i);
                out.append(sql, i, end);
                chunkStart = end;
                i = end;
                continue;
            }
            i++;
        }
        out.append(pattern.matcher(sql.substring(chunkStart)).replaceAll(replacement));
        return out.toString();
    }

    public static int skipWhitespace(String sql, int from) {
        int i = from;
        while (i < sql.length() && Character.isWhitespace(sql.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isWordStart(String sql, int i) {
        return i == 0 || !isIdentifierChar(sql.charAt(i - 1));
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '#';
    }
}
