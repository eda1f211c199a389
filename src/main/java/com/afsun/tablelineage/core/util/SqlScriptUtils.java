package com.afsun.tablelineage.core.util;

import com.afsun.tablelineage.core.SqlSegment;

import java.util.ArrayList;
import java.util.List;

/**
 * 脚本级工具：去注释、语句切分、偏移量换算行号
 *
 * @author afsun
 * @date 2025-11-11日 10:42
 */
public class SqlScriptUtils {

    private SqlScriptUtils() {
    }

    /**
     * 移除SQL中的注释（保留字符串字面量和带引号标识符中的内容）
     * 支持：
     * - 单行注释：-- comment
     * - 多行注释：/* comment *\/
     * 注释字符替换为空格、换行原样保留，返回文本与原文等长，偏移和行号可直接对应回原文。
     * Teradata 标识符允许出现 #，因此不把 # 当作注释。
     *
     * @param sql 原始SQL文本
     * @return 移除注释后的SQL
     */
    public static String stripComments(String sql) {
        if (sql == null || sql.isEmpty()) {
            return sql;
        }

        StringBuilder result = new StringBuilder(sql.length());
        int len = sql.length();
        int i = 0;

        while (i < len) {
            char c = sql.charAt(i);

            // 1. 字符串字面量 / 带引号标识符原样保留
            if (isQuote(c)) {
                int end = skipQuoted(sql, i);
                result.append(sql, i, end);
                i = end;
                continue;
            }

            // 2. 多行注释 /* ... */
            if (c == '/' && i + 1 < len && sql.charAt(i + 1) == '*') {
                int close = sql.indexOf("*/", i + 2);
                int end = close < 0 ? len : close + 2;
                blank(sql, i, end, result);
                i = end;
                continue;
            }

            // 3. 单行注释 -- ...
            if (c == '-' && i + 1 < len && sql.charAt(i + 1) == '-') {
                int end = i;
                while (end < len && sql.charAt(end) != '\n' && sql.charAt(end) != '\r') {
                    end++;
                }
                blank(sql, i, end, result);
                i = end;
                continue;
            }

            result.append(c);
            i++;
        }
        return result.toString();
    }

    /**
     * 按顶层分号切分语句：括号内、字符串内的分号不切分；末尾没有分号的片段同样输出。
     */
    public static List<SqlSegment> segment(String sql) {
        List<SqlSegment> segments = new ArrayList<>();
        if (sql == null || sql.isEmpty()) {
            return segments;
        }
        String cleaned = stripComments(sql);
        int len = cleaned.length();
        int depth = 0;
        int start = 0;
        int i = 0;
        while (i < len) {
            char c = cleaned.charAt(i);
            if (isQuote(c)) {
                i = skipQuoted(cleaned, i);
                continue;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                // 多余的右括号不让深度变成负数，否则后续分号都无法切分
                if (depth > 0) {
                    depth--;
                }
            } else if (c == ';' && depth == 0) {
                addSegment(sql, cleaned, start, i, segments);
                start = i + 1;
            }
            i++;
        }
        addSegment(sql, cleaned, start, len, segments);
        return segments;
    }

    /**
     * 偏移量换算为行号（从 1 开始）
     */
    public static int offsetToLine(String text, int offset) {
        if (text == null) {
            return 1;
        }
        int end = Math.min(Math.max(offset, 0), text.length());
        int line = 1;
        for (int i = 0; i < end; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    /**
     * 跳过从 start 开始的引号片段，返回闭合引号之后的位置；未闭合时返回文本长度
     */
    public static int skipQuoted(String sql, int start) {
        char quote = sql.charAt(start);
        int len = sql.length();
        int i = start + 1;
        while (i < len) {
            char ch = sql.charAt(i);
            if (ch == quote) {
                // 连续两个引号是转义
                if (i + 1 < len && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            if (ch == '\\' && quote == '\'' && i + 1 < len) {
                i += 2;
                continue;
            }
            i++;
        }
        return len;
    }

    public static boolean isQuote(char c) {
        return c == '\'' || c == '"' || c == '`';
    }

    public static String shortSql(String s) {
        if (s == null) {
            return "";
        }
        String t = s.replaceAll("\\s+", " ").trim();
        if (t.length() <= 200) {
            return t;
        }
        return t.substring(0, 100) + " ... " + t.substring(t.length() - 100);
    }

    private static void addSegment(String original, String cleaned, int from, int to, List<SqlSegment> out) {
        int s = from;
        while (s < to && Character.isWhitespace(cleaned.charAt(s))) {
            s++;
        }
        int e = to;
        while (e > s && Character.isWhitespace(cleaned.charAt(e - 1))) {
            e--;
        }
        if (s < e) {
            out.add(new SqlSegment(cleaned.substring(s, e), s, offsetToLine(original, s)));
        }
    }

    private static void blank(String sql, int from, int to, StringBuilder out) {
        for (int k = from; k < to; k++) {
            char ch = sql.charAt(k);
            out.append(ch == '\n' || ch == '\r' ? ch : ' ');
        }
    }
}
