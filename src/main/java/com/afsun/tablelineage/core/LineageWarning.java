package com.afsun.tablelineage.core;

import lombok.Data;

/**
 * 语句级警告，最终以文本形式挂在 {@link LineageResult#getWarnings()} 上
 */
@Data
public class LineageWarning {

    public static final String PARSE_FAILURE = "PARSE_FAILURE";
    public static final String REGEX_FALLBACK = "REGEX_FALLBACK";
    public static final String DEPTH_EXCEEDED = "DEPTH_EXCEEDED";

    private final String category;
    private final int lineNumber;
    private final String summary;

    private LineageWarning(String category, int lineNumber, String summary) {
        this.category = category;
        this.lineNumber = lineNumber;
        this.summary = summary;
    }

    public static LineageWarning parseFailure(int lineNumber, String reason) {
        return new LineageWarning(PARSE_FAILURE, lineNumber, "第 " + lineNumber + " 行语句解析失败: " + reason);
    }

    public static LineageWarning regexFallback(int lineNumber, String reason) {
        return new LineageWarning(REGEX_FALLBACK, lineNumber, "第 " + lineNumber + " 行语句使用正则回退解析: " + reason);
    }

    public static LineageWarning depthExceeded(int lineNumber, String reason) {
        return new LineageWarning(DEPTH_EXCEEDED, lineNumber, "第 " + lineNumber + " 行语句嵌套过深，已跳过: " + reason);
    }

    public String render() {
        return summary;
    }
}
