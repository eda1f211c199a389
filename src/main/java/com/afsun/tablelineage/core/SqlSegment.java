package com.afsun.tablelineage.core;

import lombok.Data;

/**
 * 切分后的单条语句
 *
 * @author afsun
 */
@Data
public class SqlSegment {

    /**
     * 语句文本，已去除首尾空白，不含结尾分号
     */
    private final String text;

    /**
     * 语句首个非空白字符在去注释文本中的偏移
     */
    private final int startOffset;

    /**
     * 起始行号（从 1 开始）
     */
    private final int lineNumber;
}
