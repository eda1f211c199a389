package com.afsun.tablelineage.core.parser;

import lombok.Data;

/**
 * 分类单条语句时需要的上下文
 */
@Data
public class StatementContext {

    private final int lineNumber;

    private final String rawText;

    /**
     * 方言改写时识别到 VOLATILE / TEMPORARY 修饰
     */
    private final boolean temporary;
}
