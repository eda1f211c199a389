package com.afsun.tablelineage.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单条语句的分类结果
 *
 * @author afsun
 * @date 2025-12-01日 15:05
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Operation {

    private final OperationKind kind;

    /**
     * 目标表，仅 SELECT / OTHER 为空
     */
    private final TableRef target;

    /**
     * 源表，保持出现顺序，允许重复
     */
    private final List<TableRef> sources;

    private final int lineNumber;

    private final String rawText;

    public Operation(OperationKind kind, TableRef target, List<TableRef> sources, int lineNumber, String rawText) {
        if (kind == null) {
            throw new IllegalArgumentException("操作类型不能为空");
        }
        if (kind.requiresTarget() && target == null) {
            throw new IllegalArgumentException(kind + " 操作必须有目标表");
        }
        this.kind = kind;
        this.target = target;
        this.sources = sources == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(sources));
        this.lineNumber = lineNumber;
        this.rawText = rawText;
    }
}
