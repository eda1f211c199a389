package com.afsun.tablelineage.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 单个脚本的表级血缘结果，构建后不可变
 *
 * @author afsun
 * @date 2025-12-01日 15:20
 */
@Getter
@ToString
@EqualsAndHashCode
public final class LineageResult {

    private final Set<String> sourceTables;
    private final Set<String> targetTables;
    private final List<String> volatileTables;
    private final List<Operation> operations;

    /**
     * 目标表 -> 源表列表（按出现顺序，允许重复）
     */
    private final Map<String, List<String>> relationships;

    private final List<String> warnings;

    LineageResult(Set<String> sourceTables,
                  Set<String> targetTables,
                  List<String> volatileTables,
                  List<Operation> operations,
                  Map<String, List<String>> relationships,
                  List<String> warnings) {
        this.sourceTables = Collections.unmodifiableSet(new LinkedHashSet<>(sourceTables));
        this.targetTables = Collections.unmodifiableSet(new LinkedHashSet<>(targetTables));
        this.volatileTables = Collections.unmodifiableList(new ArrayList<>(volatileTables));
        this.operations = Collections.unmodifiableList(new ArrayList<>(operations));
        Map<String, List<String>> copy = new LinkedHashMap<>();
        relationships.forEach((k, v) -> copy.put(k, Collections.unmodifiableList(new ArrayList<>(v))));
        this.relationships = Collections.unmodifiableMap(copy);
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
