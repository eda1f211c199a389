package com.afsun.tablelineage.core.strategy;

import com.afsun.tablelineage.core.LineageWarning;
import com.afsun.tablelineage.core.Operation;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 单条语句的分析结果。
 * 失败时没有操作只有警告；正则兜底恢复的结果既有操作也有警告。
 *
 * @author afsun
 */
@Getter
public final class StatementAnalysis {

    private final boolean success;

    private final List<Operation> operations;

    private final LineageWarning warning;

    private StatementAnalysis(boolean success, List<Operation> operations, LineageWarning warning) {
        this.success = success;
        this.operations = operations;
        this.warning = warning;
    }

    public static StatementAnalysis success(List<Operation> operations) {
        return new StatementAnalysis(true, Collections.unmodifiableList(operations), null);
    }

    public static StatementAnalysis failure(LineageWarning warning) {
        return new StatementAnalysis(false, Collections.emptyList(), warning);
    }

    public StatementAnalysis withWarning(LineageWarning recoveredWarning) {
        return new StatementAnalysis(success, operations, recoveredWarning);
    }

    /**
     * 失败原因，不带行号前缀
     */
    public String failureReason() {
        if (warning == null) {
            return null;
        }
        String summary = warning.getSummary();
        int colon = summary.indexOf(": ");
        return colon < 0 ? summary : summary.substring(colon + 2);
    }
}
