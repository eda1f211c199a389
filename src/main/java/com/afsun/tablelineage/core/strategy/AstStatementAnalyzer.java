package com.afsun.tablelineage.core.strategy;

import com.afsun.tablelineage.core.LineageWarning;
import com.afsun.tablelineage.core.Operation;
import com.afsun.tablelineage.core.SqlDialect;
import com.afsun.tablelineage.core.SqlSegment;
import com.afsun.tablelineage.core.exceptions.ResolutionDepthExceededException;
import com.afsun.tablelineage.core.parser.OperationClassifier;
import com.afsun.tablelineage.core.parser.ParseOutcome;
import com.afsun.tablelineage.core.parser.SqlSyntaxBackend;
import com.afsun.tablelineage.core.parser.StatementContext;
import com.alibaba.druid.sql.ast.SQLStatement;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 主分析路径：解析为 AST 后交给分类器
 *
 * @author afsun
 * @date 2025-12-03日 17:20
 */
@Slf4j
public class AstStatementAnalyzer implements StatementAnalyzer {

    private final SqlSyntaxBackend backend;
    private final OperationClassifier classifier;

    public AstStatementAnalyzer(SqlSyntaxBackend backend, OperationClassifier classifier) {
        this.backend = backend;
        this.classifier = classifier;
    }

    @Override
    public StatementAnalysis analyze(SqlSegment segment, SqlDialect dialect) {
        int line = segment.getLineNumber();
        ParseOutcome outcome = backend.parse(segment.getText(), dialect);
        if (!outcome.isSuccess()) {
            return StatementAnalysis.failure(LineageWarning.parseFailure(line, outcome.getFailureReason()));
        }
        StatementContext context = new StatementContext(line, segment.getText(), outcome.isTemporary());
        List<Operation> operations = new ArrayList<>();
        try {
            for (SQLStatement statement : outcome.getStatements()) {
                operations.add(classifier.classify(statement, context));
            }
        } catch (ResolutionDepthExceededException e) {
            return StatementAnalysis.failure(LineageWarning.depthExceeded(line, e.getMessage()));
        } catch (StackOverflowError e) {
            log.debug("第 {} 行语句解析栈溢出", line);
            return StatementAnalysis.failure(LineageWarning.depthExceeded(line, "StackOverflowError"));
        }
        return StatementAnalysis.success(operations);
    }
}
