package com.afsun.tablelineage.core;

import com.afsun.tablelineage.core.exceptions.InvalidScriptException;
import com.afsun.tablelineage.core.parser.DefaultOperationClassifier;
import com.afsun.tablelineage.core.parser.DruidSyntaxBackend;
import com.afsun.tablelineage.core.resolver.AstTableReferenceResolver;
import com.afsun.tablelineage.core.strategy.AstStatementAnalyzer;
import com.afsun.tablelineage.core.strategy.RegexStatementAnalyzer;
import com.afsun.tablelineage.core.strategy.StatementAnalysis;
import com.afsun.tablelineage.core.strategy.StatementAnalyzer;
import com.afsun.tablelineage.core.util.SqlDialectDetector;
import com.afsun.tablelineage.core.util.SqlScriptUtils;
import com.afsun.tablelineage.core.validate.TableNameValidator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * 默认抽取引擎：切分语句 -> 逐条分析 -> 聚合。
 * 实例不持有脚本级状态，可在多线程间共享。
 *
 * @author afsun
 * @date 2025-12-04日 10:20
 */
@Slf4j
public class DefaultSqlLineageExtractor implements SqlLineageExtractor {

    private final ExtractorOptions options;
    private final StatementAnalyzer primary;
    private final StatementAnalyzer fallback;
    private final LineageAggregator aggregator;

    public DefaultSqlLineageExtractor() {
        this(ExtractorOptions.defaults());
    }

    public DefaultSqlLineageExtractor(ExtractorOptions options) {
        TableNameValidator validator = TableNameValidator.defaults();
        this.options = options;
        this.primary = new AstStatementAnalyzer(new DruidSyntaxBackend(),
                new DefaultOperationClassifier(new AstTableReferenceResolver(options.getMaxResolveDepth()), validator));
        this.fallback = options.isRegexFallbackEnabled() ? new RegexStatementAnalyzer(validator) : null;
        this.aggregator = new LineageAggregator(validator, options.getIdentifierCase());
    }

    public DefaultSqlLineageExtractor(ExtractorOptions options, StatementAnalyzer primary,
                                      StatementAnalyzer fallback, LineageAggregator aggregator) {
        this.options = options;
        this.primary = primary;
        this.fallback = fallback;
        this.aggregator = aggregator;
    }

    @Override
    public LineageResult extract(String sql) {
        if (StringUtils.isBlank(sql)) {
            throw new InvalidScriptException("SQL脚本为空");
        }
        SqlDialect dialect = SqlDialectDetector.detect(sql, options.getDefaultDialect());
        log.debug("未指定方言，检测到: {}", dialect);
        return extract(sql, dialect);
    }

    @Override
    public LineageResult extract(String sql, SqlDialect dialect) {
        if (StringUtils.isBlank(sql)) {
            throw new InvalidScriptException("SQL脚本为空");
        }
        if (dialect == null) {
            dialect = options.getDefaultDialect();
        }
        long startTime = System.currentTimeMillis();
        String traceId = "LN-" + startTime;
        List<SqlSegment> segments = SqlScriptUtils.segment(sql);
        if (segments.isEmpty()) {
            throw new InvalidScriptException("SQL脚本中没有可解析的语句");
        }

        List<Operation> operations = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (SqlSegment segment : segments) {
            StatementAnalysis analysis = analyze(segment, dialect);
            operations.addAll(analysis.getOperations());
            if (analysis.getWarning() != null) {
                warnings.add(analysis.getWarning().render());
            }
        }
        LineageResult result = aggregator.aggregate(operations, warnings);
        log.info("SQL脚本血缘抽取完成, traceId: {}, 方言: {}, 语句数: {}, 警告数: {}, 耗时: {}ms",
                traceId, dialect.getTag(), segments.size(), warnings.size(), System.currentTimeMillis() - startTime);
        return result;
    }

    private StatementAnalysis analyze(SqlSegment segment, SqlDialect dialect) {
        StatementAnalysis analysis = primary.analyze(segment, dialect);
        if (analysis.isSuccess()) {
            return analysis;
        }
        if (fallback != null) {
            StatementAnalysis recovered = fallback.analyze(segment, dialect);
            if (recovered.isSuccess()) {
                log.warn("第 {} 行语句改用正则解析: {}", segment.getLineNumber(), analysis.failureReason());
                return recovered.withWarning(
                        LineageWarning.regexFallback(segment.getLineNumber(), analysis.failureReason()));
            }
        }
        log.warn("第 {} 行语句已跳过: {}", segment.getLineNumber(), SqlScriptUtils.shortSql(segment.getText()));
        return analysis;
    }
}
