package com.afsun.tablelineage.service.impl;

import com.afsun.tablelineage.core.ExtractorOptions;
import com.afsun.tablelineage.core.LineageResult;
import com.afsun.tablelineage.core.SqlDialect;
import com.afsun.tablelineage.core.SqlLineageExtractor;
import com.afsun.tablelineage.core.exceptions.LineageException;
import com.afsun.tablelineage.core.util.SqlDialectDetector;
import com.afsun.tablelineage.report.LineageReport;
import com.afsun.tablelineage.report.LineageReportBuilder;
import com.afsun.tablelineage.service.SqlLineageService;
import com.afsun.tablelineage.vo.BatchLineageResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * 血缘抽取服务实现
 *
 * @author afsun
 */
@Service
@Slf4j
public class SqlLineageServiceImpl implements SqlLineageService {

    private final SqlLineageExtractor extractor;
    private final LineageReportBuilder reportBuilder;
    private final ExtractorOptions options;
    private final ExecutorService lineageBatchExecutor;

    public SqlLineageServiceImpl(SqlLineageExtractor extractor, LineageReportBuilder reportBuilder,
                                 ExtractorOptions options, ExecutorService lineageBatchExecutor) {
        this.extractor = extractor;
        this.reportBuilder = reportBuilder;
        this.options = options;
        this.lineageBatchExecutor = lineageBatchExecutor;
    }

    @Override
    public LineageResult extract(String sql, String dialectTag) {
        return extractor.extract(sql, resolveDialect(sql, dialectTag));
    }

    @Override
    public LineageReport report(String scriptName, String sql, String dialectTag) {
        SqlDialect dialect = resolveDialect(sql, dialectTag);
        LineageResult result = extractor.extract(sql, dialect);
        return reportBuilder.build(scriptName, result, dialect);
    }

    @Override
    public BatchLineageResult extractBatch(Map<String, String> scripts, String dialectTag) {
        long startTime = System.currentTimeMillis();
        Map<String, Future<LineageResult>> futures = new LinkedHashMap<>();
        for (Map.Entry<String, String> script : scripts.entrySet()) {
            futures.put(script.getKey(), lineageBatchExecutor.submit(() -> extract(script.getValue(), dialectTag)));
        }

        BatchLineageResult batch = new BatchLineageResult();
        for (Map.Entry<String, Future<LineageResult>> entry : futures.entrySet()) {
            try {
                batch.getResults().put(entry.getKey(), entry.getValue().get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                String reason = cause instanceof LineageException
                        ? ((LineageException) cause).getFormattedMessage()
                        : cause.getClass().getSimpleName() + ": " + cause.getMessage();
                log.warn("脚本 {} 解析失败: {}", entry.getKey(), reason);
                batch.getFailures().put(entry.getKey(), reason);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                batch.getFailures().put(entry.getKey(), "解析被中断");
                break;
            }
        }
        batch.setParseMillis(System.currentTimeMillis() - startTime);
        log.info("批量解析完成, 脚本数: {}, 失败数: {}, 耗时: {}ms",
                scripts.size(), batch.getFailures().size(), batch.getParseMillis());
        return batch;
    }

    private SqlDialect resolveDialect(String sql, String dialectTag) {
        if (StringUtils.isNotBlank(dialectTag)) {
            return SqlDialect.of(dialectTag);
        }
        return SqlDialectDetector.detect(StringUtils.defaultString(sql), options.getDefaultDialect());
    }
}
