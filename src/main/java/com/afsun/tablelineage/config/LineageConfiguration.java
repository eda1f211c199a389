package com.afsun.tablelineage.config;

import com.afsun.tablelineage.core.DefaultSqlLineageExtractor;
import com.afsun.tablelineage.core.ExtractorOptions;
import com.afsun.tablelineage.core.SqlDialect;
import com.afsun.tablelineage.core.SqlLineageExtractor;
import com.afsun.tablelineage.core.validate.TableNameValidator;
import com.afsun.tablelineage.report.LineageReportBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 抽取引擎装配
 *
 * @author afsun
 * @date 2025-12-05日 14:00
 */
@Slf4j
@Configuration
public class LineageConfiguration {

    @Bean
    public ExtractorOptions extractorOptions(LineageProperties properties) {
        ExtractorOptions options = ExtractorOptions.builder()
                .defaultDialect(SqlDialect.of(properties.getDefaultDialect()))
                .identifierCase(properties.getIdentifierCase())
                .regexFallbackEnabled(properties.isRegexFallbackEnabled())
                .maxResolveDepth(properties.getMaxResolveDepth())
                .build();
        log.info("血缘抽取引擎配置: {}", options);
        return options;
    }

    @Bean
    public SqlLineageExtractor sqlLineageExtractor(ExtractorOptions options) {
        return new DefaultSqlLineageExtractor(options);
    }

    @Bean
    public LineageReportBuilder lineageReportBuilder(ExtractorOptions options) {
        return new LineageReportBuilder(TableNameValidator.defaults(), options.getIdentifierCase());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService lineageBatchExecutor(LineageProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = r -> {
            Thread thread = new Thread(r, "lineage-batch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getBatchParallelism()), threadFactory);
    }
}
