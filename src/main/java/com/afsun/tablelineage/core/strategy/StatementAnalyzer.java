package com.afsun.tablelineage.core.strategy;

import com.afsun.tablelineage.core.SqlDialect;
import com.afsun.tablelineage.core.SqlSegment;

/**
 * 语句分析策略
 *
 * @author afsun
 */
public interface StatementAnalyzer {

    /**
     * 分析单条语句
     *
     * @param segment 切分出的语句
     * @param dialect SQL方言
     * @return 分析结果，不抛出解析类异常
     */
    StatementAnalysis analyze(SqlSegment segment, SqlDialect dialect);
}
