package com.afsun.tablelineage.core.parser;

import com.afsun.tablelineage.core.SqlDialect;

/**
 * SQL语法解析后端：给定语句文本和方言，返回 AST 或解析失败
 *
 * @author afsun
 */
public interface SqlSyntaxBackend {

    /**
     * 解析单条语句，解析失败不抛异常，通过 {@link ParseOutcome#isSuccess()} 返回
     */
    ParseOutcome parse(String sql, SqlDialect dialect);
}
