package com.afsun.tablelineage.core.parser;

import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.ast.statement.SQLAlterTableStatement;
import com.alibaba.druid.sql.ast.statement.SQLCreateTableStatement;
import com.alibaba.druid.sql.ast.statement.SQLCreateViewStatement;
import com.alibaba.druid.sql.ast.statement.SQLDeleteStatement;
import com.alibaba.druid.sql.ast.statement.SQLDropTableStatement;
import com.alibaba.druid.sql.ast.statement.SQLDropViewStatement;
import com.alibaba.druid.sql.ast.statement.SQLInsertStatement;
import com.alibaba.druid.sql.ast.statement.SQLMergeStatement;
import com.alibaba.druid.sql.ast.statement.SQLSelectStatement;
import com.alibaba.druid.sql.ast.statement.SQLUpdateStatement;

/**
 * 语句分类器关心的顶层语句类别
 *
 * @author afsun
 */
public enum StatementCategory {
    CREATE_TABLE,
    CREATE_VIEW,
    INSERT,
    UPDATE,
    DELETE,
    MERGE,
    DROP,
    ALTER,
    SELECT,
    OTHER;

    public static StatementCategory of(SQLStatement statement) {
        if (statement instanceof SQLCreateTableStatement) {
            return CREATE_TABLE;
        }
        if (statement instanceof SQLCreateViewStatement) {
            return CREATE_VIEW;
        }
        if (statement instanceof SQLInsertStatement) {
            return INSERT;
        }
        if (statement instanceof SQLUpdateStatement) {
            return UPDATE;
        }
        if (statement instanceof SQLDeleteStatement) {
            return DELETE;
        }
        if (statement instanceof SQLMergeStatement) {
            return MERGE;
        }
        if (statement instanceof SQLDropTableStatement || statement instanceof SQLDropViewStatement) {
            return DROP;
        }
        if (statement instanceof SQLAlterTableStatement) {
            return ALTER;
        }
        if (statement instanceof SQLSelectStatement) {
            return SELECT;
        }
        return OTHER;
    }
}
