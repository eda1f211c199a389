package com.afsun.tablelineage.core.resolver;

import com.alibaba.druid.sql.ast.SQLObject;
import com.alibaba.druid.sql.ast.expr.SQLBinaryOpExpr;
import com.alibaba.druid.sql.ast.expr.SQLExistsExpr;
import com.alibaba.druid.sql.ast.expr.SQLInSubQueryExpr;
import com.alibaba.druid.sql.ast.expr.SQLNotExpr;
import com.alibaba.druid.sql.ast.expr.SQLQueryExpr;
import com.alibaba.druid.sql.ast.statement.SQLExprTableSource;
import com.alibaba.druid.sql.ast.statement.SQLJoinTableSource;
import com.alibaba.druid.sql.ast.statement.SQLSelect;
import com.alibaba.druid.sql.ast.statement.SQLSelectQueryBlock;
import com.alibaba.druid.sql.ast.statement.SQLSubqueryTableSource;
import com.alibaba.druid.sql.ast.statement.SQLUnionQuery;
import com.alibaba.druid.sql.ast.statement.SQLWithSubqueryClause;

/**
 * 表引用解析关心的 AST 节点类别，其余节点一律归为 {@link #OTHER}
 *
 * @author afsun
 * @date 2025-12-03日 09:20
 */
public enum NodeCategory {

    /**
     * 物理表（可带别名）
     */
    TABLE,

    /**
     * FROM 中带别名的子查询
     */
    SUBQUERY_SOURCE,

    JOIN,

    /**
     * UNION / INTERSECT / EXCEPT
     */
    SET_OPERATION,

    /**
     * 查询整体，可能带 WITH
     */
    SELECT,

    /**
     * 独立的 WITH 子句（INSERT ... 自带的 CTE），CTE 名称登记到当前作用域
     */
    WITH,

    QUERY_BLOCK,

    /**
     * AND / OR / 比较等二元表达式以及 NOT
     */
    BOOLEAN,

    /**
     * IN (子查询)、EXISTS (子查询)、标量子查询
     */
    SUBQUERY_PREDICATE,

    OTHER;

    public static NodeCategory of(SQLObject node) {
        if (node instanceof SQLExprTableSource) {
            return TABLE;
        }
        if (node instanceof SQLSubqueryTableSource) {
            return SUBQUERY_SOURCE;
        }
        if (node instanceof SQLJoinTableSource) {
            return JOIN;
        }
        if (node instanceof SQLUnionQuery) {
            return SET_OPERATION;
        }
        if (node instanceof SQLSelect) {
            return SELECT;
        }
        if (node instanceof SQLWithSubqueryClause) {
            return WITH;
        }
        if (node instanceof SQLSelectQueryBlock) {
            return QUERY_BLOCK;
        }
        if (node instanceof SQLInSubQueryExpr || node instanceof SQLExistsExpr || node instanceof SQLQueryExpr) {
            return SUBQUERY_PREDICATE;
        }
        if (node instanceof SQLBinaryOpExpr || node instanceof SQLNotExpr) {
            return BOOLEAN;
        }
        return OTHER;
    }
}
