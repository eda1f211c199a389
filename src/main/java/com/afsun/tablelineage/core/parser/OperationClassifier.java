package com.afsun.tablelineage.core.parser;

import com.afsun.tablelineage.core.Operation;
import com.alibaba.druid.sql.ast.SQLStatement;

/**
 * 语句分类器接口
 * 根据顶层语句类型确定操作类型、目标表与源表
 *
 * @author afsun
 */
public interface OperationClassifier {

    /**
     * 分类单条已解析的语句
     *
     * @param statement SQL语句AST节点
     * @param context   行号、原文和改写标记
     * @return 操作，SELECT / OTHER 之外的操作一定有目标表
     */
    Operation classify(SQLStatement statement, StatementContext context);
}
