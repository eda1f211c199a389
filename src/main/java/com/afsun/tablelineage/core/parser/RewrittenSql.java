package com.afsun.tablelineage.core.parser;

import lombok.Data;

/**
 * 方言改写结果
 */
@Data
public class RewrittenSql {

    private final String sql;

    /**
     * 改写时去掉了 VOLATILE / TEMPORARY 等会话级修饰
     */
    private final boolean temporary;

    public static RewrittenSql unchanged(String sql) {
        return new RewrittenSql(sql, false);
    }
}
