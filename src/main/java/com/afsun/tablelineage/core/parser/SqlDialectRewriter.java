package com.afsun.tablelineage.core.parser;

/**
 * 方言改写器：把 Druid 不认识的方言语法改写为等价的通用写法，保证表引用不变
 *
 * @author afsun
 */
public interface SqlDialectRewriter {

    /**
     * @param sql 单条语句，不含结尾分号
     * @return 改写结果，无需改写时原样返回
     */
    RewrittenSql rewrite(String sql);
}
