package com.afsun.tablelineage.core;

import com.afsun.tablelineage.core.exceptions.UnsupportedDialectException;
import com.alibaba.druid.DbType;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 支持的SQL方言
 * Druid 没有 Teradata / Spark 的语法实现，每种方言先经过改写，再按顺序尝试若干语法相近的 Druid 解析器
 *
 * @author afsun
 * @date 2025-12-01日 16:10
 */
public enum SqlDialect {

    TERADATA("teradata", DbType.postgresql, DbType.oracle, DbType.mysql),
    SPARK("spark", DbType.hive, DbType.mysql),
    SPARK2("spark2", DbType.hive, DbType.mysql);

    private final String tag;
    private final List<DbType> parserDbTypes;

    SqlDialect(String tag, DbType... parserDbTypes) {
        this.tag = tag;
        this.parserDbTypes = Collections.unmodifiableList(Arrays.asList(parserDbTypes));
    }

    public String getTag() {
        return tag;
    }

    /**
     * 依次尝试的 Druid 解析器类型，第一个同时用于格式化输出
     */
    public List<DbType> getParserDbTypes() {
        return parserDbTypes;
    }

    public DbType primaryDbType() {
        return parserDbTypes.get(0);
    }

    public static SqlDialect of(String tag) {
        if (StringUtils.isBlank(tag)) {
            throw new UnsupportedDialectException("方言不能为空, 可选值: {}", tags());
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (SqlDialect dialect : values()) {
            if (dialect.tag.equals(normalized)) {
                return dialect;
            }
        }
        throw new UnsupportedDialectException("不支持的方言: {}, 可选值: {}", tag, tags());
    }

    private static String tags() {
        StringBuilder sb = new StringBuilder();
        for (SqlDialect dialect : values()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(dialect.tag);
        }
        return sb.toString();
    }
}
