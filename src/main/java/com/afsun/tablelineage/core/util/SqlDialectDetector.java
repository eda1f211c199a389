package com.afsun.tablelineage.core.util;

import com.afsun.tablelineage.core.SqlDialect;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * SQL方言检测器
 * 调用方未指定方言时，根据脚本文本特征推断 Teradata 还是 Spark
 *
 * @author afsun
 */
@Slf4j
public class SqlDialectDetector {

    private static final Pattern TERADATA_UPDATE_FROM = Pattern.compile("(?is)\\bupdate\\s+\\S+\\s+from\\b");

    private static final Pattern TERADATA_ABBREVIATION = Pattern.compile("(?im)^\\s*(sel|ins|del|bt|et)\\b");

    private SqlDialectDetector() {
    }

    /**
     * 检测SQL方言类型
     *
     * @param sql            SQL文本
     * @param defaultDialect 无明显特征时使用的方言
     * @return 检测到的方言类型
     */
    public static SqlDialect detect(String sql, SqlDialect defaultDialect) {
        if (sql == null || sql.isEmpty()) {
            return defaultDialect;
        }

        String s = sql.toLowerCase(Locale.ROOT);

        // 1. Teradata特征检测
        if (containsTeradataFeatures(s)) {
            log.debug("检测到Teradata方言特征");
            return SqlDialect.TERADATA;
        }

        // 2. Spark特征检测
        if (containsSparkFeatures(s)) {
            log.debug("检测到Spark方言特征");
            return SqlDialect.SPARK;
        }

        log.debug("未检测到方言特征, 使用默认方言: {}", defaultDialect);
        return defaultDialect;
    }

    /**
     * 检测Teradata特征
     */
    private static boolean containsTeradataFeatures(String sql) {
        return sql.contains("volatile table") ||
               sql.contains("multiset") ||
               sql.contains("primary index") ||
               sql.contains("on commit preserve rows") ||
               sql.contains("collect stat") ||
               sql.contains("locking row for access") ||
               sql.contains("bteq") ||
               TERADATA_UPDATE_FROM.matcher(sql).find() ||
               TERADATA_ABBREVIATION.matcher(sql).find();
    }

    /**
     * 检测Spark特征
     */
    private static boolean containsSparkFeatures(String sql) {
        return sql.contains("insert overwrite") ||
               sql.contains("temporary view") ||
               sql.contains("temp view") ||
               sql.contains("cache table") ||
               sql.contains("lateral view") ||
               sql.contains("distribute by") ||
               sql.contains("using parquet") ||
               sql.contains("using delta") ||
               sql.contains("using orc") ||
               sql.indexOf('`') >= 0;
    }
}
