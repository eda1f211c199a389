package com.afsun.tablelineage.core.util;

import com.afsun.tablelineage.core.parser.RewrittenSql;
import com.afsun.tablelineage.core.parser.SqlDialectRewriter;
import lombok.extern.slf4j.Slf4j;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Spark SQL改写器，Druid 使用 Hive 语法解析 Spark SQL，以下写法需要预处理：
 * - CREATE [OR REPLACE] [GLOBAL] TEMP[ORARY] VIEW -> CREATE [OR REPLACE] VIEW
 * - CREATE TEMPORARY TABLE -> CREATE TABLE，记录临时表标记
 * - CACHE [LAZY] TABLE x [OPTIONS(...)] [AS] SELECT ... -> CREATE TABLE x AS SELECT ...，记录临时表标记
 * - CREATE TABLE ... USING parquet OPTIONS (...) 去掉数据源子句
 * - INSERT OVERWRITE t -> INSERT OVERWRITE TABLE t
 *
 * @author afsun
 * @date 2025-12-02日 11:45
 */
@Slf4j
public class SparkSqlRewriter implements SqlDialectRewriter {

    private static final Pattern TEMP_VIEW = Pattern.compile(
            "(?is)CREATE\\s+(?<replace>OR\\s+REPLACE\\s+)?(?:GLOBAL\\s+)?TEMP(?:ORARY)?\\s+VIEW\\s+");

    private static final Pattern TEMP_TABLE = Pattern.compile("(?is)CREATE\\s+(?:GLOBAL\\s+)?TEMP(?:ORARY)?\\s+TABLE\\s+");

    private static final Pattern CACHE_TABLE = Pattern.compile(
            "(?is)CACHE\\s+(?:LAZY\\s+)?TABLE\\s+(?<name>[^\\s(]+)\\s+(?:OPTIONS\\s*\\([^)]*\\)\\s*)?(?:AS\\s+)?"
                    + "(?=SELECT\\b|WITH\\b|\\()");

    private static final Pattern CREATE_TABLE = Pattern.compile("(?is)CREATE\\s+TABLE\\s+");

    private static final Pattern USING_SOURCE = Pattern.compile("(?i)USING\\s+[\\w.]+");

    private static final Pattern OPTIONS = Pattern.compile("(?i)OPTIONS\\s*\\(");

    private static final Pattern INSERT_OVERWRITE = Pattern.compile(
            "(?is)INSERT\\s+OVERWRITE\\s+(?!TABLE\\b|LOCAL\\b|DIRECTORY\\b)");

    @Override
    public RewrittenSql rewrite(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return RewrittenSql.unchanged(sql);
        }
        String original = sql.trim();
        String s = original;
        boolean temporary = false;

        Matcher tempView = TEMP_VIEW.matcher(s);
        Matcher tempTable = TEMP_TABLE.matcher(s);
        Matcher cache = CACHE_TABLE.matcher(s);
        Matcher insertOverwrite = INSERT_OVERWRITE.matcher(s);
        if (tempView.lookingAt()) {
            s = "CREATE " + (tempView.group("replace") != null ? "OR REPLACE " : "") + "VIEW "
                    + s.substring(tempView.end());
        } else if (tempTable.lookingAt()) {
            temporary = true;
            s = "CREATE TABLE " + s.substring(tempTable.end());
        } else if (cache.lookingAt()) {
            temporary = true;
            s = "CREATE TABLE " + cache.group("name") + " AS " + s.substring(cache.end());
        } else if (insertOverwrite.lookingAt()) {
            s = "INSERT OVERWRITE TABLE " + s.substring(insertOverwrite.end());
        }

        Matcher createTable = CREATE_TABLE.matcher(s);
        if (createTable.lookingAt()) {
            s = stripDataSource(s, createTable.end());
        }

        if (!s.equals(original)) {
            log.debug("Spark SQL已改写, 临时表={}: {}", temporary, SqlScriptUtils.shortSql(s));
        }
        return new RewrittenSql(s, temporary);
    }

    /**
     * 去掉建表语句顶层的 USING 与 OPTIONS(...) 子句
     */
    private String stripDataSource(String s, int from) {
        String result = s;
        int usingPos = SqlRewriteSupport.findTopLevel(result, USING_SOURCE, from);
        if (usingPos >= 0) {
            Matcher m = USING_SOURCE.matcher(result);
            m.region(usingPos, result.length());
            if (m.lookingAt()) {
                result = result.substring(0, usingPos) + result.substring(m.end());
            }
        }
        int optionsPos = SqlRewriteSupport.findTopLevel(result, OPTIONS, from);
        if (optionsPos >= 0) {
            int open = result.indexOf('(', optionsPos);
            int close = SqlRewriteSupport.findClosingParen(result, open);
            if (close > 0) {
                result = result.substring(0, optionsPos) + result.substring(close + 1);
            }
        }
        return result;
    }
}
