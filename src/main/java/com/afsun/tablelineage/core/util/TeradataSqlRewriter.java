package com.afsun.tablelineage.core.util;

import com.afsun.tablelineage.core.parser.RewrittenSql;
import com.afsun.tablelineage.core.parser.SqlDialectRewriter;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Teradata SQL改写器
 * 将Teradata特有的语法转换为Druid能够解析的通用SQL语法，表引用保持不变：
 * - SEL / INS / DEL / UPD / CT 缩写展开
 * - LOCKING ROW FOR ACCESS 前缀去除
 * - CREATE [MULTISET|SET] VOLATILE TABLE x AS ( SELECT ... ) WITH DATA ON COMMIT PRESERVE ROWS
 * -> CREATE TABLE x AS SELECT ...，并记录临时表标记
 * - UPDATE a FROM t a, s b SET ... WHERE ... -> UPDATE a SET ... FROM t a, s b WHERE ...
 * - REPLACE VIEW -> CREATE OR REPLACE VIEW
 * - DELETE FROM t ALL -> DELETE FROM t
 * - INSERT INTO t WITH c AS (...) SELECT ... -> WITH c AS (...) INSERT INTO t SELECT ...
 * - 去掉与表引用无关的 CAST ... FORMAT '...'、SAMPLE n、QUALIFY 子句
 *
 * @author afsun
 * @date 2025-12-02日 10:30
 */
@Slf4j
public class TeradataSqlRewriter implements SqlDialectRewriter {

    /**
     * 查询起点上的 SEL：左括号/右括号、集合运算符或 AS 之后，且后面跟的是查询列表而不是子句关键字
     */
    private static final Pattern SEL = Pattern.compile(
            "(?i)([()]\\s*|\\b(?:UNION|MINUS|EXCEPT|INTERSECT)(?:\\s+(?:ALL|DISTINCT))?\\s+|\\bAS\\s+)SEL\\b"
                    + "(?=\\s*\\*|\\s+(?!(?:FROM|WHERE|GROUP|ORDER|HAVING|QUALIFY|UNION|MINUS|EXCEPT|INTERSECT"
                    + "|JOIN|ON|LEFT|RIGHT|INNER|FULL|CROSS|AND|OR)\\b)\\S)");

    private static final Pattern INSERT_SEL = Pattern.compile(
            "(?is)(INSERT\\s+INTO\\s+[^\\s(]+\\s+)SEL(?=\\s)");

    private static final Pattern LEADING_ABBREVIATION = Pattern.compile("(?i)(INS|DEL|UPD|CT|SEL)\\b");

    private static final Pattern LOCKING = Pattern.compile(
            "(?is)LOCK(?:ING)?\\s+(?:ROW|(?:TABLE|DATABASE|VIEW)\\s+\\S+)\\s+(?:FOR|IN)\\s+"
                    + "(?:ACCESS|READ|WRITE|EXCLUSIVE)(?:\\s+MODE)?\\s+");

    private static final Pattern REPLACE_VIEW = Pattern.compile("(?is)REPLACE\\s+(?:RECURSIVE\\s+)?VIEW\\b");

    /**
     * CREATE 表头，temp 组命中即为会话级临时表
     */
    private static final Pattern CREATE_TABLE = Pattern.compile(
            "(?is)CREATE\\s+(?:(?:MULTISET|SET)\\s+)?(?<temp>VOLATILE\\s+|GLOBAL\\s+TEMPORARY\\s+)?"
                    + "(?:(?:MULTISET|SET)\\s+)?TABLE\\s+");

    /**
     * 表名后的 ", NO LOG, NO FALLBACK" 之类表选项
     */
    private static final Pattern TABLE_OPTIONS = Pattern.compile(
            "(?is)^(CREATE TABLE\\s+[^\\s,(]+)(?:\\s*,\\s*(?:NO\\s+|DUAL\\s+|LOCAL\\s+|NOT\\s+LOCAL\\s+)?"
                    + "(?:FALLBACK|LOG|JOURNAL|BEFORE\\s+JOURNAL|AFTER\\s+JOURNAL|CHECKSUM\\s*=\\s*\\w+"
                    + "|FREESPACE\\s*=\\s*\\d+(?:\\s+PERCENT)?|MAP\\s*=\\s*\\w+|DATABLOCKSIZE\\s*=\\s*\\w+(?:\\s+BYTES)?)"
                    + "(?:\\s+PROTECTION)?)+");

    private static final Pattern AS_KEYWORD = Pattern.compile("(?i)AS\\b");

    private static final Pattern QUERY_START = Pattern.compile("(?i)(?:SELECT\\b|WITH\\b|\\()");

    private static final Pattern COPY_TABLE = Pattern.compile("(?is)([^\\s(]+)\\s+WITH\\s+(?:NO\\s+)?DATA\\b");

    /**
     * 建表语句尾部的表选项起点
     */
    private static final Pattern TABLE_OPTION_START = Pattern.compile(
            "(?i)(?:WITH\\s+(?:NO\\s+)?DATA\\b|(?:UNIQUE\\s+)?PRIMARY\\s+INDEX\\b|NO\\s+PRIMARY\\s+INDEX\\b"
                    + "|PRIMARY\\s+AMP\\b|ON\\s+COMMIT\\b|INDEX\\s*\\()");

    private static final Pattern UPDATE_FROM = Pattern.compile("(?is)UPDATE\\s+(?<alias>[^\\s,]+)\\s+FROM\\s+");

    private static final Pattern SET_KEYWORD = Pattern.compile("(?i)SET\\b");

    private static final Pattern WHERE_KEYWORD = Pattern.compile("(?i)WHERE\\b");

    private static final Pattern DELETE_ALL = Pattern.compile("(?is)DELETE\\s+(?:FROM\\s+)?(?<table>[^\\s(]+)\\s+ALL");

    private static final Pattern DELETE_WITHOUT_FROM = Pattern.compile("(?is)DELETE\\s+(?!FROM\\b)(?<table>[^\\s(]+)");

    private static final Pattern INSERT_INTO = Pattern.compile(
            "(?is)INSERT\\s+INTO\\s+[^\\s(]+(?:\\s*\\([^()]*\\))?\\s*(?=WITH\\b)");

    private static final Pattern SELECT_KEYWORD = Pattern.compile("(?i)SEL(?:ECT)?\\b");

    /**
     * 列属性形式 (FORMAT '...')，整组去掉
     */
    private static final Pattern FORMAT_ATTRIBUTE = Pattern.compile("(?i)\\s*\\(\\s*FORMAT\\s+'(?:[^']|'')*'\\s*\\)");

    /**
     * CAST(x AS DATE FORMAT '...') 与 (DATE, FORMAT '...') 中紧贴右括号的 FORMAT
     */
    private static final Pattern FORMAT_PHRASE = Pattern.compile(
            "(?i)(?:\\s*,)?\\s+FORMAT\\s+'(?:[^']|'')*'(?=\\s*\\))");

    private static final Pattern SAMPLE = Pattern.compile(
            "(?i)\\s*\\bSAMPLE\\s+(?:WITH\\s+REPLACEMENT\\s+)?(?:RANDOMIZED\\s+ALLOCATION\\s+)?"
                    + "\\d+(?:\\.\\d+)?(?:\\s*,\\s*\\d+(?:\\.\\d+)?)*\\b");

    private static final Pattern QUALIFY = Pattern.compile("(?i)QUALIFY\\b");

    /**
     * QUALIFY 子句在同一层括号内的结束位置
     */
    private static final Pattern QUALIFY_END = Pattern.compile(
            "(?i)(?:ORDER\\s+BY|GROUP\\s+BY|HAVING|WHERE|SAMPLE|UNION|MINUS|EXCEPT|INTERSECT"
                    + "|WITH\\s+(?:NO\\s+)?DATA)\\b");

    private static final String CREATE_TABLE_PREFIX = "CREATE TABLE ";

    @Override
    public RewrittenSql rewrite(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return RewrittenSql.unchanged(sql);
        }
        String original = sql.trim();
        String s = stripLocking(original);
        s = expandAbbreviations(s);

        boolean temporary = false;
        Matcher create = CREATE_TABLE.matcher(s);
        Matcher replaceView = REPLACE_VIEW.matcher(s);
        Matcher updateFrom = UPDATE_FROM.matcher(s);
        if (create.lookingAt()) {
            temporary = create.group("temp") != null;
            s = CREATE_TABLE_PREFIX + s.substring(create.end());
            s = TABLE_OPTIONS.matcher(s).replaceFirst("$1");
            s = rewriteCreateTableBody(s);
        } else if (replaceView.lookingAt()) {
            s = "CREATE OR REPLACE VIEW" + s.substring(replaceView.end());
        } else if (updateFrom.lookingAt()) {
            s = rewriteUpdateFrom(s, updateFrom);
        } else {
            s = rewriteDelete(s);
        }
        s = hoistInsertWith(s);
        s = stripClauses(s);

        if (!s.equals(original)) {
            log.debug("Teradata SQL已改写, 临时表={}", temporary);
            log.debug("原始SQL: {}", SqlScriptUtils.shortSql(original));
            log.debug("改写SQL: {}", SqlScriptUtils.shortSql(s));
        }
        return new RewrittenSql(s, temporary);
    }

    private String stripLocking(String s) {
        Matcher m = LOCKING.matcher(s);
        return m.lookingAt() ? s.substring(m.end()) : s;
    }

    private String expandAbbreviations(String s) {
        String result = SqlRewriteSupport.replaceOutsideLiterals(s, SEL, "$1SELECT");
        Matcher m = LEADING_ABBREVIATION.matcher(result);
        if (m.lookingAt()) {
            result = leadingKeyword(m.group(1)) + result.substring(m.end());
        }
        Matcher insertSel = INSERT_SEL.matcher(result);
        if (insertSel.lookingAt()) {
            result = insertSel.group(1) + "SELECT" + result.substring(insertSel.end());
        }
        return result;
    }

    private static String leadingKeyword(String abbreviation) {
        switch (abbreviation.toUpperCase(Locale.ROOT)) {
            case "SEL":
                return "SELECT";
            case "INS":
                return "INSERT";
            case "DEL":
                return "DELETE";
            case "UPD":
                return "UPDATE";
            default:
                return "CREATE TABLE";
        }
    }

    /**
     * INSERT INTO t WITH ... SELECT：把 WITH 子句提到 INSERT 之前
     */
    private String hoistInsertWith(String s) {
        Matcher m = INSERT_INTO.matcher(s);
        if (!m.lookingAt()) {
            return s;
        }
        int withPos = m.end();
        int selectPos = SqlRewriteSupport.findTopLevel(s, SELECT_KEYWORD, withPos + 4);
        if (selectPos < 0) {
            return s;
        }
        return s.substring(withPos, selectPos).trim() + " " + s.substring(0, withPos).trim() + " "
                + s.substring(selectPos);
    }

    /**
     * 去掉不影响表级血缘、Druid 又无法解析的子句
     */
    private String stripClauses(String s) {
        String result = FORMAT_ATTRIBUTE.matcher(s).replaceAll("");
        result = FORMAT_PHRASE.matcher(result).replaceAll("");
        result = SqlRewriteSupport.replaceOutsideLiterals(result, SAMPLE, "");
        int pos = SqlRewriteSupport.findAnyLevel(result, QUALIFY, 0);
        while (pos >= 0) {
            int end = SqlRewriteSupport.findClauseEnd(result, QUALIFY_END, pos + "QUALIFY".length());
            String head = result.substring(0, pos).trim();
            String tail = result.substring(end);
            result = head + (tail.isEmpty() || tail.startsWith(")") ? "" : " ") + tail;
            pos = SqlRewriteSupport.findAnyLevel(result, QUALIFY, head.length());
        }
        return result;
    }

    /**
     * 处理 CTAS 查询体与尾部表选项
     */
    private String rewriteCreateTableBody(String s) {
        int nameStart = CREATE_TABLE_PREFIX.length();
        int asPos = SqlRewriteSupport.findTopLevel(s, AS_KEYWORD, nameStart);
        if (asPos >= 0) {
            int bodyStart = SqlRewriteSupport.skipWhitespace(s, asPos + 2);
            if (bodyStart < s.length() && s.charAt(bodyStart) == '(') {
                // AS ( SELECT ... ) WITH DATA ...：去掉外层括号与尾部选项
                int close = SqlRewriteSupport.findClosingParen(s, bodyStart);
                if (close > 0) {
                    String inner = s.substring(bodyStart + 1, close).trim();
                    String trailing = s.substring(close + 1).trim();
                    if (QUERY_START.matcher(inner).lookingAt()
                            && (trailing.isEmpty() || TABLE_OPTION_START.matcher(trailing).lookingAt())) {
                        return s.substring(0, asPos) + "AS " + inner;
                    }
                }
            } else {
                // CREATE TABLE x AS y WITH DATA：按表复制
                Matcher copy = COPY_TABLE.matcher(s);
                copy.region(bodyStart, s.length());
                if (copy.lookingAt() && !QUERY_START.matcher(copy.group(1)).lookingAt()) {
                    return s.substring(0, asPos) + "AS SELECT * FROM " + copy.group(1);
                }
            }
        }
        int optionPos = SqlRewriteSupport.findTopLevel(s, TABLE_OPTION_START, nameStart);
        return optionPos < 0 ? s : s.substring(0, optionPos).trim();
    }

    private String rewriteUpdateFrom(String s, Matcher updateFrom) {
        int fromStart = updateFrom.end();
        int setPos = SqlRewriteSupport.findTopLevel(s, SET_KEYWORD, fromStart);
        if (setPos < 0) {
            return s;
        }
        String fromList = s.substring(fromStart, setPos).trim();
        int wherePos = SqlRewriteSupport.findTopLevel(s, WHERE_KEYWORD, setPos);
        String setClause = (wherePos < 0 ? s.substring(setPos) : s.substring(setPos, wherePos)).trim();

        StringBuilder sb = new StringBuilder("UPDATE ")
                .append(updateFrom.group("alias"))
                .append(' ').append(setClause)
                .append(" FROM ").append(fromList);
        if (wherePos >= 0) {
            sb.append(' ').append(s.substring(wherePos).trim());
        }
        return sb.toString();
    }

    private String rewriteDelete(String s) {
        Matcher all = DELETE_ALL.matcher(s);
        if (all.matches()) {
            return "DELETE FROM " + all.group("table");
        }
        Matcher bare = DELETE_WITHOUT_FROM.matcher(s);
        if (bare.matches()) {
            return "DELETE FROM " + bare.group("table");
        }
        return s;
    }
}
