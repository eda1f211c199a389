package com.afsun.tablelineage.core.strategy;

import com.afsun.tablelineage.core.LineageWarning;
import com.afsun.tablelineage.core.Operation;
import com.afsun.tablelineage.core.OperationKind;
import com.afsun.tablelineage.core.SqlDialect;
import com.afsun.tablelineage.core.SqlSegment;
import com.afsun.tablelineage.core.TableRef;
import com.afsun.tablelineage.core.validate.TableNameValidator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 正则兜底策略，只在 AST 解析失败且开启回退时使用。
 * 按语句开头的关键字判断操作类型，FROM / JOIN / USING 后的名称作为源表，WITH 中定义的 CTE 名称排除在外。
 * 结果只是近似值，调用方需要同时记录回退警告。
 *
 * @author afsun
 * @date 2025-12-04日 09:30
 */
@Slf4j
public class RegexStatementAnalyzer implements StatementAnalyzer {

    private static final String NAME = "([A-Za-z0-9_$#\"`]+(?:\\.[A-Za-z0-9_$#\"`]+){0,2})";

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;

    private static final Pattern CREATE_VOLATILE = Pattern.compile(
            "^CREATE\\s+(?:(?:MULTISET|SET)\\s+)?(?:VOLATILE|GLOBAL\\s+TEMPORARY|TEMPORARY|TEMP)\\s+(?:(?:MULTISET|SET)\\s+)?TABLE\\s+"
                    + "(?:IF\\s+NOT\\s+EXISTS\\s+)?" + NAME, FLAGS);
    private static final Pattern CACHE_TABLE = Pattern.compile("^CACHE\\s+(?:LAZY\\s+)?TABLE\\s+" + NAME, FLAGS);
    private static final Pattern CREATE_VIEW = Pattern.compile(
            "^(?:CREATE\\s+(?:OR\\s+REPLACE\\s+)?(?:(?:GLOBAL\\s+)?TEMP(?:ORARY)?\\s+)?|REPLACE\\s+)VIEW\\s+"
                    + "(?:IF\\s+NOT\\s+EXISTS\\s+)?" + NAME, FLAGS);
    private static final Pattern CREATE_TABLE = Pattern.compile(
            "^CREATE\\s+(?:(?:MULTISET|SET|EXTERNAL)\\s+)?TABLE\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?" + NAME, FLAGS);
    private static final Pattern INSERT = Pattern.compile(
            "^INS(?:ERT)?\\s+(?:INTO|OVERWRITE)\\s+(?:TABLE\\s+)?" + NAME, FLAGS);
    private static final Pattern INSERT_SHORT = Pattern.compile("^INS(?:ERT)?\\s+" + NAME, FLAGS);
    private static final Pattern UPDATE_VENDOR = Pattern.compile("^UPD(?:ATE)?\\s+(\\w+)\\s+FROM\\s+" + NAME, FLAGS);
    private static final Pattern UPDATE = Pattern.compile("^UPD(?:ATE)?\\s+" + NAME, FLAGS);
    private static final Pattern DELETE = Pattern.compile("^DEL(?:ETE)?\\s+(?:FROM\\s+)?" + NAME, FLAGS);
    private static final Pattern MERGE = Pattern.compile("^MERGE\\s+INTO\\s+" + NAME, FLAGS);
    private static final Pattern DROP = Pattern.compile(
            "^DROP\\s+(?:TABLE|VIEW)\\s+(?:IF\\s+EXISTS\\s+)?" + NAME, FLAGS);
    private static final Pattern ALTER = Pattern.compile("^ALTER\\s+TABLE\\s+" + NAME, FLAGS);
    private static final Pattern SELECT = Pattern.compile("^(?:SEL(?:ECT)?|WITH)\\b", FLAGS);

    private static final Pattern SOURCE = Pattern.compile("\\b(?:FROM|JOIN|USING)\\s+" + NAME, FLAGS);
    private static final Pattern CTE_NAME = Pattern.compile("(?:\\bWITH|,)\\s*(?:RECURSIVE\\s+)?(\\w+)\\s+AS\\s*\\(", FLAGS);

    private final TableNameValidator validator;

    public RegexStatementAnalyzer(TableNameValidator validator) {
        this.validator = validator;
    }

    @Override
    public StatementAnalysis analyze(SqlSegment segment, SqlDialect dialect) {
        String sql = segment.getText().trim();
        Set<String> cteNames = cteNames(sql);
        Operation operation;
        Matcher m;
        if ((m = CREATE_VOLATILE.matcher(sql)).find() || (m = CACHE_TABLE.matcher(sql)).find()) {
            operation = build(OperationKind.CREATE_VOLATILE, m, sql, cteNames, segment);
        } else if ((m = CREATE_VIEW.matcher(sql)).find()) {
            operation = build(OperationKind.CREATE_VIEW, m, sql, cteNames, segment);
        } else if ((m = CREATE_TABLE.matcher(sql)).find()) {
            operation = build(OperationKind.CREATE, m, sql, cteNames, segment);
        } else if ((m = INSERT.matcher(sql)).find() || (m = INSERT_SHORT.matcher(sql)).find()) {
            operation = build(OperationKind.INSERT, m, sql, cteNames, segment);
        } else if ((m = UPDATE_VENDOR.matcher(sql)).find()) {
            operation = updateVendor(m, sql, cteNames, segment);
        } else if ((m = UPDATE.matcher(sql)).find()) {
            operation = update(m, sql, cteNames, segment);
        } else if ((m = DELETE.matcher(sql)).find()) {
            operation = build(OperationKind.DELETE, m, sql, cteNames, segment);
        } else if ((m = MERGE.matcher(sql)).find()) {
            operation = build(OperationKind.MERGE, m, sql, cteNames, segment);
        } else if ((m = DROP.matcher(sql)).find()) {
            operation = targetOnly(OperationKind.DROP, m, segment);
        } else if ((m = ALTER.matcher(sql)).find()) {
            operation = targetOnly(OperationKind.ALTER, m, segment);
        } else if (SELECT.matcher(sql).find()) {
            operation = new Operation(OperationKind.SELECT, null, sources(sql, 0, cteNames),
                    segment.getLineNumber(), segment.getText());
        } else {
            return StatementAnalysis.failure(LineageWarning.parseFailure(segment.getLineNumber(), "正则无法识别语句类型"));
        }
        log.debug("第 {} 行语句正则识别为 {}", segment.getLineNumber(), operation.getKind());
        return StatementAnalysis.success(Collections.singletonList(operation));
    }

    private Operation build(OperationKind kind, Matcher m, String sql, Set<String> cteNames, SqlSegment segment) {
        TableRef target = TableRef.of(m.group(1));
        List<TableRef> sources = sources(sql, m.end(), cteNames);
        // DELETE a FROM real_tbl a
        if (kind == OperationKind.DELETE && !validator.isValid(target.getName()) && !sources.isEmpty()) {
            target = sources.get(0);
        }
        return new Operation(kind, target, sources, segment.getLineNumber(), segment.getText());
    }

    private Operation targetOnly(OperationKind kind, Matcher m, SqlSegment segment) {
        return new Operation(kind, TableRef.of(m.group(1)), Collections.emptyList(),
                segment.getLineNumber(), segment.getText());
    }

    /**
     * UPDATE a FROM real_tbl a ...：FROM 后的第一张表是目标
     */
    private Operation updateVendor(Matcher m, String sql, Set<String> cteNames, SqlSegment segment) {
        TableRef target = TableRef.of(m.group(2));
        List<TableRef> sources = new ArrayList<>();
        sources.add(target);
        sources.addAll(sources(sql, m.end(), cteNames));
        return new Operation(OperationKind.UPDATE, target, sources, segment.getLineNumber(), segment.getText());
    }

    private Operation update(Matcher m, String sql, Set<String> cteNames, SqlSegment segment) {
        TableRef target = TableRef.of(m.group(1));
        List<TableRef> sources = sources(sql, m.end(), cteNames);
        if (!validator.isValid(target.getName()) && !sources.isEmpty()) {
            target = sources.get(0);
        }
        if (!sources.contains(target)) {
            sources.add(target);
        }
        return new Operation(OperationKind.UPDATE, target, sources, segment.getLineNumber(), segment.getText());
    }

    private List<TableRef> sources(String sql, int from, Set<String> cteNames) {
        List<TableRef> sources = new ArrayList<>();
        Matcher m = SOURCE.matcher(sql);
        while (from < sql.length() && m.find(from)) {
            TableRef ref = TableRef.of(m.group(1));
            if (!cteNames.contains(ref.getName().toUpperCase()) && validator.isValid(ref.qualifiedName())) {
                sources.add(ref);
            }
            from = m.end();
        }
        return sources;
    }

    private static Set<String> cteNames(String sql) {
        Set<String> names = new HashSet<>();
        Matcher m = CTE_NAME.matcher(sql);
        while (m.find()) {
            names.add(m.group(1).toUpperCase());
        }
        return names;
    }
}
