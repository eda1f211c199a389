package com.afsun.tablelineage.report;

import com.afsun.tablelineage.core.IdentifierCase;
import com.afsun.tablelineage.core.LineageResult;
import com.afsun.tablelineage.core.Operation;
import com.afsun.tablelineage.core.OperationKind;
import com.afsun.tablelineage.core.SqlDialect;
import com.afsun.tablelineage.core.TableRef;
import com.afsun.tablelineage.core.validate.TableNameValidator;
import com.alibaba.druid.sql.SQLUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把 {@link LineageResult} 投影为 {@link LineageReport}
 *
 * @author afsun
 * @date 2025-12-05日 10:15
 */
@Slf4j
public class LineageReportBuilder {

    public static final String PARSER_VERSION = "Druid";

    private final TableNameValidator validator;
    private final IdentifierCase identifierCase;

    public LineageReportBuilder(TableNameValidator validator, IdentifierCase identifierCase) {
        this.validator = validator;
        this.identifierCase = identifierCase;
    }

    public LineageReport build(String scriptName, LineageResult result, SqlDialect dialect) {
        LineageReport report = new LineageReport();
        report.setScriptName(scriptName);
        report.setParserVersion(PARSER_VERSION);
        report.getWarnings().addAll(result.getWarnings());

        Map<String, LineageReport.TableFlow> tables = report.getTables();
        for (String table : result.getSourceTables()) {
            tables.computeIfAbsent(table, k -> new LineageReport.TableFlow());
        }
        for (String table : result.getTargetTables()) {
            tables.computeIfAbsent(table, k -> new LineageReport.TableFlow());
        }
        for (String table : result.getVolatileTables()) {
            tables.computeIfAbsent(table, k -> new LineageReport.TableFlow()).setVolatileTable(true);
        }

        Map<String, Integer> statementIndex = new HashMap<>();
        for (Operation op : result.getOperations()) {
            if (StringUtils.isBlank(op.getRawText())) {
                continue;
            }
            String formatted = format(op.getRawText(), dialect);
            Integer index = statementIndex.get(formatted);
            if (index == null) {
                index = report.getStatements().size();
                statementIndex.put(formatted, index);
                report.getStatements().add(formatted);
            }
            String target = validName(op.getTarget());
            if (target == null || !tables.containsKey(target)) {
                continue;
            }
            if (op.getKind() == OperationKind.CREATE_VIEW) {
                tables.get(target).setView(true);
            }
            for (String source : validSources(op)) {
                addEdge(tables.get(target).getSource(), source, index);
                LineageReport.TableFlow sourceFlow = tables.get(source);
                if (sourceFlow != null) {
                    addEdge(sourceFlow.getTarget(), target, index);
                }
            }
        }
        if (report.getStatements().isEmpty()) {
            log.warn("脚本 {} 中没有可输出的语句", scriptName);
        }
        return report;
    }

    private static void addEdge(List<LineageReport.FlowEdge> edges, String name, int index) {
        for (LineageReport.FlowEdge edge : edges) {
            if (edge.getName().equals(name)) {
                if (!edge.getOperation().contains(index)) {
                    edge.getOperation().add(index);
                }
                return;
            }
        }
        LineageReport.FlowEdge edge = new LineageReport.FlowEdge(name);
        edge.getOperation().add(index);
        edges.add(edge);
    }

    private Set<String> validSources(Operation op) {
        Set<String> names = new LinkedHashSet<>();
        for (TableRef source : op.getSources()) {
            String name = validName(source);
            if (name != null) {
                names.add(name);
            }
        }
        return names;
    }

    private String validName(TableRef ref) {
        if (ref == null || ref.isSubquery()) {
            return null;
        }
        String name = ref.normalizedName(identifierCase);
        return validator.isValid(name) ? name : null;
    }

    /**
     * 美化输出，Druid 无法处理的方言语法保留原文
     */
    private static String format(String sql, SqlDialect dialect) {
        try {
            String formatted = SQLUtils.format(sql, dialect.primaryDbType());
            return StringUtils.isBlank(formatted) ? sql.trim() : formatted.trim();
        } catch (RuntimeException e) {
            log.debug("语句格式化失败, 保留原文: {}", e.getMessage());
            return sql.trim();
        }
    }
}
