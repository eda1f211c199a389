package com.afsun.tablelineage.core.parser;

import com.afsun.tablelineage.core.AliasScope;
import com.afsun.tablelineage.core.Operation;
import com.afsun.tablelineage.core.OperationKind;
import com.afsun.tablelineage.core.TableRef;
import com.afsun.tablelineage.core.resolver.SqlNames;
import com.afsun.tablelineage.core.resolver.TableReferenceResolver;
import com.afsun.tablelineage.core.validate.TableNameValidator;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.ast.statement.SQLAlterTableStatement;
import com.alibaba.druid.sql.ast.statement.SQLCreateTableStatement;
import com.alibaba.druid.sql.ast.statement.SQLCreateViewStatement;
import com.alibaba.druid.sql.ast.statement.SQLDeleteStatement;
import com.alibaba.druid.sql.ast.statement.SQLDropTableStatement;
import com.alibaba.druid.sql.ast.statement.SQLDropViewStatement;
import com.alibaba.druid.sql.ast.statement.SQLExprTableSource;
import com.alibaba.druid.sql.ast.statement.SQLInsertStatement;
import com.alibaba.druid.sql.ast.statement.SQLMergeStatement;
import com.alibaba.druid.sql.ast.statement.SQLSelectStatement;
import com.alibaba.druid.sql.ast.statement.SQLTableSource;
import com.alibaba.druid.sql.ast.statement.SQLUpdateSetItem;
import com.alibaba.druid.sql.ast.statement.SQLUpdateStatement;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 默认语句分类器，按语句类型取第一条命中的规则：
 * <pre>
 * CREATE TABLE（带 VOLATILE/TEMPORARY 标记） -> CREATE_VOLATILE，源表只来自定义查询
 * CREATE VIEW                            -> CREATE_VIEW，源表只来自定义查询
 * CREATE TABLE                           -> CREATE，有定义查询时解析其源表
 * INSERT                                 -> INSERT，源表来自 WITH 与插入的查询
 * UPDATE                                 -> UPDATE，目标表按 FROM 中的别名还原，目标表本身也计入源表
 * DELETE                                 -> DELETE，源表来自 FROM 与 WHERE（含 IN / EXISTS 子查询）
 * MERGE                                  -> MERGE，源表来自 USING
 * DROP / ALTER                           -> 只有目标表
 * SELECT / 其他                           -> 没有目标表，源表来自整条语句
 * </pre>
 *
 * @author afsun
 * @date 2025-12-03日 15:40
 */
@Slf4j
public class DefaultOperationClassifier implements OperationClassifier {

    private final TableReferenceResolver resolver;
    private final TableNameValidator validator;

    public DefaultOperationClassifier(TableReferenceResolver resolver, TableNameValidator validator) {
        this.resolver = resolver;
        this.validator = validator;
    }

    @Override
    public Operation classify(SQLStatement statement, StatementContext context) {
        switch (StatementCategory.of(statement)) {
            case CREATE_TABLE:
                return classifyCreateTable((SQLCreateTableStatement) statement, context);
            case CREATE_VIEW:
                SQLCreateViewStatement view = (SQLCreateViewStatement) statement;
                return operation(OperationKind.CREATE_VIEW, SqlNames.tableOf(view.getName()),
                        resolver.resolve(view.getSubQuery(), new AliasScope()), context);
            case INSERT:
                return classifyInsert((SQLInsertStatement) statement, context);
            case UPDATE:
                return classifyUpdate((SQLUpdateStatement) statement, context);
            case DELETE:
                return classifyDelete((SQLDeleteStatement) statement, context);
            case MERGE:
                SQLMergeStatement merge = (SQLMergeStatement) statement;
                return operation(OperationKind.MERGE, firstTable(merge.getInto()),
                        resolver.resolve(merge.getUsing(), new AliasScope()), context);
            case DROP:
                return operation(OperationKind.DROP, droppedTable(statement), Collections.emptyList(), context);
            case ALTER:
                return operation(OperationKind.ALTER,
                        SqlNames.tableOf(((SQLAlterTableStatement) statement).getTableSource()),
                        Collections.emptyList(), context);
            case SELECT:
                return operation(OperationKind.SELECT, null,
                        resolver.resolve(((SQLSelectStatement) statement).getSelect(), new AliasScope()), context);
            default:
                log.debug("第 {} 行语句按 OTHER 处理: {}", context.getLineNumber(), statement.getClass().getSimpleName());
                return operation(OperationKind.OTHER, null, resolver.resolve(statement, new AliasScope()), context);
        }
    }

    private Operation classifyCreateTable(SQLCreateTableStatement create, StatementContext context) {
        TableRef target = SqlNames.tableOf(create.getTableSource());
        List<TableRef> sources = create.getSelect() == null
                ? Collections.emptyList()
                : resolver.resolve(create.getSelect(), new AliasScope());
        OperationKind kind = context.isTemporary() ? OperationKind.CREATE_VOLATILE : OperationKind.CREATE;
        return operation(kind, target, sources, context);
    }

    private Operation classifyInsert(SQLInsertStatement insert, StatementContext context) {
        TableRef target = SqlNames.tableOf(insert.getTableSource());
        if (target == null) {
            target = SqlNames.tableOf(insert.getTableName());
        }
        AliasScope scope = new AliasScope();
        List<TableRef> sources = new ArrayList<>();
        // WITH c AS (...) INSERT INTO t SELECT ...：CTE 名称登记到语句作用域
        sources.addAll(resolver.resolve(insert.getWith(), scope));
        sources.addAll(resolver.resolve(insert.getQuery(), scope));
        return operation(OperationKind.INSERT, target, sources, context);
    }

    private Operation classifyUpdate(SQLUpdateStatement update, StatementContext context) {
        AliasScope scope = new AliasScope();
        List<TableRef> sources = new ArrayList<>(resolver.resolve(update.getFrom(), scope));
        TableRef target = writeTarget(update.getTableSource(), update.getFrom() != null, scope, sources);
        sources.addAll(resolver.resolve(update.getWhere(), scope));
        for (SQLUpdateSetItem item : update.getItems()) {
            sources.addAll(resolver.resolve(item.getValue(), scope));
        }
        // 更新会先读取被改写的行，目标表同时是自身的源表
        if (target != null && !sources.contains(target)) {
            sources.add(target);
        }
        return operation(OperationKind.UPDATE, target, sources, context);
    }

    private Operation classifyDelete(SQLDeleteStatement delete, StatementContext context) {
        AliasScope scope = new AliasScope();
        List<TableRef> sources = new ArrayList<>(resolver.resolve(delete.getFrom(), scope));
        TableRef target = writeTarget(delete.getTableSource(), delete.getFrom() != null, scope, sources);
        sources.addAll(resolver.resolve(delete.getWhere(), scope));
        return operation(OperationKind.DELETE, target, sources, context);
    }

    /**
     * 还原 UPDATE / DELETE 的写入目标。
     * UPDATE a FROM real_tbl a, ... 这类写法中 a 只是 FROM 里的别名，目标表是 real_tbl；
     * 别名不合法（如单字母）又查不到时，取 FROM 中的第一张表。
     */
    private TableRef writeTarget(SQLTableSource tableSource, boolean hasFrom, AliasScope scope, List<TableRef> sources) {
        if (tableSource instanceof SQLExprTableSource) {
            TableRef named = SqlNames.tableOf(tableSource);
            if (named == null) {
                return null;
            }
            if (hasFrom && named.getSchema() == null) {
                List<TableRef> bound = scope.lookup(named.getName());
                if (!bound.isEmpty()) {
                    return bound.get(0);
                }
                List<TableRef> roots = scope.roots();
                if (!validator.isValid(named.getName()) && !roots.isEmpty()) {
                    return roots.get(0);
                }
            }
            scope.bindTable(named);
            return named;
        }
        // UPDATE t1 JOIN t2 ON ... SET ...：连接中的表都计入源表，第一张为目标
        List<TableRef> joined = resolver.resolve(tableSource, scope);
        sources.addAll(joined);
        return joined.isEmpty() ? null : joined.get(0);
    }

    private TableRef firstTable(SQLTableSource source) {
        TableRef table = SqlNames.tableOf(source);
        if (table != null || source == null) {
            return table;
        }
        List<TableRef> resolved = resolver.resolve(source, new AliasScope());
        return resolved.isEmpty() ? null : resolved.get(0);
    }

    private TableRef droppedTable(SQLStatement statement) {
        List<SQLExprTableSource> tables = statement instanceof SQLDropTableStatement
                ? ((SQLDropTableStatement) statement).getTableSources()
                : ((SQLDropViewStatement) statement).getTableSources();
        return tables.isEmpty() ? null : SqlNames.tableOf(tables.get(0));
    }

    /**
     * 需要目标表却取不到时降级为 OTHER，源表保留
     */
    private Operation operation(OperationKind kind, TableRef target, List<TableRef> sources, StatementContext context) {
        if (kind.requiresTarget() && target == null) {
            log.debug("第 {} 行 {} 语句未识别出目标表, 按 OTHER 处理", context.getLineNumber(), kind);
            kind = OperationKind.OTHER;
        }
        return new Operation(kind, target, sources, context.getLineNumber(), context.getRawText());
    }
}
