package com.afsun.tablelineage.core.resolver;

import com.afsun.tablelineage.core.AliasScope;
import com.afsun.tablelineage.core.TableRef;
import com.afsun.tablelineage.core.exceptions.ResolutionDepthExceededException;
import com.alibaba.druid.sql.ast.SQLExpr;
import com.alibaba.druid.sql.ast.SQLObject;
import com.alibaba.druid.sql.ast.expr.SQLBinaryOpExpr;
import com.alibaba.druid.sql.ast.expr.SQLExistsExpr;
import com.alibaba.druid.sql.ast.expr.SQLInSubQueryExpr;
import com.alibaba.druid.sql.ast.expr.SQLNotExpr;
import com.alibaba.druid.sql.ast.expr.SQLQueryExpr;
import com.alibaba.druid.sql.ast.statement.SQLExprTableSource;
import com.alibaba.druid.sql.ast.statement.SQLJoinTableSource;
import com.alibaba.druid.sql.ast.statement.SQLSelect;
import com.alibaba.druid.sql.ast.statement.SQLSelectGroupByClause;
import com.alibaba.druid.sql.ast.statement.SQLSelectItem;
import com.alibaba.druid.sql.ast.statement.SQLSelectQueryBlock;
import com.alibaba.druid.sql.ast.statement.SQLSubqueryTableSource;
import com.alibaba.druid.sql.ast.statement.SQLUnionQuery;
import com.alibaba.druid.sql.ast.statement.SQLWithSubqueryClause;
import com.alibaba.druid.sql.visitor.SQLASTVisitorAdapter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 Druid AST 的表引用解析器。
 * 按 {@link NodeCategory} 分派；FROM 子查询、IN / EXISTS / 标量子查询都在子作用域中解析，
 * 解析结果计入包含它的语句。递归深度超过上限时抛出 {@link ResolutionDepthExceededException}。
 *
 * @author afsun
 * @date 2025-12-03日 10:05
 */
@Slf4j
public class AstTableReferenceResolver implements TableReferenceResolver {

    public static final int DEFAULT_MAX_DEPTH = 128;

    private final int maxDepth;

    public AstTableReferenceResolver() {
        this(DEFAULT_MAX_DEPTH);
    }

    public AstTableReferenceResolver(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    @Override
    public List<TableRef> resolve(SQLObject node, AliasScope scope) {
        List<TableRef> refs = new ArrayList<>();
        resolveInto(node, scope, 0, refs);
        return refs;
    }

    private void resolveInto(SQLObject node, AliasScope scope, int depth, List<TableRef> out) {
        if (node == null) {
            return;
        }
        if (depth > maxDepth) {
            throw new ResolutionDepthExceededException(maxDepth);
        }
        switch (NodeCategory.of(node)) {
            case TABLE:
                resolveTable((SQLExprTableSource) node, scope, depth, out);
                break;
            case SUBQUERY_SOURCE:
                resolveSubquerySource((SQLSubqueryTableSource) node, scope, depth, out);
                break;
            case JOIN:
                SQLJoinTableSource join = (SQLJoinTableSource) node;
                resolveInto(join.getLeft(), scope, depth + 1, out);
                resolveInto(join.getRight(), scope, depth + 1, out);
                resolveInto(join.getCondition(), scope, depth + 1, out);
                break;
            case SET_OPERATION:
                SQLUnionQuery union = (SQLUnionQuery) node;
                resolveInto(union.getLeft(), scope, depth + 1, out);
                resolveInto(union.getRight(), scope, depth + 1, out);
                break;
            case SELECT:
                resolveSelect((SQLSelect) node, scope, depth, out);
                break;
            case WITH:
                resolveWith((SQLWithSubqueryClause) node, scope, depth, out);
                break;
            case QUERY_BLOCK:
                resolveQueryBlock((SQLSelectQueryBlock) node, scope, depth, out);
                break;
            case BOOLEAN:
                if (node instanceof SQLNotExpr) {
                    resolveInto(((SQLNotExpr) node).getExpr(), scope, depth + 1, out);
                } else {
                    SQLBinaryOpExpr binary = (SQLBinaryOpExpr) node;
                    resolveInto(binary.getLeft(), scope, depth + 1, out);
                    resolveInto(binary.getRight(), scope, depth + 1, out);
                }
                break;
            case SUBQUERY_PREDICATE:
                resolveSubqueryPredicate(node, scope, depth, out);
                break;
            default:
                resolveGeneric(node, scope, depth, out);
                break;
        }
    }

    private void resolveTable(SQLExprTableSource source, AliasScope scope, int depth, List<TableRef> out) {
        SQLExpr expr = source.getExpr();
        String name = SqlNames.nameOf(expr);
        if (name == null) {
            // 表函数等非名称数据源，只关心其中嵌套的查询
            resolveInto(expr, scope, depth + 1, out);
            return;
        }
        String alias = SqlNames.normalizeAlias(source.getAlias());
        if (scope.isCte(name)) {
            // CTE 查询体已在 WITH 处展开
            if (alias != null) {
                scope.bindSubquery(alias, scope.cteRoots(name));
            }
            return;
        }
        TableRef table = SqlNames.tableOf(source);
        scope.bindTable(table);
        out.add(table);
    }

    private void resolveSubquerySource(SQLSubqueryTableSource source, AliasScope scope, int depth, List<TableRef> out) {
        List<TableRef> roots = new ArrayList<>();
        resolveInto(source.getSelect(), scope.child(), depth + 1, roots);
        scope.bindSubquery(SqlNames.normalizeAlias(source.getAlias()), roots);
        out.addAll(roots);
    }

    private void resolveSelect(SQLSelect select, AliasScope scope, int depth, List<TableRef> out) {
        AliasScope selectScope = scope;
        SQLWithSubqueryClause with = select.getWithSubQuery();
        if (with != null) {
            selectScope = scope.child();
            resolveWith(with, selectScope, depth, out);
        }
        resolveInto(select.getQuery(), selectScope, depth + 1, out);
    }

    /**
     * 先声明名称再解析查询体，递归 CTE 引用自身时不会被当作物理表
     */
    private void resolveWith(SQLWithSubqueryClause with, AliasScope scope, int depth, List<TableRef> out) {
        for (SQLWithSubqueryClause.Entry entry : with.getEntries()) {
            String name = SqlNames.normalizeAlias(entry.getAlias());
            if (name == null) {
                continue;
            }
            scope.declareCte(name);
            List<TableRef> roots = new ArrayList<>();
            resolveInto(entry.getSubQuery(), scope.child(), depth + 1, roots);
            scope.bindCte(name, roots);
            out.addAll(roots);
        }
    }

    private void resolveQueryBlock(SQLSelectQueryBlock block, AliasScope scope, int depth, List<TableRef> out) {
        AliasScope blockScope = scope.child();
        resolveInto(block.getFrom(), blockScope, depth + 1, out);
        for (SQLSelectItem item : block.getSelectList()) {
            resolveInto(item.getExpr(), blockScope, depth + 1, out);
        }
        resolveInto(block.getWhere(), blockScope, depth + 1, out);
        SQLSelectGroupByClause groupBy = block.getGroupBy();
        if (groupBy != null) {
            resolveInto(groupBy.getHaving(), blockScope, depth + 1, out);
        }
    }

    private void resolveSubqueryPredicate(SQLObject node, AliasScope scope, int depth, List<TableRef> out) {
        if (node instanceof SQLInSubQueryExpr) {
            SQLInSubQueryExpr in = (SQLInSubQueryExpr) node;
            resolveInto(in.getExpr(), scope, depth + 1, out);
            resolveInto(in.getSubQuery(), scope.child(), depth + 1, out);
        } else if (node instanceof SQLExistsExpr) {
            resolveInto(((SQLExistsExpr) node).getSubQuery(), scope.child(), depth + 1, out);
        } else {
            resolveInto(((SQLQueryExpr) node).getSubQuery(), scope.child(), depth + 1, out);
        }
    }

    /**
     * 没有专门规则的节点：用访问者找出其中的查询与数据源，再回到分派逻辑
     */
    private void resolveGeneric(SQLObject node, AliasScope scope, int depth, List<TableRef> out) {
        SQLASTVisitorAdapter visitor = new SQLASTVisitorAdapter() {
            @Override
            public boolean visit(SQLSelect x) {
                resolveInto(x, scope.child(), depth + 1, out);
                return false;
            }

            @Override
            public boolean visit(SQLSelectQueryBlock x) {
                resolveInto(x, scope, depth + 1, out);
                return false;
            }

            @Override
            public boolean visit(SQLUnionQuery x) {
                resolveInto(x, scope, depth + 1, out);
                return false;
            }

            @Override
            public boolean visit(SQLExprTableSource x) {
                resolveInto(x, scope, depth + 1, out);
                return false;
            }

            @Override
            public boolean visit(SQLSubqueryTableSource x) {
                resolveInto(x, scope, depth + 1, out);
                return false;
            }

            @Override
            public boolean visit(SQLJoinTableSource x) {
                resolveInto(x, scope, depth + 1, out);
                return false;
            }
        };
        try {
            node.accept(visitor);
        } catch (ClassCastException e) {
            // 部分方言节点只接受本方言的访问者，按无血缘贡献处理
            log.debug("节点 {} 不支持通用访问者: {}", node.getClass().getSimpleName(), e.getMessage());
        }
    }
}
