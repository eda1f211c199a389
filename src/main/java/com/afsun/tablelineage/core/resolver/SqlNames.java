package com.afsun.tablelineage.core.resolver;

import com.afsun.tablelineage.core.TableRef;
import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.SQLExpr;
import com.alibaba.druid.sql.ast.expr.SQLIdentifierExpr;
import com.alibaba.druid.sql.ast.expr.SQLPropertyExpr;
import com.alibaba.druid.sql.ast.statement.SQLExprTableSource;
import com.alibaba.druid.sql.ast.statement.SQLTableSource;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Druid 名称节点与 {@link TableRef} 之间的转换
 *
 * @author afsun
 */
public final class SqlNames {

    private SqlNames() {
    }

    /**
     * 取表名表达式的文本，a / a.b / a.b.c；非名称表达式返回 null
     */
    public static String nameOf(SQLExpr expr) {
        if (expr instanceof SQLIdentifierExpr) {
            return ((SQLIdentifierExpr) expr).getName();
        }
        if (expr instanceof SQLPropertyExpr) {
            SQLPropertyExpr property = (SQLPropertyExpr) expr;
            String owner = nameOf(property.getOwner());
            return owner == null ? null : owner + "." + property.getName();
        }
        return null;
    }

    /**
     * 按 owner / name 逐段取出名称，引号内的点号不会切分；非名称表达式返回空列表
     */
    public static List<String> partsOf(SQLExpr expr) {
        if (expr instanceof SQLIdentifierExpr) {
            List<String> parts = new ArrayList<>();
            parts.add(((SQLIdentifierExpr) expr).getName());
            return parts;
        }
        if (expr instanceof SQLPropertyExpr) {
            SQLPropertyExpr property = (SQLPropertyExpr) expr;
            List<String> parts = partsOf(property.getOwner());
            if (parts.isEmpty()) {
                return parts;
            }
            parts.add(property.getName());
            return parts;
        }
        return new ArrayList<>();
    }

    /**
     * 物理表数据源转换为 TableRef，其他类型返回 null
     */
    public static TableRef tableOf(SQLTableSource source) {
        if (!(source instanceof SQLExprTableSource)) {
            return null;
        }
        SQLExprTableSource table = (SQLExprTableSource) source;
        List<String> parts = partsOf(table.getExpr());
        return parts.isEmpty() ? null : TableRef.of(parts, normalizeAlias(table.getAlias()));
    }

    public static TableRef tableOf(SQLExpr nameExpr) {
        List<String> parts = partsOf(nameExpr);
        return parts.isEmpty() ? null : TableRef.of(parts, null);
    }

    public static String normalizeAlias(String alias) {
        if (StringUtils.isBlank(alias)) {
            return null;
        }
        return SQLUtils.normalize(alias.trim());
    }
}
