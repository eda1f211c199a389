package com.afsun.tablelineage.core;

import com.alibaba.druid.sql.SQLUtils;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 解析出的表引用
 * 身份只由 (schema, name) 决定，alias 与 subquery 仅是解析过程中的元信息
 *
 * @author afsun
 * @date 2025-12-01日 14:32
 */
@Getter
public final class TableRef {

    private final String schema;
    private final String name;
    private final String alias;

    /**
     * 是否为子查询占位，只在别名作用域内使用，不会进入最终的源表/目标表集合
     */
    private final boolean subquery;

    private TableRef(String schema, String name, String alias, boolean subquery) {
        this.schema = schema;
        this.name = name;
        this.alias = alias;
        this.subquery = subquery;
    }

    /**
     * 解析 "table" / "schema.table" / "db.schema.table"，三段式时前两段合并为 schema。
     * 只在引号之外按点号切分，"my.tbl" 是一个完整的表名
     */
    public static TableRef of(String rawName, String alias) {
        if (StringUtils.isBlank(rawName)) {
            throw new IllegalArgumentException("表名不能为空");
        }
        return of(splitQualified(rawName.trim()), alias);
    }

    /**
     * 由已切分好的名称片段构造，最后一段为表名
     */
    public static TableRef of(List<String> parts, String alias) {
        if (parts == null || parts.isEmpty() || StringUtils.isBlank(parts.get(parts.size() - 1))) {
            throw new IllegalArgumentException("表名不能为空");
        }
        String name = unquote(parts.get(parts.size() - 1));
        String schema = null;
        if (parts.size() > 1) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < parts.size() - 1; i++) {
                if (i > 0) {
                    sb.append('.');
                }
                sb.append(unquote(parts.get(i)));
            }
            schema = sb.toString();
        }
        return new TableRef(schema, name, unquote(alias), false);
    }

    public static TableRef of(String rawName) {
        return of(rawName, null);
    }

    public static TableRef subquery(String alias) {
        return new TableRef(null, alias, alias, true);
    }

    /**
     * 带 schema 的完整表名，保留原始大小写
     */
    public String qualifiedName() {
        return schema == null ? name : schema + "." + name;
    }

    public String normalizedName(IdentifierCase identifierCase) {
        return identifierCase.apply(qualifiedName());
    }

    private static List<String> splitQualified(String rawName) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < rawName.length(); i++) {
            char c = rawName.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '`') {
                quote = c;
            } else if (c == '.') {
                parts.add(current.toString());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        parts.add(current.toString());
        return parts;
    }

    private static String unquote(String part) {
        if (part == null) {
            return null;
        }
        String normalized = SQLUtils.normalize(part.trim());
        return StringUtils.isEmpty(normalized) ? null : normalized;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TableRef)) {
            return false;
        }
        TableRef that = (TableRef) o;
        return Objects.equals(schema, that.schema) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, name);
    }

    @Override
    public String toString() {
        return alias == null ? qualifiedName() : qualifiedName() + " " + alias;
    }
}
