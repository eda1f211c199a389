package com.afsun.tablelineage.core.validate;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 表名校验用到的常量集合，启动时构造一次，只读
 *
 * @author afsun
 * @date 2025-12-02日 09:40
 */
public final class SqlKeywords {

    /**
     * 不可能是表名的保留字（含 Teradata 的 BT/ET/SEL 等缩写）
     */
    public static final Set<String> RESERVED = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
            "SELECT", "INSERT", "UPDATE", "DELETE", "CREATE", "DROP", "ALTER", "MERGE",
            "FROM", "JOIN", "LEFT", "RIGHT", "INNER", "OUTER", "WHERE", "AND", "OR", "IN", "EXISTS",
            "UNION", "CASE", "WHEN", "THEN", "ELSE", "END", "GROUP", "BY", "ORDER", "HAVING",
            "DISTINCT", "COALESCE", "NULL", "AS", "ON", "BT", "ET", "WITH", "DATA", "COMMIT",
            "PRESERVE", "ROWS", "SEL", "CHARACTERS", "TRIM", "SUBSTR", "SUBSTRING",
            "CURRENT_TIMESTAMP", "CAST")));

    /**
     * 单字母别名
     */
    public static final Set<String> SINGLE_LETTER_ALIASES;

    static {
        Set<String> letters = new LinkedHashSet<>();
        for (char c = 'A'; c <= 'Z'; c++) {
            letters.add(String.valueOf(c));
        }
        SINGLE_LETTER_ALIASES = Collections.unmodifiableSet(letters);
    }

    private SqlKeywords() {
    }
}
