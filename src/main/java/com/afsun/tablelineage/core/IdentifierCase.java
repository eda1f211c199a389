package com.afsun.tablelineage.core;

import java.util.Locale;

/**
 * 表名大小写规范
 * 血缘结果中的表名按该规范归一后再去重
 *
 * @author afsun
 * @date 2025-12-01日 14:20
 */
public enum IdentifierCase {

    /**
     * 保留脚本中的原始写法
     */
    PRESERVE,

    /**
     * 统一转大写（Teradata 习惯）
     */
    UPPER,

    /**
     * 统一转小写
     */
    LOWER;

    public String apply(String identifier) {
        if (identifier == null) {
            return null;
        }
        switch (this) {
            case UPPER:
                return identifier.toUpperCase(Locale.ROOT);
            case LOWER:
                return identifier.toLowerCase(Locale.ROOT);
            default:
                return identifier;
        }
    }
}
