package com.afsun.tablelineage.core;

/**
 * 语句操作类型
 *
 * @author afsun
 */
public enum OperationKind {
    SELECT,
    INSERT,
    UPDATE,
    DELETE,
    CREATE,
    CREATE_VOLATILE,
    CREATE_VIEW,
    DROP,
    ALTER,
    MERGE,
    OTHER;

    /**
     * 除 SELECT / OTHER 外都必须有目标表
     */
    public boolean requiresTarget() {
        return this != SELECT && this != OTHER;
    }

    /**
     * 目标表是否计入脚本的目标表集合
     */
    public boolean countsAsTarget() {
        switch (this) {
            case CREATE_VOLATILE:
            case CREATE_VIEW:
            case INSERT:
            case UPDATE:
            case DELETE:
            case MERGE:
                return true;
            default:
                return false;
        }
    }
}
