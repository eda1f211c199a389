package com.afsun.tablelineage.core;

import com.afsun.tablelineage.core.exceptions.InvalidScriptException;

/**
 * 表级血缘抽取入口
 *
 * @author afsun
 */
public interface SqlLineageExtractor {

    /**
     * 抽取脚本的表级血缘，单条语句解析失败只记录警告
     *
     * @param sql     SQL脚本文本
     * @param dialect SQL方言
     * @return 抽取结果
     * @throws InvalidScriptException 脚本为空或切分不出任何语句
     */
    LineageResult extract(String sql, SqlDialect dialect);

    /**
     * 按文本特征识别方言后抽取
     */
    LineageResult extract(String sql);
}
