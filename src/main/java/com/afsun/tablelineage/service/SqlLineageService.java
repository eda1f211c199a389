package com.afsun.tablelineage.service;

import com.afsun.tablelineage.core.LineageResult;
import com.afsun.tablelineage.report.LineageReport;
import com.afsun.tablelineage.vo.BatchLineageResult;

import java.util.Map;

public interface SqlLineageService {

    /**
     * @param dialectTag 方言标识，为空时按脚本内容识别
     */
    LineageResult extract(String sql, String dialectTag);

    LineageReport report(String scriptName, String sql, String dialectTag);

    /**
     * 并发解析多个脚本，单个脚本的异常记录在 failures 中
     *
     * @param scripts 脚本名 -> 脚本内容
     */
    BatchLineageResult extractBatch(Map<String, String> scripts, String dialectTag);
}
