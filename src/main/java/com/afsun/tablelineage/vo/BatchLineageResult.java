package com.afsun.tablelineage.vo;

import com.afsun.tablelineage.core.LineageResult;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 批量解析结果，按脚本名保持提交顺序
 *
 * @author afsun
 */
@Data
public class BatchLineageResult {

    private Map<String, LineageResult> results = new LinkedHashMap<>();

    /**
     * 脚本名 -> 失败原因
     */
    private Map<String, String> failures = new LinkedHashMap<>();

    private long parseMillis;
}
