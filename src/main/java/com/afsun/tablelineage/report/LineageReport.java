package com.afsun.tablelineage.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 单个脚本的血缘报告，按表组织数据流向
 *
 * @author afsun
 */
@Data
public class LineageReport {

    @JsonProperty("script_name")
    private String scriptName;

    @JsonProperty("parser_version")
    private String parserVersion;

    /**
     * 格式化并去重后的语句，表流向中的 operation 为这里的下标
     */
    private List<String> statements = new ArrayList<>();

    /**
     * 按表名排序
     */
    private Map<String, TableFlow> tables = new TreeMap<>();

    private List<String> warnings = new ArrayList<>();

    @Data
    public static class TableFlow {

        /**
         * 写入本表时读取的表
         */
        private List<FlowEdge> source = new ArrayList<>();

        /**
         * 读取本表后写入的表
         */
        private List<FlowEdge> target = new ArrayList<>();

        @JsonProperty("is_volatile")
        private boolean volatileTable;

        @JsonProperty("is_view")
        private boolean view;
    }

    @Data
    public static class FlowEdge {

        private String name;

        private List<Integer> operation = new ArrayList<>();

        public FlowEdge() {
        }

        public FlowEdge(String name) {
            this.name = name;
        }
    }
}
