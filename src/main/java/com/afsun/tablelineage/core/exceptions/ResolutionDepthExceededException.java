package com.afsun.tablelineage.core.exceptions;

/**
 * 表引用解析递归超过上限，只在引擎内部使用，最终转换为语句级警告
 *
 * @author afsun
 */
public class ResolutionDepthExceededException extends LineageException {

    public ResolutionDepthExceededException(int maxDepth) {
        super("DEPTH_EXCEEDED", "嵌套深度超过上限 " + maxDepth, "请拆分过深的子查询或调大 sql.lineage.max-resolve-depth");
    }
}
