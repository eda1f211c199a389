package com.afsun.tablelineage.config;

import com.afsun.tablelineage.core.IdentifierCase;
import com.afsun.tablelineage.core.resolver.AstTableReferenceResolver;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 血缘抽取配置，前缀 sql.lineage
 *
 * @author afsun
 */
@Data
@ConfigurationProperties(prefix = "sql.lineage")
public class LineageProperties {

    /**
     * 未指定且无法识别方言时使用：teradata / spark / spark2
     */
    private String defaultDialect = "teradata";

    private IdentifierCase identifierCase = IdentifierCase.PRESERVE;

    private boolean regexFallbackEnabled = false;

    private int maxResolveDepth = AstTableReferenceResolver.DEFAULT_MAX_DEPTH;

    /**
     * 上传文件与文本的大小上限（字节）
     */
    private long maxFileSize = 10 * 1024 * 1024;

    /**
     * 批量解析线程数
     */
    private int batchParallelism = 4;
}
