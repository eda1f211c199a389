package com.afsun.tablelineage.core;

import com.afsun.tablelineage.core.resolver.AstTableReferenceResolver;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 抽取引擎参数
 *
 * @author afsun
 */
@Getter
@Builder
@ToString
public class ExtractorOptions {

    /**
     * 未指定方言且无法识别时使用
     */
    @Builder.Default
    private final SqlDialect defaultDialect = SqlDialect.TERADATA;

    @Builder.Default
    private final IdentifierCase identifierCase = IdentifierCase.PRESERVE;

    /**
     * AST 解析失败后是否尝试正则兜底
     */
    @Builder.Default
    private final boolean regexFallbackEnabled = false;

    @Builder.Default
    private final int maxResolveDepth = AstTableReferenceResolver.DEFAULT_MAX_DEPTH;

    public static ExtractorOptions defaults() {
        return ExtractorOptions.builder().build();
    }
}
