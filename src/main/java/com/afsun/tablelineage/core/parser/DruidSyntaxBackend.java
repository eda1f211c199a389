package com.afsun.tablelineage.core.parser;

import com.afsun.tablelineage.core.SqlDialect;
import com.afsun.tablelineage.core.util.SparkSqlRewriter;
import com.afsun.tablelineage.core.util.SqlScriptUtils;
import com.afsun.tablelineage.core.util.TeradataSqlRewriter;
import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.parser.ParserException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 基于 Druid 的解析后端。
 * 先做方言改写，再按 {@link SqlDialect#getParserDbTypes()} 的顺序尝试解析，第一个恰好得到一条语句的结果生效。
 *
 * @author afsun
 * @date 2025-12-02日 14:30
 */
@Slf4j
public class DruidSyntaxBackend implements SqlSyntaxBackend {

    private final Map<SqlDialect, SqlDialectRewriter> rewriters = new EnumMap<>(SqlDialect.class);

    public DruidSyntaxBackend() {
        SqlDialectRewriter spark = new SparkSqlRewriter();
        rewriters.put(SqlDialect.TERADATA, new TeradataSqlRewriter());
        rewriters.put(SqlDialect.SPARK, spark);
        rewriters.put(SqlDialect.SPARK2, spark);
    }

    @Override
    public ParseOutcome parse(String sql, SqlDialect dialect) {
        if (StringUtils.isBlank(sql)) {
            return ParseOutcome.failure("空语句");
        }
        RewrittenSql rewritten = rewriters.get(dialect).rewrite(sql);
        String reason = null;
        for (DbType dbType : dialect.getParserDbTypes()) {
            try {
                List<SQLStatement> statements = SQLUtils.parseStatements(rewritten.getSql(), dbType);
                if (statements.size() == 1) {
                    log.debug("Druid[{}]解析成功: {}", dbType, SqlScriptUtils.shortSql(rewritten.getSql()));
                    return ParseOutcome.success(statements, dbType, rewritten.isTemporary());
                }
                // 切分后的单条语句被拆成多条，说明该解析器没有识别完整语法
                if (statements.size() > 1 && reason == null) {
                    reason = "语句被 " + dbType + " 解析器拆分为 " + statements.size() + " 条";
                }
                log.debug("Druid[{}]解析结果为 {} 条语句, 尝试下一个解析器", dbType, statements.size());
            } catch (ParserException e) {
                if (reason == null) {
                    reason = firstLine(e.getMessage());
                }
                log.debug("Druid[{}]解析失败: {}", dbType, e.getMessage());
            } catch (RuntimeException | StackOverflowError e) {
                if (reason == null) {
                    reason = e.getClass().getSimpleName() + ": " + firstLine(e.getMessage());
                }
                log.debug("Druid[{}]解析异常", dbType, e);
            }
        }
        return ParseOutcome.failure(reason == null ? "无法识别的语句" : reason);
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "未知错误";
        }
        int nl = message.indexOf('\n');
        return StringUtils.abbreviate(nl < 0 ? message : message.substring(0, nl), 200);
    }
}
