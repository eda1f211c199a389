package com.afsun.tablelineage.core.parser;

import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.ast.SQLStatement;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 解析后端的输出：成功时带 AST，失败时带原因
 *
 * @author afsun
 */
@Getter
public final class ParseOutcome {

    private final List<SQLStatement> statements;
    private final DbType dbType;
    private final boolean temporary;
    private final String failureReason;

    private ParseOutcome(List<SQLStatement> statements, DbType dbType, boolean temporary, String failureReason) {
        this.statements = statements;
        this.dbType = dbType;
        this.temporary = temporary;
        this.failureReason = failureReason;
    }

    public static ParseOutcome success(List<SQLStatement> statements, DbType dbType, boolean temporary) {
        return new ParseOutcome(Collections.unmodifiableList(statements), dbType, temporary, null);
    }

    public static ParseOutcome failure(String reason) {
        return new ParseOutcome(Collections.emptyList(), null, false, reason);
    }

    public boolean isSuccess() {
        return failureReason == null;
    }
}
