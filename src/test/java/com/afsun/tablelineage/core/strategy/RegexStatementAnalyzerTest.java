package com.afsun.tablelineage.core.strategy;

import com.afsun.tablelineage.core.Operation;
import com.afsun.tablelineage.core.OperationKind;
import com.afsun.tablelineage.core.SqlDialect;
import com.afsun.tablelineage.core.SqlSegment;
import com.afsun.tablelineage.core.TableRef;
import com.afsun.tablelineage.core.validate.TableNameValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 正则兜底策略测试
 */
class RegexStatementAnalyzerTest {

    private RegexStatementAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new RegexStatementAnalyzer(TableNameValidator.defaults());
    }

    @Test
    void testInsertWithUnsupportedClause() {
        Operation op = analyze("INS INTO tgt_orders SEL * FROM src_orders "
                + "QUALIFY ROW_NUMBER() OVER (PARTITION BY id ORDER BY ts DESC) = 1");

        assertEquals(OperationKind.INSERT, op.getKind());
        assertEquals(TableRef.of("tgt_orders"), op.getTarget());
        assertEquals(Collections.singletonList(TableRef.of("src_orders")), op.getSources());
    }

    @Test
    void testVolatileCreate() {
        Operation op = analyze("CREATE MULTISET VOLATILE TABLE tmp_orders AS (SELECT * FROM src_orders) WITH DATA");

        assertEquals(OperationKind.CREATE_VOLATILE, op.getKind());
        assertEquals(TableRef.of("tmp_orders"), op.getTarget());
        assertEquals(Collections.singletonList(TableRef.of("src_orders")), op.getSources());
    }

    @Test
    void testVendorUpdate() {
        Operation op = analyze("UPDATE tg FROM target_tbl tg, source_tbl src SET amount = 1");

        assertEquals(OperationKind.UPDATE, op.getKind());
        assertEquals(TableRef.of("target_tbl"), op.getTarget());
        assertTrue(op.getSources().contains(TableRef.of("target_tbl")));
    }

    @Test
    void testCteNamesExcluded() {
        Operation op = analyze("WITH base AS (SELECT id FROM src_orders) "
                + "SELECT * FROM base JOIN dim_region rg ON rg.id = base.id");

        assertEquals(OperationKind.SELECT, op.getKind());
        assertEquals(Arrays.asList("src_orders", "dim_region"),
                op.getSources().stream().map(TableRef::getName).collect(Collectors.toList()));
    }

    @Test
    void testMergeUsing() {
        Operation op = analyze("MERGE INTO dim_customer USING stg_customer ON (dim_customer.id = stg_customer.id) "
                + "WHEN MATCHED THEN UPDATE SET name = stg_customer.name");

        assertEquals(OperationKind.MERGE, op.getKind());
        assertEquals(TableRef.of("dim_customer"), op.getTarget());
        assertEquals(Collections.singletonList(TableRef.of("stg_customer")), op.getSources());
    }

    @Test
    void testUnrecognizedStatementFails() {
        StatementAnalysis analysis = analyzer.analyze(new SqlSegment("COLLECT STATISTICS ON tgt_orders COLUMN (id)", 0, 5),
                SqlDialect.TERADATA);

        assertFalse(analysis.isSuccess());
        assertTrue(analysis.getOperations().isEmpty());
        assertTrue(analysis.getWarning().render().startsWith("第 5 行语句解析失败"));
    }

    private Operation analyze(String sql) {
        StatementAnalysis analysis = analyzer.analyze(new SqlSegment(sql, 0, 1), SqlDialect.TERADATA);
        assertTrue(analysis.isSuccess());
        assertEquals(1, analysis.getOperations().size());
        return analysis.getOperations().get(0);
    }
}
