package com.afsun.tablelineage.core.util;

import com.afsun.tablelineage.core.parser.RewrittenSql;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Spark SQL改写器测试
 */
class SparkSqlRewriterTest {

    private SparkSqlRewriter rewriter;

    @BeforeEach
    void setUp() {
        rewriter = new SparkSqlRewriter();
    }

    @Test
    void testTemporaryViewBecomesView() {
        RewrittenSql result = rewriter.rewrite("CREATE OR REPLACE TEMPORARY VIEW v_orders AS SELECT * FROM orders");
        assertEquals("CREATE OR REPLACE VIEW v_orders AS SELECT * FROM orders", result.getSql());
        assertFalse(result.isTemporary());
    }

    @Test
    void testGlobalTempView() {
        RewrittenSql result = rewriter.rewrite("CREATE GLOBAL TEMP VIEW v_orders AS SELECT * FROM orders");
        assertEquals("CREATE VIEW v_orders AS SELECT * FROM orders", result.getSql());
    }

    @Test
    void testTemporaryTableIsFlagged() {
        RewrittenSql result = rewriter.rewrite("CREATE TEMPORARY TABLE tmp_orders AS SELECT * FROM orders");
        assertEquals("CREATE TABLE tmp_orders AS SELECT * FROM orders", result.getSql());
        assertTrue(result.isTemporary());
    }

    @Test
    void testCacheTableBecomesTemporaryCtas() {
        RewrittenSql result = rewriter.rewrite("CACHE TABLE cached_orders AS SELECT * FROM orders");
        assertEquals("CREATE TABLE cached_orders AS SELECT * FROM orders", result.getSql());
        assertTrue(result.isTemporary());
    }

    @Test
    void testInsertOverwriteGetsTableKeyword() {
        assertEquals("INSERT OVERWRITE TABLE sales_agg SELECT * FROM sales",
                rewriter.rewrite("INSERT OVERWRITE sales_agg SELECT * FROM sales").getSql());
        assertEquals("INSERT OVERWRITE TABLE sales_agg SELECT * FROM sales",
                rewriter.rewrite("INSERT OVERWRITE TABLE sales_agg SELECT * FROM sales").getSql());
    }

    @Test
    void testDataSourceClausesStripped() {
        String sql = rewriter.rewrite(
                "CREATE TABLE sales_copy USING parquet OPTIONS (path '/tmp/sales') AS SELECT * FROM sales").getSql();

        assertTrue(sql.startsWith("CREATE TABLE sales_copy"));
        assertTrue(sql.endsWith("AS SELECT * FROM sales"));
        assertFalse(sql.contains("USING"));
        assertFalse(sql.contains("OPTIONS"));
    }
}
