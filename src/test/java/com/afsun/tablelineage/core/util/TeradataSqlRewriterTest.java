package com.afsun.tablelineage.core.util;

import com.afsun.tablelineage.core.parser.RewrittenSql;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Teradata SQL改写器测试
 */
class TeradataSqlRewriterTest {

    private TeradataSqlRewriter rewriter;

    @BeforeEach
    void setUp() {
        rewriter = new TeradataSqlRewriter();
    }

    @Test
    void testVolatileTableAsSelect() {
        RewrittenSql result = rewriter.rewrite("CREATE MULTISET VOLATILE TABLE tmp_orders AS "
                + "(SELECT id FROM src_orders) WITH DATA ON COMMIT PRESERVE ROWS");

        assertEquals("CREATE TABLE tmp_orders AS SELECT id FROM src_orders", result.getSql());
        assertTrue(result.isTemporary());
    }

    @Test
    void testVolatileTableWithPrimaryIndex() {
        RewrittenSql result = rewriter.rewrite("CREATE VOLATILE TABLE tmp_orders AS "
                + "(SELECT id FROM src_orders) WITH DATA PRIMARY INDEX (id) ON COMMIT PRESERVE ROWS");

        assertEquals("CREATE TABLE tmp_orders AS SELECT id FROM src_orders", result.getSql());
        assertTrue(result.isTemporary());
    }

    @Test
    void testPermanentTableKeepsFlagOff() {
        RewrittenSql result = rewriter.rewrite("CREATE TABLE tgt_orders (id INTEGER) PRIMARY INDEX (id)");

        assertEquals("CREATE TABLE tgt_orders (id INTEGER)", result.getSql());
        assertFalse(result.isTemporary());
    }

    @Test
    void testCopyTableWithData() {
        RewrittenSql result = rewriter.rewrite("CREATE TABLE bak_orders AS src_orders WITH DATA");
        assertEquals("CREATE TABLE bak_orders AS SELECT * FROM src_orders", result.getSql());
    }

    @Test
    void testSelAbbreviationOutsideLiterals() {
        RewrittenSql result = rewriter.rewrite("SEL id FROM src_orders WHERE note = 'SEL'");
        assertEquals("SELECT id FROM src_orders WHERE note = 'SEL'", result.getSql());
    }

    @Test
    void testLockingPrefixRemoved() {
        RewrittenSql result = rewriter.rewrite("LOCKING ROW FOR ACCESS SELECT * FROM src_orders");
        assertEquals("SELECT * FROM src_orders", result.getSql());
    }

    @Test
    void testVendorUpdateFromMovesFromAfterSet() {
        RewrittenSql result = rewriter.rewrite("UPDATE tg FROM target_tbl tg, source_tbl src "
                + "SET amount = src.amount WHERE tg.id = src.id");

        assertEquals("UPDATE tg SET amount = src.amount FROM target_tbl tg, source_tbl src WHERE tg.id = src.id",
                result.getSql());
    }

    @Test
    void testReplaceView() {
        RewrittenSql result = rewriter.rewrite("REPLACE VIEW v_orders AS SELECT * FROM src_orders");
        assertEquals("CREATE OR REPLACE VIEW v_orders AS SELECT * FROM src_orders", result.getSql());
    }

    @Test
    void testDeleteAll() {
        assertEquals("DELETE FROM stage_orders", rewriter.rewrite("DEL FROM stage_orders ALL").getSql());
        assertEquals("DELETE FROM stage_orders", rewriter.rewrite("DELETE stage_orders").getSql());
    }

    @Test
    void testInsertWithClauseMovedInFront() {
        RewrittenSql result = rewriter.rewrite(
                "INSERT INTO tgt_tbl WITH recent_src AS (SELECT * FROM src_tbl) SELECT * FROM recent_src");

        assertEquals("WITH recent_src AS (SELECT * FROM src_tbl) INSERT INTO tgt_tbl SELECT * FROM recent_src",
                result.getSql());
    }

    @Test
    void testCastFormatRemoved() {
        assertEquals("SELECT CAST(dt AS DATE) AS load_dt FROM src_tbl",
                rewriter.rewrite("SELECT CAST(dt AS DATE FORMAT 'YYYY-MM-DD') AS load_dt FROM src_tbl").getSql());
        assertEquals("SELECT dt FROM src_tbl WHERE dt = '2024-01-01'",
                rewriter.rewrite("SELECT dt (FORMAT 'YYYY-MM-DD') FROM src_tbl WHERE dt = '2024-01-01'").getSql());
    }

    @Test
    void testSampleRemoved() {
        assertEquals("SELECT id FROM src_tbl", rewriter.rewrite("SELECT id FROM src_tbl SAMPLE 100").getSql());
        assertEquals("SELECT id FROM sample_tbl", rewriter.rewrite("SELECT id FROM sample_tbl SAMPLE 0.25, 0.25").getSql());
    }

    @Test
    void testQualifyRemoved() {
        RewrittenSql result = rewriter.rewrite("SELECT id FROM src_tbl "
                + "QUALIFY ROW_NUMBER() OVER (PARTITION BY id ORDER BY ts DESC) = 1 ORDER BY id");
        assertEquals("SELECT id FROM src_tbl ORDER BY id", result.getSql());

        RewrittenSql nested = rewriter.rewrite("SELECT * FROM (SELECT id FROM src_tbl "
                + "QUALIFY RANK() OVER (ORDER BY id) = 1) ranked");
        assertEquals("SELECT * FROM (SELECT id FROM src_tbl) ranked", nested.getSql());
    }

    @Test
    void testSelExpandedOnlyWhereQueryStarts() {
        assertEquals("SELECT id AS sel FROM src_tbl", rewriter.rewrite("SELECT id AS sel FROM src_tbl").getSql());
        assertEquals("SELECT sel, id FROM src_tbl", rewriter.rewrite("SELECT sel, id FROM src_tbl").getSql());
        assertEquals("INSERT INTO tgt_tbl SELECT * FROM src_tbl",
                rewriter.rewrite("INS INTO tgt_tbl SEL * FROM src_tbl").getSql());
        assertEquals("WITH recent_src AS (SELECT id FROM src_tbl) SELECT * FROM recent_src",
                rewriter.rewrite("WITH recent_src AS (SEL id FROM src_tbl) SEL * FROM recent_src").getSql());
        assertEquals("SELECT id FROM src_tbl UNION ALL SELECT id FROM bak_tbl",
                rewriter.rewrite("SEL id FROM src_tbl UNION ALL SEL id FROM bak_tbl").getSql());
    }

    @Test
    void testPlainSqlUnchanged() {
        String sql = "INSERT INTO tgt_orders SELECT * FROM src_orders";
        RewrittenSql result = rewriter.rewrite(sql);
        assertEquals(sql, result.getSql());
        assertFalse(result.isTemporary());
    }
}
