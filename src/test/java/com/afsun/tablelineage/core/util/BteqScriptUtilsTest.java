package com.afsun.tablelineage.core.util;

import com.afsun.tablelineage.core.SqlSegment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BTEQ 脚本抽取测试
 */
class BteqScriptUtilsTest {

    private static final String SCRIPT = "#!/bin/bash\n"
            + "echo start\n"
            + "bteq <<EOF\n"
            + ".LOGON tdpid/etl_user,secret;\n"
            + "BT;\n"
            + "INSERT INTO tgt_orders SELECT * FROM src_orders;\n"
            + "ET;\n"
            + ".QUIT\n"
            + "EOF\n"
            + "echo done\n";

    @Test
    void testExtractKeepsOnlySqlInsideBlock() {
        String sql = BteqScriptUtils.extractSql(SCRIPT);

        assertTrue(sql.contains("INSERT INTO tgt_orders SELECT * FROM src_orders;"));
        assertFalse(sql.contains("LOGON"));
        assertFalse(sql.contains("echo"));
        assertFalse(sql.contains("BT;"));
        assertFalse(sql.contains("EOF"));
    }

    @Test
    void testExtractPreservesLineNumbers() {
        String sql = BteqScriptUtils.extractSql(SCRIPT);

        assertEquals(SCRIPT.chars().filter(c -> c == '\n').count(), sql.chars().filter(c -> c == '\n').count());
        List<SqlSegment> segments = SqlScriptUtils.segment(sql);
        assertEquals(1, segments.size());
        assertEquals(6, segments.get(0).getLineNumber());
    }

    @Test
    void testQuotedDelimiter() {
        String script = "bteq << 'END_SQL' > run.log\nSELECT * FROM src_orders;\nEND_SQL\n";
        assertTrue(BteqScriptUtils.containsBteqBlock(script));
        assertEquals("\nSELECT * FROM src_orders;\n\n", BteqScriptUtils.extractSql(script));
    }

    @Test
    void testPlainSqlOnlyLosesCommands() {
        String sql = BteqScriptUtils.extractSql("SELECT 1;\n.LOGON tdpid/etl_user,secret;\nSELECT 2;");
        assertEquals("SELECT 1;\n\nSELECT 2;", sql);
    }

    @Test
    void testIsBteqCommand() {
        assertTrue(BteqScriptUtils.isBteqCommand(".IF ERRORCODE <> 0 THEN .QUIT 8"));
        assertTrue(BteqScriptUtils.isBteqCommand("  ET;"));
        assertTrue(BteqScriptUtils.isBteqCommand("SLEEP 5"));
        assertFalse(BteqScriptUtils.isBteqCommand("ETL_JOB"));
        assertFalse(BteqScriptUtils.isBteqCommand("SELECT 1"));
        assertFalse(BteqScriptUtils.isBteqCommand("   "));
    }
}
