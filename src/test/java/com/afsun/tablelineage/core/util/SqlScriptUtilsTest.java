package com.afsun.tablelineage.core.util;

import com.afsun.tablelineage.core.SqlSegment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 语句切分与去注释测试
 */
class SqlScriptUtilsTest {

    @Test
    void testSemicolonInsideLiteralAndParensDoesNotSplit() {
        String sql = "SELECT ';' AS sep FROM src_tbl WHERE id IN (SELECT id FROM x_tbl; );\nSELECT 2";
        List<SqlSegment> segments = SqlScriptUtils.segment(sql);

        assertEquals(2, segments.size());
        assertEquals("SELECT ';' AS sep FROM src_tbl WHERE id IN (SELECT id FROM x_tbl; )", segments.get(0).getText());
        assertEquals("SELECT 2", segments.get(1).getText());
    }

    @Test
    void testQuotedIdentifiersAreOpaque() {
        List<SqlSegment> segments = SqlScriptUtils.segment("SELECT \"a;b\", `c;d` FROM src_tbl;");
        assertEquals(1, segments.size());
        assertEquals("SELECT \"a;b\", `c;d` FROM src_tbl", segments.get(0).getText());
    }

    @Test
    void testTrailingFragmentWithoutTerminator() {
        List<SqlSegment> segments = SqlScriptUtils.segment("SELECT 1;   \n  SELECT 2  ");
        assertEquals(2, segments.size());
        assertEquals("SELECT 2", segments.get(1).getText());
    }

    @Test
    void testBlankStatementsAreSkipped() {
        assertTrue(SqlScriptUtils.segment(" ;; \n ; ").isEmpty());
        assertTrue(SqlScriptUtils.segment("-- only comment\n/* block */").isEmpty());
    }

    @Test
    void testStripCommentsKeepsLengthAndLines() {
        String sql = "SELECT 1 -- tail\n/* multi\nline */ FROM src_tbl";
        String cleaned = SqlScriptUtils.stripComments(sql);

        assertEquals(sql.length(), cleaned.length());
        assertEquals(sql.chars().filter(c -> c == '\n').count(), cleaned.chars().filter(c -> c == '\n').count());
        assertFalse(cleaned.contains("tail"));
        assertFalse(cleaned.contains("multi"));
        assertTrue(cleaned.endsWith("FROM src_tbl"));
    }

    @Test
    void testCommentMarkersInsideLiteralsAreKept() {
        String sql = "SELECT '-- not comment', '/* nor this */' FROM src_tbl";
        assertEquals(sql, SqlScriptUtils.stripComments(sql));
    }

    @Test
    void testHashIsNotComment() {
        String sql = "SELECT * FROM stage_db.tmp#orders";
        assertEquals(sql, SqlScriptUtils.stripComments(sql));
        assertEquals(sql, SqlScriptUtils.segment(sql).get(0).getText());
    }

    @Test
    void testLineNumbersPointToFirstNonBlankCharacter() {
        String sql = "SELECT 1;\n\n-- load target\nINSERT INTO tgt_tbl\nSELECT * FROM src_tbl;";
        List<SqlSegment> segments = SqlScriptUtils.segment(sql);

        assertEquals(1, segments.get(0).getLineNumber());
        assertEquals(4, segments.get(1).getLineNumber());
        assertEquals('I', sql.charAt(segments.get(1).getStartOffset()));
    }

    @Test
    void testUnbalancedCloseParenClampsDepth() {
        List<SqlSegment> segments = SqlScriptUtils.segment("SELECT ) FROM src_tbl; SELECT 2");
        assertEquals(2, segments.size());
    }

    @Test
    void testOffsetToLine() {
        String text = "a\nb\nc";
        assertEquals(1, SqlScriptUtils.offsetToLine(text, 0));
        assertEquals(2, SqlScriptUtils.offsetToLine(text, 2));
        assertEquals(3, SqlScriptUtils.offsetToLine(text, 4));
        assertEquals(1, SqlScriptUtils.offsetToLine(text, -5));
    }
}
