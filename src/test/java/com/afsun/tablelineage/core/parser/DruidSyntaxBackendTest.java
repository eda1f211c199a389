package com.afsun.tablelineage.core.parser;

import com.afsun.tablelineage.core.SqlDialect;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 解析后端测试
 */
class DruidSyntaxBackendTest {

    private DruidSyntaxBackend backend;

    @BeforeEach
    void setUp() {
        backend = new DruidSyntaxBackend();
    }

    @Test
    void testSingleStatement() {
        ParseOutcome outcome = backend.parse("SEL id FROM src_tbl", SqlDialect.TERADATA);

        assertTrue(outcome.isSuccess());
        assertEquals(1, outcome.getStatements().size());
    }

    @Test
    void testSegmentSplitIntoSeveralStatementsFails() {
        ParseOutcome outcome = backend.parse("SELECT id FROM src_tbl SELECT id FROM other_tbl", SqlDialect.TERADATA);

        assertFalse(outcome.isSuccess());
        assertNotNull(outcome.getFailureReason());
    }

    @Test
    void testBlankStatementFails() {
        assertFalse(backend.parse("  ", SqlDialect.SPARK).isSuccess());
    }
}
