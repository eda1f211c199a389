package com.afsun.tablelineage.core.parser;

import com.afsun.tablelineage.core.Operation;
import com.afsun.tablelineage.core.OperationKind;
import com.afsun.tablelineage.core.SqlDialect;
import com.afsun.tablelineage.core.TableRef;
import com.afsun.tablelineage.core.resolver.AstTableReferenceResolver;
import com.afsun.tablelineage.core.validate.TableNameValidator;
import com.alibaba.druid.sql.ast.statement.SQLInsertStatement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 语句分类测试，语句先经过 Teradata 改写与解析
 */
class DefaultOperationClassifierTest {

    private DruidSyntaxBackend backend;
    private DefaultOperationClassifier classifier;

    @BeforeEach
    void setUp() {
        backend = new DruidSyntaxBackend();
        classifier = new DefaultOperationClassifier(new AstTableReferenceResolver(), TableNameValidator.defaults());
    }

    @Test
    void testVolatileCreateTableAsSelect() {
        Operation op = classify("CREATE VOLATILE TABLE tmp_orders AS (SELECT id FROM src_orders) "
                + "WITH DATA ON COMMIT PRESERVE ROWS");

        assertEquals(OperationKind.CREATE_VOLATILE, op.getKind());
        assertEquals("tmp_orders", op.getTarget().getName());
        assertEquals(Collections.singletonList("src_orders"), names(op.getSources()));
    }

    @Test
    void testPermanentCreateTableWithoutQuery() {
        Operation op = classify("CREATE TABLE tgt_orders (id INTEGER, amount DECIMAL(18,2))");

        assertEquals(OperationKind.CREATE, op.getKind());
        assertEquals("tgt_orders", op.getTarget().getName());
        assertTrue(op.getSources().isEmpty());
    }

    @Test
    void testInsertSelect() {
        Operation op = classify("INSERT INTO dw.tgt_orders SELECT o.id, cu.name FROM tmp_orders o "
                + "LEFT JOIN customers cu ON cu.id = o.cust_id");

        assertEquals(OperationKind.INSERT, op.getKind());
        assertEquals("dw.tgt_orders", op.getTarget().qualifiedName());
        assertEquals(Arrays.asList("tmp_orders", "customers"), names(op.getSources()));
    }

    @Test
    void testInsertValuesHasNoSources() {
        Operation op = classify("INSERT INTO audit_log (id, note) VALUES (1, 'done')");

        assertEquals(OperationKind.INSERT, op.getKind());
        assertTrue(op.getSources().isEmpty());
    }

    @Test
    void testVendorUpdateTargetsRealTable() {
        Operation op = classify("UPDATE tg FROM target_tbl tg, source_tbl src "
                + "SET amount = src.amount WHERE tg.id = src.id");

        assertEquals(OperationKind.UPDATE, op.getKind());
        assertEquals(TableRef.of("target_tbl"), op.getTarget());
        assertEquals(Arrays.asList("target_tbl", "source_tbl"), names(op.getSources()));
    }

    @Test
    void testUpdateWithSubqueryAppendsTarget() {
        Operation op = classify("UPDATE acct SET status = 'CLOSED' WHERE id IN (SELECT acct_id FROM closed_accts)");

        assertEquals(TableRef.of("acct"), op.getTarget());
        assertEquals(Arrays.asList("closed_accts", "acct"), names(op.getSources()));
    }

    @Test
    void testDeleteWithExists() {
        Operation op = classify("DELETE FROM stage_orders WHERE EXISTS "
                + "(SELECT 1 FROM done_orders dn WHERE dn.id = stage_orders.id)");

        assertEquals(OperationKind.DELETE, op.getKind());
        assertEquals(TableRef.of("stage_orders"), op.getTarget());
        assertEquals(Collections.singletonList("done_orders"), names(op.getSources()));
    }

    @Test
    void testDeleteAllAbbreviation() {
        Operation op = classify("DEL FROM stage_orders ALL");

        assertEquals(OperationKind.DELETE, op.getKind());
        assertEquals(TableRef.of("stage_orders"), op.getTarget());
        assertTrue(op.getSources().isEmpty());
    }

    @Test
    void testDropTable() {
        Operation op = classify("DROP TABLE old_orders");

        assertEquals(OperationKind.DROP, op.getKind());
        assertEquals(TableRef.of("old_orders"), op.getTarget());
        assertTrue(op.getSources().isEmpty());
    }

    @Test
    void testReplaceView() {
        Operation op = classify("REPLACE VIEW v_orders AS SELECT id FROM tgt_orders");

        assertEquals(OperationKind.CREATE_VIEW, op.getKind());
        assertEquals(TableRef.of("v_orders"), op.getTarget());
        assertEquals(Collections.singletonList("tgt_orders"), names(op.getSources()));
    }

    @Test
    void testSelectWithCte() {
        Operation op = classify("WITH base AS (SELECT id FROM src_orders) SELECT * FROM base");

        assertEquals(OperationKind.SELECT, op.getKind());
        assertNull(op.getTarget());
        assertEquals(Collections.singletonList("src_orders"), names(op.getSources()));
    }

    @Test
    void testSelAbbreviation() {
        Operation op = classify("SEL id FROM src_orders");

        assertEquals(OperationKind.SELECT, op.getKind());
        assertEquals(Collections.singletonList("src_orders"), names(op.getSources()));
    }

    @Test
    void testMissingTargetDegradesToOther() {
        Operation op = classifier.classify(new SQLInsertStatement(), new StatementContext(7, "INSERT", false));

        assertEquals(OperationKind.OTHER, op.getKind());
        assertNull(op.getTarget());
        assertEquals(7, op.getLineNumber());
    }

    @Test
    void testInsertWithClauseAfterTarget() {
        Operation op = classify("INSERT INTO tgt_tbl WITH recent_src AS (SELECT * FROM src_tbl) SELECT * FROM recent_src");

        assertEquals(OperationKind.INSERT, op.getKind());
        assertEquals("tgt_tbl", op.getTarget().getName());
        assertEquals(Collections.singletonList("src_tbl"), names(op.getSources()));
    }

    @Test
    void testQualifyClauseKeepsSingleOperation() {
        ParseOutcome outcome = backend.parse("INSERT INTO tgt_tbl SELECT id FROM src_tbl "
                + "QUALIFY ROW_NUMBER() OVER (PARTITION BY id ORDER BY ts DESC) = 1", SqlDialect.TERADATA);

        assertTrue(outcome.isSuccess(), outcome.getFailureReason());
        assertEquals(1, outcome.getStatements().size());
        Operation op = classifier.classify(outcome.getStatements().get(0), new StatementContext(1, "", false));
        assertEquals(Collections.singletonList("src_tbl"), names(op.getSources()));
        assertNull(op.getSources().get(0).getAlias());
    }

    private Operation classify(String sql) {
        ParseOutcome outcome = backend.parse(sql, SqlDialect.TERADATA);
        assertTrue(outcome.isSuccess(), outcome.getFailureReason());
        return classifier.classify(outcome.getStatements().get(0),
                new StatementContext(1, sql, outcome.isTemporary()));
    }

    private static List<String> names(List<TableRef> refs) {
        return refs.stream().map(TableRef::getName).collect(Collectors.toList());
    }
}
