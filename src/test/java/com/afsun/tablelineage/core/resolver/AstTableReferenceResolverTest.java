package com.afsun.tablelineage.core.resolver;

import com.afsun.tablelineage.core.AliasScope;
import com.afsun.tablelineage.core.TableRef;
import com.afsun.tablelineage.core.exceptions.ResolutionDepthExceededException;
import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.statement.SQLSelect;
import com.alibaba.druid.sql.ast.statement.SQLSelectStatement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 表引用解析测试：自连接、集合运算、子查询、IN / EXISTS、CTE
 */
class AstTableReferenceResolverTest {

    private AstTableReferenceResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new AstTableReferenceResolver();
    }

    @Test
    void testSelfJoinYieldsTwoReferences() {
        List<TableRef> refs = resolve("SELECT o1.id FROM orders o1 JOIN orders o2 ON o1.parent_id = o2.id");

        assertEquals(Arrays.asList("orders", "orders"), names(refs));
        assertEquals("o1", refs.get(0).getAlias());
        assertEquals("o2", refs.get(1).getAlias());
    }

    @Test
    void testUnionResolvesBothBranches() {
        List<TableRef> refs = resolve("SELECT id FROM orders_2023 UNION ALL SELECT id FROM orders_2024");
        assertEquals(Arrays.asList("orders_2023", "orders_2024"), names(refs));
    }

    @Test
    void testSubqueryAliasIsNotATable() {
        List<TableRef> refs = resolve("SELECT sq.id FROM (SELECT id FROM raw_orders) sq JOIN customers cu ON cu.id = sq.id");

        assertEquals(Arrays.asList("raw_orders", "customers"), names(refs));
        assertTrue(refs.stream().noneMatch(TableRef::isSubquery));
    }

    @Test
    void testInAndExistsSubqueries() {
        List<TableRef> refs = resolve("SELECT id FROM orders WHERE cust_id IN (SELECT id FROM customers) "
                + "AND EXISTS (SELECT 1 FROM payments pay WHERE pay.order_id = orders.id)");

        assertEquals(Arrays.asList("orders", "customers", "payments"), names(refs));
    }

    @Test
    void testScalarSubqueryInSelectList() {
        List<TableRef> refs = resolve("SELECT id, (SELECT MAX(amount) FROM payments) AS max_amount FROM orders");
        assertEquals(Arrays.asList("orders", "payments"), names(refs));
    }

    @Test
    void testCteNamesAreNotTables() {
        List<TableRef> refs = resolve("WITH recent AS (SELECT id FROM orders), "
                + "top_recent AS (SELECT id FROM recent) "
                + "SELECT * FROM top_recent JOIN customers cu ON cu.id = top_recent.id");

        assertEquals(Arrays.asList("orders", "customers"), names(refs));
    }

    @Test
    void testSchemaQualifiedName() {
        TableRef ref = resolve("SELECT * FROM sales_db.orders ord").get(0);

        assertEquals("sales_db", ref.getSchema());
        assertEquals("orders", ref.getName());
        assertEquals("sales_db.orders", ref.qualifiedName());
    }

    @Test
    void testAliasIsBoundInScope() {
        AliasScope scope = new AliasScope();
        SQLSelectStatement statement = (SQLSelectStatement) SQLUtils.parseSingleStatement(
                "SELECT * FROM orders ord", DbType.mysql);
        resolver.resolve(statement.getSelect().getQueryBlock().getFrom(), scope);

        assertEquals(Collections.singletonList(TableRef.of("orders")), scope.lookup("ORD"));
    }

    @Test
    void testNullNodeYieldsNothing() {
        assertTrue(resolver.resolve(null, new AliasScope()).isEmpty());
    }

    @Test
    void testDepthLimit() {
        AstTableReferenceResolver shallow = new AstTableReferenceResolver(3);
        SQLSelect select = select("SELECT * FROM (SELECT * FROM (SELECT * FROM (SELECT * FROM deep_tbl) d3) d2) d1");

        assertThrows(ResolutionDepthExceededException.class, () -> shallow.resolve(select, new AliasScope()));
        assertEquals(Collections.singletonList("deep_tbl"), names(resolver.resolve(select, new AliasScope())));
    }

    @Test
    void testQuotedNameWithDotIsOneIdentifier() {
        List<TableRef> refs = resolve("SELECT * FROM `my.tbl` mt JOIN sales.`orders` so ON mt.id = so.id");

        assertNull(refs.get(0).getSchema());
        assertEquals("my.tbl", refs.get(0).getName());
        assertEquals("sales", refs.get(1).getSchema());
        assertEquals("orders", refs.get(1).getName());
    }

    private List<TableRef> resolve(String sql) {
        return resolver.resolve(select(sql), new AliasScope());
    }

    private static SQLSelect select(String sql) {
        return ((SQLSelectStatement) SQLUtils.parseSingleStatement(sql, DbType.mysql)).getSelect();
    }

    private static List<String> names(List<TableRef> refs) {
        return refs.stream().map(TableRef::getName).collect(Collectors.toList());
    }
}
