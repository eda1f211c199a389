package com.afsun.tablelineage.core;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 表引用名称解析测试
 */
class TableRefTest {

    @Test
    void testSchemaAndName() {
        TableRef ref = TableRef.of("dw.tgt_orders", "tg");

        assertEquals("dw", ref.getSchema());
        assertEquals("tgt_orders", ref.getName());
        assertEquals("tg", ref.getAlias());
    }

    @Test
    void testThreePartNameMergesSchema() {
        TableRef ref = TableRef.of("prod.dw.tgt_orders");

        assertEquals("prod.dw", ref.getSchema());
        assertEquals("prod.dw.tgt_orders", ref.qualifiedName());
    }

    @Test
    void testDotInsideQuotesIsNotSplit() {
        TableRef ref = TableRef.of("\"my.tbl\"");

        assertNull(ref.getSchema());
        assertEquals("my.tbl", ref.getName());

        TableRef qualified = TableRef.of("sales.`my.tbl`");
        assertEquals("sales", qualified.getSchema());
        assertEquals("my.tbl", qualified.getName());
    }

    @Test
    void testFromParts() {
        TableRef ref = TableRef.of(Arrays.asList("sales", "\"my.tbl\""), null);

        assertEquals("sales", ref.getSchema());
        assertEquals("my.tbl", ref.getName());
        assertEquals(TableRef.of("sales.\"my.tbl\""), ref);
    }

    @Test
    void testIdentityIgnoresAlias() {
        assertEquals(TableRef.of("src_orders", "so"), TableRef.of("src_orders", "s2"));
        assertThrows(IllegalArgumentException.class, () -> TableRef.of(" "));
    }
}
