package com.afsun.tablelineage.core.resolver;

import com.afsun.tablelineage.core.AliasScope;
import com.afsun.tablelineage.core.TableRef;
import com.alibaba.druid.sql.ast.SQLObject;

import java.util.List;

/**
 * 表引用解析器：递归收集 AST 节点下的物理表引用
 *
 * @author afsun
 */
public interface TableReferenceResolver {

    /**
     * 解析节点下引用的物理表，子查询展开为其自身的源表，结果不去重。
     * 无法识别的节点返回空列表而不是抛异常。
     *
     * @param node  AST 节点，可以为 null
     * @param scope 当前作用域，解析过程中登记的别名会写入该作用域
     * @return 按出现顺序排列的表引用
     */
    List<TableRef> resolve(SQLObject node, AliasScope scope);
}
