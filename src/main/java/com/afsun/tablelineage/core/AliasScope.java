package com.afsun.tablelineage.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 查询块级作用域：维护 FROM/JOIN 中的别名到表的映射以及可见的 CTE 名称。
 * 子查询使用 {@link #child()} 开启新的作用域，解析完成后即丢弃；查找时会沿父作用域向上（关联子查询）。
 *
 * @author afsun
 */
public class AliasScope {

    private final AliasScope parent;

    /**
     * 别名(大写) -> 绑定，保持 FROM 中出现顺序
     */
    private final Map<String, Binding> bindings = new LinkedHashMap<>();

    /**
     * CTE 名称(大写) -> CTE 查询体解析出的根表
     */
    private final Map<String, List<TableRef>> ctes = new LinkedHashMap<>();

    public AliasScope() {
        this(null);
    }

    private AliasScope(AliasScope parent) {
        this.parent = parent;
    }

    public AliasScope child() {
        return new AliasScope(this);
    }

    /**
     * 登记物理表：有别名按别名登记，同时按表名登记，便于 UPDATE t FROM t, ... 这类写法直接命中
     */
    public void bindTable(TableRef table) {
        Binding binding = new Binding(table, Collections.singletonList(table));
        if (table.getAlias() != null) {
            bindings.put(key(table.getAlias()), binding);
        }
        bindings.putIfAbsent(key(table.getName()), binding);
    }

    /**
     * 登记子查询别名，别名解析为子查询自身的根表
     */
    public void bindSubquery(String alias, List<TableRef> roots) {
        if (alias == null) {
            return;
        }
        bindings.put(key(alias), new Binding(TableRef.subquery(alias), new ArrayList<>(roots)));
    }

    public void declareCte(String name) {
        ctes.putIfAbsent(key(name), new ArrayList<>());
    }

    public void bindCte(String name, List<TableRef> roots) {
        ctes.put(key(name), new ArrayList<>(roots));
    }

    public boolean isCte(String name) {
        if (name == null) {
            return false;
        }
        for (AliasScope s = this; s != null; s = s.parent) {
            if (s.ctes.containsKey(key(name))) {
                return true;
            }
        }
        return false;
    }

    public List<TableRef> cteRoots(String name) {
        for (AliasScope s = this; s != null; s = s.parent) {
            List<TableRef> roots = s.ctes.get(key(name));
            if (roots != null) {
                return Collections.unmodifiableList(roots);
            }
        }
        return Collections.emptyList();
    }

    /**
     * 按别名或表名查找，当前作用域未命中时向父作用域查找
     *
     * @return 别名指向的根表，未找到返回空列表
     */
    public List<TableRef> lookup(String aliasOrName) {
        if (aliasOrName == null) {
            return Collections.emptyList();
        }
        String k = key(aliasOrName);
        for (AliasScope s = this; s != null; s = s.parent) {
            Binding binding = s.bindings.get(k);
            if (binding != null) {
                return Collections.unmodifiableList(binding.roots);
            }
        }
        return Collections.emptyList();
    }

    public boolean isSubqueryAlias(String alias) {
        if (alias == null) {
            return false;
        }
        Binding binding = bindings.get(key(alias));
        return binding != null && binding.ref.isSubquery();
    }

    /**
     * 当前作用域内按出现顺序登记的所有根表
     */
    public List<TableRef> roots() {
        Set<TableRef> seen = new LinkedHashSet<>();
        List<TableRef> result = new ArrayList<>();
        for (Binding binding : bindings.values()) {
            for (TableRef root : binding.roots) {
                if (seen.add(root)) {
                    result.add(root);
                }
            }
        }
        return result;
    }

    private static String key(String name) {
        return name.toUpperCase(Locale.ROOT);
    }

    private static final class Binding {
        private final TableRef ref;
        private final List<TableRef> roots;

        private Binding(TableRef ref, List<TableRef> roots) {
            this.ref = ref;
            this.roots = roots;
        }
    }
}
