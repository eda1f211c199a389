package com.afsun.tablelineage.core;

import com.afsun.tablelineage.core.validate.TableNameValidator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把脚本内按顺序分类好的操作折叠为 {@link LineageResult}。
 * 源表与目标表各自判重，同一张表可以同时出现在两个集合中。
 *
 * @author afsun
 * @date 2025-12-02日 11:10
 */
public class LineageAggregator {

    private final TableNameValidator validator;
    private final IdentifierCase identifierCase;

    public LineageAggregator(TableNameValidator validator, IdentifierCase identifierCase) {
        this.validator = validator;
        this.identifierCase = identifierCase;
    }

    public LineageResult aggregate(List<Operation> operations) {
        return aggregate(operations, Collections.emptyList());
    }

    public LineageResult aggregate(List<Operation> operations, List<String> warnings) {
        Set<String> sourceTables = new LinkedHashSet<>();
        Set<String> targetTables = new LinkedHashSet<>();
        List<String> volatileTables = new ArrayList<>();
        Map<String, List<String>> relationships = new LinkedHashMap<>();

        for (Operation op : operations) {
            List<String> sources = validSources(op);
            sourceTables.addAll(sources);

            String target = validName(op.getTarget());
            if (target == null) {
                continue;
            }
            if (op.getKind() == OperationKind.CREATE_VOLATILE && !volatileTables.contains(target)) {
                volatileTables.add(target);
            }
            if (op.getKind().countsAsTarget()) {
                targetTables.add(target);
            }
            relationships.computeIfAbsent(target, k -> new ArrayList<>()).addAll(sources);
        }
        return new LineageResult(sourceTables, targetTables, volatileTables, operations, relationships, warnings);
    }

    private List<String> validSources(Operation op) {
        List<String> names = new ArrayList<>();
        for (TableRef source : op.getSources()) {
            String name = validName(source);
            if (name != null) {
                names.add(name);
            }
        }
        return names;
    }

    private String validName(TableRef ref) {
        if (ref == null || ref.isSubquery()) {
            return null;
        }
        String name = ref.normalizedName(identifierCase);
        return validator.isValid(name) ? name : null;
    }
}
