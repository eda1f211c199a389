package com.afsun.tablelineage.core.validate;

import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 表名校验器，过滤关键字、单字母别名和明显不合法的片段。
 * 对无法完全归一的方言写法保持宽松：宁可多收一个可疑名称，也不要漏掉真实的血缘边。
 *
 * @author afsun
 * @date 2025-12-02日 09:55
 */
public class TableNameValidator {

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z0-9_$#]+(\\.[A-Za-z0-9_$#]+)?$");

    private final Set<String> reservedKeywords;
    private final Set<String> aliasNames;

    public TableNameValidator(Set<String> reservedKeywords, Set<String> aliasNames) {
        this.reservedKeywords = Collections.unmodifiableSet(upper(reservedKeywords));
        this.aliasNames = Collections.unmodifiableSet(upper(aliasNames));
    }

    public static TableNameValidator defaults() {
        return new TableNameValidator(SqlKeywords.RESERVED, SqlKeywords.SINGLE_LETTER_ALIASES);
    }

    public boolean isValid(String name) {
        if (StringUtils.isBlank(name)) {
            return false;
        }
        String candidate = name.trim();
        if (candidate.indexOf(' ') >= 0 || candidate.indexOf(',') >= 0) {
            return false;
        }
        String upper = candidate.toUpperCase(Locale.ROOT);
        if (reservedKeywords.contains(upper) || aliasNames.contains(upper)) {
            return false;
        }
        if (IDENTIFIER.matcher(candidate).matches()) {
            return true;
        }
        return candidate.length() > 1 && containsLetter(candidate);
    }

    private static boolean containsLetter(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isLetter(s.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> upper(Set<String> values) {
        Set<String> result = new LinkedHashSet<>();
        if (values != null) {
            for (String v : values) {
                result.add(v.toUpperCase(Locale.ROOT));
            }
        }
        return result;
    }
}
