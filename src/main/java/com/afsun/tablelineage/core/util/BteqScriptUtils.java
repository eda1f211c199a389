package com.afsun.tablelineage.core.util;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * BTEQ 脚本预处理：从 shell 脚本中取出 bteq &lt;&lt;EOF ... EOF 块内的 SQL，并清掉 BTEQ 控制命令。
 * 被去掉的行替换为空行，提取结果的行号与原脚本一一对应，警告中的行号可以直接定位到 .sh 文件。
 *
 * @author afsun
 * @date 2025-11-05日 11:26
 */
public class BteqScriptUtils {

    /**
     * bteq &lt;&lt;EOF ... EOF，分隔符任意，允许 &lt;&lt;-EOF 和带引号的分隔符
     */
    private static final Pattern BTEQ_BLOCK = Pattern.compile(
            "(?im)^[^\\n]*\\bbteq\\b[^\\n]*<<-?\\s*['\"]?(\\w+)['\"]?[^\\n]*\\n(.*?)^\\s*\\1\\s*$",
            Pattern.DOTALL);

    /**
     * 不带点前缀的 BTEQ 命令
     */
    private static final Set<String> PLAIN_COMMANDS = Collections.unmodifiableSet(
            new LinkedHashSet<>(Arrays.asList("BT", "ET", "SLEEP")));

    private BteqScriptUtils() {
    }

    /**
     * 脚本处理入口
     *
     * @param script shell 脚本或纯 SQL 文本
     * @return 只保留 SQL 的文本，行数与输入一致
     */
    public static String extractSql(String script) {
        if (script == null || script.isEmpty()) {
            return script;
        }
        if (!containsBteqBlock(script)) {
            return removeCommands(script);
        }
        StringBuilder result = new StringBuilder(script.length());
        Matcher matcher = BTEQ_BLOCK.matcher(script);
        int last = 0;
        while (matcher.find()) {
            // 块外的 shell 内容（含 bteq 起始行）只保留换行
            blankLines(script.substring(last, matcher.start(2)), result);
            result.append(removeCommands(matcher.group(2)));
            last = matcher.end(2);
        }
        blankLines(script.substring(last), result);
        return result.toString();
    }

    public static boolean containsBteqBlock(String script) {
        return script != null && BTEQ_BLOCK.matcher(script).find();
    }

    /**
     * 是否为 BTEQ 控制命令行
     */
    public static boolean isBteqCommand(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        if (trimmed.charAt(0) == '.') {
            return trimmed.length() > 1 && Character.isLetter(trimmed.charAt(1));
        }
        String upper = trimmed.toUpperCase(Locale.ROOT);
        for (String command : PLAIN_COMMANDS) {
            if (upper.equals(command) || upper.startsWith(command + ";") || upper.startsWith(command + " ")) {
                return true;
            }
        }
        return false;
    }

    /**
     * 删除 BTEQ 控制命令，行结构保持不变
     */
    private static String removeCommands(String sql) {
        String[] lines = sql.split("\n", -1);
        StringBuilder sb = new StringBuilder(sql.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            if (!isBteqCommand(lines[i])) {
                sb.append(lines[i]);
            }
        }
        return sb.toString();
    }

    private static void blankLines(String text, StringBuilder out) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                out.append('\n');
            }
        }
    }
}
