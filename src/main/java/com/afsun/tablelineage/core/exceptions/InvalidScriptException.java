package com.afsun.tablelineage.core.exceptions;

/**
 * 脚本不可读：为空或切分后没有任何语句
 *
 * @author afsun
 */
public class InvalidScriptException extends LineageException {

    public InvalidScriptException(String message) {
        super("INVALID_SCRIPT", message, "请确认脚本中包含SQL语句，BTEQ 脚本请使用 .sh 文件上传");
    }
}
