package com.afsun.tablelineage.core.exceptions;

import org.apache.commons.lang3.ArrayUtils;
import org.slf4j.helpers.MessageFormatter;

/**
 * 方言标识无法识别
 *
 * @author afsun
 * @date 2025-12-01日 16:20
 */
public class UnsupportedDialectException extends LineageException {

    public UnsupportedDialectException(String message, Object... args) {
        super("UNSUPPORTED_DIALECT", format(message, args), "可选方言: teradata, spark, spark2");
    }

    private static String format(String message, Object[] args) {
        if (ArrayUtils.isEmpty(args)) {
            return message;
        }
        return MessageFormatter.arrayFormat(message, args).getMessage();
    }
}
