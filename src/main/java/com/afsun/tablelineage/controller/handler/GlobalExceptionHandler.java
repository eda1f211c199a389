package com.afsun.tablelineage.controller.handler;

import com.afsun.tablelineage.core.exceptions.InvalidScriptException;
import com.afsun.tablelineage.core.exceptions.LineageException;
import com.afsun.tablelineage.core.exceptions.UnsupportedDialectException;
import com.afsun.tablelineage.vo.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/**
 * 全局异常处理器
 * 单条语句的解析失败在结果的 warnings 中返回，这里只处理整个请求无法完成的情况
 *
 * @author afsun
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * 处理空脚本
     */
    @ExceptionHandler(InvalidScriptException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Response<Void> handleInvalidScriptException(InvalidScriptException e) {
        log.warn("无效的SQL脚本: {}", e.getMessage());
        return Response.fail(400, e.getFormattedMessage());
    }

    /**
     * 处理不支持的方言
     */
    @ExceptionHandler(UnsupportedDialectException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Response<Void> handleUnsupportedDialectException(UnsupportedDialectException e) {
        log.warn("不支持的方言: {}", e.getMessage());
        return Response.fail(400, e.getFormattedMessage());
    }

    /**
     * 处理其他血缘异常
     */
    @ExceptionHandler(LineageException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Response<Void> handleLineageException(LineageException e) {
        log.error("血缘抽取失败: {}", e.getFormattedMessage(), e);
        return Response.fail(422, e.getFormattedMessage());
    }

    /**
     * 处理文件上传大小超限异常
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    @ResponseStatus(HttpStatus.PAYLOAD_TOO_LARGE)
    public Response<Void> handleMaxUploadSizeExceededException(MaxUploadSizeExceededException e) {
        log.warn("文件上传大小超限: {}", e.getMessage());
        return Response.fail(413, "文件大小超过限制，请拆分脚本或使用批量接口");
    }

    /**
     * 处理非法参数异常
     */
    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Response<Void> handleIllegalArgumentException(IllegalArgumentException e) {
        log.warn("非法参数: {}", e.getMessage());
        return Response.fail(400, "参数错误: " + e.getMessage());
    }

    /**
     * 处理其他未预期异常
     */
    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Response<Void> handleException(Exception e) {
        log.error("系统异常", e);
        return Response.fail(500, "系统错误: " + e.getMessage());
    }
}
