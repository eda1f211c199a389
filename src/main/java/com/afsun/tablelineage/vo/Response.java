package com.afsun.tablelineage.vo;

import lombok.Data;

/**
 * 统一响应对象
 */
@Data
public class Response<T> {

    /**
     * 操作成功状态码
     */
    public static final int SUCCESS = 200;

    private int status;

    private T data;

    private String message;

    public Response() {
    }

    public Response(int status, T data, String message) {
        this.status = status;
        this.data = data;
        this.message = message;
    }

    public boolean isSuccess() {
        return status == SUCCESS;
    }

    /**
     * 操作成功返回响应
     *
     * @param data 返回数据
     * @return 响应结果
     */
    public static <T> Response<T> success(T data) {
        return new Response<>(SUCCESS, data, "");
    }

    /**
     * 操作失败返回响应
     *
     * @param status  状态码，与 HTTP 状态一致
     * @param message 错误信息
     * @return 响应结果
     */
    public static <T> Response<T> fail(int status, String message) {
        return new Response<>(status, null, message);
    }
}
