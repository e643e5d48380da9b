// File: com/community/portal/dto/CommonResponse.java
package com.community.portal.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * 通用API响应结构 DTO
 *
 * @param <T> 业务数据类型
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommonResponse<T> implements Serializable {

    // 状态码：200, 400, 409, 500, 503
    private Integer code;

    // 响应描述信息
    private String message;

    // 错误类型（如 INVALID_FILTER），成功时为 null
    private String errorCode;

    // 业务数据 (可以是任何DTO, List, 或 null)
    private T data;

    // 响应时间戳 (ms)
    private Long timestamp;

    /**
     * 构造成功响应 (状态码 200)
     * @param data 业务数据
     */
    public static <T> CommonResponse<T> success(T data) {
        return new CommonResponse<>(200, "请求成功", null, data, Instant.now().toEpochMilli());
    }

    /**
     * 构造失败响应
     * @param code HTTP 状态码 (如 400, 503)
     * @param errorCode 错误类型
     * @param message 错误描述
     */
    public static <T> CommonResponse<T> error(Integer code, String errorCode, String message) {
        return new CommonResponse<>(code, message, errorCode, null, Instant.now().toEpochMilli());
    }
}
