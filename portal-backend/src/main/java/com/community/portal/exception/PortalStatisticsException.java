package com.community.portal.exception;

import lombok.Getter;

/**
 * 统计服务异常基类，errorCode 用于在响应中区分错误类型
 */
@Getter
public class PortalStatisticsException extends RuntimeException {

    private final String errorCode;

    public PortalStatisticsException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public PortalStatisticsException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
