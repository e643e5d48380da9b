package com.community.portal.exception;

/**
 * 筛选条件不合法（如 homeownerIds 为空引用），在任何数据拉取之前抛出
 */
public class InvalidFilterException extends PortalStatisticsException {

    public static final String ERROR_CODE = "INVALID_FILTER";

    public InvalidFilterException(String message) {
        super(ERROR_CODE, message);
    }
}
