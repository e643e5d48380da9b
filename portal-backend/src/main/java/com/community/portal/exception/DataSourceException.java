package com.community.portal.exception;

/**
 * 业主 / 门户账号数据源不可用。原样抛给调用方，本服务不做重试。
 */
public class DataSourceException extends PortalStatisticsException {

    public static final String ERROR_CODE = "DATA_SOURCE_UNAVAILABLE";

    public DataSourceException(String message) {
        super(ERROR_CODE, message);
    }

    public DataSourceException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
