package com.community.portal.exception;

import lombok.Getter;

/**
 * 数据完整性错误：同一快照中出现重复的业主 ID
 */
@Getter
public class DuplicateHomeownerException extends PortalStatisticsException {

    public static final String ERROR_CODE = "DUPLICATE_HOMEOWNER";

    private final Long homeownerId;

    public DuplicateHomeownerException(Long homeownerId) {
        super(ERROR_CODE, "业主 ID 重复: " + homeownerId);
        this.homeownerId = homeownerId;
    }
}
