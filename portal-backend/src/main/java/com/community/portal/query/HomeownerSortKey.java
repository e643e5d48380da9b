package com.community.portal.query;

import com.community.portal.dto.EligibleHomeownerDTO;
import com.community.portal.exception.InvalidFilterException;

import java.util.Comparator;

/**
 * 符合条件业主列表的排序字段
 */
public enum HomeownerSortKey {

    ID(Comparator.comparing(EligibleHomeownerDTO::getHomeownerId)),
    FIRST_NAME(Comparator.comparing(EligibleHomeownerDTO::getFirstName,
            Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))),
    LAST_NAME(Comparator.comparing(EligibleHomeownerDTO::getLastName,
            Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER)));

    private final Comparator<EligibleHomeownerDTO> comparator;

    HomeownerSortKey(Comparator<EligibleHomeownerDTO> comparator) {
        this.comparator = comparator;
    }

    /**
     * 同名时按业主 ID 兜底，保证同一快照的排序结果稳定
     */
    public Comparator<EligibleHomeownerDTO> comparator() {
        return this == ID ? comparator : comparator.thenComparing(ID.comparator);
    }

    /**
     * 解析请求参数 sortBy（不区分大小写），为空返回 null 表示不排序
     */
    public static HomeownerSortKey fromParam(String sortBy) {
        if (sortBy == null || sortBy.isBlank()) {
            return null;
        }
        switch (sortBy.trim().toLowerCase()) {
            case "id":
            case "homeownerid":
                return ID;
            case "firstname":
                return FIRST_NAME;
            case "lastname":
                return LAST_NAME;
            default:
                throw new InvalidFilterException("不支持的排序字段: " + sortBy);
        }
    }
}
