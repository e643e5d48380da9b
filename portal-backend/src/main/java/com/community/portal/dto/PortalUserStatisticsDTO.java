package com.community.portal.dto;

import lombok.Data;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 门户账号概览统计数据传输对象
 * 三个分类互斥：withActive + withInactive + without == totalHomeowners
 */
@Data
public class PortalUserStatisticsDTO {
    // 统计生成时间（ISO 8601格式，UTC）
    private String generatedTime;

    // 符合条件的业主总数
    private Integer totalHomeowners = 0;

    // 拥有已激活门户账号的业主数
    private Integer withActivePortalAccount = 0;

    // 有门户账号记录但均未激活的业主数
    private Integer withInactivePortalAccount = 0;

    // 没有任何门户账号的业主数
    private Integer withoutPortalAccount = 0;

    // 比率指标（指标名 -> 百分比，如 {"ACTIVE_PORTAL_RATE": 50.0}）
    private Map<String, Double> ratios = new LinkedHashMap<>();
}
