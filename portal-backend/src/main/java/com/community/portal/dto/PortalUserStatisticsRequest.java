package com.community.portal.dto;

import com.community.portal.aggregation.RatioMetric;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 统计请求的筛选条件
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PortalUserStatisticsRequest {

    // 租户上下文（小区 ID），必填
    private Long communityId;

    // 允许参与统计的业主 ID 列表，必填；空列表表示没有业主符合条件，而不是"全部"
    private List<Long> homeownerIds;

    // 可选排序字段：id / firstName / lastName
    private String sortBy;

    // asc（默认）/ desc
    private String sortOrder;

    // 需要计算的比率指标，为空时使用配置中的默认指标
    private List<RatioMetric> ratios;

    public PortalUserStatisticsRequest(Long communityId, List<Long> homeownerIds) {
        this.communityId = communityId;
        this.homeownerIds = homeownerIds;
    }
}
