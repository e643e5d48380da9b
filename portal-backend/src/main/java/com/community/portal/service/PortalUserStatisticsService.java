// File: PortalUserStatisticsService.java
package com.community.portal.service;

import com.community.portal.dto.EligibleHomeownerDTO;
import com.community.portal.dto.PortalUserStatisticsDTO;
import com.community.portal.dto.PortalUserStatisticsRequest;

import java.util.List;

/**
 * 业主门户账号统计的服务接口
 */
public interface PortalUserStatisticsService {

    /**
     * 获取门户账号概览统计：筛选符合条件的业主，与门户账号左连接后汇总。
     * @param request 筛选条件
     * @return 概览统计，没有符合条件的业主时各项计数均为 0
     * @throws com.community.portal.exception.InvalidFilterException 筛选条件不合法（不会触发数据拉取）
     * @throws com.community.portal.exception.DataSourceException 数据源拉取失败
     */
    PortalUserStatisticsDTO getPortalUserOverviewStatistics(PortalUserStatisticsRequest request);

    /**
     * 获取符合条件的业主列表（查询引擎的投影结果）
     */
    List<EligibleHomeownerDTO> getEligibleHomeowners(PortalUserStatisticsRequest request);
}
