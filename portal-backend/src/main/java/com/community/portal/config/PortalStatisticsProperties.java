package com.community.portal.config;

import com.community.portal.aggregation.RatioMetric;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 统计服务配置，对应 application.properties 中的 portal.statistics.*
 */
@Data
@Component
@ConfigurationProperties(prefix = "portal.statistics")
public class PortalStatisticsProperties {

    // 等待数据源返回的最长时间（毫秒）
    private long fetchTimeoutMs = 10000;

    // 请求未指定 ratios 时计算的比率指标
    private List<RatioMetric> defaultRatios = new ArrayList<>(
            List.of(RatioMetric.ACTIVE_PORTAL_RATE, RatioMetric.WITHOUT_PORTAL_RATE));
}
