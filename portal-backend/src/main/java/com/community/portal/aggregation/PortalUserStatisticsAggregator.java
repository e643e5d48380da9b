package com.community.portal.aggregation;

import com.community.portal.dto.EligibleHomeownerDTO;
import com.community.portal.dto.PortalUserStatisticsDTO;
import com.community.portal.entity.PortalUser;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 统计聚合器：把符合条件的业主与门户账号做左连接，并归约为概览统计。
 * 每个业主只落入一个分类：已激活 / 有账号未激活 / 无账号。
 */
@Component
public class PortalUserStatisticsAggregator {

    /**
     * @param eligible    查询引擎输出的符合条件业主
     * @param portalUsers 门户账号快照（可包含不在 eligible 中的业主，会被忽略）
     * @param ratios      需要计算的比率指标
     */
    public PortalUserStatisticsDTO aggregate(List<EligibleHomeownerDTO> eligible,
                                             Collection<PortalUser> portalUsers,
                                             Collection<RatioMetric> ratios) {
        PortalUserStatisticsDTO dto = new PortalUserStatisticsDTO();

        // --- 1. 门户账号按业主分组：homeownerId -> 是否存在已激活账号 ---
        Map<Long, Boolean> accountByHomeowner = indexPortalUsers(portalUsers);

        // --- 2. 左连接并分类 ---
        int total = 0;
        int withActive = 0;
        int withInactive = 0;
        int without = 0;
        if (eligible != null) {
            for (EligibleHomeownerDTO homeowner : eligible) {
                total++;
                Boolean hasActive = accountByHomeowner.get(homeowner.getHomeownerId());
                if (hasActive == null) {
                    // 没有门户账号记录：视为未注册，不是错误
                    without++;
                } else if (hasActive) {
                    withActive++;
                } else {
                    withInactive++;
                }
            }
        }

        dto.setTotalHomeowners(total);
        dto.setWithActivePortalAccount(withActive);
        dto.setWithInactivePortalAccount(withInactive);
        dto.setWithoutPortalAccount(without);

        // --- 3. 比率指标 ---
        Map<String, Double> ratioValues = new LinkedHashMap<>();
        if (ratios != null) {
            Set<RatioMetric> requested = new LinkedHashSet<>(ratios);
            for (RatioMetric metric : requested) {
                if (metric == null) {
                    continue;
                }
                ratioValues.put(metric.name(), metric.compute(total, withActive, withInactive, without));
            }
        }
        dto.setRatios(ratioValues);

        return dto;
    }

    private Map<Long, Boolean> indexPortalUsers(Collection<PortalUser> portalUsers) {
        Map<Long, Boolean> index = new HashMap<>();
        if (portalUsers == null) {
            return index;
        }
        for (PortalUser portalUser : portalUsers) {
            if (portalUser.getHomeownerId() == null) {
                continue;
            }
            boolean active = Boolean.TRUE.equals(portalUser.getActive());
            // 同一业主有多个账号时，只要有一个已激活即算已激活
            index.merge(portalUser.getHomeownerId(), active, (a, b) -> a || b);
        }
        return index;
    }
}
