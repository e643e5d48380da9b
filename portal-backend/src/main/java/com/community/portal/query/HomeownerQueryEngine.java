package com.community.portal.query;

import com.community.portal.dto.EligibleHomeownerDTO;
import com.community.portal.entity.Homeowner;
import com.community.portal.exception.DuplicateHomeownerException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 业主查询引擎：在已拉取到内存的业主快照上，按显式的阶段依次筛选、投影、排序。
 * 每个阶段都物化为 List，引擎本身无状态，可被并发请求共享。
 */
@Component
public class HomeownerQueryEngine {

    static final String STATUS_ACTIVE = "ACTIVE";
    static final String STATUS_UNKNOWN = "UNKNOWN";

    /**
     * 计算符合条件的业主集合
     *
     * @param homeowners 业主快照
     * @param filterIds  调用方提供的业主 ID 白名单，可含重复值
     * @param sortKey    排序字段，null 表示保持快照顺序
     * @param descending 是否倒序
     * @return 符合条件的业主投影，每个业主最多出现一次
     * @throws DuplicateHomeownerException 快照中存在重复的业主 ID
     */
    public List<EligibleHomeownerDTO> findEligibleHomeowners(List<Homeowner> homeowners,
                                                             Collection<Long> filterIds,
                                                             HomeownerSortKey sortKey,
                                                             boolean descending) {

        // --- 1. 白名单去重 ---
        Set<Long> filter = normalizeFilter(filterIds);
        if (filter.isEmpty() || homeowners == null || homeowners.isEmpty()) {
            return new ArrayList<>();
        }

        // --- 2. 数据完整性检查 ---
        requireUniqueIds(homeowners);

        // --- 3. 排除停用业主 ---
        List<Homeowner> notInactive = homeowners.stream()
                .filter(h -> !Boolean.TRUE.equals(h.getInactive()))
                .collect(Collectors.toList());

        // --- 4. 白名单匹配 ---
        List<Homeowner> matched = notInactive.stream()
                .filter(h -> filter.contains(h.getHomeownerId()))
                .collect(Collectors.toList());

        // --- 5. 投影 ---
        List<EligibleHomeownerDTO> projected = matched.stream()
                .map(this::toEligibleDTO)
                .collect(Collectors.toList());

        // --- 6. 排序（可选）---
        if (sortKey != null) {
            Comparator<EligibleHomeownerDTO> comparator = sortKey.comparator();
            projected.sort(descending ? comparator.reversed() : comparator);
        }
        return projected;
    }

    private Set<Long> normalizeFilter(Collection<Long> filterIds) {
        if (filterIds == null) {
            return new LinkedHashSet<>();
        }
        return filterIds.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private void requireUniqueIds(List<Homeowner> homeowners) {
        Set<Long> seen = new HashSet<>();
        for (Homeowner homeowner : homeowners) {
            Long id = homeowner.getHomeownerId();
            if (id != null && !seen.add(id)) {
                throw new DuplicateHomeownerException(id);
            }
        }
    }

    private EligibleHomeownerDTO toEligibleDTO(Homeowner homeowner) {
        EligibleHomeownerDTO dto = new EligibleHomeownerDTO();
        dto.setHomeownerId(homeowner.getHomeownerId());
        dto.setFirstName(homeowner.getFirstName());
        dto.setLastName(homeowner.getLastName());
        dto.setFullName(buildFullName(homeowner.getFirstName(), homeowner.getLastName()));
        // 停用业主已在第 3 步排除，这里只剩 FALSE 和 NULL 两种情况
        dto.setActiveStatus(homeowner.getInactive() == null ? STATUS_UNKNOWN : STATUS_ACTIVE);
        return dto;
    }

    private String buildFullName(String firstName, String lastName) {
        StringBuilder sb = new StringBuilder();
        if (firstName != null && !firstName.isBlank()) {
            sb.append(firstName.trim());
        }
        if (lastName != null && !lastName.isBlank()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(lastName.trim());
        }
        return sb.toString();
    }
}
