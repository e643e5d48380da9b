package com.community.portal.service;

import com.community.portal.aggregation.PortalUserStatisticsAggregator;
import com.community.portal.aggregation.RatioMetric;
import com.community.portal.config.PortalStatisticsProperties;
import com.community.portal.dto.EligibleHomeownerDTO;
import com.community.portal.dto.PortalUserStatisticsDTO;
import com.community.portal.dto.PortalUserStatisticsRequest;
import com.community.portal.entity.Homeowner;
import com.community.portal.entity.PortalUser;
import com.community.portal.exception.DataSourceException;
import com.community.portal.exception.InvalidFilterException;
import com.community.portal.query.HomeownerQueryEngine;
import com.community.portal.query.HomeownerSortKey;
import com.community.portal.source.HomeownerSource;
import com.community.portal.source.PortalUserSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
@Service
@RequiredArgsConstructor
public class PortalUserStatisticsServiceImpl implements PortalUserStatisticsService {

    private final HomeownerSource homeownerSource;
    private final PortalUserSource portalUserSource;
    private final HomeownerQueryEngine queryEngine;
    private final PortalUserStatisticsAggregator aggregator;
    private final PortalStatisticsProperties properties;

    private static final DateTimeFormatter ISO_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);


    @Override
    public PortalUserStatisticsDTO getPortalUserOverviewStatistics(PortalUserStatisticsRequest request) {

        // --- 1. 参数校验（在任何数据拉取之前）---
        HomeownerSortKey sortKey = validate(request);
        List<RatioMetric> ratios = resolveRatios(request);

        log.info("开始统计门户账号概览, communityId={}, 白名单数量: {}",
                request.getCommunityId(), request.getHomeownerIds().size());

        // 白名单为空时不可能有符合条件的业主，直接返回全 0 结果
        if (request.getHomeownerIds().isEmpty()) {
            return stamp(aggregator.aggregate(new ArrayList<>(), new ArrayList<>(), ratios));
        }

        // --- 2. 并发拉取两个数据源 ---
        long fetchStart = System.currentTimeMillis();
        long deadline = deadline();
        CompletableFuture<List<Homeowner>> homeownersFuture =
                homeownerSource.fetchHomeowners(request.getCommunityId());
        CompletableFuture<List<PortalUser>> portalUsersFuture =
                portalUserSource.fetchPortalUsers(request.getCommunityId());

        // 两个拉取共用同一个截止时间，整体等待不超过 fetchTimeoutMs
        List<Homeowner> homeowners = await(homeownersFuture, "业主", deadline, homeownersFuture, portalUsersFuture);
        List<PortalUser> portalUsers = await(portalUsersFuture, "门户账号", deadline, homeownersFuture, portalUsersFuture);
        log.info("  拉取数据耗时: {} ms, 业主: {}, 门户账号: {}",
                System.currentTimeMillis() - fetchStart, homeowners.size(), portalUsers.size());

        // --- 3. 查询引擎：筛选符合条件的业主 ---
        List<EligibleHomeownerDTO> eligible = queryEngine.findEligibleHomeowners(
                homeowners, request.getHomeownerIds(), sortKey, isDescending(request));

        // --- 4. 聚合 ---
        PortalUserStatisticsDTO dto = stamp(aggregator.aggregate(eligible, portalUsers, ratios));
        log.info("门户账号概览统计完成: 总数 {}, 已激活 {}, 未激活 {}, 无账号 {}",
                dto.getTotalHomeowners(), dto.getWithActivePortalAccount(),
                dto.getWithInactivePortalAccount(), dto.getWithoutPortalAccount());
        return dto;
    }

    @Override
    public List<EligibleHomeownerDTO> getEligibleHomeowners(PortalUserStatisticsRequest request) {
        HomeownerSortKey sortKey = validate(request);
        if (request.getHomeownerIds().isEmpty()) {
            return new ArrayList<>();
        }

        CompletableFuture<List<Homeowner>> homeownersFuture =
                homeownerSource.fetchHomeowners(request.getCommunityId());
        List<Homeowner> homeowners = await(homeownersFuture, "业主", deadline(), homeownersFuture);

        List<EligibleHomeownerDTO> eligible = queryEngine.findEligibleHomeowners(
                homeowners, request.getHomeownerIds(), sortKey, isDescending(request));
        log.info("符合条件的业主查询完成, communityId={}, 数量: {}", request.getCommunityId(), eligible.size());
        return eligible;
    }

    /**
     * 校验筛选条件，并解析排序字段
     */
    private HomeownerSortKey validate(PortalUserStatisticsRequest request) {
        if (request == null) {
            throw new InvalidFilterException("筛选条件不能为空");
        }
        if (request.getCommunityId() == null) {
            throw new InvalidFilterException("communityId 不能为空");
        }
        if (request.getHomeownerIds() == null) {
            throw new InvalidFilterException("homeownerIds 不能为空，没有业主时请传空列表");
        }
        if (request.getHomeownerIds().stream().anyMatch(Objects::isNull)) {
            throw new InvalidFilterException("homeownerIds 中不能包含空值");
        }
        if (request.getRatios() != null && request.getRatios().stream().anyMatch(Objects::isNull)) {
            throw new InvalidFilterException("ratios 中不能包含空值");
        }
        String sortOrder = request.getSortOrder();
        if (sortOrder != null && !sortOrder.isBlank()
                && !"asc".equalsIgnoreCase(sortOrder) && !"desc".equalsIgnoreCase(sortOrder)) {
            throw new InvalidFilterException("不支持的排序方向: " + sortOrder);
        }
        return HomeownerSortKey.fromParam(request.getSortBy());
    }

    private boolean isDescending(PortalUserStatisticsRequest request) {
        return "desc".equalsIgnoreCase(request.getSortOrder());
    }

    private List<RatioMetric> resolveRatios(PortalUserStatisticsRequest request) {
        if (request.getRatios() == null || request.getRatios().isEmpty()) {
            return properties.getDefaultRatios();
        }
        return request.getRatios();
    }

    private long deadline() {
        return System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(properties.getFetchTimeoutMs());
    }

    /**
     * 等待数据源返回，最多等到 deadline (System.nanoTime)。
     * 失败、超时或被中断时取消所有未完成的拉取，并以 DataSourceException 抛出。
     */
    private <T> T await(CompletableFuture<T> future, String sourceName, long deadline, Future<?>... pending) {
        try {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            cancelAll(pending);
            Thread.currentThread().interrupt();
            throw new DataSourceException(sourceName + "数据拉取被中断", e);
        } catch (TimeoutException e) {
            cancelAll(pending);
            log.error("{}数据拉取超时 ({} ms)", sourceName, properties.getFetchTimeoutMs());
            throw new DataSourceException(sourceName + "数据拉取超时", e);
        } catch (CancellationException e) {
            cancelAll(pending);
            throw new DataSourceException(sourceName + "数据拉取已取消", e);
        } catch (ExecutionException e) {
            cancelAll(pending);
            Throwable cause = e.getCause();
            // 数据源已经包装好的异常原样抛出
            if (cause instanceof DataSourceException) {
                throw (DataSourceException) cause;
            }
            log.error("{}数据拉取失败: {}", sourceName, cause != null ? cause.getMessage() : e.getMessage(), cause);
            throw new DataSourceException(sourceName + "数据源不可用", cause != null ? cause : e);
        }
    }

    private void cancelAll(Future<?>... futures) {
        for (Future<?> f : futures) {
            if (!f.isDone()) {
                f.cancel(true);
            }
        }
    }

    private PortalUserStatisticsDTO stamp(PortalUserStatisticsDTO dto) {
        dto.setGeneratedTime(ISO_FORMATTER.format(Instant.now()));
        return dto;
    }
}
