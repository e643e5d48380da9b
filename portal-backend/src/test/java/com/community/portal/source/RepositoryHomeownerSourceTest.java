package com.community.portal.source;

import com.community.portal.aggregation.PortalUserStatisticsAggregator;
import com.community.portal.config.PortalStatisticsProperties;
import com.community.portal.dto.PortalUserStatisticsRequest;
import com.community.portal.entity.Homeowner;
import com.community.portal.entity.PortalUser;
import com.community.portal.exception.DataSourceException;
import com.community.portal.query.HomeownerQueryEngine;
import com.community.portal.repository.HomeownerRepository;
import com.community.portal.repository.PortalUserRepository;
import com.community.portal.service.PortalUserStatisticsServiceImpl;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * 数据源适配层测试：查询委托给 Repository，数据库异常转换为 DataSourceException，
 * 取消拉取时中断正在执行的查询
 */
@ExtendWith(MockitoExtension.class)
public class RepositoryHomeownerSourceTest {

    @Mock
    private HomeownerRepository homeownerRepository;

    @Mock
    private PortalUserRepository portalUserRepository;

    private ThreadPoolTaskExecutor executor;

    private RepositoryHomeownerSource homeownerSource;
    private RepositoryPortalUserSource portalUserSource;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setThreadNamePrefix("test-data-");
        executor.initialize();

        homeownerSource = new RepositoryHomeownerSource(homeownerRepository, executor);
        portalUserSource = new RepositoryPortalUserSource(portalUserRepository, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    /**
     * 模拟一个耗时的查询：开始时计数 started，被中断时计数 interrupted
     */
    private void stubSlowQuery(CountDownLatch started, CountDownLatch interrupted) {
        when(homeownerRepository.findAllByCommunityId(10L)).thenAnswer(invocation -> {
            started.countDown();
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return List.of();
        });
    }

    @Test
    void testFetchHomeowners() {
        List<Homeowner> homeowners = List.of(new Homeowner(1L, 10L, "A", "B", null));
        when(homeownerRepository.findAllByCommunityId(10L)).thenReturn(homeowners);

        CompletableFuture<List<Homeowner>> future = homeownerSource.fetchHomeowners(10L);

        assertEquals(homeowners, future.join());
        verify(homeownerRepository).findAllByCommunityId(10L);
    }

    @Test
    void testFetchHomeowners_DatabaseUnavailable() {
        DataAccessResourceFailureException dbError = new DataAccessResourceFailureException("db down");
        when(homeownerRepository.findAllByCommunityId(10L)).thenThrow(dbError);

        CompletableFuture<List<Homeowner>> future = homeownerSource.fetchHomeowners(10L);

        CompletionException ex = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(DataSourceException.class, ex.getCause());
        assertSame(dbError, ex.getCause().getCause());
    }

    @Test
    void testFetchPortalUsers_DatabaseUnavailable() {
        when(portalUserRepository.findAllByCommunityId(10L))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        CompletableFuture<List<PortalUser>> future = portalUserSource.fetchPortalUsers(10L);

        CompletionException ex = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(DataSourceException.class, ex.getCause());
    }

    // 取消返回的 future 会中断正在执行的查询
    @Test
    void testFetchHomeowners_CancelInterruptsRunningQuery() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        stubSlowQuery(started, interrupted);

        CompletableFuture<List<Homeowner>> future = homeownerSource.fetchHomeowners(10L);
        assertTrue(started.await(2, TimeUnit.SECONDS));

        future.cancel(true);

        assertTrue(interrupted.await(2, TimeUnit.SECONDS), "查询线程应被中断");
        assertTrue(future.isCancelled());
    }

    // 统计服务等待超时后，仍在执行的查询被中断，不继续占用线程池
    @Test
    void testOverviewStatisticsTimeout_InterruptsRunningQuery() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        stubSlowQuery(started, interrupted);

        PortalStatisticsProperties properties = new PortalStatisticsProperties();
        properties.setFetchTimeoutMs(300);
        PortalUserStatisticsServiceImpl statisticsService = new PortalUserStatisticsServiceImpl(
                homeownerSource, portalUserSource,
                new HomeownerQueryEngine(), new PortalUserStatisticsAggregator(), properties);

        long begin = System.currentTimeMillis();
        assertThrows(DataSourceException.class, () -> statisticsService.getPortalUserOverviewStatistics(
                new PortalUserStatisticsRequest(10L, List.of(1L))));

        assertTrue(interrupted.await(2, TimeUnit.SECONDS), "超时后查询线程应被中断");
        assertTrue(System.currentTimeMillis() - begin < 3000);
    }
}
