package com.community.portal.source;

import com.community.portal.entity.Homeowner;
import com.community.portal.exception.DataSourceException;
import com.community.portal.repository.HomeownerRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 基于 JPA Repository 的业主数据源，查询在 portalDataExecutor 线程池中执行
 */
@Slf4j
@Component
public class RepositoryHomeownerSource implements HomeownerSource {

    private final HomeownerRepository homeownerRepository;
    private final AsyncTaskExecutor executor;

    public RepositoryHomeownerSource(HomeownerRepository homeownerRepository,
                                     @Qualifier("portalDataExecutor") AsyncTaskExecutor executor) {
        this.homeownerRepository = homeownerRepository;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<List<Homeowner>> fetchHomeowners(Long communityId) {
        return FetchTasks.submit(executor, () -> {
            try {
                List<Homeowner> homeowners = homeownerRepository.findAllByCommunityId(communityId);
                log.debug("拉取业主快照完成，communityId={}, 数量: {}", communityId, homeowners.size());
                return homeowners;
            } catch (DataAccessException e) {
                log.error("拉取业主快照失败，communityId={}: {}", communityId, e.getMessage(), e);
                throw new DataSourceException("业主数据源不可用", e);
            }
        });
    }
}
