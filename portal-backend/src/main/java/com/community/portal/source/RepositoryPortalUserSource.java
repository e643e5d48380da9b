package com.community.portal.source;

import com.community.portal.entity.PortalUser;
import com.community.portal.exception.DataSourceException;
import com.community.portal.repository.PortalUserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Component
public class RepositoryPortalUserSource implements PortalUserSource {

    private final PortalUserRepository portalUserRepository;
    private final AsyncTaskExecutor executor;

    public RepositoryPortalUserSource(PortalUserRepository portalUserRepository,
                                      @Qualifier("portalDataExecutor") AsyncTaskExecutor executor) {
        this.portalUserRepository = portalUserRepository;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<List<PortalUser>> fetchPortalUsers(Long communityId) {
        return FetchTasks.submit(executor, () -> {
            try {
                List<PortalUser> portalUsers = portalUserRepository.findAllByCommunityId(communityId);
                log.debug("拉取门户账号快照完成，communityId={}, 数量: {}", communityId, portalUsers.size());
                return portalUsers;
            } catch (DataAccessException e) {
                log.error("拉取门户账号快照失败，communityId={}: {}", communityId, e.getMessage(), e);
                throw new DataSourceException("门户账号数据源不可用", e);
            }
        });
    }
}
