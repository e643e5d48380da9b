package com.community.portal.source;

import com.community.portal.entity.PortalUser;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 门户账号数据源：按租户异步拉取完整的门户账号快照。
 */
public interface PortalUserSource {

    CompletableFuture<List<PortalUser>> fetchPortalUsers(Long communityId);
}
