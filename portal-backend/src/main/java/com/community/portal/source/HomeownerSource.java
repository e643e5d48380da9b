package com.community.portal.source;

import com.community.portal.entity.Homeowner;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 业主数据源：按租户异步拉取完整的业主快照。
 * 失败时 future 以 DataSourceException 结束，重试策略由数据访问层自行负责。
 */
public interface HomeownerSource {

    CompletableFuture<List<Homeowner>> fetchHomeowners(Long communityId);
}
