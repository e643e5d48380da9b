package com.community.portal.repository;

import com.community.portal.entity.Homeowner;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface HomeownerRepository extends JpaRepository<Homeowner, Long> {

    // 按小区拉取全部业主快照（含停用业主，过滤交给查询引擎）
    List<Homeowner> findAllByCommunityId(Long communityId);
}
