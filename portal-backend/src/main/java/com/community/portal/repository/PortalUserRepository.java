package com.community.portal.repository;

import com.community.portal.entity.PortalUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PortalUserRepository extends JpaRepository<PortalUser, Long> {

    /**
     * 按小区拉取全部门户账号快照
     */
    List<PortalUser> findAllByCommunityId(Long communityId);
}
