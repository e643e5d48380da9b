package com.community.portal.entity;

import lombok.Data;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Column;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * PortalUser Entity: 业主门户账号表
 * homeowner_id 只是对 Homeowner 的引用，不建立 JPA 关联（左连接在内存中完成）。
 */
@Entity
@Data
@Table(name = "portal_user")
public class PortalUser implements Serializable {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "portal_user_id")
    private Long portalUserId;

    @Column(name = "homeowner_id", nullable = false)
    private Long homeownerId;

    @Column(name = "community_id", nullable = false)
    private Long communityId;

    @Column(name = "email", length = 255)
    private String email;

    // 门户账号是否已激活，NULL 视为未激活
    @Column(name = "active")
    private Boolean active;

    @Column(name = "registered_time")
    private LocalDateTime registeredTime;

    @Column(name = "last_login_time")
    private LocalDateTime lastLoginTime;
}
