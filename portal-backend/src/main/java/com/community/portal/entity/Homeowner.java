package com.community.portal.entity;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Homeowner Entity: 业主基础信息表 (使用 Lombok 简化样板代码)
 * 对应数据库中的 'homeowner' 表结构，对本服务只读。
 */
@Data // 自动生成 Getter, Setter, toString, equals, hashCode
@NoArgsConstructor // 自动生成无参构造函数
@AllArgsConstructor // 自动生成全参构造函数
@Entity
@Table(name = "homeowner")
public class Homeowner {

    /**
     * homeowner_id: 业主唯一标识符 (Primary Key)
     * 对应数据库 BIGINT 类型。
     */
    @Id
    @Column(name = "homeowner_id")
    private Long homeownerId;

    /**
     * community_id: 所属小区 (租户上下文)
     */
    @Column(name = "community_id", nullable = false)
    private Long communityId;

    @Column(name = "first_name", length = 100)
    private String firstName;

    @Column(name = "last_name", length = 100)
    private String lastName;

    /**
     * inactive: 三态标记
     * TRUE = 已停用, FALSE = 正常, NULL = 未知（按非停用处理）
     */
    @Column(name = "inactive")
    private Boolean inactive;
}
