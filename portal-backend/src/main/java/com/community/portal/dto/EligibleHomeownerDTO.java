package com.community.portal.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EligibleHomeownerDTO {
    private Long homeownerId;     // 业主ID
    private String firstName;     // 名
    private String lastName;      // 姓
    private String fullName;      // 全名（"名 姓"，缺失部分跳过）
    private String activeStatus;  // ACTIVE / UNKNOWN（停用业主不会出现在结果中）
}
