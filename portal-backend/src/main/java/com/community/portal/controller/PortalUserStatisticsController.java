package com.community.portal.controller;

import com.community.portal.dto.CommonResponse;
import com.community.portal.dto.PortalUserStatisticsDTO;
import com.community.portal.dto.PortalUserStatisticsRequest;
import com.community.portal.service.PortalUserStatisticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/PortalUser")
@RequiredArgsConstructor // Lombok: 注入 Service
public class PortalUserStatisticsController {

    private final PortalUserStatisticsService statisticsService;

    /**
     * POST /api/PortalUser/overviewStatistics
     * 获取门户账号概览统计。筛选条件放在请求体中（业主 ID 白名单可能很长）。
     *
     * @return 封装在 CommonResponse 中的 PortalUserStatisticsDTO
     */
    @PostMapping("/overviewStatistics")
    public ResponseEntity<CommonResponse<PortalUserStatisticsDTO>> getPortalUserOverviewStatistics(
            @RequestBody PortalUserStatisticsRequest request) {

        // 校验失败、数据源异常由 GlobalExceptionHandler 统一转换
        PortalUserStatisticsDTO statistics = statisticsService.getPortalUserOverviewStatistics(request);

        return ResponseEntity.ok(CommonResponse.success(statistics));
    }
}
