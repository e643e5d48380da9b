package com.community.portal.controller;

import com.community.portal.dto.CommonResponse;
import com.community.portal.dto.EligibleHomeownerDTO;
import com.community.portal.dto.PortalUserStatisticsRequest;
import com.community.portal.service.PortalUserStatisticsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/Homeowner")
public class HomeownerController {

    private final PortalUserStatisticsService statisticsService;

    public HomeownerController(PortalUserStatisticsService statisticsService) {
        this.statisticsService = statisticsService;
    }

    /**
     * **路径: /api/Homeowner/eligible**
     * 功能: 返回参与统计的业主列表（未停用且在白名单中），支持 sortBy / sortOrder
     */
    @PostMapping("/eligible")
    public ResponseEntity<CommonResponse<List<EligibleHomeownerDTO>>> getEligibleHomeowners(
            @RequestBody PortalUserStatisticsRequest request) {
        List<EligibleHomeownerDTO> list = statisticsService.getEligibleHomeowners(request);
        return ResponseEntity.ok(CommonResponse.success(list));
    }
}
