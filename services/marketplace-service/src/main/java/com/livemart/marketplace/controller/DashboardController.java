package com.livemart.marketplace.controller;

import com.livemart.marketplace.dto.DashboardResponse;
import com.livemart.marketplace.service.DashboardService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/dashboard")
public class DashboardController {

    private final DashboardService dashboardService;

    public DashboardController(DashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    @GetMapping("/retailer")
    public ResponseEntity<DashboardResponse> retailer(@RequestParam(name = "user_id") String userId) {
        return ResponseEntity.ok(dashboardService.summarize(userId));
    }

    @GetMapping("/wholesaler")
    public ResponseEntity<DashboardResponse> wholesaler(@RequestParam(name = "user_id") String userId) {
        return ResponseEntity.ok(dashboardService.summarize(userId));
    }
}
