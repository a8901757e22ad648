package com.polishfootball.network.infrastructure.web;

import com.polishfootball.network.application.FindDashboardStats;
import com.polishfootball.network.application.dto.DashboardStats;
import com.polishfootball.network.application.query.DashboardStatsQuery;
import com.polishfootball.network.infrastructure.web.dto.ApiResponse;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/admin/dashboard")
public class DashboardController {

    private final FindDashboardStats findDashboardStats;

    public DashboardController(FindDashboardStats findDashboardStats) {
        this.findDashboardStats = findDashboardStats;
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<DashboardStats>> getStats(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(defaultValue = "false") boolean includeDetails
    ) {
        return QueryResponses.toResponse(
                findDashboardStats.execute(new DashboardStatsQuery(startDate, endDate, includeDetails)));
    }
}
