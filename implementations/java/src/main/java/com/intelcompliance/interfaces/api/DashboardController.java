package com.intelcompliance.interfaces.api;

import com.intelcompliance.application.dashboard.DashboardOverview;
import com.intelcompliance.application.dashboard.IncidentStatistics;
import com.intelcompliance.application.dashboard.SecurityDashboardService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping(value = "/api/v1/dashboard", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Tag(name = "Dashboard", description = "Read-only security views")
@SecurityRequirement(name = "basicAuth")
public class DashboardController {

    private final SecurityDashboardService dashboardService;

    @GetMapping("/overview")
    @Operation(summary = "Current security overview")
    public DashboardOverview overview() {
        return dashboardService.overview();
    }

    @GetMapping("/incident-statistics")
    @Operation(summary = "Incident counts for a period")
    public IncidentStatistics incidentStatistics(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        return dashboardService.incidentStatistics(start, end);
    }
}
