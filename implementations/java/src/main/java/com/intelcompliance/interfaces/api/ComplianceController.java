package com.intelcompliance.interfaces.api;

import com.intelcompliance.application.compliance.ComplianceGap;
import com.intelcompliance.application.compliance.ComplianceReport;
import com.intelcompliance.application.compliance.ComplianceScoringService;
import com.intelcompliance.domain.model.ComplianceScoreSnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping(value = "/api/v1/compliance", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Tag(name = "Compliance", description = "Compliance scoring and reporting")
@SecurityRequirement(name = "basicAuth")
public class ComplianceController {

    private final ComplianceScoringService scoringService;

    @GetMapping("/score")
    @Operation(summary = "Current compliance score", description = "Computed on demand, not persisted")
    public ComplianceScoreSnapshot score() {
        return scoringService.calculateComplianceScore();
    }

    @GetMapping("/report")
    @Operation(summary = "Compliance report for a period")
    public ComplianceReport report(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        return scoringService.generateComplianceReport(start, end);
    }

    @GetMapping("/gaps")
    @Operation(summary = "Ranked compliance gaps")
    public List<ComplianceGap> gaps() {
        return scoringService.identifyComplianceGaps();
    }

    @PostMapping("/snapshots")
    @Operation(summary = "Record a compliance snapshot now")
    public ResponseEntity<ComplianceScoreSnapshot> recordSnapshot() {
        return ResponseEntity.status(HttpStatus.CREATED).body(scoringService.recordSnapshot());
    }

    @GetMapping("/trend")
    @Operation(summary = "Recorded snapshots, newest first")
    public List<ComplianceScoreSnapshot> trend(@RequestParam(defaultValue = "30") int limit) {
        return scoringService.complianceTrend(limit);
    }
}
