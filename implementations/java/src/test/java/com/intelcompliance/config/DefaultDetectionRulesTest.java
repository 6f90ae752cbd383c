package com.intelcompliance.config;

import com.intelcompliance.domain.model.AuditEventTypes;
import com.intelcompliance.domain.model.IncidentSeverity;
import com.intelcompliance.domain.model.IncidentType;
import com.intelcompliance.infrastructure.detection.DetectionRule;
import com.intelcompliance.infrastructure.detection.DetectionRuleType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Binds the shipped application.yml and checks the default detection rules.
 */
class DefaultDetectionRulesTest {

    private ComplianceProperties.Detection detection;
    private Map<String, DetectionRule> rules;

    @BeforeEach
    void setUp() throws IOException {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
            .load("application", new ClassPathResource("application.yml"));
        detection = new Binder(ConfigurationPropertySources.from(sources))
            .bind("compliance.detection", ComplianceProperties.Detection.class)
            .get();
        rules = detection.getRules().stream()
            .collect(Collectors.toMap(DetectionRule::getId, Function.identity()));
    }

    @Test
    void ships_exactly_four_rules() {
        assertTrue(detection.isEnabled());
        assertEquals(4, detection.getRules().size());
        List<String> ids = detection.getRules().stream().map(DetectionRule::getId).collect(Collectors.toList());
        assertEquals(List.of("brute-force-login", "bulk-export-count", "bulk-export-volume",
            "privileged-denial-burst"), ids);
    }

    @Test
    void brute_force_counts_failed_logins_per_origin() {
        DetectionRule rule = rules.get("brute-force-login");

        assertEquals(DetectionRuleType.EVENT_COUNT, rule.getType());
        assertEquals(List.of(AuditEventTypes.LOGIN_FAILED), rule.getEventTypes());
        assertEquals(DetectionRule.GroupBy.ORIGIN_ADDRESS, rule.getGroupBy());
        assertEquals(10, rule.getThreshold());
        assertEquals(Duration.ofMinutes(5), rule.getWindow());
        assertEquals(IncidentType.BRUTE_FORCE, rule.getIncidentType());
        assertEquals(IncidentSeverity.MEDIUM, rule.getSeverity());
    }

    @Test
    void export_rules_flag_exfiltration_by_count_and_by_bytes() {
        DetectionRule count = rules.get("bulk-export-count");
        DetectionRule volume = rules.get("bulk-export-volume");

        assertEquals(DetectionRuleType.EVENT_COUNT, count.getType());
        assertEquals(List.of(AuditEventTypes.FILE_DOWNLOAD, AuditEventTypes.DATA_EXPORT), count.getEventTypes());
        assertEquals(DetectionRule.GroupBy.ACTOR, count.getGroupBy());
        assertEquals(50, count.getThreshold());
        assertEquals(Duration.ofHours(1), count.getWindow());
        assertEquals(IncidentType.DATA_BREACH, count.getIncidentType());
        assertEquals(IncidentSeverity.HIGH, count.getSeverity());

        assertEquals(DetectionRuleType.METADATA_SUM, volume.getType());
        assertEquals(List.of(AuditEventTypes.FILE_DOWNLOAD, AuditEventTypes.DATA_EXPORT), volume.getEventTypes());
        assertEquals(DetectionRule.GroupBy.ACTOR, volume.getGroupBy());
        assertEquals("bytes", volume.getSumField());
        assertEquals(1_073_741_824L, volume.getThreshold());
        assertEquals(Duration.ofHours(1), volume.getWindow());
        assertEquals(IncidentType.DATA_BREACH, volume.getIncidentType());
        assertEquals(IncidentSeverity.HIGH, volume.getSeverity());
    }

    @Test
    void denial_burst_counts_access_denied_per_actor() {
        DetectionRule rule = rules.get("privileged-denial-burst");

        assertEquals(DetectionRuleType.EVENT_COUNT, rule.getType());
        assertEquals(List.of(AuditEventTypes.ACCESS_DENIED), rule.getEventTypes());
        assertEquals(DetectionRule.GroupBy.ACTOR, rule.getGroupBy());
        assertEquals(5, rule.getThreshold());
        assertEquals(Duration.ofMinutes(30), rule.getWindow());
        assertEquals(IncidentType.UNAUTHORIZED_ACCESS, rule.getIncidentType());
        assertEquals(IncidentSeverity.MEDIUM, rule.getSeverity());
    }
}
