package com.intelcompliance.config;

import com.intelcompliance.domain.model.DataClassification;
import com.intelcompliance.domain.model.IncidentSeverity;
import com.intelcompliance.domain.model.PolicyArea;
import com.intelcompliance.infrastructure.detection.DetectionRule;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Externalised settings for the compliance core, bound from {@code compliance.*}.
 *
 * <p>Scoring weights and detection rules are calibrated here against the
 * governing policy.
 */
@ConfigurationProperties(prefix = "compliance")
@Getter
@Setter
public class ComplianceProperties {

    private Crypto crypto = new Crypto();
    private Audit audit = new Audit();
    private Detection detection = new Detection();
    private Incident incident = new Incident();
    private Scoring scoring = new Scoring();

    @Getter
    @Setter
    public static class Crypto {
        /** 256-bit root secret, hex or base64. Required. */
        private String rootSecret;
        /** Salt for search hashes. Derived from the root secret when absent. */
        private String searchHashSalt;
        private Duration keyRotationInterval = Duration.ofDays(90);
        /** Keys due within this window are reported as upcoming rotations. */
        private Duration rotationWarning = Duration.ofDays(7);
        private String rotationCron = "0 0 2 * * *";
    }

    @Getter
    @Setter
    public static class Audit {
        /** Overrides of the per-classification default retention. */
        private Map<DataClassification, Duration> retention = new EnumMap<>(DataClassification.class);
        private String purgeCron = "0 30 3 * * *";

        public Duration retentionFor(DataClassification classification) {
            return retention.getOrDefault(classification, classification.getDefaultRetention());
        }
    }

    @Getter
    @Setter
    public static class Detection {
        private boolean enabled = true;
        private Duration sweepInterval = Duration.ofMinutes(1);
        private List<DetectionRule> rules = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Incident {
        private Map<IncidentSeverity, Duration> responseDeadlines = new EnumMap<>(IncidentSeverity.class);
        private Duration escalationInterval = Duration.ofMinutes(1);
        private Duration forensicsLookback = Duration.ofHours(1);
        private int forensicsMaxLogEntries = 500;
        private Duration networkBlockDuration = Duration.ofHours(24);

        public Duration responseDeadlineFor(IncidentSeverity severity) {
            return responseDeadlines.getOrDefault(severity, severity.getDefaultResponseDeadline());
        }
    }

    @Getter
    @Setter
    public static class Scoring {
        /** Relative weight per area; unlisted areas weigh 1.0. */
        private Map<PolicyArea, Double> weights = new EnumMap<>(PolicyArea.class);
        private double compliantThreshold = 90.0;
        private double atRiskThreshold = 70.0;
        private Duration defaultPeriod = Duration.ofDays(30);
        private String snapshotCron = "0 0 * * * *";

        public double weightOf(PolicyArea area) {
            return weights.getOrDefault(area, 1.0);
        }
    }
}
