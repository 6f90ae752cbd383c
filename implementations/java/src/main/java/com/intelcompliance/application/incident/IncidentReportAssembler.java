package com.intelcompliance.application.incident;

import com.intelcompliance.domain.exception.CryptoException;
import com.intelcompliance.domain.model.ContainmentAction;
import com.intelcompliance.domain.model.IncidentState;
import com.intelcompliance.domain.model.IncidentType;
import com.intelcompliance.domain.model.SecurityIncident;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns an incident and its forensics summaries into an {@link IncidentReport}.
 */
@Component
public class IncidentReportAssembler {

    private static final Map<IncidentType, List<String>> RECOMMENDATIONS = new EnumMap<>(IncidentType.class);

    static {
        RECOMMENDATIONS.put(IncidentType.DATA_BREACH, List.of(
            "Implement data loss prevention (DLP) controls",
            "Enhance user activity monitoring",
            "Review and update data classification policies"));
        RECOMMENDATIONS.put(IncidentType.UNAUTHORIZED_ACCESS, List.of(
            "Strengthen authentication requirements",
            "Implement IP allowlisting for sensitive resources",
            "Enhance intrusion detection capabilities"));
        RECOMMENDATIONS.put(IncidentType.BRUTE_FORCE, List.of(
            "Strengthen authentication requirements",
            "Enforce account lockout thresholds",
            "Implement IP allowlisting for sensitive resources"));
        RECOMMENDATIONS.put(IncidentType.MALWARE, List.of(
            "Review endpoint protection coverage",
            "Restrict software installation privileges"));
        RECOMMENDATIONS.put(IncidentType.SYSTEM_COMPROMISE, List.of(
            "Review endpoint protection coverage",
            "Audit privileged accounts on affected systems"));
        RECOMMENDATIONS.put(IncidentType.INSIDER_THREAT, List.of(
            "Review least-privilege role assignments",
            "Enhance user activity monitoring"));
        RECOMMENDATIONS.put(IncidentType.DATA_LOSS, List.of(
            "Implement data loss prevention (DLP) controls",
            "Verify backup and retention procedures"));
        RECOMMENDATIONS.put(IncidentType.DENIAL_OF_SERVICE, List.of(
            "Review rate limiting and upstream traffic filtering"));
        RECOMMENDATIONS.put(IncidentType.POLICY_VIOLATION, List.of(
            "Refresh security awareness training for involved users"));
        RECOMMENDATIONS.put(IncidentType.PHYSICAL_BREACH, List.of(
            "Review physical access controls and visitor logs"));
    }

    public IncidentReport assemble(SecurityIncident incident, List<IncidentReport.ForensicsEntry> forensics,
                                   Instant generatedAt) {
        List<ContainmentAction> actions = incident.getContainmentActions();
        long succeeded = actions.stream().filter(ContainmentAction::succeeded).count();
        long failed = actions.size() - succeeded;

        List<String> recommendations = new ArrayList<>(RECOMMENDATIONS.getOrDefault(incident.getType(), List.of()));
        if (failed > 0) {
            recommendations.add("Resolve " + failed + " failed containment action(s)");
        }
        if (forensics.stream().anyMatch(f -> !f.signatureValid())) {
            recommendations.add("Investigate forensics records that failed signature verification");
        }

        return IncidentReport.builder()
            .reportId(reportId(incident))
            .summary(new IncidentReport.Summary(incident.getId(), incident.getType(), incident.getSeverity(),
                incident.getState(), incident.getDescription(), incident.getDetectionMethod(),
                incident.getCreatedAt(), incident.getResponseDeadline(), incident.getEscalatedAt(),
                incident.enteredStateAt(IncidentState.RESOLVED).orElse(null)))
            .timeline(List.copyOf(incident.getTimeline()))
            .impact(new IncidentReport.Impact(Set.copyOf(incident.getAffectedSystems()),
                Set.copyOf(incident.getAffectedUsers()), incident.getSourceAddress(),
                incident.getType().impliesDataExposure()))
            .containment(new IncidentReport.ContainmentSummary(succeeded, failed, List.copyOf(actions)))
            .forensics(List.copyOf(forensics))
            .responders(Set.copyOf(incident.getResponders()))
            .requiredRoles(Set.copyOf(incident.getRequiredRoles()))
            .recommendations(List.copyOf(recommendations))
            .complianceNotes(complianceNotes(incident, generatedAt))
            .generatedAt(generatedAt)
            .build();
    }

    /**
     * {@code RPT-} followed by the first 16 hex characters of SHA-256 over the
     * incident id and version.
     */
    static String reportId(SecurityIncident incident) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                .digest((incident.getId() + incident.getVersion()).getBytes(StandardCharsets.UTF_8));
            return "RPT-" + HexFormat.of().formatHex(digest).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new CryptoException("SHA-256 unavailable", e);
        }
    }

    private static List<String> complianceNotes(SecurityIncident incident, Instant now) {
        List<String> notes = new ArrayList<>();
        if (incident.getType().impliesDataExposure()) {
            notes.add("CJI data was potentially compromised - FBI notification may be required");
            notes.add("Incident must be reported to the CJIS Systems Officer within 24 hours");
        }

        Instant deadline = incident.getResponseDeadline();
        Instant triagedAt = incident.enteredStateAt(IncidentState.TRIAGED).orElse(null);
        if ((triagedAt != null && triagedAt.isAfter(deadline))
                || (triagedAt == null && incident.getState() == IncidentState.NEW && now.isAfter(deadline))) {
            notes.add("Response deadline of " + deadline + " was exceeded");
        }

        if (incident.isActive()) {
            notes.add("Incident remains open in state " + incident.getState());
        }
        return List.copyOf(notes);
    }
}
