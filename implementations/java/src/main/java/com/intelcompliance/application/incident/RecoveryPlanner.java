package com.intelcompliance.application.incident;

import com.intelcompliance.domain.model.ContainmentAction;
import com.intelcompliance.domain.model.IncidentSeverity;
import com.intelcompliance.domain.model.ResponderRole;
import com.intelcompliance.domain.model.SecurityIncident;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds recovery plans from per-type templates. Pure: no I/O, no state.
 *
 * <p>Step order: retries for failed containment actions, then the type's
 * template, then the extra steps required for CRITICAL and HIGH incidents.
 */
@Component
public class RecoveryPlanner {

    private static final List<Template> DATA_BREACH = List.of(
        new Template("Verify containment completion", "Confirm every containment action holds", 30, ResponderRole.SECURITY_ANALYST),
        new Template("Reset affected credentials", "Reset credentials of all affected users", 60, ResponderRole.SECURITY_ANALYST),
        new Template("Patch identified vulnerabilities", "Close the access path used in the breach", 120, ResponderRole.SECURITY_ANALYST),
        new Template("Restore from clean backups", "Restore altered data from verified backups where needed", 240, ResponderRole.SECURITY_ANALYST),
        new Template("Implement additional monitoring", "Add monitoring on the exposed data stores", 60, ResponderRole.SECURITY_ANALYST),
        new Template("Verify system integrity", "Check integrity of affected systems and audit trail", 90, ResponderRole.SECURITY_ANALYST),
        new Template("Document lessons learned", "Record root cause and follow-up actions", 60, ResponderRole.INCIDENT_COMMANDER));

    private static final List<Template> MALWARE = List.of(
        new Template("Ensure malware is fully removed", "Remove malicious binaries and artifacts", 90, ResponderRole.SECURITY_ANALYST),
        new Template("Scan connected systems", "Scan every system reachable from the affected hosts", 180, ResponderRole.SECURITY_ANALYST),
        new Template("Update detection signatures", "Update antivirus and detection signatures", 30, ResponderRole.SECURITY_ANALYST),
        new Template("Restore clean system images", "Rebuild affected hosts from known-good images", 240, ResponderRole.SECURITY_ANALYST),
        new Template("Verify no persistence mechanisms", "Check scheduled tasks, services and startup items", 60, ResponderRole.SECURITY_ANALYST),
        new Template("Monitor for reinfection", "Watch the restored hosts for renewed activity", 120, ResponderRole.SECURITY_ANALYST));

    private static final List<Template> DEFAULT = List.of(
        new Template("Verify incident containment", "Confirm containment actions hold", 30, ResponderRole.SECURITY_ANALYST),
        new Template("Remove threat artifacts", "Remove anything the attacker left behind", 60, ResponderRole.SECURITY_ANALYST),
        new Template("Apply security patches", "Patch the weaknesses involved", 90, ResponderRole.SECURITY_ANALYST),
        new Template("Restore normal operations", "Return affected services to production", 120, ResponderRole.SECURITY_ANALYST),
        new Template("Implement monitoring", "Add monitoring for recurrence", 60, ResponderRole.SECURITY_ANALYST));

    private static final List<Template> HIGH_SEVERITY = List.of(
        new Template("Notify executive leadership", "Brief leadership on impact and recovery status", 30, ResponderRole.INCIDENT_COMMANDER),
        new Template("Out-of-band verification", "Verify restored systems through an independent channel", 60, ResponderRole.SECURITY_ANALYST));

    private static final List<String> VALIDATION_CHECKS = List.of(
        "Verify all malicious artifacts removed",
        "Confirm no unauthorized access remains",
        "Validate system integrity",
        "Test restored functionality",
        "Verify security controls are effective");

    private static final long RETRY_MINUTES = 30;

    public RecoveryPlan plan(SecurityIncident incident, Instant generatedAt) {
        List<RecoveryPlan.Step> steps = new ArrayList<>();

        for (ContainmentAction failed : incident.getContainmentActions()) {
            if (!failed.succeeded()) {
                steps.add(new RecoveryPlan.Step(steps.size() + 1,
                    "Retry " + failed.getType(),
                    "Retry failed containment on " + (failed.getTarget() != null ? failed.getTarget() : "incident scope")
                        + ": " + failed.getDetail(),
                    RETRY_MINUTES, ResponderRole.SECURITY_ANALYST));
            }
        }

        List<Template> templates = new ArrayList<>(switch (incident.getType()) {
            case DATA_BREACH -> DATA_BREACH;
            case MALWARE -> MALWARE;
            default -> DEFAULT;
        });
        if (incident.getSeverity().isAtLeast(IncidentSeverity.HIGH)) {
            templates.addAll(HIGH_SEVERITY);
        }
        for (Template template : templates) {
            steps.add(new RecoveryPlan.Step(steps.size() + 1, template.title(), template.description(),
                template.minutes(), template.owner()));
        }

        return RecoveryPlan.builder()
            .incidentId(incident.getId())
            .incidentType(incident.getType())
            .severity(incident.getSeverity())
            .steps(List.copyOf(steps))
            .validationChecks(VALIDATION_CHECKS)
            .estimatedDurationMinutes(steps.stream().mapToLong(RecoveryPlan.Step::estimatedMinutes).sum())
            .generatedAt(generatedAt)
            .build();
    }

    private record Template(String title, String description, long minutes, ResponderRole owner) {
    }
}
