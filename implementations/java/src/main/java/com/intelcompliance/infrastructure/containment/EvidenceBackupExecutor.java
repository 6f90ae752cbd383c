package com.intelcompliance.infrastructure.containment;

import com.intelcompliance.domain.model.ContainmentActionType;
import com.intelcompliance.domain.model.ForensicsCollectionType;
import com.intelcompliance.domain.model.ForensicsRecord;
import com.intelcompliance.domain.model.SecurityIncident;
import com.intelcompliance.infrastructure.forensics.ForensicsCollector;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Preserves evidence by running a full forensics collection and linking the
 * record to the incident.
 */
@Component
@RequiredArgsConstructor
public class EvidenceBackupExecutor implements ContainmentExecutor {

    private final ForensicsCollector forensicsCollector;
    private final Clock clock;

    @Override
    public boolean supports(ContainmentActionType type) {
        return type == ContainmentActionType.BACKUP_EVIDENCE;
    }

    @Override
    public String execute(ContainmentActionType type, String target, SecurityIncident incident, String actor) {
        String source = target == null || target.isBlank() ? "containment:backup-evidence" : target;
        ForensicsRecord record = forensicsCollector.collect(incident, ForensicsCollectionType.FULL, source, actor);
        incident.linkForensics(record.getId().toString(), actor, clock.instant());
        return "Evidence preserved in forensics record " + record.getId();
    }
}
