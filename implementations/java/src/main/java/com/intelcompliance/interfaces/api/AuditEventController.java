package com.intelcompliance.interfaces.api;

import com.intelcompliance.application.SecurityContextProvider;
import com.intelcompliance.domain.exception.ValidationException;
import com.intelcompliance.domain.model.AuditEvent;
import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.TimeWindow;
import com.intelcompliance.infrastructure.audit.AuditEventCommand;
import com.intelcompliance.infrastructure.audit.AuditEventFilter;
import com.intelcompliance.infrastructure.audit.AuditService;
import com.intelcompliance.infrastructure.audit.AuditVerificationResult;
import com.intelcompliance.interfaces.api.dto.AuditEventResponse;
import com.intelcompliance.interfaces.api.dto.RecordAuditEventRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/audit-events")
@RequiredArgsConstructor
@Tag(name = "Audit", description = "Signed audit trail")
@SecurityRequirement(name = "basicAuth")
public class AuditEventController {

    private static final Duration MAX_QUERY_WINDOW = Duration.ofDays(31);
    private static final int MAX_CLIENT_DESCRIPTOR = 512;

    private final AuditService auditService;
    private final SecurityContextProvider securityContext;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Record an audit event")
    public ResponseEntity<AuditEventResponse> record(@Valid @RequestBody RecordAuditEventRequest request,
                                                     HttpServletRequest httpRequest) {
        String userAgent = httpRequest.getHeader(HttpHeaders.USER_AGENT);
        AuditEventCommand.AuditEventCommandBuilder command = AuditEventCommand.builder()
            .eventType(request.getEventType())
            .action(request.getAction())
            .actorId(request.getActorId() != null ? request.getActorId() : securityContext.currentActor())
            .resourceType(request.getResourceType())
            .resourceId(request.getResourceId())
            .classification(request.getClassification())
            .outcome(request.getOutcome())
            .originAddress(request.getOriginAddress() != null
                ? request.getOriginAddress() : httpRequest.getRemoteAddr())
            .clientDescriptor(userAgent != null && userAgent.length() > MAX_CLIENT_DESCRIPTOR
                ? userAgent.substring(0, MAX_CLIENT_DESCRIPTOR) : userAgent);
        if (request.getMetadata() != null) {
            command.metadata(request.getMetadata());
        }

        AuditEvent event = auditService.record(command.build());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(AuditEventResponse.from(event, request.getMetadata()));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Query events in a time window", description = "Window is [from, to), at most 31 days")
    public List<AuditEventResponse> query(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) Set<String> eventTypes,
            @RequestParam(required = false) AuditOutcome outcome,
            @RequestParam(required = false) String actorId) {

        AuditEventFilter filter = AuditEventFilter.builder()
            .eventTypes(eventTypes != null ? eventTypes : Set.of())
            .outcome(outcome)
            .actorId(actorId)
            .build();
        return auditService.queryWindow(filter, window(from, to)).stream()
            .map(e -> AuditEventResponse.from(e, e.isMetadataSealed() ? Map.of() : auditService.metadataOf(e)))
            .collect(Collectors.toList());
    }

    @GetMapping(value = "/verification", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Verify audit signatures in a time window")
    public AuditVerificationResult verify(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return auditService.verifyIntegrity(window(from, to));
    }

    private static TimeWindow window(Instant from, Instant to) {
        if (to.isBefore(from)) {
            throw new ValidationException("to", "must not precede from");
        }
        if (Duration.between(from, to).compareTo(MAX_QUERY_WINDOW) > 0) {
            throw new ValidationException("to", "window must not exceed " + MAX_QUERY_WINDOW.toDays() + " days");
        }
        return new TimeWindow(from, to);
    }
}
