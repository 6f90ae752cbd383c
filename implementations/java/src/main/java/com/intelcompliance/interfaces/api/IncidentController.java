package com.intelcompliance.interfaces.api;

import com.intelcompliance.application.SecurityContextProvider;
import com.intelcompliance.application.incident.ContainmentRequest;
import com.intelcompliance.application.incident.ContainmentResult;
import com.intelcompliance.application.incident.CreateIncidentCommand;
import com.intelcompliance.application.incident.ForensicsRequest;
import com.intelcompliance.application.incident.ForensicsView;
import com.intelcompliance.application.incident.IncidentPatternSweep;
import com.intelcompliance.application.incident.IncidentReport;
import com.intelcompliance.application.incident.IncidentResponseService;
import com.intelcompliance.application.incident.RecoveryPlan;
import com.intelcompliance.domain.model.DetectionMethod;
import com.intelcompliance.domain.model.ForensicsCollectionType;
import com.intelcompliance.domain.model.IncidentState;
import com.intelcompliance.domain.model.SecurityIncident;
import com.intelcompliance.interfaces.api.dto.AssignResponderRequest;
import com.intelcompliance.interfaces.api.dto.CollectForensicsRequest;
import com.intelcompliance.interfaces.api.dto.ContainIncidentRequest;
import com.intelcompliance.interfaces.api.dto.CreateIncidentRequest;
import com.intelcompliance.interfaces.api.dto.ErrorResponse;
import com.intelcompliance.interfaces.api.dto.IncidentResponse;
import com.intelcompliance.interfaces.api.dto.StateTransitionRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST controller for the incident lifecycle.
 *
 * Every mutation is attributed to the authenticated operator and audited by
 * the service layer.
 */
@RestController
@RequestMapping("/api/v1/incidents")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Incidents", description = "Incident response operations")
@SecurityRequirement(name = "basicAuth")
public class IncidentController {

    private final IncidentResponseService incidentService;
    private final IncidentPatternSweep patternSweep;
    private final SecurityContextProvider securityContext;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Open an incident", description = "Creates a manually detected incident in state NEW")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Incident created",
            content = @Content(schema = @Schema(implementation = IncidentResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request parameters",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<IncidentResponse> createIncident(@Valid @RequestBody CreateIncidentRequest request) {
        CreateIncidentCommand.CreateIncidentCommandBuilder command = CreateIncidentCommand.builder()
            .type(request.getType())
            .severity(request.getSeverity())
            .description(request.getDescription())
            .detectionMethod(DetectionMethod.MANUAL)
            .sourceAddress(request.getSourceAddress())
            .initialFindings(request.getInitialFindings())
            .createdBy(securityContext.currentActor());
        if (request.getAffectedSystems() != null) {
            command.affectedSystems(request.getAffectedSystems());
        }
        if (request.getAffectedUsers() != null) {
            command.affectedUsers(request.getAffectedUsers());
        }

        SecurityIncident incident = incidentService.createIncident(command.build());
        return ResponseEntity.status(HttpStatus.CREATED).body(IncidentResponse.from(incident));
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get incident by id")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Incident found"),
        @ApiResponse(responseCode = "404", description = "Incident not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public IncidentResponse getIncident(@PathVariable String id) {
        return IncidentResponse.from(incidentService.getIncident(id));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List incidents", description = "Newest first, optionally filtered by state")
    public List<IncidentResponse> listIncidents(@RequestParam(required = false) IncidentState state) {
        return incidentService.listIncidents(state).stream()
            .map(IncidentResponse::from)
            .collect(Collectors.toList());
    }

    @PostMapping(value = "/{id}/transitions", consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Move an incident to another state")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Transition applied"),
        @ApiResponse(responseCode = "409", description = "Transition not allowed from the current state",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public IncidentResponse transition(@PathVariable String id, @Valid @RequestBody StateTransitionRequest request) {
        return IncidentResponse.from(incidentService.updateIncidentState(id, request.getState(),
            request.getNote(), securityContext.currentActor()));
    }

    @PostMapping(value = "/{id}/responders", consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Assign a responder")
    public IncidentResponse assignResponder(@PathVariable String id,
                                            @Valid @RequestBody AssignResponderRequest request) {
        return IncidentResponse.from(incidentService.assignResponder(id, request.getResponderId(),
            securityContext.currentActor()));
    }

    @PostMapping(value = "/{id}/containment", consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Execute containment actions",
        description = "Runs every action independently and reports succeeded and failed actions separately")
    public ContainmentResult contain(@PathVariable String id, @Valid @RequestBody ContainIncidentRequest request) {
        List<ContainmentRequest> actions = request.getActions() == null ? List.of() : request.getActions().stream()
            .map(a -> new ContainmentRequest(a.getType(), a.getTarget()))
            .collect(Collectors.toList());
        ContainmentResult result = incidentService.containIncident(id, actions, securityContext.currentActor());
        if (!result.getFailed().isEmpty() && log.isWarnEnabled()) {
            log.warn("Containment for {} finished with {} failed action(s)", id, result.getFailed().size());
        }
        return result;
    }

    @PostMapping(value = "/{id}/forensics", consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Collect forensic evidence")
    public ResponseEntity<ForensicsView> collectForensics(@PathVariable String id,
                                                          @Valid @RequestBody CollectForensicsRequest request) {
        ForensicsView view = incidentService.collectForensics(ForensicsRequest.builder()
            .incidentId(id)
            .collectionType(request.getCollectionType() != null
                ? request.getCollectionType() : ForensicsCollectionType.FULL)
            .source(request.getSource())
            .requestedBy(securityContext.currentActor())
            .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(view);
    }

    @GetMapping(value = "/forensics/{recordId}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Read a forensics record", description = "Decrypts the record and re-verifies its signature")
    public ForensicsView getForensics(@PathVariable UUID recordId) {
        return incidentService.getForensicsRecord(recordId);
    }

    @GetMapping(value = "/{id}/recovery-plan", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Generate a recovery plan")
    public RecoveryPlan recoveryPlan(@PathVariable String id) {
        return incidentService.generateRecoveryPlan(id);
    }

    @GetMapping(value = "/{id}/report", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Generate an incident report")
    public IncidentReport report(@PathVariable String id) {
        return incidentService.generateIncidentReport(id, securityContext.currentActor());
    }

    @PostMapping(value = "/pattern-check", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Run the pattern sweep now",
        description = "Returns the incidents opened; empty when a sweep is already running")
    public List<IncidentResponse> checkPatterns() {
        if (log.isInfoEnabled()) {
            log.info("Pattern sweep requested by {}", securityContext.currentActor());
        }
        return patternSweep.checkForIncidentPatterns().stream()
            .map(IncidentResponse::from)
            .collect(Collectors.toList());
    }
}
