package com.missionpilot.orchestrator.api;

import com.missionpilot.orchestrator.api.dto.CapabilityResponse;
import com.missionpilot.orchestrator.api.dto.EscalationResponse;
import com.missionpilot.orchestrator.api.dto.PersonaResponse;
import com.missionpilot.orchestrator.api.dto.ResolveEscalationRequest;
import com.missionpilot.orchestrator.capability.CapabilityRegistry;
import com.missionpilot.orchestrator.knowledge.KnowledgeBaseDocument;
import com.missionpilot.orchestrator.knowledge.KnowledgeBaseStore;
import com.missionpilot.orchestrator.model.EscalationStatus;
import com.missionpilot.orchestrator.model.HumanEscalation;
import com.missionpilot.orchestrator.service.MissionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * Operator-facing endpoints.
 *
 * GET    /escalations?status=OPEN     escalations awaiting a human
 * POST   /escalations/{id}/resolve    succeed or cancel the blocked task
 * GET    /capabilities                the Capability Manifest, with health
 * DELETE /capabilities/{name}         unregister a tool
 * GET    /personas/{name}             latest persona document
 */
@RestController
public class OperatorController {

    private final MissionService     missionService;
    private final CapabilityRegistry capabilities;
    private final KnowledgeBaseStore knowledgeBase;

    public OperatorController(MissionService missionService,
                              CapabilityRegistry capabilities,
                              KnowledgeBaseStore knowledgeBase) {
        this.missionService = missionService;
        this.capabilities   = capabilities;
        this.knowledgeBase  = knowledgeBase;
    }

    @GetMapping("/escalations")
    public List<EscalationResponse> listEscalations(
            @RequestParam(defaultValue = "OPEN") EscalationStatus status) {
        return missionService.escalations(status).stream()
                .map(EscalationResponse::from)
                .toList();
    }

    /**
     * Resolve an open escalation.
     *
     * HTTP 400: no action given
     * HTTP 404: escalation not found
     * HTTP 409: escalation already closed, or its mission no longer running
     */
    @PostMapping("/escalations/{id}/resolve")
    public EscalationResponse resolve(@PathVariable UUID id, @RequestBody ResolveEscalationRequest req) {
        if (req.action() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "action is required (SUCCEED or CANCEL)");
        }
        HumanEscalation escalation = missionService.findEscalation(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Escalation not found: " + id));
        try {
            return EscalationResponse.from(missionService.resolve(escalation, req.action(), req.observation()));
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    @GetMapping("/capabilities")
    public List<CapabilityResponse> listCapabilities() {
        return capabilities.all().stream()
                .map(e -> CapabilityResponse.from(e, capabilities.health(e.toolName()).orElse(null)))
                .toList();
    }

    /**
     * Remove a tool from the registry; the Tool Gateway refuses it afterwards
     * and tasks needing it see a capability gap.
     *
     * HTTP 404: no such tool
     */
    @DeleteMapping("/capabilities/{name}")
    public ResponseEntity<Void> unregisterCapability(@PathVariable String name) {
        if (!capabilities.unregister(name)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Capability not found: " + name);
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/personas/{name}")
    public PersonaResponse getPersona(@PathVariable String name) {
        KnowledgeBaseDocument latest;
        try {
            latest = knowledgeBase.read(name);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        if (!latest.exists()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Persona not found: " + name);
        }
        return PersonaResponse.from(latest, knowledgeBase.history(name));
    }
}
