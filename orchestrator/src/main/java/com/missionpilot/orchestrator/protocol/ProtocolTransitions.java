package com.missionpilot.orchestrator.protocol;

import com.missionpilot.orchestrator.model.Task;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs and counts protocol state transitions:
 * <pre>
 *   missionpilot.protocol.transitions{tier="1|2", phase}
 * </pre>
 */
@Component
public class ProtocolTransitions {

    private static final Logger log = LoggerFactory.getLogger(ProtocolTransitions.class);

    private final MeterRegistry meterRegistry;

    public ProtocolTransitions(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void enter(Task task, ProtocolPhase phase, String detail) {
        meterRegistry.counter("missionpilot.protocol.transitions",
                "tier", String.valueOf(phase.tier()), "phase", phase.name()).increment();
        if (phase == ProtocolPhase.CIRCUIT_BREAKER_TRIPPED
                || phase == ProtocolPhase.RESEARCH_EXHAUSTED
                || phase == ProtocolPhase.KNOWLEDGE_BASE_CONFLICT) {
            log.warn("Tier {} {} -> {}: {}", phase.tier(), task, phase, detail);
        } else {
            log.info("Tier {} {} -> {}: {}", phase.tier(), task, phase, detail);
        }
    }
}
