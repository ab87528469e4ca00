package com.missionpilot.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background loop that drives every running mission.
 *
 * The scheduling thread is the owner of all plans: only {@link MissionCoordinator#tick()}
 * mutates them, and it is only ever called from here. Everything else talks to
 * a plan by message:
 * <pre>
 *   worker thread    ──ProtocolDecision──►  inbox  ──tick()──►  plan
 *   HTTP thread      ──resolve / cancel──►  inbox / flags
 * </pre>
 *
 * On startup, missions left RUNNING by a previous process are picked up again;
 * their interrupted tasks restart from PENDING.
 */
@Component
@EnableScheduling
public class MissionScheduler {

    private static final Logger log = LoggerFactory.getLogger(MissionScheduler.class);

    private final MissionCoordinator coordinator;

    public MissionScheduler(MissionCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void resumeRunningMissions() {
        int resumed = coordinator.resume();
        if (resumed > 0) {
            log.info("Resumed {} running missions", resumed);
        }
    }

    /**
     * fixedDelay: the next tick starts tick-ms after the previous one finished,
     * so ticks never overlap.
     */
    @Scheduled(fixedDelayString = "${missionpilot.scheduler.tick-ms:1000}")
    public void tick() {
        coordinator.tick();
    }
}
