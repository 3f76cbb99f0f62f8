package com.labassist.orchestration.lifecycle;

import com.labassist.config.LabAssistantProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Fails requests left running past their lease, e.g. after a worker crash.
 * Stuck requests are never re-queued.
 */
@Component
@ConditionalOnProperty(prefix = "labassist.worker", name = "reaper-enabled", havingValue = "true")
@Slf4j
public class StaleRequestReaper {

    static final String TIMED_OUT = "Processing timed out";

    private final RequestStateService stateService;
    private final Duration staleAfter;
    private final Clock clock;

    public StaleRequestReaper(RequestStateService stateService, LabAssistantProperties properties, Clock clock) {
        this.stateService = stateService;
        this.staleAfter = properties.getWorker().getStaleAfter();
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${labassist.worker.reaper-interval:1m}")
    public void reap() {
        reapOnce();
    }

    public int reapOnce() {
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minus(staleAfter);
        int reaped = 0;
        for (UUID id : stateService.findRunningSince(cutoff)) {
            if (stateService.fail(id, TIMED_OUT)) {
                log.warn("Request {} running since before {} marked failed", id, cutoff);
                reaped++;
            }
        }
        return reaped;
    }
}
