package com.labassist.orchestration.lifecycle;

import com.labassist.config.LabAssistantProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Single background loop that processes queued requests one at a time,
 * high priority first, then oldest first.
 */
@Component
@ConditionalOnProperty(prefix = "labassist.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class RequestWorker {

    private final RequestStateService stateService;
    private final RequestProcessor processor;
    private final int batchSize;

    public RequestWorker(RequestStateService stateService, RequestProcessor processor,
                         LabAssistantProperties properties) {
        this.stateService = stateService;
        this.processor = processor;
        this.batchSize = properties.getWorker().getBatchSize();
    }

    @Scheduled(fixedDelayString = "${labassist.worker.poll-interval:1s}")
    public void poll() {
        int processed = pollOnce();
        if (processed > 0) {
            log.debug("Worker tick processed {} requests", processed);
        }
    }

    /**
     * Processes the current batch of queued requests.
     *
     * @return how many requests this worker drove to a terminal state
     */
    public int pollOnce() {
        List<UUID> queued;
        try {
            queued = stateService.nextQueued(batchSize);
        } catch (RuntimeException ex) {
            log.error("Could not list queued requests: {}", ex.getMessage(), ex);
            return 0;
        }
        int processed = 0;
        for (UUID id : queued) {
            try {
                if (processor.process(id)) {
                    processed++;
                }
            } catch (RuntimeException ex) {
                // Storage failed while recording the outcome; the request stays running for the reaper.
                log.error("Worker could not finish request {}: {}", id, ex.getMessage(), ex);
            }
        }
        return processed;
    }
}
