package com.labassist.orchestration.lifecycle;

import com.labassist.entity.LabRequest;
import com.labassist.entity.ToolCallLog;
import com.labassist.orchestration.model.AgentPlan;
import com.labassist.orchestration.model.ExecutionOutcome;
import com.labassist.orchestration.model.ToolCall;
import com.labassist.orchestration.service.JsonProcessingService;
import com.labassist.repository.LabRequestRepository;
import com.labassist.repository.ToolCallLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Worker-side access to request state. Every method runs in its own
 * transaction, so the persistence session is acquired and released per call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RequestStateService {

    private final LabRequestRepository labRequestRepository;
    private final ToolCallLogRepository toolCallLogRepository;
    private final JsonProcessingService jsonProcessingService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<UUID> nextQueued(int limit) {
        return labRequestRepository.findQueuedIds(PageRequest.of(0, Math.max(1, limit)));
    }

    /**
     * Atomically moves a request from queued to running.
     *
     * @return {@code false} when the request was not queued anymore
     */
    @Transactional
    public boolean claim(UUID id) {
        return labRequestRepository.claim(id, now()) == 1;
    }

    @Transactional(readOnly = true)
    public Optional<LabRequest> find(UUID id) {
        return labRequestRepository.findById(id);
    }

    @Transactional
    public void recordPlan(UUID id, AgentPlan plan) {
        if (labRequestRepository.updatePlan(id, jsonProcessingService.toJson(plan), now()) != 1) {
            throw new IllegalStateException("Request " + id + " is not running; plan not recorded");
        }
    }

    /**
     * Moves a running request to done and stores its tool calls in the same transaction.
     */
    @Transactional
    public void complete(UUID id, ExecutionOutcome outcome) {
        OffsetDateTime now = now();
        if (labRequestRepository.markDone(id, jsonProcessingService.toJson(outcome.result()), now) != 1) {
            throw new IllegalStateException("Request " + id + " is not running; result discarded");
        }
        LabRequest request = labRequestRepository.getReferenceById(id);
        List<ToolCall> toolCalls = outcome.toolCalls();
        for (int i = 0; i < toolCalls.size(); i++) {
            ToolCall call = toolCalls.get(i);
            toolCallLogRepository.save(ToolCallLog.builder()
                    .request(request)
                    .sequence(i)
                    .toolName(call.tool())
                    .toolInput(call.input())
                    .toolOutput(jsonProcessingService.toJson(call.output()))
                    .error(call.error())
                    .calledAt(call.timestamp().atOffset(ZoneOffset.UTC))
                    .build());
        }
    }

    /**
     * Moves a running request to failed.
     *
     * @return {@code false} when the request was not running, in which case nothing changed
     */
    @Transactional
    public boolean fail(UUID id, String error) {
        if (labRequestRepository.markFailed(id, error, now()) != 1) {
            log.warn("Request {} is not running; failure '{}' not recorded", id, error);
            return false;
        }
        return true;
    }

    @Transactional(readOnly = true)
    public List<UUID> findRunningSince(OffsetDateTime cutoff) {
        return labRequestRepository.findRunningStartedBefore(cutoff);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
