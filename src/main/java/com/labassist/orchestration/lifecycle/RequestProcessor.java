package com.labassist.orchestration.lifecycle;

import com.labassist.entity.LabRequest;
import com.labassist.orchestration.PlanExecutor;
import com.labassist.orchestration.model.AgentPlan;
import com.labassist.orchestration.model.ExecutionOutcome;
import com.labassist.orchestration.planner.RequestPlanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.UUID;

/**
 * Drives one request from queued through running to a terminal state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RequestProcessor {

    static final int MAX_ERROR_LENGTH = 2000;

    private final RequestStateService stateService;
    private final RequestPlanner planner;
    private final PlanExecutor planExecutor;

    /**
     * @return {@code true} if this call claimed the request and drove it to a
     * terminal state, {@code false} if another worker got it first
     */
    public boolean process(UUID id) {
        if (!stateService.claim(id)) {
            log.debug("Request {} was not claimable, skipping", id);
            return false;
        }
        log.info("Request {} claimed", id);
        try {
            LabRequest request = stateService.find(id)
                    .orElseThrow(() -> new IllegalStateException("Request " + id + " vanished after claim"));
            AgentPlan plan = planner.plan(request.getText());
            stateService.recordPlan(id, plan);
            log.info("Request {} planned with {} steps", id, plan.steps().size());

            ExecutionOutcome outcome = planExecutor.execute(request.getText(), plan);
            stateService.complete(id, outcome);
            log.info("Request {} completed ({} tool calls, {} sources)",
                    id, outcome.toolCalls().size(), outcome.result().sources().size());
        } catch (Exception ex) {
            String error = describe(ex);
            log.error("Request {} failed: {}", id, error, ex);
            stateService.fail(id, error);
        }
        return true;
    }

    static String describe(Exception ex) {
        String message = StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : ex.getClass().getSimpleName();
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
