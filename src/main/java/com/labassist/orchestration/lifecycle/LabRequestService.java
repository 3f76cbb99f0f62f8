package com.labassist.orchestration.lifecycle;

import com.fasterxml.jackson.core.type.TypeReference;
import com.labassist.entity.LabRequest;
import com.labassist.entity.RequestPriority;
import com.labassist.entity.RequestStatus;
import com.labassist.entity.ToolCallLog;
import com.labassist.orchestration.model.AgentResult;
import com.labassist.orchestration.model.ToolCall;
import com.labassist.orchestration.service.JsonProcessingService;
import com.labassist.repository.LabRequestRepository;
import com.labassist.repository.ToolCallLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Intake and status queries. Input is validated by the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LabRequestService {

    private final LabRequestRepository labRequestRepository;
    private final ToolCallLogRepository toolCallLogRepository;
    private final JsonProcessingService jsonProcessingService;

    @Transactional
    public RequestAcknowledgement submit(String text, RequestPriority priority) {
        LabRequest request = labRequestRepository.save(LabRequest.builder()
                .text(text)
                .priority(priority != null ? priority : RequestPriority.NORMAL)
                .status(RequestStatus.QUEUED)
                .build());
        log.info("Request {} queued (priority={})", request.getId(), request.getPriority().value());
        return new RequestAcknowledgement(request.getId(), request.getStatus());
    }

    @Transactional(readOnly = true)
    public RequestStatusView getStatus(UUID id) {
        LabRequest request = labRequestRepository.findById(id)
                .orElseThrow(() -> new RequestNotFoundException(id.toString()));
        RequestStatus status = request.getStatus();
        AgentResult result = status == RequestStatus.DONE && request.getResultJson() != null
                ? jsonProcessingService.fromJson(request.getResultJson(), AgentResult.class)
                : null;
        String error = status == RequestStatus.FAILED ? request.getError() : null;
        return new RequestStatusView(request.getId(), status, result, error);
    }

    @Transactional(readOnly = true)
    public List<ToolCall> getToolCalls(UUID id) {
        if (!labRequestRepository.existsById(id)) {
            throw new RequestNotFoundException(id.toString());
        }
        return toolCallLogRepository.findByRequestIdOrderBySequenceAsc(id).stream()
                .map(this::toToolCall)
                .toList();
    }

    private ToolCall toToolCall(ToolCallLog entry) {
        Object output = entry.getToolOutput() == null
                ? List.of()
                : jsonProcessingService.fromJson(entry.getToolOutput(), new TypeReference<Object>() { });
        return new ToolCall(entry.getToolName(), entry.getToolInput(), output,
                entry.getCalledAt().toInstant(), entry.getError());
    }
}
