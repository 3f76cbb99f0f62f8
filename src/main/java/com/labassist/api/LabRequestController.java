package com.labassist.api;

import com.labassist.orchestration.lifecycle.LabRequestService;
import com.labassist.orchestration.lifecycle.RequestAcknowledgement;
import com.labassist.orchestration.lifecycle.RequestNotFoundException;
import com.labassist.orchestration.lifecycle.RequestStatusView;
import com.labassist.orchestration.model.ToolCall;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/requests")
public class LabRequestController {

    private final LabRequestService labRequestService;

    public LabRequestController(LabRequestService labRequestService) {
        this.labRequestService = labRequestService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public RequestAcknowledgement create(@Valid @RequestBody LabRequestCreate request) {
        return labRequestService.submit(request.text(), request.priority());
    }

    @GetMapping("/{requestId}")
    public RequestStatusView get(@PathVariable String requestId) {
        return labRequestService.getStatus(parseId(requestId));
    }

    @GetMapping("/{requestId}/tool-calls")
    public List<ToolCall> toolCalls(@PathVariable String requestId) {
        return labRequestService.getToolCalls(parseId(requestId));
    }

    private static UUID parseId(String requestId) {
        try {
            return UUID.fromString(requestId);
        } catch (IllegalArgumentException ex) {
            throw new RequestNotFoundException(requestId);
        }
    }
}
