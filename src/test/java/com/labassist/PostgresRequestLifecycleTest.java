package com.labassist;

import com.labassist.entity.RequestPriority;
import com.labassist.entity.RequestStatus;
import com.labassist.orchestration.lifecycle.LabRequestService;
import com.labassist.orchestration.lifecycle.RequestAcknowledgement;
import com.labassist.orchestration.lifecycle.RequestProcessor;
import com.labassist.orchestration.lifecycle.RequestStateService;
import com.labassist.orchestration.model.ToolCall;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PostgresRequestLifecycleTest extends BaseIntegrationTest {

    @Autowired
    private LabRequestService labRequestService;

    @Autowired
    private RequestStateService requestStateService;

    @Autowired
    private RequestProcessor requestProcessor;

    @Test
    void testQueuedRequestsProcessedHighPriorityFirst() {
        RequestAcknowledgement normal = labRequestService.submit("Sequencer upload failure", RequestPriority.NORMAL);
        RequestAcknowledgement high = labRequestService.submit("LIMS outage this morning", RequestPriority.HIGH);

        List<UUID> queued = requestStateService.nextQueued(10);
        assertEquals(List.of(high.requestId(), normal.requestId()), queued);

        queued.forEach(requestProcessor::process);

        assertEquals(RequestStatus.DONE, labRequestService.getStatus(high.requestId()).status());
        assertEquals(RequestStatus.DONE, labRequestService.getStatus(normal.requestId()).status());
        assertTrue(labRequestService.getStatus(high.requestId()).result().sources().contains("INC-003"));
        assertEquals(List.of("search_docs", "query_incidents"),
                labRequestService.getToolCalls(normal.requestId()).stream().map(ToolCall::tool).toList());
        assertTrue(requestStateService.nextQueued(10).isEmpty());
    }
}
