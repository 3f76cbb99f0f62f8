package com.labassist.orchestration.lifecycle;

import com.labassist.config.LabAssistantProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RequestWorkerTest {

    private RequestStateService stateService;
    private RequestProcessor processor;
    private RequestWorker worker;

    @BeforeEach
    void setUp() {
        stateService = mock(RequestStateService.class);
        processor = mock(RequestProcessor.class);
        LabAssistantProperties properties = new LabAssistantProperties();
        properties.getWorker().setBatchSize(3);
        worker = new RequestWorker(stateService, processor, properties);
    }

    @Test
    void testProcessesQueuedRequestsInOrder() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        when(stateService.nextQueued(3)).thenReturn(List.of(first, second));
        when(processor.process(first)).thenReturn(true);
        when(processor.process(second)).thenReturn(false);

        assertEquals(1, worker.pollOnce());

        var order = inOrder(processor);
        order.verify(processor).process(first);
        order.verify(processor).process(second);
    }

    @Test
    void testLoopContinuesAfterRequestFailure() {
        UUID broken = UUID.randomUUID();
        UUID healthy = UUID.randomUUID();
        when(stateService.nextQueued(3)).thenReturn(List.of(broken, healthy));
        when(processor.process(broken)).thenThrow(new DataAccessResourceFailureException("db down"));
        when(processor.process(healthy)).thenReturn(true);

        assertEquals(1, worker.pollOnce());
        verify(processor).process(healthy);
    }

    @Test
    void testListingFailureSkipsTick() {
        when(stateService.nextQueued(3)).thenThrow(new DataAccessResourceFailureException("db down"));

        assertEquals(0, worker.pollOnce());
        verifyNoInteractions(processor);
    }
}
