package com.labassist.orchestration.lifecycle;

import com.labassist.config.LabAssistantProperties;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class StaleRequestReaperTest {

    @Test
    void testFailsRequestsRunningPastLease() {
        RequestStateService stateService = mock(RequestStateService.class);
        LabAssistantProperties properties = new LabAssistantProperties();
        properties.getWorker().setStaleAfter(Duration.ofMinutes(5));
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        StaleRequestReaper reaper = new StaleRequestReaper(stateService, properties, Clock.fixed(now, ZoneOffset.UTC));

        UUID stuck = UUID.randomUUID();
        UUID finishedMeanwhile = UUID.randomUUID();
        OffsetDateTime cutoff = OffsetDateTime.parse("2024-05-01T09:55:00Z");
        when(stateService.findRunningSince(cutoff)).thenReturn(List.of(stuck, finishedMeanwhile));
        when(stateService.fail(stuck, StaleRequestReaper.TIMED_OUT)).thenReturn(true);
        when(stateService.fail(finishedMeanwhile, StaleRequestReaper.TIMED_OUT)).thenReturn(false);

        assertEquals(1, reaper.reapOnce());
    }
}
