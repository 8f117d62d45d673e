package com.platform.drengine.api;

import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.GlobalExceptionHandler;
import com.platform.drengine.error.ResourceNotFoundException;
import com.platform.drengine.error.ValidationException;
import com.platform.drengine.failover.FailoverCancelResult;
import com.platform.drengine.failover.FailoverOrchestrator;
import com.platform.drengine.failover.FailoverState;
import com.platform.drengine.failover.FailoverTriggerResult;
import com.platform.drengine.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class FailoverControllerTest {

    private static final String TRIGGER = """
        {"primaryRegion":"us-east-1","targetRegion":"us-west-2","triggerType":"MANUAL","requestedBy":"ops"}
        """;

    private FailoverOrchestrator orchestrator;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        orchestrator = mock(FailoverOrchestrator.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new FailoverController(orchestrator))
            .setControllerAdvice(new GlobalExceptionHandler(new MetricsRegistry(new SimpleMeterRegistry())))
            .addPlaceholderValue("drengine.api.allowed-origins", "*")
            .build();
    }

    @Test
    void acceptedTriggerReturns202() throws Exception {
        UUID eventId = UUID.randomUUID();
        when(orchestrator.trigger(any())).thenReturn(FailoverTriggerResult.accepted(eventId));

        mockMvc.perform(post("/api/failovers").contentType(MediaType.APPLICATION_JSON).content(TRIGGER))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.status").value("ACCEPTED"))
            .andExpect(jsonPath("$.eventId").value(eventId.toString()));
    }

    @Test
    void triggerWhileAnotherFailoverIsActiveReturns409() throws Exception {
        UUID active = UUID.randomUUID();
        when(orchestrator.trigger(any())).thenReturn(FailoverTriggerResult.inProgress(active, "busy"));

        mockMvc.perform(post("/api/failovers").contentType(MediaType.APPLICATION_JSON).content(TRIGGER))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.eventId").value(active.toString()))
            .andExpect(jsonPath("$.errorCode").value(ErrorCode.FAILOVER_IN_PROGRESS.getCode()));
    }

    @Test
    void requestWithoutTargetIsRejectedBeforeReachingTheOrchestrator() throws Exception {
        mockMvc.perform(post("/api/failovers").contentType(MediaType.APPLICATION_JSON)
                .content("{\"primaryRegion\":\"us-east-1\",\"triggerType\":\"MANUAL\"}"))
            .andExpect(status().isBadRequest());

        verify(orchestrator, never()).trigger(any());
    }

    @Test
    void unknownRegionMapsTo400() throws Exception {
        when(orchestrator.trigger(any()))
            .thenThrow(new ValidationException(ErrorCode.UNKNOWN_REGION, "Unknown region: us-west-2"));

        mockMvc.perform(post("/api/failovers").contentType(MediaType.APPLICATION_JSON).content(TRIGGER))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(ErrorCode.UNKNOWN_REGION.getCode()));
    }

    @Test
    void cancelPastPointOfNoReturnReturns409() throws Exception {
        UUID eventId = UUID.randomUUID();
        when(orchestrator.cancel(eventId, "alice"))
            .thenReturn(FailoverCancelResult.pastPointOfNoReturn(eventId, FailoverState.PROMOTING));

        mockMvc.perform(post("/api/failovers/{id}/cancel", eventId).header("X-Requested-By", "alice"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.status").value("PAST_POINT_OF_NO_RETURN"));
    }

    @Test
    void unknownEventReturns404() throws Exception {
        UUID eventId = UUID.randomUUID();
        when(orchestrator.event(eventId))
            .thenThrow(new ResourceNotFoundException(ErrorCode.FAILOVER_EVENT_NOT_FOUND, "FailoverEvent", eventId));

        mockMvc.perform(get("/api/failovers/{id}", eventId))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value(ErrorCode.FAILOVER_EVENT_NOT_FOUND.getCode()));
    }

    @Test
    void noActiveFailoverReturns204() throws Exception {
        when(orchestrator.activeEvent("us-east-1")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/failovers/active").param("primaryRegion", "us-east-1"))
            .andExpect(status().isNoContent());
    }
}
