package com.kmg.analysis.api;

import com.kmg.analysis.dto.CreateRunResponse;
import com.kmg.analysis.dto.EnqueueItemsResponse;
import com.kmg.analysis.service.RunService;
import com.kmg.analysis.service.WorkerTelemetry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {RunController.class, WorkerController.class})
class RunControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RunService runService;

    @MockBean
    private WorkerTelemetry telemetry;

    @Test
    void createReturnsCreated() throws Exception {
        when(runService.createRun(any())).thenReturn(new CreateRunResponse(11L, 2, 0));

        mockMvc.perform(post("/api/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scope\":{\"source\":\"rss\"},\"itemIds\":[1,2]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.runId").value(11))
                .andExpect(jsonPath("$.enqueued").value(2));
    }

    @Test
    void createWithoutScopeIsRejected() throws Exception {
        mockMvc.perform(post("/api/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"itemLimit\":5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("scope")));
        verifyNoInteractions(runService);
    }

    @Test
    void itemLimitAboveMaximumIsRejected() throws Exception {
        mockMvc.perform(post("/api/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scope\":{},\"itemLimit\":5000}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void duplicateScopeIsConflict() throws Exception {
        when(runService.createRun(any()))
                .thenThrow(new IllegalStateException("An active run with the same scope already exists."));

        mockMvc.perform(post("/api/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scope\":{\"source\":\"rss\"}}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value(409));
    }

    @Test
    void unknownRunIsNotFound() throws Exception {
        when(runService.getRunStatus(42L)).thenThrow(new IllegalArgumentException("Run not found: 42"));

        mockMvc.perform(get("/api/runs/42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Run not found: 42"));
    }

    @Test
    void enqueueRequiresItemIds() throws Exception {
        mockMvc.perform(post("/api/runs/3/items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"itemIds\":[]}"))
                .andExpect(status().isBadRequest());

        when(runService.enqueueItems(eq(3L), any())).thenReturn(new EnqueueItemsResponse(3L, 1, 0, 4));
        mockMvc.perform(post("/api/runs/3/items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"itemIds\":[9]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalItems").value(4));
    }

    @Test
    void activeRunsListed() throws Exception {
        when(runService.listActiveRuns()).thenReturn(List.of());

        mockMvc.perform(get("/api/runs/active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }
}
