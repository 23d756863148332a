package com.kmg.analysis.api;

import com.kmg.analysis.dto.CreateRunRequest;
import com.kmg.analysis.dto.CreateRunResponse;
import com.kmg.analysis.dto.DeferredStatsView;
import com.kmg.analysis.dto.EnqueueItemsRequest;
import com.kmg.analysis.dto.EnqueueItemsResponse;
import com.kmg.analysis.dto.RunStatusView;
import com.kmg.analysis.service.RunService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/runs")
public class RunController {
    private final RunService runService;

    public RunController(RunService runService) {
        this.runService = runService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CreateRunResponse createRun(@Valid @RequestBody CreateRunRequest request) {
        return runService.createRun(request);
    }

    @PostMapping("/{id}/items")
    public EnqueueItemsResponse enqueueItems(@PathVariable long id, @Valid @RequestBody EnqueueItemsRequest request) {
        return runService.enqueueItems(id, request.itemIds());
    }

    @GetMapping("/active")
    public List<RunStatusView> listActiveRuns() {
        return runService.listActiveRuns();
    }

    @GetMapping("/deferred")
    public DeferredStatsView deferredStats(@RequestParam(required = false) Long runId) {
        return runService.getDeferredStats(runId);
    }

    @GetMapping("/{id}")
    public RunStatusView getRun(@PathVariable long id) {
        return runService.getRunStatus(id);
    }

    @PostMapping("/{id}/cancel")
    public RunStatusView cancel(@PathVariable long id) {
        return runService.cancelRun(id);
    }
}
