package com.kmg.analysis.api;

import com.kmg.analysis.dto.WorkerTelemetryView;
import com.kmg.analysis.service.WorkerTelemetry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/worker")
public class WorkerController {
    private final WorkerTelemetry telemetry;

    public WorkerController(WorkerTelemetry telemetry) {
        this.telemetry = telemetry;
    }

    @GetMapping("/telemetry")
    public WorkerTelemetryView telemetry() {
        return telemetry.snapshot();
    }
}
