package com.kmg.analysis.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record CreateRunRequest(
        @NotNull JsonNode scope,
        String modelTag,
        Double ratePerSecond,
        @Min(1) @Max(1000) Integer itemLimit,
        Boolean dryRun,
        String triggeredBy,
        List<@NotNull Long> itemIds
) {
}
