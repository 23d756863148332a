package com.kmg.analysis.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record EnqueueItemsRequest(@NotEmpty List<@NotNull Long> itemIds) {
}
