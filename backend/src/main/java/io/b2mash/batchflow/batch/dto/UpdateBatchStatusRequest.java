package io.b2mash.batchflow.batch.dto;

import io.b2mash.batchflow.batch.BatchStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record UpdateBatchStatusRequest(
    @NotNull BatchStatus status, Long workshopId, @Size(max = 4000) String observations) {}
