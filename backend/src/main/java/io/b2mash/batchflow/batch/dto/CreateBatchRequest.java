package io.b2mash.batchflow.batch.dto;

import io.b2mash.batchflow.batch.BatchStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.List;

/** A new batch. {@code status} defaults to waiting; {@code workshopId} null means internal. */
public record CreateBatchRequest(
    @NotNull LocalDate cutDate,
    @NotEmpty List<@Valid LineItemRequest> lineItems,
    BatchStatus status,
    Long workshopId,
    LocalDate expectedReturnDate,
    @Size(max = 4000) String observations) {}
