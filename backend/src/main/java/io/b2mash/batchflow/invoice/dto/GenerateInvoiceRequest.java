package io.b2mash.batchflow.invoice.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.List;

public record GenerateInvoiceRequest(
    @NotNull(message = "workshopId is required") Long workshopId,
    @NotEmpty(message = "batchIds must not be empty") List<@NotNull Long> batchIds,
    @NotNull(message = "dueDate is required") LocalDate dueDate,
    @Size(max = 4000) String notes) {}
