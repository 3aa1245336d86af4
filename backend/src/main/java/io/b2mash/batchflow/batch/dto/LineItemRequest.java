package io.b2mash.batchflow.batch.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record LineItemRequest(
    @NotNull Long productId,
    @NotNull @Min(1) Integer quantity,
    @Size(max = 100) String selectedColor,
    @Size(max = 50) String selectedSize) {}
