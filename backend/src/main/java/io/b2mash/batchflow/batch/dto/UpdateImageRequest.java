package io.b2mash.batchflow.batch.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UpdateImageRequest(@NotBlank @Size(max = 1000) String imageUrl) {}
