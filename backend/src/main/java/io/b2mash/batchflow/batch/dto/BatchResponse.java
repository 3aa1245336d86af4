package io.b2mash.batchflow.batch.dto;

import io.b2mash.batchflow.batch.Batch;
import io.b2mash.batchflow.batch.BatchLineItem;
import io.b2mash.batchflow.batch.BatchStatus;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record BatchResponse(
    Long id,
    String code,
    LocalDate cutDate,
    BatchStatus status,
    Long workshopId,
    LocalDate sentToProductionDate,
    LocalDate expectedReturnDate,
    LocalDate actualReturnDate,
    String observations,
    String imageUrl,
    boolean paid,
    Instant createdAt,
    Instant updatedAt,
    List<LineItemResponse> lineItems) {

  public static BatchResponse from(Batch batch, List<BatchLineItem> lineItems) {
    return new BatchResponse(
        batch.getId(),
        batch.getCode(),
        batch.getCutDate(),
        batch.getStatus(),
        batch.getWorkshopId(),
        batch.getSentToProductionDate(),
        batch.getExpectedReturnDate(),
        batch.getActualReturnDate(),
        batch.getObservations(),
        batch.getImageUrl(),
        batch.isPaid(),
        batch.getCreatedAt(),
        batch.getUpdatedAt(),
        lineItems.stream().map(LineItemResponse::from).toList());
  }
}
