package io.b2mash.batchflow.batch.dto;

import io.b2mash.batchflow.history.BatchHistoryEntry;
import java.time.Instant;

public record HistoryEntryResponse(
    Long id, Long batchId, String action, Long userId, Instant occurredAt, String notes) {

  public static HistoryEntryResponse from(BatchHistoryEntry entry) {
    return new HistoryEntryResponse(
        entry.getId(),
        entry.getBatchId(),
        entry.getAction(),
        entry.getUserId(),
        entry.getOccurredAt(),
        entry.getNotes());
  }
}
