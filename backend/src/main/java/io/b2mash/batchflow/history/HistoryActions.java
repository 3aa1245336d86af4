package io.b2mash.batchflow.history;

import io.b2mash.batchflow.batch.BatchStatus;

/** Action labels written to the batch history. */
public final class HistoryActions {

  public static final String CREATED = "created";
  public static final String CONFLICT_RESOLVED = "conflict_resolved";
  public static final String IMAGE_UPDATED = "image_updated";

  private HistoryActions() {}

  public static String statusChanged(BatchStatus status) {
    return "status_changed:" + status.value();
  }
}
