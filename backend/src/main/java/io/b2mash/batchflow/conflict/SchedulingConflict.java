package io.b2mash.batchflow.conflict;

import io.b2mash.batchflow.batch.Batch;
import java.time.LocalDate;

/** An open batch that a workshop is still expected to hold on a new batch's cut date. */
public record SchedulingConflict(
    Long batchId, String batchCode, LocalDate expectedReturnDate, LocalDate candidateCutDate) {

  public static SchedulingConflict of(Batch batch, LocalDate candidateCutDate) {
    return new SchedulingConflict(
        batch.getId(), batch.getCode(), batch.getExpectedReturnDate(), candidateCutDate);
  }

  public String message() {
    return "Batch "
        + batchCode
        + " is expected back on "
        + expectedReturnDate
        + ", after the cut date "
        + candidateCutDate
        + " of the new batch";
  }
}
