package io.b2mash.batchflow.history;

import java.util.List;

/**
 * Append-only log of batch status transitions. Entries are written in the caller's transaction, so
 * a rolled-back transition leaves no entry behind.
 */
public interface HistoryLog {

  /**
   * Appends an entry for the batch.
   *
   * @param batchId the batch the action applies to
   * @param action one of the {@link HistoryActions} labels
   * @param userId acting user, or null to record the configured default actor
   * @param notes optional free text
   */
  void append(Long batchId, String action, Long userId, String notes);

  /** Entries for one batch, newest first. */
  List<BatchHistoryEntry> entriesFor(Long batchId);

  /** Removes every entry of a batch that is itself being deleted. */
  void purge(Long batchId);
}
