package io.b2mash.batchflow.conflict;

import io.b2mash.batchflow.batch.Batch;
import io.b2mash.batchflow.batch.BatchRepository;
import io.b2mash.batchflow.batch.BatchStatus;
import io.b2mash.batchflow.exception.InvalidStateException;
import io.b2mash.batchflow.exception.ResourceNotFoundException;
import io.b2mash.batchflow.history.HistoryActions;
import io.b2mash.batchflow.history.HistoryLog;
import io.b2mash.batchflow.workshop.WorkshopDirectory;
import java.time.LocalDate;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Detects workshop occupancy overlaps and applies the human-confirmed resolution. Nothing here
 * resolves a conflict on its own; {@link #resolveConflict} runs only when a person asks for it.
 */
@Service
public class ConflictDetector {

  private static final Logger log = LoggerFactory.getLogger(ConflictDetector.class);

  private final BatchRepository batchRepository;
  private final WorkshopDirectory workshopDirectory;
  private final HistoryLog historyLog;

  public ConflictDetector(
      BatchRepository batchRepository, WorkshopDirectory workshopDirectory, HistoryLog historyLog) {
    this.batchRepository = batchRepository;
    this.workshopDirectory = workshopDirectory;
    this.historyLog = historyLog;
  }

  /**
   * Finds the open batch of the workshop with the earliest expected return date strictly after the
   * candidate cut date. Callers that go on to create a batch must hold the workshop lock (see
   * {@link WorkshopDirectory#lockWorkshop}) for the result to stay valid.
   *
   * @throws ResourceNotFoundException if the workshop does not exist
   */
  @Transactional(readOnly = true)
  public Optional<SchedulingConflict> checkConflict(Long workshopId, LocalDate candidateCutDate) {
    if (workshopId == null || candidateCutDate == null) {
      return Optional.empty();
    }
    workshopDirectory.getWorkshop(workshopId);
    return batchRepository
        .findOpenReturningAfter(workshopId, BatchStatus.RETURNED, candidateCutDate)
        .stream()
        .findFirst()
        .map(batch -> SchedulingConflict.of(batch, candidateCutDate));
  }

  /**
   * Closes the conflicting batch so a batch cut on {@code candidateCutDate} can be created: the
   * conflicting batch is marked returned with an expected and actual return date of the day before,
   * or of its own cut date when the new batch is cut the same day or earlier.
   *
   * @param conflictingBatchId the open batch reported by {@link #checkConflict}
   * @param candidateCutDate cut date of the batch about to be created
   * @param userId acting user for the history entry
   * @return the updated batch
   */
  @Transactional
  public Batch resolveConflict(Long conflictingBatchId, LocalDate candidateCutDate, Long userId) {
    if (candidateCutDate == null) {
      throw new InvalidStateException("Missing cut date", "The new batch's cut date is required");
    }
    if (!batchRepository.existsById(conflictingBatchId)) {
      throw new ResourceNotFoundException("Batch", conflictingBatchId);
    }
    // Workshop lock before the batch is loaded, matching the order used by creation and billing.
    Long workshopId = batchRepository.findWorkshopIdOf(conflictingBatchId);
    if (workshopId != null) {
      workshopDirectory.lockWorkshop(workshopId);
    }
    var batch =
        batchRepository
            .findById(conflictingBatchId)
            .orElseThrow(() -> new ResourceNotFoundException("Batch", conflictingBatchId));

    LocalDate previousReturn = batch.getExpectedReturnDate();
    batch.closeForConflict(candidateCutDate.minusDays(1));
    batchRepository.save(batch);
    LocalDate newReturn = batch.getExpectedReturnDate();

    historyLog.append(
        batch.getId(),
        HistoryActions.CONFLICT_RESOLVED,
        userId,
        "Expected return moved from " + previousReturn + " to " + newReturn);
    log.info(
        "Resolved scheduling conflict: batch={}, workshop={}, returnDate={}",
        batch.getCode(),
        batch.getWorkshopId(),
        newReturn);
    return batch;
  }
}
