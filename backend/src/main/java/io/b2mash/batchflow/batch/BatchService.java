package io.b2mash.batchflow.batch;

import io.b2mash.batchflow.batch.dto.BatchResponse;
import io.b2mash.batchflow.batch.dto.CreateBatchRequest;
import io.b2mash.batchflow.batch.dto.LineItemRequest;
import io.b2mash.batchflow.config.BatchflowProperties;
import io.b2mash.batchflow.conflict.ConflictDetector;
import io.b2mash.batchflow.exception.InvalidStateException;
import io.b2mash.batchflow.exception.ResourceConflictException;
import io.b2mash.batchflow.exception.ResourceNotFoundException;
import io.b2mash.batchflow.exception.SchedulingConflictException;
import io.b2mash.batchflow.history.BatchHistoryEntry;
import io.b2mash.batchflow.history.HistoryActions;
import io.b2mash.batchflow.history.HistoryLog;
import io.b2mash.batchflow.invoice.InvoiceBatchLinkRepository;
import io.b2mash.batchflow.workshop.WorkshopDirectory;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/** Owns batches and their line items: creation, status transitions and deletion. */
@Service
public class BatchService {

  private static final Logger log = LoggerFactory.getLogger(BatchService.class);

  private static final Pattern NUMERIC_CODE = Pattern.compile("\\d{1,9}");

  private final BatchRepository batchRepository;
  private final BatchLineItemRepository lineItemRepository;
  private final InvoiceBatchLinkRepository invoiceBatchLinkRepository;
  private final ConflictDetector conflictDetector;
  private final WorkshopDirectory workshopDirectory;
  private final HistoryLog historyLog;
  private final BatchflowProperties properties;
  private final TransactionTemplate transactionTemplate;

  public BatchService(
      BatchRepository batchRepository,
      BatchLineItemRepository lineItemRepository,
      InvoiceBatchLinkRepository invoiceBatchLinkRepository,
      ConflictDetector conflictDetector,
      WorkshopDirectory workshopDirectory,
      HistoryLog historyLog,
      BatchflowProperties properties,
      TransactionTemplate transactionTemplate) {
    this.batchRepository = batchRepository;
    this.lineItemRepository = lineItemRepository;
    this.invoiceBatchLinkRepository = invoiceBatchLinkRepository;
    this.conflictDetector = conflictDetector;
    this.workshopDirectory = workshopDirectory;
    this.historyLog = historyLog;
    this.properties = properties;
    this.transactionTemplate = transactionTemplate;
  }

  /**
   * Creates a batch with its line items. For workshop batches the workshop row is locked and the
   * conflict check runs under that lock, so two creations for one workshop cannot both pass a stale
   * check. The code is derived from the stored codes in the same transaction; a duplicate code from
   * a concurrent writer hits the unique constraint and the whole attempt is retried.
   *
   * @throws InvalidStateException if the request is incomplete
   * @throws SchedulingConflictException if the workshop still holds an open batch past the cut date
   */
  @Retryable(
      retryFor = DataIntegrityViolationException.class,
      maxAttempts = 3,
      backoff = @Backoff(delay = 50, multiplier = 2))
  public Batch createBatch(CreateBatchRequest request, Long userId) {
    validateNewBatch(request);
    return transactionTemplate.execute(tx -> insertBatch(request, userId));
  }

  private Batch insertBatch(CreateBatchRequest request, Long userId) {
    BatchStatus status = request.status() != null ? request.status() : BatchStatus.WAITING;

    if (request.workshopId() != null) {
      workshopDirectory.lockWorkshop(request.workshopId());
      if (status.isOpen()) {
        conflictDetector
            .checkConflict(request.workshopId(), request.cutDate())
            .ifPresent(
                conflict -> {
                  throw new SchedulingConflictException(conflict);
                });
      }
    }

    String code = nextCode(batchRepository.findAllCodes(), properties.batchCodeWidth());
    var batch =
        new Batch(
            code,
            request.cutDate(),
            status,
            request.workshopId(),
            request.expectedReturnDate(),
            request.observations());
    batch = batchRepository.saveAndFlush(batch);

    var items = new ArrayList<BatchLineItem>();
    for (LineItemRequest item : request.lineItems()) {
      items.add(
          new BatchLineItem(
              batch.getId(),
              item.productId(),
              item.quantity(),
              item.selectedColor(),
              item.selectedSize()));
    }
    lineItemRepository.saveAll(items);

    historyLog.append(batch.getId(), HistoryActions.CREATED, userId, null);
    log.info(
        "Created batch {}: cutDate={}, status={}, workshop={}, lineItems={}",
        code,
        batch.getCutDate(),
        status.value(),
        batch.getWorkshopId(),
        items.size());
    return batch;
  }

  private void validateNewBatch(CreateBatchRequest request) {
    if (request.cutDate() == null) {
      throw new InvalidStateException("Missing cut date", "A batch requires a cut date");
    }
    if (request.lineItems() == null || request.lineItems().isEmpty()) {
      throw new InvalidStateException(
          "Missing line items", "A batch requires at least one line item");
    }
    for (LineItemRequest item : request.lineItems()) {
      if (item == null || item.productId() == null) {
        throw new InvalidStateException("Invalid line item", "Every line item needs a product");
      }
      if (item.quantity() == null || item.quantity() < 1) {
        throw new InvalidStateException(
            "Invalid line item",
            "Quantity for product " + item.productId() + " must be at least 1");
      }
    }
  }

  /**
   * Next batch code: the highest purely numeric code plus one, zero-padded. Non-numeric codes are
   * ignored; with no numeric code the sequence starts at 1.
   */
  static String nextCode(Collection<String> existingCodes, int width) {
    long max = 0;
    for (String code : existingCodes) {
      if (code != null && NUMERIC_CODE.matcher(code).matches()) {
        max = Math.max(max, Long.parseLong(code));
      }
    }
    return String.format("%0" + width + "d", max + 1);
  }

  /**
   * Moves a batch to a new status and records the transition in the history.
   *
   * @param workshopId workshop to assign, or null to keep the current one
   * @param observations replaces the batch observations when not null
   */
  @Transactional
  public Batch updateStatus(
      Long batchId, BatchStatus newStatus, Long workshopId, String observations, Long userId) {
    if (newStatus == null) {
      throw new InvalidStateException("Missing status", "A target status is required");
    }
    var batch = getBatch(batchId);
    if (workshopId != null) {
      workshopDirectory.getWorkshop(workshopId);
    }
    BatchStatus previous = batch.getStatus();
    batch.transitionTo(newStatus, workshopId);
    if (observations != null) {
      batch.setObservations(observations);
    }
    batch = batchRepository.save(batch);

    historyLog.append(batch.getId(), HistoryActions.statusChanged(newStatus), userId, observations);
    log.info(
        "Batch {} moved from {} to {}", batch.getCode(), previous.value(), newStatus.value());
    return batch;
  }

  /**
   * Deletes a batch with its line items and history.
   *
   * @throws ResourceConflictException if the batch is included in an invoice
   */
  @Transactional
  public void deleteBatch(Long batchId) {
    var batch = getBatch(batchId);
    if (batch.isPaid() || invoiceBatchLinkRepository.existsByBatchId(batchId)) {
      throw new ResourceConflictException(
          "Batch is invoiced",
          "Batch " + batch.getCode() + " is included in an invoice and cannot be deleted");
    }
    lineItemRepository.deleteByBatchId(batchId);
    historyLog.purge(batchId);
    batchRepository.delete(batch);
    log.info("Deleted batch {}", batch.getCode());
  }

  /** Sets the image reference on behalf of the image service. */
  @Transactional
  public Batch updateImageUrl(Long batchId, String imageUrl, Long userId) {
    var batch = getBatch(batchId);
    batch.setImageUrl(imageUrl);
    batch = batchRepository.save(batch);
    historyLog.append(batchId, HistoryActions.IMAGE_UPDATED, userId, null);
    return batch;
  }

  @Transactional(readOnly = true)
  public Batch getBatch(Long batchId) {
    return batchRepository
        .findById(batchId)
        .orElseThrow(() -> new ResourceNotFoundException("Batch", batchId));
  }

  @Transactional(readOnly = true)
  public List<Batch> listBatches() {
    return batchRepository.findAllNewestFirst();
  }

  @Transactional(readOnly = true)
  public List<BatchLineItem> getLineItems(Long batchId) {
    return lineItemRepository.findByBatchId(batchId);
  }

  @Transactional(readOnly = true)
  public List<BatchHistoryEntry> getHistory(Long batchId) {
    getBatch(batchId);
    return historyLog.entriesFor(batchId);
  }

  @Transactional(readOnly = true)
  public BatchResponse toResponse(Batch batch) {
    return BatchResponse.from(batch, lineItemRepository.findByBatchId(batch.getId()));
  }

  /** Maps batches to responses with a single line item query. */
  @Transactional(readOnly = true)
  public List<BatchResponse> toResponses(List<Batch> batches) {
    if (batches.isEmpty()) {
      return List.of();
    }
    Map<Long, List<BatchLineItem>> itemsByBatch =
        lineItemRepository.findByBatchIds(batches.stream().map(Batch::getId).toList()).stream()
            .collect(Collectors.groupingBy(BatchLineItem::getBatchId));
    return batches.stream()
        .map(b -> BatchResponse.from(b, itemsByBatch.getOrDefault(b.getId(), List.of())))
        .toList();
  }
}
