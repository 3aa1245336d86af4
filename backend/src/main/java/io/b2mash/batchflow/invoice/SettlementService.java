package io.b2mash.batchflow.invoice;

import io.b2mash.batchflow.batch.Batch;
import io.b2mash.batchflow.batch.BatchRepository;
import io.b2mash.batchflow.exception.InvalidStateException;
import io.b2mash.batchflow.exception.ResourceConflictException;
import io.b2mash.batchflow.exception.ResourceNotFoundException;
import io.b2mash.batchflow.invoice.dto.InvoiceDetailResponse;
import io.b2mash.batchflow.invoice.dto.InvoiceLinkResponse;
import io.b2mash.batchflow.invoice.dto.InvoiceResponse;
import io.b2mash.batchflow.invoice.dto.WorkshopSettlementSummary;
import io.b2mash.batchflow.workshop.Workshop;
import io.b2mash.batchflow.workshop.WorkshopDirectory;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/** Values unbilled batches, issues invoices for them and records invoice payment. */
@Service
public class SettlementService {

  private static final Logger log = LoggerFactory.getLogger(SettlementService.class);

  private final BatchRepository batchRepository;
  private final InvoiceRepository invoiceRepository;
  private final InvoiceBatchLinkRepository linkRepository;
  private final InvoiceNumberService invoiceNumberService;
  private final BatchValuationService valuationService;
  private final WorkshopDirectory workshopDirectory;
  private final TransactionTemplate transactionTemplate;

  public SettlementService(
      BatchRepository batchRepository,
      InvoiceRepository invoiceRepository,
      InvoiceBatchLinkRepository linkRepository,
      InvoiceNumberService invoiceNumberService,
      BatchValuationService valuationService,
      WorkshopDirectory workshopDirectory,
      TransactionTemplate transactionTemplate) {
    this.batchRepository = batchRepository;
    this.invoiceRepository = invoiceRepository;
    this.linkRepository = linkRepository;
    this.invoiceNumberService = invoiceNumberService;
    this.valuationService = valuationService;
    this.workshopDirectory = workshopDirectory;
    this.transactionTemplate = transactionTemplate;
  }

  /** Unpaid batches of the workshop cut within the range, most recent cut first. */
  @Transactional(readOnly = true)
  public List<Batch> listUnbilled(Long workshopId, LocalDate startDate, LocalDate endDate) {
    requireRange(startDate, endDate);
    workshopDirectory.getWorkshop(workshopId);
    return batchRepository.findUnbilled(workshopId, startDate, endDate);
  }

  /**
   * One row per workshop in schedule order, including workshops with nothing to settle. Paid
   * batches are those on an invoice that has itself been marked paid.
   */
  @Transactional(readOnly = true)
  public List<WorkshopSettlementSummary> summarizeAllWorkshops(
      LocalDate startDate, LocalDate endDate) {
    requireRange(startDate, endDate);
    var summaries = new ArrayList<WorkshopSettlementSummary>();
    for (Workshop workshop : workshopDirectory.listInScheduleOrder()) {
      var unbilled = batchRepository.findUnbilled(workshop.getId(), startDate, endDate);
      BigDecimal unpaidValue =
          valuationService.valuateBatches(unbilled).values().stream()
              .reduce(BigDecimal.ZERO, BigDecimal::add)
              .setScale(2);
      long paidCount =
          linkRepository.countSettledBatches(
              workshop.getId(), InvoiceStatus.PAID, startDate, endDate);
      summaries.add(
          new WorkshopSettlementSummary(
              workshop.getId(), workshop.getName(), unbilled.size(), paidCount, unpaidValue));
    }
    return summaries;
  }

  /**
   * Issues one invoice covering the given batches and marks them paid, all in one transaction. The
   * workshop row is locked first so that two invoices for the same workshop are numbered one after
   * the other. A unique-key collision (a batch billed concurrently through another path) rolls the
   * attempt back and retries it; the retry then fails on the paid check.
   *
   * @throws InvalidStateException if no batches or no due date are given
   * @throws ResourceNotFoundException if the workshop or any batch does not exist
   * @throws ResourceConflictException if a batch belongs to another workshop or is already billed
   */
  @Retryable(
      retryFor = DataIntegrityViolationException.class,
      maxAttempts = 3,
      backoff = @Backoff(delay = 50, multiplier = 2))
  public Invoice generateInvoice(
      Long workshopId, List<Long> batchIds, LocalDate dueDate, String notes) {
    if (workshopId == null) {
      throw new InvalidStateException("Missing workshop", "An invoice needs a workshop");
    }
    if (batchIds == null || batchIds.isEmpty()) {
      throw new InvalidStateException("No batches selected", "An invoice needs at least one batch");
    }
    if (dueDate == null) {
      throw new InvalidStateException("Missing due date", "An invoice needs a due date");
    }
    var distinctIds = List.copyOf(new LinkedHashSet<>(batchIds));
    return transactionTemplate.execute(tx -> issueInvoice(workshopId, distinctIds, dueDate, notes));
  }

  private Invoice issueInvoice(
      Long workshopId, List<Long> batchIds, LocalDate dueDate, String notes) {
    Workshop workshop = workshopDirectory.lockWorkshop(workshopId);

    Map<Long, Batch> found =
        batchRepository.findByIds(batchIds).stream()
            .collect(Collectors.toMap(Batch::getId, Function.identity()));
    var batches = new ArrayList<Batch>();
    for (Long batchId : batchIds) {
      Batch batch = found.get(batchId);
      if (batch == null) {
        throw new ResourceNotFoundException("Batch", batchId);
      }
      if (!workshopId.equals(batch.getWorkshopId())) {
        throw new ResourceConflictException(
            "Batch not billable",
            "Batch " + batch.getCode() + " does not belong to workshop " + workshop.getName());
      }
      if (batch.isPaid()) {
        throw new ResourceConflictException(
            "Batch already billed", "Batch " + batch.getCode() + " is already on an invoice");
      }
      batches.add(batch);
    }

    LocalDate issueDate = LocalDate.now();
    String invoiceNumber = invoiceNumberService.assignNumber(workshop.getName(), issueDate);

    Map<Long, BigDecimal> amounts = valuationService.valuateBatches(batches);
    BigDecimal total =
        batches.stream()
            .map(batch -> amounts.get(batch.getId()))
            .reduce(BigDecimal.ZERO, BigDecimal::add);

    var invoice =
        invoiceRepository.save(
            new Invoice(workshopId, invoiceNumber, issueDate, dueDate, total, notes));
    for (Batch batch : batches) {
      linkRepository.save(
          new InvoiceBatchLink(invoice.getId(), batch.getId(), amounts.get(batch.getId())));
      batch.markPaid();
    }
    batchRepository.saveAll(batches);
    linkRepository.flush();

    log.info(
        "Issued invoice {} for workshop {}: {} batches, total {}",
        invoiceNumber,
        workshopId,
        batches.size(),
        invoice.getTotalAmount());
    return invoice;
  }

  /**
   * Records payment of an invoice. Links and the total stay as issued.
   *
   * @throws ResourceNotFoundException if the invoice does not exist
   * @throws InvalidStateException if the invoice is already paid
   */
  @Transactional
  public Invoice markInvoicePaid(Long invoiceId) {
    var invoice =
        invoiceRepository
            .findByIdForUpdate(invoiceId)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    invoice.markPaid();
    invoice = invoiceRepository.save(invoice);
    log.info("Invoice {} marked paid on {}", invoice.getInvoiceNumber(), invoice.getPaidDate());
    return invoice;
  }

  @Transactional(readOnly = true)
  public List<Invoice> listInvoices(Long workshopId) {
    if (workshopId == null) {
      return invoiceRepository.findAllOrdered();
    }
    return invoiceRepository.findByWorkshopId(workshopId);
  }

  @Transactional(readOnly = true)
  public Invoice getInvoice(Long invoiceId) {
    return invoiceRepository
        .findById(invoiceId)
        .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
  }

  /** The invoice with each billed batch, its frozen amount and its line items at current prices. */
  @Transactional(readOnly = true)
  public InvoiceDetailResponse getInvoiceDetail(Long invoiceId) {
    var invoice = getInvoice(invoiceId);
    var workshop = workshopDirectory.getWorkshop(invoice.getWorkshopId());
    var links = linkRepository.findByInvoiceId(invoiceId);
    Map<Long, Batch> batches =
        batchRepository.findByIds(links.stream().map(InvoiceBatchLink::getBatchId).toList())
            .stream()
            .collect(Collectors.toMap(Batch::getId, Function.identity()));

    var linkResponses =
        links.stream()
            .map(
                link -> {
                  Batch batch = batches.get(link.getBatchId());
                  return new InvoiceLinkResponse(
                      link.getBatchId(),
                      batch.getCode(),
                      batch.getCutDate(),
                      link.getAmount(),
                      valuationService.valuatedLineItems(link.getBatchId()));
                })
            .toList();
    return new InvoiceDetailResponse(
        InvoiceResponse.from(invoice), workshop.getName(), linkResponses);
  }

  private static void requireRange(LocalDate startDate, LocalDate endDate) {
    if (startDate == null || endDate == null) {
      throw new InvalidStateException(
          "Missing date range", "Both startDate and endDate are required");
    }
    if (startDate.isAfter(endDate)) {
      throw new InvalidStateException(
          "Invalid date range", "startDate " + startDate + " is after endDate " + endDate);
    }
  }
}
