package io.b2mash.batchflow.batch;

import io.b2mash.batchflow.exception.InvalidStateException;
import io.b2mash.batchflow.exception.ResourceConflictException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;

/**
 * A cut production run moving between internal production and external workshops.
 *
 * <p>All schedule dates are calendar dates without a time zone. {@code workshopId} is null only for
 * internal work. {@code paid} is flipped by settlement alone and never reset.
 */
@Entity
@Table(name = "batches")
public class Batch {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "code", nullable = false, length = 50)
  private String code;

  @Column(name = "cut_date", nullable = false)
  private LocalDate cutDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 30)
  private BatchStatus status;

  @Column(name = "workshop_id")
  private Long workshopId;

  @Column(name = "sent_to_production_date")
  private LocalDate sentToProductionDate;

  @Column(name = "expected_return_date")
  private LocalDate expectedReturnDate;

  @Column(name = "actual_return_date")
  private LocalDate actualReturnDate;

  @Column(name = "observations", length = 4000)
  private String observations;

  @Column(name = "image_url", length = 1000)
  private String imageUrl;

  @Column(name = "paid", nullable = false)
  private boolean paid;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Batch() {}

  public Batch(
      String code,
      LocalDate cutDate,
      BatchStatus status,
      Long workshopId,
      LocalDate expectedReturnDate,
      String observations) {
    requireWorkshopConsistency(status, workshopId);
    this.code = code;
    this.cutDate = cutDate;
    this.status = status;
    this.workshopId = workshopId;
    this.expectedReturnDate = expectedReturnDate;
    this.observations = observations;
    stampTransitionDates(status);
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /**
   * Moves the batch to {@code target}. Entering RETURNED stamps the actual return date if it is not
   * set yet; reverting RETURNED → WAITING clears it so the next return is stamped again.
   *
   * @param target the new status
   * @param newWorkshopId workshop to assign, or null to keep the current one (ignored and cleared
   *     for internal production)
   * @throws InvalidStateException if the transition is not allowed or leaves external work without
   *     a workshop
   */
  public void transitionTo(BatchStatus target, Long newWorkshopId) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid batch status",
          "Cannot move batch " + code + " from " + status.value() + " to " + target.value());
    }
    Long effectiveWorkshopId = newWorkshopId != null ? newWorkshopId : this.workshopId;
    if (target == BatchStatus.INTERNAL_PRODUCTION) {
      effectiveWorkshopId = null;
    }
    requireWorkshopConsistency(target, effectiveWorkshopId);

    if (status == BatchStatus.RETURNED && target == BatchStatus.WAITING) {
      this.actualReturnDate = null;
    }
    this.workshopId = effectiveWorkshopId;
    this.status = target;
    stampTransitionDates(target);
    this.updatedAt = Instant.now();
  }

  /**
   * Closes the batch so that a new batch can be cut for the same workshop: the batch is considered
   * back the day before the newcomer's cut date. A newcomer cut on or before this batch's own cut
   * date closes it on its cut date, since a batch cannot come back before it left.
   *
   * @param returnDate the day the batch is taken to have come back
   */
  public void closeForConflict(LocalDate returnDate) {
    if (!status.isOpen()) {
      throw new InvalidStateException(
          "Batch already returned", "Batch " + code + " is already returned");
    }
    LocalDate closedOn = returnDate.isBefore(cutDate) ? cutDate : returnDate;
    this.expectedReturnDate = closedOn;
    this.actualReturnDate = closedOn;
    this.status = BatchStatus.RETURNED;
    this.updatedAt = Instant.now();
  }

  /**
   * Flags the batch as billed.
   *
   * @throws ResourceConflictException if the batch is already on an invoice
   */
  public void markPaid() {
    if (paid) {
      throw new ResourceConflictException(
          "Batch already invoiced", "Batch " + code + " is already included in an invoice");
    }
    this.paid = true;
    this.updatedAt = Instant.now();
  }

  /**
   * Last calendar day occupied by the batch: the actual return date once returned, otherwise the
   * expected return date, otherwise the day after the cut.
   */
  public LocalDate occupancyEndDate() {
    if (status == BatchStatus.RETURNED && actualReturnDate != null) {
      return actualReturnDate;
    }
    if (expectedReturnDate != null) {
      return expectedReturnDate;
    }
    return cutDate.plusDays(1);
  }

  public boolean isInternal() {
    return workshopId == null;
  }

  private void stampTransitionDates(BatchStatus target) {
    if (target.isInProduction() && sentToProductionDate == null) {
      sentToProductionDate = LocalDate.now();
    }
    if (target == BatchStatus.RETURNED && actualReturnDate == null) {
      actualReturnDate = LocalDate.now();
    }
  }

  private static void requireWorkshopConsistency(BatchStatus status, Long workshopId) {
    if (status == BatchStatus.EXTERNAL_WORKSHOP && workshopId == null) {
      throw new InvalidStateException(
          "Workshop required", "A batch sent to an external workshop must name the workshop");
    }
    if (status == BatchStatus.INTERNAL_PRODUCTION && workshopId != null) {
      throw new InvalidStateException(
          "Workshop not allowed", "A batch in internal production cannot be assigned a workshop");
    }
  }

  // --- Getters and setters for collaborator-owned fields ---

  public Long getId() {
    return id;
  }

  public String getCode() {
    return code;
  }

  public LocalDate getCutDate() {
    return cutDate;
  }

  public BatchStatus getStatus() {
    return status;
  }

  public Long getWorkshopId() {
    return workshopId;
  }

  public LocalDate getSentToProductionDate() {
    return sentToProductionDate;
  }

  public LocalDate getExpectedReturnDate() {
    return expectedReturnDate;
  }

  public LocalDate getActualReturnDate() {
    return actualReturnDate;
  }

  public String getObservations() {
    return observations;
  }

  public void setObservations(String observations) {
    this.observations = observations;
    this.updatedAt = Instant.now();
  }

  public String getImageUrl() {
    return imageUrl;
  }

  public void setImageUrl(String imageUrl) {
    this.imageUrl = imageUrl;
    this.updatedAt = Instant.now();
  }

  public boolean isPaid() {
    return paid;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
