package io.b2mash.batchflow.invoice;

import io.b2mash.batchflow.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Payment owed to a workshop for a set of batches.
 *
 * <p>The total is fixed when the invoice is issued and is never recalculated, even if product
 * production values change afterwards.
 */
@Entity
@Table(name = "invoices")
public class Invoice {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "workshop_id", nullable = false)
  private Long workshopId;

  @Column(name = "invoice_number", nullable = false, length = 100)
  private String invoiceNumber;

  @Column(name = "issue_date", nullable = false)
  private LocalDate issueDate;

  @Column(name = "due_date", nullable = false)
  private LocalDate dueDate;

  @Column(name = "total_amount", nullable = false, precision = 12, scale = 2)
  private BigDecimal totalAmount;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private InvoiceStatus status = InvoiceStatus.PENDING;

  @Column(name = "paid_date")
  private LocalDate paidDate;

  @Column(name = "notes", length = 4000)
  private String notes;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Invoice() {}

  public Invoice(
      Long workshopId,
      String invoiceNumber,
      LocalDate issueDate,
      LocalDate dueDate,
      BigDecimal totalAmount,
      String notes) {
    this.workshopId = workshopId;
    this.invoiceNumber = invoiceNumber;
    this.issueDate = issueDate;
    this.dueDate = dueDate;
    this.totalAmount = totalAmount.setScale(2, RoundingMode.HALF_UP);
    this.notes = notes;
    this.createdAt = Instant.now();
  }

  /**
   * Records payment of the invoice. Links and the total are left untouched.
   *
   * @throws InvalidStateException if the invoice is already paid
   */
  public void markPaid() {
    if (!status.canTransitionTo(InvoiceStatus.PAID)) {
      throw new InvalidStateException(
          "Invalid invoice status",
          "Cannot mark invoice " + invoiceNumber + " as paid in status " + status.value());
    }
    this.status = InvoiceStatus.PAID;
    this.paidDate = LocalDate.now();
  }

  public Long getId() {
    return id;
  }

  public Long getWorkshopId() {
    return workshopId;
  }

  public String getInvoiceNumber() {
    return invoiceNumber;
  }

  public LocalDate getIssueDate() {
    return issueDate;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public BigDecimal getTotalAmount() {
    return totalAmount;
  }

  public InvoiceStatus getStatus() {
    return status;
  }

  public LocalDate getPaidDate() {
    return paidDate;
  }

  public String getNotes() {
    return notes;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
