package io.b2mash.batchflow.invoice;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;

/** A batch billed on an invoice, with its value at issue time. A batch has at most one link. */
@Entity
@Table(name = "invoice_batches")
public class InvoiceBatchLink {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "invoice_id", nullable = false)
  private Long invoiceId;

  @Column(name = "batch_id", nullable = false)
  private Long batchId;

  @Column(name = "amount", nullable = false, precision = 12, scale = 2)
  private BigDecimal amount;

  protected InvoiceBatchLink() {}

  public InvoiceBatchLink(Long invoiceId, Long batchId, BigDecimal amount) {
    this.invoiceId = invoiceId;
    this.batchId = batchId;
    this.amount = amount;
  }

  public Long getId() {
    return id;
  }

  public Long getInvoiceId() {
    return invoiceId;
  }

  public Long getBatchId() {
    return batchId;
  }

  public BigDecimal getAmount() {
    return amount;
  }
}
