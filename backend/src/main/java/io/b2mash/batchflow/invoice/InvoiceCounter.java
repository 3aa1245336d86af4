package io.b2mash.batchflow.invoice;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Next sequential suffix for one invoice number prefix ({@code ABC-DDMMYY}). Used only by
 * InvoiceNumberService.
 */
@Entity
@Table(name = "invoice_counters")
public class InvoiceCounter {

  @Id
  @Column(name = "prefix", length = 20)
  private String prefix;

  @Column(name = "next_number", nullable = false)
  private int nextNumber;

  protected InvoiceCounter() {}

  public InvoiceCounter(String prefix, int nextNumber) {
    this.prefix = prefix;
    this.nextNumber = nextNumber;
  }

  public String getPrefix() {
    return prefix;
  }

  public int getNextNumber() {
    return nextNumber;
  }

  public void setNextNumber(int nextNumber) {
    this.nextNumber = nextNumber;
  }
}
