package io.b2mash.batchflow.invoice;

import com.fasterxml.jackson.annotation.JsonValue;

/** Settlement invoice status. PENDING → PAID; PAID is terminal. */
public enum InvoiceStatus {
  PENDING("pending"),
  PAID("paid");

  private final String value;

  InvoiceStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public boolean canTransitionTo(InvoiceStatus target) {
    return this == PENDING && target == PAID;
  }
}
