package io.b2mash.batchflow.invoice.dto;

import io.b2mash.batchflow.invoice.Invoice;
import io.b2mash.batchflow.invoice.InvoiceStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

public record InvoiceResponse(
    Long id,
    Long workshopId,
    String invoiceNumber,
    LocalDate issueDate,
    LocalDate dueDate,
    BigDecimal totalAmount,
    InvoiceStatus status,
    LocalDate paidDate,
    String notes,
    Instant createdAt) {

  public static InvoiceResponse from(Invoice invoice) {
    return new InvoiceResponse(
        invoice.getId(),
        invoice.getWorkshopId(),
        invoice.getInvoiceNumber(),
        invoice.getIssueDate(),
        invoice.getDueDate(),
        invoice.getTotalAmount(),
        invoice.getStatus(),
        invoice.getPaidDate(),
        invoice.getNotes(),
        invoice.getCreatedAt());
  }
}
