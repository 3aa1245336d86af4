package io.b2mash.batchflow.invoice.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/** One billed batch: the amount frozen on the invoice and its line items at current prices. */
public record InvoiceLinkResponse(
    Long batchId,
    String batchCode,
    LocalDate cutDate,
    BigDecimal amount,
    List<ValuatedLineItem> lineItems) {}
