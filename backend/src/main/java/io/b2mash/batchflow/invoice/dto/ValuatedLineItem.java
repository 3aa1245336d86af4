package io.b2mash.batchflow.invoice.dto;

import java.math.BigDecimal;

/** A batch line item priced at the current production value of its product. */
public record ValuatedLineItem(
    Long lineItemId,
    Long batchId,
    Long productId,
    int quantity,
    String selectedColor,
    String selectedSize,
    BigDecimal unitValue,
    BigDecimal lineTotal) {}
