package io.b2mash.batchflow.invoice.dto;

import java.math.BigDecimal;

public record WorkshopSettlementSummary(
    Long workshopId,
    String workshopName,
    long pendingBatchCount,
    long paidBatchCount,
    BigDecimal totalUnpaidValue) {}
