package io.b2mash.batchflow.invoice.dto;

import java.util.List;

/** Read model for printing and exporting an invoice. */
public record InvoiceDetailResponse(
    InvoiceResponse invoice, String workshopName, List<InvoiceLinkResponse> batches) {}
