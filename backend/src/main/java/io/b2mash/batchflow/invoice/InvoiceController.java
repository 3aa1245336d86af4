package io.b2mash.batchflow.invoice;

import io.b2mash.batchflow.invoice.dto.GenerateInvoiceRequest;
import io.b2mash.batchflow.invoice.dto.InvoiceDetailResponse;
import io.b2mash.batchflow.invoice.dto.InvoiceResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/invoices")
public class InvoiceController {

  private final SettlementService settlementService;

  public InvoiceController(SettlementService settlementService) {
    this.settlementService = settlementService;
  }

  @PostMapping
  public ResponseEntity<InvoiceResponse> generateInvoice(
      @Valid @RequestBody GenerateInvoiceRequest request) {
    var invoice =
        settlementService.generateInvoice(
            request.workshopId(), request.batchIds(), request.dueDate(), request.notes());
    return ResponseEntity.created(URI.create("/api/invoices/" + invoice.getId()))
        .body(InvoiceResponse.from(invoice));
  }

  @GetMapping
  public ResponseEntity<List<InvoiceResponse>> listInvoices(
      @RequestParam(required = false) Long workshopId) {
    var invoices =
        settlementService.listInvoices(workshopId).stream().map(InvoiceResponse::from).toList();
    return ResponseEntity.ok(invoices);
  }

  @GetMapping("/{id}")
  public ResponseEntity<InvoiceDetailResponse> getInvoice(@PathVariable Long id) {
    return ResponseEntity.ok(settlementService.getInvoiceDetail(id));
  }

  @PutMapping("/{id}/paid")
  public ResponseEntity<InvoiceResponse> markInvoicePaid(@PathVariable Long id) {
    return ResponseEntity.ok(InvoiceResponse.from(settlementService.markInvoicePaid(id)));
  }
}
