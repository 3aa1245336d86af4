package io.b2mash.batchflow.invoice;

import io.b2mash.batchflow.batch.BatchService;
import io.b2mash.batchflow.batch.dto.BatchResponse;
import io.b2mash.batchflow.invoice.dto.WorkshopSettlementSummary;
import java.time.LocalDate;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/settlements")
public class SettlementController {

  private final SettlementService settlementService;
  private final BatchService batchService;

  public SettlementController(SettlementService settlementService, BatchService batchService) {
    this.settlementService = settlementService;
    this.batchService = batchService;
  }

  @GetMapping("/unbilled")
  public ResponseEntity<List<BatchResponse>> getUnbilledBatches(
      @RequestParam Long workshopId,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
    var batches = settlementService.listUnbilled(workshopId, startDate, endDate);
    return ResponseEntity.ok(batchService.toResponses(batches));
  }

  @GetMapping("/summary")
  public ResponseEntity<List<WorkshopSettlementSummary>> getWorkshopSummary(
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
    return ResponseEntity.ok(settlementService.summarizeAllWorkshops(startDate, endDate));
  }
}
