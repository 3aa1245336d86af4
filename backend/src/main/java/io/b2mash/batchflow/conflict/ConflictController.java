package io.b2mash.batchflow.conflict;

import io.b2mash.batchflow.batch.BatchService;
import io.b2mash.batchflow.batch.dto.BatchResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/conflicts")
public class ConflictController {

  private final ConflictDetector conflictDetector;
  private final BatchService batchService;

  public ConflictController(ConflictDetector conflictDetector, BatchService batchService) {
    this.conflictDetector = conflictDetector;
    this.batchService = batchService;
  }

  /** Dry run of the check performed on batch creation; {@code conflict} is null when clear. */
  @GetMapping("/check")
  public ResponseEntity<ConflictCheckResponse> checkConflict(
      @RequestParam Long workshopId,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate cutDate) {
    var conflict =
        conflictDetector
            .checkConflict(workshopId, cutDate)
            .map(ConflictDto::from)
            .orElse(null);
    return ResponseEntity.ok(new ConflictCheckResponse(conflict));
  }

  /**
   * Applies the manual resolution to a conflicting batch: it is marked returned the day before the
   * new batch's cut date.
   */
  @PostMapping("/{batchId}/resolve")
  public ResponseEntity<BatchResponse> resolveConflict(
      @PathVariable Long batchId,
      @Valid @RequestBody ResolveConflictRequest request,
      @RequestHeader(name = "X-User-Id", required = false) Long userId) {
    var batch = conflictDetector.resolveConflict(batchId, request.candidateCutDate(), userId);
    return ResponseEntity.ok(batchService.toResponse(batch));
  }

  // --- DTOs ---

  public record ResolveConflictRequest(@NotNull LocalDate candidateCutDate) {}

  public record ConflictDto(
      Long batchId, String batchCode, LocalDate expectedReturnDate, String message) {

    static ConflictDto from(SchedulingConflict conflict) {
      return new ConflictDto(
          conflict.batchId(),
          conflict.batchCode(),
          conflict.expectedReturnDate(),
          conflict.message());
    }
  }

  public record ConflictCheckResponse(ConflictDto conflict) {}
}
