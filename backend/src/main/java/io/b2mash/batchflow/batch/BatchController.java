package io.b2mash.batchflow.batch;

import io.b2mash.batchflow.batch.dto.BatchResponse;
import io.b2mash.batchflow.batch.dto.CreateBatchRequest;
import io.b2mash.batchflow.batch.dto.HistoryEntryResponse;
import io.b2mash.batchflow.batch.dto.UpdateBatchStatusRequest;
import io.b2mash.batchflow.batch.dto.UpdateImageRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for production batches. The optional {@code X-User-Id} header identifies the
 * acting user in the batch history.
 */
@RestController
@RequestMapping("/api/batches")
public class BatchController {

  private static final String USER_HEADER = "X-User-Id";

  private final BatchService batchService;

  public BatchController(BatchService batchService) {
    this.batchService = batchService;
  }

  /**
   * Creates a batch.
   *
   * @return 201 with the batch, 400 for incomplete requests, 409 when the workshop still holds an
   *     open batch past the cut date
   */
  @PostMapping
  public ResponseEntity<BatchResponse> createBatch(
      @Valid @RequestBody CreateBatchRequest request,
      @RequestHeader(name = USER_HEADER, required = false) Long userId) {
    var batch = batchService.createBatch(request, userId);
    return ResponseEntity.created(URI.create("/api/batches/" + batch.getId()))
        .body(batchService.toResponse(batch));
  }

  @GetMapping
  public ResponseEntity<List<BatchResponse>> listBatches() {
    return ResponseEntity.ok(batchService.toResponses(batchService.listBatches()));
  }

  @GetMapping("/{id}")
  public ResponseEntity<BatchResponse> getBatch(@PathVariable Long id) {
    return ResponseEntity.ok(batchService.toResponse(batchService.getBatch(id)));
  }

  @PutMapping("/{id}/status")
  public ResponseEntity<BatchResponse> updateStatus(
      @PathVariable Long id,
      @Valid @RequestBody UpdateBatchStatusRequest request,
      @RequestHeader(name = USER_HEADER, required = false) Long userId) {
    var batch =
        batchService.updateStatus(
            id, request.status(), request.workshopId(), request.observations(), userId);
    return ResponseEntity.ok(batchService.toResponse(batch));
  }

  @PutMapping("/{id}/image")
  public ResponseEntity<BatchResponse> updateImage(
      @PathVariable Long id,
      @Valid @RequestBody UpdateImageRequest request,
      @RequestHeader(name = USER_HEADER, required = false) Long userId) {
    var batch = batchService.updateImageUrl(id, request.imageUrl(), userId);
    return ResponseEntity.ok(batchService.toResponse(batch));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteBatch(@PathVariable Long id) {
    batchService.deleteBatch(id);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/{id}/history")
  public ResponseEntity<List<HistoryEntryResponse>> getHistory(@PathVariable Long id) {
    return ResponseEntity.ok(
        batchService.getHistory(id).stream().map(HistoryEntryResponse::from).toList());
  }
}
