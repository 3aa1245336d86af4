package io.b2mash.batchflow.history;

import io.b2mash.batchflow.config.BatchflowProperties;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** {@link HistoryLog} backed by the {@code batch_history} table. */
@Service
public class DatabaseHistoryLog implements HistoryLog {

  private static final Logger log = LoggerFactory.getLogger(DatabaseHistoryLog.class);

  private final BatchHistoryRepository historyRepository;
  private final BatchflowProperties properties;

  public DatabaseHistoryLog(
      BatchHistoryRepository historyRepository, BatchflowProperties properties) {
    this.historyRepository = historyRepository;
    this.properties = properties;
  }

  @Override
  @Transactional
  public void append(Long batchId, String action, Long userId, String notes) {
    Long actor = userId != null ? userId : properties.defaultActorId();
    historyRepository.save(new BatchHistoryEntry(batchId, action, actor, notes));
    log.debug("Recorded batch history: batch={}, action={}, actor={}", batchId, action, actor);
  }

  @Override
  @Transactional(readOnly = true)
  public List<BatchHistoryEntry> entriesFor(Long batchId) {
    return historyRepository.findByBatchIdNewestFirst(batchId);
  }

  @Override
  @Transactional
  public void purge(Long batchId) {
    int removed = historyRepository.deleteByBatchId(batchId);
    log.debug("Purged {} history entries of batch {}", removed, batchId);
  }
}
