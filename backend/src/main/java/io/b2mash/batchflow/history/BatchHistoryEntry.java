package io.b2mash.batchflow.history;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/** Immutable record of something that happened to a batch. No setters. */
@Entity
@Table(name = "batch_history")
public class BatchHistoryEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "batch_id", nullable = false)
  private Long batchId;

  @Column(name = "action", nullable = false, length = 100)
  private String action;

  @Column(name = "user_id", nullable = false)
  private Long userId;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  @Column(name = "notes", length = 4000)
  private String notes;

  protected BatchHistoryEntry() {}

  public BatchHistoryEntry(Long batchId, String action, Long userId, String notes) {
    this.batchId = batchId;
    this.action = action;
    this.userId = userId;
    this.notes = notes;
    this.occurredAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public Long getBatchId() {
    return batchId;
  }

  public String getAction() {
    return action;
  }

  public Long getUserId() {
    return userId;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }

  public String getNotes() {
    return notes;
  }
}
