package io.b2mash.batchflow.exception;

import io.b2mash.batchflow.conflict.SchedulingConflict;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a workshop would receive a new batch before returning an open one. Results in HTTP
 * 409 with the conflicting batch and both dates so that a person can decide how to resolve it.
 */
public class SchedulingConflictException extends ErrorResponseException {

  private final SchedulingConflict conflict;

  public SchedulingConflictException(SchedulingConflict conflict) {
    super(HttpStatus.CONFLICT, createProblem(conflict), null);
    this.conflict = conflict;
  }

  public SchedulingConflict getConflict() {
    return conflict;
  }

  private static ProblemDetail createProblem(SchedulingConflict conflict) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Scheduling conflict");
    problem.setDetail(conflict.message());
    problem.setProperty("conflictingBatchId", conflict.batchId());
    problem.setProperty("conflictingBatchCode", conflict.batchCode());
    problem.setProperty("expectedReturnDate", conflict.expectedReturnDate().toString());
    problem.setProperty("candidateCutDate", conflict.candidateCutDate().toString());
    return problem;
  }
}
