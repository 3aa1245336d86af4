package io.b2mash.batchflow.workshop;

import io.b2mash.batchflow.exception.ResourceNotFoundException;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/** Read access to workshop master data, plus the per-workshop critical section. */
@Service
public class WorkshopDirectory {

  private final WorkshopRepository workshopRepository;

  public WorkshopDirectory(WorkshopRepository workshopRepository) {
    this.workshopRepository = workshopRepository;
  }

  @Transactional(readOnly = true)
  public Workshop getWorkshop(Long workshopId) {
    return workshopRepository
        .findById(workshopId)
        .orElseThrow(() -> new ResourceNotFoundException("Workshop", workshopId));
  }

  @Transactional(readOnly = true)
  public List<Workshop> listInScheduleOrder() {
    return workshopRepository.findAllInScheduleOrder();
  }

  @Transactional(readOnly = true)
  public Map<Long, Workshop> byId() {
    return workshopRepository.findAll().stream()
        .collect(Collectors.toMap(Workshop::getId, Function.identity()));
  }

  /**
   * Locks the workshop row until the surrounding transaction ends. Concurrent callers for the same
   * workshop queue behind the lock, so a conflict check or invoice number read under it stays valid
   * until commit.
   *
   * @throws ResourceNotFoundException if the workshop does not exist
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public Workshop lockWorkshop(Long workshopId) {
    return workshopRepository
        .findByIdForUpdate(workshopId)
        .orElseThrow(() -> new ResourceNotFoundException("Workshop", workshopId));
  }
}
