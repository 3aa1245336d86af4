package io.b2mash.batchflow.invoice;

import io.b2mash.batchflow.config.BatchflowProperties;
import java.text.Normalizer;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Generates invoice numbers of the form {@code ABC-DDMMYY-NNNN} using a counter table with
 * row-level locking.
 *
 * <ul>
 *   <li>{@code ABC} is the first three letters of the workshop name, uppercased
 *   <li>One counter row per {@code ABC-DDMMYY} prefix, created lazily on first use
 *   <li>The suffix starts at {@code batchflow.invoice-sequence-start} and is gap-free (the counter
 *       update rolls back with the invoice)
 * </ul>
 */
@Service
public class InvoiceNumberService {

  private static final Logger log = LoggerFactory.getLogger(InvoiceNumberService.class);

  private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("ddMMyy");

  private final InvoiceCounterRepository counterRepository;
  private final TransactionTemplate counterCreation;
  private final int sequenceStart;

  public InvoiceNumberService(
      InvoiceCounterRepository counterRepository,
      PlatformTransactionManager transactionManager,
      BatchflowProperties properties) {
    this.counterRepository = counterRepository;
    this.counterCreation = new TransactionTemplate(transactionManager);
    this.counterCreation.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.sequenceStart = properties.invoiceSequenceStart();
  }

  /**
   * Assigns the next number for the workshop and day. The counter row stays locked until the
   * caller's transaction ends, so concurrent callers for the same prefix get consecutive numbers.
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public String assignNumber(String workshopName, LocalDate issueDate) {
    String prefix = prefixFor(workshopName, issueDate);
    ensureCounterExists(prefix);

    var counter =
        counterRepository
            .findByPrefixForUpdate(prefix)
            .orElseThrow(() -> new IllegalStateException("Invoice counter missing for " + prefix));
    int number = counter.getNextNumber();
    counter.setNextNumber(number + 1);
    counterRepository.save(counter);
    return prefix + "-" + number;
  }

  static String prefixFor(String workshopName, LocalDate issueDate) {
    return letterCode(workshopName) + "-" + issueDate.format(DAY_FORMAT);
  }

  /** First three letters of the name without accents, uppercased and padded with X. */
  static String letterCode(String workshopName) {
    String source = workshopName == null ? "" : workshopName;
    String letters =
        Normalizer.normalize(source, Normalizer.Form.NFD)
            .replaceAll("[^A-Za-z]", "")
            .toUpperCase(Locale.ROOT);
    if (letters.length() >= 3) {
      return letters.substring(0, 3);
    }
    return (letters + "XXX").substring(0, 3);
  }

  // Committed separately so that the row is visible to every caller before anyone locks it.
  private void ensureCounterExists(String prefix) {
    if (counterRepository.existsById(prefix)) {
      return;
    }
    try {
      counterCreation.executeWithoutResult(
          status -> counterRepository.insertCounter(prefix, sequenceStart));
      log.info("Started invoice sequence {} at {}", prefix, sequenceStart);
    } catch (DataIntegrityViolationException e) {
      log.debug("Invoice counter {} was created concurrently", prefix);
    }
  }
}
