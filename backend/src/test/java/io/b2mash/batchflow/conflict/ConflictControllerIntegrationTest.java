package io.b2mash.batchflow.conflict;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.batchflow.batch.BatchService;
import io.b2mash.batchflow.batch.BatchStatus;
import io.b2mash.batchflow.batch.dto.CreateBatchRequest;
import io.b2mash.batchflow.batch.dto.LineItemRequest;
import io.b2mash.batchflow.exception.SchedulingConflictException;
import io.b2mash.batchflow.product.Product;
import io.b2mash.batchflow.product.ProductRepository;
import io.b2mash.batchflow.workshop.Workshop;
import io.b2mash.batchflow.workshop.WorkshopRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ConflictControllerIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private WorkshopRepository workshopRepository;
  @Autowired private ProductRepository productRepository;
  @Autowired private BatchService batchService;

  private Long productId;

  @BeforeAll
  void seed() {
    productId =
        productRepository.save(new Product("Hoodie", "CONFLICT-IT-HOODIE", new BigDecimal("21.00")))
            .getId();
  }

  @Test
  void newBatchBeforeOpenBatchReturnsIsRejectedUntilResolved() throws Exception {
    var workshopId = newWorkshop("Overlock Norte");
    var batchA = createExternal(workshopId, "2031-03-10", "2031-03-12");

    mockMvc
        .perform(
            get("/api/conflicts/check")
                .param("workshopId", workshopId.toString())
                .param("cutDate", "2031-03-11"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.conflict.batchId").value(batchA))
        .andExpect(jsonPath("$.conflict.expectedReturnDate").value("2031-03-12"));

    mockMvc
        .perform(
            post("/api/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .content(externalJson(workshopId, "2031-03-11", "2031-03-15")))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.title").value("Scheduling conflict"))
        .andExpect(jsonPath("$.conflictingBatchId").value(batchA))
        .andExpect(jsonPath("$.expectedReturnDate").value("2031-03-12"))
        .andExpect(jsonPath("$.candidateCutDate").value("2031-03-11"));

    mockMvc
        .perform(
            post("/api/conflicts/" + batchA + "/resolve")
                .header("X-User-Id", "5")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"candidateCutDate": "2031-03-11"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("returned"))
        .andExpect(jsonPath("$.expectedReturnDate").value("2031-03-10"))
        .andExpect(jsonPath("$.actualReturnDate").value("2031-03-10"));

    mockMvc
        .perform(
            post("/api/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .content(externalJson(workshopId, "2031-03-11", "2031-03-15")))
        .andExpect(status().isCreated());

    mockMvc
        .perform(get("/api/batches/" + batchA + "/history"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[*].action", hasItem("conflict_resolved")));
  }

  @Test
  void cutOnExpectedReturnDateDoesNotConflict() throws Exception {
    var workshopId = newWorkshop("Boundary Confeccoes");
    createExternal(workshopId, "2031-04-01", "2031-04-05");

    mockMvc
        .perform(
            get("/api/conflicts/check")
                .param("workshopId", workshopId.toString())
                .param("cutDate", "2031-04-05"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.conflict").value(nullValue()));

    mockMvc
        .perform(
            post("/api/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .content(externalJson(workshopId, "2031-04-05", "2031-04-09")))
        .andExpect(status().isCreated());
  }

  @Test
  void returnedBatchesNeverConflict() throws Exception {
    var workshopId = newWorkshop("Returned Costuras");
    var batchId = createExternal(workshopId, "2031-05-01", "2031-05-20");
    mockMvc
        .perform(
            put("/api/batches/" + batchId + "/status")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"status": "returned"}
                    """))
        .andExpect(status().isOk());

    mockMvc
        .perform(
            get("/api/conflicts/check")
                .param("workshopId", workshopId.toString())
                .param("cutDate", "2031-05-02"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.conflict").value(nullValue()));
  }

  @Test
  void otherWorkshopsDoNotConflict() throws Exception {
    var busy = newWorkshop("Busy Bordados");
    var free = newWorkshop("Free Bordados");
    createExternal(busy, "2031-06-01", "2031-06-20");

    mockMvc
        .perform(
            post("/api/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .content(externalJson(free, "2031-06-02", "2031-06-04")))
        .andExpect(status().isCreated());
  }

  @Test
  void sameDayCutIsUnblockedByResolution() throws Exception {
    var workshopId = newWorkshop("Early Malhas");
    var batchId = createExternal(workshopId, "2031-07-10", "2031-07-20");

    mockMvc
        .perform(
            get("/api/conflicts/check")
                .param("workshopId", workshopId.toString())
                .param("cutDate", "2031-07-10"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.conflict.batchId").value(batchId));

    mockMvc
        .perform(
            post("/api/conflicts/" + batchId + "/resolve")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"candidateCutDate": "2031-07-10"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("returned"))
        .andExpect(jsonPath("$.expectedReturnDate").value("2031-07-10"))
        .andExpect(jsonPath("$.actualReturnDate").value("2031-07-10"));

    mockMvc
        .perform(
            post("/api/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .content(externalJson(workshopId, "2031-07-10", "2031-07-15")))
        .andExpect(status().isCreated());
  }

  @Test
  void checkForUnknownWorkshopIsNotFound() throws Exception {
    mockMvc
        .perform(
            get("/api/conflicts/check")
                .param("workshopId", "987654")
                .param("cutDate", "2031-07-10"))
        .andExpect(status().isNotFound());
  }

  @Test
  void concurrentOverlappingCreationsLetOnlyOneThrough() throws Exception {
    var workshopId = newWorkshop("Race Overloque");
    int threads = 4;

    var latch = new CountDownLatch(1);
    var created = new ConcurrentLinkedQueue<Long>();
    var errors = new ConcurrentLinkedQueue<Throwable>();
    var executor = Executors.newFixedThreadPool(threads);

    for (int i = 0; i < threads; i++) {
      executor.submit(
          () -> {
            try {
              latch.await();
              var request =
                  new CreateBatchRequest(
                      LocalDate.of(2031, 8, 1),
                      List.of(new LineItemRequest(productId, 5, null, null)),
                      BatchStatus.EXTERNAL_WORKSHOP,
                      workshopId,
                      LocalDate.of(2031, 8, 10),
                      null);
              created.add(batchService.createBatch(request, null).getId());
            } catch (Exception e) {
              errors.add(e);
            }
          });
    }

    // Release all threads at the same time
    latch.countDown();

    executor.shutdown();
    assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
    assertThat(created).hasSize(1);
    assertThat(errors)
        .hasSize(threads - 1)
        .allSatisfy(e -> assertThat(e).isInstanceOf(SchedulingConflictException.class));
  }

  @Test
  void resolvingUnknownBatchIsNotFound() throws Exception {
    mockMvc
        .perform(
            post("/api/conflicts/987654/resolve")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"candidateCutDate": "2031-07-10"}
                    """))
        .andExpect(status().isNotFound());
  }

  // --- Helpers ---

  private Long newWorkshop(String name) {
    return workshopRepository.save(new Workshop(name, 50, "#F59E0B")).getId();
  }

  private String externalJson(Long workshopId, String cutDate, String expectedReturnDate) {
    return """
        {
          "cutDate": "%s",
          "status": "external_workshop",
          "workshopId": %d,
          "expectedReturnDate": "%s",
          "lineItems": [{"productId": %d, "quantity": 12}]
        }
        """
        .formatted(cutDate, workshopId, expectedReturnDate, productId);
  }

  private int createExternal(Long workshopId, String cutDate, String expectedReturnDate)
      throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/batches")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(externalJson(workshopId, cutDate, expectedReturnDate)))
            .andExpect(status().isCreated())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }
}
