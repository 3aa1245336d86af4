package io.b2mash.batchflow.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.matchesPattern;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.batchflow.product.Product;
import io.b2mash.batchflow.product.ProductRepository;
import io.b2mash.batchflow.workshop.Workshop;
import io.b2mash.batchflow.workshop.WorkshopRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
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
class BatchControllerIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private WorkshopRepository workshopRepository;
  @Autowired private ProductRepository productRepository;

  private Long workshopId;
  private Long productId;

  @BeforeAll
  void seed() {
    workshopId = workshopRepository.save(new Workshop("Bainha Oficina", 30, "#10B981")).getId();
    productId =
        productRepository.save(new Product("Polo Shirt", "BATCH-IT-POLO", new BigDecimal("9.90")))
            .getId();
  }

  @Test
  void createsInternalBatchWithPaddedCode() throws Exception {
    mockMvc
        .perform(
            post("/api/batches")
                .header("X-User-Id", "42")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "cutDate": "2030-01-10",
                      "lineItems": [
                        {
                          "productId": %d,
                          "quantity": 5,
                          "selectedColor": "navy",
                          "selectedSize": "M"
                        }
                      ],
                      "observations": "rush order"
                    }
                    """
                        .formatted(productId)))
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", matchesPattern("/api/batches/\\d+")))
        .andExpect(jsonPath("$.code").value(matchesPattern("\\d{3,}")))
        .andExpect(jsonPath("$.status").value("waiting"))
        .andExpect(jsonPath("$.workshopId").value(nullValue()))
        .andExpect(jsonPath("$.cutDate").value("2030-01-10"))
        .andExpect(jsonPath("$.paid").value(false))
        .andExpect(jsonPath("$.lineItems", hasSize(1)))
        .andExpect(jsonPath("$.lineItems[0].quantity").value(5))
        .andExpect(jsonPath("$.lineItems[0].selectedColor").value("navy"));
  }

  @Test
  void consecutiveBatchesGetConsecutiveCodes() throws Exception {
    var first = createBatch(internalBatchJson("2030-02-01"));
    var second = createBatch(internalBatchJson("2030-02-02"));

    long firstCode = Long.parseLong(readString(first, "$.code"));
    long secondCode = Long.parseLong(readString(second, "$.code"));
    assertThat(secondCode).isGreaterThan(firstCode);
  }

  @Test
  void rejectsBatchWithoutLineItems() throws Exception {
    mockMvc
        .perform(
            post("/api/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"cutDate": "2030-01-10", "lineItems": []}
                    """))
        .andExpect(status().isBadRequest());
  }

  @Test
  void rejectsNonPositiveQuantity() throws Exception {
    mockMvc
        .perform(
            post("/api/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"cutDate": "2030-01-10", "lineItems": [{"productId": %d, "quantity": 0}]}
                    """
                        .formatted(productId)))
        .andExpect(status().isBadRequest());
  }

  @Test
  void rejectsMissingCutDate() throws Exception {
    mockMvc
        .perform(
            post("/api/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"lineItems": [{"productId": %d, "quantity": 2}]}
                    """
                        .formatted(productId)))
        .andExpect(status().isBadRequest());
  }

  @Test
  void rejectsExternalBatchWithoutWorkshop() throws Exception {
    mockMvc
        .perform(
            post("/api/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "cutDate": "2030-01-10",
                      "status": "external_workshop",
                      "lineItems": [{"productId": %d, "quantity": 2}]
                    }
                    """
                        .formatted(productId)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Workshop required"));
  }

  @Test
  void rejectsUnknownStatusValue() throws Exception {
    mockMvc
        .perform(
            post("/api/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "cutDate": "2030-01-10",
                      "status": "lost_in_transit",
                      "lineItems": [{"productId": %d, "quantity": 2}]
                    }
                    """
                        .formatted(productId)))
        .andExpect(status().isBadRequest());
  }

  @Test
  void unknownWorkshopIsNotFound() throws Exception {
    mockMvc
        .perform(
            post("/api/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "cutDate": "2030-01-10",
                      "status": "external_workshop",
                      "workshopId": 987654,
                      "lineItems": [{"productId": %d, "quantity": 2}]
                    }
                    """
                        .formatted(productId)))
        .andExpect(status().isNotFound());
  }

  @Test
  void statusLifecycleStampsAndClearsDates() throws Exception {
    var id = readId(createBatch(internalBatchJson("2030-03-01")));

    mockMvc
        .perform(
            put("/api/batches/" + id + "/status")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"status": "external_workshop", "workshopId": %d}
                    """
                        .formatted(workshopId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("external_workshop"))
        .andExpect(jsonPath("$.workshopId").value(workshopId))
        .andExpect(jsonPath("$.sentToProductionDate").value(LocalDate.now().toString()));

    mockMvc
        .perform(
            put("/api/batches/" + id + "/status")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"status": "returned", "observations": "all pieces back"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("returned"))
        .andExpect(jsonPath("$.actualReturnDate").value(LocalDate.now().toString()))
        .andExpect(jsonPath("$.observations").value("all pieces back"));

    mockMvc
        .perform(
            put("/api/batches/" + id + "/status")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"status": "waiting"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("waiting"))
        .andExpect(jsonPath("$.actualReturnDate").value(nullValue()));
  }

  @Test
  void rejectsTransitionFromWaitingToReturned() throws Exception {
    var id = readId(createBatch(internalBatchJson("2030-03-02")));

    mockMvc
        .perform(
            put("/api/batches/" + id + "/status")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"status": "returned"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid batch status"));
  }

  @Test
  void updateStatusOfUnknownBatchIsNotFound() throws Exception {
    mockMvc
        .perform(
            put("/api/batches/987654/status")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"status": "returned"}
                    """))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.title").value("Batch not found"));
  }

  @Test
  void historyRecordsCreationTransitionsAndImageUpdates() throws Exception {
    var id = readId(createBatch(internalBatchJson("2030-03-03")));

    mockMvc
        .perform(
            put("/api/batches/" + id + "/status")
                .header("X-User-Id", "7")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"status": "internal_production"}
                    """))
        .andExpect(status().isOk());
    mockMvc
        .perform(
            put("/api/batches/" + id + "/image")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"imageUrl": "https://images.example.com/batches/%d.jpg"}
                    """
                        .formatted(id)))
        .andExpect(status().isOk())
        .andExpect(
            jsonPath("$.imageUrl").value("https://images.example.com/batches/" + id + ".jpg"));

    var result =
        mockMvc
            .perform(get("/api/batches/" + id + "/history"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(3)))
            .andReturn();
    List<String> actions = JsonPath.read(result.getResponse().getContentAsString(), "$[*].action");
    assertThat(actions)
        .containsExactlyInAnyOrder(
            "created", "status_changed:internal_production", "image_updated");
    List<Integer> users = JsonPath.read(result.getResponse().getContentAsString(), "$[*].userId");
    assertThat(users).contains(7, 1);
  }

  @Test
  void deletesBatchWithItsHistory() throws Exception {
    var id = readId(createBatch(internalBatchJson("2030-03-04")));

    mockMvc.perform(delete("/api/batches/" + id)).andExpect(status().isNoContent());

    mockMvc.perform(get("/api/batches/" + id)).andExpect(status().isNotFound());
    mockMvc.perform(get("/api/batches/" + id + "/history")).andExpect(status().isNotFound());
  }

  @Test
  void refusesToDeleteInvoicedBatch() throws Exception {
    var id = readId(createBatch(externalBatchJson("2030-03-05", "2030-03-06")));
    mockMvc
        .perform(
            post("/api/invoices")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"workshopId": %d, "batchIds": [%d], "dueDate": "2030-04-30"}
                    """
                        .formatted(workshopId, id)))
        .andExpect(status().isCreated());

    mockMvc
        .perform(delete("/api/batches/" + id))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.title").value("Batch is invoiced"));
    mockMvc
        .perform(get("/api/batches/" + id))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.paid").value(true));
  }

  @Test
  void listsBatchesNewestFirst() throws Exception {
    var older = readId(createBatch(internalBatchJson("2030-03-07")));
    var newer = readId(createBatch(internalBatchJson("2030-03-08")));

    var result = mockMvc.perform(get("/api/batches")).andExpect(status().isOk()).andReturn();
    List<Integer> ids = JsonPath.read(result.getResponse().getContentAsString(), "$[*].id");
    assertThat(ids.indexOf((int) newer)).isLessThan(ids.indexOf((int) older));
  }

  // --- Helpers ---

  private String internalBatchJson(String cutDate) {
    return """
        {"cutDate": "%s", "lineItems": [{"productId": %d, "quantity": 3}]}
        """
        .formatted(cutDate, productId);
  }

  private String externalBatchJson(String cutDate, String expectedReturnDate) {
    return """
        {
          "cutDate": "%s",
          "status": "external_workshop",
          "workshopId": %d,
          "expectedReturnDate": "%s",
          "lineItems": [{"productId": %d, "quantity": 3}]
        }
        """
        .formatted(cutDate, workshopId, expectedReturnDate, productId);
  }

  private String createBatch(String json) throws Exception {
    var result =
        mockMvc
            .perform(post("/api/batches").contentType(MediaType.APPLICATION_JSON).content(json))
            .andExpect(status().isCreated())
            .andReturn();
    return result.getResponse().getContentAsString();
  }

  private static long readId(String json) {
    return ((Number) JsonPath.read(json, "$.id")).longValue();
  }

  private static String readString(String json, String path) {
    return JsonPath.read(json, path);
  }
}
