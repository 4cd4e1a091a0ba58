package courier.destination.elabftw;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import courier.DestinationSettings;
import courier.ExportContext;
import courier.ExportResult;
import courier.destination.Sessions;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ElabFtwDestinationTest {
  private static final String CDCS_URL = "https://cdcs.example.org/data?id=rec-1";

  private final ObjectMapper mapper = new ObjectMapper();
  private MockWebServer server;
  private Path file;

  @TempDir
  Path tempDir;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    file = tempDir.resolve("session-42.xml");
    Files.writeString(file, "<Experiment/>");
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  private ElabFtwDestination destination(Map<String, String> extra) {
    Map<String, String> values = new HashMap<>(extra);
    values.put(ElabFtwDestination.URL, server.url("/").toString());
    values.put(ElabFtwDestination.API_KEY, "key-1");
    return new ElabFtwDestination(DestinationSettings.of(values), new OkHttpClient());
  }

  @Test
  void enabledOnlyWithUrlAndKey() {
    assertFalse(new ElabFtwDestination(DestinationSettings.empty(), new OkHttpClient()).enabled());
    assertTrue(destination(Map.of()).enabled());
    assertEquals(85, destination(Map.of()).priority());
  }

  @Test
  void exportCreatesExperimentLinkedToCdcsAndAttachesRecord() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(201).setHeader("Location", "/api/v2/experiments/21"));
    server.enqueue(new MockResponse().setResponseCode(201).setHeader("Location", "/api/v2/experiments/21/uploads/4"));

    ExportResult result = destination(Map.of(ElabFtwDestination.CATEGORY, "2"))
        .export(Sessions.withCdcs(file, CDCS_URL));

    assertTrue(result.success(), result.errorMessage());
    assertEquals("21", result.recordId());
    assertEquals(server.url("/experiments.php?mode=view&id=21").toString(), result.recordUrl());
    assertEquals(CDCS_URL, result.metadata().get("cdcs_url"));

    JsonNode payload = mapper.readTree(server.takeRequest().getBody().readUtf8());
    assertEquals("NexusLIMS - FEI-Titan-TEM - session-42", payload.get("title").asText());
    assertTrue(payload.get("body").asText().contains("- [View in CDCS](" + CDCS_URL + ")"));
    assertEquals("jdoe", payload.get("tags").get(2).asText());
    assertEquals(CDCS_URL, payload.get("metadata").get("cdcs_url").asText());
    assertEquals("session-42", payload.get("metadata").get("nexuslims_session_id").asText());
    assertEquals(2, payload.get("category").asInt());

    RecordedRequest upload = server.takeRequest();
    assertEquals("/api/v2/experiments/21/uploads", upload.getPath());
    assertTrue(upload.getBody().readUtf8().contains("NexusLIMS XML record"));
  }

  @Test
  void exportWithoutCdcsOmitsLink() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(201).setHeader("Location", "/api/v2/experiments/3"));
    server.enqueue(new MockResponse().setResponseCode(201).setHeader("Location", "/api/v2/experiments/3/uploads/1"));

    ExportContext context = Sessions.context(file, null);
    context.addResult("cdcs", ExportResult.failure("cdcs", "down"));
    ExportResult result = destination(Map.of()).export(context);

    assertTrue(result.success());
    assertNull(result.metadata().get("cdcs_url"));
    JsonNode payload = mapper.readTree(server.takeRequest().getBody().readUtf8());
    assertFalse(payload.get("body").asText().contains("Related Records"));
    assertFalse(payload.get("metadata").has("cdcs_url"));
    assertFalse(payload.get("metadata").has("user"));
    assertEquals(2, payload.get("tags").size());
  }

  @Test
  void failedUploadBecomesFailure() {
    server.enqueue(new MockResponse().setResponseCode(201).setHeader("Location", "/api/v2/experiments/3"));
    server.enqueue(new MockResponse().setResponseCode(404));

    ExportResult result = destination(Map.of()).export(Sessions.context(file, null));

    assertFalse(result.success());
    assertEquals("Experiment 3 not found", result.errorMessage());
  }

  @Test
  void nonNumericCategoryBecomesFailure() {
    ExportResult result = destination(Map.of(ElabFtwDestination.CATEGORY, "tem"))
        .export(Sessions.context(file, null));

    assertFalse(result.success());
    assertEquals("elabftw.experiment-category must be an integer, got: tem", result.errorMessage());
    assertEquals(0, server.getRequestCount());
  }

  @Test
  void markdownBodyListsSessionDetailsInOrder() {
    String body = ElabFtwDestination.markdownBody(Sessions.context(file, "jdoe"), CDCS_URL);
    List<String> lines = List.of(body.split("\n"));

    assertEquals("# NexusLIMS Microscopy Session", lines.get(0));
    assertTrue(body.indexOf("## Session Details") < body.indexOf("## Related Records"));
    assertTrue(body.indexOf("## Related Records") < body.indexOf("## Files"));
    assertTrue(lines.contains("- **User**: jdoe"));
    assertTrue(lines.contains("- **Start**: " + Sessions.START));
    assertEquals("The complete NexusLIMS XML record is attached to this experiment.", lines.get(lines.size() - 1));
  }

  @Test
  void validateConfigProbesExperimentList() throws Exception {
    server.enqueue(new MockResponse().setBody("[]"));
    assertTrue(destination(Map.of()).validateConfig().valid());
    assertEquals("/api/v2/experiments?limit=1&offset=0", server.takeRequest().getPath());

    server.enqueue(new MockResponse().setResponseCode(401));
    assertEquals("eLabFTW authentication failed: Authentication failed - check API key",
        destination(Map.of()).validateConfig().error());
  }

  @Test
  void providerCreatesDestination() {
    assertThrows(NullPointerException.class, () -> new ElabFtwDestination.Provider().create(null));
    assertEquals("elabftw", new ElabFtwDestination.Provider().create(DestinationSettings.empty()).name());
  }
}
