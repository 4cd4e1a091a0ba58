package courier.destination.cdcs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import courier.destination.http.HttpClients;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Minimal CDCS REST client: template and workspace lookup, record upload and workspace
 * assignment. Authenticates with {@code Authorization: Token <token>}.
 */
public class CdcsClient {
  private static final Logger logger = Logger.getLogger(CdcsClient.class.getName());
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final String baseUrl;
  private final String token;
  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;

  public CdcsClient(String baseUrl, String token, OkHttpClient httpClient) {
    this(baseUrl, token, httpClient, new ObjectMapper());
  }

  public CdcsClient(String baseUrl, String token, OkHttpClient httpClient, ObjectMapper objectMapper) {
    this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
    this.token = Objects.requireNonNull(token, "token");
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  /** Id of the current version of the global template. */
  public String currentTemplateId() throws IOException {
    JsonNode templates = getJson("rest/template-version-manager/global");
    JsonNode current = templates.path(0).path("current");
    if (current.isMissingNode() || current.isNull()) {
      throw new CdcsException("CDCS returned no global template");
    }
    return current.asText();
  }

  /** Id of the first workspace the token can read. */
  public String workspaceId() throws IOException {
    JsonNode workspaces = getJson("rest/workspace/read_access");
    JsonNode id = workspaces.path(0).path("id");
    if (id.isMissingNode() || id.isNull()) {
      throw new CdcsException("CDCS returned no readable workspace");
    }
    return id.asText();
  }

  /**
   * Uploads an XML record against the current template.
   *
   * @return the new record id
   */
  public String createRecord(String title, String xmlContent) throws IOException {
    ObjectNode payload = objectMapper.createObjectNode()
        .put("template", currentTemplateId())
        .put("title", title)
        .put("xml_content", xmlContent);
    Request request = newRequest("rest/data/")
        .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
        .build();
    try (Response response = httpClient.newCall(request).execute()) {
      String body = HttpClients.bodyText(response);
      checkAuthenticated(response);
      if (response.code() != 201) {
        throw new CdcsException("CDCS upload failed: " + body);
      }
      JsonNode id = objectMapper.readTree(body).path("id");
      if (id.isMissingNode() || id.isNull()) {
        throw new CdcsException("CDCS upload response has no id: " + body);
      }
      return id.asText();
    }
  }

  /** Assigns a record to a workspace. */
  public void assignToWorkspace(String recordId, String workspaceId) throws IOException {
    Request request = newRequest("rest/data/" + recordId + "/assign/" + workspaceId)
        .patch(RequestBody.create(new byte[0], null))
        .build();
    try (Response response = httpClient.newCall(request).execute()) {
      checkAuthenticated(response);
      if (!response.isSuccessful()) {
        logger.log(Level.WARNING, "CDCS workspace assignment of record {0} returned HTTP {1}",
            new Object[]{recordId, response.code()});
      }
    }
  }

  /** Public URL of a record. */
  public String recordUrl(String recordId) {
    return HttpClients.resolve(baseUrl, "data?id=" + recordId).toString();
  }

  private JsonNode getJson(String path) throws IOException {
    Request request = newRequest(path).get().build();
    try (Response response = httpClient.newCall(request).execute()) {
      String body = HttpClients.bodyText(response);
      checkAuthenticated(response);
      if (!response.isSuccessful()) {
        throw new CdcsException("CDCS request " + path + " failed with status " + response.code() + ": " + body);
      }
      return objectMapper.readTree(body);
    }
  }

  private Request.Builder newRequest(String path) {
    HttpUrl url = HttpClients.resolve(baseUrl, path);
    return new Request.Builder()
        .url(url)
        .header("Authorization", "Token " + token);
  }

  private static void checkAuthenticated(Response response) throws CdcsAuthenticationException {
    if (response.code() == 401 || response.code() == 403) {
      throw new CdcsAuthenticationException("Could not authenticate to CDCS");
    }
  }
}
