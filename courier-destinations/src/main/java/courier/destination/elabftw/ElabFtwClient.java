package courier.destination.elabftw;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import courier.destination.http.HttpClients;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Client for the eLabFTW v2 experiments API. Authenticates with the raw API key in the
 * {@code Authorization} header.
 */
public class ElabFtwClient {
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");

  private final String baseUrl;
  private final String apiKey;
  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;

  public ElabFtwClient(String baseUrl, String apiKey, OkHttpClient httpClient) {
    this(baseUrl, apiKey, httpClient, new ObjectMapper());
  }

  public ElabFtwClient(String baseUrl, String apiKey, OkHttpClient httpClient, ObjectMapper objectMapper) {
    this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
    this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  public String baseUrl() {
    return baseUrl;
  }

  String experimentsEndpoint() {
    return baseUrl + "/api/v2/experiments";
  }

  /** Browser URL of an experiment. */
  public String experimentUrl(long experimentId) {
    return baseUrl + "/experiments.php?mode=view&id=" + experimentId;
  }

  /**
   * Creates an experiment.
   *
   * @param category category id, or {@code null} for the server default
   * @param status status id, or {@code null} for the server default
   * @return the new experiment id
   */
  public long createExperiment(String title, String body, List<String> tags, Map<String, ?> metadata,
      Integer category, Integer status) throws IOException {
    ObjectNode payload = objectMapper.createObjectNode().put("title", title);
    if (body != null) {
      payload.put("body", body);
    }
    if (tags != null && !tags.isEmpty()) {
      payload.set("tags", objectMapper.valueToTree(tags));
    }
    if (metadata != null && !metadata.isEmpty()) {
      payload.set("metadata", objectMapper.valueToTree(metadata));
    }
    if (category != null) {
      payload.put("category", category);
    }
    if (status != null) {
      payload.put("status", status);
    }
    String endpoint = experimentsEndpoint();
    Request request = newRequest(endpoint)
        .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
        .build();
    try (Response response = httpClient.newCall(request).execute()) {
      return createdId(response, endpoint, "experiment");
    }
  }

  /**
   * Attaches a file to an experiment as a multipart upload.
   *
   * @return the upload id
   */
  public long uploadFile(long experimentId, Path file, String comment) throws IOException {
    if (!Files.isRegularFile(file)) {
      throw new FileNotFoundException("File not found: " + file);
    }
    String endpoint = experimentsEndpoint() + "/" + experimentId + "/uploads";
    MultipartBody.Builder body = new MultipartBody.Builder()
        .setType(MultipartBody.FORM)
        .addFormDataPart("file", file.getFileName().toString(), RequestBody.create(file.toFile(), OCTET_STREAM));
    if (comment != null) {
      body.addFormDataPart("comment", comment);
    }
    Request request = newRequest(endpoint).post(body.build()).build();
    try (Response response = httpClient.newCall(request).execute()) {
      if (response.code() == 404) {
        throw new ElabFtwNotFoundException("Experiment " + experimentId + " not found");
      }
      return createdId(response, endpoint, "upload");
    }
  }

  /** Lists experiments; used as an authentication probe. */
  public JsonNode listExperiments(int limit, int offset) throws IOException {
    HttpUrl url = HttpUrl.get(experimentsEndpoint()).newBuilder()
        .addQueryParameter("limit", Integer.toString(limit))
        .addQueryParameter("offset", Integer.toString(offset))
        .build();
    Request request = new Request.Builder().url(url).header("Authorization", apiKey).get().build();
    try (Response response = httpClient.newCall(request).execute()) {
      String text = HttpClients.bodyText(response);
      checkError(response, url.toString(), text);
      try {
        return objectMapper.readTree(text);
      } catch (IOException ex) {
        throw new ElabFtwException("Failed to parse response JSON: " + ex.getMessage(), ex);
      }
    }
  }

  private long createdId(Response response, String endpoint, String what) throws IOException {
    String text = HttpClients.bodyText(response);
    if (response.code() != 201) {
      checkError(response, endpoint, text);
      throw new ElabFtwException("Unexpected status " + response.code() + " creating " + what + ": " + text);
    }
    String location = response.header("Location");
    if (location != null && !location.isBlank()) {
      return idFromLocation(location, what);
    }
    try {
      JsonNode id = objectMapper.readTree(text).path("id");
      if (id.canConvertToLong()) {
        return id.asLong();
      }
    } catch (IOException ex) {
      throw new ElabFtwException("201 Created response missing Location header and JSON body", ex);
    }
    throw new ElabFtwException("201 Created response missing Location header and JSON body");
  }

  static long idFromLocation(String location, String what) throws ElabFtwException {
    String trimmed = location.endsWith("/") ? location.substring(0, location.length() - 1) : location;
    String last = trimmed.substring(trimmed.lastIndexOf('/') + 1);
    try {
      return Long.parseLong(last);
    } catch (NumberFormatException ex) {
      throw new ElabFtwException("Failed to parse " + what + " ID from Location header: " + location, ex);
    }
  }

  private static void checkError(Response response, String url, String text) throws ElabFtwException {
    if (response.isSuccessful()) {
      return;
    }
    if (response.code() == 401) {
      throw new ElabFtwAuthenticationException("Authentication failed - check API key");
    }
    if (response.code() == 404) {
      throw new ElabFtwNotFoundException("Resource not found: " + url);
    }
    throw new ElabFtwException("API request failed with status " + response.code() + ": " + text);
  }

  private Request.Builder newRequest(String url) {
    return new Request.Builder().url(url).header("Authorization", apiKey);
  }

  private static String stripTrailingSlash(String url) {
    String result = url;
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }
}
