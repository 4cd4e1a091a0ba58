package courier.destination.http;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Response;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Shared OkHttp setup for destination clients.
 */
public final class HttpClients {
  public static final long TIMEOUT_SECONDS = 30;

  private HttpClients() {}

  private static final class Holder {
    static final OkHttpClient DEFAULT = new OkHttpClient.Builder()
        .connectTimeout(TIMEOUT_SECONDS, TimeUnit.SECONDS)
        .readTimeout(TIMEOUT_SECONDS, TimeUnit.SECONDS)
        .writeTimeout(TIMEOUT_SECONDS, TimeUnit.SECONDS)
        .build();
  }

  /** Client with 30 s connect, read and write timeouts. */
  public static OkHttpClient defaultClient() {
    return Holder.DEFAULT;
  }

  /**
   * Resolves {@code relative} against {@code base} the way a browser resolves a link:
   * a base without a trailing slash loses its last path segment.
   *
   * @throws IllegalArgumentException if the base is not an http(s) URL
   */
  public static HttpUrl resolve(String base, String relative) {
    HttpUrl baseUrl = HttpUrl.parse(base);
    if (baseUrl == null) {
      throw new IllegalArgumentException("Not an http(s) URL: " + base);
    }
    HttpUrl resolved = baseUrl.resolve(relative);
    if (resolved == null) {
      throw new IllegalArgumentException("Cannot resolve " + relative + " against " + base);
    }
    return resolved;
  }

  /** Reads the body as text, or an empty string if there is none. */
  public static String bodyText(Response response) throws IOException {
    return response.body() == null ? "" : response.body().string();
  }
}
