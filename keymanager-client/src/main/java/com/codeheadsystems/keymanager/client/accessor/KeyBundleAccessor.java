package com.codeheadsystems.keymanager.client.accessor;

import com.codeheadsystems.keymanager.client.exceptions.KeyBundleAccessorException;
import com.codeheadsystems.keymanager.client.model.ServerConnectionInfo;
import com.codeheadsystems.keymanager.model.KeyStatusResponse;
import com.codeheadsystems.keymanager.model.PublishedKeyBundle;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP access to a key server's publication endpoints.
 */
@Singleton
public class KeyBundleAccessor {
  private static final Logger log = LoggerFactory.getLogger(KeyBundleAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ServerConnectionInfo connectionInfo;

  /**
   * Instantiates a new Key bundle accessor.
   *
   * @param httpClient     the http client
   * @param objectMapper   the object mapper
   * @param connectionInfo the server to talk to
   */
  @Inject
  public KeyBundleAccessor(final HttpClient httpClient,
                           final ObjectMapper objectMapper,
                           final ServerConnectionInfo connectionInfo) {
    log.info("KeyBundleAccessor({})", connectionInfo);
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.connectionInfo = connectionInfo;
  }

  /**
   * Fetches the published key bundle of an account. The bundle is not verified.
   *
   * @param accountId the account
   * @return the bundle, or empty if the server has none for this account
   */
  public Optional<PublishedKeyBundle> fetch(final String accountId) {
    log.trace("fetch(accountId={})", accountId);
    return get(accountUri(accountId, "bundle"), accountId, PublishedKeyBundle.class);
  }

  /**
   * Fetches the key health of an account.
   *
   * @param accountId the account
   * @return the status
   */
  public KeyStatusResponse status(final String accountId) {
    log.trace("status(accountId={})", accountId);
    return get(accountUri(accountId, "status"), accountId, KeyStatusResponse.class)
        .orElseThrow(() -> new KeyBundleAccessorException("No status for account: " + accountId, null));
  }

  private <T> Optional<T> get(URI uri, String accountId, Class<T> type) {
    try {
      final HttpRequest httpRequest = HttpRequest.newBuilder()
          .uri(uri)
          .header("Accept", "application/json")
          .GET()
          .build();
      final HttpResponse<String> httpResponse = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      if (httpResponse.statusCode() == 404) {
        log.debug("No {} for account {}", type.getSimpleName(), accountId);
        return Optional.empty();
      }
      checkStatus(accountId, httpResponse.statusCode());
      return Optional.of(objectMapper.readValue(httpResponse.body(), type));
    } catch (IOException e) {
      throw new KeyBundleAccessorException("HTTP request failed for account: " + accountId, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new KeyBundleAccessorException("HTTP request interrupted for account: " + accountId, e);
    }
  }

  private URI accountUri(String accountId, String leaf) {
    if (accountId == null || accountId.isBlank()) {
      throw new IllegalArgumentException("accountId must not be blank");
    }
    String segment = URLEncoder.encode(accountId, StandardCharsets.UTF_8).replace("+", "%20");
    return connectionInfo.resolve("keys/" + segment + "/" + leaf);
  }

  private void checkStatus(String accountId, int statusCode) {
    if (statusCode == 401) {
      throw new SecurityException("Server rejected request (401) for account: " + accountId);
    }
    if (statusCode >= 400) {
      throw new KeyBundleAccessorException(
          "Server returned HTTP " + statusCode + " for account: " + accountId, null);
    }
  }
}
