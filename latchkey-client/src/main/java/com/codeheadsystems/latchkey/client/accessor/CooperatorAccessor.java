package com.codeheadsystems.latchkey.client.accessor;

import com.codeheadsystems.latchkey.client.config.CooperatorClientConfig;
import com.codeheadsystems.latchkey.client.exceptions.CooperatorAccessorException;
import com.codeheadsystems.latchkey.exceptions.UnknownKeyIdException;
import com.codeheadsystems.latchkey.model.lock.ApplyLockRequest;
import com.codeheadsystems.latchkey.model.lock.ApplyLockResponse;
import com.codeheadsystems.latchkey.model.lock.ErrorResponse;
import com.codeheadsystems.latchkey.model.lock.KeyInfoResponse;
import com.codeheadsystems.latchkey.model.lock.LockValues;
import com.codeheadsystems.latchkey.model.lock.RemoveLockRequest;
import com.codeheadsystems.latchkey.model.lock.RemoveLockResponse;
import com.codeheadsystems.latchkey.shamir.CommutativeCipher;
import com.codeheadsystems.latchkey.shamir.CooperatorKeyInfo;
import com.codeheadsystems.latchkey.shamir.LockCooperator;
import com.codeheadsystems.latchkey.shamir.LockedValue;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.math.BigInteger;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import org.bouncycastle.util.BigIntegers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for a remote cooperator. Speaks the JSON lock API and presents it as a
 * {@link LockCooperator}, so the unlock path does not care whether the cooperator is local.
 */
@Singleton
public class CooperatorAccessor implements LockCooperator {

  private static final Logger log = LoggerFactory.getLogger(CooperatorAccessor.class);

  private final CooperatorClientConfig config;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final CommutativeCipher cipher;

  /**
   * Instantiates a new Cooperator accessor.
   *
   * @param config       the config
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param cipher       the cipher for the shared modulus
   */
  @Inject
  public CooperatorAccessor(final CooperatorClientConfig config,
                            final HttpClient httpClient,
                            final ObjectMapper objectMapper,
                            final CommutativeCipher cipher) {
    log.info("CooperatorAccessor({})", config);
    this.config = config;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.cipher = cipher;
  }

  @Override
  public LockedValue applyLock(final BigInteger blindedValue) {
    log.trace("applyLock()");
    ApplyLockRequest request = new ApplyLockRequest(LockValues.encode(cipher.encode(blindedValue)));
    ApplyLockResponse response = post("lock/apply", request, ApplyLockResponse.class, null);
    if (response == null || response.keyId() == null || response.keyId().isBlank()) {
      throw new CooperatorAccessorException("Cooperator response missing keyId", null);
    }
    return new LockedValue(decodeValue(response.doubleBlindedValue(), "doubleBlindedValue"), response.keyId());
  }

  @Override
  public BigInteger removeLock(final BigInteger blindedValue, final String keyId) {
    log.trace("removeLock(keyId={})", keyId);
    RemoveLockRequest request = new RemoveLockRequest(LockValues.encode(cipher.encode(blindedValue)), keyId);
    RemoveLockResponse response = post("lock/remove", request, RemoveLockResponse.class, keyId);
    if (response == null) {
      throw new CooperatorAccessorException("Empty cooperator response", null);
    }
    return decodeValue(response.value(), "value");
  }

  @Override
  public CooperatorKeyInfo keyInfo() {
    log.trace("keyInfo()");
    HttpRequest httpRequest = HttpRequest.newBuilder()
        .uri(resolve("key-info"))
        .timeout(config.requestTimeout())
        .header("Accept", "application/json")
        .GET()
        .build();
    KeyInfoResponse response = send(httpRequest, KeyInfoResponse.class, null);
    if (response == null || response.currentKeyId() == null) {
      throw new CooperatorAccessorException("Cooperator key info missing currentKeyId", null);
    }
    try {
      BigInteger modulus = BigIntegers.fromUnsignedByteArray(LockValues.decode(response.modulus(), "modulus"));
      List<String> grace = response.graceKeyIds() == null ? List.of() : response.graceKeyIds();
      return new CooperatorKeyInfo(response.currentKeyId(), modulus, grace);
    } catch (IllegalArgumentException e) {
      throw new CooperatorAccessorException("Malformed key info from cooperator", e);
    }
  }

  @Override
  public String toString() {
    return "CooperatorAccessor[" + config.baseUri() + "]";
  }

  private <T> T post(final String path, final Object body, final Class<T> type, final String keyId) {
    final String requestBody;
    try {
      requestBody = objectMapper.writeValueAsString(body);
    } catch (IOException e) {
      throw new CooperatorAccessorException("Unable to encode request for " + path, e);
    }
    HttpRequest httpRequest = HttpRequest.newBuilder()
        .uri(resolve(path))
        .timeout(config.requestTimeout())
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(requestBody))
        .build();
    return send(httpRequest, type, keyId);
  }

  private <T> T send(final HttpRequest httpRequest, final Class<T> type, final String keyId) {
    try {
      final HttpResponse<String> httpResponse = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      checkStatus(httpRequest.uri(), httpResponse, keyId);
      return objectMapper.readValue(httpResponse.body(), type);
    } catch (IOException e) {
      throw new CooperatorAccessorException("HTTP request failed for " + httpRequest.uri(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CooperatorAccessorException("HTTP request interrupted for " + httpRequest.uri(), e);
    }
  }

  private void checkStatus(final URI uri, final HttpResponse<String> httpResponse, final String keyId) {
    int statusCode = httpResponse.statusCode();
    if (statusCode == 404 && keyId != null && isUnknownKeyId(httpResponse.body())) {
      log.debug("Cooperator does not know keyId={}", keyId);
      throw new UnknownKeyIdException(keyId);
    }
    if (statusCode == 401) {
      throw new SecurityException("Cooperator rejected request (401) for " + uri);
    }
    if (statusCode >= 400) {
      throw new CooperatorAccessorException("Cooperator returned HTTP " + statusCode + " for " + uri, null);
    }
  }

  private boolean isUnknownKeyId(final String body) {
    if (body == null || body.isBlank()) {
      return false;
    }
    try {
      ErrorResponse error = objectMapper.readValue(body, ErrorResponse.class);
      return error != null && ErrorResponse.UNKNOWN_KEY_ID.equals(error.error());
    } catch (IOException e) {
      log.debug("Unparseable 404 body: {}", e.getMessage());
      return false;
    }
  }

  private BigInteger decodeValue(final String value, final String name) {
    try {
      return cipher.decode(LockValues.decode(value, name));
    } catch (IllegalArgumentException e) {
      throw new CooperatorAccessorException("Malformed cooperator response field: " + name, e);
    }
  }

  private URI resolve(final String path) {
    return config.baseUri().resolve(path);
  }
}
