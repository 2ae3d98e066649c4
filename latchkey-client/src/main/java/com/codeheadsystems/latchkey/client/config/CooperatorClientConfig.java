package com.codeheadsystems.latchkey.client.config;

import java.net.URI;
import java.time.Duration;

/**
 * Where the remote cooperator lives and how long a single HTTP call may take.
 *
 * @param baseUri        base URI of the cooperator API; a trailing slash is added if missing
 * @param requestTimeout per-request timeout, separate from the ceremony timeout
 */
public record CooperatorClientConfig(URI baseUri, Duration requestTimeout) {

  /**
   * Default per-request timeout.
   */
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

  /**
   * Instantiates a new Cooperator client config.
   *
   * @param baseUri        the base uri
   * @param requestTimeout the request timeout
   */
  public CooperatorClientConfig {
    if (baseUri == null) {
      throw new IllegalArgumentException("Missing required field: baseUri");
    }
    if (!baseUri.getPath().endsWith("/")) {
      baseUri = URI.create(baseUri + "/");
    }
    if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
      throw new IllegalArgumentException("requestTimeout must be positive");
    }
  }

  /**
   * Config with the default request timeout.
   *
   * @param baseUri the base uri
   */
  public CooperatorClientConfig(URI baseUri) {
    this(baseUri, DEFAULT_REQUEST_TIMEOUT);
  }
}
