package com.codeheadsystems.latchkey.client.config;

import java.time.Duration;

/**
 * Settings for the custody orchestrator.
 *
 * @param domainSeparator      label bound into every challenge
 * @param rpId                 relying-party id bound into every challenge
 * @param ceremonyTimeout      upper bound on one authentication ceremony
 * @param signingTimeout       upper bound on one signing unit once its grant arrives
 * @param defaultSessionPolicy budget used when the warm path has to re-mint
 */
public record CustodyConfig(String domainSeparator,
                            String rpId,
                            Duration ceremonyTimeout,
                            Duration signingTimeout,
                            SessionPolicy defaultSessionPolicy) {

  /**
   * Default challenge domain separator.
   */
  public static final String DEFAULT_DOMAIN_SEPARATOR = "latchkey/vrf/v1";

  /**
   * Instantiates a new Custody config.
   *
   * @param domainSeparator      the domain separator
   * @param rpId                 the rp id
   * @param ceremonyTimeout      the ceremony timeout
   * @param signingTimeout       the signing timeout
   * @param defaultSessionPolicy the default session policy
   */
  public CustodyConfig {
    if (domainSeparator == null || domainSeparator.isBlank()) {
      throw new IllegalArgumentException("Missing required field: domainSeparator");
    }
    if (rpId == null || rpId.isBlank()) {
      throw new IllegalArgumentException("Missing required field: rpId");
    }
    if (ceremonyTimeout == null || ceremonyTimeout.isNegative() || ceremonyTimeout.isZero()) {
      throw new IllegalArgumentException("ceremonyTimeout must be positive");
    }
    if (signingTimeout == null || signingTimeout.isNegative() || signingTimeout.isZero()) {
      throw new IllegalArgumentException("signingTimeout must be positive");
    }
    if (defaultSessionPolicy == null) {
      throw new IllegalArgumentException("Missing required field: defaultSessionPolicy");
    }
  }

  /**
   * Config with a two-minute ceremony, ten-second signing and a 15-minute, 10-use session.
   *
   * @param rpId the rp id
   */
  public CustodyConfig(String rpId) {
    this(DEFAULT_DOMAIN_SEPARATOR, rpId, Duration.ofMinutes(2), Duration.ofSeconds(10),
        new SessionPolicy(Duration.ofMinutes(15), 10));
  }
}
