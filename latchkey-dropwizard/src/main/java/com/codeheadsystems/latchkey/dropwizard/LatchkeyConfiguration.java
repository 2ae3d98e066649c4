package com.codeheadsystems.latchkey.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Dropwizard configuration for the lock cooperator.
 * <p>
 * Clients and cooperator must agree on the modulus. Leaving {@code modulusHex} empty selects
 * the RFC 3526 2048-bit MODP prime. Leaving {@code keyRingFile} empty keeps the key ring in
 * memory (dev/test only: every blob becomes unrecoverable through the cooperator on restart).
 */
public class LatchkeyConfiguration extends Configuration {

  /**
   * Hex-encoded prime modulus, at least 127 bits. Empty for the RFC 3526 default.
   */
  @NotNull
  private String modulusHex = "";

  /**
   * How many retired keys keep removing locks. 0 disables the grace list.
   */
  @Min(0)
  private int maxGraceKeys = 5;

  /**
   * How long a retired key keeps removing locks.
   */
  @Min(0)
  private long graceKeyMaxAgeSeconds = 30L * 24 * 60 * 60;

  /**
   * Path of the JSON key ring file. It holds private exponents; protect it.
   */
  @NotNull
  private String keyRingFile = "";

  /**
   * Gets modulus hex.
   *
   * @return the modulus hex
   */
  @JsonProperty
  public String getModulusHex() {
    return modulusHex;
  }

  /**
   * Sets modulus hex.
   *
   * @param modulusHex the modulus hex
   */
  @JsonProperty
  public void setModulusHex(String modulusHex) {
    this.modulusHex = modulusHex;
  }

  /**
   * Gets max grace keys.
   *
   * @return the max grace keys
   */
  @JsonProperty
  public int getMaxGraceKeys() {
    return maxGraceKeys;
  }

  /**
   * Sets max grace keys.
   *
   * @param maxGraceKeys the max grace keys
   */
  @JsonProperty
  public void setMaxGraceKeys(int maxGraceKeys) {
    this.maxGraceKeys = maxGraceKeys;
  }

  /**
   * Gets grace key max age seconds.
   *
   * @return the grace key max age seconds
   */
  @JsonProperty
  public long getGraceKeyMaxAgeSeconds() {
    return graceKeyMaxAgeSeconds;
  }

  /**
   * Sets grace key max age seconds.
   *
   * @param graceKeyMaxAgeSeconds the grace key max age seconds
   */
  @JsonProperty
  public void setGraceKeyMaxAgeSeconds(long graceKeyMaxAgeSeconds) {
    this.graceKeyMaxAgeSeconds = graceKeyMaxAgeSeconds;
  }

  /**
   * Gets key ring file.
   *
   * @return the key ring file
   */
  @JsonProperty
  public String getKeyRingFile() {
    return keyRingFile;
  }

  /**
   * Sets key ring file.
   *
   * @param keyRingFile the key ring file
   */
  @JsonProperty
  public void setKeyRingFile(String keyRingFile) {
    this.keyRingFile = keyRingFile;
  }
}
