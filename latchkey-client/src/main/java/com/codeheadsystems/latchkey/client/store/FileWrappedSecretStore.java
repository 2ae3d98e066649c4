package com.codeheadsystems.latchkey.client.store;

import com.codeheadsystems.latchkey.client.model.AccountRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One JSON file per account under a directory. File names are the base64url of the account id,
 * so any id maps to a safe name. Ids whose encoding would exceed {@link #MAX_ENCODED_NAME} are
 * stored under "sha256." plus the base64url SHA-256 of the id instead. The dot never occurs in
 * base64url, so hashed names cannot collide with plain ones. Saves go through a temp file and an
 * atomic move.
 */
public class FileWrappedSecretStore implements WrappedSecretStore {

  private static final Logger log = LoggerFactory.getLogger(FileWrappedSecretStore.class);
  private static final String SUFFIX = ".json";
  private static final String HASHED_PREFIX = "sha256.";
  static final int MAX_ENCODED_NAME = 128;

  private final Path directory;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new File wrapped secret store.
   *
   * @param directory the directory, created on first save
   */
  public FileWrappedSecretStore(final Path directory) {
    this.directory = directory;
    this.objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);
    log.info("FileWrappedSecretStore({})", directory);
  }

  @Override
  public Optional<AccountRecord> load(String accountId) {
    Path file = fileFor(accountId);
    if (!Files.exists(file)) {
      log.debug("load({}) no record", accountId);
      return Optional.empty();
    }
    try {
      AccountRecordDocument document = objectMapper.readValue(file.toFile(), AccountRecordDocument.class);
      if (!accountId.equals(document.accountId())) {
        throw new IllegalStateException("Record at " + file + " belongs to another account");
      }
      return Optional.of(document.toRecord());
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read account record from " + file, e);
    }
  }

  @Override
  public synchronized void save(AccountRecord record) {
    Path file = fileFor(record.accountId());
    Path temp = file.resolveSibling(file.getFileName() + ".tmp");
    try {
      Files.createDirectories(directory);
      objectMapper.writeValue(temp.toFile(), AccountRecordDocument.from(record));
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      log.debug("save({}) blobKeyId={}", record.accountId(),
          record.blob() == null ? null : record.blob().serverKeyId());
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to write account record to " + file, e);
    }
  }

  @Override
  public synchronized boolean delete(String accountId) {
    Path file = fileFor(accountId);
    try {
      return Files.deleteIfExists(file);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to delete account record " + file, e);
    }
  }

  private Path fileFor(String accountId) {
    if (accountId == null || accountId.isBlank()) {
      throw new IllegalArgumentException("Missing required field: accountId");
    }
    Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
    byte[] idBytes = accountId.getBytes(StandardCharsets.UTF_8);
    String name = encoder.encodeToString(idBytes);
    if (name.length() > MAX_ENCODED_NAME) {
      name = HASHED_PREFIX + encoder.encodeToString(sha256(idBytes));
    }
    return directory.resolve(name + SUFFIX);
  }

  private static byte[] sha256(byte[] input) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(input);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
