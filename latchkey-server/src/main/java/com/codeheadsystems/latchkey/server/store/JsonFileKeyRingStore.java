package com.codeheadsystems.latchkey.server.store;

import com.codeheadsystems.latchkey.shamir.CooperatorKeyRing;
import com.codeheadsystems.latchkey.shamir.KeyRingStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the cooperator key ring in a single JSON file. Each save writes a sibling temp file
 * and moves it over the target atomically, so readers never see a partial ring.
 * <p>
 * The file holds the cooperator's private exponents and must be protected accordingly.
 */
public class JsonFileKeyRingStore implements KeyRingStore {

  private static final Logger log = LoggerFactory.getLogger(JsonFileKeyRingStore.class);

  private final Path file;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Json file key ring store.
   *
   * @param file the ring file; parent directories are created on first save
   */
  public JsonFileKeyRingStore(final Path file) {
    this.file = file;
    this.objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);
    log.info("JsonFileKeyRingStore({})", file);
  }

  @Override
  public Optional<CooperatorKeyRing> load() {
    if (!Files.exists(file)) {
      log.info("No key ring at {}", file);
      return Optional.empty();
    }
    try {
      KeyRingDocument document = objectMapper.readValue(file.toFile(), KeyRingDocument.class);
      CooperatorKeyRing ring = document.toKeyRing();
      log.info("Loaded key ring currentKeyId={} graceKeys={}", ring.current().keyId(), ring.grace().size());
      return Optional.of(ring);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read key ring from " + file, e);
    }
  }

  @Override
  public synchronized void save(CooperatorKeyRing ring) {
    Path temp = file.resolveSibling(file.getFileName() + ".tmp");
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      objectMapper.writeValue(temp.toFile(), KeyRingDocument.from(ring));
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      log.debug("Saved key ring currentKeyId={} to {}", ring.current().keyId(), file);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to write key ring to " + file, e);
    }
  }
}
