package com.codeheadsystems.latchkey.dropwizard;

import com.codeheadsystems.latchkey.common.RandomProvider;
import com.codeheadsystems.latchkey.dropwizard.health.CooperatorKeyRingHealthCheck;
import com.codeheadsystems.latchkey.dropwizard.tasks.RemoveGraceKeyTask;
import com.codeheadsystems.latchkey.dropwizard.tasks.RotateCooperatorKeyTask;
import com.codeheadsystems.latchkey.server.resource.LockResource;
import com.codeheadsystems.latchkey.server.resource.UnknownKeyIdExceptionMapper;
import com.codeheadsystems.latchkey.server.store.JsonFileKeyRingStore;
import com.codeheadsystems.latchkey.shamir.CommutativeCipher;
import com.codeheadsystems.latchkey.shamir.CooperatorKeyManager;
import com.codeheadsystems.latchkey.shamir.GracePolicy;
import com.codeheadsystems.latchkey.shamir.InMemoryKeyRingStore;
import com.codeheadsystems.latchkey.shamir.KeyRingStore;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.math.BigInteger;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that serves the lock cooperator API from an existing application.
 * <p>
 * Registers the lock resource, the unknown-key-id mapper, the {@code cooperator-key-ring}
 * health check and the rotation admin tasks. Requires a {@link LatchkeyConfiguration}.
 * <pre>{@code
 *   bootstrap.addBundle(new LatchkeyBundle<>());
 * }</pre>
 * Or with a custom key ring store:
 * <pre>{@code
 *   bootstrap.addBundle(new LatchkeyBundle<>(myKeyRingStore));
 * }</pre>
 */
@Singleton
public class LatchkeyBundle<C extends LatchkeyConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(LatchkeyBundle.class);

  private final KeyRingStore keyRingStore;
  private final Clock clock;

  /**
   * Creates a bundle whose key ring store comes from {@code keyRingFile}, or lives in memory
   * when that is empty.
   */
  public LatchkeyBundle() {
    this.keyRingStore = null;
    this.clock = Clock.systemUTC();
  }

  /**
   * Creates a bundle backed by the supplied key ring store. {@code keyRingFile} is ignored.
   *
   * @param keyRingStore the key ring store
   */
  @Inject
  public LatchkeyBundle(KeyRingStore keyRingStore) {
    this.keyRingStore = keyRingStore;
    this.clock = Clock.systemUTC();
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // nothing to bootstrap
  }

  @Override
  public void run(C configuration, Environment environment) {
    CommutativeCipher cipher = buildCipher(configuration);
    GracePolicy gracePolicy = new GracePolicy(configuration.getMaxGraceKeys(),
        Duration.ofSeconds(configuration.getGraceKeyMaxAgeSeconds()));
    CooperatorKeyManager keyManager = new CooperatorKeyManager(cipher, resolveStore(configuration), gracePolicy, clock);

    environment.jersey().register(new LockResource(keyManager, cipher));
    environment.jersey().register(new UnknownKeyIdExceptionMapper());
    environment.healthChecks().register(CooperatorKeyRingHealthCheck.NAME,
        new CooperatorKeyRingHealthCheck(keyManager, cipher));
    environment.admin().addTask(new RotateCooperatorKeyTask(keyManager));
    environment.admin().addTask(new RemoveGraceKeyTask(keyManager));
    log.info("LatchkeyBundle running: modulusBits={}, currentKeyId={}, gracePolicy={}",
        cipher.modulus().bitLength(), keyManager.currentKeyId(), gracePolicy);
  }

  private KeyRingStore resolveStore(C configuration) {
    if (keyRingStore != null) {
      return keyRingStore;
    }
    String file = configuration.getKeyRingFile();
    if (file == null || file.isBlank()) {
      log.warn("""
          #################################################################
          # WARNING: Cooperator key ring is held in memory. Every wrapped #
          # secret falls back to recovery after a restart.                #
          # Do not use in production.                                     #
          #################################################################
          """);
      return new InMemoryKeyRingStore();
    }
    return new JsonFileKeyRingStore(Path.of(file));
  }

  private CommutativeCipher buildCipher(C configuration) {
    String hex = configuration.getModulusHex();
    if (hex == null || hex.isBlank()) {
      return new CommutativeCipher();
    }
    return new CommutativeCipher(new BigInteger(hex, 16), new RandomProvider());
  }
}
