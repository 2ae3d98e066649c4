package com.codeheadsystems.latchkey.client.manager;

import com.codeheadsystems.latchkey.channel.OneTimeChannel;
import com.codeheadsystems.latchkey.client.ceremony.AuthenticationCeremony;
import com.codeheadsystems.latchkey.client.ceremony.CeremonyRequest;
import com.codeheadsystems.latchkey.client.ceremony.CeremonyResult;
import com.codeheadsystems.latchkey.client.ceremony.Purpose;
import com.codeheadsystems.latchkey.client.config.CustodyConfig;
import com.codeheadsystems.latchkey.client.config.SessionPolicy;
import com.codeheadsystems.latchkey.client.exceptions.AccountNotFoundException;
import com.codeheadsystems.latchkey.client.exceptions.CeremonyCancelledException;
import com.codeheadsystems.latchkey.client.exceptions.CooperatorAccessorException;
import com.codeheadsystems.latchkey.client.exceptions.RecoveryFailedException;
import com.codeheadsystems.latchkey.client.model.AccountRecord;
import com.codeheadsystems.latchkey.client.model.ProgressEvent;
import com.codeheadsystems.latchkey.client.model.ProgressListener;
import com.codeheadsystems.latchkey.client.store.WrappedSecretStore;
import com.codeheadsystems.latchkey.common.ByteUtils;
import com.codeheadsystems.latchkey.common.RandomProvider;
import com.codeheadsystems.latchkey.exceptions.CapabilityUnavailableException;
import com.codeheadsystems.latchkey.exceptions.DerivationMismatchException;
import com.codeheadsystems.latchkey.exceptions.InvalidProofException;
import com.codeheadsystems.latchkey.exceptions.UnknownKeyIdException;
import com.codeheadsystems.latchkey.kdf.KeyDerivationPipeline;
import com.codeheadsystems.latchkey.session.CapabilityGrant;
import com.codeheadsystems.latchkey.session.CapabilityStatus;
import com.codeheadsystems.latchkey.session.SessionCapabilityStore;
import com.codeheadsystems.latchkey.shamir.UnlockCooperator;
import com.codeheadsystems.latchkey.shamir.WrappedSecretBlob;
import com.codeheadsystems.latchkey.signer.EphemeralSigningUnit;
import com.codeheadsystems.latchkey.signer.SignedPayload;
import com.codeheadsystems.latchkey.signer.SigningKeyVault;
import com.codeheadsystems.latchkey.vrf.BlockReference;
import com.codeheadsystems.latchkey.vrf.ChallengeContext;
import com.codeheadsystems.latchkey.vrf.ChallengeEngine;
import com.codeheadsystems.latchkey.vrf.ChallengeInput;
import com.codeheadsystems.latchkey.vrf.FreshnessOracle;
import com.codeheadsystems.latchkey.vrf.VrfKeyPair;
import com.codeheadsystems.latchkey.vrf.VrfProof;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.UncheckedIOException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates registration, the cold path, the warm path and signing for one device.
 * <p>
 * Cold path: the cooperator helps recover the account's VRF secret key, a VRF challenge bound
 * to the session policy is issued, the user completes the ceremony, and a wrap key seed is
 * minted into the session store. Warm path: each signature dispenses one use from the store
 * into a fresh {@link EphemeralSigningUnit}. When the store has nothing usable the cold path
 * runs again with the default policy.
 * <p>
 * If the cooperator is unreachable or no longer knows the blob's key, the secret is rebuilt
 * from the ceremony's secondary secret and re-wrapped under the cooperator's current key once
 * the session is minted.
 */
@Singleton
public class KeyCustodyManager {

  private static final Logger log = LoggerFactory.getLogger(KeyCustodyManager.class);
  private static final int WRAP_KEY_SALT_LENGTH = 32;

  private final CustodyConfig config;
  private final UnlockCooperator unlockCooperator;
  private final ChallengeEngine challengeEngine;
  private final KeyDerivationPipeline pipeline;
  private final SessionCapabilityStore sessionStore;
  private final SigningKeyVault vault;
  private final WrappedSecretStore secretStore;
  private final AuthenticationCeremony ceremony;
  private final FreshnessOracle freshnessOracle;
  private final ProgressListener progressListener;
  private final ExecutorService executor;
  private final RandomProvider randomProvider;
  private final Clock clock;
  private final Map<String, CompletableFuture<CeremonyResult>> inFlight = new ConcurrentHashMap<>();

  /**
   * Instantiates a new Key custody manager.
   *
   * @param config           the config
   * @param unlockCooperator the unlock cooperator
   * @param challengeEngine  the challenge engine
   * @param pipeline         the derivation pipeline
   * @param sessionStore     the session store
   * @param vault            the signing key vault
   * @param secretStore      the account record store
   * @param ceremony         the authentication ceremony
   * @param freshnessOracle  the ledger block source
   * @param progressListener the progress listener
   * @param executor         runs signing units
   * @param randomProvider   the random provider
   * @param clock            the clock
   */
  @Inject
  public KeyCustodyManager(final CustodyConfig config,
                           final UnlockCooperator unlockCooperator,
                           final ChallengeEngine challengeEngine,
                           final KeyDerivationPipeline pipeline,
                           final SessionCapabilityStore sessionStore,
                           final SigningKeyVault vault,
                           final WrappedSecretStore secretStore,
                           final AuthenticationCeremony ceremony,
                           final FreshnessOracle freshnessOracle,
                           final ProgressListener progressListener,
                           final ExecutorService executor,
                           final RandomProvider randomProvider,
                           final Clock clock) {
    this.config = config;
    this.unlockCooperator = unlockCooperator;
    this.challengeEngine = challengeEngine;
    this.pipeline = pipeline;
    this.sessionStore = sessionStore;
    this.vault = vault;
    this.secretStore = secretStore;
    this.ceremony = ceremony;
    this.freshnessOracle = freshnessOracle;
    this.progressListener = progressListener;
    this.executor = executor;
    this.randomProvider = randomProvider;
    this.clock = clock;
    log.info("KeyCustodyManager({})", config);
  }

  /**
   * Enrols an account: runs a registration ceremony, derives the VRF key pair from the
   * secondary secret, wraps it with the cooperator and seals a fresh signing key.
   * <p>
   * If the cooperator cannot be reached the record is saved without a blob; the first unlock
   * then goes through recovery and wraps it.
   *
   * @param accountId the account id
   * @return the saved record
   * @throws CeremonyCancelledException if the ceremony fails or returns no secondary secret
   */
  public AccountRecord register(final String accountId) {
    requireText(accountId, "accountId");
    log.debug("register({})", accountId);
    ChallengeInput input = challengeEngine.buildChallenge(context(accountId, null));
    CeremonyResult result = awaitCeremony(accountId,
        new CeremonyRequest(accountId, Purpose.REGISTER, input.digest(), null));
    byte[] recoverySeed = null;
    VrfKeyPair keyPair = null;
    byte[] wrapKeySeed = null;
    byte[] kek = null;
    try {
      byte[] secondary = result.secondarySecret()
          .orElseThrow(() -> new CeremonyCancelledException("Registration ceremony returned no secondary secret"));
      recoverySeed = pipeline.recoverySeed(secondary, accountId);
      keyPair = challengeEngine.keyPairFromSeed(recoverySeed);
      WrappedSecretBlob blob = wrapOrNull(accountId, keyPair.secretKey());
      byte[] salt = randomProvider.randomBytes(WRAP_KEY_SALT_LENGTH);
      wrapKeySeed = pipeline.wrapKeySeed(result.primarySecret(), keyPair.secretKey());
      kek = pipeline.decryptionKey(wrapKeySeed, salt);
      AccountRecord record = new AccountRecord(accountId, blob, salt, keyPair.publicKey().clone(),
          vault.generate(kek), clock.instant());
      secretStore.save(record);
      log.info("register({}) complete, wrapped={}", accountId, blob != null);
      return record;
    } finally {
      ByteUtils.zeroize(recoverySeed, wrapKeySeed, kek);
      if (keyPair != null) {
        keyPair.destroy();
      }
      result.destroy();
    }
  }

  /**
   * The cold path. Nothing is minted unless every step succeeds.
   *
   * @param accountId the account id
   * @param sessionId the session id
   * @param policy    the budget to mint
   * @return status of the minted capability
   * @throws AccountNotFoundException    if the account was never registered
   * @throws CeremonyCancelledException  if a ceremony is aborted, times out or lacks presence
   * @throws RecoveryFailedException     if the fallback cannot rebuild the secret
   * @throws InvalidProofException       if the recovered secret does not match the account's VRF key
   * @throws DerivationMismatchException if the ceremony's secret does not open the signing key
   */
  public CapabilityStatus unlockSession(final String accountId, final String sessionId, final SessionPolicy policy) {
    requireText(sessionId, "sessionId");
    if (policy == null) {
      throw new IllegalArgumentException("Missing required field: policy");
    }
    AccountRecord record = loadRecord(accountId);
    log.debug("unlockSession(accountId={}, sessionId={}, policy={})", accountId, sessionId, policy);
    byte[] secret = null;
    byte[] wrapKeySeed = null;
    byte[] kek = null;
    byte[] signingKey = null;
    CeremonyResult result = null;
    try {
      secret = cooperatorUnlock(record, sessionId);
      boolean recovered = secret == null;
      if (recovered) {
        secret = recover(record, sessionId);
      }

      ChallengeInput input = challengeEngine.buildChallenge(context(accountId, policy.digest(sessionId)));
      VrfProof proof = challengeEngine.evaluate(secret, input);
      challengeEngine.verify(record.vrfPublicKey(), input, proof);
      emit(ProgressEvent.Phase.CHALLENGE_ISSUED, accountId, sessionId);
      result = awaitCeremony(sessionId, new CeremonyRequest(accountId, Purpose.AUTHENTICATE, proof.output(), proof));

      wrapKeySeed = pipeline.wrapKeySeed(result.primarySecret(), secret);
      kek = pipeline.decryptionKey(wrapKeySeed, record.wrapKeySalt());
      signingKey = vault.open(kek, record.signingKey());

      rewrap(record, secret, recovered, sessionId);
      sessionStore.mint(sessionId, wrapKeySeed, record.wrapKeySalt(), policy.ttl(), policy.maxUses());
      emit(ProgressEvent.Phase.SESSION_MINTED, accountId, sessionId);
      log.info("unlockSession({}) minted session {}", accountId, sessionId);
      return sessionStore.status(sessionId)
          .orElseThrow(() -> new IllegalStateException("Session vanished after mint: " + sessionId));
    } finally {
      ByteUtils.zeroize(secret, wrapKeySeed, kek, signingKey);
      if (result != null) {
        result.destroy();
      }
    }
  }

  /**
   * Signs with the account's signing key. Uses the warm session if it has budget left,
   * otherwise runs the cold path with the default policy first.
   *
   * @param accountId the account id
   * @param sessionId the session id
   * @param payload   the payload
   * @return the signed payload
   * @throws CapabilityUnavailableException if the session is unusable and the cold path failed;
   *                                        the cold-path failure is attached as suppressed
   */
  public SignedPayload sign(final String accountId, final String sessionId, final byte[] payload) {
    requireText(sessionId, "sessionId");
    if (payload == null) {
      throw new IllegalArgumentException("Missing required field: payload");
    }
    AccountRecord record = loadRecord(accountId);
    // room for a recovery prompt and an authentication ceremony on the cold path
    Duration receiveTimeout = config.ceremonyTimeout().multipliedBy(2).plus(config.signingTimeout());
    OneTimeChannel<CapabilityGrant> channel = OneTimeChannel.create();
    Future<SignedPayload> future = executor.submit(new EphemeralSigningUnit(
        pipeline, vault, channel.receiver(), record.signingKey(), payload, receiveTimeout));
    try {
      dispenseOrColdPath(accountId, sessionId, channel.sender());
      SignedPayload signed = future.get(config.signingTimeout().toMillis(), TimeUnit.MILLISECONDS);
      emit(ProgressEvent.Phase.SIGNED, accountId, sessionId);
      log.debug("sign(accountId={}, sessionId={}) signed {} bytes", accountId, sessionId, payload.length);
      return signed;
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("Signing unit failed", e.getCause());
    } catch (TimeoutException e) {
      throw new IllegalStateException("Signing unit did not finish within " + config.signingTimeout(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while signing", e);
    } finally {
      channel.sender().close();
      if (!future.isDone()) {
        future.cancel(true);
      }
    }
  }

  /**
   * Aborts an in-flight ceremony. The waiting call fails with
   * {@link CeremonyCancelledException} and nothing is minted.
   *
   * @param ceremonyKey the session id, or the account id for a registration
   * @return true if a ceremony was cancelled
   */
  public boolean cancel(final String ceremonyKey) {
    CompletableFuture<CeremonyResult> pending = inFlight.get(ceremonyKey);
    boolean cancelled = pending != null && pending.cancel(true);
    log.debug("cancel({}) -> {}", ceremonyKey, cancelled);
    return cancelled;
  }

  /**
   * Status of a warm session.
   *
   * @param sessionId the session id
   * @return the status, empty if none is live
   */
  public Optional<CapabilityStatus> status(final String sessionId) {
    return sessionStore.status(sessionId);
  }

  /**
   * Destroys one session's capability.
   *
   * @param sessionId the session id
   */
  public void logout(final String sessionId) {
    sessionStore.clear(sessionId);
    log.debug("logout({})", sessionId);
  }

  /**
   * Destroys every capability.
   */
  public void logoutAll() {
    sessionStore.clearAll();
    log.info("logoutAll()");
  }

  private void dispenseOrColdPath(String accountId, String sessionId, OneTimeChannel.Sender<CapabilityGrant> sender) {
    try {
      sessionStore.dispense(sessionId, 1, sender);
      return;
    } catch (CapabilityUnavailableException e) {
      log.debug("Warm path unavailable for {}: {}", sessionId, e.getClass().getSimpleName());
      emit(ProgressEvent.Phase.COLD_PATH_REQUIRED, accountId, sessionId);
      try {
        unlockSession(accountId, sessionId, config.defaultSessionPolicy());
      } catch (InvalidProofException | DerivationMismatchException fatal) {
        throw fatal;
      } catch (RuntimeException coldPathFailure) {
        e.addSuppressed(coldPathFailure);
        throw e;
      }
    }
    sessionStore.dispense(sessionId, 1, sender);
  }

  private WrappedSecretBlob wrapOrNull(String accountId, byte[] secret) {
    try {
      return unlockCooperator.register(secret);
    } catch (CooperatorAccessorException | SecurityException e) {
      log.warn("Cooperator unavailable while registering {}: {}", accountId, e.getMessage());
      return null;
    }
  }

  private byte[] cooperatorUnlock(AccountRecord record, String sessionId) {
    if (record.blob() == null) {
      log.info("No wrapped secret for {}; recovery required", record.accountId());
      return null;
    }
    emit(ProgressEvent.Phase.COOPERATOR_UNLOCK, record.accountId(), sessionId);
    try {
      return unlockCooperator.unlock(record.blob());
    } catch (UnknownKeyIdException | CooperatorAccessorException | SecurityException
             | IllegalArgumentException e) {
      log.warn("Cooperator unlock failed for {} (keyId={}): {}", record.accountId(),
          record.blob().serverKeyId(), e.getMessage());
      return null;
    }
  }

  private byte[] recover(AccountRecord record, String sessionId) {
    String accountId = record.accountId();
    emit(ProgressEvent.Phase.RECOVERY_PROMPT, accountId, sessionId);
    ChallengeInput input = challengeEngine.buildChallenge(context(accountId, null));
    CeremonyResult result = awaitCeremony(sessionId,
        new CeremonyRequest(accountId, Purpose.RECOVER, input.digest(), null));
    byte[] recoverySeed = null;
    VrfKeyPair keyPair = null;
    try {
      byte[] secondary = result.secondarySecret()
          .orElseThrow(() -> new RecoveryFailedException("Recovery ceremony returned no secondary secret", null));
      recoverySeed = pipeline.recoverySeed(secondary, accountId);
      keyPair = challengeEngine.keyPairFromSeed(recoverySeed);
      if (!MessageDigest.isEqual(keyPair.publicKey(), record.vrfPublicKey())) {
        throw new RecoveryFailedException("Recovered key does not match account " + accountId, null);
      }
      log.info("Recovered secret for {} without the cooperator", accountId);
      return keyPair.secretKey().clone();
    } finally {
      ByteUtils.zeroize(recoverySeed);
      if (keyPair != null) {
        keyPair.destroy();
      }
      result.destroy();
    }
  }

  private void rewrap(AccountRecord record, byte[] secret, boolean recovered, String sessionId) {
    try {
      Optional<WrappedSecretBlob> replacement = recovered
          ? Optional.of(unlockCooperator.register(secret))
          : unlockCooperator.migrateIfRotated(record.blob(), secret);
      if (replacement.isPresent()) {
        secretStore.save(record.withBlob(replacement.get(), clock.instant()));
        emit(ProgressEvent.Phase.REWRAPPED, record.accountId(), sessionId);
        log.info("Re-wrapped {} under keyId={}", record.accountId(), replacement.get().serverKeyId());
      }
    } catch (CooperatorAccessorException | SecurityException | IllegalStateException | UncheckedIOException e) {
      // the old blob stays; the next unlock tries again
      log.warn("Re-wrap failed for {}: {}", record.accountId(), e.getMessage());
    }
  }

  private CeremonyResult awaitCeremony(String key, CeremonyRequest request) {
    CompletableFuture<CeremonyResult> slot = new CompletableFuture<>();
    if (inFlight.putIfAbsent(key, slot) != null) {
      throw new IllegalStateException("A ceremony is already in progress for " + key);
    }
    try {
      CompletableFuture<CeremonyResult> future = ceremony.perform(request);
      future.whenComplete((value, error) -> {
        boolean taken = error == null ? slot.complete(value) : slot.completeExceptionally(error);
        if (!taken && value != null) {
          value.destroy();
        }
      });
      slot.whenComplete((value, error) -> {
        if (slot.isCancelled()) {
          future.cancel(true);
        }
      });
      CeremonyResult result = slot.get(config.ceremonyTimeout().toMillis(), TimeUnit.MILLISECONDS);
      if (!result.presenceConfirmed()) {
        result.destroy();
        throw new CeremonyCancelledException("User presence was not confirmed");
      }
      return result;
    } catch (CancellationException e) {
      throw new CeremonyCancelledException("Ceremony cancelled for " + key, e);
    } catch (TimeoutException e) {
      slot.cancel(true);
      throw new CeremonyCancelledException("Ceremony timed out after " + config.ceremonyTimeout(), e);
    } catch (ExecutionException e) {
      throw new CeremonyCancelledException("Ceremony failed for " + key, e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      slot.cancel(true);
      throw new CeremonyCancelledException("Interrupted waiting for ceremony", e);
    } finally {
      inFlight.remove(key, slot);
    }
  }

  private ChallengeContext context(String accountId, byte[] sessionPolicyDigest) {
    BlockReference block = freshnessOracle.latestBlock();
    return new ChallengeContext(config.domainSeparator(), accountId, config.rpId(), block.height(), block.hash(),
        null, sessionPolicyDigest);
  }

  private AccountRecord loadRecord(String accountId) {
    requireText(accountId, "accountId");
    return secretStore.load(accountId).orElseThrow(() -> new AccountNotFoundException(accountId));
  }

  private void emit(ProgressEvent.Phase phase, String accountId, String sessionId) {
    progressListener.onProgress(new ProgressEvent(phase, accountId, sessionId, clock.instant()));
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + name);
    }
  }
}
