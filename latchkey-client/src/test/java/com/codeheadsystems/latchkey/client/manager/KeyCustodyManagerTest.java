package com.codeheadsystems.latchkey.client.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

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
import com.codeheadsystems.latchkey.client.model.ProgressEvent.Phase;
import com.codeheadsystems.latchkey.client.store.InMemoryWrappedSecretStore;
import com.codeheadsystems.latchkey.common.RandomProvider;
import com.codeheadsystems.latchkey.exceptions.CapabilityNotFoundException;
import com.codeheadsystems.latchkey.exceptions.DerivationMismatchException;
import com.codeheadsystems.latchkey.kdf.KeyDerivationPipeline;
import com.codeheadsystems.latchkey.session.CapabilityStatus;
import com.codeheadsystems.latchkey.session.InMemorySessionCapabilityStore;
import com.codeheadsystems.latchkey.shamir.CommutativeCipher;
import com.codeheadsystems.latchkey.shamir.CooperatorKeyInfo;
import com.codeheadsystems.latchkey.shamir.CooperatorKeyManager;
import com.codeheadsystems.latchkey.shamir.GracePolicy;
import com.codeheadsystems.latchkey.shamir.InMemoryKeyRingStore;
import com.codeheadsystems.latchkey.shamir.LockCooperator;
import com.codeheadsystems.latchkey.shamir.LockedValue;
import com.codeheadsystems.latchkey.shamir.UnlockCooperator;
import com.codeheadsystems.latchkey.shamir.WrappedSecretBlob;
import com.codeheadsystems.latchkey.signer.SignedPayload;
import com.codeheadsystems.latchkey.signer.SigningKeyVault;
import com.codeheadsystems.latchkey.vrf.BlockReference;
import com.codeheadsystems.latchkey.vrf.ChallengeContext;
import com.codeheadsystems.latchkey.vrf.ChallengeEngine;
import com.codeheadsystems.latchkey.vrf.ChallengeInput;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KeyCustodyManagerTest {

  private static final BigInteger M521 = BigInteger.ONE.shiftLeft(521).subtract(BigInteger.ONE);
  private static final String ACCOUNT = "alice";
  private static final String SESSION = "session-1";
  private static final byte[] BLOCK_HASH = "block-100".getBytes(StandardCharsets.UTF_8);
  private static final byte[] PAYLOAD = "transfer 10 to bob".getBytes(StandardCharsets.UTF_8);
  private static final SessionPolicy DEFAULT_POLICY = new SessionPolicy(Duration.ofMinutes(15), 3);

  private final ChallengeEngine challengeEngine = new ChallengeEngine();
  private final RandomProvider randomProvider = new RandomProvider();
  private final List<ProgressEvent> events = new CopyOnWriteArrayList<>();

  private TestClock clock;
  private CooperatorKeyManager keyManager;
  private SwitchableCooperator cooperator;
  private FakeCeremony ceremony;
  private InMemoryWrappedSecretStore secretStore;
  private InMemorySessionCapabilityStore sessionStore;
  private ExecutorService executor;
  private KeyCustodyManager manager;

  @BeforeEach
  void setUp() {
    clock = new TestClock(Instant.parse("2026-05-01T00:00:00Z"));
    CommutativeCipher cipher = new CommutativeCipher(M521, randomProvider);
    keyManager = new CooperatorKeyManager(cipher, new InMemoryKeyRingStore(),
        new GracePolicy(2, Duration.ofDays(1)), clock);
    cooperator = new SwitchableCooperator(keyManager);
    ceremony = new FakeCeremony();
    secretStore = new InMemoryWrappedSecretStore();
    sessionStore = new InMemorySessionCapabilityStore(clock);
    executor = Executors.newCachedThreadPool();
    manager = newManager(new CustodyConfig(CustodyConfig.DEFAULT_DOMAIN_SEPARATOR, "Example.com",
        Duration.ofSeconds(5), Duration.ofSeconds(5), DEFAULT_POLICY), cipher);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private KeyCustodyManager newManager(CustodyConfig config, CommutativeCipher cipher) {
    return new KeyCustodyManager(config,
        new UnlockCooperator(cipher, cooperator, clock),
        challengeEngine,
        new KeyDerivationPipeline(),
        sessionStore,
        new SigningKeyVault(randomProvider),
        secretStore,
        ceremony,
        () -> new BlockReference(100, BLOCK_HASH),
        events::add,
        executor,
        randomProvider,
        clock);
  }

  @Test
  void register_wrapsSecretAndSealsSigningKey() {
    AccountRecord record = manager.register(ACCOUNT);

    assertThat(record.blob()).isNotNull();
    assertThat(record.blob().serverKeyId()).isEqualTo(keyManager.currentKeyId());
    assertThat(record.vrfPublicKey()).hasSize(33);
    assertThat(record.wrapKeySalt()).hasSize(32);
    assertThat(secretStore.load(ACCOUNT)).contains(record);
    assertThat(ceremony.purposes()).containsExactly(Purpose.REGISTER);
  }

  @Test
  void sign_coldPathThenWarmPath() {
    AccountRecord record = manager.register(ACCOUNT);

    SignedPayload first = manager.sign(ACCOUNT, SESSION, PAYLOAD);
    SignedPayload second = manager.sign(ACCOUNT, SESSION, PAYLOAD);

    assertThat(SigningKeyVault.verify(record.signingKey().publicKey(), PAYLOAD, first.signature())).isTrue();
    assertThat(second.signature()).isEqualTo(first.signature());
    assertThat(ceremony.purposes()).containsExactly(Purpose.REGISTER, Purpose.AUTHENTICATE);
    assertThat(manager.status(SESSION)).map(CapabilityStatus::remainingUses).contains(1);
    assertThat(phases()).containsExactly(
        Phase.COLD_PATH_REQUIRED, Phase.COOPERATOR_UNLOCK, Phase.CHALLENGE_ISSUED,
        Phase.SESSION_MINTED, Phase.SIGNED, Phase.SIGNED);
  }

  @Test
  void unlockSession_challengeIsVrfOutputBoundToSessionPolicy() {
    AccountRecord record = manager.register(ACCOUNT);
    SessionPolicy policy = new SessionPolicy(Duration.ofMinutes(5), 2);

    CapabilityStatus status = manager.unlockSession(ACCOUNT, SESSION, policy);

    assertThat(status.remainingUses()).isEqualTo(2);
    assertThat(status.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(5)));
    CeremonyRequest request = ceremony.requests.get(1);
    assertThat(request.purpose()).isEqualTo(Purpose.AUTHENTICATE);
    ChallengeInput expected = challengeEngine.buildChallenge(new ChallengeContext(
        CustodyConfig.DEFAULT_DOMAIN_SEPARATOR, ACCOUNT, "example.com", 100, BLOCK_HASH, null,
        policy.digest(SESSION)));
    assertThat(challengeEngine.verify(record.vrfPublicKey(), expected, request.proof()))
        .isEqualTo(request.challenge());
  }

  @Test
  void exhaustedSession_runsColdPathAgain() {
    manager.register(ACCOUNT);
    manager.unlockSession(ACCOUNT, SESSION, new SessionPolicy(Duration.ofMinutes(5), 1));

    manager.sign(ACCOUNT, SESSION, PAYLOAD);
    assertThat(ceremony.requests).hasSize(2);
    manager.sign(ACCOUNT, SESSION, PAYLOAD);

    assertThat(ceremony.purposes()).containsExactly(Purpose.REGISTER, Purpose.AUTHENTICATE, Purpose.AUTHENTICATE);
    assertThat(phases()).contains(Phase.COLD_PATH_REQUIRED);
    assertThat(manager.status(SESSION)).map(CapabilityStatus::remainingUses)
        .contains(DEFAULT_POLICY.maxUses() - 1);
  }

  @Test
  void expiredSession_runsColdPathAgain() {
    manager.register(ACCOUNT);
    manager.unlockSession(ACCOUNT, SESSION, new SessionPolicy(Duration.ofMinutes(1), 5));
    clock.advance(Duration.ofMinutes(2));

    manager.sign(ACCOUNT, SESSION, PAYLOAD);

    assertThat(ceremony.purposes()).containsExactly(Purpose.REGISTER, Purpose.AUTHENTICATE, Purpose.AUTHENTICATE);
  }

  @Test
  void rotationWithGrace_migratesBlobOnUnlock() {
    manager.register(ACCOUNT);
    String oldKeyId = keyManager.currentKeyId();
    keyManager.rotate(true);

    manager.unlockSession(ACCOUNT, SESSION, DEFAULT_POLICY);

    AccountRecord updated = secretStore.load(ACCOUNT).orElseThrow();
    assertThat(updated.blob().serverKeyId()).isEqualTo(keyManager.currentKeyId()).isNotEqualTo(oldKeyId);
    assertThat(ceremony.purposes()).doesNotContain(Purpose.RECOVER);
    assertThat(phases()).contains(Phase.REWRAPPED);
  }

  @Test
  void unknownKeyId_fallsBackToRecoveryAndRewraps() {
    manager.register(ACCOUNT);
    keyManager.rotate(false);

    manager.unlockSession(ACCOUNT, SESSION, DEFAULT_POLICY);

    assertThat(ceremony.purposes()).containsExactly(Purpose.REGISTER, Purpose.RECOVER, Purpose.AUTHENTICATE);
    assertThat(phases()).containsSubsequence(Phase.COOPERATOR_UNLOCK, Phase.RECOVERY_PROMPT,
        Phase.CHALLENGE_ISSUED, Phase.REWRAPPED, Phase.SESSION_MINTED);
    assertThat(secretStore.load(ACCOUNT).orElseThrow().blob().serverKeyId()).isEqualTo(keyManager.currentKeyId());

    ceremony.requests.clear();
    manager.unlockSession(ACCOUNT, "session-2", DEFAULT_POLICY);
    assertThat(ceremony.purposes()).containsExactly(Purpose.AUTHENTICATE);
  }

  @Test
  void corruptStoredBlob_fallsBackToRecoveryAndRewraps() {
    AccountRecord registered = manager.register(ACCOUNT);
    WrappedSecretBlob blob = registered.blob();
    byte[] truncated = Arrays.copyOf(blob.serverLockedValue(), blob.serverLockedValue().length - 1);
    secretStore.save(registered.withBlob(
        new WrappedSecretBlob(blob.ciphertext(), truncated, blob.serverKeyId(), blob.updatedAt()),
        clock.instant()));

    CapabilityStatus status = manager.unlockSession(ACCOUNT, SESSION, DEFAULT_POLICY);

    assertThat(status.remainingUses()).isEqualTo(DEFAULT_POLICY.maxUses());
    assertThat(ceremony.purposes()).containsExactly(Purpose.REGISTER, Purpose.RECOVER, Purpose.AUTHENTICATE);
    assertThat(phases()).containsSubsequence(Phase.COOPERATOR_UNLOCK, Phase.RECOVERY_PROMPT,
        Phase.REWRAPPED, Phase.SESSION_MINTED);
    WrappedSecretBlob rewrapped = secretStore.load(ACCOUNT).orElseThrow().blob();
    assertThat(rewrapped.serverLockedValue()).hasSize(blob.serverLockedValue().length);

    ceremony.requests.clear();
    manager.unlockSession(ACCOUNT, "session-2", DEFAULT_POLICY);
    assertThat(ceremony.purposes()).containsExactly(Purpose.AUTHENTICATE);
  }

  @Test
  void cooperatorDown_recoversButKeepsOldBlob() {
    AccountRecord registered = manager.register(ACCOUNT);
    cooperator.down.set(true);

    CapabilityStatus status = manager.unlockSession(ACCOUNT, SESSION, DEFAULT_POLICY);

    assertThat(status.remainingUses()).isEqualTo(DEFAULT_POLICY.maxUses());
    assertThat(ceremony.purposes()).contains(Purpose.RECOVER);
    assertThat(secretStore.load(ACCOUNT)).contains(registered);
    assertThat(phases()).doesNotContain(Phase.REWRAPPED);
  }

  @Test
  void registerWhileCooperatorDown_wrapsOnFirstUnlock() {
    cooperator.down.set(true);
    AccountRecord registered = manager.register(ACCOUNT);
    assertThat(registered.blob()).isNull();
    cooperator.down.set(false);

    manager.unlockSession(ACCOUNT, SESSION, DEFAULT_POLICY);

    assertThat(ceremony.purposes()).containsExactly(Purpose.REGISTER, Purpose.RECOVER, Purpose.AUTHENTICATE);
    assertThat(secretStore.load(ACCOUNT).orElseThrow().blob()).isNotNull();
  }

  @Test
  void recoveryWithWrongSecondarySecret_fails() {
    manager.register(ACCOUNT);
    keyManager.rotate(false);
    ceremony.secondarySecret = "not-the-recovery-code".getBytes(StandardCharsets.UTF_8);

    assertThatThrownBy(() -> manager.unlockSession(ACCOUNT, SESSION, DEFAULT_POLICY))
        .isInstanceOf(RecoveryFailedException.class);
    assertThat(manager.status(SESSION)).isEmpty();
  }

  @Test
  void wrongPrimarySecret_isDerivationMismatch() {
    manager.register(ACCOUNT);
    ceremony.primarySecret = "another-credential".getBytes(StandardCharsets.UTF_8);

    assertThatThrownBy(() -> manager.unlockSession(ACCOUNT, SESSION, DEFAULT_POLICY))
        .isInstanceOf(DerivationMismatchException.class);
    assertThat(manager.status(SESSION)).isEmpty();

    assertThatThrownBy(() -> manager.sign(ACCOUNT, SESSION, PAYLOAD))
        .isInstanceOf(DerivationMismatchException.class);
  }

  @Test
  void presenceNotConfirmed_mintsNothing() {
    manager.register(ACCOUNT);
    ceremony.presence = false;

    assertThatThrownBy(() -> manager.unlockSession(ACCOUNT, SESSION, DEFAULT_POLICY))
        .isInstanceOf(CeremonyCancelledException.class)
        .hasMessageContaining("presence");
    assertThat(manager.status(SESSION)).isEmpty();
    assertThat(phases()).doesNotContain(Phase.SESSION_MINTED);
  }

  @Test
  void sign_coldPathFailure_surfacesCapabilityErrorWithSuppressedCause() {
    manager.register(ACCOUNT);
    ceremony.presence = false;

    assertThatThrownBy(() -> manager.sign(ACCOUNT, SESSION, PAYLOAD))
        .isInstanceOf(CapabilityNotFoundException.class)
        .satisfies(e -> {
          assertThat(e.getSuppressed()).hasSize(1);
          assertThat(e.getSuppressed()[0]).isInstanceOf(CeremonyCancelledException.class);
        });
  }

  @Test
  void cancel_abortsInFlightCeremony() throws Exception {
    manager.register(ACCOUNT);
    ceremony.hang = true;

    CompletableFuture<CapabilityStatus> unlock = CompletableFuture.supplyAsync(
        () -> manager.unlockSession(ACCOUNT, SESSION, DEFAULT_POLICY), executor);
    assertThat(ceremony.hung.await(5, TimeUnit.SECONDS)).isTrue();

    assertThat(manager.cancel(SESSION)).isTrue();

    assertThatThrownBy(() -> unlock.get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(CeremonyCancelledException.class);
    assertThat(ceremony.pending.isCancelled()).isTrue();
    assertThat(manager.status(SESSION)).isEmpty();
    assertThat(manager.cancel(SESSION)).isFalse();
  }

  @Test
  void ceremonyTimeout_mintsNothing() {
    KeyCustodyManager impatient = newManager(new CustodyConfig(CustodyConfig.DEFAULT_DOMAIN_SEPARATOR,
        "example.com", Duration.ofMillis(200), Duration.ofSeconds(5), DEFAULT_POLICY),
        new CommutativeCipher(M521, randomProvider));
    impatient.register(ACCOUNT);
    ceremony.hang = true;

    assertThatThrownBy(() -> impatient.unlockSession(ACCOUNT, SESSION, DEFAULT_POLICY))
        .isInstanceOf(CeremonyCancelledException.class)
        .hasMessageContaining("timed out");
    assertThat(ceremony.pending.isCancelled()).isTrue();
    assertThat(impatient.status(SESSION)).isEmpty();
  }

  @Test
  void unknownAccount_isReported() {
    assertThatThrownBy(() -> manager.sign("nobody", SESSION, PAYLOAD))
        .isInstanceOf(AccountNotFoundException.class);
    assertThatThrownBy(() -> manager.unlockSession("nobody", SESSION, DEFAULT_POLICY))
        .isInstanceOf(AccountNotFoundException.class);
  }

  @Test
  void logout_destroysCapabilities() {
    manager.register(ACCOUNT);
    manager.unlockSession(ACCOUNT, SESSION, DEFAULT_POLICY);
    manager.unlockSession(ACCOUNT, "session-2", DEFAULT_POLICY);

    manager.logout(SESSION);
    assertThat(manager.status(SESSION)).isEmpty();
    assertThat(manager.status("session-2")).isPresent();

    manager.logoutAll();
    assertThat(manager.status("session-2")).isEmpty();
  }

  private List<Phase> phases() {
    return events.stream().map(ProgressEvent::phase).collect(Collectors.toList());
  }

  /**
   * Stands in for a passkey: stable secrets per credential, optionally hanging forever.
   */
  static class FakeCeremony implements AuthenticationCeremony {

    final List<CeremonyRequest> requests = new CopyOnWriteArrayList<>();
    final CountDownLatch hung = new CountDownLatch(1);
    volatile byte[] primarySecret = "credential-prf-output".getBytes(StandardCharsets.UTF_8);
    volatile byte[] secondarySecret = "recovery-code-1234".getBytes(StandardCharsets.UTF_8);
    volatile boolean presence = true;
    volatile boolean hang;
    volatile CompletableFuture<CeremonyResult> pending;

    @Override
    public CompletableFuture<CeremonyResult> perform(CeremonyRequest request) {
      requests.add(request);
      if (hang) {
        pending = new CompletableFuture<>();
        hung.countDown();
        return pending;
      }
      byte[] secondary = request.purpose() == Purpose.AUTHENTICATE ? null : secondarySecret;
      return CompletableFuture.completedFuture(new CeremonyResult(presence, primarySecret, secondary));
    }

    List<Purpose> purposes() {
      return requests.stream().map(CeremonyRequest::purpose).collect(Collectors.toList());
    }
  }

  /**
   * Delegates to a real key manager unless switched off.
   */
  static class SwitchableCooperator implements LockCooperator {

    final AtomicBoolean down = new AtomicBoolean();
    private final LockCooperator delegate;

    SwitchableCooperator(LockCooperator delegate) {
      this.delegate = delegate;
    }

    @Override
    public LockedValue applyLock(BigInteger blindedValue) {
      checkUp();
      return delegate.applyLock(blindedValue);
    }

    @Override
    public BigInteger removeLock(BigInteger blindedValue, String keyId) {
      checkUp();
      return delegate.removeLock(blindedValue, keyId);
    }

    @Override
    public CooperatorKeyInfo keyInfo() {
      checkUp();
      return delegate.keyInfo();
    }

    private void checkUp() {
      if (down.get()) {
        throw new CooperatorAccessorException("Connection refused", null);
      }
    }
  }

  static class TestClock extends Clock {

    private volatile Instant now;

    TestClock(Instant start) {
      this.now = start;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
