package com.codeheadsystems.latchkey.signer;

import com.codeheadsystems.latchkey.channel.OneTimeChannel;
import com.codeheadsystems.latchkey.common.ByteUtils;
import com.codeheadsystems.latchkey.kdf.KeyDerivationPipeline;
import com.codeheadsystems.latchkey.session.CapabilityGrant;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-use task that turns one capability grant into one signature. The grant, the derived
 * key and the plaintext private key exist only inside {@link #call()} and are wiped on every
 * exit path.
 */
public class EphemeralSigningUnit implements Callable<SignedPayload> {

  private static final Logger log = LoggerFactory.getLogger(EphemeralSigningUnit.class);

  private final KeyDerivationPipeline pipeline;
  private final SigningKeyVault vault;
  private final OneTimeChannel.Receiver<CapabilityGrant> receiver;
  private final EncryptedSigningKey signingKey;
  private final byte[] payload;
  private final Duration receiveTimeout;
  private final AtomicBoolean used = new AtomicBoolean();

  /**
   * Instantiates a new Ephemeral signing unit.
   *
   * @param pipeline       the derivation pipeline
   * @param vault          the vault that opens the signing key
   * @param receiver       the channel the grant arrives on
   * @param signingKey     the sealed signing key
   * @param payload        bytes to sign
   * @param receiveTimeout how long to wait for the grant
   */
  public EphemeralSigningUnit(final KeyDerivationPipeline pipeline,
                              final SigningKeyVault vault,
                              final OneTimeChannel.Receiver<CapabilityGrant> receiver,
                              final EncryptedSigningKey signingKey,
                              final byte[] payload,
                              final Duration receiveTimeout) {
    this.pipeline = pipeline;
    this.vault = vault;
    this.receiver = receiver;
    this.signingKey = signingKey;
    this.payload = payload.clone();
    this.receiveTimeout = receiveTimeout;
  }

  @Override
  public SignedPayload call() throws InterruptedException {
    if (!used.compareAndSet(false, true)) {
      throw new IllegalStateException("Signing unit already used");
    }
    CapabilityGrant grant = null;
    byte[] kek = null;
    byte[] privateKey = null;
    try {
      grant = receiver.receive(receiveTimeout);
      kek = pipeline.decryptionKey(grant.wrapKeySeed(), grant.wrapKeySalt());
      privateKey = vault.open(kek, signingKey);
      byte[] signature = vault.sign(privateKey, payload);
      log.trace("call(): signed {} bytes for session {}", payload.length, grant.sessionId());
      return new SignedPayload(payload.clone(), signature, signingKey.publicKey().clone());
    } finally {
      if (grant != null) {
        grant.destroy();
      }
      ByteUtils.zeroize(kek, privateKey);
    }
  }
}
