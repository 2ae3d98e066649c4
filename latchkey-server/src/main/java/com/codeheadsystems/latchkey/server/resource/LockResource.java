package com.codeheadsystems.latchkey.server.resource;

import com.codeheadsystems.latchkey.exceptions.UnknownKeyIdException;
import com.codeheadsystems.latchkey.model.lock.ApplyLockRequest;
import com.codeheadsystems.latchkey.model.lock.ApplyLockResponse;
import com.codeheadsystems.latchkey.model.lock.KeyInfoResponse;
import com.codeheadsystems.latchkey.model.lock.LockValues;
import com.codeheadsystems.latchkey.model.lock.RemoveLockRequest;
import com.codeheadsystems.latchkey.model.lock.RemoveLockResponse;
import com.codeheadsystems.latchkey.shamir.CommutativeCipher;
import com.codeheadsystems.latchkey.shamir.CooperatorKeyInfo;
import com.codeheadsystems.latchkey.shamir.LockCooperator;
import com.codeheadsystems.latchkey.shamir.LockedValue;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.math.BigInteger;
import org.bouncycastle.util.BigIntegers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for the cooperator side of the Shamir three-pass exchange.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /lock/apply}  applies the current key's lock</li>
 *   <li>{@code POST /lock/remove} removes the lock of the key named in the request</li>
 *   <li>{@code GET /key-info}     current key id, modulus and grace key ids</li>
 * </ul>
 * The cooperator only ever sees values carrying a client lock it cannot remove.
 */
@Singleton
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class LockResource {

  private static final Logger log = LoggerFactory.getLogger(LockResource.class);

  private final LockCooperator lockCooperator;
  private final CommutativeCipher cipher;

  /**
   * Instantiates a new Lock resource.
   *
   * @param lockCooperator the cooperator key manager
   * @param cipher         the cipher for the shared modulus
   */
  @Inject
  public LockResource(final LockCooperator lockCooperator, final CommutativeCipher cipher) {
    this.lockCooperator = lockCooperator;
    this.cipher = cipher;
    log.info("LockResource({}, modulusBits={})", lockCooperator, cipher.modulus().bitLength());
  }

  /**
   * Applies the cooperator's current lock.
   *
   * @param request the request
   * @return the double-locked value and the key id that locked it
   */
  @POST
  @Path("lock/apply")
  public ApplyLockResponse applyLock(final ApplyLockRequest request) {
    if (request == null) {
      throw new WebApplicationException("Missing request body", Response.Status.BAD_REQUEST);
    }
    BigInteger value = decodeValue(request.blindedValue());
    LockedValue locked = lockCooperator.applyLock(value);
    log.trace("applyLock() keyId={}", locked.keyId());
    return new ApplyLockResponse(LockValues.encode(cipher.encode(locked.value())), locked.keyId());
  }

  /**
   * Removes the lock applied by the named key.
   *
   * @param request the request
   * @return the value without the cooperator's lock
   * @throws UnknownKeyIdException mapped to 404 by {@link UnknownKeyIdExceptionMapper}
   */
  @POST
  @Path("lock/remove")
  public RemoveLockResponse removeLock(final RemoveLockRequest request) {
    if (request == null) {
      throw new WebApplicationException("Missing request body", Response.Status.BAD_REQUEST);
    }
    if (request.keyId() == null || request.keyId().isBlank()) {
      throw new WebApplicationException("Missing required field: keyId", Response.Status.BAD_REQUEST);
    }
    BigInteger value = decodeValue(request.blindedValue());
    BigInteger unlocked = lockCooperator.removeLock(value, request.keyId());
    log.trace("removeLock() keyId={}", request.keyId());
    return new RemoveLockResponse(LockValues.encode(cipher.encode(unlocked)));
  }

  /**
   * Key info.
   *
   * @return the key info response
   */
  @GET
  @Path("key-info")
  public KeyInfoResponse keyInfo() {
    CooperatorKeyInfo info = lockCooperator.keyInfo();
    return new KeyInfoResponse(info.currentKeyId(),
        LockValues.encode(BigIntegers.asUnsignedByteArray(info.modulus())),
        info.graceKeyIds());
  }

  private BigInteger decodeValue(String blindedValue) {
    try {
      return cipher.decode(LockValues.decode(blindedValue, "blindedValue"));
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    }
  }
}
