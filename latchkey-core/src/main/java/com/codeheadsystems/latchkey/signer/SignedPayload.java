package com.codeheadsystems.latchkey.signer;

/**
 * Output of a signing unit.
 *
 * @param payload   the bytes that were signed
 * @param signature the 64-byte Ed25519 signature
 * @param publicKey the key that verifies it
 */
public record SignedPayload(byte[] payload, byte[] signature, byte[] publicKey) {
}
