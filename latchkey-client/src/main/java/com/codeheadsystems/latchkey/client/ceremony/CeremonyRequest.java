package com.codeheadsystems.latchkey.client.ceremony;

import com.codeheadsystems.latchkey.vrf.VrfProof;

/**
 * What the authentication ceremony is asked to sign over.
 *
 * @param accountId the account
 * @param purpose   the purpose
 * @param challenge the challenge bytes handed to the authenticator
 * @param proof     the VRF proof behind {@code challenge}; null when no VRF key is available yet
 */
public record CeremonyRequest(String accountId, Purpose purpose, byte[] challenge, VrfProof proof) {
}
