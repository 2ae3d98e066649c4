package com.codeheadsystems.latchkey.shamir;

import java.util.List;

/**
 * Outcome of a key rotation.
 *
 * @param currentKeyId  the new current key id
 * @param previousKeyId the key id that was current before the rotation
 * @param graceKeyIds   the grace list after rotation and pruning
 */
public record RotationResult(String currentKeyId, String previousKeyId, List<String> graceKeyIds) {
}
