package io.taskqueue.wellness.lab;

import java.util.Objects;

/**
 * Encrypted copy of an upload.
 *
 * @param iv        base64 initialization vector
 * @param authTag   base64 authentication tag
 * @param algorithm algorithm label stored with the object
 */
public record SealedArtifact(byte[] ciphertext, String iv, String authTag, String algorithm) {

  public SealedArtifact {
    Objects.requireNonNull(ciphertext, "ciphertext");
    Objects.requireNonNull(iv, "iv");
    Objects.requireNonNull(authTag, "authTag");
    Objects.requireNonNull(algorithm, "algorithm");
  }
}
