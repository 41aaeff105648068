package io.taskqueue.wellness.lab;

import java.security.GeneralSecurityException;

/**
 * Encrypts uploads at rest.
 *
 * @see AesGcmArtifactSealer
 */
public interface ArtifactSealer {

  SealedArtifact seal(byte[] plaintext) throws GeneralSecurityException;

  byte[] unseal(SealedArtifact sealed) throws GeneralSecurityException;
}
