package io.taskqueue.wellness.lab;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * AES-256-GCM sealer with a random 96-bit IV per artifact.
 *
 * <p>The JCA appends the 128-bit tag to the ciphertext; it is split off so the tag can be
 * stored as object metadata next to the IV.
 */
public final class AesGcmArtifactSealer implements ArtifactSealer {

  public static final String ALGORITHM = "aes-256-gcm";

  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final int KEY_LENGTH = 32;
  private static final int IV_LENGTH = 12;
  private static final int TAG_LENGTH = 16;

  private final SecretKey key;
  private final SecureRandom random;

  public AesGcmArtifactSealer(byte[] key) {
    this(key, new SecureRandom());
  }

  AesGcmArtifactSealer(byte[] key, SecureRandom random) {
    Objects.requireNonNull(key, "key");
    if (key.length != KEY_LENGTH) {
      throw new IllegalArgumentException("Sealing key must be 256 bits, got " + key.length * 8);
    }
    this.key = new SecretKeySpec(key.clone(), "AES");
    this.random = Objects.requireNonNull(random, "random");
  }

  /**
   * Creates a sealer from a base64-encoded 256-bit key.
   */
  public static AesGcmArtifactSealer fromBase64Key(String base64Key) {
    Objects.requireNonNull(base64Key, "base64Key");
    return new AesGcmArtifactSealer(Base64.getDecoder().decode(base64Key));
  }

  @Override
  public SealedArtifact seal(byte[] plaintext) throws GeneralSecurityException {
    byte[] iv = new byte[IV_LENGTH];
    random.nextBytes(iv);
    Cipher cipher = Cipher.getInstance(TRANSFORMATION);
    cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, iv));
    byte[] output = cipher.doFinal(plaintext);

    int split = output.length - TAG_LENGTH;
    Base64.Encoder encoder = Base64.getEncoder();
    return new SealedArtifact(
        Arrays.copyOfRange(output, 0, split),
        encoder.encodeToString(iv),
        encoder.encodeToString(Arrays.copyOfRange(output, split, output.length)),
        ALGORITHM);
  }

  @Override
  public byte[] unseal(SealedArtifact sealed) throws GeneralSecurityException {
    if (!ALGORITHM.equals(sealed.algorithm())) {
      throw new GeneralSecurityException("Unsupported seal algorithm: " + sealed.algorithm());
    }
    Base64.Decoder decoder = Base64.getDecoder();
    byte[] iv = decoder.decode(sealed.iv());
    byte[] tag = decoder.decode(sealed.authTag());
    byte[] input = new byte[sealed.ciphertext().length + tag.length];
    System.arraycopy(sealed.ciphertext(), 0, input, 0, sealed.ciphertext().length);
    System.arraycopy(tag, 0, input, sealed.ciphertext().length, tag.length);

    Cipher cipher = Cipher.getInstance(TRANSFORMATION);
    cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(tag.length * 8, iv));
    return cipher.doFinal(input);
  }
}
