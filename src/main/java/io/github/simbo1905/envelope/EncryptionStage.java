// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import static io.github.simbo1905.envelope.EnvelopeCodec.LOGGER;

/// Password based AES-256-CBC. Output is `[16-byte IV][ciphertext]` with a fresh random IV per call.
///
/// The key is derived with PBKDF2-HMAC-SHA256 over a fixed all-zero salt. A constant salt lets one precomputed
/// dictionary attack every buffer, but changing it breaks every existing encrypted buffer so it can only change
/// together with the format version.
final class EncryptionStage implements TransformStage {

  static final String CIPHER = "AES/CBC/PKCS5Padding";
  static final String KDF = "PBKDF2WithHmacSHA256";
  static final int IV_BYTES = 16;
  static final int KEY_BITS = 256;
  static final int KDF_ITERATIONS = 10_000;
  static final byte[] FIXED_SALT = new byte[16];

  private static final SecureRandom RANDOM = new SecureRandom();

  private final char[] password;

  EncryptionStage(String password) {
    Objects.requireNonNull(password, "encryption key must not be null");
    this.password = password.toCharArray();
  }

  @Override
  public String name() {
    return "aes-256-cbc";
  }

  static SecretKey deriveKey(char[] password) throws GeneralSecurityException {
    final PBEKeySpec spec = new PBEKeySpec(password, FIXED_SALT, KDF_ITERATIONS, KEY_BITS);
    try {
      final byte[] keyBytes = SecretKeyFactory.getInstance(KDF).generateSecret(spec).getEncoded();
      return new SecretKeySpec(keyBytes, "AES");
    } finally {
      spec.clearPassword();
    }
  }

  @Override
  public byte[] apply(byte[] input) {
    final byte[] iv = new byte[IV_BYTES];
    RANDOM.nextBytes(iv);
    try {
      final Cipher cipher = Cipher.getInstance(CIPHER);
      cipher.init(Cipher.ENCRYPT_MODE, deriveKey(password), new IvParameterSpec(iv));
      final byte[] result = new byte[IV_BYTES + cipher.getOutputSize(input.length)];
      System.arraycopy(iv, 0, result, 0, IV_BYTES);
      final int written = cipher.doFinal(input, 0, input.length, result, IV_BYTES);
      LOGGER.fine(() -> "Encrypted " + input.length + " bytes to " + (IV_BYTES + written) + " bytes");
      return written == result.length - IV_BYTES ? result : Arrays.copyOf(result, IV_BYTES + written);
    } catch (GeneralSecurityException e) {
      throw new TransformException("Encryption failed: " + e.getMessage(), e);
    }
  }

  @Override
  public byte[] invert(byte[] input) {
    if (input.length < IV_BYTES) {
      throw new TransformException("Encrypted buffer of " + input.length + " bytes is shorter than its " + IV_BYTES + " byte IV");
    }
    try {
      final Cipher cipher = Cipher.getInstance(CIPHER);
      cipher.init(Cipher.DECRYPT_MODE, deriveKey(password), new IvParameterSpec(input, 0, IV_BYTES));
      final byte[] result = cipher.doFinal(input, IV_BYTES, input.length - IV_BYTES);
      LOGGER.fine(() -> "Decrypted " + input.length + " bytes to " + result.length + " bytes");
      return result;
    } catch (GeneralSecurityException e) {
      throw new TransformException("Decryption failed, wrong key or corrupt buffer: " + e.getMessage(), e);
    }
  }
}
