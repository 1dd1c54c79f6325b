package com.codeheadsystems.gatekeeper.server.hash;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * One-way, deterministic transform from a plaintext password to a digest that can be stored and
 * compared.
 */
public interface PasswordHasher {

  /**
   * Hashes a plaintext password.
   *
   * @param plaintext the password
   * @return the digest
   */
  String hash(String plaintext);

  /**
   * Checks a plaintext password against a stored digest in constant time.
   *
   * @param plaintext    the presented password
   * @param storedDigest the digest from the credential store
   * @return true if they match
   */
  default boolean matches(String plaintext, String storedDigest) {
    if (plaintext == null || storedDigest == null) {
      return false;
    }
    return MessageDigest.isEqual(
        hash(plaintext).getBytes(StandardCharsets.UTF_8),
        storedDigest.getBytes(StandardCharsets.UTF_8));
  }
}
