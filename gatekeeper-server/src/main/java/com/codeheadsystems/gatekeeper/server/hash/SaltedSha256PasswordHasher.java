package com.codeheadsystems.gatekeeper.server.hash;

import static org.bouncycastle.util.encoders.Hex.toHexString;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.bouncycastle.crypto.digests.SHA256Digest;

/**
 * Lowercase hex of SHA-256 over {@code password || salt}, with one salt for the whole
 * application.
 * <p>
 * This reproduces the digests already present in existing {@code users.json} documents so those
 * accounts keep working. It is not a password KDF: there is no per-record salt and no work factor.
 */
public class SaltedSha256PasswordHasher implements PasswordHasher {

  private final String salt;

  /**
   * Instantiates a new hasher.
   *
   * @param salt the application-wide salt
   */
  public SaltedSha256PasswordHasher(String salt) {
    this.salt = Objects.requireNonNull(salt, "salt");
  }

  @Override
  public String hash(String plaintext) {
    Objects.requireNonNull(plaintext, "plaintext");
    byte[] input = (plaintext + salt).getBytes(StandardCharsets.UTF_8);
    SHA256Digest digest = new SHA256Digest();
    digest.update(input, 0, input.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return toHexString(out);
  }
}
