package com.codeheadsystems.gatekeeper.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.gatekeeper.server.exception.AuthFailureException;
import com.codeheadsystems.gatekeeper.server.exception.AuthFailureException.Reason;
import com.codeheadsystems.gatekeeper.server.model.AuthContext;
import com.codeheadsystems.gatekeeper.server.model.CredentialRecord;
import com.codeheadsystems.gatekeeper.server.store.CredentialStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and validates bearer tokens.
 * <p>
 * Tokens are JWTs signed with HMAC-SHA256 carrying the username as subject and an absolute expiry.
 * Nothing is stored server-side: a token is valid exactly when its signature verifies, the current
 * instant is strictly before its expiry, and its subject still exists in the credential store.
 * There is no revocation; a session ends when its token expires.
 */
public class SessionTokenManager {

  private static final Logger log = LoggerFactory.getLogger(SessionTokenManager.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final CredentialStore credentialStore;
  private final String issuer;
  private final Duration ttl;
  private final Clock clock;

  /**
   * Creates a new SessionTokenManager using the system clock.
   *
   * @param secret          HMAC-SHA256 signing secret
   * @param issuer          JWT issuer claim
   * @param ttl             token lifetime
   * @param credentialStore store used to re-resolve the subject on every validation
   */
  public SessionTokenManager(byte[] secret, String issuer, Duration ttl,
                             CredentialStore credentialStore) {
    this(secret, issuer, ttl, credentialStore, Clock.systemUTC());
  }

  /**
   * Creates a new SessionTokenManager.
   *
   * @param secret          HMAC-SHA256 signing secret
   * @param issuer          JWT issuer claim
   * @param ttl             token lifetime
   * @param credentialStore store used to re-resolve the subject on every validation
   * @param clock           source of the current instant for issuance and expiry checks
   */
  public SessionTokenManager(byte[] secret, String issuer, Duration ttl,
                             CredentialStore credentialStore, Clock clock) {
    this.algorithm = Algorithm.HMAC256(secret);
    this.verifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm).withIssuer(issuer))
        .build(clock);
    this.credentialStore = credentialStore;
    this.issuer = issuer;
    this.ttl = ttl;
    this.clock = clock;
  }

  /**
   * Issues a token for an authenticated user.
   *
   * @param username the subject
   * @return the signed token and its lifetime
   */
  public IssuedToken issue(String username) {
    Instant now = clock.instant();
    Instant expiresAt = now.plus(ttl);

    String token = JWT.create()
        .withIssuer(issuer)
        .withSubject(username)
        .withIssuedAt(now)
        .withExpiresAt(expiresAt)
        .sign(algorithm);

    log.debug("Issued token for {} expiring at {}", username, expiresAt);
    return new IssuedToken(token, ttl.toSeconds());
  }

  /**
   * Validates a token and resolves its subject against the live credential store.
   *
   * @param token the raw token, without the {@code Bearer } prefix
   * @return the identity
   * @throws AuthFailureException with {@code MALFORMED_OR_UNSIGNED}, {@code EXPIRED} or
   *                              {@code UNKNOWN_USER}
   */
  public AuthContext validate(String token) {
    if (token == null || token.isBlank()) {
      throw new AuthFailureException(Reason.MALFORMED_OR_UNSIGNED);
    }
    DecodedJWT decoded;
    try {
      decoded = verifier.verify(token);
    } catch (TokenExpiredException e) {
      log.debug("Token expired: {}", e.getMessage());
      throw new AuthFailureException(Reason.EXPIRED, e);
    } catch (JWTVerificationException e) {
      log.debug("Token verification failed: {}", e.getMessage());
      throw new AuthFailureException(Reason.MALFORMED_OR_UNSIGNED, e);
    }

    String username = decoded.getSubject();
    Instant expiresAt = decoded.getExpiresAtAsInstant();
    if (username == null || username.isBlank() || expiresAt == null) {
      log.debug("Token is missing its subject or expiry");
      throw new AuthFailureException(Reason.MALFORMED_OR_UNSIGNED);
    }
    // The JWT library still accepts a token at the exact expiry second.
    if (!clock.instant().isBefore(expiresAt)) {
      log.debug("Token for {} expired at {}", username, expiresAt);
      throw new AuthFailureException(Reason.EXPIRED);
    }

    Optional<CredentialRecord> record = credentialStore.find(username);
    if (record.isEmpty()) {
      log.warn("Token presented for non-existent user: {}", username);
      throw new AuthFailureException(Reason.UNKNOWN_USER);
    }
    return AuthContext.from(record.get());
  }

  /**
   * A freshly issued token.
   *
   * @param token            the signed JWT
   * @param expiresInSeconds its lifetime at issuance
   */
  public record IssuedToken(String token, long expiresInSeconds) {

    @Override
    public String toString() {
      return "IssuedToken[expiresInSeconds=" + expiresInSeconds + "]";
    }
  }
}
