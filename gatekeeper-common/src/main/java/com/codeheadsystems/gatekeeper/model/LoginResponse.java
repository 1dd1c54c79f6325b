package com.codeheadsystems.gatekeeper.model;

/**
 * Common shape of the two login results. Basic deployments answer with a
 * {@link BasicLoginResponse}; bearer deployments with a {@link BearerLoginResponse}.
 */
public interface LoginResponse {

  /**
   * The username that logged in.
   *
   * @return the username
   */
  String username();
}
