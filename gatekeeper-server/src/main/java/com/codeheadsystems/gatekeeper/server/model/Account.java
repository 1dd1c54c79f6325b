package com.codeheadsystems.gatekeeper.server.model;

import java.util.Map;

/**
 * Public view of a stored credential record, returned by registration.
 *
 * @param username the username
 * @param role     the role, or null when the deployment is not role-aware
 * @param profile  the profile fields
 */
public record Account(String username, Role role, Map<String, Object> profile) {
}
