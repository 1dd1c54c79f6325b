package com.codeheadsystems.gatekeeper.client.model;

import java.net.URI;

/**
 * Network connection details for a gatekeeper server.
 *
 * @param endpoint The base URI of the server (e.g. http://host:8080).
 */
public record ServerConnectionInfo(URI endpoint) {
}
