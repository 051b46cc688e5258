package com.codeheadsystems.keymanager.client.model;

import java.net.URI;

/**
 * Network connection details of a key server.
 *
 * @param baseUri root URI of the server (e.g. http://host:8080/); {@code keys/...} paths are
 *                appended to it
 */
public record ServerConnectionInfo(URI baseUri) {

  public ServerConnectionInfo {
    if (baseUri == null) {
      throw new IllegalArgumentException("baseUri must not be null");
    }
  }

  /**
   * URI of a path below the base URI.
   *
   * @param path path without a leading slash
   * @return the resolved URI
   */
  public URI resolve(String path) {
    String base = baseUri.toString();
    return URI.create(base.endsWith("/") ? base + path : base + "/" + path);
  }
}
