package com.codeheadsystems.ibauth.client.model;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Base URLs of the broker API.
 *
 * @param apiBase     the cloud API base, e.g. {@code https://api.ibkr.com/v1/api}
 * @param gatewayBase the local gateway base, or null when no gateway is deployed
 */
public record ServerConnectionInfo(URI apiBase, URI gatewayBase) {

  /**
   * Resolves a path against the cloud API base.
   *
   * @param path path starting with {@code /}
   * @return the absolute uri
   */
  public URI api(String path) {
    return resolve(apiBase, path);
  }

  /**
   * Bases to try for brokerage session init, gateway first.
   *
   * @return the bases in order
   */
  public List<URI> sessionInitBases() {
    List<URI> bases = new ArrayList<>(2);
    if (gatewayBase != null) {
      bases.add(gatewayBase);
    }
    bases.add(apiBase);
    return bases;
  }

  /**
   * Appends a path to a base url.
   *
   * @param base the base
   * @param path path starting with {@code /}
   * @return the absolute uri
   */
  public static URI resolve(URI base, String path) {
    return base.resolve(base.getPath() + path);
  }
}
