package com.codeheadsystems.ibauth.client.model;

import java.net.URI;

/**
 * A fully signed request, ready to send.
 *
 * @param method              HTTP method
 * @param uri                 target, including any query string
 * @param authorizationHeader value of the {@code Authorization} header
 * @param formBody            {@code application/x-www-form-urlencoded} body, or null for none
 */
public record SignedRequest(String method, URI uri, String authorizationHeader, String formBody) {

  /**
   * Whether a form body accompanies the request.
   *
   * @return true if there is a body
   */
  public boolean hasFormBody() {
    return formBody != null && !formBody.isEmpty();
  }
}
