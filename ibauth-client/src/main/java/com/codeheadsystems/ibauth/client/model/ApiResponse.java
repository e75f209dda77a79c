package com.codeheadsystems.ibauth.client.model;

/**
 * Raw broker response.
 *
 * @param statusCode HTTP status
 * @param body       response body, possibly empty
 */
public record ApiResponse(int statusCode, String body) {

  public boolean isSuccess() {
    return statusCode >= 200 && statusCode < 300;
  }

  public boolean isUnauthorized() {
    return statusCode == 401;
  }
}
