package com.codeheadsystems.ibauth.client.model;

/**
 * States of an {@code AuthSession}.
 * <p>
 * The happy path runs top to bottom; the fast path enters at {@link #HAS_ACCESS_TOKEN}.
 */
public enum AuthState {
  UNAUTHENTICATED,
  HAS_REQUEST_TOKEN,
  HAS_ACCESS_TOKEN,
  HAS_LIVE_SESSION_TOKEN,
  SESSION_INITIALIZED,
  /**
   * The last attempt failed. Distinct from {@link #UNAUTHENTICATED} so callers can tell a
   * rejected handshake from one that never ran.
   */
  FAILED
}
