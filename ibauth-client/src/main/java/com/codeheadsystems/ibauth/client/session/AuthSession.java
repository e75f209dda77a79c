package com.codeheadsystems.ibauth.client.session;

import com.codeheadsystems.ibauth.client.model.AccessToken;
import com.codeheadsystems.ibauth.client.model.AuthState;
import com.codeheadsystems.ibauth.client.model.AuthStep;
import com.codeheadsystems.ibauth.client.model.LiveSessionToken;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authentication state of one credential set, owned by the caller.
 * <p>
 * Reads are lock free. Every transition that changes tokens happens inside
 * {@link #withLock(Supplier)}, so at most one token exchange or re-derivation runs at a time and
 * the access token and live session token are always replaced as a consistent pair.
 */
public class AuthSession {

  private static final Logger log = LoggerFactory.getLogger(AuthSession.class);

  private final ReentrantLock lock = new ReentrantLock();

  private volatile AuthState state = AuthState.UNAUTHENTICATED;
  private volatile AccessToken accessToken;
  private volatile LiveSessionToken liveSessionToken;
  private volatile AuthStep failedStep;

  /**
   * Runs an action while holding the session lock.
   *
   * @param action the action
   * @param <T>    result type
   * @return the action's result
   */
  public <T> T withLock(Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  public AuthState state() {
    return state;
  }

  public AccessToken accessToken() {
    return accessToken;
  }

  public LiveSessionToken liveSessionToken() {
    return liveSessionToken;
  }

  /**
   * The step that failed last, if the session is {@link AuthState#FAILED}.
   *
   * @return the failed step or null
   */
  public AuthStep failedStep() {
    return failedStep;
  }

  /**
   * Whether the brokerage session is initialized and signed calls can be made.
   *
   * @return true if authenticated
   */
  public boolean isAuthenticated() {
    return state == AuthState.SESSION_INITIALIZED && liveSessionToken != null;
  }

  public void onRequestToken() {
    transition(AuthState.HAS_REQUEST_TOKEN);
  }

  public void onAccessToken(AccessToken accessToken) {
    requireLock();
    this.accessToken = accessToken;
    this.liveSessionToken = null;
    transition(AuthState.HAS_ACCESS_TOKEN);
  }

  public void onLiveSessionToken(LiveSessionToken liveSessionToken) {
    requireLock();
    this.liveSessionToken = liveSessionToken;
    transition(AuthState.HAS_LIVE_SESSION_TOKEN);
  }

  public void onSessionInitialized() {
    transition(AuthState.SESSION_INITIALIZED);
  }

  /**
   * Drops the live session token and returns to {@link AuthState#HAS_ACCESS_TOKEN}.
   */
  public void invalidateLiveSessionToken() {
    requireLock();
    this.liveSessionToken = null;
    transition(accessToken == null ? AuthState.UNAUTHENTICATED : AuthState.HAS_ACCESS_TOKEN);
  }

  /**
   * Records a failed attempt.
   *
   * @param step the step that failed
   */
  public void onFailure(AuthStep step) {
    this.failedStep = step;
    transition(AuthState.FAILED);
  }

  /**
   * Forgets all tokens.
   */
  public void clear() {
    requireLock();
    this.accessToken = null;
    this.liveSessionToken = null;
    this.failedStep = null;
    transition(AuthState.UNAUTHENTICATED);
  }

  private void transition(AuthState next) {
    requireLock();
    if (next != AuthState.FAILED) {
      failedStep = null;
    }
    log.debug("transition({} -> {})", state, next);
    state = next;
  }

  private void requireLock() {
    if (!lock.isHeldByCurrentThread()) {
      throw new IllegalStateException("AuthSession changes require the session lock");
    }
  }

  @Override
  public String toString() {
    return "AuthSession[state=" + state + ", liveSessionToken=" + liveSessionToken + "]";
  }
}
