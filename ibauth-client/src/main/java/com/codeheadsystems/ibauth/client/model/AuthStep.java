package com.codeheadsystems.ibauth.client.model;

/**
 * A step of the token exchange, used to report where an attempt failed.
 */
public enum AuthStep {
  REQUEST_TOKEN,
  ACCESS_TOKEN,
  LIVE_SESSION_TOKEN,
  SESSION_INIT
}
