package com.codeheadsystems.ibauth.client.store;

import com.codeheadsystems.ibauth.model.store.PersistedTokenRecord;
import java.util.Optional;

/**
 * Storage abstraction for the persisted token set.
 * <p>
 * Implementations must be thread-safe. A stored record lacking either the access token or the
 * live session token must be reported as absent so the caller re-authenticates. Write failures
 * are raised as {@link com.codeheadsystems.ibauth.client.exceptions.TokenStoreException}, never
 * swallowed.
 */
public interface TokenStore {

  /**
   * Loads the stored token set.
   *
   * @return the record, or empty if none is stored or it is incomplete
   */
  Optional<PersistedTokenRecord> load();

  /**
   * Replaces the stored token set.
   *
   * @param record the record
   */
  void save(PersistedTokenRecord record);

  /**
   * Removes the stored token set. Does nothing when none is stored.
   */
  void clear();
}
