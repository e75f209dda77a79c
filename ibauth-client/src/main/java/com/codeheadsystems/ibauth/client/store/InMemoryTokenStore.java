package com.codeheadsystems.ibauth.client.store;

import com.codeheadsystems.ibauth.model.store.PersistedTokenRecord;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link TokenStore}. Tokens are lost when the process exits; suitable for tests
 * and short-lived tools.
 */
public class InMemoryTokenStore implements TokenStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryTokenStore.class);

  private final AtomicReference<PersistedTokenRecord> record = new AtomicReference<>();

  @Override
  public Optional<PersistedTokenRecord> load() {
    return Optional.ofNullable(record.get()).filter(PersistedTokenRecord::isComplete);
  }

  @Override
  public void save(PersistedTokenRecord record) {
    this.record.set(record);
    log.debug("Stored tokens for consumer {}", record.consumerKey());
  }

  @Override
  public void clear() {
    record.set(null);
    log.debug("Cleared tokens");
  }
}
