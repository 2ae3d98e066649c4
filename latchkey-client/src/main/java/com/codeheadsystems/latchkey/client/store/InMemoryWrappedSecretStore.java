package com.codeheadsystems.latchkey.client.store;

import com.codeheadsystems.latchkey.client.model.AccountRecord;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed store for tests and short-lived processes.
 */
public class InMemoryWrappedSecretStore implements WrappedSecretStore {

  private final Map<String, AccountRecord> records = new ConcurrentHashMap<>();

  @Override
  public Optional<AccountRecord> load(String accountId) {
    return Optional.ofNullable(records.get(accountId));
  }

  @Override
  public void save(AccountRecord record) {
    records.put(record.accountId(), record);
  }

  @Override
  public boolean delete(String accountId) {
    return records.remove(accountId) != null;
  }
}
