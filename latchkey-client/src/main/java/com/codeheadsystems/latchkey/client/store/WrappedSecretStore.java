package com.codeheadsystems.latchkey.client.store;

import com.codeheadsystems.latchkey.client.model.AccountRecord;
import java.util.Optional;

/**
 * Persistence for account records. Implementations replace a record as a whole; readers never
 * observe a half-written one.
 */
public interface WrappedSecretStore {

  /**
   * Load.
   *
   * @param accountId the account id
   * @return the record, if any
   */
  Optional<AccountRecord> load(String accountId);

  /**
   * Saves, replacing any previous record for the account.
   *
   * @param record the record
   */
  void save(AccountRecord record);

  /**
   * Delete.
   *
   * @param accountId the account id
   * @return true if a record was removed
   */
  boolean delete(String accountId);
}
