package com.codeheadsystems.latchkey.client.exceptions;

/**
 * No persisted record exists for the account.
 */
public class AccountNotFoundException extends RuntimeException {

  /**
   * Instantiates a new Account not found exception.
   *
   * @param accountId the account id
   */
  public AccountNotFoundException(final String accountId) {
    super("No record for account: " + accountId);
  }
}
