package it.gov.pagopa.blob.export.model;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class AccountCredentials {

  public static final AccountCredentials NONE = new AccountCredentials(null, null);

  String accountName;
  String accountKey;

  /** Both name and key are needed to sign a token. */
  public boolean isComplete() {
    return accountName != null
        && !accountName.isBlank()
        && accountKey != null
        && !accountKey.isBlank();
  }

  @Override
  public String toString() {
    // never log the key
    return String.format(
        "AccountCredentials(accountName=%s, accountKey=%s)",
        accountName, accountKey == null ? null : "****");
  }
}
