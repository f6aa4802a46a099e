package it.gov.pagopa.blob.export.parser;

import it.gov.pagopa.blob.export.model.AccountCredentials;
import lombok.experimental.UtilityClass;

/**
 * Reads the account name and key out of a storage connection string such as {@code
 * DefaultEndpointsProtocol=https;AccountName=acme;AccountKey=...;EndpointSuffix=core.windows.net}.
 * Every other field is ignored.
 */
@UtilityClass
public class ConnectionStringParser {

  public static final String ACCOUNT_NAME = "AccountName=";
  public static final String ACCOUNT_KEY = "AccountKey=";

  private static final char FIELD_SEPARATOR = ';';

  /**
   * Parses the credentials of a connection string.
   *
   * <p>The key is only looked up when a non-empty name is present: a string carrying a key but no
   * name yields {@link AccountCredentials#NONE}.
   *
   * @param connectionString full connection string, may be null
   * @return the credentials, with null fields for anything not found
   */
  public static AccountCredentials parse(String connectionString) {
    String accountName = getValue(connectionString, ACCOUNT_NAME);
    if (accountName == null || accountName.isEmpty()) {
      return AccountCredentials.NONE;
    }
    return new AccountCredentials(accountName, getValue(connectionString, ACCOUNT_KEY));
  }

  /**
   * Value between {@code field} and the next {@code ;}, or up to the end of the string when
   * {@code field} is the last one. The first occurrence wins.
   */
  static String getValue(String connectionString, String field) {
    if (connectionString == null) {
      return null;
    }
    int start = connectionString.indexOf(field);
    if (start < 0) {
      return null;
    }
    start += field.length();
    int end = connectionString.indexOf(FIELD_SEPARATOR, start);
    return end < 0 ? connectionString.substring(start) : connectionString.substring(start, end);
  }
}
