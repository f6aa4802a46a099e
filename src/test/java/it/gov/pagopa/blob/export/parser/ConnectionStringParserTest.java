package it.gov.pagopa.blob.export.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import it.gov.pagopa.blob.export.model.AccountCredentials;
import org.junit.jupiter.api.Test;

class ConnectionStringParserTest {

  @Test
  void testFullConnectionString() {
    AccountCredentials credentials =
        ConnectionStringParser.parse(
            "DefaultEndpointsProtocol=https;AccountName=acme;AccountKey=abc123;EndpointSuffix=core.windows.net");

    assertEquals("acme", credentials.getAccountName());
    assertEquals("abc123", credentials.getAccountKey());
    assertTrue(credentials.isComplete());
  }

  @Test
  void testFieldOrderDoesNotMatter() {
    AccountCredentials credentials =
        ConnectionStringParser.parse("AccountKey=k3y==;EndpointSuffix=x;AccountName=acme;");

    assertEquals("acme", credentials.getAccountName());
    assertEquals("k3y==", credentials.getAccountKey());
  }

  @Test
  void testLastFieldWithoutTrailingSeparator() {
    AccountCredentials credentials =
        ConnectionStringParser.parse("AccountName=acme;AccountKey=abc123");

    assertEquals("acme", credentials.getAccountName());
    assertEquals("abc123", credentials.getAccountKey());
  }

  @Test
  void testKeyWithoutNameYieldsNoCredentials() {
    AccountCredentials credentials =
        ConnectionStringParser.parse("DefaultEndpointsProtocol=https;AccountKey=abc123;");

    assertSame(AccountCredentials.NONE, credentials);
    assertNull(credentials.getAccountKey());
    assertFalse(credentials.isComplete());
  }

  @Test
  void testEmptyNameYieldsNoCredentials() {
    AccountCredentials credentials = ConnectionStringParser.parse("AccountName=;AccountKey=k");

    assertSame(AccountCredentials.NONE, credentials);
    assertNull(credentials.getAccountName());
    assertNull(credentials.getAccountKey());
  }

  @Test
  void testNameWithoutKey() {
    AccountCredentials credentials = ConnectionStringParser.parse("AccountName=acme;");

    assertEquals("acme", credentials.getAccountName());
    assertNull(credentials.getAccountKey());
    assertFalse(credentials.isComplete());
  }

  @Test
  void testFirstOccurrenceWins() {
    AccountCredentials credentials =
        ConnectionStringParser.parse("AccountName=first;AccountName=second;AccountKey=abc");

    assertEquals("first", credentials.getAccountName());
  }

  @Test
  void testNullAndEmptyInput() {
    assertSame(AccountCredentials.NONE, ConnectionStringParser.parse(null));
    assertSame(AccountCredentials.NONE, ConnectionStringParser.parse(""));
  }

  @Test
  void testKeyIsMaskedInToString() {
    AccountCredentials credentials =
        ConnectionStringParser.parse("AccountName=acme;AccountKey=secret-value");

    assertFalse(credentials.toString().contains("secret-value"));
  }
}
