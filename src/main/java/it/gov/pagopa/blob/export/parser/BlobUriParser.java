package it.gov.pagopa.blob.export.parser;

import it.gov.pagopa.blob.export.model.ParsedBlobUri;
import it.gov.pagopa.blob.export.model.ParsedFileName;
import lombok.experimental.UtilityClass;

/**
 * Splits blob URIs of the form {@code scheme://account.<suffix>/container/path/file.ext[?token]}.
 *
 * <p>Anything that does not have that shape is reported as {@link ParsedBlobUri#EMPTY}, never as
 * an exception and never as a partially filled result.
 */
@UtilityClass
public class BlobUriParser {

  private static final String SCHEME_SEPARATOR = "://";
  private static final char QUERY_START = '?';
  private static final char PATH_SEPARATOR = '/';
  private static final char DOT = '.';

  public static ParsedBlobUri parse(String blobUri) {
    if (blobUri == null || blobUri.isBlank()) {
      return ParsedBlobUri.EMPTY;
    }

    int schemeIdx = blobUri.indexOf(SCHEME_SEPARATOR);
    if (schemeIdx < 0) {
      return ParsedBlobUri.EMPTY;
    }
    int pathStart = schemeIdx + SCHEME_SEPARATOR.length();

    // the token keeps its leading '?'
    String sasToken = null;
    String path;
    int queryIdx = blobUri.indexOf(QUERY_START);
    if (queryIdx >= 0 && queryIdx >= pathStart) {
      path = blobUri.substring(pathStart, queryIdx);
      sasToken = blobUri.substring(queryIdx);
    } else if (queryIdx >= 0) {
      // '?' before the path start: nothing left to parse
      return ParsedBlobUri.EMPTY;
    } else {
      path = blobUri.substring(pathStart);
    }

    int authorityEnd = path.indexOf(PATH_SEPARATOR);
    if (authorityEnd < 0) {
      return ParsedBlobUri.EMPTY;
    }
    String authority = path.substring(0, authorityEnd);
    String rawPath = path.substring(authorityEnd + 1);

    // the authority delimits the account, the raw path delimits the container
    int accountEnd = authority.indexOf(DOT);
    int containerEnd = rawPath.indexOf(PATH_SEPARATOR);
    if (accountEnd < 0 || containerEnd < 0) {
      return ParsedBlobUri.EMPTY;
    }

    String blobPath = rawPath.substring(containerEnd + 1);
    String fileName = blobPath.substring(blobPath.lastIndexOf(PATH_SEPARATOR) + 1);

    return ParsedBlobUri.builder()
        .account(authority.substring(0, accountEnd))
        .container(rawPath.substring(0, containerEnd))
        .blobPath(blobPath)
        .fileName(fileName)
        .fileExtension(extensionOf(fileName))
        .sasToken(sasToken)
        .build();
  }

  /**
   * Splits {@code directory/file.ext} at the last separator. A path without a file name (empty or
   * ending in {@code /}) yields {@link ParsedFileName#EMPTY}.
   */
  public static ParsedFileName parseFileName(String path) {
    if (path == null) {
      return ParsedFileName.EMPTY;
    }
    int idx = path.lastIndexOf(PATH_SEPARATOR);
    String fileName = path.substring(idx + 1);
    if (fileName.isEmpty()) {
      return ParsedFileName.EMPTY;
    }
    return ParsedFileName.builder()
        .directory(idx < 0 ? "" : path.substring(0, idx))
        .fileName(fileName)
        .fileExtension(extensionOf(fileName))
        .build();
  }

  private static String extensionOf(String fileName) {
    int idx = fileName.lastIndexOf(DOT);
    return idx < 0 ? null : fileName.substring(idx + 1);
  }
}
