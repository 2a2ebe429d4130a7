package io.b2mash.b2b.mediaflow.folder;

import java.util.Locale;
import java.util.regex.Pattern;

/** Canonical form of folder paths as stored on uploads and folder records. */
public final class FolderPaths {

  // completed/<jobId>/... and orders/<jobId>/... are blob-storage prefixes, not folder names
  private static final Pattern STORAGE_PREFIX =
      Pattern.compile("^(?:completed|orders)/[^/]+/(.+)$");
  private static final Pattern REPEATED_SLASHES = Pattern.compile("/{2,}");

  private FolderPaths() {}

  /**
   * Trims, converts backslashes, collapses duplicate slashes, drops leading and trailing slashes,
   * and strips a storage prefix. Null becomes the empty string.
   */
  public static String normalize(String rawPath) {
    if (rawPath == null) {
      return "";
    }
    String path = rawPath.trim().replace('\\', '/');
    path = REPEATED_SLASHES.matcher(path).replaceAll("/");
    path = stripSlashes(path);
    var prefixed = STORAGE_PREFIX.matcher(path);
    if (prefixed.matches()) {
      path = stripSlashes(prefixed.group(1));
    }
    return path;
  }

  /** Key used to compare paths; case-insensitive. */
  public static String comparisonKey(String rawPath) {
    return normalize(rawPath).toLowerCase(Locale.ROOT);
  }

  public static boolean isBlank(String rawPath) {
    return normalize(rawPath).isEmpty();
  }

  private static String stripSlashes(String path) {
    int start = 0;
    int end = path.length();
    while (start < end && path.charAt(start) == '/') {
      start++;
    }
    while (end > start && path.charAt(end - 1) == '/') {
      end--;
    }
    return path.substring(start, end);
  }
}
