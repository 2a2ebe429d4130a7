package io.b2mash.b2b.mediaflow.folder;

import java.util.UUID;

/**
 * Identity of a deliverable folder within a job. Every variant renders to a stable string and
 * {@link #parse(String)} reads it back; paths inside keys are compared case-insensitively.
 *
 * <p>{@link #resolve} applies the one resolution order used everywhere: explicit stored key, then
 * folder token, then order + path, then instance, then plain path.
 */
public sealed interface FolderKey
    permits FolderKey.Path, FolderKey.Token, FolderKey.OrderScoped, FolderKey.Instance {

  String TOKEN_PREFIX = "token:";
  String ORDER_PREFIX = "order:";
  String INSTANCE_PREFIX = "instance:";
  String PATH_PREFIX = "path:";
  String SEPARATOR = "::";

  String render();

  /** Plain folder path, for folders that carry nothing more specific. */
  record Path(String path) implements FolderKey {
    public Path {
      path = FolderPaths.comparisonKey(path);
    }

    @Override
    public String render() {
      return PATH_PREFIX + path;
    }
  }

  /** Folder identified by its security token, independent of where its files are stored. */
  record Token(String token) implements FolderKey {
    public Token {
      if (token == null || token.isBlank()) {
        throw new IllegalArgumentException("Folder token must not be blank");
      }
      token = token.trim();
    }

    @Override
    public String render() {
      return TOKEN_PREFIX + token;
    }
  }

  /** A path that exists separately for every order of the job. */
  record OrderScoped(UUID orderId, String path) implements FolderKey {
    public OrderScoped {
      path = FolderPaths.comparisonKey(path);
    }

    @Override
    public String render() {
      return ORDER_PREFIX + orderId + SEPARATOR + path;
    }
  }

  /**
   * Token-less, order-less uploads sharing a path and editor folder name, identified by the first
   * upload of the group.
   */
  record Instance(UUID instanceId, String path) implements FolderKey {
    public Instance {
      path = FolderPaths.comparisonKey(path);
    }

    @Override
    public String render() {
      return INSTANCE_PREFIX + instanceId + SEPARATOR + path;
    }
  }

  static FolderKey resolve(
      String storedKey, String folderToken, UUID orderId, UUID instanceId, String folderPath) {
    if (storedKey != null && !storedKey.isBlank()) {
      return parse(storedKey);
    }
    if (folderToken != null && !folderToken.isBlank()) {
      return new Token(folderToken);
    }
    if (orderId != null) {
      return new OrderScoped(orderId, folderPath);
    }
    if (instanceId != null) {
      return new Instance(instanceId, folderPath);
    }
    return new Path(folderPath);
  }

  /**
   * Reads a rendered key back.
   *
   * @throws IllegalArgumentException if {@code rendered} is not a folder key
   */
  static FolderKey parse(String rendered) {
    if (rendered == null) {
      throw new IllegalArgumentException("Folder key must not be null");
    }
    String key = rendered.trim();
    if (key.startsWith(TOKEN_PREFIX)) {
      return new Token(key.substring(TOKEN_PREFIX.length()));
    }
    if (key.startsWith(PATH_PREFIX)) {
      return new Path(key.substring(PATH_PREFIX.length()));
    }
    if (key.startsWith(ORDER_PREFIX)) {
      String[] parts = splitScoped(key.substring(ORDER_PREFIX.length()), rendered);
      return new OrderScoped(parseUuid(parts[0], rendered), parts[1]);
    }
    if (key.startsWith(INSTANCE_PREFIX)) {
      String[] parts = splitScoped(key.substring(INSTANCE_PREFIX.length()), rendered);
      return new Instance(parseUuid(parts[0], rendered), parts[1]);
    }
    throw new IllegalArgumentException("Unrecognised folder key: " + rendered);
  }

  private static String[] splitScoped(String body, String rendered) {
    int separator = body.indexOf(SEPARATOR);
    if (separator < 0) {
      throw new IllegalArgumentException("Folder key is missing its path: " + rendered);
    }
    return new String[] {
      body.substring(0, separator), body.substring(separator + SEPARATOR.length())
    };
  }

  private static UUID parseUuid(String value, String rendered) {
    try {
      return UUID.fromString(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Folder key has a malformed id: " + rendered, e);
    }
  }
}
