package io.b2mash.b2b.mediaflow.lifecycle;

/**
 * @param valid whether the requested edge is in the allow-list
 * @param error names the rejected edge; null when valid
 */
public record TransitionResult(boolean valid, String error) {

  static TransitionResult allowed() {
    return new TransitionResult(true, null);
  }

  static TransitionResult rejected(String error) {
    return new TransitionResult(false, error);
  }
}
