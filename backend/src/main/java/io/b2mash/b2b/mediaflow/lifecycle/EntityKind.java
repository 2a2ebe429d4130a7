package io.b2mash.b2b.mediaflow.lifecycle;

import java.util.Locale;

/** Entities whose status follows a fixed state machine. */
public enum EntityKind {
  JOB,
  ORDER;

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
