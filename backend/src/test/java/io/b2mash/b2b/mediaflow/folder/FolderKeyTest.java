package io.b2mash.b2b.mediaflow.folder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class FolderKeyTest {

  private static final UUID ORDER_ID = UUID.fromString("7d1f6c2e-0a3b-4c5d-8e9f-001122334455");

  @Test
  void resolve_prefersStoredKeyOverEverythingElse() {
    var key = FolderKey.resolve("token:abc", "other", ORDER_ID, null, "Photos");

    assertThat(key).isEqualTo(new FolderKey.Token("abc"));
  }

  @Test
  void resolve_fallsThroughTokenOrderInstancePath() {
    UUID instance = UUID.randomUUID();

    assertThat(FolderKey.resolve(null, "tok", ORDER_ID, instance, "p"))
        .isInstanceOf(FolderKey.Token.class);
    assertThat(FolderKey.resolve(null, " ", ORDER_ID, instance, "p"))
        .isInstanceOf(FolderKey.OrderScoped.class);
    assertThat(FolderKey.resolve(null, null, null, instance, "p"))
        .isInstanceOf(FolderKey.Instance.class);
    assertThat(FolderKey.resolve(null, null, null, null, "p")).isInstanceOf(FolderKey.Path.class);
  }

  @Test
  void render_usesNormalizedLowerCasePath() {
    assertThat(new FolderKey.OrderScoped(ORDER_ID, "completed/J1/Raw Files/").render())
        .isEqualTo("order:" + ORDER_ID + "::raw files");
    assertThat(new FolderKey.Path("Photos").render()).isEqualTo("path:photos");
  }

  @Test
  void parse_readsBackEveryVariant() {
    UUID instance = UUID.randomUUID();
    var keys =
        new FolderKey[] {
          new FolderKey.Token("t0k3n"),
          new FolderKey.Path("photos/edited"),
          new FolderKey.OrderScoped(ORDER_ID, "raw"),
          new FolderKey.Instance(instance, "a::b")
        };

    for (FolderKey key : keys) {
      assertThat(FolderKey.parse(key.render())).isEqualTo(key);
    }
  }

  @Test
  void parse_rejectsUnknownPrefix() {
    assertThatThrownBy(() -> FolderKey.parse("folder:123"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void parse_rejectsMalformedId() {
    assertThatThrownBy(() -> FolderKey.parse("order:not-a-uuid::photos"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("malformed id");
  }

  @Test
  void token_mustNotBeBlank() {
    assertThatThrownBy(() -> new FolderKey.Token(" "))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
