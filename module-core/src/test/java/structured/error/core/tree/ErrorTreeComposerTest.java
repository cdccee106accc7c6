package structured.error.core.tree;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import structured.error.core.catalog.ErrorLookup;
import structured.error.core.codec.ErrorTreeCodec;
import structured.error.core.domain.model.ContextNode;
import structured.error.core.domain.model.ErrorNode;
import structured.error.core.domain.model.PropagationSettings;
import structured.error.core.support.SeededCatalog;

@DisplayName("ErrorTreeComposer")
class ErrorTreeComposerTest {

  private final ErrorTreeComposer composer =
      new ErrorTreeComposer(
          new ErrorLookup(
              SeededCatalog.snapshot(),
              SeededCatalog.registry(Map.of()),
              PropagationSettings.defaults()),
          SeededCatalog.HANDLER);

  private final ErrorNode existing =
      new ErrorNode(
          5021003,
          "not found",
          null,
          "ArticleIsDeletable",
          "61",
          List.of(ContextNode.builder().put("EntityId", 8).build()));

  @Test
  @DisplayName("인코딩된 트리는 그대로 사용")
  void reusesEncodedTree() {
    assertThat(composer.wrap(ErrorTreeCodec.encode(existing))).isEqualTo(existing);
  }

  @Test
  @DisplayName("before는 첫 자식, after는 순서대로 마지막 자식")
  void insertsSlots() {
    ContextNode before = ContextNode.builder().put("ThrownBy", "ArticleIsDeletable").build();
    ContextNode after1 = ContextNode.builder().put("CalledBy", "Outer").build();
    ErrorNode after2 = ErrorNode.leaf(1, "extra", null, "X");

    ErrorNode wrapped =
        composer.wrap(ErrorTreeCodec.encode(existing), before, List.of(after1, after2));

    assertThat(wrapped.children())
        .containsExactly(before, existing.children().get(0), after1, after2);
    assertThat(wrapped.code()).isEqualTo(existing.code());
  }

  @Test
  @DisplayName("일반 텍스트는 UnknownError 리프로 합성, 원문은 ChildMessage")
  void synthesizesFromPlainText() {
    ErrorNode wrapped = composer.wrap("Conversion failed when converting 'abc' to int.");

    assertThat(wrapped.code()).isEqualTo(SeededCatalog.UNKNOWN_ERROR.errorId());
    assertThat(wrapped.sourceProcedure()).isEqualTo(SeededCatalog.HANDLER);
    assertThat(wrapped.userMessage())
        .endsWith("is not defined in the error table. Conversion failed when converting 'abc' to int.");
  }

  @Test
  @DisplayName("'<'로 시작하지만 해석 불가하면 불투명 텍스트로 취급")
  void undecodableTreatedAsOpaque() {
    ErrorNode wrapped = composer.wrap("<broken");

    assertThat(wrapped.code()).isEqualTo(SeededCatalog.UNKNOWN_ERROR.errorId());
    assertThat(wrapped.userMessage()).endsWith("<broken");
  }
}
