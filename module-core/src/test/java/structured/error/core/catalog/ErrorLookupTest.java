package structured.error.core.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import structured.error.core.codec.ErrorTreeCodec;
import structured.error.core.domain.model.ContextNode;
import structured.error.core.domain.model.ErrorChild;
import structured.error.core.domain.model.ErrorDefinition;
import structured.error.core.domain.model.ErrorNode;
import structured.error.core.domain.model.PropagationSettings;
import structured.error.core.support.SeededCatalog;

@DisplayName("ErrorLookup")
class ErrorLookupTest {

  private static final int TEST_PROC_ID = 1921598084;

  private final ErrorLookup lookup =
      new ErrorLookup(
          SeededCatalog.snapshot(),
          SeededCatalog.registry(Map.of(TEST_PROC_ID, "Test_ErrorLookup")),
          PropagationSettings.defaults());

  @Nested
  @DisplayName("정확히 일치하는 정의")
  class ExactMatch {

    @Test
    @DisplayName("토큰 치환 후 PROCID/LINE은 P/L로 승격되고 T에서 제거")
    void promotesReservedKeys() {
      ContextNode context =
          ContextNode.builder()
              .put("EntityId", 8)
              .put("PROCID", TEST_PROC_ID)
              .put("LINE", 61)
              .build();

      ErrorNode node = lookup.lookup("ArticleIsDeletable", "NotFound", context);

      assertThat(node.code()).isEqualTo(5021003);
      assertThat(node.userMessage()).isEqualTo("The Article specified was not found");
      assertThat(node.developerMessage()).isEqualTo("The Article 8 specified was not found");
      assertThat(node.sourceProcedure()).isEqualTo("Test_ErrorLookup");
      assertThat(node.sourceLine()).isEqualTo("61");
      assertThat(node.children())
          .containsExactly(ContextNode.builder().put("EntityId", 8).build());
    }

    @Test
    @DisplayName("예약 키 매칭은 대소문자 무시")
    void reservedKeysIgnoreCase() {
      ContextNode context =
          ContextNode.builder().put("procid", TEST_PROC_ID).put("Line", 3).build();

      ErrorNode node = lookup.lookup("ArticleIsDeletable", "NotFound", context);

      assertThat(node.sourceProcedure()).isEqualTo("Test_ErrorLookup");
      assertThat(node.sourceLine()).isEqualTo("3");
      assertThat(node.children()).isEmpty();
    }

    @Test
    @DisplayName("해석할 수 없는 PROCID는 소유 프로시저 이름으로 대체")
    void unresolvedProcId() {
      ContextNode context = ContextNode.builder().put("PROCID", 42).build();

      ErrorNode node = lookup.lookup("ArticleIsDeletable", "NotFound", context);

      assertThat(node.sourceProcedure()).isEqualTo("ArticleIsDeletable");
    }

    @Test
    @DisplayName("컨텍스트 자식은 (정리된) T 다음에 원래 순서대로 붙음")
    void keepsContextOrder() {
      ErrorNode first = ErrorNode.leaf(1, "first", null, "A");
      ErrorNode second = ErrorNode.leaf(2, "second", null, "B");
      List<ErrorChild> context =
          List.of(ContextNode.builder().put("EntityId", 1).build(), first, second);

      ErrorNode node = lookup.lookup("ArticleIsDeletable", "NotFound", context);

      assertThat(node.children())
          .containsExactly(ContextNode.builder().put("EntityId", 1).build(), first, second);
    }
  }

  @Nested
  @DisplayName("대체 정의")
  class Fallback {

    @Test
    @DisplayName("정의가 없으면 (ErrorHandler, UnknownError)와 ErrorId=0 토큰")
    void unknownErrorEntry() {
      ErrorNode node = lookup.lookup("Proc", "Missing");

      assertThat(node.code()).isEqualTo(1000);
      assertThat(node.userMessage())
          .isEqualTo(
              "Unknown error message \"Missing\" for procedure \"Proc\" is not defined in the error"
                  + " table. ");
      assertThat(node.sourceProcedure()).isEqualTo("Proc");
      assertThat(node.children())
          .containsExactly(ContextNode.builder().put("ErrorId", 0).build());
    }

    @Test
    @DisplayName("기존 T가 있으면 그 첫 T에 ErrorId를 추가")
    void marksExistingContext() {
      ErrorNode node =
          lookup.lookup("Proc", "Missing", ContextNode.builder().put("Key", "v").build());

      assertThat(node.contextChildren())
          .containsExactly(ContextNode.builder().put("Key", "v").put("ErrorId", 0).build());
    }

    @Test
    @DisplayName("카탈로그가 비어 있어도 내장 템플릿으로 메시지 생성")
    void builtinTemplate() {
      ErrorLookup empty =
          new ErrorLookup(
              ErrorCatalogSnapshot.empty(),
              SeededCatalog.registry(Map.of()),
              PropagationSettings.defaults());

      ErrorNode node = empty.lookup("Proc", "Missing");

      assertThat(node.code()).isZero();
      assertThat(node.userMessage()).startsWith("Unknown error message \"Missing\"");
    }
  }

  @Nested
  @DisplayName("#ChildMessage#")
  class ChildMessage {

    private final ErrorLookup outer =
        new ErrorLookup(
            ErrorCatalogSnapshot.of(
                List.of(
                    new ErrorDefinition(
                        9, "Outer", "Failed", "Outer: #ChildMessage#", "Outer dev: #ChildMessage#"))),
            SeededCatalog.registry(Map.of()),
            PropagationSettings.defaults());

    @Test
    @DisplayName("첫 중첩 E의 M/D로 치환")
    void fromFirstNestedError() {
      List<ErrorChild> context =
          List.of(
              new ErrorNode(2, "inner user", "inner dev", "Inner", null, List.of()),
              ErrorNode.leaf(3, "second", null, "Other"));

      ErrorNode node = outer.lookup("Outer", "Failed", context);

      assertThat(node.userMessage()).isEqualTo("Outer: inner user");
      assertThat(node.developerMessage()).isEqualTo("Outer dev: inner dev");
    }

    @Test
    @DisplayName("중첩 E에 D가 없으면 개발자 메시지도 M 사용")
    void developerFallsBackToUserMessage() {
      ErrorNode node =
          outer.lookup("Outer", "Failed", List.of(ErrorNode.leaf(2, "inner", null, "Inner")));

      assertThat(node.developerMessage()).isEqualTo("Outer dev: inner");
    }

    @Test
    @DisplayName("중첩 E가 없으면 빈 문자열")
    void noNestedError() {
      ErrorNode node = outer.lookup("Outer", "Failed");

      assertThat(node.userMessage()).isEqualTo("Outer: ");
    }

    @Test
    @DisplayName("호출자가 준 ChildMessage 토큰이 우선")
    void callerTokenWins() {
      List<ErrorChild> context =
          List.of(
              ContextNode.builder().put("ChildMessage", "raw text").build(),
              ErrorNode.leaf(2, "inner", null, "Inner"));

      ErrorNode node = outer.lookup("Outer", "Failed", context);

      assertThat(node.userMessage()).isEqualTo("Outer: raw text");
    }
  }

  @Nested
  @DisplayName("lookupMessage")
  class LookupMessage {

    private final ErrorLookup small =
        new ErrorLookup(
            SeededCatalog.snapshot(),
            SeededCatalog.registry(Map.of()),
            new PropagationSettings(300, "ErrorHandler", 50000, Map.of()));

    private List<ErrorChild> manyChildren(ContextNode head) {
      List<ErrorChild> context = new ArrayList<>();
      context.add(head);
      for (int i = 0; i < 20; i++) {
        context.add(ErrorNode.leaf(100 + i, "nested failure number " + i, null, "Deep"));
      }
      return context;
    }

    @Test
    @DisplayName("기본적으로 최대 길이에 맞게 잘라냄")
    void limitedByDefault() {
      String message =
          small.lookupMessage(
              "ArticleIsDeletable",
              "NotFound",
              manyChildren(ContextNode.builder().put("EntityId", 1).build()));

      assertThat(message.length()).isLessThanOrEqualTo(300);
      assertThat(ErrorTreeCodec.decode(message).code()).isEqualTo(5021003);
    }

    @Test
    @DisplayName("LimitLength가 거짓이면 잘라내지 않고 T에서도 제거")
    void limitLengthDisabled() {
      String message =
          small.lookupMessage(
              "ArticleIsDeletable",
              "NotFound",
              manyChildren(ContextNode.builder().put("EntityId", 1).put("LimitLength", 0).build()));

      ErrorNode decoded = ErrorTreeCodec.decode(message);
      assertThat(message.length()).isGreaterThan(300);
      assertThat(decoded.errorChildren()).hasSize(20);
      assertThat(decoded.contextChildren())
          .containsExactly(ContextNode.builder().put("EntityId", 1).build());
    }
  }
}
