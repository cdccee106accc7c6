package structured.error.core.support;

import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.Tuple;
import structured.error.core.domain.model.AttachmentNode;
import structured.error.core.domain.model.ContextNode;
import structured.error.core.domain.model.ErrorChild;
import structured.error.core.domain.model.ErrorNode;

/** 에러 트리 생성기 (jqwik) */
public final class ErrorTreeArbitraries {

  private ErrorTreeArbitraries() {}

  public static Arbitrary<ErrorNode> trees() {
    return errorNodes(3);
  }

  public static Arbitrary<ErrorNode> errorNodes(int depth) {
    Arbitrary<List<ErrorChild>> children =
        depth == 0 ? Arbitraries.just(List.of()) : children(depth).list().ofMaxSize(4);
    return Combinators.combine(
            Arbitraries.integers().between(0, 99_999_999),
            text(),
            text().injectNull(0.4),
            names().injectNull(0.2),
            Arbitraries.integers().between(1, 9999).map(String::valueOf).injectNull(0.5),
            children)
        .as(ErrorNode::new);
  }

  private static Arbitrary<ErrorChild> children(int depth) {
    Arbitrary<ErrorChild> contexts = contexts().map(ErrorChild.class::cast);
    Arbitrary<ErrorChild> errors = errorNodes(depth - 1).map(ErrorChild.class::cast);
    Arbitrary<ErrorChild> attachments = attachments().map(ErrorChild.class::cast);
    return Arbitraries.oneOf(contexts, errors, attachments);
  }

  public static Arbitrary<ContextNode> contexts() {
    return Arbitraries.maps(names(), text()).ofMinSize(1).ofMaxSize(4).map(ContextNode::new);
  }

  public static Arbitrary<AttachmentNode> attachments() {
    Arbitrary<String> elementNames =
        Arbitraries.strings().withCharRange('a', 'z').ofMinLength(1).ofMaxLength(6).map(n -> "x" + n);
    return Combinators.combine(
            elementNames,
            Arbitraries.maps(names(), text()).ofMaxSize(2),
            Arbitraries.strings().withCharRange('a', 'z').ofMinLength(1).ofMaxLength(10).injectNull(0.5))
        .as((name, attributes, body) -> new AttachmentNode(name, attributes, body, List.of()));
  }

  /** XML 이름 규칙을 만족하는 속성 이름 (xmlns 접두 이름 포함) */
  public static Arbitrary<String> names() {
    Arbitrary<String> plain =
        Arbitraries.strings()
            .withCharRange('a', 'z')
            .withCharRange('A', 'Z')
            .ofMinLength(1)
            .ofMaxLength(10);
    Arbitrary<String> xmlns =
        Arbitraries.oneOf(
            Arbitraries.just("xmlns"),
            Arbitraries.strings().withCharRange('a', 'z').ofMaxLength(5).map(n -> "xmlns_" + n));
    return Arbitraries.frequencyOf(Tuple.of(9, plain), Tuple.of(1, xmlns));
  }

  /**
   * 이스케이프 대상 문자와 한글을 포함한 메시지
   *
   * <p>탭/CR/LF 외의 0x20 미만 제어 문자는 XML 1.0으로 표현할 수 없어 인코딩 시 U+FFFD로 바뀌므로 생성하지 않습니다.
   */
  public static Arbitrary<String> text() {
    return Arbitraries.strings()
        .withCharRange(' ', '~')
        .withCharRange('가', '힣')
        .withChars('\n', '\t', '\r')
        .ofMaxLength(60);
  }
}
