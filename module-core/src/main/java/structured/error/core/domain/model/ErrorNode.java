package structured.error.core.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 구조화 에러 트리의 노드 ({@code E} 요소)
 *
 * <p>순수 도메인 - 불변 record. 트리 편집은 항상 새 인스턴스를 반환합니다.
 *
 * <h3>속성</h3>
 *
 * <ul>
 *   <li><b>code</b> ({@code N}): 에러 카탈로그의 errorId
 *   <li><b>userMessage</b> ({@code M}): 사용자에게 보여줄 메시지
 *   <li><b>developerMessage</b> ({@code D}): userMessage와 다를 때만 보관
 *   <li><b>sourceProcedure</b> ({@code P}): 에러를 보고한 프로시저
 *   <li><b>sourceLine</b> ({@code L}): 에러가 발생한 라인
 * </ul>
 *
 * <p>자식은 {@link ContextNode}, 중첩 {@link ErrorNode}, {@link AttachmentNode}가 순서대로 섞인 목록입니다.
 */
public record ErrorNode(
    int code,
    String userMessage,
    String developerMessage,
    String sourceProcedure,
    String sourceLine,
    List<ErrorChild> children)
    implements ErrorChild {

  public static final String ELEMENT = "E";

  public ErrorNode {
    userMessage = userMessage == null ? "" : userMessage;
    if (developerMessage != null && developerMessage.equals(userMessage)) {
      developerMessage = null;
    }
    children = children == null ? List.of() : List.copyOf(children);
  }

  /** 자식 없는 리프 노드 생성 */
  public static ErrorNode leaf(
      int code, String userMessage, String developerMessage, String sourceProcedure) {
    return new ErrorNode(code, userMessage, developerMessage, sourceProcedure, null, List.of());
  }

  public boolean hasDeveloperMessage() {
    return developerMessage != null;
  }

  /** 중첩 에러 자식만 순서대로 */
  public List<ErrorNode> errorChildren() {
    return children.stream()
        .filter(ErrorNode.class::isInstance)
        .map(ErrorNode.class::cast)
        .toList();
  }

  /** 컨텍스트 자식만 순서대로 */
  public List<ContextNode> contextChildren() {
    return children.stream()
        .filter(ContextNode.class::isInstance)
        .map(ContextNode.class::cast)
        .toList();
  }

  public Optional<ErrorNode> firstErrorChild() {
    return children.stream()
        .filter(ErrorNode.class::isInstance)
        .map(ErrorNode.class::cast)
        .findFirst();
  }

  public ErrorNode withChildren(List<ErrorChild> newChildren) {
    return new ErrorNode(
        code, userMessage, developerMessage, sourceProcedure, sourceLine, newChildren);
  }

  public ErrorNode withoutDeveloperMessage() {
    return new ErrorNode(code, userMessage, null, sourceProcedure, sourceLine, children);
  }

  /** 첫 번째 자식으로 삽입한 새 노드 */
  public ErrorNode prepend(ErrorChild child) {
    Objects.requireNonNull(child, "child");
    List<ErrorChild> copy = new ArrayList<>(children.size() + 1);
    copy.add(child);
    copy.addAll(children);
    return withChildren(copy);
  }

  /** 마지막 자식으로 추가한 새 노드 */
  public ErrorNode append(ErrorChild child) {
    Objects.requireNonNull(child, "child");
    List<ErrorChild> copy = new ArrayList<>(children);
    copy.add(child);
    return withChildren(copy);
  }

  /**
   * 주어진 타입의 마지막 자식을 제거한 새 노드
   *
   * @return 해당 타입의 자식이 없으면 empty
   */
  public Optional<ErrorNode> withoutLast(Class<? extends ErrorChild> type) {
    for (int i = children.size() - 1; i >= 0; i--) {
      if (type.isInstance(children.get(i))) {
        return Optional.of(withChildAt(i, null));
      }
    }
    return Optional.empty();
  }

  /** 마지막 중첩 에러 자식을 교체한 새 노드 */
  public Optional<ErrorNode> replaceLastErrorChild(ErrorNode replacement) {
    for (int i = children.size() - 1; i >= 0; i--) {
      if (children.get(i) instanceof ErrorNode) {
        return Optional.of(withChildAt(i, replacement));
      }
    }
    return Optional.empty();
  }

  public Optional<ErrorNode> lastErrorChild() {
    for (int i = children.size() - 1; i >= 0; i--) {
      if (children.get(i) instanceof ErrorNode node) {
        return Optional.of(node);
      }
    }
    return Optional.empty();
  }

  private ErrorNode withChildAt(int index, ErrorChild replacement) {
    List<ErrorChild> copy = new ArrayList<>(children);
    if (replacement == null) {
      copy.remove(index);
    } else {
      copy.set(index, replacement);
    }
    return withChildren(copy);
  }
}
