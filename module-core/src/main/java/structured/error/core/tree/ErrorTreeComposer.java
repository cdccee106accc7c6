package structured.error.core.tree;

import java.util.List;
import structured.error.core.catalog.ErrorLookup;
import structured.error.core.codec.ErrorTreeCodec;
import structured.error.core.domain.model.ContextNode;
import structured.error.core.domain.model.ErrorChild;
import structured.error.core.domain.model.ErrorNode;
import structured.error.core.substitution.TokenSubstitutor;

/**
 * 하위 프레임에서 올라온 메시지를 에러 트리로 감싸기
 *
 * <ul>
 *   <li>이미 인코딩된 트리면 그대로 사용
 *   <li>그 외 텍스트는 불투명 메시지로 보고 (핸들러, UnknownError) 리프를 생성, 원문은 {@code ChildMessage} 토큰으로 전달
 * </ul>
 *
 * <p>{@code before}는 루트의 첫 자식으로, {@code after}는 순서대로 마지막 자식으로 붙습니다. 기존 트리의 자식 순서는 바꾸지 않습니다.
 */
public class ErrorTreeComposer {

  private final ErrorLookup errorLookup;
  private final String handlerName;

  public ErrorTreeComposer(ErrorLookup errorLookup, String handlerName) {
    this.errorLookup = errorLookup;
    this.handlerName = handlerName;
  }

  public ErrorNode wrap(String rawMessage) {
    return wrap(rawMessage, null, List.of());
  }

  /**
   * @param rawMessage 인코딩된 트리 또는 일반 텍스트
   * @param before 첫 자식으로 넣을 노드 (null이면 생략)
   * @param after 마지막 자식으로 덧붙일 노드들
   */
  public ErrorNode wrap(String rawMessage, ErrorChild before, List<? extends ErrorChild> after) {
    ErrorNode root =
        ErrorTreeCodec.tryDecode(rawMessage).orElseGet(() -> synthesize(rawMessage));
    if (before != null) {
      root = root.prepend(before);
    }
    for (ErrorChild child : after) {
      root = root.append(child);
    }
    return root;
  }

  private ErrorNode synthesize(String rawMessage) {
    ContextNode context =
        ContextNode.builder()
            .put(TokenSubstitutor.CHILD_MESSAGE, rawMessage == null ? "" : rawMessage)
            .build();
    return errorLookup.lookup(handlerName, ErrorLookup.UNKNOWN_ERROR, context);
  }
}
