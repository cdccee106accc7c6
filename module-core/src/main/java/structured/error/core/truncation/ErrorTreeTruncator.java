package structured.error.core.truncation;

import java.util.Optional;
import structured.error.core.codec.ErrorTreeCodec;
import structured.error.core.domain.model.AttachmentNode;
import structured.error.core.domain.model.ContextNode;
import structured.error.core.domain.model.ErrorNode;

/**
 * 인코딩 길이 예산에 맞춘 에러 트리 잘라내기
 *
 * <p>예산을 넘는 동안 아래 순서 중 처음 적용 가능한 축소를 한 번씩 적용합니다.
 *
 * <ol>
 *   <li>루트의 마지막 첨부(T/E 이외) 자식 제거
 *   <li>루트의 마지막 E 자식이 E 자식을 가지면 그 마지막 손자 제거
 *   <li>루트의 마지막 E 자식 제거
 *   <li>루트의 마지막 T 자식 제거
 *   <li>루트의 개발자 메시지(D) 제거
 *   <li>포기하고 초과된 인코딩 그대로 반환
 * </ol>
 *
 * <p>루트의 code, userMessage, sourceProcedure는 절대 제거되지 않습니다. 매 단계가 노드 또는 속성 수를 줄이므로 항상 종료됩니다.
 */
public final class ErrorTreeTruncator {

  private ErrorTreeTruncator() {}

  /**
   * 트리를 인코딩하고 필요하면 예산에 맞게 잘라냄
   *
   * @param node 루트 노드
   * @param budget 최대 문자 수
   * @param limited false면 잘라내지 않음
   * @return 인코딩 결과 (더 줄일 수 없으면 예산을 넘을 수 있음)
   */
  public static String fit(ErrorNode node, int budget, boolean limited) {
    String encoded = ErrorTreeCodec.encode(node);
    ErrorNode current = node;
    while (limited && encoded.length() > budget) {
      Optional<ErrorNode> reduced = reduceOnce(current);
      if (reduced.isEmpty()) {
        break;
      }
      current = reduced.get();
      encoded = ErrorTreeCodec.encode(current);
    }
    return encoded;
  }

  /**
   * 우선순위상 첫 번째 축소 한 단계
   *
   * @return 더 줄일 것이 없으면 empty
   */
  public static Optional<ErrorNode> reduceOnce(ErrorNode root) {
    Optional<ErrorNode> withoutAttachment = root.withoutLast(AttachmentNode.class);
    if (withoutAttachment.isPresent()) {
      return withoutAttachment;
    }

    Optional<ErrorNode> lastError = root.lastErrorChild();
    if (lastError.isPresent()) {
      Optional<ErrorNode> prunedChild = lastError.get().withoutLast(ErrorNode.class);
      if (prunedChild.isPresent()) {
        return root.replaceLastErrorChild(prunedChild.get());
      }
      return root.withoutLast(ErrorNode.class);
    }

    Optional<ErrorNode> withoutContext = root.withoutLast(ContextNode.class);
    if (withoutContext.isPresent()) {
      return withoutContext;
    }

    if (root.hasDeveloperMessage()) {
      return Optional.of(root.withoutDeveloperMessage());
    }
    return Optional.empty();
  }
}
