package structured.error.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;
import structured.error.core.domain.model.AttachmentNode;
import structured.error.core.domain.model.ContextNode;
import structured.error.core.domain.model.ErrorChild;
import structured.error.core.domain.model.ErrorNode;

/**
 * 해석된 에러 트리 (디버깅용)
 *
 * <p>자식은 {@code type}(E, T, 또는 첨부 요소 이름)으로 구분합니다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorTreeResponse(
    String type,
    Integer code,
    String userMessage,
    String developerMessage,
    String procedure,
    String line,
    Map<String, String> attributes,
    String text,
    List<ErrorTreeResponse> children) {

  public static ErrorTreeResponse from(ErrorNode node) {
    return new ErrorTreeResponse(
        ErrorNode.ELEMENT,
        node.code(),
        node.userMessage(),
        node.developerMessage(),
        node.sourceProcedure(),
        node.sourceLine(),
        null,
        null,
        node.children().stream().map(ErrorTreeResponse::fromChild).toList());
  }

  private static ErrorTreeResponse fromChild(ErrorChild child) {
    if (child instanceof ErrorNode error) {
      return from(error);
    }
    if (child instanceof ContextNode context) {
      return new ErrorTreeResponse(
          ContextNode.ELEMENT, null, null, null, null, null, context.attributes(), null, null);
    }
    return fromAttachment((AttachmentNode) child);
  }

  private static ErrorTreeResponse fromAttachment(AttachmentNode node) {
    return new ErrorTreeResponse(
        node.name(),
        null,
        null,
        null,
        null,
        null,
        node.attributes(),
        node.text(),
        node.children().stream().map(ErrorTreeResponse::fromAttachment).toList());
  }
}
