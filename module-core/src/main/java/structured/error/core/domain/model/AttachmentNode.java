package structured.error.core.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@code T}/{@code E}가 아닌 임의 자식 요소
 *
 * <p>외부 생산자가 덧붙인 부가 정보를 해석 과정에서 잃지 않기 위해 보존합니다. 잘라내기 1순위 제거 대상입니다.
 *
 * @param name 요소 이름
 * @param attributes 속성 (순서 보존)
 * @param text 텍스트 내용 (없으면 {@code null})
 * @param children 하위 요소
 */
public record AttachmentNode(
    String name, Map<String, String> attributes, String text, List<AttachmentNode> children)
    implements ErrorChild {

  public AttachmentNode {
    Objects.requireNonNull(name, "name");
    attributes =
        Collections.unmodifiableMap(
            attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes));
    children = children == null ? List.of() : List.copyOf(children);
    if (text != null && text.isEmpty()) {
      text = null;
    }
  }

  public static AttachmentNode of(String name, Map<String, String> attributes) {
    return new AttachmentNode(name, attributes, null, List.of());
  }
}
