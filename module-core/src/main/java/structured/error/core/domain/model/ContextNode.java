package structured.error.core.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 진단 속성 노드 ({@code T} 요소)
 *
 * <p>속성 이름 → 값의 순서 보존 맵입니다. 값이 {@code null}인 속성은 보관하지 않습니다.
 *
 * <p>속성 이름은 인코딩 후에도 해석 가능해야 하므로 XML 이름 규칙을 벗어나는 문자는 {@code _}로 치환됩니다.
 */
public record ContextNode(Map<String, String> attributes) implements ErrorChild {

  public static final String ELEMENT = "T";

  public ContextNode {
    LinkedHashMap<String, String> copy = new LinkedHashMap<>();
    if (attributes != null) {
      attributes.forEach(
          (name, value) -> {
            if (name != null && !name.isBlank() && value != null) {
              copy.put(toXmlName(name.trim()), value);
            }
          });
    }
    attributes = Collections.unmodifiableMap(copy);
  }

  public static ContextNode empty() {
    return new ContextNode(Map.of());
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean isEmpty() {
    return attributes.isEmpty();
  }

  public String get(String name) {
    return attributes.get(name);
  }

  /** 주어진 이름(대소문자 무시)의 속성을 제거한 새 노드 */
  public ContextNode withoutIgnoreCase(Set<String> names) {
    Set<String> upper =
        names.stream().map(n -> n.toUpperCase(Locale.ROOT)).collect(Collectors.toSet());
    LinkedHashMap<String, String> kept = new LinkedHashMap<>();
    attributes.forEach(
        (name, value) -> {
          if (!upper.contains(name.toUpperCase(Locale.ROOT))) {
            kept.put(name, value);
          }
        });
    return new ContextNode(kept);
  }

  /** 속성을 추가(또는 덮어쓰기)한 새 노드 */
  public ContextNode with(String name, String value) {
    LinkedHashMap<String, String> copy = new LinkedHashMap<>(attributes);
    copy.put(name, value);
    return new ContextNode(copy);
  }

  static String toXmlName(String name) {
    StringBuilder sb = new StringBuilder(name.length());
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      boolean valid =
          Character.isLetter(c)
              || c == '_'
              || (i > 0 && (Character.isDigit(c) || c == '-' || c == '.'));
      sb.append(valid ? c : '_');
    }
    return sb.toString();
  }

  public static final class Builder {
    private final LinkedHashMap<String, String> attributes = new LinkedHashMap<>();

    private Builder() {}

    /** {@code null} 값은 무시 (속성 자체를 생략) */
    public Builder put(String name, Object value) {
      if (value != null) {
        attributes.put(name, String.valueOf(value));
      }
      return this;
    }

    public ContextNode build() {
      return new ContextNode(attributes);
    }
  }
}
