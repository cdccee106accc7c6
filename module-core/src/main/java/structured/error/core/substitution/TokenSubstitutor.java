package structured.error.core.substitution;

import java.util.Map;
import structured.error.core.domain.model.TokenSet;

/**
 * 메시지 템플릿의 {@code #name#} 자리표시자 치환
 *
 * <ul>
 *   <li>토큰 값이 {@code null}이면 빈 문자열로 치환
 *   <li>일치하는 자리표시자가 없는 토큰은 무시
 *   <li>일치하는 토큰이 없는 자리표시자는 그대로 남김 (에러 아님)
 * </ul>
 *
 * <p>{@code #ChildMessage#}는 일반 치환 이후 {@link #substituteChildMessage}로 별도 해석됩니다.
 */
public final class TokenSubstitutor {

  public static final String CHILD_MESSAGE = "ChildMessage";
  public static final String CHILD_MESSAGE_PLACEHOLDER = placeholder(CHILD_MESSAGE);

  private TokenSubstitutor() {}

  public static String substitute(String template, TokenSet tokens) {
    return substitute(template, tokens.asMap());
  }

  public static String substitute(String template, Map<String, String> tokens) {
    if (template == null || template.indexOf('#') < 0) {
      return template;
    }
    String result = template;
    for (Map.Entry<String, String> token : tokens.entrySet()) {
      String value = token.getValue() == null ? "" : token.getValue();
      result = result.replace(placeholder(token.getKey()), value);
    }
    return result;
  }

  public static boolean hasChildMessage(String template) {
    return template != null && template.contains(CHILD_MESSAGE_PLACEHOLDER);
  }

  /** {@code #ChildMessage#}를 주어진 값(null이면 빈 문자열)으로 치환 */
  public static String substituteChildMessage(String template, String childMessage) {
    if (template == null) {
      return null;
    }
    return template.replace(CHILD_MESSAGE_PLACEHOLDER, childMessage == null ? "" : childMessage);
  }

  public static String placeholder(String name) {
    return "#" + name + "#";
  }
}
