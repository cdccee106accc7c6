package structured.error.core.util;

/**
 * 설정 값의 참/거짓 판정
 *
 * <p>대소문자 무시, 첫 글자가 {@code y}, {@code t}, {@code 1} 중 하나면 참입니다 ("yes", "True", "1" 등).
 */
public final class TruthyValues {

  private TruthyValues() {}

  public static boolean isTruthy(String value) {
    if (value == null || value.isEmpty()) {
      return false;
    }
    char first = Character.toLowerCase(value.charAt(0));
    return first == 'y' || first == 't' || first == '1';
  }
}
