package structured.error.core.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 메시지 치환용 토큰 집합
 *
 * <p>이름은 대소문자를 구분하며 같은 이름을 두 번 넣으면 마지막 값이 남습니다. 한 번의 실패 처리 동안만 사용되는 지역 객체입니다.
 */
public final class TokenSet {

  private final LinkedHashMap<String, String> tokens = new LinkedHashMap<>();

  public static TokenSet of(Map<String, String> values) {
    TokenSet set = new TokenSet();
    values.forEach(set::put);
    return set;
  }

  public TokenSet put(String name, String value) {
    tokens.put(name, value);
    return this;
  }

  public TokenSet putIfAbsent(String name, String value) {
    tokens.putIfAbsent(name, value);
    return this;
  }

  public String get(String name) {
    return tokens.get(name);
  }

  public boolean contains(String name) {
    return tokens.containsKey(name);
  }

  /** 예약 키 조회용 (PROCID, LINE, LimitLength) */
  public Optional<String> findIgnoreCase(String name) {
    String upper = name.toUpperCase(Locale.ROOT);
    return tokens.entrySet().stream()
        .filter(e -> e.getKey().toUpperCase(Locale.ROOT).equals(upper))
        .map(Map.Entry::getValue)
        .findFirst();
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(tokens);
  }

  public int size() {
    return tokens.size();
  }
}
