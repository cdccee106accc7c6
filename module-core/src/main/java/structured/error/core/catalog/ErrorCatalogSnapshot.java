package structured.error.core.catalog;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import structured.error.core.domain.model.ErrorDefinition;
import structured.error.core.port.out.ErrorCatalog;

/**
 * 불변 카탈로그 스냅샷
 *
 * <p>(ownerProcedure, errorName) 키로 색인된 읽기 전용 맵입니다. 인프라 어댑터가 주기적으로 새 스냅샷을 만들어 교체합니다.
 */
public final class ErrorCatalogSnapshot implements ErrorCatalog {

  private final Map<Key, ErrorDefinition> definitions;
  private final Map<Integer, ErrorDefinition> definitionsById;

  private ErrorCatalogSnapshot(
      Map<Key, ErrorDefinition> definitions, Map<Integer, ErrorDefinition> definitionsById) {
    this.definitions = Map.copyOf(definitions);
    this.definitionsById = Map.copyOf(definitionsById);
  }

  /**
   * 정의 목록으로 스냅샷 생성
   *
   * @throws IllegalArgumentException (ownerProcedure, errorName) 또는 errorId가 중복된 경우
   */
  public static ErrorCatalogSnapshot of(Collection<ErrorDefinition> definitions) {
    Map<Key, ErrorDefinition> byKey = new HashMap<>();
    Map<Integer, ErrorDefinition> byId = new HashMap<>();
    for (ErrorDefinition definition : definitions) {
      Key key = new Key(definition.ownerProcedure(), definition.errorName());
      if (byKey.putIfAbsent(key, definition) != null) {
        throw new IllegalArgumentException("Duplicate error definition: " + key);
      }
      if (byId.putIfAbsent(definition.errorId(), definition) != null) {
        throw new IllegalArgumentException("Duplicate errorId: " + definition.errorId());
      }
    }
    return new ErrorCatalogSnapshot(byKey, byId);
  }

  public static ErrorCatalogSnapshot empty() {
    return new ErrorCatalogSnapshot(Map.of(), Map.of());
  }

  @Override
  public Optional<ErrorDefinition> find(String ownerProcedure, String errorName) {
    if (ownerProcedure == null || errorName == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(definitions.get(new Key(ownerProcedure, errorName)));
  }

  /** 에러 노드의 N(code)로 원래 정의 역조회 */
  public Optional<ErrorDefinition> findById(int errorId) {
    return Optional.ofNullable(definitionsById.get(errorId));
  }

  public int size() {
    return definitions.size();
  }

  private record Key(String ownerProcedure, String errorName) {}
}
