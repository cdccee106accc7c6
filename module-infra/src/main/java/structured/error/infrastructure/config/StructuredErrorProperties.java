package structured.error.infrastructure.config;

import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import structured.error.core.domain.model.HostFailureKind;
import structured.error.core.domain.model.PropagationSettings;

/**
 * 에러 전파 엔진 설정
 *
 * <h2>설정</h2>
 *
 * <pre>{@code
 * structured-error:
 *   max-message-length: 2047
 *   handler-name: ErrorHandler
 *   user-defined-threshold: 50000
 *   host-failure-codes:
 *     "[2601]": INDEX_VIOLATION
 *     "[1205]": DEADLOCK
 *   catalog:
 *     refresh-after: PT5M
 *   host:
 *     server-name: localhost
 *     database-name: structured_error
 * }</pre>
 *
 * <p>host-failure-codes를 생략하면 2601(IndexViolation), 1205(Deadlock)가 기본값입니다.
 */
@ConfigurationProperties(prefix = "structured-error")
public record StructuredErrorProperties(
    @DefaultValue("2047") int maxMessageLength,
    @DefaultValue("ErrorHandler") String handlerName,
    @DefaultValue("50000") int userDefinedThreshold,
    Map<Integer, HostFailureKind> hostFailureCodes,
    @DefaultValue Catalog catalog,
    @DefaultValue Host host) {

  public StructuredErrorProperties {
    if (maxMessageLength <= 0) {
      throw new IllegalArgumentException(
          "structured-error.max-message-length must be positive, got: " + maxMessageLength);
    }
    if (handlerName == null || handlerName.isBlank()) {
      throw new IllegalArgumentException("structured-error.handler-name must not be blank");
    }
    if (hostFailureCodes == null || hostFailureCodes.isEmpty()) {
      hostFailureCodes = PropagationSettings.defaults().hostFailureCodes();
    }
  }

  public PropagationSettings toSettings() {
    return new PropagationSettings(
        maxMessageLength, handlerName, userDefinedThreshold, hostFailureCodes);
  }

  /** @param refreshAfter 카탈로그 스냅샷 재적재 주기 */
  public record Catalog(@DefaultValue("PT5M") Duration refreshAfter) {

    public Catalog {
      if (refreshAfter == null || refreshAfter.isNegative() || refreshAfter.isZero()) {
        throw new IllegalArgumentException(
            "structured-error.catalog.refresh-after must be positive, got: " + refreshAfter);
      }
    }
  }

  /** 에러 컨텍스트에 기록되는 서버/DB 이름 */
  public record Host(
      @DefaultValue("localhost") String serverName,
      @DefaultValue("structured_error") String databaseName) {}
}
