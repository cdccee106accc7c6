package structured.error.global.host;

import org.slf4j.MDC;
import structured.error.core.port.out.HostEnvironment;
import structured.error.global.filter.MDCFilter;
import structured.error.infrastructure.config.StructuredErrorProperties;

/**
 * 설정 기반 호스트 정보
 *
 * <p>서버/DB 이름은 {@code structured-error.host.*}에서, 세션 id는 현재 호출 체인의 MDC requestId에서 읽습니다.
 */
public class ConfiguredHostEnvironment implements HostEnvironment {

  private static final String NO_SESSION = "-";

  private final StructuredErrorProperties.Host host;

  public ConfiguredHostEnvironment(StructuredErrorProperties.Host host) {
    this.host = host;
  }

  @Override
  public String serverName() {
    return host.serverName();
  }

  @Override
  public String databaseName() {
    return host.databaseName();
  }

  @Override
  public String sessionId() {
    String requestId = MDC.get(MDCFilter.REQUEST_ID_KEY);
    return requestId != null ? requestId : NO_SESSION;
  }
}
