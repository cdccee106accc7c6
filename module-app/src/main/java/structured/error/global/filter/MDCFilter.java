package structured.error.global.filter;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * 로그 추적용 MDC 필터
 *
 * <h4>MDC 키</h4>
 *
 * <ul>
 *   <li>{@link #REQUEST_ID_KEY}: 요청 추적용 Correlation ID. 에러 컨텍스트의 {@code SPID}로도 기록됨
 * </ul>
 */
@Component
public class MDCFilter implements Filter {

  /** HTTP 헤더 이름: X-Correlation-ID */
  public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

  /** MDC 키: requestId */
  public static final String REQUEST_ID_KEY = "requestId";

  @Override
  public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
      throws IOException, ServletException {
    String correlationId = resolveCorrelationId((HttpServletRequest) request);
    MDC.put(REQUEST_ID_KEY, correlationId);
    ((HttpServletResponse) response).setHeader(CORRELATION_ID_HEADER, correlationId);
    try {
      chain.doFilter(request, response);
    } finally {
      MDC.remove(REQUEST_ID_KEY);
    }
  }

  /** 외부 헤더 확인 후 없으면 생성 */
  private String resolveCorrelationId(HttpServletRequest request) {
    String id = request.getHeader(CORRELATION_ID_HEADER);
    return (id == null || id.isBlank()) ? UUID.randomUUID().toString() : id;
  }
}
