package structured.error.core.audit;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Period;
import java.time.format.DateTimeParseException;
import lombok.extern.slf4j.Slf4j;
import structured.error.core.port.out.ParameterPort;

/**
 * 감사 로그 보존 기간 계산
 *
 * <p>cutoff = 오늘 0시(UTC) - {@code PurgePeriod} (ISO-8601 기간, 기본 {@code P1W}). 값이 없거나 해석할 수 없으면 기본값을
 * 사용합니다.
 */
@Slf4j
public class AuditRetentionPolicy {

  public static final Period DEFAULT_PERIOD = Period.ofWeeks(1);

  private final ParameterPort parameterPort;
  private final Clock clock;

  public AuditRetentionPolicy(ParameterPort parameterPort, Clock clock) {
    this.parameterPort = parameterPort;
    this.clock = clock;
  }

  public LocalDateTime cutoff() {
    return LocalDate.now(clock).atStartOfDay().minus(period());
  }

  Period period() {
    return parameterPort
        .findValue(ParameterPort.PURGE_PERIOD)
        .map(AuditRetentionPolicy::parse)
        .orElse(DEFAULT_PERIOD);
  }

  private static Period parse(String value) {
    try {
      Period period = Period.parse(value.trim());
      if (period.isNegative() || period.isZero()) {
        log.warn("[AuditRetentionPolicy] Non-positive PurgePeriod '{}', using {}", value, DEFAULT_PERIOD);
        return DEFAULT_PERIOD;
      }
      return period;
    } catch (DateTimeParseException e) {
      log.warn("[AuditRetentionPolicy] Invalid PurgePeriod '{}', using {}", value, DEFAULT_PERIOD);
      return DEFAULT_PERIOD;
    }
  }
}
