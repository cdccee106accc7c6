package structured.error.core.audit;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import structured.error.core.port.out.ParameterPort;

@DisplayName("AuditRetentionPolicy")
class AuditRetentionPolicyTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-03-11T17:45:00Z"), ZoneOffset.UTC);

  private static AuditRetentionPolicy policy(String purgePeriod) {
    ParameterPort parameters =
        name ->
            ParameterPort.PURGE_PERIOD.equals(name) ? Optional.ofNullable(purgePeriod) : Optional.empty();
    return new AuditRetentionPolicy(parameters, CLOCK);
  }

  @Test
  @DisplayName("기본 보존 기간은 오늘 0시 기준 1주")
  void defaultPeriod() {
    assertThat(policy(null).cutoff()).isEqualTo(LocalDateTime.of(2026, 3, 4, 0, 0));
  }

  @Test
  @DisplayName("ISO-8601 기간 파라미터 적용")
  void configuredPeriod() {
    assertThat(policy("P1M").cutoff()).isEqualTo(LocalDateTime.of(2026, 2, 11, 0, 0));
    assertThat(policy("P3D").cutoff()).isEqualTo(LocalDateTime.of(2026, 3, 8, 0, 0));
  }

  @Test
  @DisplayName("해석할 수 없거나 0 이하인 값은 기본값")
  void invalidPeriod() {
    assertThat(policy("<TimeSpan Week=\"1\"/>").cutoff())
        .isEqualTo(LocalDateTime.of(2026, 3, 4, 0, 0));
    assertThat(policy("P0D").cutoff()).isEqualTo(LocalDateTime.of(2026, 3, 4, 0, 0));
  }
}
