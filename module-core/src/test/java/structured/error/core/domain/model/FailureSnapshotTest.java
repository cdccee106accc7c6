package structured.error.core.domain.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.SQLException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import structured.error.global.error.exception.StructuredErrorException;

@DisplayName("FailureSnapshot.capture")
class FailureSnapshotTest {

  @Test
  @DisplayName("구조화 신호는 신호 속성을 그대로 캡처")
  void structuredSignal() {
    StructuredErrorException signal =
        new StructuredErrorException("<E N=\"1\" M=\"m\"/>", 50000, 11, 3, "Inner", 42);

    FailureSnapshot snapshot = FailureSnapshot.capture(signal, "Outer");

    assertThat(snapshot)
        .isEqualTo(
            new FailureSnapshot(
                50000, "<E N=\"1\" M=\"m\"/>", "Inner", 42, 11, 3, List.of()));
  }

  @Test
  @DisplayName("원인 체인의 SQLException 벤더 코드 사용")
  void sqlExceptionInCauseChain() {
    SQLException sql = new SQLException("duplicate", "23000", 2601);

    FailureSnapshot snapshot =
        FailureSnapshot.capture(new RuntimeException(new IllegalStateException(sql)), "Outer");

    assertThat(snapshot.errorNumber()).isEqualTo(2601);
    assertThat(snapshot.message()).isEqualTo("duplicate");
    assertThat(snapshot.procedure()).isEqualTo("Outer");
    assertThat(snapshot.severity()).isEqualTo(StructuredErrorException.DEFAULT_SEVERITY);
  }

  @Test
  @DisplayName("그 외 예외는 번호 0, 메시지가 없으면 클래스 이름")
  void otherFailure() {
    FailureSnapshot snapshot = FailureSnapshot.capture(new NullPointerException(), null);

    assertThat(snapshot.errorNumber()).isZero();
    assertThat(snapshot.message()).isEqualTo(NullPointerException.class.getName());
    assertThat(snapshot.procedure()).isEmpty();
    assertThat(snapshot.line()).isPositive();
  }
}
