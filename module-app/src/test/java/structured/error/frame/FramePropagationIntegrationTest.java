package structured.error.frame;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import structured.error.core.codec.ErrorTreeCodec;
import structured.error.core.domain.model.ContextNode;
import structured.error.core.domain.model.ErrorNode;
import structured.error.global.error.exception.StructuredErrorException;

@SpringBootTest
class FramePropagationIntegrationTest {

  private static final String MARKER = "FramePropagationMarker";
  private static final FrameDefinition OUTER = FrameDefinition.write("Outer");
  private static final FrameDefinition INNER = FrameDefinition.write("Inner");

  @Autowired private FrameExecutor frameExecutor;
  @Autowired private JdbcTemplate jdbcTemplate;
  @Autowired private MeterRegistry meterRegistry;

  @AfterEach
  void tearDown() {
    jdbcTemplate.update("DELETE FROM parameters WHERE parameter_name = ?", MARKER);
  }

  private void insertMarker() {
    jdbcTemplate.update(
        "INSERT INTO parameters (parameter_name, parameter_value) VALUES (?, 'x')", MARKER);
  }

  private int markerCount() {
    return jdbcTemplate.queryForObject(
        "SELECT COUNT(*) FROM parameters WHERE parameter_name = ?", Integer.class, MARKER);
  }

  private double dispatchCount(String classification, String procedure) {
    Counter counter =
        meterRegistry
            .find("structured.error.dispatch")
            .tag("classification", classification)
            .tag("procedure", procedure)
            .counter();
    return counter == null ? 0 : counter.count();
  }

  @Test
  @DisplayName("중첩 프레임 실패는 재진입 경로로 호출자 컨텍스트만 덧붙여 올라온다")
  void nestedFailure_reentry() {
    double before = dispatchCount("REENTRY", "Outer");

    StructuredErrorException thrown =
        catchThrowableOfType(
            () ->
                frameExecutor.execute(
                    OUTER,
                    outer ->
                        frameExecutor.execute(
                            INNER, inner -> inner.signal("MissingDefinition"))),
            StructuredErrorException.class);

    ErrorNode root = ErrorTreeCodec.decode(thrown.getMessage());
    List<ContextNode> contexts = root.contextChildren();
    assertThat(root.code()).isEqualTo(1000);
    assertThat(contexts).extracting(node -> node.get("ThrownBy")).contains("Inner");
    assertThat(contexts.get(contexts.size() - 1).get("CalledBy")).isEqualTo("Outer");
    assertThat(thrown.getProcedure()).isEqualTo("ErrorHandler");
    assertThat(dispatchCount("REENTRY", "Outer")).isEqualTo(before + 1);
  }

  @Test
  @DisplayName("안쪽 프레임이 실패하면 바깥 프레임이 연 트랜잭션의 쓰기도 롤백된다")
  void nestedFailure_rollsBackOuterWrite() {
    catchThrowableOfType(
        () ->
            frameExecutor.execute(
                OUTER,
                outer -> {
                  insertMarker();
                  return frameExecutor.execute(INNER, inner -> inner.signal("MissingDefinition"));
                }),
        StructuredErrorException.class);

    assertThat(markerCount()).isZero();
  }

  @Test
  @DisplayName("성공한 프레임의 쓰기는 커밋된다")
  void success_commits() {
    Integer result =
        frameExecutor.execute(
            OUTER,
            outer -> {
              insertMarker();
              return 1;
            });

    assertThat(result).isEqualTo(1);
    assertThat(markerCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("드라이버의 중복 키 에러 번호가 매핑되어 있으면 IndexViolation(1002)으로 바뀐다")
  void duplicateKey_knownHostFailure() {
    insertMarker();

    StructuredErrorException thrown =
        catchThrowableOfType(
            () ->
                frameExecutor.execute(
                    OUTER,
                    outer -> {
                      insertMarker();
                      return null;
                    }),
            StructuredErrorException.class);

    ErrorNode root = ErrorTreeCodec.decode(thrown.getMessage());
    ContextNode context = root.contextChildren().get(0);
    assertThat(root.code()).isEqualTo(1002);
    assertThat(root.sourceProcedure()).isEqualTo("ErrorHandler");
    assertThat(context.get("ErrorNumber")).isEqualTo("23505");
    assertThat(context.get("ThrownBy")).isEqualTo("Outer");
    assertThat(markerCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("매핑되지 않은 DB 에러 번호는 UnknownSystemError(1001)로 바뀐다")
  void notNullViolation_unknownHostFailure() {
    StructuredErrorException thrown =
        catchThrowableOfType(
            () ->
                frameExecutor.execute(
                    OUTER,
                    outer ->
                        jdbcTemplate.update(
                            "INSERT INTO parameters (parameter_name, parameter_value)"
                                + " VALUES (NULL, 'x')")),
            StructuredErrorException.class);

    ErrorNode root = ErrorTreeCodec.decode(thrown.getMessage());
    assertThat(root.code()).isEqualTo(1001);
    assertThat(root.userMessage()).startsWith("Unknown SQL Server error on server test-server");
    assertThat(root.contextChildren().get(0).get("ErrorNumber")).isEqualTo("23502");
    assertThat(root.contextChildren().get(0).get("ThrownBy")).isEqualTo("Outer");
  }
}
