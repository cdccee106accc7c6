package structured.error.frame;

import java.util.Objects;

/**
 * 프레임 선언
 *
 * @param name 프로시저 이름 (카탈로그 소유자 이름과 같아야 함)
 * @param readOnly 읽기 전용 여부. 감사 파라미터({@code AuditReadLog}/{@code AuditWriteLog}) 선택과 트랜잭션
 *     readOnly 힌트에 사용
 */
public record FrameDefinition(String name, boolean readOnly) {

  public FrameDefinition {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("frame name must not be blank");
    }
  }

  public static FrameDefinition read(String name) {
    return new FrameDefinition(name, true);
  }

  public static FrameDefinition write(String name) {
    return new FrameDefinition(name, false);
  }
}
