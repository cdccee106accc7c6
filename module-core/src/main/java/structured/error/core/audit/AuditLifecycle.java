package structured.error.core.audit;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import structured.error.core.port.out.AuditLogPort;
import structured.error.core.port.out.ParameterPort;
import structured.error.core.port.out.ProcedureRegistry;
import structured.error.core.util.TruthyValues;

/**
 * 프레임 감사 엔트리 생명주기
 *
 * <h3>상태 전이</h3>
 *
 * <pre>
 * (없음) --begin--> open --end--> closed-normal
 *                        --fail-> closed-failed
 * </pre>
 *
 * <ul>
 *   <li>읽기 전용 프레임은 {@code AuditReadLog}, 쓰기 프레임은 {@code AuditWriteLog} 파라미터가 참일 때만 엔트리 생성
 *   <li>id가 없으면 end/fail은 저장소 호출 없이 무시
 *   <li>이미 닫힌 엔트리를 다시 닫으려 하면 저장소가 거부하고 WARN 로그만 남김
 * </ul>
 *
 * <p>시각은 UTC 기준 {@link Clock}에서 얻습니다.
 */
@Slf4j
public class AuditLifecycle {

  private final AuditLogPort auditLogPort;
  private final ParameterPort parameterPort;
  private final ProcedureRegistry procedureRegistry;
  private final Clock clock;

  public AuditLifecycle(
      AuditLogPort auditLogPort,
      ParameterPort parameterPort,
      ProcedureRegistry procedureRegistry,
      Clock clock) {
    this.auditLogPort = auditLogPort;
    this.parameterPort = parameterPort;
    this.procedureRegistry = procedureRegistry;
    this.clock = clock;
  }

  /**
   * 감사 엔트리 시작
   *
   * @param callerProcId 호출 프레임 식별자
   * @param readOnly 읽기 전용 프레임 여부 (적용할 파라미터 선택)
   * @param inputData 입력 파라미터 직렬화 값 (nullable)
   * @return 생성된 id, 감사가 꺼져 있으면 empty
   */
  public Optional<Long> begin(int callerProcId, boolean readOnly, String inputData) {
    String flag = readOnly ? ParameterPort.AUDIT_READ_LOG : ParameterPort.AUDIT_WRITE_LOG;
    if (!isEnabled(flag)) {
      return Optional.empty();
    }
    String procedureName =
        procedureRegistry.findName(callerProcId).orElse(Integer.toString(callerProcId));
    long id = auditLogPort.insert(procedureName, inputData, now());
    log.debug("[AuditLifecycle] Begin: id={}, procedure={}", id, procedureName);
    return Optional.of(id);
  }

  /** 정상 종료 (출력 없음) */
  public void end(Long auditId) {
    end(auditId, null);
  }

  /** 정상 종료 */
  public void end(Long auditId, String outputData) {
    if (auditId == null) {
      return;
    }
    if (!auditLogPort.complete(auditId, outputData, now())) {
      log.warn("[AuditLifecycle] Entry already closed or missing: id={}", auditId);
    }
  }

  /** 실패 종료, 인코딩된 에러 트리를 함께 저장 */
  public void fail(Long auditId, String encodedTree) {
    if (auditId == null) {
      return;
    }
    if (!auditLogPort.fail(auditId, encodedTree, now())) {
      log.warn("[AuditLifecycle] Entry already closed or missing: id={}", auditId);
    }
  }

  private boolean isEnabled(String parameterName) {
    return parameterPort.findValue(parameterName).map(TruthyValues::isTruthy).orElse(false);
  }

  private LocalDateTime now() {
    return LocalDateTime.now(clock);
  }
}
