package structured.error.frame;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import structured.error.core.audit.AuditLifecycle;
import structured.error.core.catalog.ErrorLookup;
import structured.error.core.dispatch.FailureDispatcher;
import structured.error.core.domain.model.FailureSnapshot;
import structured.error.global.error.exception.StructuredErrorException;
import structured.error.global.filter.MDCFilter;

/**
 * 프레임 실행기
 *
 * <h3>실행 순서</h3>
 *
 * <ol>
 *   <li>감사 엔트리 시작 (입력 파라미터는 JSON)
 *   <li>{@link TransactionScope} 열기 (활성 트랜잭션이 없을 때만 소유)
 *   <li>본문 실행 → 소유자면 커밋 → 감사 엔트리 종료
 * </ol>
 *
 * <p>커밋 후 감사 종료가 실패해도 같은 실패 경로로 디스패치됩니다. 이때 트랜잭션은 이미 완료되어 롤백하지 않습니다.
 *
 * <h3>실패 시</h3>
 *
 * <ol>
 *   <li>롤백이 상태를 바꾸기 전에 {@link FailureSnapshot} 캡처
 *   <li>소유자면 롤백 (이미 완료된 트랜잭션은 건드리지 않음)
 *   <li>{@link FailureDispatcher}로 넘겨 구조화 에러로 재신호
 * </ol>
 *
 * <p>{@link Error}는 롤백만 하고 디스패치 없이 즉시 전파합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FrameExecutor {

  static final String METRIC_NAME = "structured.frame";

  private final InMemoryProcedureRegistry procedureRegistry;
  private final AuditLifecycle auditLifecycle;
  private final FailureDispatcher dispatcher;
  private final ErrorLookup errorLookup;
  private final PlatformTransactionManager transactionManager;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  /**
   * 프레임 실행
   *
   * @param frame 프레임 선언
   * @param inputParams 감사 로그에 남길 입력 파라미터 (nullable)
   * @param task 프레임 본문
   * @return 본문 결과
   * @throws StructuredErrorException 본문 실패가 디스패치된 경우
   */
  public <T> T execute(FrameDefinition frame, Map<String, ?> inputParams, FrameTask<T> task) {
    Objects.requireNonNull(frame, "frame must not be null");
    Objects.requireNonNull(task, "task must not be null");

    boolean sessionOwner = openSession();
    try {
      return run(frame, inputParams, task);
    } finally {
      closeSession(sessionOwner);
    }
  }

  /** 입력 파라미터 없이 실행 */
  public <T> T execute(FrameDefinition frame, FrameTask<T> task) {
    return execute(frame, null, task);
  }

  private <T> T run(FrameDefinition frame, Map<String, ?> inputParams, FrameTask<T> task) {
    int procId = procedureRegistry.register(frame.name());
    Timer.Sample sample = Timer.start(meterRegistry);
    Long auditId = null;
    TransactionScope scope = null;
    T result;
    try {
      auditId = auditLifecycle.begin(procId, frame.readOnly(), toJson(inputParams)).orElse(null);
      scope = TransactionScope.open(transactionManager, frame.name(), frame.readOnly());
      result = task.run(new FrameContext(frame.name(), procId, errorLookup));
      scope.commitIfOwner();
      auditLifecycle.end(auditId, toJson(result));
    } catch (Error e) {
      rollbackQuietly(scope, e);
      stop(sample, frame, "error");
      throw e;
    } catch (Exception e) {
      FailureSnapshot snapshot = FailureSnapshot.capture(e, frame.name());
      rollbackQuietly(scope, e);
      if (!(e instanceof StructuredErrorException)) {
        log.warn("[FrameExecutor] {} failed: {}", frame.name(), e.toString(), e);
      }
      stop(sample, frame, "failure");
      throw dispatch(procId, auditId, snapshot, e);
    }

    stop(sample, frame, "success");
    return result;
  }

  private RuntimeException dispatch(
      int procId, Long auditId, FailureSnapshot snapshot, Exception failure) {
    try {
      return dispatcher.handleFailure(procId, auditId, snapshot);
    } catch (StructuredErrorException signal) {
      return signal;
    } catch (RuntimeException dispatchFailure) {
      // 디스패치 자체가 실패하면 원본을 suppressed로 보존
      safeAddSuppressed(dispatchFailure, failure);
      return dispatchFailure;
    }
  }

  private void rollbackQuietly(TransactionScope scope, Throwable primary) {
    if (scope == null) {
      return;
    }
    try {
      scope.rollbackIfOwner();
    } catch (RuntimeException rollbackFailure) {
      log.warn("[FrameExecutor] Rollback failed: {}", rollbackFailure.toString());
      safeAddSuppressed(primary, rollbackFailure);
    }
  }

  private String toJson(Object value) {
    if (value == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      log.debug("[FrameExecutor] Audit payload not serializable: {}", value.getClass().getName());
      return String.valueOf(value);
    }
  }

  private void stop(Timer.Sample sample, FrameDefinition frame, String outcome) {
    sample.stop(
        Timer.builder(METRIC_NAME)
            .tag("procedure", frame.name())
            .tag("result", outcome)
            .register(meterRegistry));
  }

  /** 호출 체인 최상위 프레임이 세션 id를 만든다 (HTTP 요청은 MDCFilter가 이미 설정) */
  private static boolean openSession() {
    if (MDC.get(MDCFilter.REQUEST_ID_KEY) != null) {
      return false;
    }
    MDC.put(MDCFilter.REQUEST_ID_KEY, UUID.randomUUID().toString());
    return true;
  }

  private static void closeSession(boolean owner) {
    if (owner) {
      MDC.remove(MDCFilter.REQUEST_ID_KEY);
    }
  }

  private static void safeAddSuppressed(Throwable primary, Throwable suppressed) {
    if (primary != suppressed && suppressed != null) {
      primary.addSuppressed(suppressed);
    }
  }
}
