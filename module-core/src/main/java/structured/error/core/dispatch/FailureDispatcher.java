package structured.error.core.dispatch;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import structured.error.core.audit.AuditLifecycle;
import structured.error.core.catalog.ErrorLookup;
import structured.error.core.codec.ErrorTreeCodec;
import structured.error.core.domain.model.ContextNode;
import structured.error.core.domain.model.ErrorChild;
import structured.error.core.domain.model.ErrorNode;
import structured.error.core.domain.model.FailureClassification;
import structured.error.core.domain.model.FailureSnapshot;
import structured.error.core.domain.model.HostFailureKind;
import structured.error.core.domain.model.PropagationSettings;
import structured.error.core.port.out.DispatchObserver;
import structured.error.core.port.out.ErrorCatalog;
import structured.error.core.port.out.HostEnvironment;
import structured.error.core.port.out.ParameterPort;
import structured.error.core.port.out.ProcedureRegistry;
import structured.error.core.tree.ErrorTreeComposer;
import structured.error.core.truncation.ErrorTreeTruncator;
import structured.error.core.util.TruthyValues;
import structured.error.global.error.exception.StructuredErrorException;

/**
 * 프레임 실패 전파 디스패처
 *
 * <p>프레임마다 실패 시 한 번 호출되며, 아래 순서로 첫 번째로 일치하는 경로를 따릅니다.
 *
 * <ol>
 *   <li><b>REENTRY</b>: 실패 발생 프로시저가 디스패처 자신 → 기존 트리 뒤에 호출자 컨텍스트만 추가
 *   <li><b>USER_DEFINED</b>: 에러 번호가 임계값(50000) 이상 → 기존 트리 앞에 호출자/발생 위치 컨텍스트 추가
 *   <li><b>KNOWN_HOST_FAILURE</b>: 알려진 저수준 실패 번호 → 해당 카탈로그 에러로 새 트리 생성
 *   <li><b>UNKNOWN_HOST_FAILURE</b>: 그 외 → {@code UnknownSystemError}로 새 트리 생성
 * </ol>
 *
 * <p>모든 경로는 감사 엔트리를 최대 한 번 갱신하고 정확히 한 번 재신호합니다. 정상 반환 경로는 없습니다.
 */
@Slf4j
@RequiredArgsConstructor
public class FailureDispatcher {

  public static final String UNKNOWN_SYSTEM_ERROR = "UnknownSystemError";

  private final ErrorLookup errorLookup;
  private final ErrorTreeComposer composer;
  private final ErrorCatalog catalog;
  private final AuditLifecycle auditLifecycle;
  private final ParameterPort parameterPort;
  private final ProcedureRegistry procedureRegistry;
  private final HostEnvironment hostEnvironment;
  private final DispatchObserver observer;
  private final PropagationSettings settings;

  /**
   * 포착한 예외를 그대로 전파 처리
   *
   * <p>롤백 등으로 원본 상태가 바뀔 수 있다면 먼저 {@link FailureSnapshot#capture}로 캡처한 뒤 스냅샷 오버로드를 사용하세요.
   */
  public StructuredErrorException handleFailure(int callerProcId, Long auditId, Throwable failure) {
    String callerName = callerName(callerProcId);
    throw handleFailure(callerProcId, auditId, FailureSnapshot.capture(failure, callerName));
  }

  /**
   * 캡처된 실패 상태를 전파 처리
   *
   * <p>항상 {@link StructuredErrorException}을 던집니다. 반환 타입은 호출 측에서 {@code throw
   * dispatcher.handleFailure(...)} 형태로 쓸 수 있게 하기 위한 것입니다.
   *
   * @param callerProcId 처리 중인 프레임 식별자
   * @param auditId 갱신할 감사 엔트리 (nullable)
   * @param snapshot 실패 상태
   */
  public StructuredErrorException handleFailure(
      int callerProcId, Long auditId, FailureSnapshot snapshot) {
    String callerName = callerName(callerProcId);
    FailureClassification classification = classify(snapshot, settings);

    if (isDebugMode()) {
      logBreakdown(callerProcId, callerName, snapshot, classification);
    }
    observer.onDispatch(classification, callerName);

    String message =
        switch (classification) {
          case REENTRY -> rewrap(auditId, reentryTree(callerName, snapshot));
          case USER_DEFINED -> rewrap(auditId, userDefinedTree(callerName, snapshot));
          case KNOWN_HOST_FAILURE -> lookupHostFailure(
              callerProcId, callerName, auditId, snapshot, hostFailureName(snapshot));
          case UNKNOWN_HOST_FAILURE -> lookupHostFailure(
              callerProcId, callerName, auditId, snapshot, UNKNOWN_SYSTEM_ERROR);
        };

    throw new StructuredErrorException(
        message,
        StructuredErrorException.USER_DEFINED_ERROR_NUMBER,
        snapshot.severity(),
        snapshot.state(),
        settings.handlerName(),
        snapshot.line());
  }

  /** 스냅샷 분류 (첫 번째 일치 규칙) */
  public static FailureClassification classify(
      FailureSnapshot snapshot, PropagationSettings settings) {
    if (settings.handlerName().equals(snapshot.procedure())) {
      return FailureClassification.REENTRY;
    }
    if (snapshot.errorNumber() >= settings.userDefinedThreshold()) {
      return FailureClassification.USER_DEFINED;
    }
    if (settings.hostFailureCodes().containsKey(snapshot.errorNumber())) {
      return FailureClassification.KNOWN_HOST_FAILURE;
    }
    return FailureClassification.UNKNOWN_HOST_FAILURE;
  }

  // ==================== Paths ====================

  private ErrorNode reentryTree(String callerName, FailureSnapshot snapshot) {
    ContextNode context =
        ContextNode.builder()
            .put("CalledBy", callerName)
            .put("Line", snapshot.line())
            .put("DB", hostEnvironment.databaseName())
            .put("SPID", hostEnvironment.sessionId())
            .build();
    List<ErrorChild> after = new ArrayList<>();
    after.add(context);
    after.addAll(snapshot.trailing());
    return composer.wrap(snapshot.message(), null, after);
  }

  private ErrorNode userDefinedTree(String callerName, FailureSnapshot snapshot) {
    String calledBy = callerName != null && callerName.equals(snapshot.procedure()) ? null : callerName;
    ContextNode context =
        ContextNode.builder()
            .put("CalledBy", calledBy)
            .put("ThrownBy", snapshot.procedure())
            .put("ThrownLine", snapshot.line())
            .put("DB", hostEnvironment.databaseName())
            .put("SPID", hostEnvironment.sessionId())
            .build();
    return composer.wrap(snapshot.message(), context, snapshot.trailing());
  }

  /** 감사에는 잘라내기 전 전체 트리, 재신호에는 예산에 맞춘 텍스트 */
  private String rewrap(Long auditId, ErrorNode tree) {
    auditLifecycle.fail(auditId, ErrorTreeCodec.encode(tree));
    return ErrorTreeTruncator.fit(tree, settings.maxMessageLength(), true);
  }

  private String lookupHostFailure(
      int callerProcId,
      String callerName,
      Long auditId,
      FailureSnapshot snapshot,
      String errorName) {
    ContextNode context =
        ContextNode.builder()
            .put("ErrorNumber", snapshot.errorNumber())
            .put("ErrorMessage", snapshot.message())
            .put(ErrorLookup.KEY_PROCID, callerProcId)
            .put("ThrownBy", snapshot.procedure())
            .put("ThrownLine", snapshot.line())
            .put("ServerName", hostEnvironment.serverName())
            .put("DB", hostEnvironment.databaseName())
            .put("SPID", hostEnvironment.sessionId())
            .build();
    String owner = ownerFor(callerName, errorName);
    String message = errorLookup.lookupMessage(owner, errorName, context);
    auditLifecycle.fail(auditId, message);
    return message;
  }

  /** 호출 프레임이 같은 이름의 자체 정의를 가지면 그것을, 아니면 공통 정의를 사용 */
  private String ownerFor(String callerName, String errorName) {
    if (callerName != null && catalog.find(callerName, errorName).isPresent()) {
      return callerName;
    }
    return settings.handlerName();
  }

  private String hostFailureName(FailureSnapshot snapshot) {
    HostFailureKind kind = settings.hostFailureCodes().get(snapshot.errorNumber());
    return kind.getErrorName();
  }

  // ==================== Support ====================

  private String callerName(int callerProcId) {
    return procedureRegistry.findName(callerProcId).orElse(null);
  }

  private boolean isDebugMode() {
    return parameterPort
        .findValue(ParameterPort.DEBUG_MODE)
        .map(TruthyValues::isTruthy)
        .orElse(false);
  }

  private void logBreakdown(
      int callerProcId,
      String callerName,
      FailureSnapshot snapshot,
      FailureClassification classification) {
    log.info(
        "[{}] {}[{}]: {}-{} | classification={}, callerProcId={}, caller={}, severity={}, state={}",
        settings.handlerName(),
        snapshot.procedure().isEmpty() ? "(null procedure)" : snapshot.procedure(),
        snapshot.line(),
        snapshot.errorNumber(),
        snapshot.message(),
        classification,
        callerProcId,
        callerName,
        snapshot.severity(),
        snapshot.state());
  }
}
