package structured.error.core.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import structured.error.core.domain.model.ContextNode;
import structured.error.core.domain.model.ErrorChild;
import structured.error.core.domain.model.ErrorDefinition;
import structured.error.core.domain.model.ErrorNode;
import structured.error.core.domain.model.PropagationSettings;
import structured.error.core.domain.model.TokenSet;
import structured.error.core.port.out.ErrorCatalog;
import structured.error.core.port.out.ProcedureRegistry;
import structured.error.core.substitution.TokenSubstitutor;
import structured.error.core.truncation.ErrorTreeTruncator;
import structured.error.core.util.TruthyValues;

/**
 * 카탈로그 기반 에러 노드 생성
 *
 * <h3>해석 순서</h3>
 *
 * <ol>
 *   <li>(procedureName, errorName) 정확히 일치
 *   <li>(핸들러, UnknownError)
 *   <li>내장 템플릿 (code 0) - 카탈로그가 비어 있어도 메시지는 항상 생성됨
 * </ol>
 *
 * <h3>컨텍스트</h3>
 *
 * <p>context 목록의 최상위 T 노드 속성이 치환 토큰이 되고, 목록 전체가 같은 순서로 새 노드의 자식이 됩니다. 예약 키
 * {@code PROCID}, {@code LINE}은 노드의 P/L 속성으로 승격되고 {@code LimitLength}는 잘라내기 여부를 결정합니다. 세 키 모두
 * 자식 T 노드에서는 제거됩니다.
 *
 * <p>카탈로그 스냅샷만 읽는 부수효과 없는 연산입니다.
 */
@Slf4j
public class ErrorLookup {

  public static final String UNKNOWN_ERROR = "UnknownError";
  public static final String TOKEN_PROCEDURE_NAME = "ProcedureName";
  public static final String TOKEN_ERROR_NAME = "ErrorName";
  public static final String TOKEN_ERROR_ID = "ErrorId";
  public static final String KEY_PROCID = "PROCID";
  public static final String KEY_LINE = "LINE";
  public static final String KEY_LIMIT_LENGTH = "LimitLength";

  static final int BUILTIN_ERROR_ID = 0;
  static final String BUILTIN_TEMPLATE =
      "Unknown error message \"#ErrorName#\" for procedure \"#ProcedureName#\" is not defined in"
          + " the error table. #ChildMessage#";

  private static final Set<String> RESERVED_KEYS = Set.of(KEY_PROCID, KEY_LINE, KEY_LIMIT_LENGTH);

  private final ErrorCatalog catalog;
  private final ProcedureRegistry procedureRegistry;
  private final PropagationSettings settings;

  public ErrorLookup(
      ErrorCatalog catalog, ProcedureRegistry procedureRegistry, PropagationSettings settings) {
    this.catalog = catalog;
    this.procedureRegistry = procedureRegistry;
    this.settings = settings;
  }

  public ErrorNode lookup(String procedureName, String errorName) {
    return lookup(procedureName, errorName, List.of());
  }

  public ErrorNode lookup(String procedureName, String errorName, ContextNode context) {
    return lookup(procedureName, errorName, List.of(context));
  }

  /**
   * 카탈로그 정의로 에러 노드 생성 (잘라내기 없음)
   *
   * @param procedureName 에러를 소유한 프로시저
   * @param errorName 에러 이름
   * @param context 토큰 T 노드와 하위 에러/첨부 자식
   */
  public ErrorNode lookup(String procedureName, String errorName, List<ErrorChild> context) {
    return resolve(procedureName, errorName, context).node();
  }

  /**
   * 에러 노드를 생성해 인코딩
   *
   * <p>{@code LimitLength} 토큰이 거짓이 아니면 최대 길이에 맞게 잘라냅니다.
   */
  public String lookupMessage(String procedureName, String errorName, List<ErrorChild> context) {
    Resolved resolved = resolve(procedureName, errorName, context);
    return ErrorTreeTruncator.fit(
        resolved.node(), settings.maxMessageLength(), resolved.limitLength());
  }

  public String lookupMessage(String procedureName, String errorName, ContextNode context) {
    return lookupMessage(procedureName, errorName, List.of(context));
  }

  private Resolved resolve(String procedureName, String errorName, List<ErrorChild> context) {
    List<ErrorChild> children = new ArrayList<>(context == null ? List.of() : context);

    TokenSet tokens = new TokenSet();
    children.stream()
        .filter(ContextNode.class::isInstance)
        .map(ContextNode.class::cast)
        .forEach(node -> node.attributes().forEach(tokens::put));
    tokens.putIfAbsent(TOKEN_PROCEDURE_NAME, procedureName);
    tokens.putIfAbsent(TOKEN_ERROR_NAME, errorName);

    boolean limitLength =
        tokens.findIgnoreCase(KEY_LIMIT_LENGTH).map(TruthyValues::isTruthy).orElse(true);

    ErrorDefinition definition = catalog.find(procedureName, errorName).orElse(null);
    if (definition == null) {
      definition = fallbackDefinition();
      log.debug(
          "[ErrorLookup] Undefined error {}.{} - using errorId={}",
          procedureName,
          errorName,
          definition.errorId());
      tokens.put(TOKEN_PROCEDURE_NAME, procedureName);
      tokens.put(TOKEN_ERROR_NAME, errorName);
      tokens.put(TOKEN_ERROR_ID, Integer.toString(BUILTIN_ERROR_ID));
      markFirstContext(children);
    }

    String userMessage = TokenSubstitutor.substitute(definition.userMessageTemplate(), tokens);
    String developerMessage =
        TokenSubstitutor.substitute(definition.developerMessageTemplate(), tokens);

    Optional<ErrorNode> firstChild =
        children.stream()
            .filter(ErrorNode.class::isInstance)
            .map(ErrorNode.class::cast)
            .findFirst();
    if (TokenSubstitutor.hasChildMessage(userMessage)
        || TokenSubstitutor.hasChildMessage(developerMessage)) {
      String childUser = firstChild.map(ErrorNode::userMessage).orElse("");
      String childDeveloper = firstChild.map(ErrorNode::developerMessage).orElse(childUser);
      userMessage = TokenSubstitutor.substituteChildMessage(userMessage, childUser);
      developerMessage = TokenSubstitutor.substituteChildMessage(developerMessage, childDeveloper);
    }

    String sourceProcedure =
        tokens.findIgnoreCase(KEY_PROCID).flatMap(this::procedureName).orElse(procedureName);
    String sourceLine = tokens.findIgnoreCase(KEY_LINE).orElse(null);

    ErrorNode node =
        new ErrorNode(
            definition.errorId(),
            userMessage,
            developerMessage,
            sourceProcedure,
            sourceLine,
            withoutReservedKeys(children));
    return new Resolved(node, limitLength);
  }

  private ErrorDefinition fallbackDefinition() {
    return catalog
        .find(settings.handlerName(), UNKNOWN_ERROR)
        .orElseGet(
            () ->
                new ErrorDefinition(
                    BUILTIN_ERROR_ID, settings.handlerName(), UNKNOWN_ERROR, BUILTIN_TEMPLATE, null));
  }

  /** 첫 T 노드에 ErrorId 표시 (없으면 맨 앞에 생성) */
  private void markFirstContext(List<ErrorChild> children) {
    String errorId = Integer.toString(BUILTIN_ERROR_ID);
    for (int i = 0; i < children.size(); i++) {
      if (children.get(i) instanceof ContextNode node) {
        children.set(i, node.with(TOKEN_ERROR_ID, errorId));
        return;
      }
    }
    children.add(0, ContextNode.builder().put(TOKEN_ERROR_ID, errorId).build());
  }

  private Optional<String> procedureName(String procId) {
    try {
      return procedureRegistry.findName(Integer.parseInt(procId.trim()));
    } catch (NumberFormatException e) {
      log.debug("[ErrorLookup] Non-numeric PROCID ignored: {}", procId);
      return Optional.empty();
    }
  }

  private static List<ErrorChild> withoutReservedKeys(List<ErrorChild> children) {
    List<ErrorChild> result = new ArrayList<>(children.size());
    for (ErrorChild child : children) {
      if (child instanceof ContextNode node) {
        ContextNode reduced = node.withoutIgnoreCase(RESERVED_KEYS);
        if (!reduced.isEmpty()) {
          result.add(reduced);
        }
      } else {
        result.add(child);
      }
    }
    return result;
  }

  private record Resolved(ErrorNode node, boolean limitLength) {}
}
