package structured.error.core.domain.model;

/**
 * 에러 노드({@link ErrorNode})의 자식 요소
 *
 * <p>구현체는 세 가지뿐입니다.
 *
 * <ul>
 *   <li>{@link ContextNode}: 진단 속성 묶음 ({@code T} 요소)
 *   <li>{@link ErrorNode}: 하위 프레임에서 올라온 중첩 에러 ({@code E} 요소)
 *   <li>{@link AttachmentNode}: 그 외 임의 요소 (잘라내기 시 가장 먼저 제거)
 * </ul>
 */
public interface ErrorChild {}
