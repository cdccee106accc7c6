package structured.error.frame;

/**
 * 프레임 본문
 *
 * <p>checked 예외를 그대로 던질 수 있으며, 모든 예외는 {@link FrameExecutor}가 디스패처로 넘깁니다.
 *
 * @param <T> 결과 타입
 */
@FunctionalInterface
public interface FrameTask<T> {

  T run(FrameContext context) throws Exception;
}
