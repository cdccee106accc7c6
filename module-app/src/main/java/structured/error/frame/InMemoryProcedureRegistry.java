package structured.error.frame;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;
import structured.error.core.port.out.ProcedureRegistry;

/**
 * 프레임 이름 ↔ 숫자 식별자
 *
 * <p>처음 실행되는 프레임에 순차 id를 부여하며, 프로세스 수명 동안 같은 이름은 같은 id를 유지합니다.
 */
@Component
public class InMemoryProcedureRegistry implements ProcedureRegistry {

  private static final int FIRST_ID = 1;

  private final AtomicInteger sequence = new AtomicInteger(FIRST_ID);
  private final Map<String, Integer> idsByName = new ConcurrentHashMap<>();
  private final Map<Integer, String> namesById = new ConcurrentHashMap<>();

  /** 이름에 대한 id (없으면 새로 등록) */
  public int register(String procedureName) {
    return idsByName.computeIfAbsent(
        procedureName,
        name -> {
          int id = sequence.getAndIncrement();
          namesById.put(id, name);
          return id;
        });
  }

  @Override
  public Optional<String> findName(int procedureId) {
    return Optional.ofNullable(namesById.get(procedureId));
  }
}
