package structured.error.core.port.out;

import java.util.Optional;

/** Port resolving numeric procedure identifiers to human-readable names. */
public interface ProcedureRegistry {

  Optional<String> findName(int procedureId);
}
