package structured.error.core.port.out;

import java.util.Optional;
import structured.error.core.domain.model.ErrorDefinition;

/**
 * Port for reading the error template catalog.
 *
 * <p>Implemented by module-infra adapters. Implementations expose a read-only snapshot; how and
 * when the snapshot is refreshed is decided by the adapter.
 */
public interface ErrorCatalog {

  /**
   * Find the definition owned by a procedure.
   *
   * @param ownerProcedure owning procedure name
   * @param errorName error name within the owner
   * @return definition or empty
   */
  Optional<ErrorDefinition> find(String ownerProcedure, String errorName);
}
