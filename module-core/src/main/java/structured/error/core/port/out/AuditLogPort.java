package structured.error.core.port.out;

import java.time.LocalDateTime;
import java.util.Optional;
import structured.error.core.domain.model.AuditEntry;

/**
 * Port for the audit log store.
 *
 * <p>Rows are appended on frame entry and updated by id afterwards. Concurrent frames rely on the
 * row-level atomicity of the underlying storage.
 */
public interface AuditLogPort {

  /**
   * Append a new open entry.
   *
   * @return generated identifier
   */
  long insert(String procedureName, String inputData, LocalDateTime startTime);

  /**
   * Close an open entry normally.
   *
   * @return false if the entry does not exist or was already closed
   */
  boolean complete(long id, String outputData, LocalDateTime endTime);

  /**
   * Close an open entry with an error.
   *
   * @return false if the entry does not exist or was already closed
   */
  boolean fail(long id, String errorMessage, LocalDateTime endTime);

  Optional<AuditEntry> findById(long id);

  /**
   * Delete up to {@code limit} entries started before the cutoff that are open or ended before it.
   *
   * @return number of deleted rows
   */
  int purge(LocalDateTime cutoff, int limit);
}
