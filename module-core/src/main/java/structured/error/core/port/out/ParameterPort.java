package structured.error.core.port.out;

import java.util.Optional;

/**
 * Port for the key/value runtime configuration store.
 *
 * <p>Values are free text; flags are interpreted with {@link
 * structured.error.core.util.TruthyValues#isTruthy(String)}.
 */
public interface ParameterPort {

  String AUDIT_READ_LOG = "AuditReadLog";
  String AUDIT_WRITE_LOG = "AuditWriteLog";
  String DEBUG_MODE = "DebugMode";
  String PURGE_PERIOD = "PurgePeriod";

  /**
   * Find the raw value of a parameter.
   *
   * @param parameterName parameter name
   * @return value or empty when the row is missing or the value is null
   */
  Optional<String> findValue(String parameterName);
}
