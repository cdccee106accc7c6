package structured.error.core.port.out;

/** Port describing where the current frame runs (server, database, session). */
public interface HostEnvironment {

  String serverName();

  String databaseName();

  /** Identifier of the current session. Frames of one call chain share it. */
  String sessionId();
}
