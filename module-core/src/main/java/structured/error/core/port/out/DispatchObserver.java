package structured.error.core.port.out;

import structured.error.core.domain.model.FailureClassification;

/** Port notified once per dispatch (metrics). */
@FunctionalInterface
public interface DispatchObserver {

  DispatchObserver NOOP = (classification, callingProcedure) -> {};

  void onDispatch(FailureClassification classification, String callingProcedure);
}
