package structured.error.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import structured.error.core.domain.model.FailureClassification;
import structured.error.core.port.out.DispatchObserver;

/**
 * 디스패치 분류별 카운터
 *
 * <ul>
 *   <li>{@code structured.error.dispatch{classification, procedure}}
 * </ul>
 */
@RequiredArgsConstructor
public class DispatchMetrics implements DispatchObserver {

  static final String METRIC_NAME = "structured.error.dispatch";
  private static final String UNKNOWN_PROCEDURE = "unknown";

  private final MeterRegistry meterRegistry;

  @Override
  public void onDispatch(FailureClassification classification, String callingProcedure) {
    Counter.builder(METRIC_NAME)
        .description("Failures dispatched by the error handler")
        .tag("classification", classification.name())
        .tag("procedure", callingProcedure != null ? callingProcedure : UNKNOWN_PROCEDURE)
        .register(meterRegistry)
        .increment();
  }
}
