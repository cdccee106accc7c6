package structured.error.config;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import structured.error.core.audit.AuditLifecycle;
import structured.error.core.audit.AuditRetentionPolicy;
import structured.error.core.catalog.ErrorLookup;
import structured.error.core.dispatch.FailureDispatcher;
import structured.error.core.domain.model.PropagationSettings;
import structured.error.core.port.out.AuditLogPort;
import structured.error.core.port.out.DispatchObserver;
import structured.error.core.port.out.ErrorCatalog;
import structured.error.core.port.out.HostEnvironment;
import structured.error.core.port.out.ParameterPort;
import structured.error.core.port.out.ProcedureRegistry;
import structured.error.core.tree.ErrorTreeComposer;
import structured.error.global.host.ConfiguredHostEnvironment;
import structured.error.infrastructure.config.StructuredErrorProperties;
import structured.error.monitoring.DispatchMetrics;

/**
 * 에러 전파 엔진 조립
 *
 * <p>module-core 클래스는 Spring에 의존하지 않으므로 여기서 포트 어댑터와 함께 빈으로 등록합니다. 시각은 모두 UTC {@link Clock}
 * 기준입니다.
 */
@Configuration
@EnableConfigurationProperties({StructuredErrorProperties.class, AuditPurgeProperties.class})
public class ErrorEngineConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public PropagationSettings propagationSettings(StructuredErrorProperties properties) {
    return properties.toSettings();
  }

  @Bean
  public HostEnvironment hostEnvironment(StructuredErrorProperties properties) {
    return new ConfiguredHostEnvironment(properties.host());
  }

  @Bean
  public DispatchObserver dispatchObserver(MeterRegistry meterRegistry) {
    return new DispatchMetrics(meterRegistry);
  }

  @Bean
  public ErrorLookup errorLookup(
      ErrorCatalog errorCatalog,
      ProcedureRegistry procedureRegistry,
      PropagationSettings propagationSettings) {
    return new ErrorLookup(errorCatalog, procedureRegistry, propagationSettings);
  }

  @Bean
  public ErrorTreeComposer errorTreeComposer(
      ErrorLookup errorLookup, PropagationSettings propagationSettings) {
    return new ErrorTreeComposer(errorLookup, propagationSettings.handlerName());
  }

  @Bean
  public AuditLifecycle auditLifecycle(
      AuditLogPort auditLogPort,
      ParameterPort parameterPort,
      ProcedureRegistry procedureRegistry,
      Clock clock) {
    return new AuditLifecycle(auditLogPort, parameterPort, procedureRegistry, clock);
  }

  @Bean
  public AuditRetentionPolicy auditRetentionPolicy(ParameterPort parameterPort, Clock clock) {
    return new AuditRetentionPolicy(parameterPort, clock);
  }

  @Bean
  public FailureDispatcher failureDispatcher(
      ErrorLookup errorLookup,
      ErrorTreeComposer errorTreeComposer,
      ErrorCatalog errorCatalog,
      AuditLifecycle auditLifecycle,
      ParameterPort parameterPort,
      ProcedureRegistry procedureRegistry,
      HostEnvironment hostEnvironment,
      DispatchObserver dispatchObserver,
      PropagationSettings propagationSettings) {
    return new FailureDispatcher(
        errorLookup,
        errorTreeComposer,
        errorCatalog,
        auditLifecycle,
        parameterPort,
        procedureRegistry,
        hostEnvironment,
        dispatchObserver,
        propagationSettings);
  }
}
