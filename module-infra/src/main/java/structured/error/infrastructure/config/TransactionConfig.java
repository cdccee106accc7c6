package structured.error.infrastructure.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * 트랜잭션 설정
 *
 * <p>카탈로그 스냅샷 적재용 읽기 전용 템플릿만 등록합니다. 프레임 트랜잭션은 {@code FrameExecutor}가 {@link
 * PlatformTransactionManager}로 직접 엽니다.
 */
@Configuration
public class TransactionConfig {

  /**
   * 읽기 전용 TransactionTemplate
   *
   * <p>timeout=10초. 카탈로그 적재는 단일 SELECT이므로 그 이상 걸리면 DB 이상으로 간주합니다.
   *
   * @param transactionManager Spring이 제공하는 트랜잭션 매니저
   * @return 읽기 전용 TransactionTemplate
   */
  @Bean(name = "readOnlyTransactionTemplate")
  public TransactionTemplate readOnlyTransactionTemplate(
      PlatformTransactionManager transactionManager) {
    TransactionTemplate template = new TransactionTemplate(transactionManager);
    template.setReadOnly(true);
    template.setTimeout(10);
    return template;
  }
}
