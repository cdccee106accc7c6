package structured.error.infrastructure.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.support.TransactionTemplate;
import structured.error.infrastructure.catalog.CachingErrorCatalog;
import structured.error.infrastructure.persistence.jpa.ErrorJpaRepository;

/** 에러 카탈로그 어댑터 빈 */
@Configuration
@EnableConfigurationProperties(StructuredErrorProperties.class)
public class CatalogConfig {

  @Bean
  public CachingErrorCatalog errorCatalog(
      ErrorJpaRepository errorRepository,
      @Qualifier("readOnlyTransactionTemplate") TransactionTemplate readOnlyTransactionTemplate,
      StructuredErrorProperties properties) {
    return new CachingErrorCatalog(
        errorRepository, readOnlyTransactionTemplate, properties.catalog().refreshAfter());
  }
}
