package structured.error.frame;

import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * 프레임 트랜잭션 범위
 *
 * <p>활성 트랜잭션이 없을 때 연 프레임만 소유자가 되어 커밋/롤백합니다. 바깥 트랜잭션을 빌려 쓰는 프레임은 아무것도 하지 않으며, 실패는
 * 재신호를 통해 소유 프레임까지 올라가 그곳에서 롤백됩니다.
 */
final class TransactionScope {

  private final PlatformTransactionManager transactionManager;
  private final TransactionStatus status;

  private TransactionScope(
      PlatformTransactionManager transactionManager, TransactionStatus status) {
    this.transactionManager = transactionManager;
    this.status = status;
  }

  static TransactionScope open(
      PlatformTransactionManager transactionManager, String name, boolean readOnly) {
    if (TransactionSynchronizationManager.isActualTransactionActive()) {
      return new TransactionScope(transactionManager, null);
    }
    DefaultTransactionDefinition definition =
        new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRED);
    definition.setName(name);
    definition.setReadOnly(readOnly);
    return new TransactionScope(transactionManager, transactionManager.getTransaction(definition));
  }

  boolean isOwner() {
    return status != null;
  }

  void commitIfOwner() {
    if (isOwner() && !status.isCompleted()) {
      transactionManager.commit(status);
    }
  }

  /** 소유자이고 아직 완료되지 않은 경우에만 롤백 */
  void rollbackIfOwner() {
    if (isOwner() && !status.isCompleted()) {
      transactionManager.rollback(status);
    }
  }
}
