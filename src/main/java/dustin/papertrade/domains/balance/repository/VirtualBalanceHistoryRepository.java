package dustin.papertrade.domains.balance.repository;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import dustin.papertrade.domains.balance.model.BalanceChangeType;
import dustin.papertrade.domains.balance.model.entity.VirtualBalanceHistory;

/**
 * 가상 잔고 변경 이력 리포지토리
 * Virtual Balance History Repository
 */
@Repository
public interface VirtualBalanceHistoryRepository extends JpaRepository<VirtualBalanceHistory, Long> {

    List<VirtualBalanceHistory> findByVirtualBalanceIdOrderByIdAsc(Long virtualBalanceId);

    List<VirtualBalanceHistory> findByRelatedOrderIdOrderByIdAsc(Long relatedOrderId);

    Page<VirtualBalanceHistory> findByVirtualBalanceIdAndCreatedAtBetweenOrderByIdDesc(
            Long virtualBalanceId, LocalDateTime from, LocalDateTime to, Pageable pageable);

    Page<VirtualBalanceHistory> findByVirtualBalanceIdAndChangeTypeAndCreatedAtBetweenOrderByIdDesc(
            Long virtualBalanceId, BalanceChangeType changeType, LocalDateTime from, LocalDateTime to, Pageable pageable);
}
