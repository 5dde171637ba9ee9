package dustin.papertrade.domains.transaction.repository;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.papertrade.domains.transaction.model.TransactionType;
import dustin.papertrade.domains.transaction.model.entity.Transaction;

/**
 * 거래 원장 리포지토리
 * Transaction Repository
 */
@Repository
public interface TransactionRepository extends JpaRepository<Transaction, Long> {

    List<Transaction> findByOrderIdOrderByIdAsc(Long orderId);

    Page<Transaction> findByUserIdAndTransactionDateBetweenOrderByTransactionDateDesc(
            Long userId, LocalDateTime from, LocalDateTime to, Pageable pageable);

    Page<Transaction> findByUserIdAndTransactionTypeAndTransactionDateBetweenOrderByTransactionDateDesc(
            Long userId, TransactionType transactionType, LocalDateTime from, LocalDateTime to, Pageable pageable);

    /**
     * 기간 내 사용자 거래 조회 (일별 통계용)
     * Find user's transactions in [start, end)
     */
    @Query("SELECT t FROM Transaction t WHERE t.userId = :userId " +
           "AND t.transactionDate >= :start AND t.transactionDate < :end " +
           "ORDER BY t.transactionDate ASC, t.id ASC")
    List<Transaction> findByUserIdInPeriod(
        @Param("userId") Long userId,
        @Param("start") LocalDateTime start,
        @Param("end") LocalDateTime end
    );

    /**
     * 기간 내 매수/매도 체결이 있는 사용자 ID 목록
     * Find distinct user IDs with trades in [start, end)
     */
    @Query("SELECT DISTINCT t.userId FROM Transaction t " +
           "WHERE t.transactionType IN (dustin.papertrade.domains.transaction.model.TransactionType.BUY, " +
           "dustin.papertrade.domains.transaction.model.TransactionType.SELL) " +
           "AND t.transactionDate >= :start AND t.transactionDate < :end")
    List<Long> findTradingUserIdsInPeriod(
        @Param("start") LocalDateTime start,
        @Param("end") LocalDateTime end
    );

    /**
     * 기간 내 실현 손익이 있는 매도 거래 조회
     * Find SELL transactions with realized P/L in [start, end)
     */
    @Query("SELECT t FROM Transaction t WHERE t.userId = :userId " +
           "AND t.transactionType = dustin.papertrade.domains.transaction.model.TransactionType.SELL " +
           "AND t.realizedProfitLoss IS NOT NULL " +
           "AND t.transactionDate >= :start AND t.transactionDate < :end " +
           "ORDER BY t.transactionDate ASC")
    List<Transaction> findRealizedSellsInPeriod(
        @Param("userId") Long userId,
        @Param("start") LocalDateTime start,
        @Param("end") LocalDateTime end
    );
}
