package dustin.papertrade.domains.position.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.papertrade.domains.position.model.entity.Portfolio;
import jakarta.persistence.LockModeType;

/**
 * 보유 종목 리포지토리
 * Portfolio Repository
 */
@Repository
public interface PortfolioRepository extends JpaRepository<Portfolio, Long> {

    Optional<Portfolio> findByUserIdAndStockId(Long userId, String stockId);

    List<Portfolio> findByUserIdAndIsActiveTrueOrderByStockIdAsc(Long userId);

    long countByUserIdAndIsActiveTrue(Long userId);

    /**
     * 보유 종목 조회 (비관적 락)
     * Find position with pessimistic lock (FOR UPDATE)
     * 
     * 체결 정산 시 사용자 잔고 락을 획득한 뒤에 호출됩니다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Portfolio p WHERE p.userId = :userId AND p.stockId = :stockId")
    Optional<Portfolio> findByUserIdAndStockIdForUpdate(
        @Param("userId") Long userId,
        @Param("stockId") String stockId
    );
}
