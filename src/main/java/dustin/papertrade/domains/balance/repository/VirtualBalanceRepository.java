package dustin.papertrade.domains.balance.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.papertrade.domains.balance.model.entity.VirtualBalance;
import jakarta.persistence.LockModeType;

/**
 * 가상 잔고 리포지토리
 * Virtual Balance Repository
 */
@Repository
public interface VirtualBalanceRepository extends JpaRepository<VirtualBalance, Long> {

    Optional<VirtualBalance> findByUserId(Long userId);

    boolean existsByUserId(Long userId);

    /**
     * 사용자 잔고 조회 (비관적 락)
     * Find balance by user ID with pessimistic lock (FOR UPDATE)
     * 
     * 주문 접수, 취소, 만료, 체결, 입출금 모두 이 락을 가장 먼저 획득합니다.
     * 같은 사용자의 원장 변경 작업은 이 락으로 직렬화됩니다.
     * 
     * @param userId 사용자 ID
     * @return 잔고 정보 (없으면 Optional.empty())
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM VirtualBalance b WHERE b.userId = :userId")
    Optional<VirtualBalance> findByUserIdForUpdate(@Param("userId") Long userId);
}
