package dustin.papertrade.domains.order.repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.papertrade.domains.order.model.OrderStatus;
import dustin.papertrade.domains.order.model.entity.Order;
import jakarta.persistence.LockModeType;

/**
 * 주문 리포지토리
 * Order Repository
 * 
 * 역할:
 * - 주문 엔티티의 데이터베이스 접근을 담당
 * - 사용자별 주문 조회, 상태별 필터링
 * - 매도 예약 수량 계산, 만료 대상 조회
 */
@Repository
public interface OrderRepository extends JpaRepository<Order, Long> {

    /**
     * 사용자 ID로 주문 목록 조회
     * Find orders by user ID
     */
    Page<Order> findByUserId(Long userId, Pageable pageable);

    /**
     * 사용자 ID와 주문 상태로 주문 목록 조회
     * Find orders by user ID and status
     */
    Page<Order> findByUserIdAndOrderStatus(Long userId, OrderStatus orderStatus, Pageable pageable);

    /**
     * 사용자의 미체결 주문 조회 (최신순)
     */
    List<Order> findByUserIdAndOrderStatusInOrderByOrderDateDesc(Long userId, Collection<OrderStatus> statuses);

    /**
     * 사용자 ID와 주문 ID로 주문 조회
     * Find order by user ID and order ID
     * 
     * 사용자가 자신의 주문만 조회할 수 있도록 보안 검증에 사용
     */
    Optional<Order> findByUserIdAndId(Long userId, Long orderId);

    /**
     * 사용자의 종목별 가장 최근 주문 조회
     * 시세가 없을 때 통화/시장 정보를 이어받는 데 사용
     */
    Optional<Order> findFirstByUserIdAndStockIdOrderByIdDesc(Long userId, String stockId);

    long countByUserIdAndOrderStatusIn(Long userId, Collection<OrderStatus> statuses);

    /**
     * 주문 ID로 주문 조회 (비관적 락)
     * Find order by ID with pessimistic lock (FOR UPDATE)
     * 
     * 사용자 잔고 락을 획득한 뒤에만 호출됩니다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.id = :orderId")
    Optional<Order> findByIdForUpdate(@Param("orderId") Long orderId);

    /**
     * 미체결 매도 주문 잔량 합계 (매도 예약 수량)
     * Sum of remaining quantity over open SELL orders for user and stock
     * 
     * 매도 가능 수량 = 보유 수량 - 이 값
     */
    @Query("SELECT COALESCE(SUM(o.quantity - o.executedQuantity), 0) FROM Order o " +
           "WHERE o.userId = :userId AND o.stockId = :stockId " +
           "AND o.orderType = dustin.papertrade.domains.order.model.OrderType.SELL " +
           "AND o.orderStatus IN (dustin.papertrade.domains.order.model.OrderStatus.PENDING, " +
           "dustin.papertrade.domains.order.model.OrderStatus.PARTIALLY_FILLED)")
    BigDecimal sumOpenSellQuantity(
        @Param("userId") Long userId,
        @Param("stockId") String stockId
    );

    /**
     * 특정 주문을 제외한 미체결 매도 주문 잔량 합계
     * Sum of open SELL remaining quantity, excluding one order (주문 정정 시 사용)
     */
    @Query("SELECT COALESCE(SUM(o.quantity - o.executedQuantity), 0) FROM Order o " +
           "WHERE o.userId = :userId AND o.stockId = :stockId AND o.id <> :excludeOrderId " +
           "AND o.orderType = dustin.papertrade.domains.order.model.OrderType.SELL " +
           "AND o.orderStatus IN (dustin.papertrade.domains.order.model.OrderStatus.PENDING, " +
           "dustin.papertrade.domains.order.model.OrderStatus.PARTIALLY_FILLED)")
    BigDecimal sumOpenSellQuantityExcluding(
        @Param("userId") Long userId,
        @Param("stockId") String stockId,
        @Param("excludeOrderId") Long excludeOrderId
    );

    /**
     * 만료 대상 주문 ID 조회
     * Find IDs of open orders whose expires_at <= asOf
     */
    @Query("SELECT o.id FROM Order o WHERE o.expiresAt IS NOT NULL AND o.expiresAt <= :asOf " +
           "AND o.orderStatus IN (dustin.papertrade.domains.order.model.OrderStatus.PENDING, " +
           "dustin.papertrade.domains.order.model.OrderStatus.PARTIALLY_FILLED) " +
           "ORDER BY o.id ASC")
    List<Long> findExpirableOrderIds(@Param("asOf") LocalDateTime asOf);
}
