package dustin.papertrade.domains.order.model.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import dustin.papertrade.domains.order.model.ExitReason;
import dustin.papertrade.domains.order.model.OrderMethod;
import dustin.papertrade.domains.order.model.OrderStatus;
import dustin.papertrade.domains.order.model.OrderType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 주문 엔티티
 * Order Entity
 * 
 * 역할:
 * - 사용자가 생성한 모의 매수/매도 주문 저장
 * - 주문 상태, 누적 체결 수량/금액, 누적 수수료 관리
 * 
 * 주문 유형:
 * - orderType: BUY (매수) 또는 SELL (매도)
 * - orderMethod: MARKET, LIMIT, STOP_LOSS, TAKE_PROFIT
 * 
 * 예약:
 * - 매수 주문: 접수 시 (수량 * 가격 * 환율 + 예상 수수료)를 available_cash에서 예약 → reserved_cash
 *   체결마다 비례 해제, 취소/만료/거부 시 남은 예약 전액 해제
 * - 매도 주문: 저장된 예약 없음 (미체결 매도 주문 수량 합계를 조회해서 계산)
 * 
 * 예시:
 * - 지정가 매수: "삼성전자를 70,000원에 10주 사고 싶다"
 *   → orderType=BUY, orderMethod=LIMIT, orderPrice=70000, quantity=10
 * 
 * 주의사항:
 * - 삭제되지 않음 (감사 목적), 종료 상태 이후 변경 불가
 */
@Entity
@Table(name = "orders",
       indexes = {
           @Index(name = "idx_orders_user_status", columnList = "user_id,order_status"),
           @Index(name = "idx_orders_user_stock_type", columnList = "user_id,stock_id,order_type,order_status"),
           @Index(name = "idx_orders_expires_at", columnList = "order_status,expires_at")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    /**
     * 주문 고유 ID
     * Order ID
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    /**
     * 주문한 사용자 ID
     */
    @Column(name = "user_id", nullable = false)
    private Long userId;

    /**
     * 종목 코드
     */
    @Column(name = "stock_id", nullable = false, length = 50)
    private String stockId;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_type", nullable = false, length = 10)
    private OrderType orderType;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_method", nullable = false, length = 20)
    private OrderMethod orderMethod;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_status", nullable = false, length = 20)
    @Builder.Default
    private OrderStatus orderStatus = OrderStatus.PENDING;

    /**
     * 주문 수량 (0보다 큼)
     */
    @Column(name = "quantity", nullable = false, precision = 20, scale = 8)
    private BigDecimal quantity;

    /**
     * 주문 가격 (현지 통화, 시장가 주문은 NULL)
     */
    @Column(name = "order_price", precision = 20, scale = 8)
    private BigDecimal orderPrice;

    /**
     * 예약 계산에 사용된 가격
     * 지정가 계열은 주문 가격, 시장가는 접수 시점 기준가
     */
    @Column(name = "reference_price", precision = 20, scale = 8)
    private BigDecimal referencePrice;

    /**
     * 종목 통화
     */
    @Column(name = "currency", nullable = false, length = 10)
    @Builder.Default
    private String currency = "KRW";

    /**
     * 시장 구분 (수수료 스케줄 조회 키)
     */
    @Column(name = "market", length = 50)
    private String market;

    /**
     * 접수 시점 원화 환율 (원화 자산은 1)
     */
    @Column(name = "exchange_rate", nullable = false, precision = 20, scale = 6)
    @Builder.Default
    private BigDecimal exchangeRate = BigDecimal.ONE;

    /**
     * 남은 매수 예약금 (원화)
     */
    @Column(name = "reserved_cash", nullable = false, precision = 20, scale = 2)
    @Builder.Default
    private BigDecimal reservedCash = BigDecimal.ZERO;

    /**
     * 누적 체결 수량 (0 <= x <= quantity)
     */
    @Column(name = "executed_quantity", nullable = false, precision = 20, scale = 8)
    @Builder.Default
    private BigDecimal executedQuantity = BigDecimal.ZERO;

    /**
     * 누적 체결 금액 (현지 통화, 체결가 * 체결 수량 합계)
     */
    @Column(name = "executed_amount", nullable = false, precision = 30, scale = 8)
    @Builder.Default
    private BigDecimal executedAmount = BigDecimal.ZERO;

    /**
     * 평균 체결가 = executed_amount / executed_quantity
     */
    @Column(name = "average_price", precision = 20, scale = 8)
    private BigDecimal averagePrice;

    @Column(name = "commission", nullable = false, precision = 20, scale = 2)
    @Builder.Default
    private BigDecimal commission = BigDecimal.ZERO;

    @Column(name = "tax", nullable = false, precision = 20, scale = 2)
    @Builder.Default
    private BigDecimal tax = BigDecimal.ZERO;

    @Column(name = "total_fee", nullable = false, precision = 20, scale = 2)
    @Builder.Default
    private BigDecimal totalFee = BigDecimal.ZERO;

    /**
     * 매도 청산 사유 (매도 체결 시 설정)
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "exit_reason", length = 20)
    private ExitReason exitReason;

    /**
     * 거부 사유 (REJECTED 상태)
     */
    @Column(name = "reject_reason", length = 500)
    private String rejectReason;

    @Column(name = "notes", length = 500)
    private String notes;

    @Column(name = "order_date", nullable = false)
    private LocalDateTime orderDate;

    /**
     * 최초 체결 시간
     */
    @Column(name = "executed_date")
    private LocalDateTime executedDate;

    @Column(name = "cancelled_date")
    private LocalDateTime cancelledDate;

    /**
     * 만료 시각 (NULL이면 만료 없음)
     */
    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 미체결 수량
     * Remaining (unexecuted) quantity
     */
    public BigDecimal getRemainingQuantity() {
        return quantity.subtract(executedQuantity);
    }

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdAt = now;
        updatedAt = now;
        if (orderDate == null) {
            orderDate = now;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
