package dustin.papertrade.domains.order.model.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import org.hibernate.annotations.Immutable;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 주문 체결 내역 엔티티
 * Order Execution Entity
 * 
 * 역할:
 * - 주문 1건의 개별 체결 기록 (부분 체결마다 1건)
 * - 체결 수량 합계 = 주문의 executed_quantity
 * 
 * 주의사항:
 * - INSERT 전용
 */
@Entity
@Immutable
@Table(name = "order_executions",
       indexes = {
           @Index(name = "idx_order_executions_order_id", columnList = "order_id")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_id", nullable = false, updatable = false)
    private Long orderId;

    /**
     * 체결가 (현지 통화)
     */
    @Column(name = "execution_price", nullable = false, updatable = false, precision = 20, scale = 8)
    private BigDecimal executionPrice;

    @Column(name = "execution_quantity", nullable = false, updatable = false, precision = 20, scale = 8)
    private BigDecimal executionQuantity;

    /**
     * 체결 금액 (현지 통화, 체결가 * 체결 수량)
     */
    @Column(name = "execution_amount", nullable = false, updatable = false, precision = 30, scale = 8)
    private BigDecimal executionAmount;

    /**
     * 체결 수수료 + 세금 (원화)
     */
    @Column(name = "execution_fee", nullable = false, updatable = false, precision = 20, scale = 2)
    private BigDecimal executionFee;

    /**
     * 체결 시점 원화 환율
     */
    @Column(name = "exchange_rate", nullable = false, updatable = false, precision = 20, scale = 6)
    private BigDecimal exchangeRate;

    @Column(name = "execution_time", nullable = false, updatable = false)
    private LocalDateTime executionTime;
}
