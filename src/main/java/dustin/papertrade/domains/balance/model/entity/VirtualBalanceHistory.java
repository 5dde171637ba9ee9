package dustin.papertrade.domains.balance.model.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import org.hibernate.annotations.Immutable;

import dustin.papertrade.domains.balance.model.BalanceChangeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 가상 잔고 변경 이력 엔티티
 * Virtual Balance History Entity
 * 
 * 역할:
 * - 현금 잔고가 변경될 때마다 1건씩 기록되는 감사(audit) 로그
 * - 입금, 출금, 매수 체결, 매도 체결, 초기 지급
 * 
 * 주의사항:
 * - INSERT 전용 (수정/삭제 불가)
 * - change_amount는 부호 포함 (출금/매수는 음수)
 */
@Entity
@Immutable
@Table(name = "virtual_balance_histories",
       indexes = {
           @Index(name = "idx_vb_histories_balance_id", columnList = "virtual_balance_id,created_at"),
           @Index(name = "idx_vb_histories_order_id", columnList = "related_order_id")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VirtualBalanceHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 가상 잔고 ID
     */
    @Column(name = "virtual_balance_id", nullable = false, updatable = false)
    private Long virtualBalanceId;

    /**
     * 변경 전 현금 잔고
     */
    @Column(name = "previous_cash_balance", nullable = false, updatable = false, precision = 20, scale = 2)
    private BigDecimal previousCashBalance;

    /**
     * 변경 후 현금 잔고
     */
    @Column(name = "new_cash_balance", nullable = false, updatable = false, precision = 20, scale = 2)
    private BigDecimal newCashBalance;

    /**
     * 변경 금액 (부호 포함)
     */
    @Column(name = "change_amount", nullable = false, updatable = false, precision = 20, scale = 2)
    private BigDecimal changeAmount;

    /**
     * 변경 유형
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "change_type", nullable = false, updatable = false, length = 20)
    private BalanceChangeType changeType;

    /**
     * 관련 주문 ID (입출금은 NULL)
     */
    @Column(name = "related_order_id", updatable = false)
    private Long relatedOrderId;

    @Column(name = "description", updatable = false, length = 500)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
