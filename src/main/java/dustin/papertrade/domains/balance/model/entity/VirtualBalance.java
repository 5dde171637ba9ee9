package dustin.papertrade.domains.balance.model.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 가상 잔고 엔티티
 * Virtual Balance Entity (per-user cash ledger)
 * 
 * 역할:
 * - 사용자별 가상 현금 원장 (사용자당 1개)
 * - 매수 주문 예약(available_cash 차감)과 체결 정산의 기준 데이터
 * 
 * 잔고 구조:
 * - cash_balance: 총 현금
 * - available_cash: 주문 가능 현금 (cash_balance - 미체결 매수 예약 합계)
 * - reserved = cash_balance - available_cash
 * 
 * 불변 조건:
 * - 0 <= available_cash <= cash_balance
 * - cash_balance는 체결 정산 또는 입출금으로만 변경됨
 */
@Entity
@Table(name = "virtual_balances",
       uniqueConstraints = @UniqueConstraint(name = "uk_virtual_balances_user_id", columnNames = {"user_id"}),
       indexes = {
           @Index(name = "idx_virtual_balances_user_id", columnList = "user_id")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VirtualBalance {

    /**
     * 잔고 고유 ID (DB에서 자동 생성)
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 사용자 ID
     */
    @Column(name = "user_id", nullable = false)
    private Long userId;

    /**
     * 총 현금 잔고
     * Total cash balance
     */
    @Column(name = "cash_balance", nullable = false, precision = 20, scale = 2)
    @Builder.Default
    private BigDecimal cashBalance = BigDecimal.ZERO;

    /**
     * 주문 가능 현금 (미체결 매수 예약분 제외)
     * Available (unreserved) cash
     */
    @Column(name = "available_cash", nullable = false, precision = 20, scale = 2)
    @Builder.Default
    private BigDecimal availableCash = BigDecimal.ZERO;

    /**
     * 투자 원금 (보유 포지션의 매수 원가 합계)
     * Cost basis of all open positions
     */
    @Column(name = "invested_amount", nullable = false, precision = 20, scale = 2)
    @Builder.Default
    private BigDecimal investedAmount = BigDecimal.ZERO;

    /**
     * 누적 매수 금액
     */
    @Column(name = "total_buy_amount", nullable = false, precision = 20, scale = 2)
    @Builder.Default
    private BigDecimal totalBuyAmount = BigDecimal.ZERO;

    /**
     * 누적 매도 금액
     */
    @Column(name = "total_sell_amount", nullable = false, precision = 20, scale = 2)
    @Builder.Default
    private BigDecimal totalSellAmount = BigDecimal.ZERO;

    /**
     * 누적 수수료
     */
    @Column(name = "total_commission", nullable = false, precision = 20, scale = 2)
    @Builder.Default
    private BigDecimal totalCommission = BigDecimal.ZERO;

    /**
     * 누적 세금
     */
    @Column(name = "total_tax", nullable = false, precision = 20, scale = 2)
    @Builder.Default
    private BigDecimal totalTax = BigDecimal.ZERO;

    /**
     * 마지막 거래 시간
     */
    @Column(name = "last_trade_date")
    private LocalDateTime lastTradeDate;

    /**
     * 낙관적 락 버전
     * Optimistic lock version
     */
    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 예약 중인 현금 (미체결 매수 주문)
     * Reserved cash held by open BUY orders
     */
    public BigDecimal getReservedCash() {
        return cashBalance.subtract(availableCash);
    }

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
