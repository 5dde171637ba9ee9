package dustin.papertrade.domains.transaction.model.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import org.hibernate.annotations.Immutable;

import dustin.papertrade.domains.transaction.model.TransactionType;
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
 * 거래 원장 엔티티
 * Transaction Entity (immutable ledger row)
 * 
 * 역할:
 * - 체결 1건 또는 입출금 1건마다 기록되는 확정 거래 내역
 * - 일별 통계와 기간별 실현 손익 집계의 원천 데이터
 * 
 * 주의사항:
 * - 한 번 기록되면 수정/삭제 불가 (@Immutable, updatable=false)
 * - order_id는 입출금의 경우 NULL
 * - 손익/환율 필드는 매도 체결에서만 채워짐
 * 
 * 금액 규칙 (원화 기준):
 * - amount: 총 거래 금액 (가격 * 수량 * 환율)
 * - net_amount: 매수 = amount + 수수료, 매도 = amount - 수수료 - 세금
 */
@Entity
@Immutable
@Table(name = "transactions",
       indexes = {
           @Index(name = "idx_transactions_user_date", columnList = "user_id,transaction_date"),
           @Index(name = "idx_transactions_order_id", columnList = "order_id"),
           @Index(name = "idx_transactions_date", columnList = "transaction_date")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Transaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    /**
     * 종목 코드 (주식/코인 거래 시)
     */
    @Column(name = "stock_id", updatable = false, length = 50)
    private String stockId;

    /**
     * 주문 ID (체결 거래 시)
     */
    @Column(name = "order_id", updatable = false)
    private Long orderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, updatable = false, length = 20)
    private TransactionType transactionType;

    /**
     * 체결 수량 (입출금은 NULL)
     */
    @Column(name = "quantity", updatable = false, precision = 20, scale = 8)
    private BigDecimal quantity;

    /**
     * 체결 가격 (현지 통화, 입출금은 NULL)
     */
    @Column(name = "price", updatable = false, precision = 20, scale = 8)
    private BigDecimal price;

    /**
     * 총 거래 금액 (원화)
     */
    @Column(name = "amount", nullable = false, updatable = false, precision = 20, scale = 2)
    private BigDecimal amount;

    @Column(name = "commission", nullable = false, updatable = false, precision = 20, scale = 2)
    @Builder.Default
    private BigDecimal commission = BigDecimal.ZERO;

    @Column(name = "tax", nullable = false, updatable = false, precision = 20, scale = 2)
    @Builder.Default
    private BigDecimal tax = BigDecimal.ZERO;

    /**
     * 순 거래 금액 (실제 현금 변동액의 절대값)
     */
    @Column(name = "net_amount", nullable = false, updatable = false, precision = 20, scale = 2)
    private BigDecimal netAmount;

    @Column(name = "cash_balance_before", nullable = false, updatable = false, precision = 20, scale = 2)
    private BigDecimal cashBalanceBefore;

    @Column(name = "cash_balance_after", nullable = false, updatable = false, precision = 20, scale = 2)
    private BigDecimal cashBalanceAfter;

    /**
     * 실현 손익 (원화, 매도만) = price_profit_loss + exchange_profit_loss
     */
    @Column(name = "realized_profit_loss", updatable = false, precision = 20, scale = 2)
    private BigDecimal realizedProfitLoss;

    /**
     * 가격 변동에 의한 손익 (수수료/세금 차감 후)
     */
    @Column(name = "price_profit_loss", updatable = false, precision = 20, scale = 2)
    private BigDecimal priceProfitLoss;

    /**
     * 환율 변동에 의한 손익 (해외 자산만)
     */
    @Column(name = "exchange_profit_loss", updatable = false, precision = 20, scale = 2)
    private BigDecimal exchangeProfitLoss;

    /**
     * 매수 평균 환율 (해외 자산 매도 시)
     */
    @Column(name = "purchase_average_exchange_rate", updatable = false, precision = 20, scale = 6)
    private BigDecimal purchaseAverageExchangeRate;

    /**
     * 매도 시점 환율 (해외 자산 매도 시)
     */
    @Column(name = "current_exchange_rate", updatable = false, precision = 20, scale = 6)
    private BigDecimal currentExchangeRate;

    @Column(name = "transaction_date", nullable = false, updatable = false)
    private LocalDateTime transactionDate;

    @Column(name = "description", updatable = false, length = 500)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (transactionDate == null) {
            transactionDate = createdAt;
        }
    }
}
