package dustin.papertrade.domains.statistics.model.entity;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 거래 통계 엔티티
 * Trading Statistics Entity
 * 
 * 역할:
 * - 사용자별 일별 거래 집계 저장
 * - 같은 (user_id, period_type, stat_date)로 다시 집계하면 덮어씀
 * 
 * 집계 항목:
 * - 거래 건수 (매수/매도 구분), 매수/매도 금액, 수수료, 세금
 * - 실현 손익 합계, 수익/손실 매도 건수, 승률
 */
@Entity
@Table(name = "trading_statistics",
       uniqueConstraints = @UniqueConstraint(
           name = "uk_trading_statistics_user_period_date",
           columnNames = {"user_id", "period_type", "stat_date"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradingStatistics {

    public static final String PERIOD_DAILY = "daily";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    /**
     * 집계 단위 (현재 "daily"만 사용)
     */
    @Column(name = "period_type", nullable = false, length = 20)
    @Builder.Default
    private String periodType = PERIOD_DAILY;

    @Column(name = "stat_date", nullable = false)
    private LocalDate statDate;

    @Column(name = "total_trades", nullable = false)
    @Builder.Default
    private Integer totalTrades = 0;

    @Column(name = "buy_trades", nullable = false)
    @Builder.Default
    private Integer buyTrades = 0;

    @Column(name = "sell_trades", nullable = false)
    @Builder.Default
    private Integer sellTrades = 0;

    @Column(name = "total_buy_amount", nullable = false, precision = 20, scale = 2)
    @Builder.Default
    private BigDecimal totalBuyAmount = BigDecimal.ZERO;

    @Column(name = "total_sell_amount", nullable = false, precision = 20, scale = 2)
    @Builder.Default
    private BigDecimal totalSellAmount = BigDecimal.ZERO;

    @Column(name = "total_commission", nullable = false, precision = 20, scale = 2)
    @Builder.Default
    private BigDecimal totalCommission = BigDecimal.ZERO;

    @Column(name = "total_tax", nullable = false, precision = 20, scale = 2)
    @Builder.Default
    private BigDecimal totalTax = BigDecimal.ZERO;

    @Column(name = "realized_profit_loss", nullable = false, precision = 20, scale = 2)
    @Builder.Default
    private BigDecimal realizedProfitLoss = BigDecimal.ZERO;

    /**
     * 실현 손익 > 0 인 매도 건수
     */
    @Column(name = "win_trades", nullable = false)
    @Builder.Default
    private Integer winTrades = 0;

    /**
     * 실현 손익 < 0 인 매도 건수
     */
    @Column(name = "loss_trades", nullable = false)
    @Builder.Default
    private Integer lossTrades = 0;

    /**
     * 승률 (%) = win_trades / sell_trades * 100
     */
    @Column(name = "win_rate", nullable = false, precision = 5, scale = 2)
    @Builder.Default
    private BigDecimal winRate = BigDecimal.ZERO;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

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
