package dustin.papertrade.domains.position.model.entity;

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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 보유 종목 엔티티
 * Portfolio Entity (position book entry)
 * 
 * 역할:
 * - 사용자별 종목 보유 수량과 평균 매수가 관리
 * - 매수 체결마다 가중 평균으로 평균 매수가 갱신
 * - 매도 체결 시 평균 매수가는 유지, 수량만 감소
 * 
 * 포지션 계산:
 * - 평균 매수가 = (기존 수량 * 기존 평균가 + 체결 수량 * 체결가) / (기존 수량 + 체결 수량)
 * - 해외 자산: 평균 환율도 같은 방식으로 가중 평균
 * - krw_average_price = average_price * average_exchange_rate
 * 
 * 수량이 0이 되면:
 * - is_active = false
 * - 평균가/평균 환율 0으로 초기화 (다음 매수 시 새로 계산)
 */
@Entity
@Table(name = "portfolios",
       uniqueConstraints = @UniqueConstraint(name = "uk_portfolios_user_stock", columnNames = {"user_id", "stock_id"}),
       indexes = {
           @Index(name = "idx_portfolios_user_id", columnList = "user_id,is_active")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Portfolio {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    /**
     * 종목 코드 (예: 005930, AAPL, BTC)
     */
    @Column(name = "stock_id", nullable = false, length = 50)
    private String stockId;

    /**
     * 종목 통화 (KRW, USD ...)
     */
    @Column(name = "currency", nullable = false, length = 10)
    @Builder.Default
    private String currency = "KRW";

    /**
     * 현재 보유 수량 (0 이상)
     */
    @Column(name = "current_quantity", nullable = false, precision = 20, scale = 8)
    @Builder.Default
    private BigDecimal currentQuantity = BigDecimal.ZERO;

    /**
     * 평균 매수가 (현지 통화)
     */
    @Column(name = "average_price", nullable = false, precision = 20, scale = 8)
    @Builder.Default
    private BigDecimal averagePrice = BigDecimal.ZERO;

    /**
     * 평균 매수 환율 (원화 자산은 1)
     */
    @Column(name = "average_exchange_rate", nullable = false, precision = 20, scale = 6)
    @Builder.Default
    private BigDecimal averageExchangeRate = BigDecimal.ONE;

    /**
     * 원화 환산 평균 매수가
     */
    @Column(name = "krw_average_price", nullable = false, precision = 20, scale = 8)
    @Builder.Default
    private BigDecimal krwAveragePrice = BigDecimal.ZERO;

    /**
     * 누적 실현 손익 (원화)
     */
    @Column(name = "realized_profit_loss", nullable = false, precision = 20, scale = 2)
    @Builder.Default
    private BigDecimal realizedProfitLoss = BigDecimal.ZERO;

    @Column(name = "first_buy_date")
    private LocalDateTime firstBuyDate;

    @Column(name = "last_buy_date")
    private LocalDateTime lastBuyDate;

    @Column(name = "last_sell_date")
    private LocalDateTime lastSellDate;

    /**
     * 활성 보유 여부 (수량 > 0)
     */
    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

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
