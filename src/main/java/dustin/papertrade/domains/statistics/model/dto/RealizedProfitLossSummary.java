package dustin.papertrade.domains.statistics.model.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import dustin.papertrade.domains.statistics.model.PeriodType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 기간별 실현 손익 요약
 * Realized profit/loss summary for a period
 * 
 * - investedAmount = sellAmount - realizedProfitLoss (매도분의 매수 원가 + 수수료)
 * - profitLossRate = realizedProfitLoss / investedAmount * 100
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RealizedProfitLossSummary {

    private Long userId;

    private PeriodType periodType;

    /**
     * 조회 시작 시각 (포함)
     */
    private LocalDateTime from;

    /**
     * 조회 종료 시각 (미포함)
     */
    private LocalDateTime to;

    private BigDecimal realizedProfitLoss;

    private BigDecimal sellAmount;

    private BigDecimal investedAmount;

    private BigDecimal profitLossRate;

    private List<StockProfitLoss> stocks;
}
