package dustin.papertrade.domains.statistics.model.dto;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 종목별 실현 손익
 * Realized profit/loss per stock
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockProfitLoss {

    private String stockId;

    private int sellTrades;

    private BigDecimal sellQuantity;

    private BigDecimal sellAmount;

    private BigDecimal realizedProfitLoss;

    /**
     * 가격 변동 손익
     */
    private BigDecimal priceProfitLoss;

    /**
     * 환율 변동 손익 (해외 자산)
     */
    private BigDecimal exchangeProfitLoss;
}
