package dustin.papertrade.domains.position.model.dto;

import java.math.BigDecimal;

import dustin.papertrade.domains.fee.model.ProfitLoss;
import dustin.papertrade.domains.position.model.entity.Portfolio;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 매도 체결 포지션 반영 결과
 * Position sell result
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionSellResult {

    private Portfolio portfolio;

    /**
     * 매도 직전 평균 매수가 (현지 통화)
     */
    private BigDecimal averagePrice;

    /**
     * 매도 직전 평균 매수 환율
     */
    private BigDecimal averageExchangeRate;

    /**
     * 매도 수량의 매수 원가 (원화)
     */
    private BigDecimal costBasis;

    private ProfitLoss profitLoss;
}
