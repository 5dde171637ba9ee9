package dustin.papertrade.domains.fee.model;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 매도 실현 손익 (원화)
 * Realized profit/loss of a sell fill
 * 
 * - priceProfitLoss: 가격 변동 손익 (수수료/세금 차감)
 * - exchangeProfitLoss: 환율 변동 손익 (원화 자산은 null)
 * - realizedProfitLoss = priceProfitLoss + exchangeProfitLoss
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfitLoss {

    private BigDecimal priceProfitLoss;

    private BigDecimal exchangeProfitLoss;

    private BigDecimal realizedProfitLoss;
}
