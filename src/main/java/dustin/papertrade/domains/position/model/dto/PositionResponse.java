package dustin.papertrade.domains.position.model.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 보유 종목 응답 DTO
 * Position Response DTO
 * 
 * 평가 손익은 시세 제공자에 현재가가 있을 때만 계산됩니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionResponse {

    private Long userId;
    private String stockId;
    private String currency;
    private BigDecimal currentQuantity;

    /**
     * 매도 가능 수량 (보유 수량 - 미체결 매도 주문 수량)
     */
    private BigDecimal sellableQuantity;

    private BigDecimal averagePrice;
    private BigDecimal averageExchangeRate;
    private BigDecimal krwAveragePrice;

    /**
     * 매수 원가 (원화)
     */
    private BigDecimal investedAmount;

    /**
     * 현재가 (현지 통화, 시세 없으면 null)
     */
    private BigDecimal currentPrice;

    /**
     * 평가 금액 (원화, 시세 없으면 null)
     */
    private BigDecimal evaluationAmount;

    /**
     * 평가 손익 (원화, 시세 없으면 null)
     */
    private BigDecimal unrealizedProfitLoss;

    /**
     * 평가 수익률 (%, 시세 없으면 null)
     */
    private BigDecimal unrealizedProfitLossRate;

    private BigDecimal realizedProfitLoss;
    private LocalDateTime firstBuyDate;
    private LocalDateTime lastBuyDate;
    private LocalDateTime lastSellDate;
}
