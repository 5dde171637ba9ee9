package dustin.papertrade.domains.balance.model.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 잔고 요약 DTO
 * Balance Summary DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BalanceResponse {

    private Long userId;

    /**
     * 총 현금 잔고
     */
    private BigDecimal cashBalance;

    /**
     * 주문 가능 현금
     */
    private BigDecimal availableCash;

    /**
     * 미체결 매수 주문에 예약된 현금 (cashBalance - availableCash)
     */
    private BigDecimal reservedCash;

    /**
     * 보유 포지션 매수 원가 합계
     */
    private BigDecimal investedAmount;

    private BigDecimal totalBuyAmount;
    private BigDecimal totalSellAmount;
    private BigDecimal totalCommission;
    private BigDecimal totalTax;
    private LocalDateTime lastTradeDate;
}
