package dustin.papertrade.domains.order.model.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import dustin.papertrade.domains.order.model.OrderMethod;
import dustin.papertrade.domains.order.model.OrderType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 주문 생성 명령
 * Create Order Command
 * 
 * 주문 조합:
 * 1. 지정가 매수: orderType=BUY, orderMethod=LIMIT, orderPrice 필수
 * 2. 시장가 매수: orderType=BUY, orderMethod=MARKET, orderPrice 무시 (기준가는 시세 제공자에서 조회)
 * 3. 손절/익절 매도: orderType=SELL, orderMethod=STOP_LOSS/TAKE_PROFIT, orderPrice 필수
 * 
 * 예시:
 * - "삼성전자를 70,000원에 10주 매수"
 *   → stockId='005930', orderType=BUY, orderMethod=LIMIT, orderPrice=70000, quantity=10
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderCommand {

    private Long userId;

    private String stockId;

    private OrderType orderType;

    private OrderMethod orderMethod;

    /**
     * 주문 수량 (0보다 커야 함)
     */
    private BigDecimal quantity;

    /**
     * 주문 가격 (현지 통화)
     * 
     * 필수값: LIMIT/STOP_LOSS/TAKE_PROFIT (0보다 커야 함)
     * MARKET: 무시 (NULL로 저장)
     */
    private BigDecimal orderPrice;

    /**
     * 만료 시각 (optional, 없으면 trading.order.default-time-to-live 적용)
     */
    private LocalDateTime expiresAt;

    private String notes;
}
