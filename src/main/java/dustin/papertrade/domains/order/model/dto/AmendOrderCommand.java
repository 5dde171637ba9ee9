package dustin.papertrade.domains.order.model.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 주문 정정 명령
 * Amend Order Command
 * 
 * NULL인 필드는 변경하지 않습니다.
 * 
 * 예시:
 * - "미체결 매수 10주를 15주 @ 9,500원으로 정정"
 *   → quantity=15, orderPrice=9500
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AmendOrderCommand {

    /**
     * 새 주문 가격 (LIMIT/STOP_LOSS/TAKE_PROFIT만 가능, 0보다 커야 함)
     */
    private BigDecimal orderPrice;

    /**
     * 새 주문 수량 (이미 체결된 수량보다 커야 함)
     */
    private BigDecimal quantity;

    private LocalDateTime expiresAt;

    private String notes;

    public boolean changesQuantityOrPrice() {
        return quantity != null || orderPrice != null;
    }
}
