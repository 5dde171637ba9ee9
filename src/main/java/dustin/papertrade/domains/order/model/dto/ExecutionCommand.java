package dustin.papertrade.domains.order.model.dto;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 체결 명령 (시세 피드/매칭 로직에서 전달)
 * Execution Command
 * 
 * - executionPrice: 필수, 0보다 큼 (현지 통화)
 * - executedQuantity: 없으면 미체결 잔량 전부
 * - commission, tax: 없으면 FeeCalculator로 계산, 있으면 그대로 사용 (0 이상)
 * - exchangeRate: 없으면 주문 접수 시점 환율
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionCommand {

    private Long orderId;

    private BigDecimal executionPrice;

    private BigDecimal executedQuantity;

    private BigDecimal commission;

    private BigDecimal tax;

    private BigDecimal exchangeRate;
}
