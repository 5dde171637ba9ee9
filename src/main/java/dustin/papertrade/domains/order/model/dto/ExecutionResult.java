package dustin.papertrade.domains.order.model.dto;

import dustin.papertrade.domains.balance.model.entity.VirtualBalanceHistory;
import dustin.papertrade.domains.order.model.entity.Order;
import dustin.papertrade.domains.order.model.entity.OrderExecution;
import dustin.papertrade.domains.transaction.model.entity.Transaction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 체결 정산 결과
 * Execution Result
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionResult {

    /**
     * 갱신된 주문
     */
    private Order order;

    /**
     * 이번 체결 내역
     */
    private OrderExecution execution;

    /**
     * 기록된 거래 원장
     */
    private Transaction transaction;

    private VirtualBalanceHistory balanceHistory;
}
