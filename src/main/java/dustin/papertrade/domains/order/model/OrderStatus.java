package dustin.papertrade.domains.order.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 주문 상태
 * Order Status
 * 
 * 상태 전이:
 * - PENDING → PARTIALLY_FILLED, FILLED, CANCELLED, REJECTED, EXPIRED
 * - PARTIALLY_FILLED → PARTIALLY_FILLED, FILLED, CANCELLED, EXPIRED
 * - FILLED, CANCELLED, REJECTED, EXPIRED: 종료 상태 (변경 불가)
 */
public enum OrderStatus {
    PENDING,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED,
    EXPIRED;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED || this == EXPIRED;
    }

    public boolean isOpen() {
        return !isTerminal();
    }

    public boolean canTransitionTo(OrderStatus next) {
        return allowedTransitions().contains(next);
    }

    private Set<OrderStatus> allowedTransitions() {
        switch (this) {
            case PENDING:
                return EnumSet.of(PARTIALLY_FILLED, FILLED, CANCELLED, REJECTED, EXPIRED);
            case PARTIALLY_FILLED:
                return EnumSet.of(PARTIALLY_FILLED, FILLED, CANCELLED, EXPIRED);
            default:
                return EnumSet.noneOf(OrderStatus.class);
        }
    }

    /**
     * 미체결(예약 유지) 상태 목록
     */
    public static List<OrderStatus> openStatuses() {
        return List.of(PENDING, PARTIALLY_FILLED);
    }
}
