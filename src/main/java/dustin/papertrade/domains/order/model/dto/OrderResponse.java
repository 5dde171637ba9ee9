package dustin.papertrade.domains.order.model.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import dustin.papertrade.domains.order.model.ExitReason;
import dustin.papertrade.domains.order.model.OrderMethod;
import dustin.papertrade.domains.order.model.OrderStatus;
import dustin.papertrade.domains.order.model.OrderType;
import dustin.papertrade.domains.order.model.entity.Order;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 주문 응답 DTO
 * Order Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResponse {

    private Long id;
    private Long userId;
    private String stockId;
    private OrderType orderType;
    private OrderMethod orderMethod;
    private OrderStatus orderStatus;
    private BigDecimal quantity;
    private BigDecimal orderPrice;
    private String currency;
    private BigDecimal exchangeRate;

    /**
     * 미체결 수량
     */
    private BigDecimal remainingQuantity;

    private BigDecimal executedQuantity;
    private BigDecimal averagePrice;
    private BigDecimal reservedCash;
    private BigDecimal totalFee;
    private ExitReason exitReason;
    private LocalDateTime orderDate;
    private LocalDateTime executedDate;
    private LocalDateTime cancelledDate;
    private LocalDateTime expiresAt;

    public static OrderResponse from(Order order) {
        return OrderResponse.builder()
                .id(order.getId())
                .userId(order.getUserId())
                .stockId(order.getStockId())
                .orderType(order.getOrderType())
                .orderMethod(order.getOrderMethod())
                .orderStatus(order.getOrderStatus())
                .quantity(order.getQuantity())
                .orderPrice(order.getOrderPrice())
                .currency(order.getCurrency())
                .exchangeRate(order.getExchangeRate())
                .remainingQuantity(order.getRemainingQuantity())
                .executedQuantity(order.getExecutedQuantity())
                .averagePrice(order.getAveragePrice())
                .reservedCash(order.getReservedCash())
                .totalFee(order.getTotalFee())
                .exitReason(order.getExitReason())
                .orderDate(order.getOrderDate())
                .executedDate(order.getExecutedDate())
                .cancelledDate(order.getCancelledDate())
                .expiresAt(order.getExpiresAt())
                .build();
    }
}
