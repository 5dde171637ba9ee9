package dustin.papertrade.domains.order.model;

/**
 * 주문 유형
 * Order Type
 */
public enum OrderType {
    BUY,
    SELL
}
