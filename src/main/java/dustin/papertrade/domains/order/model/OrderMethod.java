package dustin.papertrade.domains.order.model;

/**
 * 주문 방식
 * Order Method
 * 
 * - MARKET: 시장가 (가격 없음, 기준가로 예약)
 * - LIMIT: 지정가
 * - STOP_LOSS / TAKE_PROFIT: 트리거 가격이 있는 지정가 (트리거 판단은 외부 시세 연동에서 수행)
 */
public enum OrderMethod {
    MARKET,
    LIMIT,
    STOP_LOSS,
    TAKE_PROFIT;

    public boolean requiresPrice() {
        return this != MARKET;
    }
}
