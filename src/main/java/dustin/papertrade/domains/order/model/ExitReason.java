package dustin.papertrade.domains.order.model;

/**
 * 매도 청산 사유 (체결가와 평균 매수가 비교)
 * Exit Reason
 */
public enum ExitReason {
    TAKE_PROFIT,
    STOP_LOSS
}
