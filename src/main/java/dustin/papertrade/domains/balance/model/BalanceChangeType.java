package dustin.papertrade.domains.balance.model;

/**
 * 잔고 변경 유형
 * Balance Change Type
 */
public enum BalanceChangeType {
    INITIAL_DEPOSIT,
    DEPOSIT,
    WITHDRAW,
    BUY,
    SELL
}
