package dustin.papertrade.domains.transaction.model;

/**
 * 거래 유형
 * Transaction Type
 */
public enum TransactionType {
    BUY,
    SELL,
    DEPOSIT,
    WITHDRAW;

    public boolean isTrade() {
        return this == BUY || this == SELL;
    }
}
