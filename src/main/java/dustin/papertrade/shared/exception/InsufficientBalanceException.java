package dustin.papertrade.shared.exception;

import java.math.BigDecimal;
import java.util.Map;

import lombok.Getter;

/**
 * 잔고 부족 예외
 * Insufficient Balance Exception
 * 
 * 주문 예약 또는 출금 시 가용 잔고가 요청 금액보다 적을 때 발생합니다.
 */
@Getter
public class InsufficientBalanceException extends TradingException {

    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientBalanceException(BigDecimal required, BigDecimal available) {
        super(ErrorCode.INSUFFICIENT_BALANCE,
                String.format("가용 잔고가 부족합니다. 필요 금액: %s원, 가용 잔고: %s원",
                        required.toPlainString(), available.toPlainString()),
                Map.of("required", required, "available", available));
        this.required = required;
        this.available = available;
    }
}
