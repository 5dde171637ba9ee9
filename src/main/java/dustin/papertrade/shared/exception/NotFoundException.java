package dustin.papertrade.shared.exception;

/**
 * 주문, 계좌, 포지션을 찾을 수 없을 때
 * Not Found Exception
 */
public class NotFoundException extends TradingException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
