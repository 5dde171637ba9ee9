package dustin.papertrade.shared.exception;

/**
 * 입력값 오류, 허용되지 않는 상태 전이, 과다 매도 시도
 * Validation Exception
 */
public class ValidationException extends TradingException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
