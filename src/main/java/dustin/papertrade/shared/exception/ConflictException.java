package dustin.papertrade.shared.exception;

/**
 * 동시 수정 충돌
 * Conflict Exception
 * 
 * 락 대기 시간 초과 또는 버전 충돌로 작업을 완료하지 못한 경우 발생합니다.
 * 재시도 여부는 호출 측이 결정합니다.
 */
public class ConflictException extends TradingException {

    public ConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }

    public ConflictException(String message, Throwable cause) {
        super(ErrorCode.CONFLICT, message, cause);
    }
}
