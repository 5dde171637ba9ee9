package dustin.papertrade.shared.exception;

import java.util.Map;

import lombok.Getter;

/**
 * 원장 예외 기반 클래스
 * Base exception for ledger errors
 * 
 * 모든 하위 예외는 호출 측에서 복구 가능한 오류입니다 (4xx 계열).
 * 예상하지 못한 영속성 오류는 이 계층으로 감싸지 않고 그대로 전파되어 트랜잭션을 롤백합니다.
 */
@Getter
public abstract class TradingException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected TradingException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.details = Map.of();
    }

    protected TradingException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    protected TradingException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = Map.of();
    }
}
