package dustin.papertrade.shared.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 원장 에러 코드
 * Ledger Error Code
 * 
 * httpStatus는 호출 측 경계(HTTP 등)에서 매핑할 때 사용하는 힌트입니다.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    INSUFFICIENT_BALANCE("INSUFFICIENT_BALANCE", 400),
    NOT_FOUND("NOT_FOUND", 404),
    CONFLICT("CONFLICT", 409);

    private final String code;
    private final int httpStatus;
}
