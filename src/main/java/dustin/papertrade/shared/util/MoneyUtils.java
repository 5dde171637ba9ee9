package dustin.papertrade.shared.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 금액/가격/환율 스케일 처리
 * Decimal scale helpers
 * 
 * - 금액(원화): 소수점 2자리
 * - 가격, 수량: 소수점 8자리
 * - 환율: 소수점 6자리
 * 반올림은 모두 HALF_UP
 */
public final class MoneyUtils {

    public static final int MONEY_SCALE = 2;
    public static final int PRICE_SCALE = 8;
    public static final int RATE_SCALE = 6;

    private MoneyUtils() {
    }

    public static BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal price(BigDecimal value) {
        return value.setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal rate(BigDecimal value) {
        return value.setScale(RATE_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal nvl(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
