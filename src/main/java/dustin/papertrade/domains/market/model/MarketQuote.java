package dustin.papertrade.domains.market.model;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 종목 시세
 * Market Quote
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketQuote {

    private String stockId;

    /**
     * 현재가 (현지 통화)
     */
    private BigDecimal price;

    /**
     * 통화 (KRW, USD ...)
     */
    @Builder.Default
    private String currency = "KRW";

    /**
     * 시장 구분 (KRX, NASDAQ, UPBIT ...) - 수수료 테이블 조회 키
     */
    private String market;

    public boolean isDomestic() {
        return currency == null || "KRW".equalsIgnoreCase(currency);
    }
}
