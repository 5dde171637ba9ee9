package dustin.papertrade.domains.market.service;

import java.math.BigDecimal;
import java.util.Optional;

import dustin.papertrade.domains.market.model.MarketQuote;

/**
 * 시세 제공자
 * Market Price Provider
 * 
 * 역할:
 * - 시장가 주문의 기준 가격, 종목 통화/시장 구분 제공
 * - 해외 자산 원화 환율 제공
 * 
 * 주의사항:
 * - 읽기 전용, 원장 트랜잭션 진입 전에만 호출됨
 * - 시세가 없으면 Optional.empty() (예외 대신)
 */
public interface MarketPriceProvider {

    /**
     * 종목 시세 조회
     * 
     * @param stockId 종목 코드
     * @return 시세 (없으면 Optional.empty())
     */
    Optional<MarketQuote> getQuote(String stockId);

    /**
     * 원화 환율 조회
     * 
     * @param currency 통화 (예: USD)
     * @return 1 단위 통화의 원화 가격 (KRW는 항상 1)
     */
    Optional<BigDecimal> getExchangeRate(String currency);
}
