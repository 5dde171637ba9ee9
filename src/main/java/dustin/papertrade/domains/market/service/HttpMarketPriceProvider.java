package dustin.papertrade.domains.market.service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;

import dustin.papertrade.config.TradingProperties;
import dustin.papertrade.domains.market.model.MarketQuote;
import lombok.extern.slf4j.Slf4j;

/**
 * 외부 시세 서버 HTTP 클라이언트
 * HTTP Market Price Provider
 * 
 * 역할:
 * - 시세 서버에서 종목 현재가와 환율 조회 (동기)
 * 
 * API:
 * - GET {baseUrl}/api/v1/stocks/{stockId}/price → {"price": "70000", "currency": "KRW", "market": "KRX"}
 * - GET {baseUrl}/api/v1/exchange-rates/{currency} → {"rate": "1350.5"}
 * 
 * 주의사항:
 * - 원장 트랜잭션 밖에서만 호출됨
 * - 통신 실패/응답 오류 시 Optional.empty() 반환 (호출 측에서 시장가 주문 거부)
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "trading.market", name = "provider", havingValue = "http")
public class HttpMarketPriceProvider implements MarketPriceProvider {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public HttpMarketPriceProvider(RestTemplateBuilder restTemplateBuilder, TradingProperties tradingProperties) {
        TradingProperties.Http http = tradingProperties.getMarket().getHttp();
        this.baseUrl = http.getBaseUrl();
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(Duration.ofMillis(http.getTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(http.getTimeoutMs()))
                .build();
        log.info("[HttpMarketPriceProvider] 시세 클라이언트 초기화: baseUrl={}, timeoutMs={}", baseUrl, http.getTimeoutMs());
    }

    @Override
    public Optional<MarketQuote> getQuote(String stockId) {
        try {
            ResponseEntity<JsonNode> response = restTemplate.getForEntity(
                    baseUrl + "/api/v1/stocks/{stockId}/price", JsonNode.class, stockId);
            JsonNode body = response.getBody();
            if (!response.getStatusCode().is2xxSuccessful() || body == null || !body.hasNonNull("price")) {
                log.warn("[HttpMarketPriceProvider] 시세 응답 없음: stockId={}, status={}", stockId, response.getStatusCode());
                return Optional.empty();
            }
            return Optional.of(MarketQuote.builder()
                    .stockId(stockId)
                    .price(new BigDecimal(body.get("price").asText()))
                    .currency(body.hasNonNull("currency") ? body.get("currency").asText() : "KRW")
                    .market(body.hasNonNull("market") ? body.get("market").asText() : null)
                    .build());
        } catch (RestClientException e) {
            log.error("[HttpMarketPriceProvider] 시세 조회 실패: stockId={}, error={}", stockId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<BigDecimal> getExchangeRate(String currency) {
        if (currency == null || "KRW".equalsIgnoreCase(currency)) {
            return Optional.of(BigDecimal.ONE);
        }
        try {
            JsonNode body = restTemplate.getForObject(
                    baseUrl + "/api/v1/exchange-rates/{currency}", JsonNode.class, currency.toUpperCase());
            if (body == null || !body.hasNonNull("rate")) {
                log.warn("[HttpMarketPriceProvider] 환율 응답 없음: currency={}", currency);
                return Optional.empty();
            }
            return Optional.of(new BigDecimal(body.get("rate").asText()));
        } catch (RestClientException e) {
            log.error("[HttpMarketPriceProvider] 환율 조회 실패: currency={}, error={}", currency, e.getMessage());
            return Optional.empty();
        }
    }
}
