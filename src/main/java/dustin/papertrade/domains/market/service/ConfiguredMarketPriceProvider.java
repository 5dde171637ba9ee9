package dustin.papertrade.domains.market.service;

import java.math.BigDecimal;
import java.util.Optional;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import dustin.papertrade.config.TradingProperties;
import dustin.papertrade.domains.market.model.MarketQuote;
import lombok.RequiredArgsConstructor;

/**
 * 설정값 기반 시세 제공자
 * Static market price provider backed by trading.market.* properties
 * 
 * 설정 예:
 * - trading.market.quotes.005930.price=70000
 * - trading.market.quotes.AAPL.price=190.5
 * - trading.market.quotes.AAPL.currency=USD
 * - trading.market.exchange-rates.USD=1350
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "trading.market", name = "provider", havingValue = "static", matchIfMissing = true)
public class ConfiguredMarketPriceProvider implements MarketPriceProvider {

    private final TradingProperties tradingProperties;

    @Override
    public Optional<MarketQuote> getQuote(String stockId) {
        TradingProperties.Quote quote = tradingProperties.getMarket().getQuotes().get(stockId);
        if (quote == null || quote.getPrice() == null) {
            return Optional.empty();
        }
        return Optional.of(MarketQuote.builder()
                .stockId(stockId)
                .price(quote.getPrice())
                .currency(quote.getCurrency())
                .market(quote.getMarket())
                .build());
    }

    @Override
    public Optional<BigDecimal> getExchangeRate(String currency) {
        if (currency == null || "KRW".equalsIgnoreCase(currency)) {
            return Optional.of(BigDecimal.ONE);
        }
        return Optional.ofNullable(tradingProperties.getMarket().getExchangeRates().get(currency.toUpperCase()));
    }
}
