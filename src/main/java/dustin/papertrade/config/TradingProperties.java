package dustin.papertrade.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 모의 투자 원장 설정
 * Trading Ledger Configuration
 * 
 * 역할:
 * - 초기 가상 잔고, 기본 수수료율, 주문 만료/시장가 처리 정책
 * - 통계 배치, 시세 제공자, Kafka 이벤트 발행 설정
 * 
 * 설정 방법:
 * - application.properties에서 trading.* 로 설정
 * - 환경변수로 오버라이드 가능
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "trading")
public class TradingProperties {

    /**
     * 날짜 경계(일별 통계) 계산에 사용하는 시간대
     * Time zone for day boundaries
     */
    @NotBlank
    private String zoneId = "Asia/Seoul";

    @Valid
    private Balance balance = new Balance();

    @Valid
    private Fee fee = new Fee();

    @Valid
    private Order order = new Order();

    @Valid
    private Statistics statistics = new Statistics();

    @Valid
    private Market market = new Market();

    @Valid
    private Kafka kafka = new Kafka();

    @Data
    public static class Balance {
        /**
         * 계좌 개설 시 지급되는 초기 가상 현금
         * Initial virtual cash on account opening
         */
        @NotNull
        @DecimalMin("0")
        private BigDecimal initialCash = new BigDecimal("1000000");
    }

    /**
     * 기본 수수료 스케줄 (fee_configs 테이블에 설정이 없을 때 사용)
     * Default fee schedule
     */
    @Data
    public static class Fee {
        /**
         * 매수/매도 공통 수수료율 (예: 0.00015 = 0.015%)
         */
        @NotNull
        @DecimalMin("0")
        private BigDecimal commissionRate = new BigDecimal("0.00015");

        /**
         * 매도 거래세율 (예: 0.0023 = 0.23%)
         */
        @NotNull
        @DecimalMin("0")
        private BigDecimal taxRate = new BigDecimal("0.0023");

        /**
         * 최소 수수료 (원)
         */
        @NotNull
        @DecimalMin("0")
        private BigDecimal minCommission = BigDecimal.ZERO;
    }

    @Data
    public static class Order {
        /**
         * 주문 기본 유효 기간 (null이면 만료 없음)
         * Default order time-to-live
         */
        private Duration defaultTimeToLive;

        /**
         * 시장가 주문을 접수 직후 기준가로 즉시 체결할지 여부
         */
        private boolean executeMarketImmediately = true;

        /**
         * 주문 만료 스케줄러 활성화 여부
         */
        private boolean expirySchedulerEnabled = true;

        /**
         * 주문 만료 스케줄러 실행 간격 (ms)
         */
        private long expiryIntervalMs = 60000;
    }

    @Data
    public static class Statistics {
        /**
         * 전일 통계 배치 실행 시점 (기본: 매일 00:10)
         */
        @NotBlank
        private String cron = "0 10 0 * * ?";

        private boolean schedulerEnabled = true;
    }

    @Data
    public static class Market {
        /**
         * 시세 제공자: static (설정값) 또는 http
         */
        @NotBlank
        private String provider = "static";

        /**
         * 정적 시세 테이블 (종목 코드 -> 시세)
         */
        private Map<String, Quote> quotes = new HashMap<>();

        /**
         * 정적 환율 테이블 (통화 -> 원화 환율)
         */
        private Map<String, BigDecimal> exchangeRates = new HashMap<>();

        @Valid
        private Http http = new Http();
    }

    @Data
    public static class Quote {
        private BigDecimal price;
        private String currency = "KRW";
        private String market = "KRX";
    }

    @Data
    public static class Http {
        private String baseUrl = "http://localhost:8000";
        private int timeoutMs = 3000;
    }

    @Data
    public static class Kafka {
        /**
         * 체결 정산 이벤트 토픽
         */
        @NotBlank
        private String topic = "transaction-settled";

        /**
         * 이벤트 발행 여부 (브로커가 없는 환경에서는 false)
         */
        private boolean publishEnabled = true;

        /**
         * 리스너 컨테이너 자동 시작 여부
         */
        private boolean listenerAutoStartup = true;
    }
}
