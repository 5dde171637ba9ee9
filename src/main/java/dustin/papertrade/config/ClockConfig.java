package dustin.papertrade.config;

import java.time.Clock;
import java.time.ZoneId;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 시계 설정
 * Clock Configuration
 * 
 * 주문 시각, 체결 시각, 만료 판정, 일별 통계 경계가 모두 이 Clock을 기준으로 계산됩니다.
 * 테스트에서는 고정 Clock으로 교체합니다.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(TradingProperties tradingProperties) {
        return Clock.system(ZoneId.of(tradingProperties.getZoneId()));
    }
}
