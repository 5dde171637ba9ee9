package dustin.papertrade.domains.statistics.scheduler;

import java.time.Clock;
import java.time.LocalDate;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import dustin.papertrade.domains.statistics.service.StatisticsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 거래 통계 스케줄러
 * Statistics Scheduler
 * 
 * 역할:
 * - 매일 전일 거래가 있는 모든 사용자의 일별 통계를 다시 집계
 * 
 * 실행 시점:
 * - trading.statistics.cron (기본 "0 10 0 * * ?" = 매일 00:10, trading.zone-id 기준)
 * 
 * 재시도:
 * - 실패 시 최대 3회 (1초, 2초 간격)
 * - 모두 실패하면 @Recover에서 에러 로그
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "trading.statistics", name = "scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class StatisticsScheduler {

    private final StatisticsService statisticsService;
    private final Clock clock;

    /**
     * 전일 통계 배치 작업
     * Daily statistics batch job for the previous day
     */
    @Scheduled(cron = "${trading.statistics.cron:0 10 0 * * ?}", zone = "${trading.zone-id:Asia/Seoul}")
    @Retryable(retryFor = Exception.class, maxAttempts = 3, backoff = @Backoff(delay = 1000, multiplier = 2))
    public void updatePreviousDayStatistics() {
        LocalDate yesterday = LocalDate.now(clock).minusDays(1);
        log.info("[StatisticsScheduler] 전일 통계 배치 작업 시작: date={}", yesterday);

        int count = statisticsService.updateDailyStatisticsForAllUsers(yesterday);

        log.info("[StatisticsScheduler] 전일 통계 배치 작업 완료: date={}, count={}", yesterday, count);
    }

    @Recover
    public void recover(Exception e) {
        log.error("[StatisticsScheduler] 전일 통계 배치 작업 최종 실패 (재시도 소진)", e);
    }
}
