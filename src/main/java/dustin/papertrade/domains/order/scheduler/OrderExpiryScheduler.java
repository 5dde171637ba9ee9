package dustin.papertrade.domains.order.scheduler;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import dustin.papertrade.domains.order.service.OrderService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 주문 만료 스케줄러
 * Order Expiry Scheduler
 * 
 * 역할:
 * - 만료 시각이 지난 미체결 주문을 주기적으로 EXPIRED 처리
 * - 매수 주문의 남은 예약금 해제
 * 
 * 실행 주기:
 * - trading.order.expiry-interval-ms (기본 60초, 이전 실행 종료 기준)
 * - trading.order.expiry-scheduler-enabled=false 이면 등록되지 않음
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "trading.order", name = "expiry-scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class OrderExpiryScheduler {

    private final OrderService orderService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${trading.order.expiry-interval-ms:60000}")
    public void expireOrders() {
        LocalDateTime now = LocalDateTime.now(clock);
        int expired = orderService.expireOrders(now);
        if (expired > 0) {
            log.info("[OrderExpiryScheduler] 만료 주문 처리: asOf={}, count={}", now, expired);
        }
    }
}
