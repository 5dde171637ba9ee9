package dustin.papertrade.domains.order;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import dustin.papertrade.config.TestConfig;
import dustin.papertrade.domains.order.scheduler.OrderExpiryScheduler;
import dustin.papertrade.domains.order.service.OrderService;

@ExtendWith(MockitoExtension.class)
class OrderExpirySchedulerTest {

    @Mock
    private OrderService orderService;

    @Test
    @DisplayName("현재 시각 기준으로 만료 대상 주문을 처리")
    void expiresAsOfNow() {
        // given
        when(orderService.expireOrders(TestConfig.NOW)).thenReturn(2);
        OrderExpiryScheduler scheduler = new OrderExpiryScheduler(
                orderService, Clock.fixed(TestConfig.FIXED_INSTANT, TestConfig.ZONE));

        // when
        scheduler.expireOrders();

        // then
        verify(orderService).expireOrders(TestConfig.NOW);
    }
}
