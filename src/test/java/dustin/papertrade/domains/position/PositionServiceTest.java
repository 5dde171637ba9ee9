package dustin.papertrade.domains.position;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import dustin.papertrade.config.MutableMarketPriceProvider;
import dustin.papertrade.config.TestConfig;
import dustin.papertrade.domains.balance.service.BalanceService;
import dustin.papertrade.domains.execution.service.ExecutionSettlementService;
import dustin.papertrade.domains.order.model.OrderMethod;
import dustin.papertrade.domains.order.model.OrderType;
import dustin.papertrade.domains.order.model.dto.CreateOrderCommand;
import dustin.papertrade.domains.order.model.dto.ExecutionCommand;
import dustin.papertrade.domains.order.model.entity.Order;
import dustin.papertrade.domains.order.service.OrderService;
import dustin.papertrade.domains.position.model.dto.PositionResponse;
import dustin.papertrade.domains.position.service.PositionService;
import dustin.papertrade.shared.exception.NotFoundException;

/**
 * 보유 종목 서비스 테스트
 * Position Service Test
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
@Import(TestConfig.class)
class PositionServiceTest {

    private static final Long USER_ID = 4001L;
    private static final String STOCK_ID = "005930";

    @Autowired
    private PositionService positionService;

    @Autowired
    private OrderService orderService;

    @Autowired
    private ExecutionSettlementService executionSettlementService;

    @Autowired
    private BalanceService balanceService;

    @Autowired
    private MutableMarketPriceProvider marketPriceProvider;

    @BeforeEach
    void setUp() {
        marketPriceProvider.clear();
        balanceService.openAccount(USER_ID, null);
    }

    @Test
    @DisplayName("현재가 12,000원이면 10주 @ 10,000원 포지션의 평가 손익은 20,000원 (20.00%)")
    void evaluatesWithQuote() {
        // given
        buy(STOCK_ID, "10", "10000", null);
        marketPriceProvider.setQuote(STOCK_ID, "12000");

        // when
        List<PositionResponse> positions = positionService.getPositions(USER_ID);

        // then
        assertThat(positions).hasSize(1);
        PositionResponse position = positions.get(0);
        assertThat(position.getInvestedAmount()).isEqualByComparingTo("100000.00");
        assertThat(position.getCurrentPrice()).isEqualByComparingTo("12000");
        assertThat(position.getEvaluationAmount()).isEqualByComparingTo("120000.00");
        assertThat(position.getUnrealizedProfitLoss()).isEqualByComparingTo("20000.00");
        assertThat(position.getUnrealizedProfitLossRate()).isEqualByComparingTo("20.00");
    }

    @Test
    @DisplayName("시세가 없으면 평가 항목은 비어 있음")
    void noQuoteNoEvaluation() {
        // given
        buy(STOCK_ID, "2", "10000", null);

        // when
        PositionResponse position = positionService.getPosition(USER_ID, STOCK_ID);

        // then
        assertThat(position.getCurrentQuantity()).isEqualByComparingTo("2");
        assertThat(position.getCurrentPrice()).isNull();
        assertThat(position.getEvaluationAmount()).isNull();
    }

    @Test
    @DisplayName("미체결 매도 3주가 있으면 매도 가능 수량은 7주")
    void sellableQuantity() {
        // given
        buy(STOCK_ID, "10", "10000", null);
        orderService.createOrder(order(STOCK_ID, OrderType.SELL, "3", "11000"));

        // when & then
        assertThat(positionService.getSellableQuantity(USER_ID, STOCK_ID)).isEqualByComparingTo("7");
        assertThat(positionService.getPosition(USER_ID, STOCK_ID).getSellableQuantity()).isEqualByComparingTo("7");
        assertThat(positionService.getSellableQuantity(USER_ID, "000660")).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("해외 종목 추가 매수 시 평균가와 평균 환율이 수량 가중 평균으로 갱신됨")
    void weightedAverageForForeignStock() {
        // given
        marketPriceProvider.setQuote("AAPL", "100", "USD", "NASDAQ");
        marketPriceProvider.setExchangeRate("USD", "1300");

        // when: 2주 @ 100 (환율 1,300) + 2주 @ 110 (체결 환율 1,400)
        buy("AAPL", "2", "100", null);
        buy("AAPL", "2", "110", "1400");

        // then
        PositionResponse position = positionService.getPosition(USER_ID, "AAPL");
        assertThat(position.getCurrency()).isEqualTo("USD");
        assertThat(position.getCurrentQuantity()).isEqualByComparingTo("4");
        assertThat(position.getAveragePrice()).isEqualByComparingTo("105");
        assertThat(position.getAverageExchangeRate()).isEqualByComparingTo("1350");
        assertThat(position.getKrwAveragePrice()).isEqualByComparingTo("141750");
    }

    @Test
    @DisplayName("전량 매도한 종목은 목록에서 제외됨")
    void closedPositionExcluded() {
        // given
        buy(STOCK_ID, "1", "10000", null);
        Order sell = orderService.createOrder(order(STOCK_ID, OrderType.SELL, "1", "10000"));
        executionSettlementService.execute(ExecutionCommand.builder()
                .orderId(sell.getId())
                .executionPrice(new BigDecimal("10000"))
                .build());

        // when & then
        assertThat(positionService.getPositions(USER_ID)).isEmpty();
        assertThat(positionService.getPosition(USER_ID, STOCK_ID).getCurrentQuantity()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("보유 이력이 없는 종목 조회 시 NotFoundException")
    void positionNotFound() {
        assertThatThrownBy(() -> positionService.getPosition(USER_ID, "035720"))
                .isInstanceOf(NotFoundException.class);
    }

    private void buy(String stockId, String quantity, String price, String exchangeRate) {
        Order order = orderService.createOrder(order(stockId, OrderType.BUY, quantity, price));
        executionSettlementService.execute(ExecutionCommand.builder()
                .orderId(order.getId())
                .executionPrice(new BigDecimal(price))
                .exchangeRate(exchangeRate != null ? new BigDecimal(exchangeRate) : null)
                .build());
    }

    private CreateOrderCommand order(String stockId, OrderType type, String quantity, String price) {
        return CreateOrderCommand.builder()
                .userId(USER_ID)
                .stockId(stockId)
                .orderType(type)
                .orderMethod(OrderMethod.LIMIT)
                .quantity(new BigDecimal(quantity))
                .orderPrice(new BigDecimal(price))
                .build();
    }
}
