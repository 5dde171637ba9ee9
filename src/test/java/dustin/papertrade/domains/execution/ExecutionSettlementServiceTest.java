package dustin.papertrade.domains.execution;

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
import dustin.papertrade.domains.balance.model.BalanceChangeType;
import dustin.papertrade.domains.balance.model.dto.BalanceResponse;
import dustin.papertrade.domains.balance.model.entity.VirtualBalanceHistory;
import dustin.papertrade.domains.balance.service.BalanceService;
import dustin.papertrade.domains.execution.service.ExecutionSettlementService;
import dustin.papertrade.domains.order.model.ExitReason;
import dustin.papertrade.domains.order.model.OrderMethod;
import dustin.papertrade.domains.order.model.OrderStatus;
import dustin.papertrade.domains.order.model.OrderType;
import dustin.papertrade.domains.order.model.dto.CreateOrderCommand;
import dustin.papertrade.domains.order.model.dto.ExecutionCommand;
import dustin.papertrade.domains.order.model.dto.ExecutionResult;
import dustin.papertrade.domains.order.model.entity.Order;
import dustin.papertrade.domains.order.service.OrderService;
import dustin.papertrade.domains.position.model.entity.Portfolio;
import dustin.papertrade.domains.position.repository.PortfolioRepository;
import dustin.papertrade.domains.transaction.model.TransactionType;
import dustin.papertrade.domains.transaction.model.entity.Transaction;
import dustin.papertrade.domains.transaction.service.TransactionService;
import dustin.papertrade.shared.exception.InsufficientBalanceException;
import dustin.papertrade.shared.exception.NotFoundException;
import dustin.papertrade.shared.exception.ValidationException;

/**
 * 체결 정산 서비스 테스트
 * Execution Settlement Service Test
 * 
 * 테스트 항목:
 * 1. 매수 체결 (전량, 슬리피지, 분할 체결)
 * 2. 매도 체결 (실현 손익, 청산 사유, 해외 종목 환율 손익)
 * 3. 체결 거부 (종료 주문, 초과 수량, 잘못된 가격, 없는 주문)
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
@Import(TestConfig.class)
class ExecutionSettlementServiceTest {

    private static final Long USER_ID = 3001L;
    private static final String STOCK_ID = "005930";

    @Autowired
    private ExecutionSettlementService executionSettlementService;

    @Autowired
    private OrderService orderService;

    @Autowired
    private BalanceService balanceService;

    @Autowired
    private PortfolioRepository portfolioRepository;

    @Autowired
    private TransactionService transactionService;

    @Autowired
    private MutableMarketPriceProvider marketPriceProvider;

    @BeforeEach
    void setUp() {
        marketPriceProvider.clear();
    }

    // =====================================================
    // 1. 매수 체결
    // =====================================================

    @Test
    @DisplayName("매수 10주 @ 10,000원 전량 체결: 현금 899,985원, 포지션 10주, 예약금 0")
    void fullBuyFill() {
        // given
        balanceService.openAccount(USER_ID, null);
        Order order = createOrder(USER_ID, STOCK_ID, OrderType.BUY, "10", "10000");

        // when
        ExecutionResult result = executionSettlementService.execute(fill(order.getId(), "10000", null));

        // then
        Order filled = result.getOrder();
        assertThat(filled.getOrderStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(filled.getExecutedQuantity()).isEqualByComparingTo("10");
        assertThat(filled.getAveragePrice()).isEqualByComparingTo("10000");
        assertThat(filled.getCommission()).isEqualByComparingTo("15.00");
        assertThat(filled.getReservedCash()).isEqualByComparingTo("0");
        assertThat(filled.getExecutedDate()).isEqualTo(TestConfig.NOW);

        BalanceResponse balance = balanceService.getBalance(USER_ID);
        assertThat(balance.getCashBalance()).isEqualByComparingTo("899985.00");
        assertThat(balance.getAvailableCash()).isEqualByComparingTo("899985.00");
        assertThat(balance.getInvestedAmount()).isEqualByComparingTo("100000.00");

        Portfolio portfolio = portfolioRepository.findByUserIdAndStockId(USER_ID, STOCK_ID).orElseThrow();
        assertThat(portfolio.getCurrentQuantity()).isEqualByComparingTo("10");
        assertThat(portfolio.getAveragePrice()).isEqualByComparingTo("10000");
        assertThat(portfolio.getFirstBuyDate()).isEqualTo(TestConfig.NOW);

        Transaction transaction = result.getTransaction();
        assertThat(transaction.getTransactionType()).isEqualTo(TransactionType.BUY);
        assertThat(transaction.getAmount()).isEqualByComparingTo("100000.00");
        assertThat(transaction.getNetAmount()).isEqualByComparingTo("100015.00");
        assertThat(transaction.getCashBalanceBefore()).isEqualByComparingTo("1000000");
        assertThat(transaction.getCashBalanceAfter()).isEqualByComparingTo("899985.00");

        VirtualBalanceHistory history = result.getBalanceHistory();
        assertThat(history.getChangeType()).isEqualTo(BalanceChangeType.BUY);
        assertThat(history.getChangeAmount()).isEqualByComparingTo("-100015.00");
        assertThat(history.getRelatedOrderId()).isEqualTo(order.getId());
    }

    @Test
    @DisplayName("지정가보다 낮은 가격(9,900원)에 체결되면 차액이 가용 잔고로 돌아옴")
    void favorableSlippage() {
        // given
        balanceService.openAccount(USER_ID, null);
        Order order = createOrder(USER_ID, STOCK_ID, OrderType.BUY, "10", "10000");

        // when
        executionSettlementService.execute(fill(order.getId(), "9900", null));

        // then: 99,000 + 14.85 차감
        BalanceResponse balance = balanceService.getBalance(USER_ID);
        assertThat(balance.getCashBalance()).isEqualByComparingTo("900985.15");
        assertThat(balance.getAvailableCash()).isEqualByComparingTo("900985.15");
    }

    @Test
    @DisplayName("상승 슬리피지로 실제 체결 금액이 가용 잔고를 넘으면 InsufficientBalanceException, 전체 롤백")
    void unfavorableSlippageBeyondAvailable() {
        // given: 100,100원으로 10주 @ 10,000원 예약 (가용 85원)
        balanceService.openAccount(USER_ID, new BigDecimal("100100"));
        Order order = createOrder(USER_ID, STOCK_ID, OrderType.BUY, "10", "10000");

        // when & then: 10,100원 체결 시 101,015.15원 필요
        assertThatThrownBy(() -> executionSettlementService.execute(fill(order.getId(), "10100", null)))
                .isInstanceOf(InsufficientBalanceException.class);
    }

    @Test
    @DisplayName("분할 체결 3주 @ 10,000원 + 7주 @ 11,000원: 평균 체결가 10,700원, 가용 잔고 = 현금 잔고")
    void partialFills() {
        // given
        balanceService.openAccount(USER_ID, null);
        Order order = createOrder(USER_ID, STOCK_ID, OrderType.BUY, "10", "10000");

        // when
        ExecutionResult first = executionSettlementService.execute(fill(order.getId(), "10000", "3"));

        // then
        assertThat(first.getOrder().getOrderStatus()).isEqualTo(OrderStatus.PARTIALLY_FILLED);
        assertThat(first.getOrder().getReservedCash()).isEqualByComparingTo("70010.50");

        // when
        ExecutionResult second = executionSettlementService.execute(fill(order.getId(), "11000", null));

        // then
        Order filled = second.getOrder();
        assertThat(filled.getOrderStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(filled.getAveragePrice()).isEqualByComparingTo("10700");
        assertThat(filled.getReservedCash()).isEqualByComparingTo("0");
        assertThat(orderService.getExecutions(USER_ID, order.getId())).hasSize(2);
        assertThat(transactionService.getOrderTransactions(order.getId()))
                .extracting(Transaction::getQuantity)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("3"), new BigDecimal("7"));

        BalanceResponse balance = balanceService.getBalance(USER_ID);
        assertThat(balance.getCashBalance()).isEqualByComparingTo("892983.95");
        assertThat(balance.getAvailableCash()).isEqualByComparingTo("892983.95");

        Portfolio portfolio = portfolioRepository.findByUserIdAndStockId(USER_ID, STOCK_ID).orElseThrow();
        assertThat(portfolio.getAveragePrice()).isEqualByComparingTo("10700");
    }

    // =====================================================
    // 2. 매도 체결
    // =====================================================

    @Test
    @DisplayName("수수료 2,000원, 세금 1,000원 지정 매도: 현금 1,016,985원, 실현 손익 17,000원, 익절")
    void sellWithExplicitFees() {
        // given
        balanceService.openAccount(USER_ID, null);
        holdShares(USER_ID, STOCK_ID, "10", "10000");
        Order sell = createOrder(USER_ID, STOCK_ID, OrderType.SELL, "10", "12000");

        // when
        ExecutionResult result = executionSettlementService.execute(ExecutionCommand.builder()
                .orderId(sell.getId())
                .executionPrice(new BigDecimal("12000"))
                .commission(new BigDecimal("2000"))
                .tax(new BigDecimal("1000"))
                .build());

        // then
        assertThat(result.getOrder().getExitReason()).isEqualTo(ExitReason.TAKE_PROFIT);
        assertThat(result.getOrder().getTotalFee()).isEqualByComparingTo("3000");

        Transaction transaction = result.getTransaction();
        assertThat(transaction.getTransactionType()).isEqualTo(TransactionType.SELL);
        assertThat(transaction.getNetAmount()).isEqualByComparingTo("117000.00");
        assertThat(transaction.getRealizedProfitLoss()).isEqualByComparingTo("17000.00");
        assertThat(transaction.getExchangeProfitLoss()).isNull();

        BalanceResponse balance = balanceService.getBalance(USER_ID);
        assertThat(balance.getCashBalance()).isEqualByComparingTo("1016985.00");
        assertThat(balance.getAvailableCash()).isEqualByComparingTo("1016985.00");
        assertThat(balance.getInvestedAmount()).isEqualByComparingTo("0");

        Portfolio portfolio = portfolioRepository.findByUserIdAndStockId(USER_ID, STOCK_ID).orElseThrow();
        assertThat(portfolio.getCurrentQuantity()).isEqualByComparingTo("0");
        assertThat(portfolio.getIsActive()).isFalse();
        assertThat(portfolio.getRealizedProfitLoss()).isEqualByComparingTo("17000.00");
    }

    @Test
    @DisplayName("평균가 아래 매도 4주 @ 9,000원: 실현 손익 -4,088.20원, 손절")
    void sellAtLoss() {
        // given
        balanceService.openAccount(USER_ID, null);
        holdShares(USER_ID, STOCK_ID, "10", "10000");
        Order sell = createOrder(USER_ID, STOCK_ID, OrderType.SELL, "4", "9000");

        // when: 수수료 5.40원 + 세금 82.80원
        ExecutionResult result = executionSettlementService.execute(fill(sell.getId(), "9000", null));

        // then
        assertThat(result.getOrder().getExitReason()).isEqualTo(ExitReason.STOP_LOSS);
        assertThat(result.getTransaction().getCommission()).isEqualByComparingTo("5.40");
        assertThat(result.getTransaction().getTax()).isEqualByComparingTo("82.80");
        assertThat(result.getTransaction().getRealizedProfitLoss()).isEqualByComparingTo("-4088.20");

        Portfolio portfolio = portfolioRepository.findByUserIdAndStockId(USER_ID, STOCK_ID).orElseThrow();
        assertThat(portfolio.getCurrentQuantity()).isEqualByComparingTo("6");
        assertThat(portfolio.getAveragePrice()).isEqualByComparingTo("10000");
        assertThat(portfolio.getIsActive()).isTrue();
    }

    @Test
    @DisplayName("해외 종목: 환율 1,300원 매수 → 1,350원 매도 시 가격 손익과 환율 손익 분리")
    void foreignSellSplitsProfitLoss() {
        // given
        balanceService.openAccount(USER_ID, null);
        marketPriceProvider.setQuote("AAPL", "100", "USD", "NASDAQ");
        marketPriceProvider.setExchangeRate("USD", "1300");
        holdShares(USER_ID, "AAPL", "5", "100");

        marketPriceProvider.setExchangeRate("USD", "1350");
        Order sell = createOrder(USER_ID, "AAPL", OrderType.SELL, "5", "110");

        // when: 체결 금액 742,500원, 수수료 111.38원, 세금 1,707.75원
        ExecutionResult result = executionSettlementService.execute(fill(sell.getId(), "110", null));

        // then
        Transaction transaction = result.getTransaction();
        assertThat(transaction.getAmount()).isEqualByComparingTo("742500.00");
        assertThat(transaction.getPriceProfitLoss()).isEqualByComparingTo("63180.87");
        assertThat(transaction.getExchangeProfitLoss()).isEqualByComparingTo("27500.00");
        assertThat(transaction.getRealizedProfitLoss()).isEqualByComparingTo("90680.87");
        assertThat(transaction.getPurchaseAverageExchangeRate()).isEqualByComparingTo("1300");
        assertThat(transaction.getCurrentExchangeRate()).isEqualByComparingTo("1350");

        // 1,000,000 - 650,097.50 + 742,500 - 1,819.13
        assertThat(balanceService.getBalance(USER_ID).getCashBalance()).isEqualByComparingTo("1090583.37");
    }

    // =====================================================
    // 3. 체결 거부
    // =====================================================

    @Test
    @DisplayName("종료된 주문, 잔량 초과 수량, 0원 체결가, 없는 주문은 체결할 수 없음")
    void rejectsInvalidExecutions() {
        // given
        balanceService.openAccount(USER_ID, null);
        Order filled = createOrder(USER_ID, STOCK_ID, OrderType.BUY, "1", "10000");
        executionSettlementService.execute(fill(filled.getId(), "10000", null));
        Order open = createOrder(USER_ID, STOCK_ID, OrderType.BUY, "2", "10000");

        // when & then
        assertThatThrownBy(() -> executionSettlementService.execute(fill(filled.getId(), "10000", null)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> executionSettlementService.execute(fill(open.getId(), "10000", "3")))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> executionSettlementService.execute(fill(open.getId(), "0", null)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> executionSettlementService.execute(fill(999_999L, "10000", null)))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("원화 주문에 1이 아닌 환율을 지정하면 ValidationException, 환율 1은 허용")
    void domesticOrderRejectsExchangeRate() {
        // given
        balanceService.openAccount(USER_ID, null);
        Order order = createOrder(USER_ID, STOCK_ID, OrderType.BUY, "2", "10000");

        // when
        ExecutionResult result = executionSettlementService.execute(ExecutionCommand.builder()
                .orderId(order.getId())
                .executionPrice(new BigDecimal("10000"))
                .executedQuantity(BigDecimal.ONE)
                .exchangeRate(BigDecimal.ONE)
                .build());

        // then
        assertThat(result.getTransaction().getAmount()).isEqualByComparingTo("10000.00");
        assertThatThrownBy(() -> executionSettlementService.execute(ExecutionCommand.builder()
                        .orderId(order.getId())
                        .executionPrice(new BigDecimal("10000"))
                        .exchangeRate(new BigDecimal("1300"))
                        .build()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("환율");
    }

    @Test
    @DisplayName("지정 수수료/세금은 그대로 반영되고, 소수점 2자리를 넘으면 ValidationException")
    void explicitFeesKeptVerbatim() {
        // given
        balanceService.openAccount(USER_ID, null);
        Order order = createOrder(USER_ID, STOCK_ID, OrderType.BUY, "2", "10000");

        // when
        ExecutionResult result = executionSettlementService.execute(ExecutionCommand.builder()
                .orderId(order.getId())
                .executionPrice(new BigDecimal("10000"))
                .executedQuantity(BigDecimal.ONE)
                .commission(new BigDecimal("15.50"))
                .tax(new BigDecimal("0.000"))
                .build());

        // then
        assertThat(result.getTransaction().getCommission()).isEqualByComparingTo("15.50");
        assertThat(result.getTransaction().getNetAmount()).isEqualByComparingTo("10015.50");
        assertThatThrownBy(() -> executionSettlementService.execute(ExecutionCommand.builder()
                        .orderId(order.getId())
                        .executionPrice(new BigDecimal("10000"))
                        .commission(new BigDecimal("15.005"))
                        .build()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("소수점");
    }

    @Test
    @DisplayName("주문별 잔고 이력은 예약 해제 없이 체결 단위로 기록됨")
    void balanceHistoryPerFill() {
        // given
        balanceService.openAccount(USER_ID, null);
        Order order = createOrder(USER_ID, STOCK_ID, OrderType.BUY, "4", "10000");

        // when
        executionSettlementService.execute(fill(order.getId(), "10000", "1"));
        executionSettlementService.execute(fill(order.getId(), "10000", "3"));

        // then
        List<VirtualBalanceHistory> histories = balanceService.getOrderHistory(order.getId());
        assertThat(histories).hasSize(2);
        assertThat(histories).allMatch(history -> history.getChangeType() == BalanceChangeType.BUY);
        assertThat(histories.get(1).getNewCashBalance()).isEqualByComparingTo("959994.00");
    }

    private void holdShares(Long userId, String stockId, String quantity, String price) {
        Order buy = createOrder(userId, stockId, OrderType.BUY, quantity, price);
        executionSettlementService.execute(fill(buy.getId(), price, null));
    }

    private Order createOrder(Long userId, String stockId, OrderType type, String quantity, String price) {
        return orderService.createOrder(CreateOrderCommand.builder()
                .userId(userId)
                .stockId(stockId)
                .orderType(type)
                .orderMethod(OrderMethod.LIMIT)
                .quantity(new BigDecimal(quantity))
                .orderPrice(new BigDecimal(price))
                .build());
    }

    private ExecutionCommand fill(Long orderId, String price, String quantity) {
        return ExecutionCommand.builder()
                .orderId(orderId)
                .executionPrice(new BigDecimal(price))
                .executedQuantity(quantity != null ? new BigDecimal(quantity) : null)
                .build();
    }
}
