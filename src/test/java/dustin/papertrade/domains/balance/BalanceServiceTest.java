package dustin.papertrade.domains.balance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import dustin.papertrade.config.TestConfig;
import dustin.papertrade.domains.balance.model.BalanceChangeType;
import dustin.papertrade.domains.balance.model.dto.BalanceResponse;
import dustin.papertrade.domains.balance.model.entity.VirtualBalance;
import dustin.papertrade.domains.balance.model.entity.VirtualBalanceHistory;
import dustin.papertrade.domains.balance.service.BalanceService;
import dustin.papertrade.domains.order.model.OrderMethod;
import dustin.papertrade.domains.order.model.OrderType;
import dustin.papertrade.domains.order.model.dto.CreateOrderCommand;
import dustin.papertrade.domains.order.model.entity.Order;
import dustin.papertrade.domains.order.service.OrderService;
import dustin.papertrade.domains.transaction.model.TransactionType;
import dustin.papertrade.domains.transaction.model.entity.Transaction;
import dustin.papertrade.domains.transaction.service.TransactionService;
import dustin.papertrade.shared.exception.ConflictException;
import dustin.papertrade.shared.exception.InsufficientBalanceException;
import dustin.papertrade.shared.exception.NotFoundException;
import dustin.papertrade.shared.exception.ValidationException;

/**
 * 가상 잔고 서비스 통합 테스트
 * Balance Service Integration Test
 * 
 * 테스트 항목:
 * 1. 계좌 개설 (초기 잔고, 중복 개설)
 * 2. 입금 / 출금
 * 3. 계좌 초기화
 * 4. 잔고 요약 조회 (예약 금액)
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
@Import(TestConfig.class)
class BalanceServiceTest {

    private static final Long USER_ID = 1001L;

    @Autowired
    private BalanceService balanceService;

    @Autowired
    private OrderService orderService;

    @Autowired
    private TransactionService transactionService;

    @Test
    @DisplayName("계좌 개설: 기본 초기 잔고 1,000,000원과 INITIAL_DEPOSIT 이력")
    void openAccount() {
        // when
        VirtualBalance balance = balanceService.openAccount(USER_ID, null);

        // then
        assertThat(balance.getCashBalance()).isEqualByComparingTo("1000000");
        assertThat(balance.getAvailableCash()).isEqualByComparingTo("1000000");
        assertThat(balance.getInvestedAmount()).isEqualByComparingTo("0");

        List<VirtualBalanceHistory> histories = balanceService
                .getHistory(USER_ID, null, null, null, PageRequest.of(0, 10))
                .getContent();
        assertThat(histories).hasSize(1);
        assertThat(histories.get(0).getChangeType()).isEqualTo(BalanceChangeType.INITIAL_DEPOSIT);
        assertThat(histories.get(0).getChangeAmount()).isEqualByComparingTo("1000000");
    }

    @Test
    @DisplayName("계좌 중복 개설 시 ConflictException")
    void openAccountTwice() {
        // given
        balanceService.openAccount(USER_ID, null);

        // when & then
        assertThatThrownBy(() -> balanceService.openAccount(USER_ID, null))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    @DisplayName("입금: 현금과 가용 잔고가 함께 증가하고 DEPOSIT 거래가 기록됨")
    void deposit() {
        // given
        balanceService.openAccount(USER_ID, null);

        // when
        VirtualBalance balance = balanceService.deposit(USER_ID, new BigDecimal("50000"), null);

        // then
        assertThat(balance.getCashBalance()).isEqualByComparingTo("1050000");
        assertThat(balance.getAvailableCash()).isEqualByComparingTo("1050000");

        List<Transaction> transactions = transactionService
                .getTransactions(USER_ID, TransactionType.DEPOSIT, null, null, PageRequest.of(0, 10))
                .getContent();
        assertThat(transactions).hasSize(1);
        assertThat(transactions.get(0).getAmount()).isEqualByComparingTo("50000");
        assertThat(transactions.get(0).getCashBalanceBefore()).isEqualByComparingTo("1000000");
        assertThat(transactions.get(0).getCashBalanceAfter()).isEqualByComparingTo("1050000");
    }

    @Test
    @DisplayName("0 이하 금액 입출금은 ValidationException")
    void nonPositiveAmount() {
        // given
        balanceService.openAccount(USER_ID, null);

        // when & then
        assertThatThrownBy(() -> balanceService.deposit(USER_ID, BigDecimal.ZERO, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> balanceService.withdraw(USER_ID, new BigDecimal("-1"), null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("가용 잔고보다 큰 출금은 InsufficientBalanceException")
    void withdrawInsufficient() {
        // given
        balanceService.openAccount(USER_ID, new BigDecimal("10000"));

        // when & then
        assertThatThrownBy(() -> balanceService.withdraw(USER_ID, new BigDecimal("10001"), null))
                .isInstanceOf(InsufficientBalanceException.class)
                .hasMessageContaining("잔고");
    }

    @Test
    @DisplayName("예약된 현금은 출금할 수 없음")
    void withdrawReservedCash() {
        // given
        balanceService.openAccount(USER_ID, null);
        orderService.createOrder(limitBuy("005930", "10", "10000"));

        // when & then: 가용 잔고 899,985원
        assertThatThrownBy(() -> balanceService.withdraw(USER_ID, new BigDecimal("900000"), null))
                .isInstanceOf(InsufficientBalanceException.class);
    }

    @Test
    @DisplayName("잔고 요약: 예약 금액 = 현금 잔고 - 가용 잔고")
    void balanceSummary() {
        // given
        balanceService.openAccount(USER_ID, null);
        orderService.createOrder(limitBuy("005930", "10", "10000"));

        // when
        BalanceResponse response = balanceService.getBalance(USER_ID);

        // then
        assertThat(response.getCashBalance()).isEqualByComparingTo("1000000");
        assertThat(response.getAvailableCash()).isEqualByComparingTo("899985.00");
        assertThat(response.getReservedCash()).isEqualByComparingTo("100015.00");
    }

    @Test
    @DisplayName("미체결 주문이 있으면 계좌 초기화 불가, 취소 후에는 초기화 가능")
    void resetAccount() {
        // given
        balanceService.openAccount(USER_ID, null);
        balanceService.withdraw(USER_ID, new BigDecimal("300000"), null);
        Order order = orderService.createOrder(limitBuy("005930", "1", "10000"));

        // when & then
        assertThatThrownBy(() -> balanceService.resetAccount(USER_ID, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("미체결 주문");

        orderService.cancelOrder(USER_ID, order.getId());
        VirtualBalance reset = balanceService.resetAccount(USER_ID, new BigDecimal("2000000"));

        assertThat(reset.getCashBalance()).isEqualByComparingTo("2000000");
        assertThat(reset.getAvailableCash()).isEqualByComparingTo("2000000");
        assertThat(reset.getTotalBuyAmount()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("계좌가 없으면 NotFoundException")
    void accountNotFound() {
        assertThatThrownBy(() -> balanceService.getBalance(99999L))
                .isInstanceOf(NotFoundException.class);
    }

    private CreateOrderCommand limitBuy(String stockId, String quantity, String price) {
        return CreateOrderCommand.builder()
                .userId(USER_ID)
                .stockId(stockId)
                .orderType(OrderType.BUY)
                .orderMethod(OrderMethod.LIMIT)
                .quantity(new BigDecimal(quantity))
                .orderPrice(new BigDecimal(price))
                .build();
    }
}
