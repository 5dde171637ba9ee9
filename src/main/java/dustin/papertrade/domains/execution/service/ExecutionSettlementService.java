package dustin.papertrade.domains.execution.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import dustin.papertrade.domains.balance.model.entity.VirtualBalance;
import dustin.papertrade.domains.balance.model.entity.VirtualBalanceHistory;
import dustin.papertrade.domains.balance.service.BalanceService;
import dustin.papertrade.domains.fee.model.FeeBreakdown;
import dustin.papertrade.domains.fee.model.FeeSchedule;
import dustin.papertrade.domains.fee.service.FeeCalculator;
import dustin.papertrade.domains.fee.service.FeeConfigService;
import dustin.papertrade.domains.order.model.ExitReason;
import dustin.papertrade.domains.order.model.OrderStatus;
import dustin.papertrade.domains.order.model.OrderType;
import dustin.papertrade.domains.order.model.dto.ExecutionCommand;
import dustin.papertrade.domains.order.model.dto.ExecutionResult;
import dustin.papertrade.domains.order.model.entity.Order;
import dustin.papertrade.domains.order.model.entity.OrderExecution;
import dustin.papertrade.domains.order.repository.OrderExecutionRepository;
import dustin.papertrade.domains.order.repository.OrderRepository;
import dustin.papertrade.domains.position.model.dto.PositionSellResult;
import dustin.papertrade.domains.position.service.PositionService;
import dustin.papertrade.domains.transaction.model.TransactionType;
import dustin.papertrade.domains.transaction.model.entity.Transaction;
import dustin.papertrade.domains.transaction.service.TransactionService;
import dustin.papertrade.shared.exception.NotFoundException;
import dustin.papertrade.shared.exception.ValidationException;
import dustin.papertrade.shared.kafka.KafkaEventProducer;
import dustin.papertrade.shared.kafka.model.TransactionSettledEvent;
import dustin.papertrade.shared.transaction.LedgerTransactionRunner;
import dustin.papertrade.shared.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 체결 정산 서비스
 * Execution Settlement Service
 * 
 * 역할:
 * - 체결 1건을 주문, 체결 내역, 잔고, 보유 종목, 거래 원장, 잔고 이력에 원자적으로 반영
 * - 정산 커밋 후 Kafka로 체결 정산 이벤트 발행
 * 
 * 처리 흐름 (하나의 트랜잭션):
 * 1. 사용자 잔고 락 → 주문 락 (종료 상태 주문은 거부)
 * 2. 체결 내역 저장
 * 3. 주문 누적 체결 수량/금액/수수료, 평균 체결가, 상태 갱신
 * 4. 매수: 예약금 비례 해제 + 실제 체결 금액 차감, 포지션 가중 평균 갱신
 *    매도: 순 매도 금액 입금, 포지션 차감, 실현 손익 계산
 * 5. 거래 원장, 잔고 이력 기록
 * 
 * 주의사항:
 * - 수수료 스케줄은 트랜잭션 진입 전에 조회
 * - 예외 발생 시 전체 롤백
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionSettlementService {

    private final OrderRepository orderRepository;
    private final OrderExecutionRepository orderExecutionRepository;
    private final BalanceService balanceService;
    private final PositionService positionService;
    private final TransactionService transactionService;
    private final FeeCalculator feeCalculator;
    private final FeeConfigService feeConfigService;
    private final KafkaEventProducer kafkaEventProducer;
    private final LedgerTransactionRunner ledgerTransactionRunner;
    private final Clock clock;

    /**
     * 체결 정산
     * Settle one execution (fill) of an order
     * 
     * @param command 체결 명령
     * @return 정산 결과 (주문, 체결 내역, 거래 원장, 잔고 이력)
     * @throws NotFoundException 주문이 없는 경우
     * @throws ValidationException 종료 상태 주문, 잘못된 가격/수량/수수료/환율, 보유 수량 부족
     * @throws dustin.papertrade.shared.exception.InsufficientBalanceException 매수 체결 금액이 가용 잔고를 초과하는 경우
     */
    public ExecutionResult execute(ExecutionCommand command) {
        validateCommand(command);

        // 소유자 확인 및 수수료 스케줄 조회 (트랜잭션 진입 전)
        Order snapshot = orderRepository.findById(command.getOrderId())
                .orElseThrow(() -> new NotFoundException("주문을 찾을 수 없습니다: orderId=" + command.getOrderId()));
        FeeSchedule schedule = feeConfigService.getFeeSchedule(snapshot.getMarket());

        ExecutionResult result = ledgerTransactionRunner.execute("executeOrder",
                status -> settle(snapshot.getUserId(), command, schedule));

        log.info("[ExecutionSettlementService] 체결 정산 완료: orderId={}, userId={}, status={}, executedQuantity={}/{}",
                result.getOrder().getId(), result.getOrder().getUserId(), result.getOrder().getOrderStatus(),
                result.getOrder().getExecutedQuantity(), result.getOrder().getQuantity());
        return result;
    }

    private ExecutionResult settle(Long userId, ExecutionCommand command, FeeSchedule schedule) {
        // ===== 1. 락 획득 (잔고 → 주문) =====
        VirtualBalance balance = balanceService.lockAccount(userId);
        Order order = orderRepository.findByIdForUpdate(command.getOrderId())
                .orElseThrow(() -> new NotFoundException("주문을 찾을 수 없습니다: orderId=" + command.getOrderId()));
        if (order.getOrderStatus().isTerminal()) {
            throw new ValidationException(String.format(
                    "종료된 주문은 체결할 수 없습니다: orderId=%d, status=%s", order.getId(), order.getOrderStatus()));
        }

        BigDecimal remaining = order.getRemainingQuantity();
        BigDecimal quantity = command.getExecutedQuantity() != null ? command.getExecutedQuantity() : remaining;
        if (quantity.signum() <= 0 || quantity.compareTo(remaining) > 0) {
            throw new ValidationException(String.format(
                    "체결 수량이 올바르지 않습니다: orderId=%d, executedQuantity=%s, remaining=%s",
                    order.getId(), quantity, remaining));
        }

        BigDecimal price = command.getExecutionPrice();
        if (command.getExchangeRate() != null && isDomestic(order)
                && command.getExchangeRate().compareTo(BigDecimal.ONE) != 0) {
            throw new ValidationException(String.format(
                    "원화 주문에는 환율을 지정할 수 없습니다: orderId=%d, exchangeRate=%s",
                    order.getId(), command.getExchangeRate()));
        }
        BigDecimal exchangeRate = command.getExchangeRate() != null ? command.getExchangeRate() : order.getExchangeRate();
        LocalDateTime now = LocalDateTime.now(clock);

        FeeBreakdown calculated = feeCalculator.calculate(schedule, order.getOrderType(), quantity, price, exchangeRate);
        BigDecimal commission = command.getCommission() != null
                ? MoneyUtils.money(command.getCommission())
                : calculated.getCommission();
        BigDecimal tax = command.getTax() != null
                ? MoneyUtils.money(command.getTax())
                : calculated.getTax();
        BigDecimal fee = commission.add(tax);
        BigDecimal grossAmount = feeCalculator.notional(quantity, price, exchangeRate);
        BigDecimal localAmount = MoneyUtils.price(price.multiply(quantity));

        // ===== 2. 체결 내역 저장 =====
        OrderExecution execution = orderExecutionRepository.save(OrderExecution.builder()
                .orderId(order.getId())
                .executionPrice(price)
                .executionQuantity(quantity)
                .executionAmount(localAmount)
                .executionFee(fee)
                .exchangeRate(exchangeRate)
                .executionTime(now)
                .build());

        // ===== 3. 주문 누적값 / 상태 갱신 =====
        BigDecimal executedQuantity = order.getExecutedQuantity().add(quantity);
        BigDecimal executedAmount = order.getExecutedAmount().add(localAmount);
        boolean completes = executedQuantity.compareTo(order.getQuantity()) == 0;
        OrderStatus nextStatus = completes ? OrderStatus.FILLED : OrderStatus.PARTIALLY_FILLED;

        order.setExecutedQuantity(executedQuantity);
        order.setExecutedAmount(executedAmount);
        order.setAveragePrice(executedAmount.divide(executedQuantity, MoneyUtils.PRICE_SCALE, RoundingMode.HALF_UP));
        order.setCommission(order.getCommission().add(commission));
        order.setTax(order.getTax().add(tax));
        order.setTotalFee(order.getTotalFee().add(fee));
        order.setOrderStatus(nextStatus);
        if (order.getExecutedDate() == null) {
            order.setExecutedDate(now);
        }

        // ===== 4. 잔고 / 포지션 반영 =====
        VirtualBalanceHistory history;
        Transaction.TransactionBuilder transaction = Transaction.builder()
                .userId(userId)
                .stockId(order.getStockId())
                .orderId(order.getId())
                .quantity(quantity)
                .price(price)
                .amount(grossAmount)
                .commission(commission)
                .tax(tax)
                .currentExchangeRate(exchangeRate)
                .transactionDate(now);

        if (order.getOrderType() == OrderType.BUY) {
            BigDecimal released = completes
                    ? order.getReservedCash()
                    : MoneyUtils.money(order.getReservedCash().multiply(quantity)
                            .divide(remaining, MoneyUtils.PRICE_SCALE, RoundingMode.HALF_UP));
            order.setReservedCash(order.getReservedCash().subtract(released));

            history = balanceService.settleBuy(balance, released, grossAmount, commission, tax, order.getId(),
                    String.format("%s 매수 체결 %s주 @ %s", order.getStockId(), quantity, price));
            positionService.applyBuy(userId, order.getStockId(), order.getCurrency(), quantity, price, exchangeRate);

            transaction.transactionType(TransactionType.BUY)
                    .netAmount(grossAmount.add(fee))
                    .description(String.format("%s 매수", order.getStockId()));
        } else {
            PositionSellResult sellResult = positionService.applySell(
                    userId, order.getStockId(), quantity, price, exchangeRate, fee);
            order.setExitReason(price.compareTo(sellResult.getAveragePrice()) >= 0
                    ? ExitReason.TAKE_PROFIT
                    : ExitReason.STOP_LOSS);

            history = balanceService.settleSell(balance, grossAmount, commission, tax, sellResult.getCostBasis(),
                    order.getId(), String.format("%s 매도 체결 %s주 @ %s", order.getStockId(), quantity, price));

            transaction.transactionType(TransactionType.SELL)
                    .netAmount(grossAmount.subtract(fee))
                    .realizedProfitLoss(sellResult.getProfitLoss().getRealizedProfitLoss())
                    .priceProfitLoss(sellResult.getProfitLoss().getPriceProfitLoss())
                    .exchangeProfitLoss(sellResult.getProfitLoss().getExchangeProfitLoss())
                    .purchaseAverageExchangeRate(sellResult.getAverageExchangeRate())
                    .description(String.format("%s 매도 (%s)", order.getStockId(), order.getExitReason()));
        }
        Order savedOrder = orderRepository.save(order);

        // ===== 5. 거래 원장 기록 =====
        Transaction savedTransaction = transactionService.recordTrade(transaction
                .cashBalanceBefore(history.getPreviousCashBalance())
                .cashBalanceAfter(history.getNewCashBalance())
                .build());

        publishAfterCommit(savedTransaction);

        return ExecutionResult.builder()
                .order(savedOrder)
                .execution(execution)
                .transaction(savedTransaction)
                .balanceHistory(history)
                .build();
    }

    /**
     * 커밋 이후 정산 이벤트 발행 등록
     * 롤백되면 발행하지 않습니다.
     */
    private void publishAfterCommit(Transaction transaction) {
        TransactionSettledEvent event = TransactionSettledEvent.builder()
                .transactionId(transaction.getId())
                .orderId(transaction.getOrderId())
                .userId(transaction.getUserId())
                .stockId(transaction.getStockId())
                .transactionType(transaction.getTransactionType())
                .quantity(transaction.getQuantity())
                .price(transaction.getPrice())
                .amount(transaction.getAmount())
                .commission(transaction.getCommission())
                .tax(transaction.getTax())
                .realizedProfitLoss(transaction.getRealizedProfitLoss())
                .transactionDate(transaction.getTransactionDate())
                .build();

        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                kafkaEventProducer.publishTransactionSettled(event);
            }
        });
    }

    private void validateCommand(ExecutionCommand command) {
        if (command == null || command.getOrderId() == null) {
            throw new ValidationException("주문 ID는 필수입니다");
        }
        if (!MoneyUtils.isPositive(command.getExecutionPrice())) {
            throw new ValidationException(String.format(
                    "체결가는 0보다 커야 합니다: orderId=%d, executionPrice=%s",
                    command.getOrderId(), command.getExecutionPrice()));
        }
        if (command.getExecutedQuantity() != null && command.getExecutedQuantity().signum() <= 0) {
            throw new ValidationException(String.format(
                    "체결 수량은 0보다 커야 합니다: orderId=%d, executedQuantity=%s",
                    command.getOrderId(), command.getExecutedQuantity()));
        }
        if (command.getExchangeRate() != null && command.getExchangeRate().signum() <= 0) {
            throw new ValidationException(String.format(
                    "환율은 0보다 커야 합니다: orderId=%d, exchangeRate=%s",
                    command.getOrderId(), command.getExchangeRate()));
        }
        if ((command.getCommission() != null && command.getCommission().signum() < 0)
                || (command.getTax() != null && command.getTax().signum() < 0)) {
            throw new ValidationException(String.format(
                    "수수료와 세금은 0 이상이어야 합니다: orderId=%d, commission=%s, tax=%s",
                    command.getOrderId(), command.getCommission(), command.getTax()));
        }
        if (exceedsMoneyScale(command.getCommission()) || exceedsMoneyScale(command.getTax())) {
            throw new ValidationException(String.format(
                    "수수료와 세금은 소수점 %d자리까지만 지정할 수 있습니다: orderId=%d, commission=%s, tax=%s",
                    MoneyUtils.MONEY_SCALE, command.getOrderId(), command.getCommission(), command.getTax()));
        }
    }

    private boolean exceedsMoneyScale(BigDecimal amount) {
        return amount != null && amount.stripTrailingZeros().scale() > MoneyUtils.MONEY_SCALE;
    }

    private boolean isDomestic(Order order) {
        return order.getCurrency() == null || "KRW".equalsIgnoreCase(order.getCurrency());
    }
}
