package dustin.papertrade.domains.balance.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import dustin.papertrade.config.TradingProperties;
import dustin.papertrade.domains.balance.model.BalanceChangeType;
import dustin.papertrade.domains.balance.model.dto.BalanceResponse;
import dustin.papertrade.domains.balance.model.entity.VirtualBalance;
import dustin.papertrade.domains.balance.model.entity.VirtualBalanceHistory;
import dustin.papertrade.domains.balance.repository.VirtualBalanceHistoryRepository;
import dustin.papertrade.domains.balance.repository.VirtualBalanceRepository;
import dustin.papertrade.domains.order.model.OrderStatus;
import dustin.papertrade.domains.order.repository.OrderRepository;
import dustin.papertrade.domains.position.repository.PortfolioRepository;
import dustin.papertrade.domains.transaction.model.TransactionType;
import dustin.papertrade.domains.transaction.service.TransactionService;
import dustin.papertrade.shared.exception.ConflictException;
import dustin.papertrade.shared.exception.InsufficientBalanceException;
import dustin.papertrade.shared.exception.NotFoundException;
import dustin.papertrade.shared.exception.ValidationException;
import dustin.papertrade.shared.transaction.LedgerTransactionRunner;
import dustin.papertrade.shared.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 가상 잔고 서비스
 * Virtual Balance Service (BalanceAccount)
 * 
 * 역할:
 * - 계좌 개설, 입금, 출금, 초기화 (외부 결제 연동용 진입점)
 * - 주문/체결 처리에서 사용하는 원장 연산 (예약, 해제, 매수/매도 정산)
 * - 잔고 변경 시마다 VirtualBalanceHistory 기록
 * 
 * 동시성 제어:
 * - 모든 변경 작업은 잔고 행을 PESSIMISTIC_WRITE로 먼저 잠근 뒤 수행
 * - 원장 연산 메서드는 호출 측 트랜잭션 안에서만 실행됨 (MANDATORY)
 * 
 * 불변 조건:
 * - 0 <= available_cash <= cash_balance
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BalanceService {

    private static final LocalDateTime MIN_DATE = LocalDateTime.of(1970, 1, 1, 0, 0);
    private static final LocalDateTime MAX_DATE = LocalDateTime.of(9999, 12, 31, 23, 59, 59);

    private final VirtualBalanceRepository virtualBalanceRepository;
    private final VirtualBalanceHistoryRepository virtualBalanceHistoryRepository;
    private final OrderRepository orderRepository;
    private final PortfolioRepository portfolioRepository;
    private final TransactionService transactionService;
    private final LedgerTransactionRunner ledgerTransactionRunner;
    private final TradingProperties tradingProperties;
    private final Clock clock;

    // =====================================================
    // 1. 계좌 개설 / 입출금 / 초기화
    // =====================================================

    /**
     * 가상 계좌 개설
     * Open virtual account
     * 
     * 초기 현금을 지급하고 INITIAL_DEPOSIT 이력을 남깁니다.
     * 
     * @param userId 사용자 ID
     * @param initialCash 초기 현금 (null이면 설정값 trading.balance.initial-cash)
     * @return 생성된 잔고
     * @throws ConflictException 이미 계좌가 있는 경우
     */
    public VirtualBalance openAccount(Long userId, BigDecimal initialCash) {
        BigDecimal amount = MoneyUtils.money(initialCash != null
                ? initialCash
                : tradingProperties.getBalance().getInitialCash());
        if (amount.signum() < 0) {
            throw new ValidationException("초기 현금은 0 이상이어야 합니다: initialCash=" + amount);
        }

        return ledgerTransactionRunner.execute("openAccount", status -> {
            if (virtualBalanceRepository.existsByUserId(userId)) {
                throw new ConflictException("이미 가상 계좌가 존재합니다: userId=" + userId);
            }

            VirtualBalance balance = virtualBalanceRepository.save(VirtualBalance.builder()
                    .userId(userId)
                    .cashBalance(amount)
                    .availableCash(amount)
                    .build());

            recordHistory(balance, BigDecimal.ZERO.setScale(MoneyUtils.MONEY_SCALE),
                    BalanceChangeType.INITIAL_DEPOSIT, null, "초기 가상 잔고 지급");

            log.info("[BalanceService] 가상 계좌 개설: userId={}, initialCash={}", userId, amount);
            return balance;
        });
    }

    /**
     * 입금
     * Deposit
     * 
     * @param userId 사용자 ID
     * @param amount 입금액 (0보다 커야 함)
     * @param description 설명 (optional)
     * @return 변경된 잔고
     * @throws ValidationException 금액이 0 이하인 경우
     * @throws NotFoundException 계좌가 없는 경우
     */
    public VirtualBalance deposit(Long userId, BigDecimal amount, String description) {
        BigDecimal depositAmount = requirePositiveAmount(amount, "입금");

        return ledgerTransactionRunner.execute("deposit", status -> {
            VirtualBalance balance = lockAccount(userId);
            BigDecimal previousCash = balance.getCashBalance();

            balance.setCashBalance(previousCash.add(depositAmount));
            balance.setAvailableCash(balance.getAvailableCash().add(depositAmount));
            virtualBalanceRepository.save(balance);

            String memo = description != null ? description : "가상 잔고 입금";
            recordHistory(balance, previousCash, BalanceChangeType.DEPOSIT, null, memo);
            transactionService.recordCashMovement(userId, TransactionType.DEPOSIT, depositAmount,
                    previousCash, balance.getCashBalance(), memo);

            log.info("[BalanceService] 입금: userId={}, amount={}, cash={} -> {}",
                    userId, depositAmount, previousCash, balance.getCashBalance());
            return balance;
        });
    }

    /**
     * 출금
     * Withdraw
     * 
     * 예약되지 않은 현금(available_cash) 범위 안에서만 출금할 수 있습니다.
     * 
     * @param userId 사용자 ID
     * @param amount 출금액 (0보다 커야 함)
     * @param description 설명 (optional)
     * @return 변경된 잔고
     * @throws ValidationException 금액이 0 이하인 경우
     * @throws InsufficientBalanceException 가용 잔고가 부족한 경우
     */
    public VirtualBalance withdraw(Long userId, BigDecimal amount, String description) {
        BigDecimal withdrawAmount = requirePositiveAmount(amount, "출금");

        return ledgerTransactionRunner.execute("withdraw", status -> {
            VirtualBalance balance = lockAccount(userId);
            if (balance.getAvailableCash().compareTo(withdrawAmount) < 0) {
                throw new InsufficientBalanceException(withdrawAmount, balance.getAvailableCash());
            }
            BigDecimal previousCash = balance.getCashBalance();

            balance.setCashBalance(previousCash.subtract(withdrawAmount));
            balance.setAvailableCash(balance.getAvailableCash().subtract(withdrawAmount));
            virtualBalanceRepository.save(balance);

            String memo = description != null ? description : "가상 잔고 출금";
            recordHistory(balance, previousCash, BalanceChangeType.WITHDRAW, null, memo);
            transactionService.recordCashMovement(userId, TransactionType.WITHDRAW, withdrawAmount,
                    previousCash, balance.getCashBalance(), memo);

            log.info("[BalanceService] 출금: userId={}, amount={}, cash={} -> {}",
                    userId, withdrawAmount, previousCash, balance.getCashBalance());
            return balance;
        });
    }

    /**
     * 계좌 초기화
     * Reset account to a fresh initial balance
     * 
     * 미체결 주문과 보유 포지션이 없을 때만 가능합니다.
     * 누적 통계(총 매수/매도/수수료/세금)도 0으로 초기화됩니다.
     * 
     * @param userId 사용자 ID
     * @param initialCash 초기 현금 (null이면 설정값)
     * @return 초기화된 잔고
     * @throws ValidationException 미체결 주문 또는 보유 포지션이 있는 경우
     */
    public VirtualBalance resetAccount(Long userId, BigDecimal initialCash) {
        BigDecimal amount = MoneyUtils.money(initialCash != null
                ? initialCash
                : tradingProperties.getBalance().getInitialCash());
        if (amount.signum() < 0) {
            throw new ValidationException("초기 현금은 0 이상이어야 합니다: initialCash=" + amount);
        }

        return ledgerTransactionRunner.execute("resetAccount", status -> {
            VirtualBalance balance = lockAccount(userId);

            long openOrders = orderRepository.countByUserIdAndOrderStatusIn(userId, OrderStatus.openStatuses());
            if (openOrders > 0) {
                throw new ValidationException(String.format(
                        "미체결 주문이 있어 계좌를 초기화할 수 없습니다: userId=%d, openOrders=%d", userId, openOrders));
            }
            long activePositions = portfolioRepository.countByUserIdAndIsActiveTrue(userId);
            if (activePositions > 0) {
                throw new ValidationException(String.format(
                        "보유 종목이 있어 계좌를 초기화할 수 없습니다: userId=%d, positions=%d", userId, activePositions));
            }

            BigDecimal previousCash = balance.getCashBalance();
            balance.setCashBalance(amount);
            balance.setAvailableCash(amount);
            balance.setInvestedAmount(BigDecimal.ZERO);
            balance.setTotalBuyAmount(BigDecimal.ZERO);
            balance.setTotalSellAmount(BigDecimal.ZERO);
            balance.setTotalCommission(BigDecimal.ZERO);
            balance.setTotalTax(BigDecimal.ZERO);
            balance.setLastTradeDate(null);
            virtualBalanceRepository.save(balance);

            recordHistory(balance, previousCash, BalanceChangeType.INITIAL_DEPOSIT, null, "가상 잔고 초기화");

            log.info("[BalanceService] 계좌 초기화: userId={}, cash={} -> {}", userId, previousCash, amount);
            return balance;
        });
    }

    // =====================================================
    // 2. 원장 연산 (호출 측 트랜잭션 내에서만 사용)
    // =====================================================

    /**
     * 사용자 잔고 잠금
     * Lock user's balance row (FOR UPDATE)
     * 
     * @param userId 사용자 ID
     * @return 잠긴 잔고
     * @throws NotFoundException 계좌가 없는 경우
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public VirtualBalance lockAccount(Long userId) {
        return virtualBalanceRepository.findByUserIdForUpdate(userId)
                .orElseThrow(() -> new NotFoundException("가상 계좌를 찾을 수 없습니다: userId=" + userId));
    }

    /**
     * 매수 주문 현금 예약
     * Reserve cash for a BUY order
     * 
     * available_cash만 차감하고 cash_balance는 변경하지 않습니다.
     * 
     * @param balance 잠긴 잔고
     * @param amount 예약 금액
     * @throws InsufficientBalanceException 가용 잔고 부족 시
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void reserve(VirtualBalance balance, BigDecimal amount) {
        BigDecimal available = balance.getAvailableCash();
        if (available.compareTo(amount) < 0) {
            throw new InsufficientBalanceException(amount, available);
        }
        balance.setAvailableCash(available.subtract(amount));
        virtualBalanceRepository.save(balance);

        log.info("[BalanceService] 현금 예약: userId={}, amount={}, available={} -> {}",
                balance.getUserId(), amount, available, balance.getAvailableCash());
    }

    /**
     * 매수 예약 해제 (취소/만료/거부)
     * Release a BUY reservation
     * 
     * @param balance 잠긴 잔고
     * @param amount 해제 금액
     * @param orderId 관련 주문 ID (로그용)
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void release(VirtualBalance balance, BigDecimal amount, Long orderId) {
        if (amount.signum() == 0) {
            return;
        }
        BigDecimal available = balance.getAvailableCash();
        BigDecimal released = available.add(amount);
        if (released.compareTo(balance.getCashBalance()) > 0) {
            throw new IllegalStateException(String.format(
                    "예약 해제 후 가용 잔고가 총 잔고를 초과합니다: userId=%d, orderId=%d, available=%s, release=%s, cash=%s",
                    balance.getUserId(), orderId, available, amount, balance.getCashBalance()));
        }
        balance.setAvailableCash(released);
        virtualBalanceRepository.save(balance);

        log.info("[BalanceService] 예약 해제: userId={}, orderId={}, amount={}, available={} -> {}",
                balance.getUserId(), orderId, amount, available, released);
    }

    /**
     * 매수 체결 정산
     * Settle a BUY fill
     * 
     * 처리:
     * 1. 해당 체결분의 예약금을 available_cash로 되돌림
     * 2. 실제 체결 금액(체결가 * 수량 + 수수료 + 세금)을 cash_balance와 available_cash에서 차감
     *    → 예약 시점 가격과 체결가의 차이(슬리피지)가 여기서 정산됨
     * 3. 투자 원금, 누적 매수 금액, 누적 수수료/세금 갱신
     * 4. BUY 이력 기록
     * 
     * @param balance 잠긴 잔고
     * @param releasedReservation 이번 체결로 해제되는 예약금
     * @param grossAmount 체결 금액 (원화, 수수료 제외)
     * @param commission 수수료
     * @param tax 세금
     * @param orderId 주문 ID
     * @param description 이력 설명
     * @return 기록된 잔고 이력
     * @throws InsufficientBalanceException 실제 체결 금액이 예약금 + 가용 잔고를 초과하는 경우
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public VirtualBalanceHistory settleBuy(
            VirtualBalance balance,
            BigDecimal releasedReservation,
            BigDecimal grossAmount,
            BigDecimal commission,
            BigDecimal tax,
            Long orderId,
            String description) {
        BigDecimal actualCost = grossAmount.add(commission).add(tax);
        BigDecimal previousCash = balance.getCashBalance();
        BigDecimal previousAvailable = balance.getAvailableCash();

        BigDecimal newAvailable = previousAvailable.add(releasedReservation).subtract(actualCost);
        BigDecimal newCash = previousCash.subtract(actualCost);
        if (newAvailable.signum() < 0 || newCash.signum() < 0) {
            throw new InsufficientBalanceException(actualCost, previousAvailable.add(releasedReservation));
        }

        balance.setCashBalance(newCash);
        balance.setAvailableCash(newAvailable);
        balance.setInvestedAmount(balance.getInvestedAmount().add(grossAmount));
        balance.setTotalBuyAmount(balance.getTotalBuyAmount().add(grossAmount));
        balance.setTotalCommission(balance.getTotalCommission().add(commission));
        balance.setTotalTax(balance.getTotalTax().add(tax));
        balance.setLastTradeDate(LocalDateTime.now(clock));
        virtualBalanceRepository.save(balance);

        log.info("[BalanceService] 매수 정산: userId={}, orderId={}, reservedReleased={}, actualCost={}, " +
                "cash={} -> {}, available={} -> {}",
                balance.getUserId(), orderId, releasedReservation, actualCost,
                previousCash, newCash, previousAvailable, newAvailable);

        return recordHistory(balance, previousCash, BalanceChangeType.BUY, orderId, description);
    }

    /**
     * 매도 체결 정산
     * Settle a SELL fill
     * 
     * 처리:
     * 1. 순 매도 금액(체결 금액 - 수수료 - 세금)을 cash_balance와 available_cash에 입금
     * 2. 투자 원금에서 매도 수량의 매수 원가 차감 (0 미만 불가)
     * 3. 누적 매도 금액, 누적 수수료/세금 갱신
     * 4. SELL 이력 기록
     * 
     * @param balance 잠긴 잔고
     * @param grossAmount 체결 금액 (원화)
     * @param commission 수수료
     * @param tax 세금
     * @param costBasis 매도 수량의 매수 원가 (원화)
     * @param orderId 주문 ID
     * @param description 이력 설명
     * @return 기록된 잔고 이력
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public VirtualBalanceHistory settleSell(
            VirtualBalance balance,
            BigDecimal grossAmount,
            BigDecimal commission,
            BigDecimal tax,
            BigDecimal costBasis,
            Long orderId,
            String description) {
        BigDecimal netAmount = grossAmount.subtract(commission).subtract(tax);
        BigDecimal previousCash = balance.getCashBalance();
        BigDecimal previousAvailable = balance.getAvailableCash();

        BigDecimal newCash = previousCash.add(netAmount);
        BigDecimal newAvailable = previousAvailable.add(netAmount);
        if (newAvailable.signum() < 0 || newCash.signum() < 0) {
            throw new InsufficientBalanceException(netAmount.negate(), previousAvailable);
        }

        BigDecimal invested = balance.getInvestedAmount().subtract(costBasis);
        balance.setCashBalance(newCash);
        balance.setAvailableCash(newAvailable);
        balance.setInvestedAmount(invested.signum() < 0 ? BigDecimal.ZERO : invested);
        balance.setTotalSellAmount(balance.getTotalSellAmount().add(grossAmount));
        balance.setTotalCommission(balance.getTotalCommission().add(commission));
        balance.setTotalTax(balance.getTotalTax().add(tax));
        balance.setLastTradeDate(LocalDateTime.now(clock));
        virtualBalanceRepository.save(balance);

        log.info("[BalanceService] 매도 정산: userId={}, orderId={}, netAmount={}, cash={} -> {}, available={} -> {}",
                balance.getUserId(), orderId, netAmount, previousCash, newCash, previousAvailable, newAvailable);

        return recordHistory(balance, previousCash, BalanceChangeType.SELL, orderId, description);
    }

    /**
     * 잔고 변경 이력 기록
     * Record balance history
     * 
     * 변경 금액은 (현재 cash_balance - previousCash)로 계산됩니다.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public VirtualBalanceHistory recordHistory(
            VirtualBalance balance,
            BigDecimal previousCash,
            BalanceChangeType changeType,
            Long orderId,
            String description) {
        VirtualBalanceHistory history = VirtualBalanceHistory.builder()
                .virtualBalanceId(balance.getId())
                .previousCashBalance(previousCash)
                .newCashBalance(balance.getCashBalance())
                .changeAmount(balance.getCashBalance().subtract(previousCash))
                .changeType(changeType)
                .relatedOrderId(orderId)
                .description(description)
                .createdAt(LocalDateTime.now(clock))
                .build();
        return virtualBalanceHistoryRepository.save(history);
    }

    // =====================================================
    // 3. 조회
    // =====================================================

    /**
     * 잔고 요약 조회
     * Get balance summary
     * 
     * @param userId 사용자 ID
     * @return 잔고 요약
     * @throws NotFoundException 계좌가 없는 경우
     */
    @Transactional(readOnly = true)
    public BalanceResponse getBalance(Long userId) {
        VirtualBalance balance = virtualBalanceRepository.findByUserId(userId)
                .orElseThrow(() -> new NotFoundException("가상 계좌를 찾을 수 없습니다: userId=" + userId));

        return BalanceResponse.builder()
                .userId(balance.getUserId())
                .cashBalance(balance.getCashBalance())
                .availableCash(balance.getAvailableCash())
                .reservedCash(balance.getReservedCash())
                .investedAmount(balance.getInvestedAmount())
                .totalBuyAmount(balance.getTotalBuyAmount())
                .totalSellAmount(balance.getTotalSellAmount())
                .totalCommission(balance.getTotalCommission())
                .totalTax(balance.getTotalTax())
                .lastTradeDate(balance.getLastTradeDate())
                .build();
    }

    /**
     * 잔고 변경 이력 조회
     * Get balance history
     * 
     * @param userId 사용자 ID
     * @param changeType 변경 유형 필터 (optional)
     * @param from 시작 시각 (optional)
     * @param to 종료 시각 (optional)
     * @param pageable 페이지 정보
     * @return 이력 (최신순)
     */
    @Transactional(readOnly = true)
    public Page<VirtualBalanceHistory> getHistory(
            Long userId, BalanceChangeType changeType, LocalDateTime from, LocalDateTime to, Pageable pageable) {
        VirtualBalance balance = virtualBalanceRepository.findByUserId(userId)
                .orElseThrow(() -> new NotFoundException("가상 계좌를 찾을 수 없습니다: userId=" + userId));
        LocalDateTime start = from != null ? from : MIN_DATE;
        LocalDateTime end = to != null ? to : MAX_DATE;

        if (changeType != null) {
            return virtualBalanceHistoryRepository.findByVirtualBalanceIdAndChangeTypeAndCreatedAtBetweenOrderByIdDesc(
                    balance.getId(), changeType, start, end, pageable);
        }
        return virtualBalanceHistoryRepository.findByVirtualBalanceIdAndCreatedAtBetweenOrderByIdDesc(
                balance.getId(), start, end, pageable);
    }

    /**
     * 주문 관련 잔고 이력 조회
     */
    @Transactional(readOnly = true)
    public List<VirtualBalanceHistory> getOrderHistory(Long orderId) {
        return virtualBalanceHistoryRepository.findByRelatedOrderIdOrderByIdAsc(orderId);
    }

    private BigDecimal requirePositiveAmount(BigDecimal amount, String action) {
        if (!MoneyUtils.isPositive(amount)) {
            throw new ValidationException(String.format("%s 금액은 0보다 커야 합니다: amount=%s", action, amount));
        }
        return MoneyUtils.money(amount);
    }
}
