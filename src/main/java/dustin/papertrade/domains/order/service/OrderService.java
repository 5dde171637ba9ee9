package dustin.papertrade.domains.order.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.papertrade.config.TradingProperties;
import dustin.papertrade.domains.balance.model.entity.VirtualBalance;
import dustin.papertrade.domains.balance.service.BalanceService;
import dustin.papertrade.domains.execution.service.ExecutionSettlementService;
import dustin.papertrade.domains.fee.model.FeeSchedule;
import dustin.papertrade.domains.fee.service.FeeCalculator;
import dustin.papertrade.domains.fee.service.FeeConfigService;
import dustin.papertrade.domains.market.model.MarketQuote;
import dustin.papertrade.domains.market.service.MarketPriceProvider;
import dustin.papertrade.domains.order.model.OrderMethod;
import dustin.papertrade.domains.order.model.OrderStatus;
import dustin.papertrade.domains.order.model.OrderType;
import dustin.papertrade.domains.order.model.dto.AmendOrderCommand;
import dustin.papertrade.domains.order.model.dto.CreateOrderCommand;
import dustin.papertrade.domains.order.model.dto.ExecutionCommand;
import dustin.papertrade.domains.order.model.entity.Order;
import dustin.papertrade.domains.order.model.entity.OrderExecution;
import dustin.papertrade.domains.order.repository.OrderExecutionRepository;
import dustin.papertrade.domains.order.repository.OrderRepository;
import dustin.papertrade.domains.position.model.entity.Portfolio;
import dustin.papertrade.domains.position.repository.PortfolioRepository;
import dustin.papertrade.shared.exception.InsufficientBalanceException;
import dustin.papertrade.shared.exception.NotFoundException;
import dustin.papertrade.shared.exception.TradingException;
import dustin.papertrade.shared.exception.ValidationException;
import dustin.papertrade.shared.transaction.LedgerTransactionRunner;
import dustin.papertrade.shared.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 주문 서비스
 * Order Service (OrderLedger)
 * 
 * 역할:
 * - 주문 접수 (매수: 현금 예약, 매도: 매도 가능 수량 검증)
 * - 주문 정정 (가격, 수량, 만료 시각, 메모)
 * - 주문 취소, 만료, 거부 (매수 예약금 정확히 해제)
 * - 주문 조회
 * 
 * 처리 흐름 (주문 접수):
 * 1. 입력 검증
 * 2. 시세/환율/수수료 스케줄 조회 (트랜잭션 밖)
 * 3. 트랜잭션: 잔고 락 → 가용 잔고/매도 가능 수량 확인 → 예약 → 주문 저장 (PENDING)
 * 4. 시장가 주문이면 기준가로 즉시 체결 (별도 트랜잭션, 설정에 따라)
 * 
 * 동시성 제어:
 * - 같은 사용자의 주문 접수/정정/취소/만료/체결은 잔고 행 락으로 직렬화됨
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderService {

    private static final String DEFAULT_CURRENCY = "KRW";

    private final OrderRepository orderRepository;
    private final OrderExecutionRepository orderExecutionRepository;
    private final PortfolioRepository portfolioRepository;
    private final BalanceService balanceService;
    private final ExecutionSettlementService executionSettlementService;
    private final FeeCalculator feeCalculator;
    private final FeeConfigService feeConfigService;
    private final MarketPriceProvider marketPriceProvider;
    private final LedgerTransactionRunner ledgerTransactionRunner;
    private final TradingProperties tradingProperties;
    private final Clock clock;

    // =====================================================
    // 1. 주문 접수
    // =====================================================

    /**
     * 주문 생성
     * Create order
     * 
     * @param command 주문 생성 명령
     * @return 생성된 주문 (시장가 즉시 체결 시 체결 후 상태)
     * @throws ValidationException 입력 오류, 시세 없음(시장가), 매도 가능 수량 부족
     * @throws InsufficientBalanceException 매수 예약 금액이 가용 잔고를 초과하는 경우
     * @throws NotFoundException 가상 계좌가 없는 경우
     */
    public Order createOrder(CreateOrderCommand command) {
        // ===== 1. 입력 검증 =====
        validateCommand(command);

        // ===== 2. 시세 / 환율 / 수수료 스케줄 조회 (트랜잭션 밖) =====
        MarketQuote quote = resolveQuote(command);
        BigDecimal exchangeRate = resolveExchangeRate(quote);
        FeeSchedule schedule = feeConfigService.getFeeSchedule(quote.getMarket());

        BigDecimal referencePrice = command.getOrderMethod().requiresPrice()
                ? command.getOrderPrice()
                : quote.getPrice();
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime expiresAt = resolveExpiresAt(command, now);

        Order order = Order.builder()
                .userId(command.getUserId())
                .stockId(command.getStockId())
                .orderType(command.getOrderType())
                .orderMethod(command.getOrderMethod())
                .orderStatus(OrderStatus.PENDING)
                .quantity(command.getQuantity())
                .orderPrice(command.getOrderMethod().requiresPrice() ? command.getOrderPrice() : null)
                .referencePrice(referencePrice)
                .currency(quote.getCurrency() != null ? quote.getCurrency().toUpperCase() : DEFAULT_CURRENCY)
                .market(quote.getMarket())
                .exchangeRate(exchangeRate)
                .notes(command.getNotes())
                .orderDate(now)
                .expiresAt(expiresAt)
                .build();

        // ===== 3. 예약 + 저장 (하나의 트랜잭션) =====
        Order saved = ledgerTransactionRunner.execute("createOrder", status -> {
            VirtualBalance balance = balanceService.lockAccount(command.getUserId());

            if (command.getOrderType() == OrderType.BUY) {
                BigDecimal requiredCash = feeCalculator.notional(command.getQuantity(), referencePrice, exchangeRate)
                        .add(feeCalculator.estimateBuyFee(schedule, command.getQuantity(), referencePrice, exchangeRate));
                balanceService.reserve(balance, requiredCash);
                order.setReservedCash(requiredCash);
            } else {
                BigDecimal held = portfolioRepository.findByUserIdAndStockId(command.getUserId(), command.getStockId())
                        .map(Portfolio::getCurrentQuantity)
                        .orElse(BigDecimal.ZERO);
                BigDecimal reserved = MoneyUtils.nvl(
                        orderRepository.sumOpenSellQuantity(command.getUserId(), command.getStockId()));
                BigDecimal available = held.subtract(reserved);
                if (command.getQuantity().compareTo(available) > 0) {
                    throw new ValidationException(String.format(
                            "매도 가능 수량이 부족합니다. 보유: %s, 미체결 매도: %s, 매도 가능: %s, 주문: %s",
                            held, reserved, available.max(BigDecimal.ZERO), command.getQuantity()));
                }
            }

            return orderRepository.save(order);
        });

        log.info("[OrderService] 주문 접수: orderId={}, userId={}, stockId={}, type={}, method={}, quantity={}, price={}, reservedCash={}",
                saved.getId(), saved.getUserId(), saved.getStockId(), saved.getOrderType(), saved.getOrderMethod(),
                saved.getQuantity(), referencePrice, saved.getReservedCash());

        // ===== 4. 시장가 즉시 체결 =====
        if (saved.getOrderMethod() == OrderMethod.MARKET
                && tradingProperties.getOrder().isExecuteMarketImmediately()) {
            return executeMarketOrder(saved);
        }
        return saved;
    }

    /**
     * 시장가 주문 즉시 체결
     * 체결이 거부되면 주문은 PENDING으로 남고 예약은 유지됩니다.
     */
    private Order executeMarketOrder(Order order) {
        try {
            return executionSettlementService.execute(ExecutionCommand.builder()
                    .orderId(order.getId())
                    .executionPrice(order.getReferencePrice())
                    .build())
                    .getOrder();
        } catch (TradingException e) {
            log.warn("[OrderService] 시장가 즉시 체결 실패, 주문은 미체결로 유지: orderId={}, error={}",
                    order.getId(), e.getMessage());
            return order;
        }
    }

    // =====================================================
    // 2. 주문 정정
    // =====================================================

    /**
     * 주문 정정
     * Amend order (price, quantity, expires_at, notes)
     * 
     * PENDING, PARTIALLY_FILLED 상태에서만 가능합니다.
     * 매수: 수량/가격이 바뀌면 남은 수량 기준으로 예약금을 다시 계산하고 차액만 예약 또는 해제
     * 매도: 수량이 바뀌면 이 주문을 제외한 매도 가능 수량으로 다시 검증
     * 
     * @param userId 사용자 ID
     * @param orderId 주문 ID
     * @param command 정정 명령
     * @return 정정된 주문
     * @throws NotFoundException 주문이 없거나 다른 사용자의 주문인 경우
     * @throws ValidationException 종료된 주문, 잘못된 정정 값, 매도 가능 수량 부족
     * @throws InsufficientBalanceException 늘어난 매수 예약금이 가용 잔고를 초과하는 경우
     */
    public Order amendOrder(Long userId, Long orderId, AmendOrderCommand command) {
        if (command == null) {
            throw new ValidationException("정정 명령은 필수입니다");
        }
        Order snapshot = getOrder(userId, orderId);
        validateAmendment(snapshot, command);
        FeeSchedule schedule = feeConfigService.getFeeSchedule(snapshot.getMarket());

        Order amended = ledgerTransactionRunner.execute("amendOrder", status -> {
            VirtualBalance balance = balanceService.lockAccount(userId);
            Order order = orderRepository.findByIdForUpdate(orderId)
                    .filter(o -> o.getUserId().equals(userId))
                    .orElseThrow(() -> new NotFoundException(String.format(
                            "주문을 찾을 수 없습니다: userId=%d, orderId=%d", userId, orderId)));
            if (order.getOrderStatus().isTerminal()) {
                throw new ValidationException(String.format(
                        "정정할 수 없는 주문 상태입니다: orderId=%d, status=%s", orderId, order.getOrderStatus()));
            }

            BigDecimal quantity = command.getQuantity() != null ? command.getQuantity() : order.getQuantity();
            if (quantity.compareTo(order.getExecutedQuantity()) <= 0) {
                throw new ValidationException(String.format(
                        "정정 수량은 체결 수량보다 커야 합니다: orderId=%d, quantity=%s, executedQuantity=%s",
                        orderId, quantity, order.getExecutedQuantity()));
            }
            BigDecimal remaining = quantity.subtract(order.getExecutedQuantity());
            BigDecimal referencePrice = command.getOrderPrice() != null
                    ? command.getOrderPrice()
                    : order.getReferencePrice();

            if (order.getOrderType() == OrderType.BUY) {
                if (command.changesQuantityOrPrice()) {
                    reReserve(balance, order, schedule, remaining, referencePrice);
                }
            } else if (command.getQuantity() != null) {
                BigDecimal held = portfolioRepository.findByUserIdAndStockId(userId, order.getStockId())
                        .map(Portfolio::getCurrentQuantity)
                        .orElse(BigDecimal.ZERO);
                BigDecimal reserved = MoneyUtils.nvl(orderRepository.sumOpenSellQuantityExcluding(
                        userId, order.getStockId(), orderId));
                BigDecimal available = held.subtract(reserved);
                if (remaining.compareTo(available) > 0) {
                    throw new ValidationException(String.format(
                            "매도 가능 수량이 부족합니다. 보유: %s, 다른 미체결 매도: %s, 매도 가능: %s, 정정 후 잔량: %s",
                            held, reserved, available.max(BigDecimal.ZERO), remaining));
                }
            }

            order.setQuantity(quantity);
            if (command.getOrderPrice() != null) {
                order.setOrderPrice(command.getOrderPrice());
                order.setReferencePrice(command.getOrderPrice());
            }
            if (command.getExpiresAt() != null) {
                order.setExpiresAt(command.getExpiresAt());
            }
            if (command.getNotes() != null) {
                order.setNotes(command.getNotes());
            }
            return orderRepository.save(order);
        });

        log.info("[OrderService] 주문 정정: orderId={}, userId={}, quantity={}, price={}, expiresAt={}, reservedCash={}",
                orderId, userId, amended.getQuantity(), amended.getReferencePrice(), amended.getExpiresAt(),
                amended.getReservedCash());
        return amended;
    }

    /**
     * 매수 예약금 재계산 (남은 수량 x 가격 x 접수 환율 + 예상 수수료)
     * 기존 예약금과의 차액만 가용 잔고에서 예약하거나 돌려줍니다.
     */
    private void reReserve(VirtualBalance balance, Order order, FeeSchedule schedule,
                           BigDecimal remaining, BigDecimal referencePrice) {
        BigDecimal required = feeCalculator.notional(remaining, referencePrice, order.getExchangeRate())
                .add(feeCalculator.estimateBuyFee(schedule, remaining, referencePrice, order.getExchangeRate()));
        BigDecimal difference = required.subtract(order.getReservedCash());

        if (difference.signum() > 0) {
            balanceService.reserve(balance, difference);
        } else if (difference.signum() < 0) {
            balanceService.release(balance, difference.negate(), order.getId());
        }
        order.setReservedCash(required);
    }

    private void validateAmendment(Order order, AmendOrderCommand command) {
        if (order.getOrderStatus().isTerminal()) {
            throw new ValidationException(String.format(
                    "정정할 수 없는 주문 상태입니다: orderId=%d, status=%s", order.getId(), order.getOrderStatus()));
        }
        if (command.getQuantity() != null && !MoneyUtils.isPositive(command.getQuantity())) {
            throw new ValidationException("주문 수량은 0보다 커야 합니다: quantity=" + command.getQuantity());
        }
        if (command.getOrderPrice() != null) {
            if (!order.getOrderMethod().requiresPrice()) {
                throw new ValidationException(String.format(
                        "시장가 주문은 가격을 정정할 수 없습니다: orderId=%d", order.getId()));
            }
            if (!MoneyUtils.isPositive(command.getOrderPrice())) {
                throw new ValidationException("주문 가격은 0보다 커야 합니다: orderPrice=" + command.getOrderPrice());
            }
        }
        if (command.getExpiresAt() != null && !command.getExpiresAt().isAfter(LocalDateTime.now(clock))) {
            throw new ValidationException("만료 시각은 현재 이후여야 합니다: expiresAt=" + command.getExpiresAt());
        }
    }

    // =====================================================
    // 3. 취소 / 만료 / 거부
    // =====================================================

    /**
     * 주문 취소
     * Cancel order
     * 
     * PENDING, PARTIALLY_FILLED 상태에서만 가능합니다.
     * 매수 주문은 남은 예약금을 가용 잔고로 정확히 돌려줍니다.
     * 
     * @param userId 사용자 ID
     * @param orderId 주문 ID
     * @return 취소된 주문
     * @throws NotFoundException 주문이 없거나 다른 사용자의 주문인 경우
     * @throws ValidationException 이미 종료된 주문인 경우
     */
    public Order cancelOrder(Long userId, Long orderId) {
        Order cancelled = ledgerTransactionRunner.execute("cancelOrder", status -> {
            VirtualBalance balance = balanceService.lockAccount(userId);
            Order order = orderRepository.findByIdForUpdate(orderId)
                    .filter(o -> o.getUserId().equals(userId))
                    .orElseThrow(() -> new NotFoundException(String.format(
                            "주문을 찾을 수 없습니다: userId=%d, orderId=%d", userId, orderId)));

            requireTransition(order, OrderStatus.CANCELLED, "취소");
            releaseReservation(balance, order);
            order.setOrderStatus(OrderStatus.CANCELLED);
            order.setCancelledDate(LocalDateTime.now(clock));
            return orderRepository.save(order);
        });

        log.info("[OrderService] 주문 취소: orderId={}, userId={}, executedQuantity={}/{}",
                orderId, userId, cancelled.getExecutedQuantity(), cancelled.getQuantity());
        return cancelled;
    }

    /**
     * 만료 시각이 지난 미체결 주문 일괄 만료
     * Expire open orders whose expires_at <= asOf
     * 
     * 주문마다 별도 트랜잭션으로 처리하며, 실패한 주문은 로그만 남기고 건너뜁니다.
     * 
     * @param asOf 기준 시각
     * @return 만료 처리된 주문 수
     */
    public int expireOrders(LocalDateTime asOf) {
        List<Long> orderIds = orderRepository.findExpirableOrderIds(asOf);
        if (orderIds.isEmpty()) {
            return 0;
        }

        int expired = 0;
        for (Long orderId : orderIds) {
            try {
                if (expireOrder(orderId, asOf)) {
                    expired++;
                }
            } catch (TradingException e) {
                log.warn("[OrderService] 주문 만료 건너뜀: orderId={}, error={}", orderId, e.getMessage());
            } catch (RuntimeException e) {
                log.error("[OrderService] 주문 만료 실패: orderId={}", orderId, e);
            }
        }

        log.info("[OrderService] 주문 만료 처리 완료: asOf={}, 대상={}, 만료={}", asOf, orderIds.size(), expired);
        return expired;
    }

    /**
     * 단일 주문 만료
     * Expire a single order (락 획득 후 상태와 만료 시각을 다시 확인)
     * 
     * @return 만료 처리 여부 (이미 종료되었거나 만료 시각 전이면 false)
     */
    public boolean expireOrder(Long orderId, LocalDateTime asOf) {
        Long ownerId = findOwnerId(orderId);

        return ledgerTransactionRunner.execute("expireOrder", status -> {
            VirtualBalance balance = balanceService.lockAccount(ownerId);
            Order order = orderRepository.findByIdForUpdate(orderId)
                    .orElseThrow(() -> new NotFoundException("주문을 찾을 수 없습니다: orderId=" + orderId));

            if (order.getOrderStatus().isTerminal()
                    || order.getExpiresAt() == null
                    || order.getExpiresAt().isAfter(asOf)) {
                return false;
            }

            releaseReservation(balance, order);
            order.setOrderStatus(OrderStatus.EXPIRED);
            orderRepository.save(order);

            log.info("[OrderService] 주문 만료: orderId={}, userId={}, expiresAt={}",
                    orderId, ownerId, order.getExpiresAt());
            return true;
        });
    }

    /**
     * 주문 거부 (운영자용)
     * Reject a PENDING order
     * 
     * @param orderId 주문 ID
     * @param reason 거부 사유
     * @return 거부된 주문
     * @throws ValidationException PENDING 상태가 아닌 경우
     */
    public Order rejectOrder(Long orderId, String reason) {
        Long ownerId = findOwnerId(orderId);

        Order rejected = ledgerTransactionRunner.execute("rejectOrder", status -> {
            VirtualBalance balance = balanceService.lockAccount(ownerId);
            Order order = orderRepository.findByIdForUpdate(orderId)
                    .orElseThrow(() -> new NotFoundException("주문을 찾을 수 없습니다: orderId=" + orderId));

            requireTransition(order, OrderStatus.REJECTED, "거부");
            releaseReservation(balance, order);
            order.setOrderStatus(OrderStatus.REJECTED);
            order.setRejectReason(reason);
            return orderRepository.save(order);
        });

        log.info("[OrderService] 주문 거부: orderId={}, userId={}, reason={}", orderId, ownerId, reason);
        return rejected;
    }

    // =====================================================
    // 4. 조회
    // =====================================================

    /**
     * 주문 조회
     * Get order
     * 
     * @throws NotFoundException 주문이 없거나 다른 사용자의 주문인 경우
     */
    @Transactional(readOnly = true)
    public Order getOrder(Long userId, Long orderId) {
        return orderRepository.findByUserIdAndId(userId, orderId)
                .orElseThrow(() -> new NotFoundException(String.format(
                        "주문을 찾을 수 없습니다: userId=%d, orderId=%d", userId, orderId)));
    }

    /**
     * 주문 목록 조회 (상태 필터 optional)
     * Get orders
     */
    @Transactional(readOnly = true)
    public Page<Order> getOrders(Long userId, OrderStatus status, Pageable pageable) {
        if (status != null) {
            return orderRepository.findByUserIdAndOrderStatus(userId, status, pageable);
        }
        return orderRepository.findByUserId(userId, pageable);
    }

    /**
     * 미체결 주문 목록 조회 (PENDING, PARTIALLY_FILLED)
     * Get open orders
     */
    @Transactional(readOnly = true)
    public List<Order> getPendingOrders(Long userId) {
        return orderRepository.findByUserIdAndOrderStatusInOrderByOrderDateDesc(userId, OrderStatus.openStatuses());
    }

    @Transactional(readOnly = true)
    public List<OrderExecution> getExecutions(Long userId, Long orderId) {
        Order order = getOrder(userId, orderId);
        return orderExecutionRepository.findByOrderIdOrderByIdAsc(order.getId());
    }

    // =====================================================
    // 내부 메서드
    // =====================================================

    private void validateCommand(CreateOrderCommand command) {
        if (command.getUserId() == null) {
            throw new ValidationException("사용자 ID는 필수입니다");
        }
        if (command.getStockId() == null || command.getStockId().isBlank()) {
            throw new ValidationException("종목 코드는 필수입니다");
        }
        if (command.getOrderType() == null || command.getOrderMethod() == null) {
            throw new ValidationException(String.format(
                    "주문 유형과 주문 방식은 필수입니다: orderType=%s, orderMethod=%s",
                    command.getOrderType(), command.getOrderMethod()));
        }
        if (!MoneyUtils.isPositive(command.getQuantity())) {
            throw new ValidationException("주문 수량은 0보다 커야 합니다: quantity=" + command.getQuantity());
        }
        if (command.getOrderMethod().requiresPrice() && !MoneyUtils.isPositive(command.getOrderPrice())) {
            throw new ValidationException(String.format(
                    "%s 주문은 0보다 큰 주문 가격이 필요합니다: orderPrice=%s",
                    command.getOrderMethod(), command.getOrderPrice()));
        }
        if (command.getExpiresAt() != null && !command.getExpiresAt().isAfter(LocalDateTime.now(clock))) {
            throw new ValidationException("만료 시각은 현재 이후여야 합니다: expiresAt=" + command.getExpiresAt());
        }
    }

    /**
     * 시세 조회
     * 시장가 주문은 시세가 필수, 지정가 계열은 시세가 없으면 보유 종목의 통화를 따름
     */
    private MarketQuote resolveQuote(CreateOrderCommand command) {
        return marketPriceProvider.getQuote(command.getStockId())
                .filter(quote -> MoneyUtils.isPositive(quote.getPrice()) || command.getOrderMethod().requiresPrice())
                .orElseGet(() -> {
                    if (!command.getOrderMethod().requiresPrice()) {
                        throw new ValidationException(
                                "시장가 주문의 기준 가격을 조회할 수 없습니다: stockId=" + command.getStockId());
                    }
                    return fallbackQuote(command.getUserId(), command.getStockId());
                });
    }

    /**
     * 시세 없는 지정가 계열 주문의 통화/시장 결정
     * 
     * 1. 보유 종목이 있으면 그 통화 (시장은 같은 통화의 직전 주문에서)
     * 2. 보유 이력이 없으면 원화 자산
     */
    private MarketQuote fallbackQuote(Long userId, String stockId) {
        String currency = portfolioRepository.findByUserIdAndStockId(userId, stockId)
                .map(Portfolio::getCurrency)
                .orElse(DEFAULT_CURRENCY);
        String market = orderRepository.findFirstByUserIdAndStockIdOrderByIdDesc(userId, stockId)
                .filter(previous -> currency.equalsIgnoreCase(previous.getCurrency()))
                .map(Order::getMarket)
                .orElse(null);

        if (!DEFAULT_CURRENCY.equalsIgnoreCase(currency)) {
            log.info("[OrderService] 시세 없음, 보유 종목 통화 적용: userId={}, stockId={}, currency={}, market={}",
                    userId, stockId, currency, market);
        }
        return MarketQuote.builder()
                .stockId(stockId)
                .currency(currency)
                .market(market)
                .build();
    }

    private BigDecimal resolveExchangeRate(MarketQuote quote) {
        if (quote.isDomestic()) {
            return BigDecimal.ONE;
        }
        return marketPriceProvider.getExchangeRate(quote.getCurrency())
                .filter(MoneyUtils::isPositive)
                .map(MoneyUtils::rate)
                .orElseThrow(() -> new ValidationException(String.format(
                        "환율 정보를 조회할 수 없습니다: stockId=%s, currency=%s",
                        quote.getStockId(), quote.getCurrency())));
    }

    private LocalDateTime resolveExpiresAt(CreateOrderCommand command, LocalDateTime now) {
        if (command.getExpiresAt() != null) {
            return command.getExpiresAt();
        }
        Duration ttl = tradingProperties.getOrder().getDefaultTimeToLive();
        return ttl != null ? now.plus(ttl) : null;
    }

    private Long findOwnerId(Long orderId) {
        return orderRepository.findById(orderId)
                .map(Order::getUserId)
                .orElseThrow(() -> new NotFoundException("주문을 찾을 수 없습니다: orderId=" + orderId));
    }

    private void requireTransition(Order order, OrderStatus next, String action) {
        if (!order.getOrderStatus().canTransitionTo(next)) {
            throw new ValidationException(String.format(
                    "%s할 수 없는 주문 상태입니다: orderId=%d, status=%s", action, order.getId(), order.getOrderStatus()));
        }
    }

    /**
     * 남은 매수 예약금 해제 (매도 주문은 해제할 예약 없음)
     */
    private void releaseReservation(VirtualBalance balance, Order order) {
        BigDecimal reserved = order.getReservedCash();
        if (order.getOrderType() == OrderType.BUY && reserved.signum() > 0) {
            balanceService.release(balance, reserved, order.getId());
            order.setReservedCash(BigDecimal.ZERO);
        }
    }
}
