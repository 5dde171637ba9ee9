package dustin.papertrade.domains.position.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import dustin.papertrade.domains.fee.model.ProfitLoss;
import dustin.papertrade.domains.fee.service.FeeCalculator;
import dustin.papertrade.domains.market.model.MarketQuote;
import dustin.papertrade.domains.market.service.MarketPriceProvider;
import dustin.papertrade.domains.order.repository.OrderRepository;
import dustin.papertrade.domains.position.model.dto.PositionResponse;
import dustin.papertrade.domains.position.model.dto.PositionSellResult;
import dustin.papertrade.domains.position.model.entity.Portfolio;
import dustin.papertrade.domains.position.repository.PortfolioRepository;
import dustin.papertrade.shared.exception.NotFoundException;
import dustin.papertrade.shared.exception.ValidationException;
import dustin.papertrade.shared.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 보유 종목 서비스
 * Position Service (PositionBook)
 * 
 * 역할:
 * - 매수 체결 시 가중 평균 매수가/평균 환율 갱신
 * - 매도 체결 시 수량 차감, 실현 손익 계산
 * - 보유 종목 및 매도 가능 수량 조회
 * 
 * 동시성 제어:
 * - applyBuy/applySell은 체결 정산 트랜잭션 안에서만 실행됨 (MANDATORY)
 * - 사용자 잔고 락 → 주문 락 다음에 포지션 행을 FOR UPDATE로 잠금
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionService {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final PortfolioRepository portfolioRepository;
    private final OrderRepository orderRepository;
    private final FeeCalculator feeCalculator;
    private final MarketPriceProvider marketPriceProvider;
    private final Clock clock;

    // =====================================================
    // 1. 체결 반영
    // =====================================================

    /**
     * 매수 체결 반영
     * Apply a BUY fill to the position
     * 
     * 처리:
     * - 신규 또는 수량 0인 포지션: 체결가/환율로 새 평균 시작, first_buy_date 설정
     * - 기존 포지션: 가중 평균
     *   새 평균가 = (기존 수량 * 기존 평균가 + 체결 수량 * 체결가) / (기존 수량 + 체결 수량)
     *   새 평균 환율도 같은 가중치로 계산
     * 
     * @param userId 사용자 ID
     * @param stockId 종목 코드
     * @param currency 종목 통화
     * @param quantity 체결 수량
     * @param price 체결가 (현지 통화)
     * @param exchangeRate 체결 환율
     * @return 갱신된 포지션
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Portfolio applyBuy(
            Long userId, String stockId, String currency,
            BigDecimal quantity, BigDecimal price, BigDecimal exchangeRate) {
        LocalDateTime now = LocalDateTime.now(clock);
        Portfolio portfolio = portfolioRepository.findByUserIdAndStockIdForUpdate(userId, stockId)
                .orElseGet(() -> Portfolio.builder()
                        .userId(userId)
                        .stockId(stockId)
                        .currency(currency)
                        .build());

        BigDecimal previousQuantity = portfolio.getCurrentQuantity();
        BigDecimal newQuantity = previousQuantity.add(quantity);

        if (previousQuantity.signum() == 0) {
            portfolio.setAveragePrice(MoneyUtils.price(price));
            portfolio.setAverageExchangeRate(MoneyUtils.rate(exchangeRate));
            portfolio.setCurrency(currency);
            portfolio.setFirstBuyDate(now);
        } else {
            BigDecimal averagePrice = previousQuantity.multiply(portfolio.getAveragePrice())
                    .add(quantity.multiply(price))
                    .divide(newQuantity, MoneyUtils.PRICE_SCALE, RoundingMode.HALF_UP);
            BigDecimal averageExchangeRate = previousQuantity.multiply(portfolio.getAverageExchangeRate())
                    .add(quantity.multiply(exchangeRate))
                    .divide(newQuantity, MoneyUtils.RATE_SCALE, RoundingMode.HALF_UP);
            portfolio.setAveragePrice(averagePrice);
            portfolio.setAverageExchangeRate(averageExchangeRate);
        }

        portfolio.setKrwAveragePrice(MoneyUtils.price(
                portfolio.getAveragePrice().multiply(portfolio.getAverageExchangeRate())));
        portfolio.setCurrentQuantity(newQuantity);
        portfolio.setLastBuyDate(now);
        portfolio.setIsActive(true);
        Portfolio saved = portfolioRepository.save(portfolio);

        log.info("[PositionService] 매수 반영: userId={}, stockId={}, quantity={} -> {}, averagePrice={}",
                userId, stockId, previousQuantity, newQuantity, saved.getAveragePrice());
        return saved;
    }

    /**
     * 매도 체결 반영
     * Apply a SELL fill to the position
     * 
     * 처리:
     * - 보유 수량 차감 (평균 매수가 유지)
     * - 실현 손익 계산 후 누적 (가격 손익 + 환율 손익)
     * - 수량이 0이 되면 비활성화, 평균가/평균 환율 초기화
     * 
     * @param userId 사용자 ID
     * @param stockId 종목 코드
     * @param quantity 체결 수량
     * @param price 체결가 (현지 통화)
     * @param exchangeRate 매도 시점 환율
     * @param fee 수수료 + 세금 (원화)
     * @return 매도 반영 결과 (매수 원가, 실현 손익)
     * @throws ValidationException 보유 수량이 부족한 경우
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public PositionSellResult applySell(
            Long userId, String stockId,
            BigDecimal quantity, BigDecimal price, BigDecimal exchangeRate, BigDecimal fee) {
        Portfolio portfolio = portfolioRepository.findByUserIdAndStockIdForUpdate(userId, stockId)
                .orElseThrow(() -> new ValidationException(String.format(
                        "보유하지 않은 종목은 매도할 수 없습니다: userId=%d, stockId=%s", userId, stockId)));

        BigDecimal previousQuantity = portfolio.getCurrentQuantity();
        if (previousQuantity.compareTo(quantity) < 0) {
            throw new ValidationException(String.format(
                    "보유 수량이 부족합니다: userId=%d, stockId=%s, 보유=%s, 매도=%s",
                    userId, stockId, previousQuantity, quantity));
        }

        BigDecimal averagePrice = portfolio.getAveragePrice();
        BigDecimal averageExchangeRate = portfolio.getAverageExchangeRate();
        boolean domestic = isDomestic(portfolio.getCurrency());

        ProfitLoss profitLoss = feeCalculator.calculateProfitLoss(
                price, quantity, averagePrice, averageExchangeRate, exchangeRate, fee, domestic);
        BigDecimal costBasis = MoneyUtils.money(averagePrice.multiply(quantity).multiply(averageExchangeRate));

        BigDecimal newQuantity = previousQuantity.subtract(quantity);
        portfolio.setCurrentQuantity(newQuantity);
        portfolio.setRealizedProfitLoss(portfolio.getRealizedProfitLoss().add(profitLoss.getRealizedProfitLoss()));
        portfolio.setLastSellDate(LocalDateTime.now(clock));
        if (newQuantity.signum() == 0) {
            portfolio.setIsActive(false);
            portfolio.setAveragePrice(BigDecimal.ZERO);
            portfolio.setAverageExchangeRate(BigDecimal.ZERO);
            portfolio.setKrwAveragePrice(BigDecimal.ZERO);
        }
        Portfolio saved = portfolioRepository.save(portfolio);

        log.info("[PositionService] 매도 반영: userId={}, stockId={}, quantity={} -> {}, realizedProfitLoss={}",
                userId, stockId, previousQuantity, newQuantity, profitLoss.getRealizedProfitLoss());

        return PositionSellResult.builder()
                .portfolio(saved)
                .averagePrice(averagePrice)
                .averageExchangeRate(averageExchangeRate)
                .costBasis(costBasis)
                .profitLoss(profitLoss)
                .build();
    }

    // =====================================================
    // 2. 조회
    // =====================================================

    /**
     * 보유 종목 목록 조회 (활성 포지션만)
     * Get active positions
     * 
     * 시세 제공자에 현재가가 있으면 평가 금액/평가 손익을 함께 계산합니다.
     */
    @Transactional(readOnly = true)
    public List<PositionResponse> getPositions(Long userId) {
        List<Portfolio> portfolios = portfolioRepository.findByUserIdAndIsActiveTrueOrderByStockIdAsc(userId);

        List<PositionResponse> result = new ArrayList<>();
        for (Portfolio portfolio : portfolios) {
            result.add(toResponse(portfolio));
        }
        return result;
    }

    /**
     * 종목별 보유 현황 조회
     * Get position for user and stock
     * 
     * @throws NotFoundException 포지션이 없는 경우
     */
    @Transactional(readOnly = true)
    public PositionResponse getPosition(Long userId, String stockId) {
        Portfolio portfolio = portfolioRepository.findByUserIdAndStockId(userId, stockId)
                .orElseThrow(() -> new NotFoundException(String.format(
                        "보유 종목을 찾을 수 없습니다: userId=%d, stockId=%s", userId, stockId)));
        return toResponse(portfolio);
    }

    /**
     * 매도 가능 수량 조회
     * Get sellable quantity = 보유 수량 - 미체결 매도 주문 잔량
     */
    @Transactional(readOnly = true)
    public BigDecimal getSellableQuantity(Long userId, String stockId) {
        BigDecimal held = portfolioRepository.findByUserIdAndStockId(userId, stockId)
                .map(Portfolio::getCurrentQuantity)
                .orElse(BigDecimal.ZERO);
        return calculateSellable(userId, stockId, held);
    }

    private BigDecimal calculateSellable(Long userId, String stockId, BigDecimal held) {
        BigDecimal reserved = MoneyUtils.nvl(orderRepository.sumOpenSellQuantity(userId, stockId));
        BigDecimal sellable = held.subtract(reserved);
        return sellable.signum() < 0 ? BigDecimal.ZERO : sellable;
    }

    private PositionResponse toResponse(Portfolio portfolio) {
        BigDecimal investedAmount = MoneyUtils.money(portfolio.getCurrentQuantity()
                .multiply(portfolio.getAveragePrice())
                .multiply(portfolio.getAverageExchangeRate()));

        PositionResponse.PositionResponseBuilder builder = PositionResponse.builder()
                .userId(portfolio.getUserId())
                .stockId(portfolio.getStockId())
                .currency(portfolio.getCurrency())
                .currentQuantity(portfolio.getCurrentQuantity())
                .sellableQuantity(calculateSellable(
                        portfolio.getUserId(), portfolio.getStockId(), portfolio.getCurrentQuantity()))
                .averagePrice(portfolio.getAveragePrice())
                .averageExchangeRate(portfolio.getAverageExchangeRate())
                .krwAveragePrice(portfolio.getKrwAveragePrice())
                .investedAmount(investedAmount)
                .realizedProfitLoss(portfolio.getRealizedProfitLoss())
                .firstBuyDate(portfolio.getFirstBuyDate())
                .lastBuyDate(portfolio.getLastBuyDate())
                .lastSellDate(portfolio.getLastSellDate());

        Optional<MarketQuote> quote = portfolio.getCurrentQuantity().signum() > 0
                ? marketPriceProvider.getQuote(portfolio.getStockId())
                : Optional.empty();
        if (quote.isPresent()) {
            BigDecimal currentRate = isDomestic(portfolio.getCurrency())
                    ? BigDecimal.ONE
                    : marketPriceProvider.getExchangeRate(portfolio.getCurrency())
                            .orElse(portfolio.getAverageExchangeRate());
            BigDecimal evaluation = feeCalculator.notional(
                    portfolio.getCurrentQuantity(), quote.get().getPrice(), currentRate);
            BigDecimal unrealized = evaluation.subtract(investedAmount);
            builder.currentPrice(quote.get().getPrice())
                    .evaluationAmount(evaluation)
                    .unrealizedProfitLoss(unrealized)
                    .unrealizedProfitLossRate(investedAmount.signum() > 0
                            ? unrealized.multiply(HUNDRED).divide(investedAmount, 2, RoundingMode.HALF_UP)
                            : BigDecimal.ZERO);
        }
        return builder.build();
    }

    private boolean isDomestic(String currency) {
        return currency == null || "KRW".equalsIgnoreCase(currency);
    }
}
