package dustin.papertrade.domains.statistics.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.papertrade.domains.statistics.model.PeriodType;
import dustin.papertrade.domains.statistics.model.dto.RealizedProfitLossSummary;
import dustin.papertrade.domains.statistics.model.dto.StockProfitLoss;
import dustin.papertrade.domains.statistics.model.entity.TradingStatistics;
import dustin.papertrade.domains.statistics.repository.TradingStatisticsRepository;
import dustin.papertrade.domains.transaction.model.TransactionType;
import dustin.papertrade.domains.transaction.model.entity.Transaction;
import dustin.papertrade.domains.transaction.repository.TransactionRepository;
import dustin.papertrade.shared.exception.ConflictException;
import dustin.papertrade.shared.exception.ValidationException;
import dustin.papertrade.shared.transaction.LedgerTransactionRunner;
import dustin.papertrade.shared.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;

/**
 * 거래 통계 서비스
 * Statistics Service
 * 
 * 역할:
 * - 사용자별 일별 거래 통계 집계 (trading_statistics)
 * - 전체 사용자 일별 통계 배치 (statisticsExecutor 스레드 풀)
 * - 기간별 실현 손익 요약
 * 
 * 집계 기준:
 * - [date 00:00, date+1 00:00) 구간의 BUY/SELL 거래 (trading.zone-id 기준 시각)
 * - 같은 날짜를 다시 집계하면 기존 행을 덮어씀 (멱등)
 * - 동시 생성으로 유니크 제약 위반 시 한 번 재집계
 */
@Slf4j
@Service
public class StatisticsService {

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final LocalDateTime MIN_DATE = LocalDateTime.of(1970, 1, 1, 0, 0);
    private static final LocalDateTime MAX_DATE = LocalDateTime.of(9999, 12, 31, 23, 59, 59);

    private final TransactionRepository transactionRepository;
    private final TradingStatisticsRepository tradingStatisticsRepository;
    private final LedgerTransactionRunner ledgerTransactionRunner;
    private final Executor statisticsExecutor;

    public StatisticsService(
            TransactionRepository transactionRepository,
            TradingStatisticsRepository tradingStatisticsRepository,
            LedgerTransactionRunner ledgerTransactionRunner,
            @Qualifier("statisticsExecutor") Executor statisticsExecutor) {
        this.transactionRepository = transactionRepository;
        this.tradingStatisticsRepository = tradingStatisticsRepository;
        this.ledgerTransactionRunner = ledgerTransactionRunner;
        this.statisticsExecutor = statisticsExecutor;
    }

    // =====================================================
    // 1. 일별 통계 집계
    // =====================================================

    /**
     * 사용자 일별 통계 갱신
     * Update daily statistics for user and date
     * 
     * @param userId 사용자 ID
     * @param date 집계 날짜
     * @return 저장된 통계
     * @throws ConflictException 재집계 후에도 유니크 제약 충돌이 계속되는 경우
     */
    public TradingStatistics updateDailyStatistics(Long userId, LocalDate date) {
        try {
            return upsertDailyStatistics(userId, date);
        } catch (DataIntegrityViolationException e) {
            // 같은 (사용자, 날짜) 행을 다른 집계가 먼저 생성함: 다시 집계하면 그 행을 덮어씀
            log.warn("[StatisticsService] 일별 통계 동시 생성 충돌, 재집계: userId={}, date={}, error={}",
                    userId, date, e.getMessage());
        }

        try {
            return upsertDailyStatistics(userId, date);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException(String.format(
                    "일별 통계를 저장하지 못했습니다: userId=%d, date=%s", userId, date), e);
        }
    }

    private TradingStatistics upsertDailyStatistics(Long userId, LocalDate date) {
        LocalDateTime start = date.atStartOfDay();
        LocalDateTime end = date.plusDays(1).atStartOfDay();

        return ledgerTransactionRunner.execute("updateDailyStatistics", status -> {
            List<Transaction> transactions = transactionRepository.findByUserIdInPeriod(userId, start, end);

            int buyTrades = 0;
            int sellTrades = 0;
            int winTrades = 0;
            int lossTrades = 0;
            BigDecimal totalBuyAmount = BigDecimal.ZERO;
            BigDecimal totalSellAmount = BigDecimal.ZERO;
            BigDecimal totalCommission = BigDecimal.ZERO;
            BigDecimal totalTax = BigDecimal.ZERO;
            BigDecimal realizedProfitLoss = BigDecimal.ZERO;

            for (Transaction transaction : transactions) {
                if (!transaction.getTransactionType().isTrade()) {
                    continue;
                }
                totalCommission = totalCommission.add(MoneyUtils.nvl(transaction.getCommission()));
                totalTax = totalTax.add(MoneyUtils.nvl(transaction.getTax()));

                if (transaction.getTransactionType() == TransactionType.BUY) {
                    buyTrades++;
                    totalBuyAmount = totalBuyAmount.add(transaction.getAmount());
                } else {
                    sellTrades++;
                    totalSellAmount = totalSellAmount.add(transaction.getAmount());
                    BigDecimal profitLoss = MoneyUtils.nvl(transaction.getRealizedProfitLoss());
                    realizedProfitLoss = realizedProfitLoss.add(profitLoss);
                    if (profitLoss.signum() > 0) {
                        winTrades++;
                    } else if (profitLoss.signum() < 0) {
                        lossTrades++;
                    }
                }
            }

            BigDecimal winRate = sellTrades > 0
                    ? BigDecimal.valueOf(winTrades).multiply(HUNDRED)
                            .divide(BigDecimal.valueOf(sellTrades), 2, RoundingMode.HALF_UP)
                    : MoneyUtils.money(BigDecimal.ZERO);

            TradingStatistics statistics = tradingStatisticsRepository
                    .findByUserIdAndPeriodTypeAndStatDate(userId, TradingStatistics.PERIOD_DAILY, date)
                    .orElseGet(() -> TradingStatistics.builder()
                            .userId(userId)
                            .periodType(TradingStatistics.PERIOD_DAILY)
                            .statDate(date)
                            .build());

            statistics.setTotalTrades(buyTrades + sellTrades);
            statistics.setBuyTrades(buyTrades);
            statistics.setSellTrades(sellTrades);
            statistics.setTotalBuyAmount(MoneyUtils.money(totalBuyAmount));
            statistics.setTotalSellAmount(MoneyUtils.money(totalSellAmount));
            statistics.setTotalCommission(MoneyUtils.money(totalCommission));
            statistics.setTotalTax(MoneyUtils.money(totalTax));
            statistics.setRealizedProfitLoss(MoneyUtils.money(realizedProfitLoss));
            statistics.setWinTrades(winTrades);
            statistics.setLossTrades(lossTrades);
            statistics.setWinRate(winRate);
            TradingStatistics saved = tradingStatisticsRepository.saveAndFlush(statistics);

            log.info("[StatisticsService] 일별 통계 갱신: userId={}, date={}, trades={}, realizedProfitLoss={}, winRate={}",
                    userId, date, saved.getTotalTrades(), saved.getRealizedProfitLoss(), saved.getWinRate());
            return saved;
        });
    }

    /**
     * 전체 사용자 일별 통계 갱신
     * Update daily statistics for every user who traded on the date
     * 
     * 사용자별 집계는 statisticsExecutor에서 병렬로 실행되며,
     * 개별 사용자 실패는 로그만 남기고 나머지 사용자는 계속 처리합니다.
     * 
     * @param date 집계 날짜
     * @return 성공한 사용자 수
     */
    public int updateDailyStatisticsForAllUsers(LocalDate date) {
        List<Long> userIds = transactionRepository.findTradingUserIdsInPeriod(
                date.atStartOfDay(), date.plusDays(1).atStartOfDay());
        log.info("[StatisticsService] 일별 통계 배치 시작: date={}, 대상 사용자 수={}", date, userIds.size());

        AtomicInteger succeeded = new AtomicInteger();
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (Long userId : userIds) {
            futures.add(CompletableFuture.runAsync(() -> {
                try {
                    updateDailyStatistics(userId, date);
                    succeeded.incrementAndGet();
                } catch (RuntimeException e) {
                    log.error("[StatisticsService] 사용자 일별 통계 갱신 실패: userId={}, date={}", userId, date, e);
                }
            }, statisticsExecutor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        log.info("[StatisticsService] 일별 통계 배치 완료: date={}, 성공={}/{}", date, succeeded.get(), userIds.size());
        return succeeded.get();
    }

    // =====================================================
    // 2. 조회
    // =====================================================

    /**
     * 일별 통계 조회
     * Get daily statistics in [from, to]
     */
    @Transactional(readOnly = true)
    public List<TradingStatistics> getStatistics(Long userId, LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new ValidationException(String.format("조회 기간이 올바르지 않습니다: from=%s, to=%s", from, to));
        }
        return tradingStatisticsRepository.findByUserIdAndPeriodTypeAndStatDateBetweenOrderByStatDateAsc(
                userId, TradingStatistics.PERIOD_DAILY, from, to);
    }

    /**
     * 기간별 실현 손익 요약
     * Get realized profit/loss summary for a period
     * 
     * @param userId 사용자 ID
     * @param periodType 기간 유형
     * @param anchor 기준일 (ALL이면 무시)
     * @return 실현 손익 요약 (종목별 내역 포함, 종목 코드순)
     */
    @Transactional(readOnly = true)
    public RealizedProfitLossSummary getPeriodRealizedProfitLoss(Long userId, PeriodType periodType, LocalDate anchor) {
        LocalDateTime from;
        LocalDateTime to;
        switch (periodType) {
            case DAY:
                from = anchor.atStartOfDay();
                to = anchor.plusDays(1).atStartOfDay();
                break;
            case WEEK:
                LocalDate monday = anchor.with(DayOfWeek.MONDAY);
                from = monday.atStartOfDay();
                to = monday.plusWeeks(1).atStartOfDay();
                break;
            case MONTH:
                from = anchor.withDayOfMonth(1).atStartOfDay();
                to = anchor.withDayOfMonth(1).plusMonths(1).atStartOfDay();
                break;
            case YEAR:
                from = anchor.withDayOfYear(1).atStartOfDay();
                to = anchor.withDayOfYear(1).plusYears(1).atStartOfDay();
                break;
            default:
                from = MIN_DATE;
                to = MAX_DATE;
                break;
        }

        List<Transaction> sells = transactionRepository.findRealizedSellsInPeriod(userId, from, to);

        BigDecimal realizedProfitLoss = BigDecimal.ZERO;
        BigDecimal sellAmount = BigDecimal.ZERO;
        Map<String, StockProfitLoss> byStock = new TreeMap<>();
        for (Transaction sell : sells) {
            realizedProfitLoss = realizedProfitLoss.add(sell.getRealizedProfitLoss());
            sellAmount = sellAmount.add(sell.getAmount());

            StockProfitLoss stock = byStock.computeIfAbsent(sell.getStockId(), stockId -> StockProfitLoss.builder()
                    .stockId(stockId)
                    .sellQuantity(BigDecimal.ZERO)
                    .sellAmount(BigDecimal.ZERO)
                    .realizedProfitLoss(BigDecimal.ZERO)
                    .priceProfitLoss(BigDecimal.ZERO)
                    .exchangeProfitLoss(BigDecimal.ZERO)
                    .build());
            stock.setSellTrades(stock.getSellTrades() + 1);
            stock.setSellQuantity(stock.getSellQuantity().add(sell.getQuantity()));
            stock.setSellAmount(stock.getSellAmount().add(sell.getAmount()));
            stock.setRealizedProfitLoss(stock.getRealizedProfitLoss().add(sell.getRealizedProfitLoss()));
            stock.setPriceProfitLoss(stock.getPriceProfitLoss().add(MoneyUtils.nvl(sell.getPriceProfitLoss())));
            stock.setExchangeProfitLoss(stock.getExchangeProfitLoss().add(MoneyUtils.nvl(sell.getExchangeProfitLoss())));
        }

        BigDecimal investedAmount = sellAmount.subtract(realizedProfitLoss);
        BigDecimal profitLossRate = investedAmount.signum() > 0
                ? realizedProfitLoss.multiply(HUNDRED).divide(investedAmount, 2, RoundingMode.HALF_UP)
                : MoneyUtils.money(BigDecimal.ZERO);

        return RealizedProfitLossSummary.builder()
                .userId(userId)
                .periodType(periodType)
                .from(from)
                .to(to)
                .realizedProfitLoss(MoneyUtils.money(realizedProfitLoss))
                .sellAmount(MoneyUtils.money(sellAmount))
                .investedAmount(MoneyUtils.money(investedAmount))
                .profitLossRate(profitLossRate)
                .stocks(new ArrayList<>(byStock.values()))
                .build();
    }
}
