package dustin.papertrade.domains.fee.service;

import java.math.BigDecimal;

import org.springframework.stereotype.Component;

import dustin.papertrade.domains.fee.model.FeeBreakdown;
import dustin.papertrade.domains.fee.model.FeeSchedule;
import dustin.papertrade.domains.fee.model.ProfitLoss;
import dustin.papertrade.domains.order.model.OrderType;
import dustin.papertrade.shared.util.MoneyUtils;

/**
 * 수수료/세금/실현 손익 계산기
 * Fee Calculator
 * 
 * 역할:
 * - 체결 금액에 대한 수수료, 세금 계산
 * - 매수 주문 예약 시 예상 수수료 계산
 * - 매도 체결 시 가격/환율 손익 계산
 * 
 * 계산 규칙 (원화 기준, 소수점 2자리 HALF_UP):
 * - 체결 금액 = 가격 * 수량 * 환율
 * - 수수료 = max(체결 금액 * 수수료율, 최소 수수료) (매수/매도 공통)
 * - 세금 = 체결 금액 * 세율 (매도만)
 * 
 * 주의사항:
 * - I/O 없는 순수 계산 (요율은 FeeConfigService에서 미리 조회한 FeeSchedule로 전달)
 */
@Component
public class FeeCalculator {

    /**
     * 체결 수수료/세금 계산
     * Calculate commission and tax for a fill
     * 
     * @param schedule 수수료 스케줄
     * @param orderType 매수/매도
     * @param quantity 수량
     * @param price 가격 (현지 통화)
     * @param exchangeRate 원화 환율 (원화 자산은 1)
     * @return 수수료/세금
     */
    public FeeBreakdown calculate(
            FeeSchedule schedule, OrderType orderType, BigDecimal quantity, BigDecimal price, BigDecimal exchangeRate) {
        BigDecimal notional = notional(quantity, price, exchangeRate);

        BigDecimal commission = MoneyUtils.money(notional.multiply(schedule.getCommissionRate()));
        BigDecimal minCommission = MoneyUtils.nvl(schedule.getMinCommission());
        if (commission.compareTo(minCommission) < 0) {
            commission = MoneyUtils.money(minCommission);
        }

        BigDecimal tax = orderType == OrderType.SELL
                ? MoneyUtils.money(notional.multiply(schedule.getTaxRate()))
                : MoneyUtils.money(BigDecimal.ZERO);

        return FeeBreakdown.builder()
                .commission(commission)
                .tax(tax)
                .build();
    }

    /**
     * 매수 예약용 예상 수수료
     * Estimated fee for a BUY reservation
     */
    public BigDecimal estimateBuyFee(FeeSchedule schedule, BigDecimal quantity, BigDecimal price, BigDecimal exchangeRate) {
        return calculate(schedule, OrderType.BUY, quantity, price, exchangeRate).getTotal();
    }

    /**
     * 체결 금액 (원화)
     * Notional in KRW
     */
    public BigDecimal notional(BigDecimal quantity, BigDecimal price, BigDecimal exchangeRate) {
        return MoneyUtils.money(price.multiply(quantity).multiply(exchangeRate));
    }

    /**
     * 매도 실현 손익 계산
     * Calculate realized profit/loss of a sell fill
     * 
     * - 가격 손익 = (체결가 - 평균 매수가) * 수량 * 매수 평균 환율 - 수수료/세금
     * - 환율 손익 = 체결가 * 수량 * (매도 시점 환율 - 매수 평균 환율) (해외 자산만)
     * 
     * @param executionPrice 체결가 (현지 통화)
     * @param quantity 체결 수량
     * @param averagePrice 평균 매수가 (현지 통화)
     * @param purchaseExchangeRate 매수 평균 환율
     * @param currentExchangeRate 매도 시점 환율
     * @param fee 수수료 + 세금
     * @param domestic 원화 자산 여부
     * @return 실현 손익
     */
    public ProfitLoss calculateProfitLoss(
            BigDecimal executionPrice,
            BigDecimal quantity,
            BigDecimal averagePrice,
            BigDecimal purchaseExchangeRate,
            BigDecimal currentExchangeRate,
            BigDecimal fee,
            boolean domestic) {
        BigDecimal priceProfitLoss = MoneyUtils.money(executionPrice.subtract(averagePrice)
                .multiply(quantity)
                .multiply(purchaseExchangeRate)
                .subtract(fee));

        BigDecimal exchangeProfitLoss = null;
        BigDecimal realized = priceProfitLoss;
        if (!domestic) {
            exchangeProfitLoss = MoneyUtils.money(executionPrice
                    .multiply(quantity)
                    .multiply(currentExchangeRate.subtract(purchaseExchangeRate)));
            realized = realized.add(exchangeProfitLoss);
        }

        return ProfitLoss.builder()
                .priceProfitLoss(priceProfitLoss)
                .exchangeProfitLoss(exchangeProfitLoss)
                .realizedProfitLoss(realized)
                .build();
    }
}
