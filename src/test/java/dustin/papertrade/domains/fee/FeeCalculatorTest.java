package dustin.papertrade.domains.fee;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.papertrade.domains.fee.model.FeeBreakdown;
import dustin.papertrade.domains.fee.model.FeeSchedule;
import dustin.papertrade.domains.fee.model.ProfitLoss;
import dustin.papertrade.domains.fee.service.FeeCalculator;
import dustin.papertrade.domains.order.model.OrderType;

/**
 * 수수료 계산기 테스트
 * Fee Calculator Test
 */
class FeeCalculatorTest {

    private final FeeCalculator feeCalculator = new FeeCalculator();

    private final FeeSchedule schedule = FeeSchedule.builder()
            .commissionRate(new BigDecimal("0.00015"))
            .taxRate(new BigDecimal("0.0023"))
            .minCommission(BigDecimal.ZERO)
            .build();

    @Test
    @DisplayName("매수 수수료: 수수료율만 적용되고 세금은 0")
    void buyFee() {
        // when
        FeeBreakdown fee = feeCalculator.calculate(
                schedule, OrderType.BUY, new BigDecimal("10"), new BigDecimal("10000"), BigDecimal.ONE);

        // then
        assertThat(fee.getCommission()).isEqualByComparingTo("15.00");
        assertThat(fee.getTax()).isEqualByComparingTo("0");
        assertThat(fee.getTotal()).isEqualByComparingTo("15.00");
    }

    @Test
    @DisplayName("매도 수수료: 수수료 + 거래세")
    void sellFee() {
        // when
        FeeBreakdown fee = feeCalculator.calculate(
                schedule, OrderType.SELL, new BigDecimal("10"), new BigDecimal("10000"), BigDecimal.ONE);

        // then
        assertThat(fee.getCommission()).isEqualByComparingTo("15.00");
        assertThat(fee.getTax()).isEqualByComparingTo("230.00");
    }

    @Test
    @DisplayName("최소 수수료보다 작으면 최소 수수료 적용")
    void minCommission() {
        // given
        FeeSchedule withMinimum = FeeSchedule.builder()
                .commissionRate(new BigDecimal("0.00015"))
                .taxRate(BigDecimal.ZERO)
                .minCommission(new BigDecimal("1000"))
                .build();

        // when
        FeeBreakdown fee = feeCalculator.calculate(
                withMinimum, OrderType.BUY, new BigDecimal("1"), new BigDecimal("10000"), BigDecimal.ONE);

        // then
        assertThat(fee.getCommission()).isEqualByComparingTo("1000.00");
    }

    @Test
    @DisplayName("해외 자산: 환율을 곱한 원화 금액 기준으로 계산 (소수점 2자리 반올림)")
    void foreignNotional() {
        // when
        BigDecimal notional = feeCalculator.notional(new BigDecimal("2"), new BigDecimal("150.25"), new BigDecimal("1350"));
        FeeBreakdown fee = feeCalculator.calculate(
                schedule, OrderType.BUY, new BigDecimal("2"), new BigDecimal("150.25"), new BigDecimal("1350"));

        // then
        assertThat(notional).isEqualByComparingTo("405675.00");
        assertThat(fee.getCommission()).isEqualByComparingTo("60.85");
    }

    @Test
    @DisplayName("국내 자산 실현 손익: 가격 손익만 있고 환율 손익은 없음")
    void domesticProfitLoss() {
        // when
        ProfitLoss profitLoss = feeCalculator.calculateProfitLoss(
                new BigDecimal("12000"), new BigDecimal("5"), new BigDecimal("10000"),
                BigDecimal.ONE, BigDecimal.ONE, new BigDecimal("100"), true);

        // then
        assertThat(profitLoss.getPriceProfitLoss()).isEqualByComparingTo("9900.00");
        assertThat(profitLoss.getExchangeProfitLoss()).isNull();
        assertThat(profitLoss.getRealizedProfitLoss()).isEqualByComparingTo("9900.00");
    }

    @Test
    @DisplayName("해외 자산 실현 손익: 가격 손익 + 환율 손익")
    void foreignProfitLoss() {
        // when
        ProfitLoss profitLoss = feeCalculator.calculateProfitLoss(
                new BigDecimal("110"), new BigDecimal("10"), new BigDecimal("100"),
                new BigDecimal("1300"), new BigDecimal("1350"), new BigDecimal("500"), false);

        // then
        assertThat(profitLoss.getPriceProfitLoss()).isEqualByComparingTo("129500.00");
        assertThat(profitLoss.getExchangeProfitLoss()).isEqualByComparingTo("55000.00");
        assertThat(profitLoss.getRealizedProfitLoss()).isEqualByComparingTo("184500.00");
    }
}
