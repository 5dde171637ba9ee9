package dustin.papertrade.domains.fee.model;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 수수료 스케줄 (시장별로 해석된 요율)
 * Resolved fee schedule
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeeSchedule {

    /**
     * 적용 시장 (기본 스케줄은 null)
     */
    private String market;

    private BigDecimal commissionRate;

    private BigDecimal taxRate;

    @Builder.Default
    private BigDecimal minCommission = BigDecimal.ZERO;
}
