package dustin.papertrade.domains.fee.model;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 수수료 계산 결과
 * Fee breakdown (commission, tax)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeeBreakdown {

    private BigDecimal commission;

    private BigDecimal tax;

    public BigDecimal getTotal() {
        return commission.add(tax);
    }
}
