package dustin.papertrade.domains.fee;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import dustin.papertrade.config.TestConfig;
import dustin.papertrade.domains.fee.model.FeeSchedule;
import dustin.papertrade.domains.fee.model.entity.FeeConfig;
import dustin.papertrade.domains.fee.repository.FeeConfigRepository;
import dustin.papertrade.domains.fee.service.FeeConfigService;

/**
 * 수수료 설정 서비스 테스트
 * Fee Config Service Test
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
@Import(TestConfig.class)
class FeeConfigServiceTest {

    @Autowired
    private FeeConfigService feeConfigService;

    @Autowired
    private FeeConfigRepository feeConfigRepository;

    @AfterEach
    void tearDown() {
        // 롤백된 설정이 캐시에 남지 않도록 다시 로드
        feeConfigRepository.deleteAll();
        feeConfigService.refreshFeeConfigs();
    }

    @Test
    @DisplayName("DB 설정이 없으면 설정 파일 기본 요율 사용")
    void defaultsFromProperties() {
        // when
        FeeSchedule schedule = feeConfigService.getFeeSchedule("KRX");

        // then
        assertThat(schedule.getCommissionRate()).isEqualByComparingTo("0.00015");
        assertThat(schedule.getTaxRate()).isEqualByComparingTo("0.0023");
        assertThat(schedule.getMinCommission()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("새로고침 후 시장별 설정이 우선 적용되고, 다른 시장은 기본값 유지")
    void marketConfigAfterRefresh() {
        // given
        feeConfigRepository.save(FeeConfig.builder()
                .market("TEST-MKT")
                .commissionRate(new BigDecimal("0.0025"))
                .taxRate(BigDecimal.ZERO)
                .minCommission(new BigDecimal("1000"))
                .build());

        // when
        feeConfigService.refreshFeeConfigs();

        // then
        FeeSchedule schedule = feeConfigService.getFeeSchedule("test-mkt");
        assertThat(schedule.getCommissionRate()).isEqualByComparingTo("0.0025");
        assertThat(schedule.getTaxRate()).isEqualByComparingTo("0");
        assertThat(schedule.getMinCommission()).isEqualByComparingTo("1000");
        assertThat(feeConfigService.getFeeSchedule("KRX").getCommissionRate()).isEqualByComparingTo("0.00015");
        assertThat(feeConfigService.getFeeSchedule(null).getTaxRate()).isEqualByComparingTo("0.0023");
    }

    @Test
    @DisplayName("비활성 설정은 로드하지 않음")
    void inactiveConfigIgnored() {
        // given
        feeConfigRepository.save(FeeConfig.builder()
                .market("OFF-MKT")
                .commissionRate(new BigDecimal("0.01"))
                .taxRate(new BigDecimal("0.01"))
                .isActive(false)
                .build());

        // when
        feeConfigService.refreshFeeConfigs();

        // then
        assertThat(feeConfigService.getFeeSchedule("OFF-MKT").getCommissionRate()).isEqualByComparingTo("0.00015");
    }
}
