package dustin.papertrade.domains.fee.model.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 수수료 설정 엔티티
 * Fee Config Entity
 * 
 * 역할:
 * - 시장별 수수료율/세율 관리 (KRX, NASDAQ, UPBIT ...)
 * - 서버 시작 시 메모리에 로드되어 사용
 * - market이 NULL인 행은 전체 기본값 (설정 파일 기본값보다 우선)
 */
@Entity
@Table(name = "fee_configs",
       indexes = {
           @Index(name = "idx_fee_configs_market", columnList = "market,is_active")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeeConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 시장 구분 (NULL이면 모든 시장에 적용)
     */
    @Column(name = "market", length = 50)
    private String market;

    /**
     * 수수료율 (매수/매도 공통, 예: 0.00015 = 0.015%)
     */
    @Column(name = "commission_rate", nullable = false, precision = 10, scale = 6)
    private BigDecimal commissionRate;

    /**
     * 거래세율 (매도에만 적용, 예: 0.0023 = 0.23%)
     */
    @Column(name = "tax_rate", nullable = false, precision = 10, scale = 6)
    private BigDecimal taxRate;

    /**
     * 최소 수수료 (원)
     */
    @Column(name = "min_commission", nullable = false, precision = 20, scale = 2)
    @Builder.Default
    private BigDecimal minCommission = BigDecimal.ZERO;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
