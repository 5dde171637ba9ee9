package dustin.papertrade.domains.fee.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import dustin.papertrade.domains.fee.model.entity.FeeConfig;

/**
 * 수수료 설정 Repository
 * Fee Config Repository
 */
@Repository
public interface FeeConfigRepository extends JpaRepository<FeeConfig, Long> {

    /**
     * 활성화된 모든 수수료 설정 조회
     */
    List<FeeConfig> findByIsActiveTrue();
}
