package dustin.papertrade.domains.statistics.repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import dustin.papertrade.domains.statistics.model.entity.TradingStatistics;

/**
 * 거래 통계 리포지토리
 * Trading Statistics Repository
 */
@Repository
public interface TradingStatisticsRepository extends JpaRepository<TradingStatistics, Long> {

    Optional<TradingStatistics> findByUserIdAndPeriodTypeAndStatDate(Long userId, String periodType, LocalDate statDate);

    List<TradingStatistics> findByUserIdAndPeriodTypeAndStatDateBetweenOrderByStatDateAsc(
            Long userId, String periodType, LocalDate from, LocalDate to);
}
