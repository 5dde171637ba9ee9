package dustin.papertrade.domains.fee.service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Service;

import dustin.papertrade.config.TradingProperties;
import dustin.papertrade.domains.fee.model.FeeSchedule;
import dustin.papertrade.domains.fee.model.entity.FeeConfig;
import dustin.papertrade.domains.fee.repository.FeeConfigRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 수수료 설정 서비스
 * Fee Config Service
 * 
 * 역할:
 * - 서버 시작 시 모든 활성 수수료 설정을 메모리에 로드
 * - 시장별 수수료 스케줄 조회 (메모리에서 빠르게 조회)
 * 
 * 우선순위:
 * 1. market이 일치하는 설정
 * 2. market이 NULL인 DB 기본 설정
 * 3. trading.fee.* 설정 파일 기본값
 * 
 * 주의사항:
 * - 원장 트랜잭션 진입 전에 호출되어 락 보유 중 DB 조회가 발생하지 않음
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeeConfigService {

    private static final String DEFAULT_KEY = "default";

    private final FeeConfigRepository feeConfigRepository;
    private final TradingProperties tradingProperties;

    /**
     * 수수료 스케줄 캐시
     * Key: market 또는 "default"
     */
    private final Map<String, FeeSchedule> feeScheduleCache = new ConcurrentHashMap<>();

    /**
     * 서버 시작 시 수수료 설정 로드
     * Load fee configs on server startup
     */
    @PostConstruct
    public void loadFeeConfigs() {
        List<FeeConfig> activeConfigs = feeConfigRepository.findByIsActiveTrue();

        feeScheduleCache.clear();
        for (FeeConfig config : activeConfigs) {
            String key = config.getMarket() != null ? config.getMarket().toUpperCase() : DEFAULT_KEY;
            feeScheduleCache.put(key, FeeSchedule.builder()
                    .market(config.getMarket())
                    .commissionRate(config.getCommissionRate())
                    .taxRate(config.getTaxRate())
                    .minCommission(config.getMinCommission())
                    .build());
            log.debug("[FeeConfigService] 수수료 설정 로드: key={}, commissionRate={}, taxRate={}",
                    key, config.getCommissionRate(), config.getTaxRate());
        }

        if (!feeScheduleCache.containsKey(DEFAULT_KEY)) {
            TradingProperties.Fee fee = tradingProperties.getFee();
            log.info("[FeeConfigService] DB 기본 수수료 설정 없음. 설정 파일 기본값 사용: commissionRate={}, taxRate={}, minCommission={}",
                    fee.getCommissionRate(), fee.getTaxRate(), fee.getMinCommission());
        }

        log.info("[FeeConfigService] 수수료 설정 로드 완료: 총 {}개", feeScheduleCache.size());
    }

    /**
     * 시장별 수수료 스케줄 조회
     * Get fee schedule for market
     * 
     * @param market 시장 구분 (null 가능)
     * @return 수수료 스케줄
     */
    public FeeSchedule getFeeSchedule(String market) {
        if (market != null) {
            FeeSchedule schedule = feeScheduleCache.get(market.toUpperCase());
            if (schedule != null) {
                return schedule;
            }
        }
        FeeSchedule defaultSchedule = feeScheduleCache.get(DEFAULT_KEY);
        if (defaultSchedule != null) {
            return defaultSchedule;
        }
        TradingProperties.Fee fee = tradingProperties.getFee();
        return FeeSchedule.builder()
                .commissionRate(fee.getCommissionRate())
                .taxRate(fee.getTaxRate())
                .minCommission(fee.getMinCommission())
                .build();
    }

    /**
     * 수수료 설정 새로고침 (런타임에 수수료 변경 시 사용)
     * Refresh fee configs
     */
    public void refreshFeeConfigs() {
        log.info("[FeeConfigService] 수수료 설정 새로고침");
        loadFeeConfigs();
    }
}
