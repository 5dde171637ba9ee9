package dustin.papertrade.shared.kafka;

import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.papertrade.domains.statistics.service.StatisticsService;
import dustin.papertrade.shared.kafka.model.TransactionSettledEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Kafka 체결 정산 이벤트 Consumer
 * Kafka Transaction Settled Event Consumer
 * 
 * 역할:
 * - 체결 정산 완료 이벤트 수신
 * - 해당 사용자/체결 날짜의 일별 통계 갱신
 * 
 * 처리 흐름:
 * 1. Kafka에서 'transaction-settled' 토픽 메시지 수신 (trading.kafka.topic)
 * 2. JSON 파싱
 * 3. StatisticsService.updateDailyStatistics 호출 (멱등)
 * 
 * 주의사항:
 * - 같은 이벤트가 중복 수신되어도 통계 결과는 동일
 * - 실패 시 예외를 던져 Kafka Consumer가 재시도
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaTransactionSettledConsumer {

    private final StatisticsService statisticsService;
    private final ObjectMapper objectMapper;

    /**
     * 체결 정산 이벤트 수신 및 처리
     * Consume transaction settled event
     * 
     * @param message Kafka 메시지 (JSON 문자열)
     */
    @KafkaListener(
            topics = "${trading.kafka.topic:transaction-settled}",
            groupId = "${spring.kafka.consumer.group-id:papertrade-consumer-group}")
    public void consumeTransactionSettled(String message) {
        TransactionSettledEvent event;
        try {
            event = objectMapper.readValue(message, TransactionSettledEvent.class);
        } catch (JsonProcessingException e) {
            log.error("[KafkaTransactionSettledConsumer] 이벤트 파싱 실패: message={}, error={}", message, e.getMessage(), e);
            throw new IllegalArgumentException("체결 정산 이벤트 파싱 실패", e);
        }

        if (event.getUserId() == null || event.getTransactionDate() == null) {
            log.warn("[KafkaTransactionSettledConsumer] 필수 필드 누락, 건너뜀: message={}", message);
            return;
        }

        statisticsService.updateDailyStatistics(event.getUserId(), event.getTransactionDate().toLocalDate());

        log.debug("[KafkaTransactionSettledConsumer] 일별 통계 갱신 완료: transactionId={}, userId={}, date={}",
                event.getTransactionId(), event.getUserId(), event.getTransactionDate().toLocalDate());
    }
}
