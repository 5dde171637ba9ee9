package dustin.papertrade.shared.kafka;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.papertrade.config.TradingProperties;
import dustin.papertrade.shared.kafka.model.TransactionSettledEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * Kafka 이벤트 발행자
 * Kafka Event Producer
 * 
 * 역할:
 * - 체결 정산 완료 이벤트를 Kafka로 발행
 * - 비동기 처리 (eventExecutor 스레드 풀, 논블로킹)
 * 
 * 주의사항:
 * - 원장 트랜잭션 커밋 이후에만 호출됨
 * - 실패해도 정산 결과에는 영향 없음 (로깅만)
 * - trading.kafka.publish-enabled=false 이면 발행하지 않음
 */
@Slf4j
@Component
public class KafkaEventProducer {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final TradingProperties tradingProperties;
    private final Executor eventExecutor;

    public KafkaEventProducer(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            TradingProperties tradingProperties,
            @Qualifier("eventExecutor") Executor eventExecutor) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.tradingProperties = tradingProperties;
        this.eventExecutor = eventExecutor;
    }

    /**
     * 체결 정산 이벤트 발행
     * Publish transaction settled event
     * 
     * 파티션 키: userId (같은 사용자의 이벤트 순서 보장)
     * 
     * @param event 정산 이벤트
     * @return 발행 여부 (비활성화 또는 직렬화 실패 시 false)
     */
    public boolean publishTransactionSettled(TransactionSettledEvent event) {
        if (!tradingProperties.getKafka().isPublishEnabled()) {
            log.debug("[KafkaEventProducer] 이벤트 발행 비활성화: transactionId={}", event.getTransactionId());
            return false;
        }

        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("[KafkaEventProducer] 체결 정산 이벤트 직렬화 실패: transactionId={}, error={}",
                    event.getTransactionId(), e.getMessage());
            return false;
        }

        String topic = tradingProperties.getKafka().getTopic();
        String key = String.valueOf(event.getUserId());
        CompletableFuture<Void> future = CompletableFuture.runAsync(() -> {
            kafkaTemplate.send(topic, key, payload);
            log.debug("[KafkaEventProducer] 체결 정산 이벤트 발행: topic={}, transactionId={}",
                    topic, event.getTransactionId());
        }, eventExecutor);

        // 비동기 처리 (논블로킹)
        future.exceptionally(ex -> {
            log.error("[KafkaEventProducer] 체결 정산 이벤트 발행 실패: transactionId={}, error={}",
                    event.getTransactionId(), ex.getMessage());
            return null;
        });
        return true;
    }
}
