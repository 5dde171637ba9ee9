package dustin.papertrade.shared.kafka.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.fasterxml.jackson.annotation.JsonProperty;

import dustin.papertrade.domains.transaction.model.TransactionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 체결 정산 완료 이벤트
 * Transaction Settled Event
 * 
 * 체결 정산 트랜잭션이 커밋된 후 Kafka로 발행됩니다.
 * Consumer가 이를 받아서 해당 사용자/날짜의 일별 통계를 갱신합니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionSettledEvent {

    /**
     * 거래 원장 ID
     */
    @JsonProperty("transaction_id")
    private Long transactionId;

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("user_id")
    private Long userId;

    /**
     * 종목 코드 (예: "005930")
     */
    @JsonProperty("stock_id")
    private String stockId;

    /**
     * BUY 또는 SELL
     */
    @JsonProperty("transaction_type")
    private TransactionType transactionType;

    @JsonProperty("quantity")
    private BigDecimal quantity;

    @JsonProperty("price")
    private BigDecimal price;

    /**
     * 체결 금액 (원화)
     */
    @JsonProperty("amount")
    private BigDecimal amount;

    @JsonProperty("commission")
    private BigDecimal commission;

    @JsonProperty("tax")
    private BigDecimal tax;

    /**
     * 실현 손익 (매도만)
     */
    @JsonProperty("realized_profit_loss")
    private BigDecimal realizedProfitLoss;

    /**
     * 체결 시간 (trading.zone-id 기준)
     */
    @JsonProperty("transaction_date")
    private LocalDateTime transactionDate;
}
