package dustin.papertrade.domains.transaction.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import dustin.papertrade.domains.transaction.model.TransactionType;
import dustin.papertrade.domains.transaction.model.entity.Transaction;
import dustin.papertrade.domains.transaction.repository.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 거래 원장 서비스
 * Transaction Service
 * 
 * 역할:
 * - 체결/입출금 거래 내역 기록 (INSERT 전용)
 * - 사용자 거래 내역 조회
 * 
 * 주의사항:
 * - 기록 메서드는 호출 측 원장 트랜잭션 안에서만 실행됨 (MANDATORY)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionService {

    private static final LocalDateTime MIN_DATE = LocalDateTime.of(1970, 1, 1, 0, 0);
    private static final LocalDateTime MAX_DATE = LocalDateTime.of(9999, 12, 31, 23, 59, 59);

    private final TransactionRepository transactionRepository;
    private final Clock clock;

    /**
     * 체결 거래 기록
     * Record a settled trade
     * 
     * @param transaction 기록할 거래 (BUY/SELL)
     * @return 저장된 거래
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Transaction recordTrade(Transaction transaction) {
        if (transaction.getTransactionType() == null || !transaction.getTransactionType().isTrade()) {
            throw new IllegalArgumentException("체결 거래는 BUY/SELL 유형이어야 합니다: type=" + transaction.getTransactionType());
        }
        if (transaction.getTransactionDate() == null) {
            transaction.setTransactionDate(LocalDateTime.now(clock));
        }
        Transaction saved = transactionRepository.save(transaction);
        log.info("[TransactionService] 체결 거래 기록: transactionId={}, userId={}, orderId={}, type={}, amount={}",
                saved.getId(), saved.getUserId(), saved.getOrderId(), saved.getTransactionType(), saved.getAmount());
        return saved;
    }

    /**
     * 입출금 거래 기록
     * Record a deposit or withdrawal
     * 
     * @param userId 사용자 ID
     * @param type DEPOSIT 또는 WITHDRAW
     * @param amount 금액 (양수)
     * @param cashBefore 변경 전 현금 잔고
     * @param cashAfter 변경 후 현금 잔고
     * @param description 설명
     * @return 저장된 거래
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Transaction recordCashMovement(
            Long userId,
            TransactionType type,
            BigDecimal amount,
            BigDecimal cashBefore,
            BigDecimal cashAfter,
            String description) {
        if (type.isTrade()) {
            throw new IllegalArgumentException("입출금 거래는 DEPOSIT/WITHDRAW 유형이어야 합니다: type=" + type);
        }
        Transaction transaction = Transaction.builder()
                .userId(userId)
                .transactionType(type)
                .amount(amount)
                .netAmount(amount)
                .cashBalanceBefore(cashBefore)
                .cashBalanceAfter(cashAfter)
                .transactionDate(LocalDateTime.now(clock))
                .description(description)
                .build();
        return transactionRepository.save(transaction);
    }

    /**
     * 거래 내역 조회 (필터: 유형, 기간)
     * Get user's transactions
     * 
     * @param userId 사용자 ID
     * @param type 거래 유형 (optional)
     * @param from 시작 시각 (optional, 포함)
     * @param to 종료 시각 (optional, 포함)
     * @param pageable 페이지 정보
     * @return 거래 내역 (최신순)
     */
    @Transactional(readOnly = true)
    public Page<Transaction> getTransactions(
            Long userId, TransactionType type, LocalDateTime from, LocalDateTime to, Pageable pageable) {
        LocalDateTime start = from != null ? from : MIN_DATE;
        LocalDateTime end = to != null ? to : MAX_DATE;
        if (type != null) {
            return transactionRepository.findByUserIdAndTransactionTypeAndTransactionDateBetweenOrderByTransactionDateDesc(
                    userId, type, start, end, pageable);
        }
        return transactionRepository.findByUserIdAndTransactionDateBetweenOrderByTransactionDateDesc(
                userId, start, end, pageable);
    }

    @Transactional(readOnly = true)
    public List<Transaction> getOrderTransactions(Long orderId) {
        return transactionRepository.findByOrderIdOrderByIdAsc(orderId);
    }
}
