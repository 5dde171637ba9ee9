package dustin.papertrade.shared.transaction;

import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import dustin.papertrade.shared.exception.ConflictException;
import lombok.extern.slf4j.Slf4j;

/**
 * 원장 트랜잭션 실행기
 * Ledger Transaction Runner
 * 
 * 역할:
 * - 원장을 변경하는 작업(주문 접수, 취소, 만료, 체결, 입출금)을 하나의 트랜잭션으로 실행
 * - 락 대기 시간 초과 / 버전 충돌을 ConflictException으로 변환
 * 
 * 락 순서:
 * 1. 사용자 잔고 행 (PESSIMISTIC_WRITE)
 * 2. 주문 행
 * 3. 포지션 행
 * 모든 변경 작업이 같은 순서로 락을 획득하므로 교착 상태가 발생하지 않습니다.
 */
@Slf4j
@Component
public class LedgerTransactionRunner {

    private final TransactionTemplate transactionTemplate;

    public LedgerTransactionRunner(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * 트랜잭션 내에서 작업 실행
     * Execute callback in a single ledger transaction
     * 
     * @param operation 로그용 작업 이름
     * @param callback 트랜잭션 내에서 실행할 작업
     * @return 작업 결과
     * @throws ConflictException 락 경합 또는 동시 수정으로 실패한 경우
     */
    public <T> T execute(String operation, TransactionCallback<T> callback) {
        try {
            return transactionTemplate.execute(callback);
        } catch (ConcurrencyFailureException e) {
            log.warn("[LedgerTransactionRunner] 동시 수정 충돌: operation={}, error={}", operation, e.getMessage());
            throw new ConflictException(
                    String.format("다른 요청과 충돌하여 처리하지 못했습니다. 잠시 후 다시 시도해주세요: operation=%s", operation), e);
        }
    }
}
