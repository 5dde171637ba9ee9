package dustin.papertrade.config;

import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * 비동기 처리 설정
 * Executor Configuration
 * 
 * 체결 이벤트 발행, 통계 배치 등 원장 트랜잭션 밖에서 실행되는 작업용 스레드 풀
 */
@Configuration
public class PerformanceConfig {

    /**
     * 통계 집계 배치용 스레드 풀
     * Statistics batch thread pool
     */
    @Bean(name = "statisticsExecutor")
    public Executor statisticsExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int corePoolSize = Runtime.getRuntime().availableProcessors();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(corePoolSize * 2);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("statistics-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    /**
     * 이벤트 발행용 스레드 풀
     * Event publishing executor
     * 
     * 작업 완료 후 트랜잭션 동기화 상태를 정리합니다.
     */
    @Bean(name = "eventExecutor")
    public Executor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("event-");
        executor.setTaskDecorator(runnable -> () -> {
            try {
                runnable.run();
            } finally {
                TransactionSynchronizationManager.clear();
            }
        });
        executor.initialize();
        return executor;
    }
}
