package dustin.papertrade.domains.order.repository;

import java.util.List;

import org.springframework.stereotype.Repository;
import org.springframework.data.jpa.repository.JpaRepository;

import dustin.papertrade.domains.order.model.entity.OrderExecution;

/**
 * 주문 체결 내역 리포지토리
 * Order Execution Repository
 */
@Repository
public interface OrderExecutionRepository extends JpaRepository<OrderExecution, Long> {

    List<OrderExecution> findByOrderIdOrderByIdAsc(Long orderId);
}
