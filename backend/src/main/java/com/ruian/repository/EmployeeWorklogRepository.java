package com.ruian.repository;

import com.ruian.entity.EmployeeWorklog;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Repository interface for EmployeeWorklog entity.
 *
 * There is no unique constraint on the worklog natural key, so duplicate
 * detection reads the existing rows of the orders touched by a batch.
 */
@Repository
public interface EmployeeWorklogRepository extends JpaRepository<EmployeeWorklog, Long>,
        JpaSpecificationExecutor<EmployeeWorklog> {

    /**
     * Load existing worklogs for a set of order numbers, in insertion order.
     *
     * @param orderNos the order numbers referenced by a batch
     * @return stored worklog rows for those orders
     */
    List<EmployeeWorklog> findByOrderNoInOrderByIdAsc(Collection<String> orderNos);

    /**
     * Load all worklogs whose work date falls within a range, in insertion order.
     *
     * @param start inclusive lower bound
     * @param end inclusive upper bound
     * @return matching worklog rows
     */
    List<EmployeeWorklog> findByWorkDateBetweenOrderByIdAsc(OffsetDateTime start, OffsetDateTime end);

    /**
     * @param orderNo the exact order number
     * @return worklog rows of the order, latest work date first
     */
    List<EmployeeWorklog> findByOrderNoOrderByWorkDateDesc(String orderNo);

    static Specification<EmployeeWorklog> orderNoContains(String orderNo) {
        return (root, query, cb) -> orderNo == null || orderNo.isBlank()
                ? null
                : cb.like(root.get("orderNo"), "%" + orderNo.trim() + "%");
    }

    static Specification<EmployeeWorklog> employeeIdEquals(String employeeId) {
        return (root, query, cb) -> employeeId == null || employeeId.isBlank()
                ? null
                : cb.equal(root.get("employeeId"), employeeId.trim());
    }

    static Specification<EmployeeWorklog> workedFrom(OffsetDateTime start) {
        return (root, query, cb) -> start == null
                ? null
                : cb.greaterThanOrEqualTo(root.get("workDate"), start);
    }

    static Specification<EmployeeWorklog> workedUntil(OffsetDateTime end) {
        return (root, query, cb) -> end == null
                ? null
                : cb.lessThanOrEqualTo(root.get("workDate"), end);
    }
}
