package com.ruian.repository;

import com.ruian.entity.ProductionInfo;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Repository interface for ProductionInfo entity.
 *
 * Besides the lookups used by the import and validation flows, it exposes
 * {@link Specification} factories for the filtered list endpoint.
 */
@Repository
public interface ProductionInfoRepository extends JpaRepository<ProductionInfo, Long>,
        JpaSpecificationExecutor<ProductionInfo> {

    /**
     * Insert a production row unless uq_prodinfo already holds its natural key.
     *
     * The conflict is resolved by PostgreSQL, so a row inserted by a
     * concurrent import is skipped instead of aborting the transaction.
     *
     * @return 1 if the row was inserted, 0 if it already existed
     */
    @Modifying
    @Query(value = "INSERT INTO production_info " +
            "(order_no, model, brand_no, quantity, job_type, worklog_no, performance_factor, upload_date) " +
            "VALUES (:orderNo, :model, :brandNo, :quantity, :jobType, :worklogNo, :performanceFactor, :uploadDate) " +
            "ON CONFLICT ON CONSTRAINT uq_prodinfo DO NOTHING",
            nativeQuery = true)
    int insertIfAbsent(
            @Param("orderNo") String orderNo,
            @Param("model") String model,
            @Param("brandNo") String brandNo,
            @Param("quantity") int quantity,
            @Param("jobType") String jobType,
            @Param("worklogNo") String worklogNo,
            @Param("performanceFactor") BigDecimal performanceFactor,
            @Param("uploadDate") OffsetDateTime uploadDate);

    /**
     * Load every production row for a set of order numbers.
     * Used to build the per-batch matching lookup.
     *
     * @param orderNos the order numbers referenced by a batch
     * @return all production rows for those orders
     */
    List<ProductionInfo> findByOrderNoIn(Collection<String> orderNos);

    /**
     * Find all rows of one order, newest upload first.
     *
     * @param orderNo the exact order number
     * @return production rows of the order
     */
    List<ProductionInfo> findByOrderNoOrderByUploadDateDesc(String orderNo);

    static Specification<ProductionInfo> orderNoContains(String orderNo) {
        return (root, query, cb) -> orderNo == null || orderNo.isBlank()
                ? null
                : cb.like(root.get("orderNo"), "%" + orderNo.trim() + "%");
    }

    static Specification<ProductionInfo> uploadedFrom(OffsetDateTime start) {
        return (root, query, cb) -> start == null
                ? null
                : cb.greaterThanOrEqualTo(root.get("uploadDate"), start);
    }

    static Specification<ProductionInfo> uploadedUntil(OffsetDateTime end) {
        return (root, query, cb) -> end == null
                ? null
                : cb.lessThanOrEqualTo(root.get("uploadDate"), end);
    }
}
