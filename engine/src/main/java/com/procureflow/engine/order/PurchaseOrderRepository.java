package com.procureflow.engine.order;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;

@Repository
public interface PurchaseOrderRepository extends JpaRepository<PurchaseOrder, String> {

    /** Row lock on the PO. Taken before any budget row lock. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PurchaseOrder p WHERE p.id = :id")
    Optional<PurchaseOrder> findByIdForUpdate(@Param("id") String id);

    List<PurchaseOrder> findByStatusOrderByCreatedAtAsc(PurchaseOrderStatus status);

    @Query("SELECT p.id FROM PurchaseOrder p WHERE p.status = :status ORDER BY p.createdAt ASC")
    List<String> findIdsByStatus(@Param("status") PurchaseOrderStatus status);
}
