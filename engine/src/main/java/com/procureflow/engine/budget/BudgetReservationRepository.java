package com.procureflow.engine.budget;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;

@Repository
public interface BudgetReservationRepository extends JpaRepository<BudgetReservation, Long> {

    Optional<BudgetReservation> findFirstByPoIdAndStatus(String poId, ReservationStatus status);

    List<BudgetReservation> findByPoIdOrderByCreatedAtAsc(String poId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM BudgetReservation r WHERE r.id = :id")
    Optional<BudgetReservation> findByIdForUpdate(@Param("id") Long id);
}
