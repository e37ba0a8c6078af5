package com.procureflow.engine.budget;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;

@Repository
public interface BudgetRepository extends JpaRepository<Budget, Long> {

    Optional<Budget> findByDepartmentIdAndFiscalYear(String departmentId, int fiscalYear);

    /** SELECT ... FOR UPDATE on the department's row for the year. Serializes reservations per department. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Budget b WHERE b.departmentId = :departmentId AND b.fiscalYear = :fiscalYear")
    Optional<Budget> findForUpdate(@Param("departmentId") String departmentId, @Param("fiscalYear") int fiscalYear);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Budget b WHERE b.id = :id")
    Optional<Budget> findByIdForUpdate(@Param("id") Long id);
}
