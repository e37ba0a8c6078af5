package com.procureflow.engine.supplier;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface SupplierRepository extends JpaRepository<Supplier, String> {

    List<Supplier> findByStatusOrderByRatingDesc(SupplierStatus status);

    @Query("SELECT DISTINCT s FROM Supplier s JOIN s.categories c " +
           "WHERE s.status = :status AND c = :category ORDER BY s.rating DESC")
    List<Supplier> findByStatusAndCategory(@Param("status") SupplierStatus status,
                                           @Param("category") String category);
}
