package com.procureflow.engine.supplier;

import com.procureflow.engine.exception.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Supplier queries against H2: status filter, category join and rating order.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(SupplierRegistry.class)
class SupplierRegistryTest {

    @Autowired SupplierRepository supplierRepository;
    @Autowired SupplierRegistry supplierRegistry;

    private void supplier(String id, SupplierStatus status, String rating, String... categories) {
        supplierRepository.save(Supplier.builder()
                .supplierId(id).name("Supplier " + id).status(status).riskScore(RiskScore.LOW)
                .rating(new BigDecimal(rating)).maxOrderValue(new BigDecimal("100000"))
                .categories(new LinkedHashSet<>(List.of(categories)))
                .build());
    }

    @BeforeEach
    void setUp() {
        supplier("SUP-001", SupplierStatus.APPROVED, "4.50", "it", "office");
        supplier("SUP-002", SupplierStatus.APPROVED, "4.90", "it");
        supplier("SUP-003", SupplierStatus.SUSPENDED, "5.00", "it");
        supplier("SUP-004", SupplierStatus.PENDING, "4.95", "office");
        supplier("SUP-005", SupplierStatus.APPROVED, "3.20", "furniture");
    }

    @Test
    @DisplayName("listApproved without a category: approved suppliers only, best rated first")
    void listAllApproved() {
        assertThat(supplierRegistry.listApproved(null))
                .extracting(Supplier::getSupplierId)
                .containsExactly("SUP-002", "SUP-001", "SUP-005");
        assertThat(supplierRegistry.listApproved("  "))
                .extracting(Supplier::getSupplierId)
                .containsExactly("SUP-002", "SUP-001", "SUP-005");
    }

    @Test
    @DisplayName("listApproved by category: joins categories, skips suspended and pending suppliers")
    void listApprovedByCategory() {
        assertThat(supplierRegistry.listApproved("it"))
                .extracting(Supplier::getSupplierId)
                .containsExactly("SUP-002", "SUP-001");
        assertThat(supplierRegistry.listApproved("office"))
                .extracting(Supplier::getSupplierId)
                .containsExactly("SUP-001");
        assertThat(supplierRegistry.listApproved("catering")).isEmpty();
    }

    @Test
    @DisplayName("A supplier with several categories appears once in a category listing")
    void noDuplicatesFromCategoryJoin() {
        supplier("SUP-006", SupplierStatus.APPROVED, "4.00", "it", "hardware");

        assertThat(supplierRepository.findByStatusAndCategory(SupplierStatus.APPROVED, "it"))
                .extracting(Supplier::getSupplierId)
                .containsExactly("SUP-002", "SUP-001", "SUP-006");
    }

    @Test
    @DisplayName("getSupplier: stored supplier is returned, unknown id is NotFound")
    void getSupplier() {
        assertThat(supplierRegistry.getSupplier("SUP-003").isSuspended()).isTrue();
        assertThatThrownBy(() -> supplierRegistry.getSupplier("SUP-999"))
                .isInstanceOf(NotFoundException.class);
    }
}
