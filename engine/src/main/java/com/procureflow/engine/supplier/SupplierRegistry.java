package com.procureflow.engine.supplier;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.procureflow.engine.exception.NotFoundException;

import lombok.RequiredArgsConstructor;

/**
 * Read access to supplier master data. Every call hits the table so that
 * importer updates (a suspension, a new order cap) apply to the next routing decision.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SupplierRegistry {

    private final SupplierRepository supplierRepository;

    public Supplier getSupplier(String supplierId) {
        return supplierRepository.findById(supplierId)
                .orElseThrow(() -> new NotFoundException("Supplier", supplierId));
    }

    /** Approved suppliers, best rated first, optionally narrowed to one category. */
    public List<Supplier> listApproved(String category) {
        if (category == null || category.isBlank()) {
            return supplierRepository.findByStatusOrderByRatingDesc(SupplierStatus.APPROVED);
        }
        return supplierRepository.findByStatusAndCategory(SupplierStatus.APPROVED, category);
    }
}
