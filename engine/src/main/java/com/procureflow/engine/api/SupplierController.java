package com.procureflow.engine.api;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.procureflow.engine.supplier.RiskScore;
import com.procureflow.engine.supplier.Supplier;
import com.procureflow.engine.supplier.SupplierRegistry;
import com.procureflow.engine.supplier.SupplierStatus;

import lombok.RequiredArgsConstructor;
import lombok.Value;

@RestController
@RequestMapping("/api/suppliers")
@RequiredArgsConstructor
public class SupplierController {

    private final SupplierRegistry supplierRegistry;

    @GetMapping("/{supplierId}")
    public ResponseEntity<SupplierView> get(@PathVariable String supplierId) {
        return ResponseEntity.ok(SupplierView.of(supplierRegistry.getSupplier(supplierId)));
    }

    /** Approved suppliers, best rated first. */
    @GetMapping
    public ResponseEntity<List<SupplierView>> listApproved(
            @RequestParam(value = "category", required = false) String category) {
        return ResponseEntity.ok(supplierRegistry.listApproved(category).stream().map(SupplierView::of).toList());
    }

    @Value
    static class SupplierView {
        String supplierId;
        String name;
        SupplierStatus status;
        BigDecimal rating;
        RiskScore riskScore;
        BigDecimal maxOrderValue;
        Set<String> categories;
        String paymentTerms;
        String contactEmail;

        static SupplierView of(Supplier s) {
            return new SupplierView(s.getSupplierId(), s.getName(), s.getStatus(), s.getRating(), s.getRiskScore(),
                    s.getMaxOrderValue(), Set.copyOf(s.getCategories()), s.getPaymentTerms(), s.getContactEmail());
        }
    }
}
