package com.procureflow.engine.policy;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "approvers")
@Getter @Setter @Builder @NoArgsConstructor @AllArgsConstructor
public class Approver {
    @Id @Column(name = "approver_role", length = 50) private String role;
    @Column(name = "name", nullable = false) private String name;
    @Column(name = "email", nullable = false) private String email;
    @Column(name = "department", length = 100) private String department;
    @Column(name = "active", nullable = false) @Builder.Default private boolean active = true;
    @Column(name = "created_at", updatable = false) private Instant createdAt;
    @Column(name = "updated_at") private Instant updatedAt;

    @PrePersist void prePersist() { Instant n = Instant.now(); if (createdAt == null) createdAt = n; updatedAt = n; }
    @PreUpdate void preUpdate() { updatedAt = Instant.now(); }
}
