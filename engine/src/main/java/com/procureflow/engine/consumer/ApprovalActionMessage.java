package com.procureflow.engine.consumer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.procureflow.engine.order.ApprovalDecision;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inbound approver decision from {@code approvals.actions}.
 * {@code id} is only consulted when the record carries no {@code event-id} header.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApprovalActionMessage {
    private String id;
    private String poId;
    private String role;
    private ApprovalDecision decision;
    private String comment;
}
