package com.procureflow.engine.order;

import java.time.Instant;

import lombok.Value;

@Value
public class ApprovalActionView {
    String role;
    ApprovalDecision decision;
    String comment;
    Instant actedAt;

    static ApprovalActionView of(ApprovalAction action) {
        return new ApprovalActionView(action.getRole(), action.getDecision(), action.getComment(), action.getActedAt());
    }
}
