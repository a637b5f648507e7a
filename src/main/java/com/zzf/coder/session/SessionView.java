package com.zzf.coder.session;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.zzf.coder.core.plan.PlanSnapshot;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only status of a session, as returned by the REST API.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionView {
    String id;
    String projectRoot;
    long createdAt;
    SessionStatus status;
    LoopState state;
    FailureReason failureReason;
    String failureMessage;
    String finalAnswer;
    int cyclesCompleted;
    long turnCount;
    PlanSnapshot plan;

    public static SessionView of(Session session) {
        return SessionView.builder()
                .id(session.getId())
                .projectRoot(session.getProjectRoot().toString())
                .createdAt(session.getCreatedAt())
                .status(session.getStatus())
                .state(session.getState())
                .failureReason(session.getFailureReason())
                .failureMessage(session.getFailureMessage())
                .finalAnswer(session.getFinalAnswer())
                .cyclesCompleted(session.getCyclesCompleted())
                .turnCount(session.getContext().nextSeq())
                .plan(session.getPlanner().snapshot())
                .build();
    }
}
