package com.zzf.coder.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.zzf.coder.core.context.Turn;
import com.zzf.coder.core.plan.PlanSnapshot;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionCheckpoint {
    String sessionId;
    String projectRoot;
    SessionStatus status;
    FailureReason failureReason;
    String failureMessage;
    String finalAnswer;
    int cyclesCompleted;
    long savedAt;
    List<Turn> turns;
    PlanSnapshot plan;

    public static SessionCheckpoint of(Session session) {
        return SessionCheckpoint.builder()
                .sessionId(session.getId())
                .projectRoot(session.getProjectRoot().toString())
                .status(session.getStatus())
                .failureReason(session.getFailureReason())
                .failureMessage(session.getFailureMessage())
                .finalAnswer(session.getFinalAnswer())
                .cyclesCompleted(session.getCyclesCompleted())
                .savedAt(System.currentTimeMillis())
                .turns(session.getContext().turns())
                .plan(session.getPlanner().snapshot())
                .build();
    }
}
