package com.z254.sentinel.responder.domain.repository;

import com.z254.sentinel.responder.domain.model.ApprovalRecord;
import com.z254.sentinel.responder.domain.model.Comment;

import java.util.List;

/**
 * Append-only store for human actions and comments on incidents.
 */
public interface ApprovalRecordRepository {

    ApprovalRecord append(ApprovalRecord record);

    /**
     * Records for one incident, oldest first.
     */
    List<ApprovalRecord> findByIncidentId(String incidentId);

    Comment appendComment(Comment comment);

    List<Comment> findCommentsByIncidentId(String incidentId);
}
