package com.z254.sentinel.responder.domain.repository;

import com.z254.sentinel.responder.domain.model.ApprovalRecord;
import com.z254.sentinel.responder.domain.model.Comment;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Repository
public class InMemoryApprovalRecordRepository implements ApprovalRecordRepository {

    private final List<ApprovalRecord> records = new CopyOnWriteArrayList<>();
    private final List<Comment> comments = new CopyOnWriteArrayList<>();

    @Override
    public ApprovalRecord append(ApprovalRecord record) {
        records.add(record);
        return record;
    }

    @Override
    public List<ApprovalRecord> findByIncidentId(String incidentId) {
        return records.stream()
                .filter(record -> record.getIncidentId().equals(incidentId))
                .toList();
    }

    @Override
    public Comment appendComment(Comment comment) {
        comments.add(comment);
        return comment;
    }

    @Override
    public List<Comment> findCommentsByIncidentId(String incidentId) {
        return comments.stream()
                .filter(comment -> comment.getIncidentId().equals(incidentId))
                .toList();
    }
}
