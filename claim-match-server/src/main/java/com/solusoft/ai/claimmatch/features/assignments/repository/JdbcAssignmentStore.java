package com.solusoft.ai.claimmatch.features.assignments.repository;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import com.solusoft.ai.claimmatch.exception.NotFoundException;
import com.solusoft.ai.claimmatch.features.assignments.model.Assignment;
import com.solusoft.ai.claimmatch.features.assignments.model.AssignmentStatus;
import com.solusoft.ai.claimmatch.persistence.JsonPayloadCodec;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

/**
 * SQLite assignment table. The (document_id, claim_id) unique key is what keeps two
 * concurrent matching passes from storing the same pair twice.
 */
@Repository
@Slf4j
public class JdbcAssignmentStore implements AssignmentStore {

    private final JdbcTemplate jdbcTemplate;
    private final JsonPayloadCodec codec;
    private final Clock clock;

    public JdbcAssignmentStore(JdbcTemplate jdbcTemplate, JsonPayloadCodec codec, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
        this.clock = clock;
    }

    @PostConstruct
    public void initSchema() {
        log.info("Entering initSchema [assignments]");
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS assignments (
                id TEXT PRIMARY KEY,
                document_id TEXT NOT NULL,
                claim_id TEXT NOT NULL,
                status TEXT NOT NULL,
                match_score REAL NOT NULL,
                payload TEXT NOT NULL,
                UNIQUE (document_id, claim_id)
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_assignments_document ON assignments (document_id)");
        log.info("Exiting initSchema [assignments]");
    }

    @Override
    public List<Assignment> getAll() {
        return jdbcTemplate.query("SELECT payload FROM assignments ORDER BY document_id, match_score DESC",
                (rs, rowNum) -> codec.read(rs.getString("payload"), Assignment.class));
    }

    @Override
    public Optional<Assignment> get(String id) {
        return jdbcTemplate.query("SELECT payload FROM assignments WHERE id = ?",
                (rs, rowNum) -> codec.read(rs.getString("payload"), Assignment.class), id)
                .stream().findFirst();
    }

    @Override
    public List<Assignment> find(Predicate<Assignment> filter) {
        return getAll().stream().filter(filter).toList();
    }

    @Override
    public Optional<Assignment> findByPair(String documentId, String claimId) {
        return jdbcTemplate.query("SELECT payload FROM assignments WHERE document_id = ? AND claim_id = ?",
                (rs, rowNum) -> codec.read(rs.getString("payload"), Assignment.class), documentId, claimId)
                .stream().findFirst();
    }

    @Override
    public List<Assignment> findByDocument(String documentId) {
        return jdbcTemplate.query("SELECT payload FROM assignments WHERE document_id = ? ORDER BY match_score DESC",
                (rs, rowNum) -> codec.read(rs.getString("payload"), Assignment.class), documentId);
    }

    @Override
    public Assignment createIfAbsent(Assignment assignment) {
        Instant now = Instant.now(clock);
        Assignment toInsert = assignment.toBuilder()
                .id(assignment.id() != null ? assignment.id() : UUID.randomUUID().toString())
                .status(assignment.status() != null ? assignment.status() : AssignmentStatus.CANDIDATE)
                .createdAt(now)
                .updatedAt(now)
                .build();

        int inserted = jdbcTemplate.update("""
            INSERT INTO assignments (id, document_id, claim_id, status, match_score, payload)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (document_id, claim_id) DO NOTHING
        """,
            toInsert.id(),
            toInsert.documentId(),
            toInsert.claimId(),
            toInsert.status().value(),
            toInsert.matchScore(),
            codec.write(toInsert));

        if (inserted == 1) {
            log.debug("Created assignment {} for document {} / claim {}", toInsert.id(), toInsert.documentId(), toInsert.claimId());
            return toInsert;
        }

        log.debug("Assignment for document {} / claim {} already exists", toInsert.documentId(), toInsert.claimId());
        return findByPair(toInsert.documentId(), toInsert.claimId())
                .orElseThrow(() -> new IllegalStateException(
                        "Assignment pair conflict without a stored row: " + toInsert.documentId() + "/" + toInsert.claimId()));
    }

    @Override
    public Assignment update(Assignment assignment) {
        Assignment toSave = assignment.toBuilder().updatedAt(Instant.now(clock)).build();

        int updated = jdbcTemplate.update("UPDATE assignments SET status = ?, match_score = ?, payload = ? WHERE id = ?",
                toSave.status().value(),
                toSave.matchScore(),
                codec.write(toSave),
                toSave.id());

        if (updated == 0) {
            throw new NotFoundException("Assignment", assignment.id());
        }
        return toSave;
    }

    @Override
    public int clearCandidatesForDocument(String documentId, Collection<String> retainedClaimIds) {
        Set<String> retained = Set.copyOf(retainedClaimIds);
        List<String> toDelete = jdbcTemplate.queryForList(
                "SELECT claim_id FROM assignments WHERE document_id = ? AND status = ?",
                String.class, documentId, AssignmentStatus.CANDIDATE.value())
                .stream()
                .filter(claimId -> !retained.contains(claimId))
                .toList();

        int deleted = 0;
        for (String claimId : toDelete) {
            deleted += jdbcTemplate.update("DELETE FROM assignments WHERE document_id = ? AND claim_id = ? AND status = ?",
                    documentId, claimId, AssignmentStatus.CANDIDATE.value());
        }

        if (deleted > 0) {
            log.debug("Cleared {} stale candidate(s) for document {}", deleted, documentId);
        }
        return deleted;
    }
}
