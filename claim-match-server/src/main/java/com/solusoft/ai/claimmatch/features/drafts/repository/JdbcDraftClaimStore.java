package com.solusoft.ai.claimmatch.features.drafts.repository;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import com.solusoft.ai.claimmatch.exception.NotFoundException;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaim;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaimStatus;
import com.solusoft.ai.claimmatch.persistence.JsonPayloadCodec;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

/**
 * Draft claims plus a membership table listing every document a draft references.
 * Creation checks membership and inserts in one transaction.
 */
@Repository
@Slf4j
public class JdbcDraftClaimStore implements DraftClaimStore {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final JsonPayloadCodec codec;
    private final Clock clock;

    public JdbcDraftClaimStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                               JsonPayloadCodec codec, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.codec = codec;
        this.clock = clock;
    }

    @PostConstruct
    public void initSchema() {
        log.info("Entering initSchema [draft_claims]");
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS draft_claims (
                id TEXT PRIMARY KEY,
                status TEXT NOT NULL,
                primary_document_id TEXT NOT NULL,
                payload TEXT NOT NULL
            )
        """);
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS draft_claim_documents (
                draft_claim_id TEXT NOT NULL,
                document_id TEXT NOT NULL,
                PRIMARY KEY (draft_claim_id, document_id)
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_draft_claim_documents_document ON draft_claim_documents (document_id)");
        log.info("Exiting initSchema [draft_claims]");
    }

    @Override
    public List<DraftClaim> getAll() {
        return jdbcTemplate.query("SELECT payload FROM draft_claims ORDER BY id",
                (rs, rowNum) -> codec.read(rs.getString("payload"), DraftClaim.class));
    }

    @Override
    public Optional<DraftClaim> get(String id) {
        return jdbcTemplate.query("SELECT payload FROM draft_claims WHERE id = ?",
                (rs, rowNum) -> codec.read(rs.getString("payload"), DraftClaim.class), id)
                .stream().findFirst();
    }

    @Override
    public List<DraftClaim> find(Predicate<DraftClaim> filter) {
        return getAll().stream().filter(filter).toList();
    }

    @Override
    public Optional<DraftClaim> create(DraftClaim draft) {
        Instant now = Instant.now(clock);
        DraftClaim toInsert = draft.toBuilder()
                .id(draft.id() != null ? draft.id() : UUID.randomUUID().toString())
                .status(draft.status() != null ? draft.status() : DraftClaimStatus.PENDING)
                .generatedAt(now)
                .updatedAt(now)
                .build();

        return transactionTemplate.execute(status -> {
            if (!toInsert.documentIds().isEmpty()) {
                String placeholders = String.join(", ", Collections.nCopies(toInsert.documentIds().size(), "?"));
                Integer claimed = jdbcTemplate.queryForObject(
                        "SELECT COUNT(*) FROM draft_claim_documents WHERE document_id IN (" + placeholders + ")",
                        Integer.class, toInsert.documentIds().toArray());
                if (claimed != null && claimed > 0) {
                    log.warn("Skipping draft for document {}: {} document(s) already belong to a draft",
                            toInsert.primaryDocumentId(), claimed);
                    return Optional.<DraftClaim>empty();
                }
            }

            jdbcTemplate.update("INSERT INTO draft_claims (id, status, primary_document_id, payload) VALUES (?, ?, ?, ?)",
                    toInsert.id(), toInsert.status().value(), toInsert.primaryDocumentId(), codec.write(toInsert));
            insertMembership(toInsert);

            log.debug("Created draft claim {} for document {}", toInsert.id(), toInsert.primaryDocumentId());
            return Optional.of(toInsert);
        });
    }

    @Override
    public DraftClaim update(DraftClaim draft) {
        DraftClaim toSave = draft.toBuilder().updatedAt(Instant.now(clock)).build();

        return transactionTemplate.execute(status -> {
            int updated = jdbcTemplate.update("UPDATE draft_claims SET status = ?, payload = ? WHERE id = ?",
                    toSave.status().value(), codec.write(toSave), toSave.id());
            if (updated == 0) {
                throw new NotFoundException("Draft claim", draft.id());
            }
            insertMembership(toSave);
            return toSave;
        });
    }

    private void insertMembership(DraftClaim draft) {
        for (String documentId : draft.documentIds()) {
            jdbcTemplate.update("INSERT OR IGNORE INTO draft_claim_documents (draft_claim_id, document_id) VALUES (?, ?)",
                    draft.id(), documentId);
        }
    }
}
