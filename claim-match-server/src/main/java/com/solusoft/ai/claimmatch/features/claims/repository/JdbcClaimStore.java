package com.solusoft.ai.claimmatch.features.claims.repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import com.solusoft.ai.claimmatch.features.claims.model.InsurerClaim;
import com.solusoft.ai.claimmatch.persistence.JsonPayloadCodec;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

@Repository
@Slf4j
public class JdbcClaimStore implements ClaimStore {

    private final JdbcTemplate jdbcTemplate;
    private final JsonPayloadCodec codec;

    public JdbcClaimStore(JdbcTemplate jdbcTemplate, JsonPayloadCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
    }

    @PostConstruct
    public void initSchema() {
        log.info("Entering initSchema [insurer_claims]");
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS insurer_claims (
                id TEXT PRIMARY KEY,
                claim_number TEXT,
                payload TEXT NOT NULL
            )
        """);
        log.info("Exiting initSchema [insurer_claims]");
    }

    @Override
    public List<InsurerClaim> getAll() {
        return jdbcTemplate.query("SELECT payload FROM insurer_claims ORDER BY id",
                (rs, rowNum) -> codec.read(rs.getString("payload"), InsurerClaim.class));
    }

    @Override
    public Optional<InsurerClaim> get(String id) {
        return jdbcTemplate.query("SELECT payload FROM insurer_claims WHERE id = ?",
                (rs, rowNum) -> codec.read(rs.getString("payload"), InsurerClaim.class), id)
                .stream().findFirst();
    }

    @Override
    public InsurerClaim save(InsurerClaim claim) {
        InsurerClaim toSave = claim.id() == null
                ? claim.toBuilder().id(UUID.randomUUID().toString()).build()
                : claim;

        jdbcTemplate.update("INSERT OR REPLACE INTO insurer_claims (id, claim_number, payload) VALUES (?, ?, ?)",
                toSave.id(), toSave.claimNumber(), codec.write(toSave));
        return toSave;
    }
}
