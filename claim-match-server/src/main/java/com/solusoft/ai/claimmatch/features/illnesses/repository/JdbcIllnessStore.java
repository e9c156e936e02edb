package com.solusoft.ai.claimmatch.features.illnesses.repository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import com.solusoft.ai.claimmatch.features.illnesses.model.Illness;
import com.solusoft.ai.claimmatch.features.illnesses.model.RelevantAccount;
import com.solusoft.ai.claimmatch.persistence.JsonPayloadCodec;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

@Repository
@Slf4j
public class JdbcIllnessStore implements IllnessStore {

    private final JdbcTemplate jdbcTemplate;
    private final JsonPayloadCodec codec;
    private final Clock clock;

    public JdbcIllnessStore(JdbcTemplate jdbcTemplate, JsonPayloadCodec codec, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
        this.clock = clock;
    }

    @PostConstruct
    public void initSchema() {
        log.info("Entering initSchema [illnesses]");
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS illnesses (
                id TEXT PRIMARY KEY,
                patient_id TEXT,
                payload TEXT NOT NULL
            )
        """);
        log.info("Exiting initSchema [illnesses]");
    }

    @Override
    public Optional<Illness> get(String id) {
        return jdbcTemplate.query("SELECT payload FROM illnesses WHERE id = ?",
                (rs, rowNum) -> codec.read(rs.getString("payload"), Illness.class), id)
                .stream().findFirst();
    }

    @Override
    public Illness save(Illness illness) {
        Instant now = Instant.now(clock);
        Illness toSave = illness.toBuilder()
                .id(illness.id() != null ? illness.id() : UUID.randomUUID().toString())
                .createdAt(illness.createdAt() != null ? illness.createdAt() : now)
                .updatedAt(now)
                .build();

        jdbcTemplate.update("INSERT OR REPLACE INTO illnesses (id, patient_id, payload) VALUES (?, ?, ?)",
                toSave.id(), toSave.patientId(), codec.write(toSave));
        return toSave;
    }

    @Override
    public Optional<Illness> mergeRelevantAccounts(String illnessId, List<RelevantAccount> accounts) {
        Optional<Illness> existing = get(illnessId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        Illness illness = existing.get();

        Set<String> knownEmails = new HashSet<>();
        illness.relevantAccounts().forEach(a -> knownEmails.add(a.email().toLowerCase(Locale.ROOT)));

        List<RelevantAccount> merged = new ArrayList<>(illness.relevantAccounts());
        for (RelevantAccount account : accounts) {
            if (knownEmails.add(account.email().toLowerCase(Locale.ROOT))) {
                merged.add(account);
            }
        }

        if (merged.size() == illness.relevantAccounts().size()) {
            return Optional.of(illness);
        }

        log.info("Adding {} relevant account(s) to illness {}", merged.size() - illness.relevantAccounts().size(), illnessId);
        return Optional.of(save(illness.toBuilder().relevantAccounts(merged).build()));
    }
}
