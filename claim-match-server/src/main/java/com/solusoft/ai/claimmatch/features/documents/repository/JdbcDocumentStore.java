package com.solusoft.ai.claimmatch.features.documents.repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import com.solusoft.ai.claimmatch.features.documents.model.MedicalDocument;
import com.solusoft.ai.claimmatch.persistence.JsonPayloadCodec;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

@Repository
@Slf4j
public class JdbcDocumentStore implements DocumentStore {

    private final JdbcTemplate jdbcTemplate;
    private final JsonPayloadCodec codec;

    public JdbcDocumentStore(JdbcTemplate jdbcTemplate, JsonPayloadCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
    }

    @PostConstruct
    public void initSchema() {
        log.info("Entering initSchema [medical_documents]");
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS medical_documents (
                id TEXT PRIMARY KEY,
                source_type TEXT NOT NULL,
                classification TEXT,
                archived_at TEXT,
                payload TEXT NOT NULL
            )
        """);
        log.info("Exiting initSchema [medical_documents]");
    }

    @Override
    public List<MedicalDocument> getAll() {
        return jdbcTemplate.query("SELECT payload FROM medical_documents ORDER BY id",
                (rs, rowNum) -> codec.read(rs.getString("payload"), MedicalDocument.class));
    }

    @Override
    public Optional<MedicalDocument> get(String id) {
        return jdbcTemplate.query("SELECT payload FROM medical_documents WHERE id = ?",
                (rs, rowNum) -> codec.read(rs.getString("payload"), MedicalDocument.class), id)
                .stream().findFirst();
    }

    @Override
    public MedicalDocument save(MedicalDocument document) {
        MedicalDocument toSave = document.id() == null
                ? document.toBuilder().id(UUID.randomUUID().toString()).build()
                : document;

        jdbcTemplate.update("""
            INSERT OR REPLACE INTO medical_documents (id, source_type, classification, archived_at, payload)
            VALUES (?, ?, ?, ?, ?)
        """,
            toSave.id(),
            toSave.sourceType().value(),
            toSave.classification().value(),
            toSave.archivedAt() != null ? toSave.archivedAt().toString() : null,
            codec.write(toSave));

        log.debug("Saved document {}", toSave.id());
        return toSave;
    }
}
