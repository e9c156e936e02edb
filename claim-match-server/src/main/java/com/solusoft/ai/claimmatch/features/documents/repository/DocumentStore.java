package com.solusoft.ai.claimmatch.features.documents.repository;

import java.util.List;
import java.util.Optional;

import com.solusoft.ai.claimmatch.features.documents.model.MedicalDocument;

public interface DocumentStore {

    List<MedicalDocument> getAll();

    Optional<MedicalDocument> get(String id);

    // Used by the ingestion side; assigns an id when missing
    MedicalDocument save(MedicalDocument document);
}
