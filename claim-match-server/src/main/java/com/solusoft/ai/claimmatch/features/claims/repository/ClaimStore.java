package com.solusoft.ai.claimmatch.features.claims.repository;

import java.util.List;
import java.util.Optional;

import com.solusoft.ai.claimmatch.features.claims.model.InsurerClaim;

public interface ClaimStore {

    List<InsurerClaim> getAll();

    Optional<InsurerClaim> get(String id);

    InsurerClaim save(InsurerClaim claim);
}
