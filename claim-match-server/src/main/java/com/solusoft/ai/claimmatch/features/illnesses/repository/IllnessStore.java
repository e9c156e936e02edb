package com.solusoft.ai.claimmatch.features.illnesses.repository;

import java.util.List;
import java.util.Optional;

import com.solusoft.ai.claimmatch.features.illnesses.model.Illness;
import com.solusoft.ai.claimmatch.features.illnesses.model.RelevantAccount;

public interface IllnessStore {

    Optional<Illness> get(String id);

    Illness save(Illness illness);

    /**
     * Appends accounts whose email (case-insensitive) is not on the illness yet.
     *
     * @return the updated illness, or empty when the illness does not exist
     */
    Optional<Illness> mergeRelevantAccounts(String illnessId, List<RelevantAccount> accounts);
}
