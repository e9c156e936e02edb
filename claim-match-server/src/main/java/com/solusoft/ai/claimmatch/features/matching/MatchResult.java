package com.solusoft.ai.claimmatch.features.matching;

import java.util.List;
import java.util.stream.Collectors;

import com.solusoft.ai.claimmatch.features.assignments.model.AmountMatchDetails;
import com.solusoft.ai.claimmatch.features.assignments.model.DateMatchDetails;
import com.solusoft.ai.claimmatch.features.assignments.model.MatchReasonType;

public record MatchResult(
    String documentId,
    String claimId,
    double score,
    List<MatchReason> reasons,
    AmountMatchDetails amountMatchDetails,
    DateMatchDetails dateMatchDetails
) {

    public MatchResult {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public MatchReasonType primaryReasonType() {
        return reasons.isEmpty() ? MatchReasonType.APPROXIMATE_AMOUNT : reasons.get(0).type();
    }

    public String describeReasons() {
        return reasons.stream().map(MatchReason::description).collect(Collectors.joining("; "));
    }
}
