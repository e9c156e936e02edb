package com.solusoft.ai.claimmatch.features.review.tool;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import org.springaicommunity.mcp.annotation.McpTool;
import org.springaicommunity.mcp.annotation.McpToolParam;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solusoft.ai.claimmatch.exception.ClaimMatchException;
import com.solusoft.ai.claimmatch.exception.MatchingException;
import com.solusoft.ai.claimmatch.exception.ValidationException;
import com.solusoft.ai.claimmatch.features.assignments.AssignmentReviewService;
import com.solusoft.ai.claimmatch.features.assignments.model.Assignment;
import com.solusoft.ai.claimmatch.features.assignments.model.AssignmentStatus;
import com.solusoft.ai.claimmatch.features.assignments.repository.AssignmentStore;
import com.solusoft.ai.claimmatch.features.drafts.DraftClaimGenerator;
import com.solusoft.ai.claimmatch.features.drafts.DraftClaimLifecycle;
import com.solusoft.ai.claimmatch.features.drafts.DraftClaimPromoter;
import com.solusoft.ai.claimmatch.features.drafts.model.AcceptDraftClaimRequest;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaim;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaimRange;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaimStatus;
import com.solusoft.ai.claimmatch.features.drafts.model.PromoteDraftResult;
import com.solusoft.ai.claimmatch.features.drafts.repository.DraftClaimStore;
import com.solusoft.ai.claimmatch.features.matching.AssignmentEngine;
import com.solusoft.ai.claimmatch.features.matching.RematchJob;
import com.solusoft.ai.claimmatch.features.review.ReviewStatsService;

import lombok.extern.slf4j.Slf4j;

/**
 * Review operations published as MCP tools. Every tool answers with a JSON string;
 * failures come back as {@code {"success":false,"status":...,"message":...}}.
 */
@Service
@Slf4j
public class ClaimMatchingMcpTools {

    static final String ALREADY_RUNNING = "ALREADY_RUNNING";

    private final AssignmentEngine assignmentEngine;
    private final AssignmentReviewService assignmentReviewService;
    private final DraftClaimGenerator draftClaimGenerator;
    private final DraftClaimLifecycle draftClaimLifecycle;
    private final DraftClaimPromoter draftClaimPromoter;
    private final RematchJob rematchJob;
    private final ReviewStatsService reviewStatsService;
    private final AssignmentStore assignmentStore;
    private final DraftClaimStore draftClaimStore;
    private final ObjectMapper objectMapper;

    public ClaimMatchingMcpTools(AssignmentEngine assignmentEngine, AssignmentReviewService assignmentReviewService,
                                 DraftClaimGenerator draftClaimGenerator, DraftClaimLifecycle draftClaimLifecycle,
                                 DraftClaimPromoter draftClaimPromoter, RematchJob rematchJob,
                                 ReviewStatsService reviewStatsService, AssignmentStore assignmentStore,
                                 DraftClaimStore draftClaimStore, ObjectMapper objectMapper) {
        this.assignmentEngine = assignmentEngine;
        this.assignmentReviewService = assignmentReviewService;
        this.draftClaimGenerator = draftClaimGenerator;
        this.draftClaimLifecycle = draftClaimLifecycle;
        this.draftClaimPromoter = draftClaimPromoter;
        this.rematchJob = rematchJob;
        this.reviewStatsService = reviewStatsService;
        this.assignmentStore = assignmentStore;
        this.draftClaimStore = draftClaimStore;
        this.objectMapper = objectMapper;
    }

    // -------------------------------------------------------------------------
    //  MATCHING
    // -------------------------------------------------------------------------

    @McpTool(name = "match_document", description = "Scores one medical document against every insurer claim and stores the best matches as candidate assignments.")
    public String matchDocument(@McpToolParam(description = "ID of the medical document") String documentId) {
        log.info("[TOOL] Entering match_document");
        log.debug("Input documentId: {}", documentId);
        try {
            return assignmentsResult(assignmentEngine.matchDocumentById(documentId));
        } catch (Exception e) {
            return handleError("match_document", e);
        }
    }

    @McpTool(name = "match_all_documents", description = "Matches every medical bill with detected amounts and every dated calendar event against all claims.")
    public String matchAllDocuments() {
        log.info("[TOOL] Entering match_all_documents");
        try {
            return assignmentsResult(assignmentEngine.matchAllDocuments());
        } catch (Exception e) {
            return handleError("match_all_documents", e);
        }
    }

    @McpTool(name = "match_documents_by_ids", description = "Matches the given documents against all claims. Unknown IDs are ignored.")
    public String matchDocumentsByIds(@McpToolParam(description = "Medical document IDs") List<String> documentIds) {
        log.info("[TOOL] Entering match_documents_by_ids");
        log.debug("Input documentIds: {}", documentIds);
        try {
            if (documentIds == null || documentIds.isEmpty()) {
                throw new ValidationException("documentIds must not be empty");
            }
            return assignmentsResult(assignmentEngine.matchDocumentsByIds(documentIds));
        } catch (Exception e) {
            return handleError("match_documents_by_ids", e);
        }
    }

    @McpTool(name = "rematch_all", description = "Runs the full rematch batch. Refused while another batch is running.")
    public String rematchAll() {
        log.info("[TOOL] Entering rematch_all");
        try {
            return batchResult("rematch_all", rematchJob.rematchAll());
        } catch (Exception e) {
            return handleError("rematch_all", e);
        }
    }

    @McpTool(name = "match_accepted_drafts", description = "Rematches every document that belongs to an accepted draft claim.")
    public String matchAcceptedDrafts() {
        log.info("[TOOL] Entering match_accepted_drafts");
        try {
            return batchResult("match_accepted_drafts", rematchJob.matchAcceptedDrafts());
        } catch (Exception e) {
            return handleError("match_accepted_drafts", e);
        }
    }

    // -------------------------------------------------------------------------
    //  ASSIGNMENT REVIEW
    // -------------------------------------------------------------------------

    @McpTool(name = "list_assignments", description = "Lists assignments, optionally only those with one status (candidate, confirmed or rejected). Highest score first.")
    public String listAssignments(
            @McpToolParam(description = "Optional status filter: candidate, confirmed or rejected", required = false) String status) {
        log.info("[TOOL] Entering list_assignments");
        log.debug("Input status: {}", status);
        try {
            Optional<AssignmentStatus> filter = parseStatus(status, AssignmentStatus::fromValue,
                    "status must be one of candidate, confirmed, rejected");
            List<Assignment> assignments = assignmentStore.find(a -> filter.map(f -> f == a.status()).orElse(true)).stream()
                    .sorted(Comparator.comparingDouble(Assignment::matchScore).reversed())
                    .toList();
            return assignmentsResult(assignments);
        } catch (Exception e) {
            return handleError("list_assignments", e);
        }
    }

    @McpTool(name = "confirm_assignment", description = "Confirms a candidate assignment for an illness and adds the document's provider contacts to that illness.")
    public String confirmAssignment(
            @McpToolParam(description = "ID of the candidate assignment") String assignmentId,
            @McpToolParam(description = "ID of the illness the document belongs to") String illnessId,
            @McpToolParam(description = "Optional reviewer notes", required = false) String reviewNotes) {
        log.info("[TOOL] Entering confirm_assignment");
        log.debug("Input assignmentId: {}, illnessId: {}", assignmentId, illnessId);
        try {
            Assignment assignment = assignmentReviewService.confirmAssignment(assignmentId, illnessId, reviewNotes, currentReviewer());
            return success(Map.of("assignment", assignment));
        } catch (Exception e) {
            return handleError("confirm_assignment", e);
        }
    }

    @McpTool(name = "reject_assignment", description = "Rejects a candidate assignment.")
    public String rejectAssignment(
            @McpToolParam(description = "ID of the candidate assignment") String assignmentId,
            @McpToolParam(description = "Optional reviewer notes", required = false) String reviewNotes) {
        log.info("[TOOL] Entering reject_assignment");
        try {
            return success(Map.of("assignment", assignmentReviewService.rejectAssignment(assignmentId, reviewNotes)));
        } catch (Exception e) {
            return handleError("reject_assignment", e);
        }
    }

    @McpTool(name = "create_manual_assignment", description = "Links a document to a claim by hand with full confidence. Returns the existing assignment if the pair is already linked.")
    public String createManualAssignment(
            @McpToolParam(description = "ID of the medical document") String documentId,
            @McpToolParam(description = "ID of the insurer claim") String claimId,
            @McpToolParam(description = "Optional reason for the manual link", required = false) String reviewNotes) {
        log.info("[TOOL] Entering create_manual_assignment");
        try {
            return success(Map.of("assignment", assignmentReviewService.createManualAssignment(documentId, claimId, reviewNotes)));
        } catch (Exception e) {
            return handleError("create_manual_assignment", e);
        }
    }

    @McpTool(name = "preview_assignment_accounts", description = "Lists the contacts that confirming this assignment would add to the illness.")
    public String previewAssignmentAccounts(@McpToolParam(description = "ID of the assignment") String assignmentId) {
        log.info("[TOOL] Entering preview_assignment_accounts");
        try {
            return success(Map.of("accounts", assignmentReviewService.previewAccounts(assignmentId)));
        } catch (Exception e) {
            return handleError("preview_assignment_accounts", e);
        }
    }

    // -------------------------------------------------------------------------
    //  DRAFT CLAIMS
    // -------------------------------------------------------------------------

    @McpTool(name = "generate_draft_claims", description = "Creates pending draft claims for unattached bill attachments with a payment. Range: forever, last_month or last_week.")
    public String generateDraftClaims(@McpToolParam(description = "forever (default), last_month or last_week", required = false) String range) {
        log.info("[TOOL] Entering generate_draft_claims");
        log.debug("Input range: {}", range);
        try {
            List<DraftClaim> drafts = draftClaimGenerator.generate(parseRange(range));
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("created", drafts.size());
            result.put("drafts", drafts);
            return success(result);
        } catch (Exception e) {
            return handleError("generate_draft_claims", e);
        }
    }

    @McpTool(name = "list_draft_claims", description = "Lists draft claims, optionally only those with one status (pending, accepted or rejected).")
    public String listDraftClaims(
            @McpToolParam(description = "Optional status filter: pending, accepted or rejected", required = false) String status) {
        log.info("[TOOL] Entering list_draft_claims");
        log.debug("Input status: {}", status);
        try {
            Optional<DraftClaimStatus> filter = parseStatus(status, DraftClaimStatus::fromValue,
                    "status must be one of pending, accepted, rejected");
            List<DraftClaim> drafts = draftClaimStore.find(d -> filter.map(f -> f == d.status()).orElse(true));
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("count", drafts.size());
            result.put("draftClaims", drafts);
            return success(result);
        } catch (Exception e) {
            return handleError("list_draft_claims", e);
        }
    }

    @McpTool(name = "accept_draft_claim", description = "Accepts a pending draft claim. Needs an illness, doctor notes, a treatment date or calendar events, and proof of payment.")
    public String acceptDraftClaim(
            @McpToolParam(description = "ID of the draft claim") String draftClaimId,
            @McpToolParam(description = "Acceptance details") AcceptDraftClaimRequest request) {
        log.info("[TOOL] Entering accept_draft_claim");
        log.debug("Input draftClaimId: {}, request: {}", draftClaimId, request);
        try {
            if (request == null) {
                throw new ValidationException("Acceptance details are required");
            }
            return success(Map.of("draftClaim", draftClaimLifecycle.accept(draftClaimId, request)));
        } catch (Exception e) {
            return handleError("accept_draft_claim", e);
        }
    }

    @McpTool(name = "reject_draft_claim", description = "Rejects a pending draft claim.")
    public String rejectDraftClaim(@McpToolParam(description = "ID of the draft claim") String draftClaimId) {
        log.info("[TOOL] Entering reject_draft_claim");
        try {
            return success(Map.of("draftClaim", draftClaimLifecycle.reject(draftClaimId)));
        } catch (Exception e) {
            return handleError("reject_draft_claim", e);
        }
    }

    @McpTool(name = "mark_draft_claim_pending", description = "Re-opens an accepted or rejected draft claim. Entered acceptance details are kept.")
    public String markDraftClaimPending(@McpToolParam(description = "ID of the draft claim") String draftClaimId) {
        log.info("[TOOL] Entering mark_draft_claim_pending");
        try {
            return success(Map.of("draftClaim", draftClaimLifecycle.markPending(draftClaimId)));
        } catch (Exception e) {
            return handleError("mark_draft_claim_pending", e);
        }
    }

    @McpTool(name = "promote_document_to_draft", description = "Builds a draft claim from a document and the other attachments of its email, even without a detected payment.")
    public String promoteDocumentToDraft(@McpToolParam(description = "ID of the medical document") String documentId) {
        log.info("[TOOL] Entering promote_document_to_draft");
        try {
            PromoteDraftResult result = draftClaimPromoter.promote(documentId);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("draftClaim", result.draft());
            payload.put("created", result.created());
            payload.put("expanded", result.expanded());
            return success(payload);
        } catch (Exception e) {
            return handleError("promote_document_to_draft", e);
        }
    }

    @McpTool(name = "get_review_stats", description = "Counts of claims, documents, assignments and draft claims plus the candidate score distribution.")
    public String getReviewStats() {
        log.info("[TOOL] Entering get_review_stats");
        try {
            return success(Map.of("stats", reviewStatsService.getStats()));
        } catch (Exception e) {
            return handleError("get_review_stats", e);
        }
    }

    // -------------------------------------------------------------------------
    //  HELPER METHODS
    // -------------------------------------------------------------------------

    private DraftClaimRange parseRange(String range) {
        if (range == null || range.isBlank()) {
            return DraftClaimRange.FOREVER;
        }
        try {
            return DraftClaimRange.fromValue(range.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("range must be one of forever, last_month, last_week");
        }
    }

    private static <T> Optional<T> parseStatus(String value, Function<String, T> parser, String message) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(parser.apply(value.trim()));
        } catch (IllegalArgumentException e) {
            throw new ValidationException(message);
        }
    }

    private String currentReviewer() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        return auth != null && auth.isAuthenticated() ? auth.getName() : null;
    }

    private String assignmentsResult(List<Assignment> assignments) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("count", assignments.size());
        result.put("assignments", assignments);
        return success(result);
    }

    private String batchResult(String toolName, Optional<List<Assignment>> assignments) {
        if (assignments.isEmpty()) {
            log.warn("[TOOL] {} refused: rematch already running", toolName);
            Map<String, Object> response = new HashMap<>();
            response.put("success", false);
            response.put("status", ALREADY_RUNNING);
            response.put("message", "A rematch is already running");
            return toJson(response);
        }
        return assignmentsResult(assignments.get());
    }

    private String success(Map<String, Object> data) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.putAll(data);
        return toJson(response);
    }

    private String toJson(Object data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.error("JSON Serialization Error", e);
            return "{\"success\":false,\"status\":\"FATAL_ERROR\",\"message\":\"JSON_ERROR\"}";
        }
    }

    private String handleError(String toolName, Exception e) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("success", false);

        if (e instanceof ClaimMatchException claimMatchException && !(e instanceof MatchingException)) {
            log.warn("⚠️ Tool [{}] rejected request: {}", toolName, e.getMessage());
            errorResponse.put("status", claimMatchException.getErrorCode());
            errorResponse.put("message", e.getMessage());
        } else {
            log.error("❌ CRITICAL ERROR in tool [{}]: {}", toolName, e.getMessage(), e);
            errorResponse.put("status", "FATAL_ERROR");
            errorResponse.put("message", "System failure in " + toolName + ". " + e.getMessage());
        }
        return toJson(errorResponse);
    }
}
