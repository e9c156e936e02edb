package com.solusoft.ai.claimmatch.exception;

import lombok.Getter;

@Getter
public class NotFoundException extends ClaimMatchException {

    private final String entityType;
    private final String entityId;

    public NotFoundException(String entityType, String entityId) {
        super(entityType + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }

    @Override
    public String getErrorCode() {
        return "NOT_FOUND";
    }
}
