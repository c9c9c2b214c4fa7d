package com.positionkeeper.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/** A position or time box named by the caller does not exist. */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(ErrorCode.NOT_FOUND, String.format("%s %s not found", resourceType, identifier), details(resourceType, identifier));
    }

    public static ResourceNotFoundException position(String positionId) {
        return new ResourceNotFoundException("Position", positionId);
    }

    private static Map<String, Object> details(String resourceType, String identifier) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("resource", resourceType);
        details.put("Position".equals(resourceType) ? POSITION_ID : "id", identifier);
        return details;
    }
}
