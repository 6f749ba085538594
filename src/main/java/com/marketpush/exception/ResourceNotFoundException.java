package com.marketpush.exception;

public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, Object id) {
        super(ErrorCode.NOT_FOUND, resourceType + " not found: " + id);
    }
}
