package com.findinpath.hierarchy.exception;

public class InvalidOperationException extends HierarchyException {

    public InvalidOperationException(String message) {
        super(Reason.INVALID_OPERATION, message);
    }
}
