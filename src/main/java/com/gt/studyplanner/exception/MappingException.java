package com.gt.studyplanner.exception;

// Thrown when a stored JSON document can not be converted to or from its model type
public class MappingException extends RuntimeException {

    public MappingException(String errMsg) {
        super(errMsg);
    }

    public MappingException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
