package com.labassist.orchestration.lifecycle;

public class RequestNotFoundException extends RuntimeException {

    public RequestNotFoundException(String requestId) {
        super("Request not found: " + requestId);
    }
}
