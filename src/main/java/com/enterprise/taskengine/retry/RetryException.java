package com.enterprise.taskengine.retry;

/**
 * Raised by a running task to hand a {@link RetryRequest} to the
 * {@link RetryController}. It never leaves the controller.
 */
public class RetryException extends RuntimeException {
    
    private final transient RetryRequest request;
    
    public RetryException(RetryRequest request) {
        super(describe(request), request.getException());
        this.request = request;
    }
    
    public RetryRequest getRequest() {
        return request;
    }
    
    private static String describe(RetryRequest request) {
        StringBuilder message = new StringBuilder("Retry");
        if (request.getCountdown() != null) {
            message.append(" in ").append(request.getCountdown().getSeconds()).append('s');
        }
        if (request.getException() != null) {
            message.append(": ").append(request.getException());
        }
        return message.toString();
    }
}
