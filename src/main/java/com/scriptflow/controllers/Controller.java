package com.scriptflow.controllers;

import com.scriptflow.blocks.OperationFailure;
import io.javalin.Javalin;

import java.util.Map;

/**
 * An HTTP surface over one service. Each controller registers its own routes.
 */
public interface Controller {

    void registerRoutes(Javalin app);

    /**
     * Error body that never carries a null message.
     */
    static Map<String, Object> errorBody(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            m = e.getClass().getSimpleName();
        }
        return Map.of("error", m);
    }

    /**
     * Status code for a rejected forest operation. The response body is the
     * result itself, which carries the reason and message.
     */
    static int statusFor(OperationFailure reason) {
        if (reason == null) {
            return 200;
        }
        switch (reason) {
            case NOT_FOUND:
                return 404;
            case WOULD_CREATE_CYCLE:
                return 409;
            case INVALID_CONTAINER:
            case VALIDATION_FAILED:
            default:
                return 400;
        }
    }
}
