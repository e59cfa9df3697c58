package com.foldermatch.app.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Recomendacao da politica de recuperacao de erros. Quem chama decide se segue.
 */
public record RecoveryAction(RecoveryActionType type,
                             String message,
                             String suggestedSolution,
                             boolean shouldRetry,
                             Duration retryDelay) {

    public RecoveryAction {
        Objects.requireNonNull(type, "type");
        message = message == null ? "" : message;
        suggestedSolution = suggestedSolution == null ? "" : suggestedSolution;
        retryDelay = retryDelay == null ? Duration.ZERO : retryDelay;
    }

    public static RecoveryAction skip(String message, String suggestedSolution) {
        return new RecoveryAction(RecoveryActionType.SKIP, message, suggestedSolution, false, Duration.ZERO);
    }

    public static RecoveryAction retry(String message, String suggestedSolution, Duration delay) {
        return new RecoveryAction(RecoveryActionType.RETRY, message, suggestedSolution, true, delay);
    }

    public boolean isAbort() {
        return type == RecoveryActionType.ABORT;
    }
}
