package com.foldermatch.app.concurrent;

import com.foldermatch.app.model.RecoveryAction;

/**
 * Lancada quando a politica de recuperacao responde {@code ABORT} (por exemplo, disco cheio).
 * Ao contrario de um item ignorado, isso para a operacao inteira.
 */
public class AnalysisAbortedException extends RuntimeException {

    private final transient RecoveryAction action;

    public AnalysisAbortedException(RecoveryAction action, Throwable cause) {
        super(action == null ? "Analise abortada" : action.message(), cause);
        this.action = action;
    }

    public RecoveryAction action() {
        return action;
    }
}
