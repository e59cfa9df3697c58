package com.foldermatch.app.recovery;

import com.foldermatch.app.concurrent.AnalysisAbortedException;
import com.foldermatch.app.concurrent.WorkerBudget;
import com.foldermatch.app.model.RecoveryAction;
import com.foldermatch.app.model.RecoveryActionType;

/**
 * As partes de uma decisao de recuperacao que toda etapa aplica do mesmo jeito.
 */
public final class RecoveryActions {

    private RecoveryActions() {}

    /**
     * Aborta em {@code ABORT} e reduz o orcamento de workers em {@code REDUCE_PARALLELISM}; o resto
     * fica com quem chamou (que normalmente ignora o item).
     *
     * @throws AnalysisAbortedException quando a acao e abortar
     */
    public static void enforce(RecoveryAction action, WorkerBudget budget, Throwable cause) {
        if (action == null) return;
        if (action.isAbort()) {
            throw new AnalysisAbortedException(action, cause);
        }
        if (action.type() == RecoveryActionType.REDUCE_PARALLELISM && budget != null) {
            budget.reduce();
        }
    }
}
