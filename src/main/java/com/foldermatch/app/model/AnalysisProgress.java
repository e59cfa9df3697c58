package com.foldermatch.app.model;

/**
 * Um relatorio de progresso. {@code max} e 0 quando indeterminado.
 */
public record AnalysisProgress(AnalysisPhase phase, int current, int max, String message, boolean indeterminate) {

    public static AnalysisProgress indeterminate(AnalysisPhase phase, String message) {
        return new AnalysisProgress(phase, 0, 0, message, true);
    }

    public static AnalysisProgress of(AnalysisPhase phase, int current, int max, String message) {
        return new AnalysisProgress(phase, current, max, message, false);
    }

    public static AnalysisProgress complete(int count, String message) {
        return new AnalysisProgress(AnalysisPhase.COMPLETE, count, count, message, false);
    }

    public boolean isComplete() {
        return phase == AnalysisPhase.COMPLETE;
    }
}
