package com.foldermatch.app.concurrent;

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.foldermatch.app.model.AnalysisPhase;
import com.foldermatch.app.model.AnalysisProgress;

/**
 * Repassa progresso para um destino opcional, descartando relatorios que fariam {@code current}
 * voltar dentro da mesma fase. Workers podem reportar de varias threads.
 */
public final class ProgressReporter {

    private static final Logger logger = LoggerFactory.getLogger(ProgressReporter.class);

    private final Consumer<AnalysisProgress> sink;
    private AnalysisPhase lastPhase;
    private int lastCurrent = -1;

    public ProgressReporter(Consumer<AnalysisProgress> sink) {
        this.sink = sink;
    }

    public static ProgressReporter of(Consumer<AnalysisProgress> sink) {
        return new ProgressReporter(sink);
    }

    public synchronized void report(AnalysisProgress progress) {
        if (sink == null || progress == null) return;
        if (progress.phase() == lastPhase && progress.current() < lastCurrent) return;
        lastPhase = progress.phase();
        lastCurrent = progress.current();
        try {
            sink.accept(progress);
        } catch (RuntimeException e) {
            // listener quebrado nao pode derrubar a analise
            logger.warn("Listener de progresso falhou: {}", e.toString());
        }
    }

    public void report(AnalysisPhase phase, int current, int max, String message) {
        report(AnalysisProgress.of(phase, current, max, message));
    }

    public void indeterminate(AnalysisPhase phase, String message) {
        report(AnalysisProgress.indeterminate(phase, message));
    }

    public void indeterminate(AnalysisPhase phase, int current, String message) {
        report(new AnalysisProgress(phase, current, 0, message, true));
    }

    public void complete(int count, String message) {
        report(AnalysisProgress.complete(count, message));
    }
}
