package com.foldermatch.app.concurrent;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sinal de cancelamento cooperativo consultado pelos loops longos.
 *
 * Um token pode ser cancelado direto, expirar apos um timeout de relogio ou seguir um ou mais
 * tokens pai. A consulta nao usa lock.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(new AtomicBoolean(false), List.of(), Long.MAX_VALUE);

    private final AtomicBoolean cancelled;
    private final List<CancellationToken> parents;
    private final long deadlineNanos;

    private CancellationToken(AtomicBoolean cancelled, List<CancellationToken> parents, long deadlineNanos) {
        this.cancelled = cancelled;
        this.parents = parents;
        this.deadlineNanos = deadlineNanos;
    }

    public static CancellationToken create() {
        return new CancellationToken(new AtomicBoolean(false), List.of(), Long.MAX_VALUE);
    }

    /**
     * Token que nunca e cancelado.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Embrulha uma flag existente, para que codigo que ja compartilha um {@link AtomicBoolean} controle o token.
     */
    public static CancellationToken fromAtomicBoolean(AtomicBoolean flag) {
        return new CancellationToken(Objects.requireNonNull(flag, "flag"), List.of(), Long.MAX_VALUE);
    }

    public static CancellationToken withTimeout(Duration timeout) {
        return linked(List.of(), timeout);
    }

    /**
     * Novo token cancelado quando qualquer pai e cancelado ou quando {@code timeout} expira.
     * Timeout nulo ou nao positivo significa sem prazo.
     */
    public static CancellationToken linked(CancellationToken parent, Duration timeout) {
        return linked(List.of(Objects.requireNonNull(parent, "parent")), timeout);
    }

    public static CancellationToken linked(List<CancellationToken> parents, Duration timeout) {
        long deadline = Long.MAX_VALUE;
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            deadline = System.nanoTime() + saturatedNanos(timeout);
        }
        return new CancellationToken(new AtomicBoolean(false), List.copyOf(parents), deadline);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        if (cancelled.get()) return true;
        if (isTimedOut()) return true;
        for (CancellationToken parent : parents) {
            if (parent.isCancellationRequested()) return true;
        }
        return false;
    }

    /**
     * True quando este token (nao um pai) passou do prazo.
     */
    public boolean isTimedOut() {
        return deadlineNanos != Long.MAX_VALUE && System.nanoTime() - deadlineNanos >= 0;
    }

    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException(isTimedOut() ? "Tempo limite da operacao excedido" : "Operacao cancelada");
        }
    }

    private static long saturatedNanos(Duration d) {
        try {
            return d.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE / 2;
        }
    }
}
