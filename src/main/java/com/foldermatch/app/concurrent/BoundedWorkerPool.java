package com.foldermatch.app.concurrent;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Executa unidades independentes num pool fixo de threads daemon, no maximo
 * {@link WorkerBudget#current()} por vez, enquanto a thread chamadora vigia o token de cancelamento.
 */
public final class BoundedWorkerPool {

    private static final long POLL_MILLIS = 100;

    private final String threadPrefix;
    private final WorkerBudget budget;

    public BoundedWorkerPool(String threadPrefix, WorkerBudget budget) {
        this.threadPrefix = threadPrefix;
        this.budget = budget;
    }

    public WorkerBudget budget() {
        return budget;
    }

    /**
     * Executa {@code work} uma vez por unidade e espera todas.
     *
     * @throws CancellationException quando o token dispara; workers em execucao sao interrompidos
     * @throws RuntimeException a primeira falha nao checada de um worker, relancada como veio
     */
    public <T> void runAll(List<T> units, Consumer<T> work, CancellationToken cancel) {
        cancel.throwIfCancellationRequested();
        if (units.isEmpty()) return;

        int threads = Math.min(budget.initial(), units.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads, namedFactory(threadPrefix));
        try {
            List<Future<?>> futures = new ArrayList<>(units.size());
            for (T unit : units) {
                futures.add(pool.submit(() -> {
                    if (cancel.isCancellationRequested()) return;
                    try {
                        budget.acquire();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    try {
                        if (!cancel.isCancellationRequested()) work.accept(unit);
                    } finally {
                        budget.release();
                    }
                }));
            }
            pool.shutdown();

            for (Future<?> f : futures) await(f, cancel);
            cancel.throwIfCancellationRequested();
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Executa {@code task} numa unica thread daemon e devolve o resultado. A thread chamadora segue
     * consultando o token, entao uma tarefa presa em I/O nao segura quem chamou apos cancelamento ou timeout.
     *
     * @throws CancellationException quando o token dispara; a thread da tarefa e interrompida
     */
    public <R> R call(Supplier<R> task, CancellationToken cancel) {
        cancel.throwIfCancellationRequested();
        ExecutorService pool = Executors.newSingleThreadExecutor(namedFactory(threadPrefix));
        try {
            Callable<R> callable = task::get;
            Future<R> future = pool.submit(callable);
            pool.shutdown();
            R result = await(future, cancel);
            cancel.throwIfCancellationRequested();
            return result;
        } finally {
            pool.shutdownNow();
        }
    }

    private static <R> R await(Future<R> future, CancellationToken cancel) {
        while (true) {
            cancel.throwIfCancellationRequested();
            try {
                return future.get(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                // consulta de novo
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrompido esperando os workers");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException re) throw re;
                if (cause instanceof Error err) throw err;
                throw new IllegalStateException(cause);
            }
        }
    }

    static ThreadFactory namedFactory(String prefix) {
        return new ThreadFactory() {
            private final ThreadFactory base = Executors.defaultThreadFactory();
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override public Thread newThread(Runnable r) {
                Thread t = base.newThread(r);
                t.setName(prefix + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
    }
}
