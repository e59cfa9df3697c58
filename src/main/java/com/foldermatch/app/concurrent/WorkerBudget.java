package com.foldermatch.app.concurrent;

import java.util.concurrent.Semaphore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Quantas unidades podem rodar ao mesmo tempo. Comeca no paralelismo configurado e so diminui
 * (ate 1) quando a politica de recuperacao pede para aliviar a carga.
 */
public final class WorkerBudget {

    private static final Logger logger = LoggerFactory.getLogger(WorkerBudget.class);

    private final ShrinkableSemaphore permits;
    private final int initial;
    private int current;

    public WorkerBudget(int parallelism) {
        this.initial = Math.max(1, parallelism);
        this.current = initial;
        this.permits = new ShrinkableSemaphore(initial);
    }

    public int initial() {
        return initial;
    }

    public synchronized int current() {
        return current;
    }

    public void acquire() throws InterruptedException {
        permits.acquire();
    }

    public void release() {
        permits.release();
    }

    /**
     * Corta o orcamento pela metade, nunca abaixo de 1.
     *
     * @return true quando o orcamento de fato diminuiu
     */
    public synchronized boolean reduce() {
        if (current <= 1) return false;
        int next = Math.max(1, current / 2);
        permits.shrink(current - next);
        logger.info("Reduzindo paralelismo {} -> {}", current, next);
        current = next;
        return true;
    }

    private static final class ShrinkableSemaphore extends Semaphore {
        ShrinkableSemaphore(int permits) {
            super(permits);
        }

        void shrink(int by) {
            reducePermits(by);
        }
    }
}
