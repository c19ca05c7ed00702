package com.tcrimer.backtest;

import com.tcrimer.model.BacktestResult;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One submitted run. A pending run is cancelled outright; a running one stops at the next bar.
 */
public final class BacktestHandle {
    private final String strategyId;
    private final String symbol;
    private final AtomicReference<BacktestRunState> state = new AtomicReference<>(BacktestRunState.PENDING);
    private volatile boolean cancelRequested;
    private volatile BacktestFailedException.Reason failureReason;
    private volatile Future<BacktestResult> future;

    BacktestHandle(String strategyId, String symbol) {
        this.strategyId = strategyId;
        this.symbol = symbol;
    }

    public String strategyId() {
        return strategyId;
    }

    public String symbol() {
        return symbol;
    }

    public BacktestRunState state() {
        return state.get();
    }

    /**
     * Set once the run is FAILED; null otherwise.
     */
    public BacktestFailedException.Reason failureReason() {
        return failureReason;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public void cancel() {
        cancelRequested = true;
        Future<BacktestResult> f = future;
        if (f != null && state.get() == BacktestRunState.PENDING && f.cancel(false)) {
            // the task body will not run to record the outcome
            markFailed(BacktestFailedException.Reason.CANCELLED);
        }
    }

    /**
     * Waits for the result; on timeout the run is cancelled and fails with TIMEOUT.
     */
    public BacktestResult await(Duration timeout) throws BacktestFailedException {
        Future<BacktestResult> f = future;
        if (f == null) {
            throw new IllegalStateException("run " + strategyId + "/" + symbol + " was never submitted");
        }
        try {
            return f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            markFailed(BacktestFailedException.Reason.TIMEOUT);
            cancelRequested = true;
            f.cancel(true);
            throw new BacktestFailedException(BacktestFailedException.Reason.TIMEOUT,
                    strategyId + " on " + symbol + " exceeded " + timeout.toMillis() + "ms", e);
        } catch (CancellationException e) {
            throw new BacktestFailedException(BacktestFailedException.Reason.CANCELLED,
                    strategyId + " on " + symbol + " cancelled before it started", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            throw new BacktestFailedException(BacktestFailedException.Reason.CANCELLED,
                    "interrupted waiting for " + strategyId + " on " + symbol, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BacktestFailedException failed) {
                throw failed;
            }
            throw new BacktestFailedException(BacktestFailedException.Reason.DATA_FAULT,
                    strategyId + " on " + symbol + " crashed: " + cause, cause);
        }
    }

    void attach(Future<BacktestResult> future) {
        this.future = future;
        if (cancelRequested) {
            cancel();
        }
    }

    boolean markRunning() {
        return state.compareAndSet(BacktestRunState.PENDING, BacktestRunState.RUNNING);
    }

    void markCompleted() {
        state.compareAndSet(BacktestRunState.RUNNING, BacktestRunState.COMPLETED);
    }

    /**
     * First failure reason wins, so a TIMEOUT is not overwritten by the CANCELLED it triggers.
     */
    void markFailed(BacktestFailedException.Reason reason) {
        BacktestRunState previous = state.getAndUpdate(s -> s.isTerminal() ? s : BacktestRunState.FAILED);
        if (!previous.isTerminal()) {
            failureReason = reason;
        }
    }
}
