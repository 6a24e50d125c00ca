package com.backtester.backtest;

/**
 * Receives progress checkpoints from a simulation. Called on the simulation's own thread;
 * implementations must return quickly and must not throw.
 */
@FunctionalInterface
public interface BacktestProgressListener {

    BacktestProgressListener NOOP = progress -> {};

    void onProgress(BacktestProgress progress);
}
