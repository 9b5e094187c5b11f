package io.cronbot.core.scheduler;

/**
 * Handle for an armed timer.
 */
public interface TimerHandle {
    /**
     * Withdraws the timer if it has not fired yet. Never interrupts a callback already running.
     *
     * @return true if the timer was withdrawn by this call
     */
    boolean cancel();

    boolean isActive();
}
