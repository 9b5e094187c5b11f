package io.cronbot.core.scheduler;

/**
 * What happens when a recurring job fires while its previous invocation is still running.
 */
public enum OverlapPolicy {
    /** Start another invocation alongside the running one. */
    ALLOW,
    /** Drop the new fire; the following occurrence is still armed. */
    SKIP
}
