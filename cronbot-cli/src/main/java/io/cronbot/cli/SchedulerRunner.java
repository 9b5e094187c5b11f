package io.cronbot.cli;

/**
 * Hosts the scheduler process until shutdown.
 */
@FunctionalInterface
public interface SchedulerRunner {
    int run() throws Exception;
}
