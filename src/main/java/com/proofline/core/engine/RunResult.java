package com.proofline.core.engine;

import com.proofline.core.lifecycle.ProgressSummary;

/**
 * Outcome of one runner invocation.
 *
 * @param outcome  what happened
 * @param taskId   the claimed task, null when nothing was eligible
 * @param progress counters after the run, null when the run failed before a recount
 * @param message  one-line summary for the console
 */
public record RunResult(Outcome outcome, Long taskId, ProgressSummary progress, String message) {

    public enum Outcome {
        /** No eligible task. */
        IDLE,
        COMPLETED,
        /** A task-level error, appended to the task's error log. */
        FAILED,
        /** The source could not be reached; logged only, the task is released unchanged. */
        UNREACHABLE
    }

    public static RunResult idle(String message) {
        return new RunResult(Outcome.IDLE, null, null, message);
    }

    public static RunResult completed(long taskId, ProgressSummary progress, String message) {
        return new RunResult(Outcome.COMPLETED, taskId, progress, message);
    }

    public static RunResult failed(long taskId, String message) {
        return new RunResult(Outcome.FAILED, taskId, null, message);
    }

    public static RunResult unreachable(long taskId, String message) {
        return new RunResult(Outcome.UNREACHABLE, taskId, null, message);
    }

    public int exitCode() {
        return outcome == Outcome.FAILED || outcome == Outcome.UNREACHABLE ? 1 : 0;
    }
}
