package com.formula.conversion.scheduler;

import com.formula.conversion.core.model.FormulaRecord;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One formula that has to be rendered in the current batch.
 * The state is shared between the worker running the job and the coordinating
 * thread cancelling it; transitions are compare-and-set so a job is either
 * started or cancelled, never both.
 */
public class ConversionJob {

    private final FormulaRecord formula;
    private final int ordinal;
    private final String outputPath;
    private final AtomicReference<JobState> state = new AtomicReference<>(JobState.PENDING);

    /**
     * @param formula    the formula to render
     * @param ordinal    1-based position among all formulas of the batch, cached or not
     * @param outputPath allocated image path relative to the base directory
     */
    public ConversionJob(FormulaRecord formula, int ordinal, String outputPath) {
        this.formula = Objects.requireNonNull(formula, "formula is required");
        this.outputPath = Objects.requireNonNull(outputPath, "outputPath is required");
        if (ordinal < 1) {
            throw new IllegalArgumentException("ordinal must be >= 1");
        }
        this.ordinal = ordinal;
    }

    public FormulaRecord getFormula() {
        return formula;
    }

    public int getOrdinal() {
        return ordinal;
    }

    public String getOutputPath() {
        return outputPath;
    }

    /**
     * Output path without its file extension; renderers append their own.
     */
    public String getOutputBasePath() {
        int slash = outputPath.lastIndexOf('/');
        int dot = outputPath.lastIndexOf('.');
        return dot > slash ? outputPath.substring(0, dot) : outputPath;
    }

    public JobState getState() {
        return state.get();
    }

    /**
     * Moves the job from pending to running.
     *
     * @return false if the job was cancelled before it could start
     */
    boolean markRunning() {
        return state.compareAndSet(JobState.PENDING, JobState.RUNNING);
    }

    /**
     * Cancels the job if it has not started yet.
     *
     * @return true if the job will not run
     */
    boolean cancel() {
        return state.compareAndSet(JobState.PENDING, JobState.CANCELLED);
    }

    void markSucceeded() {
        transitionFromRunning(JobState.SUCCEEDED);
    }

    void markFailed() {
        transitionFromRunning(JobState.FAILED);
    }

    private void transitionFromRunning(JobState target) {
        if (!state.compareAndSet(JobState.RUNNING, target)) {
            throw new IllegalStateException("job " + ordinal + " is " + state.get() + ", cannot become " + target);
        }
    }

    @Override
    public String toString() {
        return "ConversionJob{ordinal=" + ordinal + ", outputPath='" + outputPath + "', state=" + state.get() + '}';
    }
}
