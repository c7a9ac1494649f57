package com.eainde.research.progress;

/**
 * Keys of the progress lines written during a run.
 */
public final class ProgressKeys {

    private ProgressKeys() {}

    public static final String TRACE_ID = "trace_id";
    public static final String STARTING = "starting";
    public static final String PLANNING = "planning";
    public static final String SEARCHING = "searching";
    public static final String EVALUATION = "evaluation";
    public static final String FOLLOW_UP = "follow_up";
    public static final String MAX_ITERATIONS = "max_iterations";
    public static final String WRITING = "writing";
    public static final String FINAL_REPORT = "final_report";
    public static final String ERROR = "error";
}
