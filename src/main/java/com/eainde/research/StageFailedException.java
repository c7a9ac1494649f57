package com.eainde.research;

/**
 * Marks the stage a failure came from while it travels through the workflow runtime.
 * The orchestrator unwraps it and rethrows the original cause.
 */
public class StageFailedException extends ResearchException {

    private final String stage;

    public StageFailedException(String stage, Throwable cause) {
        super("Stage '" + stage + "' failed: " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
