package com.phillippitts.swarmcouncil.exception;

/**
 * Thrown when a pipeline stage's provider call fails. Triggers degradation; callers of a
 * workflow never see it, they get a run with a {@code degraded} or {@code failed} status instead.
 */
public class StageExecutionException extends SwarmCouncilException {

    private final int stageIndex;
    private final String role;
    private final String providerId;

    public StageExecutionException(int stageIndex, String role, String providerId, Throwable cause) {
        super("Stage " + stageIndex + " (" + role + " via " + providerId + ") failed: "
                + (cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage()), cause);
        this.stageIndex = stageIndex;
        this.role = role;
        this.providerId = providerId;
    }

    public int getStageIndex() {
        return stageIndex;
    }

    public String getRole() {
        return role;
    }

    public String getProviderId() {
        return providerId;
    }
}
