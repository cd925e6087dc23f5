package ai.authtrail.util.grpc.trailers;

public enum CallPhase {
    STARTED,
    HANDLER_RUNNING,
    SUCCEEDED,
    FAILED,
    TRAILERS_MERGED,
    SENT,
    CANCELLED;

    public boolean isFinished() {
        return this == TRAILERS_MERGED || this == SENT || this == CANCELLED;
    }
}
