package ai.treemetrics.git;

public enum ChangeStatus {
    ADDED,
    MODIFIED,
    DELETED
}
