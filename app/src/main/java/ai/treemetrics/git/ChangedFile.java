package ai.treemetrics.git;

/** A repository-relative path (forward slashes) and how it changed between two revisions. */
public record ChangedFile(String path, ChangeStatus status) {}
