package ai.treemetrics.git;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.errors.RevisionSyntaxException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevTree;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.jetbrains.annotations.Nullable;

/**
 * Read-only access to the revisions a diff report compares: resolving revision strings, listing changed files
 * between two commits and reading file contents at a commit.
 */
public final class GitRevisions implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(GitRevisions.class);

    private final Repository repository;

    private GitRevisions(Repository repository) {
        this.repository = repository;
    }

    /**
     * Opens the repository containing {@code dir}.
     *
     * @throws GitDiffException if there is no repository at or above {@code dir}, or it is a shallow clone
     */
    public static GitRevisions open(Path dir) throws GitDiffException {
        var builder = new FileRepositoryBuilder();
        builder.findGitDir(dir.toAbsolutePath().toFile());
        if (builder.getGitDir() == null) {
            throw GitDiffException.notARepository();
        }
        Repository repository;
        try {
            repository = builder.build();
        } catch (IOException e) {
            logger.debug("Failed to open repository at {}", builder.getGitDir(), e);
            throw GitDiffException.notARepository();
        }
        if (Files.exists(repository.getDirectory().toPath().resolve("shallow"))) {
            repository.close();
            throw GitDiffException.shallowClone();
        }
        logger.debug("Opened repository {}", repository.getDirectory());
        return new GitRevisions(repository);
    }

    public ObjectId resolveCommit(String rev) throws GitDiffException {
        try {
            var id = repository.resolve(rev + "^{commit}");
            if (id == null) {
                throw GitDiffException.refNotFound(rev);
            }
            return id;
        } catch (RevisionSyntaxException e) {
            throw GitDiffException.refNotFound(rev);
        } catch (IOException e) {
            throw new GitDiffException("Git error: " + e.getMessage(), e);
        }
    }

    private RevTree resolveTree(String rev) throws GitDiffException {
        var commitId = resolveCommit(rev);
        try (var revWalk = new RevWalk(repository)) {
            return revWalk.parseCommit(commitId).getTree();
        } catch (IOException e) {
            throw new GitDiffException("Git error: " + e.getMessage(), e);
        }
    }

    /** Files that differ between the trees of {@code from} and {@code to}. Renames appear as a delete and an add. */
    public List<ChangedFile> changedFiles(String from, String to) throws GitDiffException {
        var fromTree = resolveTree(from);
        var toTree = resolveTree(to);
        try (var diffFormatter = new DiffFormatter(new ByteArrayOutputStream())) {
            diffFormatter.setRepository(repository);
            var files = new ArrayList<ChangedFile>();
            for (DiffEntry entry : diffFormatter.scan(fromTree, toTree)) {
                switch (entry.getChangeType()) {
                    case ADD, COPY -> files.add(new ChangedFile(entry.getNewPath(), ChangeStatus.ADDED));
                    case MODIFY -> files.add(new ChangedFile(entry.getNewPath(), ChangeStatus.MODIFIED));
                    case DELETE -> files.add(new ChangedFile(entry.getOldPath(), ChangeStatus.DELETED));
                    case RENAME -> {
                        files.add(new ChangedFile(entry.getOldPath(), ChangeStatus.DELETED));
                        files.add(new ChangedFile(entry.getNewPath(), ChangeStatus.ADDED));
                    }
                }
            }
            logger.debug("{} files changed between {} and {}", files.size(), from, to);
            return files;
        } catch (IOException e) {
            throw new GitDiffException("Git error: " + e.getMessage(), e);
        }
    }

    /**
     * Content of {@code path} at {@code rev} with trailing line breaks collapsed into a single newline, or empty when
     * the path does not exist at that revision.
     */
    public Optional<byte[]> readBlob(String rev, String path) throws GitDiffException {
        var tree = resolveTree(rev);
        try (var treeWalk = TreeWalk.forPath(repository, path, tree)) {
            if (treeWalk == null) {
                return Optional.empty();
            }
            var data = repository.open(treeWalk.getObjectId(0)).getBytes();
            return Optional.of(normalizeTrailingNewlines(data));
        } catch (IOException e) {
            throw new GitDiffException("Could not find '" + path + "' at rev '" + rev + "'.", e);
        }
    }

    static byte[] normalizeTrailingNewlines(byte[] data) {
        int end = data.length;
        while (end > 0 && (data[end - 1] == '\n' || data[end - 1] == '\r')) {
            end--;
        }
        var out = new byte[end + 1];
        System.arraycopy(data, 0, out, 0, end);
        out[end] = '\n';
        return out;
    }

    /**
     * A short branch name pointing at the same commit as {@code rev}, preferring local branches over remote tracking
     * ones, or {@code rev} itself when there is none.
     */
    public String friendlyRefLabel(String rev) {
        ObjectId commitId;
        try {
            commitId = repository.resolve(rev + "^{commit}");
        } catch (IOException | RevisionSyntaxException e) {
            logger.debug("Could not resolve {} for labelling", rev, e);
            return rev;
        }
        if (commitId == null) {
            return rev;
        }
        var local = findBranchFor(commitId, Constants.R_HEADS);
        if (local != null) {
            return local;
        }
        var remote = findBranchFor(commitId, Constants.R_REMOTES);
        return remote != null ? remote : rev;
    }

    private @Nullable String findBranchFor(ObjectId commitId, String prefix) {
        List<Ref> refs;
        try {
            refs = repository.getRefDatabase().getRefsByPrefix(prefix);
        } catch (IOException e) {
            logger.debug("Could not list refs under {}", prefix, e);
            return null;
        }
        return refs.stream()
                .filter(ref -> commitId.equals(ref.getObjectId()))
                .map(ref -> shortenRefName(ref.getName()))
                .findFirst()
                .orElse(null);
    }

    static String shortenRefName(String full) {
        if (full.startsWith(Constants.R_HEADS)) {
            return full.substring(Constants.R_HEADS.length());
        }
        if (full.startsWith(Constants.R_REMOTES + "origin/")) {
            return full.substring((Constants.R_REMOTES + "origin/").length());
        }
        if (full.startsWith(Constants.R_REMOTES)) {
            var rest = full.substring(Constants.R_REMOTES.length());
            int slash = rest.indexOf('/');
            return slash >= 0 ? rest.substring(slash + 1) : rest;
        }
        return full;
    }

    @Override
    public void close() {
        repository.close();
    }
}
