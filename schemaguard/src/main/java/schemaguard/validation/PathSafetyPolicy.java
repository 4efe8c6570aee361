package schemaguard.validation;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a file path may be stored in the database.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>null or blank: rejected</li>
 *   <li>any {@code ..} or {@code ~} in the raw string: rejected</li>
 *   <li>not absolute after normalization: rejected</li>
 *   <li>inside the managed documents directory: accepted</li>
 *   <li>managed directory required: rejected</li>
 *   <li>under a system directory (case-insensitive prefix): rejected</li>
 * </ol>
 *
 * <p>The check is purely lexical. Symbolic links are not resolved and the file need not exist.
 */
public final class PathSafetyPolicy {

    static final List<String> SYSTEM_PREFIXES = List.of(
            "/etc/", "/bin/", "/sbin/", "/usr/bin/", "/usr/sbin/",
            "C:\\Windows\\", "C:\\System32\\", "C:\\Program Files\\");

    private final Path managedDir;
    private final boolean requireManaged;

    /**
     * @param managedDir the managed documents directory, or null for none
     * @param requireManaged whether paths outside {@code managedDir} are rejected
     */
    public PathSafetyPolicy(Path managedDir, boolean requireManaged) {
        if (requireManaged && managedDir == null) {
            throw new IllegalArgumentException("requireManaged needs a managed directory");
        }
        this.managedDir = managedDir == null ? null : managedDir.toAbsolutePath().normalize();
        this.requireManaged = requireManaged;
    }

    /**
     * A policy with no managed directory: only the lexical and denylist checks apply.
     */
    public static PathSafetyPolicy unmanaged() {
        return new PathSafetyPolicy(null, false);
    }

    public Path managedDir() {
        return managedDir;
    }

    public boolean requireManaged() {
        return requireManaged;
    }

    /**
     * @param value the candidate path, usually a caller-supplied string
     * @return true if the path may be stored
     */
    public boolean isSafe(Object value) {
        if (!(value instanceof String)) {
            return false;
        }
        String raw = (String) value;
        if (raw.isBlank() || raw.contains("..") || raw.contains("~")) {
            return false;
        }

        Path normalized;
        try {
            normalized = Path.of(raw).normalize();
        } catch (InvalidPathException e) {
            return false;
        }
        if (!normalized.isAbsolute()) {
            return false;
        }

        if (managedDir != null && normalized.startsWith(managedDir)) {
            return true;
        }
        if (requireManaged) {
            return false;
        }

        String lower = normalized.toString().toLowerCase(Locale.ROOT);
        for (String prefix : SYSTEM_PREFIXES) {
            if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "PathSafetyPolicy{managedDir=" + managedDir + ", requireManaged=" + requireManaged + '}';
    }
}
