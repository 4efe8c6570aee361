package host;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import schemaguard.backup.BackupInfo;
import schemaguard.bootstrap.Database;
import schemaguard.bootstrap.DatabaseBootstrap;
import schemaguard.config.MigrationConfig;
import schemaguard.config.MigrationConfigLoader;
import schemaguard.exceptions.DatabaseHandleException;
import schemaguard.exceptions.MigrateException;
import schemaguard.exceptions.OperationException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Command-line host for the inspection database.
 *
 * <p>Every run goes through {@link DatabaseBootstrap}, so the schema is migrated before
 * the command executes.
 *
 * <h2>Commands:</h2>
 * <ul>
 *   <li>{@code status} - schema version and row counts</li>
 *   <li>{@code backups} - list automatic backups, newest first</li>
 *   <li>{@code backup-now <file>} - copy the live database to a file</li>
 *   <li>{@code restore <file>} - replace the live database with a file; the replaced file
 *       is kept in the backup directory and the restored one is migrated on the next start</li>
 * </ul>
 *
 * <h2>Usage:</h2>
 * <pre>
 * java -Dstorage.data.dir=/var/lib/inspections -jar inspection-host.jar status
 * java -jar inspection-host.jar backup-now /mnt/usb/inspections.mv.db
 * </pre>
 */
public class InspectionHost {

    private static final Logger log = LoggerFactory.getLogger(InspectionHost.class);

    public static void main(String[] args) {
        MigrationConfig config = MigrationConfigLoader.load();
        int code = run(config, args, System.out);
        if (code != 0) {
            System.exit(code);
        }
    }

    /**
     * Runs one command.
     *
     * @return the process exit code
     */
    static int run(MigrationConfig config, String[] args, PrintStream out) {
        String command = args.length > 0 ? args[0] : "status";
        try (Database db = DatabaseBootstrap.start(config)) {
            MaintenanceActions actions = new MaintenanceActions(
                    db.handle(), db.manager().backupStore(), db.manager().journal());
            switch (command) {
                case "status":
                    printStatus(db, out);
                    return 0;
                case "backups":
                    printBackups(db.getBackupInfo(), out);
                    return 0;
                case "backup-now":
                    if (args.length < 2) {
                        out.println("usage: backup-now <file>");
                        return 2;
                    }
                    actions.backupNow(Path.of(args[1]));
                    out.println("Backup written to " + args[1]);
                    return 0;
                case "restore":
                    if (args.length < 2) {
                        out.println("usage: restore <file>");
                        return 2;
                    }
                    Optional<Path> previous = actions.restoreFrom(Path.of(args[1]));
                    out.println("Database restored from " + args[1]);
                    previous.ifPresent(p -> out.println("Previous database saved to " + p));
                    out.println("Schema migrations run on the next start");
                    return 0;
                default:
                    out.println("Unknown command: " + command);
                    out.println("Commands: status, backups, backup-now <file>, restore <file>");
                    return 2;
            }
        } catch (MigrateException e) {
            log.error("Database migration failed, refusing to start: {}", e.getMessage());
            return 1;
        } catch (OperationException | IOException e) {
            log.error("Command {} failed: {}", command, e.getMessage());
            return 1;
        } catch (DatabaseHandleException e) {
            log.error("Database unavailable: {}", e.getMessage());
            return 1;
        }
    }

    private static void printStatus(Database db, PrintStream out) throws OperationException {
        out.println("Schema version: " + db.migrationResult().toVersion());
        out.println("Equipment:      " + db.executor().execute("equipment", "getCount").scalarAsLong());
        out.println("Inspections:    " + db.executor().execute("inspections", "getCount").scalarAsLong());
        out.println("Backups:        " + db.getBackupInfo().size());
    }

    private static void printBackups(List<BackupInfo> backups, PrintStream out) {
        if (backups.isEmpty()) {
            out.println("No backups");
            return;
        }
        for (BackupInfo b : backups) {
            out.printf("%s  %10d bytes  %s%n", b.created(), b.size(), b.name());
        }
    }
}
