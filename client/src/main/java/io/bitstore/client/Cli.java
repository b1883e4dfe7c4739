// file: client/src/main/java/io/bitstore/client/Cli.java
package io.bitstore.client;

import io.bitstore.core.BitException;
import io.bitstore.core.SaveRecord;
import io.bitstore.core.delta.CompressionStats;
import io.bitstore.storage.CheckoutPlan;
import io.bitstore.storage.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * The {@code bit} command-line front end.
 *
 * Usage:
 *   bit [--root <dir>] [-v] init
 *   bit [--root <dir>] [-v] save <label...>
 *   bit [--root <dir>] [-v] list
 *   bit [--root <dir>] [-v] checkout [--dry-run] <id>
 *   bit [--root <dir>] [-v] now
 *   bit [--root <dir>] [-v] show <id> <path>
 *   bit [--root <dir>] [-v] stats <id>
 *   bit [--root <dir>] [-v] check-ignore <path...>
 *
 * Exit codes: 0 success, 1 usage or repository error, 2 anything unexpected.
 */
public final class Cli {

    private static final String USAGE = """
            Usage: bit [--root <dir>] [-v|--verbose] <command> [args]
            Commands:
              init                      Initialize a .bit repository
              save <label...>           Save the current state under the given label
              list                      List all saved states
              checkout [--dry-run] <id> Restore files to the given save
              now                       Restore files to the latest save
              show <id> <path>          Print a file as of a save
              stats <id>                Patch compression figures of a save
              check-ignore <path...>    Tell which paths .bitignore excludes
            """;

    // Held so the configured level is not lost when the logger is collected.
    private static final Logger APP_LOGGER = Logger.getLogger("io.bitstore");

    private final Repository repo;
    private final Path root;
    private final PrintStream out;

    private Cli(Repository repo, Path root, PrintStream out) {
        this.repo = repo;
        this.root = root;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Runs one command and returns the process exit code. */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            Options opts = Options.parse(args);
            if (opts.help()) {
                out.print(USAGE);
                return 0;
            }
            configureLogging(opts.verbose());

            Cli cli = new Cli(Repository.open(opts.root()), opts.root(), out);
            cli.dispatch(opts.command(), opts.rest());
            return 0;
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            if (e.showUsage()) {
                err.print(USAGE);
            }
            return 1;
        } catch (BitException | IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            e.printStackTrace(err);
            return 2;
        }
    }

    private void dispatch(String cmd, List<String> rest) {
        switch (cmd) {
            case "init" -> {
                expectArgs(rest, 0, 0, "init takes no arguments");
                repo.init();
                out.println("Initialized empty bit repository in " + root.resolve(".bit"));
            }
            case "save" -> {
                expectArgs(rest, 1, Integer.MAX_VALUE, "save requires <label>");
                String label = String.join(" ", rest);
                String id = repo.saveState(label);
                out.println("Saved state '" + label + "' with id " + id);
            }
            case "list" -> {
                expectArgs(rest, 0, 0, "list takes no arguments");
                list();
            }
            case "checkout" -> checkout(rest);
            case "now" -> {
                expectArgs(rest, 0, 0, "now takes no arguments");
                Optional<SaveRecord> latest = repo.checkoutLatest();
                if (latest.isEmpty()) {
                    out.println("No saves found");
                } else {
                    out.println("Checked out latest save '" + latest.get().label() + "' with id " + latest.get().id());
                }
            }
            case "show" -> {
                expectArgs(rest, 2, 2, "show requires <id> <path>");
                byte[] content = repo.readFile(rest.get(0), rest.get(1));
                out.write(content, 0, content.length);
                out.flush();
            }
            case "stats" -> {
                expectArgs(rest, 1, 1, "stats requires <id>");
                stats(rest.get(0));
            }
            case "check-ignore" -> {
                expectArgs(rest, 1, Integer.MAX_VALUE, "check-ignore requires <path...>");
                for (Map.Entry<String, Boolean> e : repo.checkIgnore(rest).entrySet()) {
                    out.println(e.getKey() + ": " + (e.getValue() ? "ignored" : "tracked"));
                }
            }
            default -> throw new CliException("unknown command: " + cmd, true);
        }
    }

    private void list() {
        List<SaveRecord> saves = repo.listSaves();
        if (saves.isEmpty()) {
            out.println("No saves found");
            return;
        }
        out.println("Saves:");
        for (SaveRecord s : saves) {
            out.printf("  %s  %s  %s%n", s.id(), s.createdAt(), s.label());
        }
    }

    private void checkout(List<String> rest) {
        boolean dryRun = !rest.isEmpty() && "--dry-run".equals(rest.get(0));
        List<String> ids = dryRun ? rest.subList(1, rest.size()) : rest;
        expectArgs(ids, 1, 1, "checkout requires <id>");
        String id = ids.get(0);

        if (!dryRun) {
            repo.checkout(id);
            out.println("Checked out save " + id);
            return;
        }

        CheckoutPlan plan = repo.planCheckout(id);
        if (plan.restoresIgnoreSpec()) {
            out.println("restore .bitignore");
        }
        for (String p : plan.toDelete()) out.println("delete " + p);
        for (String p : plan.toWrite()) out.println("write  " + p);
        for (String p : plan.preserved().keySet()) out.println("keep   " + p);
    }

    private void stats(String id) {
        CompressionStats stats = repo.compressionStats(id);
        if (stats.byPath().isEmpty()) {
            out.println("No patches in save " + id);
            return;
        }
        for (Map.Entry<String, CompressionStats.PathStats> e : stats.byPath().entrySet()) {
            CompressionStats.PathStats ps = e.getValue();
            out.printf("  %s  %d -> %d bytes (saved %d)%n",
                    e.getKey(), ps.uncompressed(), ps.compressed(), ps.saving());
        }
        out.printf(Locale.ROOT, "ratio %.2f%n", stats.ratio());
    }

    private static void expectArgs(List<String> rest, int min, int max, String message) {
        if (rest.size() < min || rest.size() > max) {
            throw new CliException(message, true);
        }
    }

    /**
     * Loads {@code logging.properties} from the classpath; verbose mode
     * opens up io.bitstore loggers down to FINE.
     */
    private static void configureLogging(boolean verbose) {
        try (InputStream in = Cli.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read logging.properties", e);
        }
        if (verbose) {
            APP_LOGGER.setLevel(Level.FINE);
            for (Handler h : Logger.getLogger("").getHandlers()) {
                h.setLevel(Level.FINE);
            }
        }
    }

    record Options(Path root, boolean verbose, boolean help, String command, List<String> rest) {

        static Options parse(String[] args) {
            Path root = Paths.get("").toAbsolutePath();
            boolean verbose = false;
            int i = 0;
            while (i < args.length && args[i].startsWith("-")) {
                switch (args[i]) {
                    case "--root" -> {
                        if (i + 1 >= args.length) {
                            throw new CliException("--root requires a value", true);
                        }
                        root = Paths.get(args[++i]).toAbsolutePath().normalize();
                    }
                    case "-v", "--verbose" -> verbose = true;
                    case "-h", "--help" -> {
                        return new Options(root, verbose, true, null, List.of());
                    }
                    default -> throw new CliException("unknown option: " + args[i], true);
                }
                i++;
            }
            if (i >= args.length) {
                throw new CliException("missing command", true);
            }
            String command = args[i];
            List<String> rest = Arrays.asList(args).subList(i + 1, args.length);
            return new Options(root, verbose, false, command, List.copyOf(rest));
        }
    }

    static final class CliException extends RuntimeException {
        private final boolean showUsage;

        CliException(String msg, boolean showUsage) {
            super(msg);
            this.showUsage = showUsage;
        }

        boolean showUsage() {
            return showUsage;
        }
    }
}
