// file: client/src/main/java/io/spillq/client/Cli.java
package io.spillq.client;

import io.spillq.core.QueueException;
import io.spillq.storage.HybridQueue;
import io.spillq.storage.QueueConfig;
import io.spillq.storage.SpillOrdering;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Command line access to a queue backing file.
 *
 * Usage:
 *   spillq-cli [options] push <item>...
 *   spillq-cli [options] pop [n]
 *   spillq-cli [options] len
 *
 * Options:
 *   --config,   -c <file.json>   queue config (see QueueConfig.fromJsonFile)
 *   --path,     -p <file>        backing file (default: ./queue.txt)
 *   --capacity, -n <slots>       memory ring slots
 *   --ordering, -o <policy>      STRICT_FIFO or SPILL_NEWEST_FIRST
 *
 * Every invocation is its own process, so the queue is opened with
 * flushOnClose: whatever is still in memory at exit is written to the file.
 *
 * Examples:
 *   spillq-cli --path jobs.txt push a b c
 *   spillq-cli --path jobs.txt pop 2
 *   spillq-cli --path jobs.txt len
 */
public final class Cli {

    private static final String DEFAULT_PATH = "./queue.txt";

    private final HybridQueue queue;
    private final PrintStream out;

    private Cli(HybridQueue queue, PrintStream out) {
        this.queue = queue;
        this.out = out;
    }

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    /**
     * @return process exit code: 0 ok, 1 usage error, 2 queue/IO failure
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            Invocation inv = parse(args);
            try (HybridQueue queue = new HybridQueue(inv.config())) {
                new Cli(queue, out).execute(inv.command(), inv.operands());
            }
            return 0;
        } catch (UsageException e) {
            err.println("error: " + e.getMessage());
            err.print(USAGE);
            return 1;
        } catch (QueueException | UncheckedIOException | IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            return 2;
        } catch (Exception e) {
            e.printStackTrace(err);
            return 2;
        }
    }

    private void execute(String cmd, List<String> operands) {
        switch (cmd) {
            case "push" -> {
                if (operands.isEmpty()) {
                    throw new UsageException("push requires at least one <item>");
                }
                queue.pushBatch(operands);
                out.println("OK " + operands.size());
            }
            case "pop" -> {
                if (operands.size() > 1) {
                    throw new UsageException("pop takes at most one count");
                }
                int n = operands.isEmpty() ? 1 : parsePositive("pop count", operands.get(0));
                List<String> popped = queue.popBatch(n);
                if (popped.isEmpty()) {
                    out.println("(empty)");
                    return;
                }
                popped.forEach(out::println);
            }
            case "len" -> {
                if (!operands.isEmpty()) {
                    throw new UsageException("len takes no arguments");
                }
                out.println(queue.length());
            }
            default -> throw new UsageException("unknown command: " + cmd);
        }
    }

    record Invocation(QueueConfig config, String command, List<String> operands) {}

    static Invocation parse(String[] args) {
        String configFile = null;
        String path = null;
        Integer capacity = null;
        SpillOrdering ordering = null;

        int i = 0;
        for (; i < args.length && args[i].startsWith("-"); i++) {
            switch (args[i]) {
                case "--config", "-c" -> {
                    ensureValue(args, i);
                    configFile = args[++i];
                }
                case "--path", "-p" -> {
                    ensureValue(args, i);
                    path = args[++i];
                }
                case "--capacity", "-n" -> {
                    ensureValue(args, i);
                    capacity = parsePositive("capacity", args[++i]);
                }
                case "--ordering", "-o" -> {
                    ensureValue(args, i);
                    String raw = args[++i];
                    try {
                        ordering = SpillOrdering.valueOf(raw.toUpperCase(Locale.ROOT));
                    } catch (IllegalArgumentException e) {
                        throw new UsageException("invalid ordering: " + raw);
                    }
                }
                default -> throw new UsageException("unknown option: " + args[i]);
            }
        }
        if (i >= args.length) {
            throw new UsageException("missing command");
        }

        QueueConfig cfg = configFile != null
                ? QueueConfig.fromJsonFile(Path.of(configFile))
                : QueueConfig.defaults(Path.of(DEFAULT_PATH));
        if (path != null) cfg = cfg.withPath(Path.of(path));
        if (capacity != null) {
            if (capacity < 2) throw new UsageException("capacity must be >= 2");
            cfg = cfg.withRingCapacity(capacity);
        }
        if (ordering != null) cfg = cfg.withOrdering(ordering);
        cfg = cfg.withFlushOnClose(true);

        String command = args[i];
        List<String> operands = Arrays.asList(args).subList(i + 1, args.length);
        return new Invocation(cfg, command, operands);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new UsageException("missing value for option: " + args[i]);
        }
    }

    private static int parsePositive(String what, String raw) {
        try {
            int v = Integer.parseInt(raw);
            if (v <= 0) throw new UsageException(what + " must be > 0, got: " + raw);
            return v;
        } catch (NumberFormatException e) {
            throw new UsageException("invalid " + what + ": " + raw);
        }
    }

    private static final String USAGE = """
            Usage:
              spillq-cli [options] push <item>...
              spillq-cli [options] pop [n]
              spillq-cli [options] len

            Options:
              --config,   -c   JSON queue config
              --path,     -p   Backing file (default: ./queue.txt)
              --capacity, -n   Memory ring slots
              --ordering, -o   STRICT_FIFO or SPILL_NEWEST_FIRST
            """;

    private static final class UsageException extends RuntimeException {
        UsageException(String msg) {
            super(msg);
        }
    }
}
