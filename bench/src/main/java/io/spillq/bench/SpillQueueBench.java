// file: bench/src/main/java/io/spillq/bench/SpillQueueBench.java
package io.spillq.bench;

import io.spillq.storage.HybridQueue;
import io.spillq.storage.QueueConfig;
import io.spillq.storage.SpillOrdering;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mixed push/pop workload driver against a single HybridQueue.
 *
 * Usage:
 *   java -jar bench.jar \
 *     --path /tmp/spillq-bench.txt \
 *     --threads 4 \
 *     --ops-per-thread 20000 \
 *     --capacity 1024 \
 *     --value-bytes 128 \
 *     --pop-ratio 0.4 \
 *     --ordering STRICT_FIFO
 *
 * A pop ratio below 0.5 lets the queue grow past the ring, so the run
 * exercises spills and disk pops as well as the in-memory fast path.
 *
 * Output:
 *   - Summary line to stderr (throughput, latency percentiles, queue metrics).
 *   - CSV to stdout with per-op latency samples:
 *       op,success,latency_us
 */
public final class SpillQueueBench {

    private static final class Sample {
        final String op;
        final boolean ok;
        final double latencyUs;

        Sample(String op, boolean ok, double latencyUs) {
            this.op = op;
            this.ok = ok;
            this.latencyUs = latencyUs;
        }
    }

    public static void main(String[] args) throws Exception {
        Map<String, String> cfg = parseArgs(args);

        Path path = Path.of(cfg.getOrDefault("path", "./spillq-bench.txt"));
        int threads = Integer.parseInt(cfg.getOrDefault("threads", "4"));
        int opsPerThread = Integer.parseInt(cfg.getOrDefault("ops-per-thread", "20000"));
        int capacity = Integer.parseInt(cfg.getOrDefault("capacity", "1024"));
        int valueBytes = Integer.parseInt(cfg.getOrDefault("value-bytes", "128"));
        double popRatio = Double.parseDouble(cfg.getOrDefault("pop-ratio", "0.4"));
        SpillOrdering ordering = SpillOrdering.valueOf(cfg.getOrDefault("ordering", "STRICT_FIFO"));

        Files.deleteIfExists(path);
        QueueConfig config = QueueConfig.defaults(path)
                .withRingCapacity(capacity)
                .withOrdering(ordering);

        try (HybridQueue queue = new HybridQueue(config)) {
            runBenchmark(queue, threads, opsPerThread, valueBytes, popRatio);
        } finally {
            Files.deleteIfExists(path);
        }
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String key = a.substring(2);
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for " + a);
                }
                out.put(key, args[++i]);
            } else {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
        }
        return out;
    }

    private static void runBenchmark(
            HybridQueue queue,
            int threads,
            int opsPerThread,
            int valueBytes,
            double popRatio
    ) throws Exception {

        char[] filler = new char[valueBytes];
        Arrays.fill(filler, 'x');
        String payload = new String(filler);

        ExecutorService exec = Executors.newFixedThreadPool(threads);
        BlockingQueue<Sample> samples = new LinkedBlockingQueue<>();
        AtomicLong opCount = new AtomicLong();
        long started = System.nanoTime();

        Runnable worker = () -> {
            ThreadLocalRandom rnd = ThreadLocalRandom.current();
            for (int i = 0; i < opsPerThread; i++) {
                boolean isPop = rnd.nextDouble() < popRatio;
                String op = isPop ? "POP" : "PUSH";
                long start = System.nanoTime();
                boolean ok = false;
                try {
                    if (isPop) {
                        ok = queue.pop().isPresent();
                    } else {
                        queue.push(payload);
                        ok = true;
                    }
                } catch (RuntimeException ignored) {
                    ok = false;
                } finally {
                    double latencyUs = (System.nanoTime() - start) / 1_000.0;
                    samples.add(new Sample(op, ok, latencyUs));
                    opCount.incrementAndGet();
                }
            }
        };

        for (int i = 0; i < threads; i++) {
            exec.submit(worker);
        }
        exec.shutdown();
        if (!exec.awaitTermination(1, TimeUnit.HOURS)) {
            System.err.println("benchmark did not finish within an hour");
        }
        double elapsedSeconds = (System.nanoTime() - started) / 1_000_000_000.0;

        List<Sample> all = new ArrayList<>(samples.size());
        samples.drainTo(all);

        summarizeAndPrint(all, opCount.get(), elapsedSeconds, queue);
    }

    private static void summarizeAndPrint(List<Sample> all, long totalOps, double elapsedSeconds, HybridQueue queue) {
        if (all.isEmpty()) {
            System.err.println("no samples collected");
            return;
        }

        double throughput = totalOps / elapsedSeconds;

        List<Double> latencies = new ArrayList<>(all.size());
        for (Sample s : all) {
            if (s.ok) {
                latencies.add(s.latencyUs);
            }
        }
        Collections.sort(latencies);

        double p50 = percentile(latencies, 0.50);
        double p95 = percentile(latencies, 0.95);
        double p99 = percentile(latencies, 0.99);

        long okCount = all.stream().filter(s -> s.ok).count();
        long missCount = all.size() - okCount;

        System.err.printf(
                "throughput=%.2f ops/s, ok=%d, miss=%d, p50=%.1fus, p95=%.1fus, p99=%.1fus, remaining=%d%n",
                throughput, okCount, missCount, p50, p95, p99, queue.length()
        );
        System.err.println(queue.metrics());

        // CSV to stdout.
        System.out.println("op,success,latency_us");
        for (Sample s : all) {
            System.out.printf("%s,%s,%.3f%n", s.op, s.ok ? "1" : "0", s.latencyUs);
        }
    }

    static double percentile(List<Double> sorted, double q) {
        if (sorted.isEmpty()) return Double.NaN;
        double idx = q * (sorted.size() - 1);
        int lo = (int) Math.floor(idx);
        int hi = (int) Math.ceil(idx);
        if (lo == hi) return sorted.get(lo);
        double w = idx - lo;
        return sorted.get(lo) * (1 - w) + sorted.get(hi) * w;
    }
}
