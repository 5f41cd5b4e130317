package com.example.tieredcache.loadgen;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Drives {@code GET /item} on a running instance and prints latency percentiles and the cache stats.
 * Usage: {@code LoadGenerator <zipf|hotcold|herd> [durationSeconds] [threads] [baseUrl]}
 */
public class LoadGenerator {

    private static final HttpClient client = HttpClient.newHttpClient();

    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            System.out.println("Usage: LoadGenerator <zipf|hotcold|herd> [durationSeconds] [threads] [baseUrl]");
            return;
        }

        String workload = args[0];
        int duration = args.length > 1 ? Integer.parseInt(args[1]) : 60;
        int threads = args.length > 2 ? Integer.parseInt(args[2]) : 50;
        String baseUrl = args.length > 3 ? args[3] : "http://localhost:8080";

        System.out.println(String.format("Workload=%s Duration=%ds Threads=%d Target=%s", workload, duration, threads, baseUrl));
        run(baseUrl, workload, duration, threads);
        System.out.println("Cache stats: " + fetch(baseUrl + "/stats"));
    }

    static KeyWorkload workloadFor(String name, long seed) {
        switch (name) {
            case "zipf":
                return KeyWorkload.zipf(100_000, 0.9, seed);
            case "hotcold":
                return KeyWorkload.hotCold(100_000, 1_000, 0.8, seed);
            case "herd":
                return KeyWorkload.herd("hot-key-stampede");
            default:
                throw new IllegalArgumentException("Unknown workload: " + name);
        }
    }

    private static void run(String baseUrl, String workload, int durationSeconds, int threads) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        AtomicLong requestCount = new AtomicLong();
        AtomicLong failures = new AtomicLong();
        ConcurrentLinkedQueue<Double> latencies = new ConcurrentLinkedQueue<>();
        long endTime = System.currentTimeMillis() + durationSeconds * 1000L;

        for (int i = 0; i < threads; i++) {
            KeyWorkload keys = workloadFor(workload, i);
            executor.submit(() -> {
                while (System.currentTimeMillis() < endTime) {
                    String key = keys.nextKey();
                    try {
                        long start = System.nanoTime();
                        HttpResponse<String> response = send(baseUrl + "/item?key=" + URLEncoder.encode(key, StandardCharsets.UTF_8));
                        latencies.add((System.nanoTime() - start) / 1_000_000.0);
                        if (isSuccess(response.statusCode())) {
                            requestCount.incrementAndGet();
                        } else {
                            failures.incrementAndGet();
                        }
                    } catch (Exception e) {
                        failures.incrementAndGet();
                    }
                }
            });
        }

        executor.shutdown();
        executor.awaitTermination(durationSeconds + 10, TimeUnit.SECONDS);

        DescriptiveStatistics stats = new DescriptiveStatistics();
        latencies.forEach(stats::addValue);
        System.out.println(String.format("Requests=%d Failures=%d RPS=%.1f", requestCount.get(), failures.get(),
            requestCount.get() / (double) durationSeconds));
        System.out.println(String.format("Avg=%.2fms P95=%.2fms P99=%.2fms Max=%.2fms",
            stats.getMean(), stats.getPercentile(95), stats.getPercentile(99), stats.getMax()));
    }

    static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    private static String fetch(String url) throws Exception {
        return send(url).body();
    }

    private static HttpResponse<String> send(String url) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .GET()
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
