package nl.nfi.probregex.regex.generate;

import nl.nfi.probregex.regex.Expression;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Stream;

import static java.lang.Math.min;
import static java.util.Objects.requireNonNull;
import static nl.nfi.probregex.regex.generate.SamplerCommon.DEFAULT_MAX_UNROLLS;
import static nl.nfi.probregex.regex.generate.SamplerCommon.generateString;

// splits the requested samples into chunks, every chunk samples with its own Random
public final class ThreadedSampler implements StringGenerator {

    private static final int DEFAULT_CHUNK_SIZE = 1 << 16;

    private final Expression expression;
    private final Random random;
    private final long maxUnrolls;
    private final int threadCount;
    private final int chunkSize;

    private ThreadedSampler(final Expression expression, final Random random, final long maxUnrolls, final int threadCount, final int chunkSize) {
        this.expression = expression;
        this.random = random;
        this.maxUnrolls = maxUnrolls;
        this.threadCount = threadCount;
        this.chunkSize = chunkSize;
    }

    public static ThreadedSampler init(final Expression expression) {
        return new ThreadedSampler(requireNonNull(expression, "expression"), new Random(), DEFAULT_MAX_UNROLLS,
            Runtime.getRuntime().availableProcessors(), DEFAULT_CHUNK_SIZE);
    }

    public ThreadedSampler random(final Random random) {
        return new ThreadedSampler(expression, requireNonNull(random, "random"), maxUnrolls, threadCount, chunkSize);
    }

    public ThreadedSampler seed(final long seed) {
        return random(new Random(seed));
    }

    public ThreadedSampler maxUnrolls(final long maxUnrolls) {
        if (maxUnrolls < 0) {
            throw new IllegalArgumentException("Maximum number of repetition steps must not be negative: %d".formatted(maxUnrolls));
        }
        return new ThreadedSampler(expression, random, maxUnrolls, threadCount, chunkSize);
    }

    public ThreadedSampler threadCount(final int threadCount) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("Thread count must be at least 1: %d".formatted(threadCount));
        }
        return new ThreadedSampler(expression, random, maxUnrolls, threadCount, chunkSize);
    }

    public ThreadedSampler chunkSize(final int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("Chunk size must be at least 1: %d".formatted(chunkSize));
        }
        return new ThreadedSampler(expression, random, maxUnrolls, threadCount, chunkSize);
    }

    @Override
    public List<String> sampleMany(final int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Sample count must not be negative: %d".formatted(count));
        }
        final List<Chunk> chunks = splitIntoChunks(count);
        // ordered: same seed and count always produce the same list
        final List<String> samples = new ArrayList<>(count);
        runInPool(() -> chunks.stream()
            .parallel()
            .map(this::sampleChunk)
            .toList())
            .forEach(samples::addAll);
        return samples;
    }

    @Override
    public void writeSamples(final long limit, final PrintStream output) {
        final List<Chunk> chunks = splitIntoChunks(limit);
        runInPool(() -> {
            chunks.stream()
                .unordered()
                .parallel()
                .map(this::sampleChunk)
                .forEach(batch -> {
                    synchronized (output) {
                        batch.forEach(output::println);
                    }
                });
            return null;
        });
    }

    private List<String> sampleChunk(final Chunk chunk) {
        final Random chunkRandom = new Random(chunk.seed());
        final List<String> batch = new ArrayList<>(chunk.size());
        for (int i = 0; i < chunk.size(); i++) {
            batch.add(generateString(expression, chunkRandom, maxUnrolls));
        }
        return batch;
    }

    // seeds are drawn up front and in order, the shared Random is never touched from worker threads
    private List<Chunk> splitIntoChunks(final long limit) {
        return Stream.iterate(0L, offset -> offset < limit, offset -> offset + chunkSize)
            .map(offset -> new Chunk(random.nextLong(), (int) min(chunkSize, limit - offset)))
            .toList();
    }

    private <T> T runInPool(final Callable<T> task) {
        final ForkJoinPool pool = new ForkJoinPool(threadCount);
        try {
            return pool.submit(task).get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while sampling", e);
        } catch (final ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    private record Chunk(long seed, int size) {
    }
}
