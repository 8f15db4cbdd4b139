package org.javai.reporting.exec;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.reporting.config.ExecutionSettings;
import org.javai.reporting.query.BoundQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs report queries on a fixed set of worker threads so that at most
 * {@link ExecutionSettings#maxConcurrentQueries()} statements are in flight at once.
 *
 * <p>Each call waits for its result up to a deadline measured from submission, queueing time
 * included. When the deadline passes the running statement is cancelled and a failed result is
 * returned.</p>
 */
public class QueryExecutionPool implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(QueryExecutionPool.class);

	private final QueryExecutor executor;
	private final ExecutorService workers;
	private final Duration defaultDeadline;

	public QueryExecutionPool(QueryExecutor executor, ExecutionSettings settings) {
		this.executor = Objects.requireNonNull(executor, "executor");
		this.defaultDeadline = settings.defaultDeadline();
		this.workers = Executors.newFixedThreadPool(settings.maxConcurrentQueries(), new WorkerThreadFactory());
	}

	public QueryResult run(BoundQuery query) {
		return run(query, defaultDeadline);
	}

	public QueryResult run(BoundQuery query, Duration deadline) {
		Objects.requireNonNull(query, "query");
		Objects.requireNonNull(deadline, "deadline");
		long start = System.nanoTime();
		CancellationToken token = CancellationToken.create();

		Future<QueryResult> future;
		try {
			future = workers.submit(() -> executor.execute(query, token));
		} catch (RejectedExecutionException e) {
			return QueryResult.failure(query.sql(), "Query execution pool is shut down", elapsedSince(start));
		}

		try {
			return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
		} catch (TimeoutException e) {
			token.cancel();
			future.cancel(true);
			logger.warn("Report query cancelled after exceeding its deadline of {} ms", deadline.toMillis());
			return QueryResult.failure(query.sql(),
					"Query exceeded deadline of " + deadline.toMillis() + " ms", elapsedSince(start));
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			token.cancel();
			future.cancel(true);
			return QueryResult.failure(query.sql(), "Query execution was interrupted", elapsedSince(start));
		} catch (ExecutionException e) {
			Throwable cause = e.getCause() != null ? e.getCause() : e;
			return QueryResult.failure(query.sql(), "Query execution failed: " + cause.getMessage(), elapsedSince(start));
		}
	}

	@Override
	public void close() {
		workers.shutdownNow();
		try {
			if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
				logger.warn("Report query workers did not terminate within 5 seconds");
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	private static Duration elapsedSince(long start) {
		return Duration.ofNanos(System.nanoTime() - start);
	}

	private static final class WorkerThreadFactory implements ThreadFactory {

		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "report-query-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}
	}
}
