package org.javai.reporting.exec;

import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lets another thread abort an execution. Cancelling before the statement starts prevents it from
 * running; cancelling while it runs calls {@link Statement#cancel()}.
 */
public final class CancellationToken {

	private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

	private final AtomicBoolean cancelled = new AtomicBoolean();
	private final AtomicReference<Statement> running = new AtomicReference<>();

	public static CancellationToken create() {
		return new CancellationToken();
	}

	public boolean isCancelled() {
		return cancelled.get();
	}

	public void cancel() {
		cancelled.set(true);
		Statement statement = running.get();
		if (statement != null) {
			try {
				statement.cancel();
			} catch (SQLException e) {
				logger.debug("Driver could not cancel running statement: {}", e.getMessage());
			}
		}
	}

	/**
	 * @return false if the token was already cancelled and the statement must not run
	 */
	boolean attach(Statement statement) {
		running.set(statement);
		return !cancelled.get();
	}

	void detach() {
		running.set(null);
	}
}
