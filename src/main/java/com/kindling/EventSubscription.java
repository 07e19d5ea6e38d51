/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.kindling;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;

/**
 * An active subscription to database events, acquired via {@link Attachment#queueEvents(Set, EventHandler)}.
 * <p>
 * The engine fires a registration once; the subscription re-registers immediately on every firing, using the counts it
 * just received as the new baseline, so posts that race a re-registration are reported by the next firing rather
 * than lost. Count changes are handed to the {@link EventHandler} in order, one batch at a time, by a dispatcher task
 * running on the client executor.
 * <p>
 * The subscription lives until it is cancelled or its attachment is closed.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class EventSubscription extends AttachmentResource {
	/**
	 * Baseline count used for the priming registration: lower than any real count, so the engine fires immediately with
	 * the current counts.
	 */
	static final long UNKNOWN_COUNT = -1L;

	@NonNull
	private static final Map<String, Long> STOP_DISPATCHING;

	static {
		STOP_DISPATCHING = Collections.unmodifiableMap(new LinkedHashMap<>());
	}

	@NonNull
	private final Set<@NonNull String> eventNames;
	@NonNull
	private final EventHandler eventHandler;
	@NonNull
	private final BlockingQueue<@NonNull Map<@NonNull String, @NonNull Long>> pendingBatches;
	@NonNull
	private final AtomicBoolean cancelled;
	@NonNull
	private final Object lock;
	@NonNull
	private final Logger logger;

	@GuardedBy("lock")
	@NonNull
	private final Map<@NonNull String, @NonNull Long> engineCounts;
	@GuardedBy("lock")
	@NonNull
	private final Map<@NonNull String, @NonNull Long> deliveredCounts;
	@GuardedBy("lock")
	private boolean primed;
	@GuardedBy("lock")
	@Nullable
	private EngineEventRegistration registration;
	// Bumped per engine registration so a listener fired from inside queueEvents keeps the newest one
	@GuardedBy("lock")
	private long registrationGeneration;

	EventSubscription(@NonNull Attachment attachment,
										@NonNull Set<@NonNull String> eventNames,
										@NonNull EventHandler eventHandler) {
		super(attachment);

		requireNonNull(eventNames);
		requireNonNull(eventHandler);

		this.eventNames = eventNames;
		this.eventHandler = eventHandler;
		this.pendingBatches = new LinkedBlockingQueue<>();
		this.cancelled = new AtomicBoolean(false);
		this.lock = new Object();
		this.logger = Logger.getLogger(EventSubscription.class.getName());
		this.engineCounts = new LinkedHashMap<>();
		this.deliveredCounts = new LinkedHashMap<>();
		this.primed = false;
		this.registrationGeneration = 0;

		for (String eventName : eventNames) {
			this.engineCounts.put(eventName, UNKNOWN_COUNT);
			this.deliveredCounts.put(eventName, 0L);
		}
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{handle=%s, eventNames=%s, cancelled=%s}", getClass().getSimpleName(), getHandle(),
				getEventNames(), isCancelled());
	}

	/**
	 * Cancels this subscription. No handler invocation starts after this method returns.
	 * <p>
	 * Cancelling more than once is a no-op, and cancelling from inside {@link EventHandler#handle(Map)} is allowed.
	 *
	 * @return a future which completes when the engine registration has been cancelled
	 */
	@NonNull
	public CompletableFuture<Void> cancel() {
		if (!stopDispatching())
			return CompletableFuture.completedFuture(null);

		return getAttachment().getClient().perform(List.of(), () -> {
			if (markReleased())
				releaseEngineResources();

			logger.finer(format("Cancelled event subscription %d", getHandle()));
			return null;
		});
	}

	@NonNull
	public Boolean isCancelled() {
		return this.cancelled.get();
	}

	@NonNull
	public Set<@NonNull String> getEventNames() {
		return this.eventNames;
	}

	/**
	 * Cumulative number of times each subscribed event has been posted since the subscription began, as reported by the
	 * engine so far.
	 *
	 * @return event names mapped to cumulative counts
	 */
	@NonNull
	public Map<@NonNull String, @NonNull Long> getCounts() {
		synchronized (this.lock) {
			return Collections.unmodifiableMap(new LinkedHashMap<>(this.deliveredCounts));
		}
	}

	/**
	 * Primes the engine registration and starts the dispatcher.
	 */
	void start() {
		synchronized (this.lock) {
			try {
				register();
			} catch (EngineException e) {
				throw new DatabaseException(e);
			}
		}

		try {
			getAttachment().getClient().getExecutorService().execute(this::dispatch);
		} catch (RejectedExecutionException e) {
			stopDispatching();
			cancelRegistrationQuietly();
			throw new DisposedResourceException("Client has been disposed");
		}
	}

	/**
	 * Invoked by the engine when a registration fires.
	 */
	private void onEvents(@NonNull Map<@NonNull String, @NonNull Long> counts) {
		requireNonNull(counts);

		synchronized (this.lock) {
			if (isCancelled())
				return;

			Map<String, Long> batch = new LinkedHashMap<>();

			for (String eventName : getEventNames()) {
				Long count = counts.get(eventName);

				if (count == null)
					continue;

				long previousCount = this.engineCounts.get(eventName);

				if (this.primed && count > previousCount)
					batch.put(eventName, count - previousCount);

				this.engineCounts.put(eventName, count);
			}

			if (!this.primed)
				logger.finer(format("Event subscription %d primed with counts %s", getHandle(), this.engineCounts));

			this.primed = true;

			try {
				register();
			} catch (Exception e) {
				logger.log(WARNING, format("Unable to re-register event subscription %d; no further events will be delivered", getHandle()), e);
			}

			if (batch.size() > 0) {
				for (Map.Entry<String, Long> entry : batch.entrySet())
					this.deliveredCounts.merge(entry.getKey(), entry.getValue(), Long::sum);

				this.pendingBatches.offer(Collections.unmodifiableMap(batch));
			}
		}
	}

	@GuardedBy("lock")
	private void register() throws EngineException {
		long generation = ++this.registrationGeneration;
		this.registration = null;

		EngineEventRegistration registration = getAttachment().getEngineAttachment().queueEvents(new LinkedHashMap<>(this.engineCounts), this::onEvents);

		// A listener fired from inside queueEvents has already registered again; this registration is spent
		if (this.registrationGeneration == generation)
			this.registration = registration;
	}

	private void dispatch() {
		while (true) {
			Map<String, Long> batch;

			try {
				batch = this.pendingBatches.take();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return;
			}

			if (batch == STOP_DISPATCHING || isCancelled())
				return;

			try {
				getEventHandler().handle(batch);
			} catch (Throwable t) {
				logger.log(WARNING, format("Event handler for subscription %d failed", getHandle()), t);
			}
		}
	}

	private boolean stopDispatching() {
		if (!this.cancelled.compareAndSet(false, true))
			return false;

		this.pendingBatches.offer(STOP_DISPATCHING);
		return true;
	}

	private void cancelRegistrationQuietly() {
		try {
			releaseEngineResources();
		} catch (EngineException e) {
			logger.log(WARNING, format("Unable to cancel engine registration for event subscription %d", getHandle()), e);
		}
	}

	@Override
	void invalidate() {
		stopDispatching();
		super.invalidate();
	}

	@Override
	void releaseEngineResources() throws EngineException {
		EngineEventRegistration registration;

		synchronized (this.lock) {
			registration = this.registration;
			this.registration = null;
		}

		if (registration != null)
			registration.cancel();
	}

	@NonNull
	EventHandler getEventHandler() {
		return this.eventHandler;
	}
}
