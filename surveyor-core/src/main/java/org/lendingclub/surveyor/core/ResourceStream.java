/**
 * Copyright 2017-2018 LendingClub, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.lendingclub.surveyor.core;

import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.google.common.collect.Streams;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Single-pass sequence of resources, yielded service by service as each service
 * finishes scanning.
 * <p>
 * At most <code>max_concurrent_services</code> services are scanned at once; the
 * next one is launched only when a running one completes. Closing the stream
 * interrupts running scans and discards whatever they would have produced; the
 * services that did not finish are recorded as cancelled in the diagnostics.
 */
public class ResourceStream extends AbstractIterator<Resource> implements Iterable<Resource>, Closeable {

	static final long POLL_MILLIS = 100;

	Logger logger = LoggerFactory.getLogger(getClass());

	private final Deque<RegionScanner> pending;
	private final Function<RegionScanner, ServiceScanConductor> conductorFactory;
	private final List<String> regions;
	private final int concurrency;
	private final int total;
	private final ScanListener listener;
	private final ScanDiagnostics diagnostics;

	private final AtomicBoolean iterated = new AtomicBoolean(false);
	private volatile boolean closed = false;

	private volatile ThreadPoolExecutor pool;
	private CompletionService<ServiceScanResult> completionService;
	private final Map<Future<ServiceScanResult>, String> inFlight = Maps.newHashMap();
	private final Map<String, Stopwatch> timers = Maps.newHashMap();
	private final Set<String> unfinished = Sets.newConcurrentHashSet();
	private final Stopwatch runTimer = Stopwatch.createUnstarted();
	private Iterator<Resource> current = Collections.emptyIterator();
	private int completed = 0;

	ResourceStream(List<RegionScanner> scanners, List<String> regions,
			Function<RegionScanner, ServiceScanConductor> conductorFactory, int concurrency, ScanListener listener,
			ScanDiagnostics diagnostics) {
		this.pending = new ArrayDeque<>(scanners);
		this.total = scanners.size();
		this.regions = regions;
		this.conductorFactory = conductorFactory;
		this.concurrency = Math.max(1, Math.min(concurrency, scanners.size()));
		this.listener = listener;
		this.diagnostics = diagnostics;
		scanners.forEach(scanner -> unfinished.add(scanner.getServiceName()));
	}

	@Override
	public Iterator<Resource> iterator() {
		if (!iterated.compareAndSet(false, true)) {
			throw new IllegalStateException("resource stream can only be iterated once");
		}
		return this;
	}

	/**
	 * The same resources as a {@link Stream}. Closing the returned stream closes this one.
	 */
	public Stream<Resource> toStream() {
		return Streams.stream(iterator()).onClose(this::close);
	}

	public ScanDiagnostics getDiagnostics() {
		return diagnostics;
	}

	public boolean isClosed() {
		return closed;
	}

	/**
	 * True if the stream was closed or interrupted before every service finished.
	 */
	public boolean isCancelled() {
		return diagnostics.isCancelled();
	}

	@Override
	protected Resource computeNext() {
		while (true) {
			if (closed) {
				recordUnfinishedAsCancelled();
				return endOfData();
			}
			if (current.hasNext()) {
				return current.next();
			}
			if (Thread.currentThread().isInterrupted()) {
				close();
				throw new ScanCancelledException("resource stream interrupted");
			}
			if (pool == null) {
				start();
			}
			if (inFlight.isEmpty()) {
				shutdown();
				logger.info("all {} services completed", total);
				return endOfData();
			}
			Future<ServiceScanResult> future = awaitNext();
			if (future == null || closed) {
				recordUnfinishedAsCancelled();
				return endOfData();
			}
			String service = inFlight.remove(future);
			submitNext();
			current = complete(service, future).iterator();
		}
	}

	private void start() {
		runTimer.start();
		pool = new ThreadPoolExecutor(concurrency, concurrency, 0L, TimeUnit.MILLISECONDS,
				new LinkedBlockingQueue<Runnable>(),
				new ThreadFactoryBuilder().setDaemon(true).setNameFormat("service-scanner-%d").build());
		completionService = new ExecutorCompletionService<>(pool);
		for (int i = 0; i < concurrency; i++) {
			submitNext();
		}
	}

	private void submitNext() {
		RegionScanner scanner = pending.poll();
		if (scanner == null || closed) {
			return;
		}
		ServiceScanConductor conductor = conductorFactory.apply(scanner);
		Future<ServiceScanResult> future;
		try {
			future = completionService.submit(() -> conductor.scan(regions));
		} catch (RejectedExecutionException e) {
			// the pool was shut down by a concurrent close()
			logger.debug("not launching {}: stream closed", scanner.getServiceName());
			close();
			return;
		}
		timers.put(scanner.getServiceName(), Stopwatch.createStarted());
		inFlight.put(future, scanner.getServiceName());
	}

	private Future<ServiceScanResult> awaitNext() {
		try {
			Future<ServiceScanResult> future = null;
			while (future == null) {
				if (closed) {
					return null;
				}
				future = completionService.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
			}
			return future;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			close();
			throw new ScanCancelledException("resource stream interrupted", e);
		}
	}

	private List<Resource> complete(String service, Future<ServiceScanResult> future) {
		Stopwatch sw = timers.remove(service);
		try {
			ServiceScanResult result = future.get();
			diagnostics.recordService(result, sw.elapsed());
			unfinished.remove(service);
			listener.serviceCompleted(service, ++completed, total, result.getResourceCount());
			return result.getResources();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			close();
			throw new ScanCancelledException("resource stream interrupted", e);
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (closed || ErrorClassifier.isCancellation(cause)) {
				logger.info("scan of {} was cancelled", service);
				diagnostics.recordServiceCancelled(service, sw.elapsed());
				unfinished.remove(service);
				return Collections.emptyList();
			}
			logger.error("scan of {} failed; counting it as zero resources", service, cause);
			diagnostics.recordServiceFailure(service, cause, sw.elapsed());
			unfinished.remove(service);
			listener.serviceFailed(service, cause);
			listener.serviceCompleted(service, ++completed, total, 0);
			return Collections.emptyList();
		}
	}

	private void shutdown() {
		if (pool != null) {
			pool.shutdownNow();
		}
	}

	/**
	 * Stops launching services and interrupts the ones that are running. Safe to
	 * call from any thread, and more than once.
	 */
	@Override
	public void close() {
		if (closed) {
			return;
		}
		closed = true;
		if (completed < total) {
			logger.info("resource stream closed with {} of {} services completed", completed, total);
		}
		shutdown();
		recordUnfinishedAsCancelled();
	}

	// called by both the closing thread and the consumer; the first record wins
	private void recordUnfinishedAsCancelled() {
		Duration elapsed = runTimer.isRunning() ? runTimer.elapsed() : Duration.ZERO;
		for (String service : unfinished) {
			diagnostics.recordServiceCancelled(service, elapsed);
		}
	}
}
