/*
 * Copyright (c) 2011-2016 Pivotal Software Inc., Inc. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package tributary.core.subscriber;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicLongFieldUpdater;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import tributary.core.subscription.CancelledSubscription;
import tributary.core.support.BackpressureUtils;
import tributary.core.support.ReactiveState;
import tributary.fn.Supplier;

/**
 * A Subscriber recording every signal it receives, with assertion helpers for tests. Demand is unbounded unless an
 * initial request is given, in which case more can be asked with {@link #request(long)}.
 *
 * @param <T> the value type
 * @author Anatoly Kadyshev
 * @author Stephane Maldini
 */
public class TestSubscriber<T> implements Subscriber<T>, Subscription, ReactiveState.ActiveDownstream {

	/**
	 * @param <T> the value type
	 * @return a new subscriber requesting unbounded demand on subscribe
	 */
	public static <T> TestSubscriber<T> create() {
		return new TestSubscriber<>(Long.MAX_VALUE);
	}

	/**
	 * @param initialRequest the demand sent on subscribe, zero for none
	 * @param <T> the value type
	 * @return a new subscriber
	 */
	public static <T> TestSubscriber<T> create(long initialRequest) {
		return new TestSubscriber<>(initialRequest);
	}

	/**
	 * Block until the condition is true or the timeout elapses.
	 *
	 * @param timeoutMillis the maximum wait
	 * @param errorMessageSupplier the failure message
	 * @param conditionSupplier the condition to poll
	 * @throws InterruptedException if interrupted while waiting
	 */
	public static void waitFor(long timeoutMillis,
			Supplier<String> errorMessageSupplier,
			Supplier<Boolean> conditionSupplier) throws InterruptedException {
		long timeoutNs = TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
		long startTime = System.nanoTime();
		do {
			if (conditionSupplier.get()) {
				return;
			}
			Thread.sleep(10);
		}
		while (System.nanoTime() - startTime < timeoutNs);
		throw new AssertionError(errorMessageSupplier.get());
	}

	private final List<T> values = new ArrayList<>();

	private final List<Throwable> errors = new ArrayList<>();

	private final CountDownLatch terminated = new CountDownLatch(1);

	private final long initialRequest;

	private volatile int completions;
	@SuppressWarnings("rawtypes")
	static final AtomicIntegerFieldUpdater<TestSubscriber> COMPLETIONS =
			AtomicIntegerFieldUpdater.newUpdater(TestSubscriber.class, "completions");

	private volatile long missedRequested;
	@SuppressWarnings("rawtypes")
	static final AtomicLongFieldUpdater<TestSubscriber> MISSED_REQUESTED =
			AtomicLongFieldUpdater.newUpdater(TestSubscriber.class, "missedRequested");

	private volatile Subscription subscription;
	@SuppressWarnings("rawtypes")
	static final AtomicReferenceFieldUpdater<TestSubscriber, Subscription> SUBSCRIPTION =
			AtomicReferenceFieldUpdater.newUpdater(TestSubscriber.class, Subscription.class, "subscription");

	protected TestSubscriber(long initialRequest) {
		this.initialRequest = initialRequest;
	}

	@Override
	public void onSubscribe(Subscription s) {
		if (!SUBSCRIPTION.compareAndSet(this, null, s)) {
			s.cancel();
			if (subscription != CancelledSubscription.INSTANCE) {
				BackpressureUtils.reportSubscriptionSet();
			}
			return;
		}
		long r = initialRequest;
		long missed = MISSED_REQUESTED.getAndSet(this, 0L);
		if (missed != 0L) {
			r = BackpressureUtils.addOrLongMax(r, missed);
		}
		if (r > 0L) {
			s.request(r);
		}
	}

	@Override
	public void onNext(T t) {
		synchronized (values) {
			values.add(t);
		}
	}

	@Override
	public void onError(Throwable t) {
		synchronized (errors) {
			errors.add(t);
		}
		terminated.countDown();
	}

	@Override
	public void onComplete() {
		COMPLETIONS.incrementAndGet(this);
		terminated.countDown();
	}

	@Override
	public void request(long n) {
		if (BackpressureUtils.validate(n)) {
			Subscription s = subscription;
			if (s != null) {
				s.request(n);
			}
			else {
				BackpressureUtils.getAndAdd(MISSED_REQUESTED, this, n);
				s = subscription;
				if (s != null) {
					long missed = MISSED_REQUESTED.getAndSet(this, 0L);
					if (missed != 0L) {
						s.request(missed);
					}
				}
			}
		}
	}

	@Override
	public void cancel() {
		Subscription s = SUBSCRIPTION.getAndSet(this, CancelledSubscription.INSTANCE);
		if (s != null && s != CancelledSubscription.INSTANCE) {
			s.cancel();
		}
	}

	@Override
	public boolean isCancelled() {
		return subscription == CancelledSubscription.INSTANCE;
	}

	/**
	 * @return a snapshot of the received values
	 */
	public List<T> values() {
		synchronized (values) {
			return new ArrayList<>(values);
		}
	}

	/**
	 * @return a snapshot of the received errors
	 */
	public List<Throwable> errors() {
		synchronized (errors) {
			return new ArrayList<>(errors);
		}
	}

	/**
	 * @return true once onComplete or onError has been received
	 */
	public boolean isTerminated() {
		return terminated.getCount() == 0;
	}

	/**
	 * Block until a terminal signal arrives, for at most the configured default timeout.
	 *
	 * @return this
	 * @throws InterruptedException if interrupted while waiting
	 */
	public TestSubscriber<T> await() throws InterruptedException {
		return await(ReactiveState.DEFAULT_TIMEOUT, TimeUnit.MILLISECONDS);
	}

	/**
	 * Block until a terminal signal arrives.
	 *
	 * @param timeout the maximum wait
	 * @param unit the timeout unit
	 * @return this
	 * @throws InterruptedException if interrupted while waiting
	 */
	public TestSubscriber<T> await(long timeout, TimeUnit unit) throws InterruptedException {
		if (!terminated.await(timeout, unit)) {
			throw new AssertionError(String.format("No terminal signal received within %d %s",
					timeout,
					unit.name().toLowerCase()));
		}
		return this;
	}

	/**
	 * Block until the given number of values has been received.
	 *
	 * @param n the expected count
	 * @return this
	 * @throws InterruptedException if interrupted while waiting
	 */
	public TestSubscriber<T> awaitValueCount(int n) throws InterruptedException {
		waitFor(ReactiveState.DEFAULT_TIMEOUT,
				() -> String.format("%d out of %d values received within %d ms",
						values().size(),
						n,
						ReactiveState.DEFAULT_TIMEOUT),
				() -> values().size() >= n);
		return this;
	}

	@SafeVarargs
	public final TestSubscriber<T> assertValues(T... expected) {
		List<T> actual = values();
		if (!actual.equals(Arrays.asList(expected))) {
			throw new AssertionError(String.format("Expected values %s but received %s",
					Arrays.toString(expected),
					actual));
		}
		return this;
	}

	public final TestSubscriber<T> assertValueCount(int n) {
		int size = values().size();
		if (size != n) {
			throw new AssertionError(String.format("Expected %d values but received %d", n, size));
		}
		return this;
	}

	public final TestSubscriber<T> assertNoValues() {
		return assertValueCount(0);
	}

	public final TestSubscriber<T> assertComplete() {
		int c = completions;
		if (c == 0) {
			throw new AssertionError("Not completed");
		}
		if (c > 1) {
			throw new AssertionError(String.format("Multiple completions: %d", c));
		}
		return this;
	}

	public final TestSubscriber<T> assertNotComplete() {
		if (completions != 0) {
			throw new AssertionError("Completed");
		}
		return this;
	}

	public final TestSubscriber<T> assertNoError() {
		List<Throwable> e = errors();
		if (!e.isEmpty()) {
			AssertionError ae = new AssertionError(String.format("Expected no error but received %s", e));
			ae.initCause(e.get(0));
			throw ae;
		}
		return this;
	}

	public final TestSubscriber<T> assertError(Class<? extends Throwable> type) {
		List<Throwable> e = errors();
		if (e.isEmpty()) {
			throw new AssertionError("No error received");
		}
		if (e.size() > 1) {
			throw new AssertionError(String.format("Multiple errors: %s", e));
		}
		if (!type.isInstance(e.get(0))) {
			AssertionError ae = new AssertionError(String.format("Expected error of type %s but received %s",
					type.getName(),
					e.get(0)));
			ae.initCause(e.get(0));
			throw ae;
		}
		return this;
	}

	public final TestSubscriber<T> assertErrorMessage(String message) {
		List<Throwable> e = errors();
		if (e.size() != 1) {
			throw new AssertionError(String.format("Expected one error but received %s", e));
		}
		if (!message.equals(e.get(0).getMessage())) {
			throw new AssertionError(String.format("Expected error message \"%s\" but received \"%s\"",
					message,
					e.get(0).getMessage()));
		}
		return this;
	}

	public final TestSubscriber<T> assertTerminated() {
		if (!isTerminated()) {
			throw new AssertionError("Not terminated");
		}
		return this;
	}

	public final TestSubscriber<T> assertNotTerminated() {
		if (isTerminated()) {
			throw new AssertionError(String.format("Terminated with %d completions and errors %s",
					completions,
					errors()));
		}
		return this;
	}

	public final TestSubscriber<T> assertSubscribed() {
		if (subscription == null) {
			throw new AssertionError("onSubscribe not received");
		}
		return this;
	}
}
