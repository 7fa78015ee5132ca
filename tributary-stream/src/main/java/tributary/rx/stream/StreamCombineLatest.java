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

package tributary.rx.stream;

import java.util.Arrays;
import java.util.Iterator;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicLongFieldUpdater;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tributary.core.error.Exceptions;
import tributary.core.subscription.CancelledSubscription;
import tributary.core.support.BackpressureUtils;
import tributary.core.support.ReactiveState;
import tributary.fn.BiFunction;
import tributary.rx.Stream;

/**
 * Combines the latest value of two sources each time either of them emits, once both have emitted at least once.
 * <p>
 * Completes when both sources have completed, or as soon as one source completes without ever emitting. The first
 * error from either source cancels the other one and is relayed.
 *
 * @param <T> the first source value type
 * @param <U> the second source value type
 * @param <R> the combined value type
 * @author Stephane Maldini
 */
public final class StreamCombineLatest<T, U, R> extends Stream<R>
		implements ReactiveState.Factory, ReactiveState.LinkedUpstreams {

	static final Logger log = LoggerFactory.getLogger(StreamCombineLatest.class);

	final Publisher<? extends T> first;

	final Publisher<? extends U> second;

	final BiFunction<? super T, ? super U, ? extends R> combiner;

	public StreamCombineLatest(Publisher<? extends T> first,
			Publisher<? extends U> second,
			BiFunction<? super T, ? super U, ? extends R> combiner) {
		this.first = Objects.requireNonNull(first, "first");
		this.second = Objects.requireNonNull(second, "second");
		this.combiner = Objects.requireNonNull(combiner, "combiner");
	}

	@Override
	public Iterator<?> upstreams() {
		return Arrays.asList(first, second).iterator();
	}

	@Override
	public long upstreamsCount() {
		return 2L;
	}

	@Override
	public void subscribe(Subscriber<? super R> s) {
		CombineLatestCoordinator<T, U, R> coordinator = new CombineLatestCoordinator<>(s, combiner);

		s.onSubscribe(coordinator);

		coordinator.subscribe(first, second);
	}

	static final class CombineLatestCoordinator<T, U, R>
			implements Subscription, LinkedUpstreams, ActiveDownstream, DownstreamDemand {

		final Subscriber<? super R> actual;

		final BiFunction<? super T, ? super U, ? extends R> combiner;

		final CombineLatestInner<T> firstInner;

		final CombineLatestInner<U> secondInner;

		final Queue<Object[]> queue = new ConcurrentLinkedQueue<>();

		Object firstLatest;

		Object secondLatest;

		int completedWithValue;

		volatile boolean cancelled;

		volatile boolean done;

		volatile long requested;
		@SuppressWarnings("rawtypes")
		static final AtomicLongFieldUpdater<CombineLatestCoordinator> REQUESTED =
				AtomicLongFieldUpdater.newUpdater(CombineLatestCoordinator.class, "requested");

		volatile int wip;
		@SuppressWarnings("rawtypes")
		static final AtomicIntegerFieldUpdater<CombineLatestCoordinator> WIP =
				AtomicIntegerFieldUpdater.newUpdater(CombineLatestCoordinator.class, "wip");

		volatile Throwable error;
		@SuppressWarnings("rawtypes")
		static final AtomicReferenceFieldUpdater<CombineLatestCoordinator, Throwable> ERROR =
				AtomicReferenceFieldUpdater.newUpdater(CombineLatestCoordinator.class, Throwable.class, "error");

		CombineLatestCoordinator(Subscriber<? super R> actual,
				BiFunction<? super T, ? super U, ? extends R> combiner) {
			this.actual = actual;
			this.combiner = combiner;
			this.firstInner = new CombineLatestInner<>(this, 0);
			this.secondInner = new CombineLatestInner<>(this, 1);
		}

		void subscribe(Publisher<? extends T> first, Publisher<? extends U> second) {
			first.subscribe(firstInner);
			if (done || cancelled) {
				return;
			}
			second.subscribe(secondInner);
		}

		@Override
		public void request(long n) {
			if (BackpressureUtils.validate(n)) {
				BackpressureUtils.getAndAdd(REQUESTED, this, n);
				drain();
			}
		}

		@Override
		public void cancel() {
			if (!cancelled) {
				cancelled = true;
				if (WIP.getAndIncrement(this) == 0) {
					queue.clear();
					cancelAll();
				}
			}
		}

		void cancelAll() {
			firstInner.cancel();
			secondInner.cancel();
		}

		void innerValue(int index, Object value) {
			synchronized (this) {
				if (index == 0) {
					firstLatest = value;
				}
				else {
					secondLatest = value;
				}
				if (firstLatest == null || secondLatest == null) {
					return;
				}
				queue.offer(new Object[]{firstLatest, secondLatest});
			}
			drain();
		}

		void innerComplete(int index) {
			synchronized (this) {
				Object latest = index == 0 ? firstLatest : secondLatest;
				if (latest != null && ++completedWithValue < 2) {
					return;
				}
				done = true;
			}
			drain();
		}

		void innerError(Throwable e) {
			if (cancelled || !ERROR.compareAndSet(this, null, e)) {
				Exceptions.onErrorDropped(e);
				return;
			}
			done = true;
			drain();
		}

		@SuppressWarnings("unchecked")
		void drain() {
			if (WIP.getAndIncrement(this) != 0) {
				return;
			}

			final Subscriber<? super R> a = actual;
			final Queue<Object[]> q = queue;

			int missed = 1;

			for (; ; ) {

				long r = requested;
				long e = 0L;

				while (e != r) {
					boolean d = done;

					Object[] v = q.poll();

					boolean empty = v == null;

					if (checkTerminated(d, empty, a, q)) {
						return;
					}

					if (empty) {
						break;
					}

					R w;

					try {
						w = combiner.apply((T) v[0], (U) v[1]);
					}
					catch (Throwable ex) {
						Exceptions.throwIfFatal(ex);
						innerError(Exceptions.addValueAsLastCause(ex, v[0]));
						continue;
					}

					if (w == null) {
						innerError(new NullPointerException("The combiner returned a null value"));
						continue;
					}

					a.onNext(w);

					e++;
				}

				if (e == r) {
					if (checkTerminated(done, q.isEmpty(), a, q)) {
						return;
					}
				}

				if (e != 0L && r != Long.MAX_VALUE) {
					REQUESTED.addAndGet(this, -e);
				}

				missed = WIP.addAndGet(this, -missed);
				if (missed == 0) {
					break;
				}
			}
		}

		boolean checkTerminated(boolean d, boolean empty, Subscriber<?> a, Queue<Object[]> q) {
			if (cancelled) {
				q.clear();
				cancelAll();
				return true;
			}

			if (d) {
				Throwable e = error;

				if (e != null) {
					q.clear();
					cancelled = true;
					cancelAll();
					a.onError(e);
					return true;
				}
				else if (empty) {
					cancelled = true;
					cancelAll();
					a.onComplete();
					return true;
				}
			}
			return false;
		}

		@Override
		public boolean isCancelled() {
			return cancelled;
		}

		@Override
		public long requestedFromDownstream() {
			return requested;
		}

		@Override
		public Iterator<?> upstreams() {
			return Arrays.asList(firstInner, secondInner).iterator();
		}

		@Override
		public long upstreamsCount() {
			return 2L;
		}
	}

	static final class CombineLatestInner<T> implements Subscriber<T>, Upstream, Downstream {

		final CombineLatestCoordinator<?, ?, ?> parent;

		final int index;

		volatile Subscription s;
		@SuppressWarnings("rawtypes")
		static final AtomicReferenceFieldUpdater<CombineLatestInner, Subscription> S =
				AtomicReferenceFieldUpdater.newUpdater(CombineLatestInner.class, Subscription.class, "s");

		CombineLatestInner(CombineLatestCoordinator<?, ?, ?> parent, int index) {
			this.parent = parent;
			this.index = index;
		}

		@Override
		public void onSubscribe(Subscription s) {
			if (!S.compareAndSet(this, null, s)) {
				s.cancel();
				if (this.s != CancelledSubscription.INSTANCE) {
					BackpressureUtils.reportSubscriptionSet();
				}
				return;
			}
			s.request(Long.MAX_VALUE);
		}

		@Override
		public void onNext(T t) {
			parent.innerValue(index, t);
		}

		@Override
		public void onError(Throwable t) {
			parent.innerError(t);
		}

		@Override
		public void onComplete() {
			parent.innerComplete(index);
		}

		void cancel() {
			Subscription a = s;
			if (a != CancelledSubscription.INSTANCE) {
				a = S.getAndSet(this, CancelledSubscription.INSTANCE);
				if (a != null && a != CancelledSubscription.INSTANCE) {
					if (TRACE_CANCEL) {
						log.debug("cancel source #{}", index);
					}
					a.cancel();
				}
			}
		}

		@Override
		public Object upstream() {
			return s;
		}

		@Override
		public Object downstream() {
			return parent;
		}
	}
}
