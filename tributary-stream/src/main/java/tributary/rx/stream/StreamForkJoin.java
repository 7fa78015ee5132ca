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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tributary.core.error.Exceptions;
import tributary.core.subscription.CancelledSubscription;
import tributary.core.subscription.DeferredScalarSubscription;
import tributary.core.support.Assert;
import tributary.core.support.BackpressureUtils;
import tributary.core.support.ReactiveState;
import tributary.rx.Stream;

/**
 * Waits for the last value of every source and emits them once, as a list ordered like the sources, then completes.
 * <p>
 * All sources are subscribed when this stream is subscribed. The position of a value in the emitted list is the
 * position of its source, whatever the order in which sources complete. The first source error is relayed at once and
 * cancels the other sources.
 * <p>
 * A source completing without any value leaves its slot empty forever: the stream then never emits nor completes.
 * Callers needing a bounded wait must apply their own timeout downstream.
 *
 * @param <T> the common value type of the sources
 */
public final class StreamForkJoin<T> extends Stream<List<T>>
		implements ReactiveState.Factory, ReactiveState.LinkedUpstreams {

	static final Logger log = LoggerFactory.getLogger(StreamForkJoin.class);

	final List<Publisher<? extends T>> sources;

	public StreamForkJoin(List<? extends Publisher<? extends T>> sources) {
		Objects.requireNonNull(sources, "sources");
		Assert.isTrue(!sources.isEmpty(), "forkJoin requires at least one source");
		List<Publisher<? extends T>> copy = new ArrayList<>(sources.size());
		for (Publisher<? extends T> source : sources) {
			copy.add(Objects.requireNonNull(source, "The sources list contains a null Publisher"));
		}
		this.sources = Collections.unmodifiableList(copy);
	}

	@Override
	public Iterator<?> upstreams() {
		return sources.iterator();
	}

	@Override
	public long upstreamsCount() {
		return sources.size();
	}

	@Override
	public void subscribe(Subscriber<? super List<T>> s) {
		ForkJoinCoordinator<T> coordinator = new ForkJoinCoordinator<>(s, sources.size());

		s.onSubscribe(coordinator);

		coordinator.subscribe(sources);
	}

	@Override
	public String toString() {
		return "{forkJoin: " + sources.size() + " sources}";
	}

	static final class ForkJoinCoordinator<T> extends DeferredScalarSubscription<List<T>>
			implements LinkedUpstreams {

		final ForkJoinInner<T>[] subscribers;

		final Object[] results;

		int count;

		boolean terminated;

		@SuppressWarnings("unchecked")
		ForkJoinCoordinator(Subscriber<? super List<T>> actual, int n) {
			super(actual);
			ForkJoinInner<T>[] a = new ForkJoinInner[n];
			for (int i = 0; i < n; i++) {
				a[i] = new ForkJoinInner<>(this, i);
			}
			this.subscribers = a;
			this.results = new Object[n];
		}

		void subscribe(List<Publisher<? extends T>> sources) {
			ForkJoinInner<T>[] a = subscribers;
			for (int i = 0; i < a.length; i++) {
				if (isCancelled() || isTerminated()) {
					return;
				}
				new StreamLast<T>(sources.get(i)).subscribe(a[i]);
			}
		}

		@SuppressWarnings("unchecked")
		void innerValue(int index, T value) {
			List<T> list;
			synchronized (this) {
				if (terminated || results[index] != null) {
					return;
				}
				results[index] = value;
				if (++count != results.length) {
					return;
				}
				terminated = true;
				list = Collections.unmodifiableList(Arrays.asList((T[]) results.clone()));
			}
			complete(list);
		}

		void innerEmpty(int index) {
			if (log.isDebugEnabled()) {
				log.debug("Source #{} completed without a value, forkJoin will not emit", index);
			}
		}

		void innerError(Throwable e) {
			synchronized (this) {
				if (terminated) {
					Exceptions.onErrorDropped(e);
					return;
				}
				terminated = true;
			}
			cancelAll();
			if (!isCancelled()) {
				subscriber.onError(e);
			}
		}

		synchronized boolean isTerminated() {
			return terminated;
		}

		@Override
		public void cancel() {
			super.cancel();
			cancelAll();
		}

		void cancelAll() {
			for (ForkJoinInner<T> inner : subscribers) {
				inner.cancel();
			}
		}

		@Override
		public Iterator<?> upstreams() {
			return Arrays.asList(subscribers).iterator();
		}

		@Override
		public long upstreamsCount() {
			return subscribers.length;
		}
	}

	static final class ForkJoinInner<T> implements Subscriber<T>, Upstream, Downstream, ActiveUpstream {

		final ForkJoinCoordinator<T> parent;

		final int index;

		boolean hasValue;

		volatile boolean done;

		volatile Subscription s;
		@SuppressWarnings("rawtypes")
		static final AtomicReferenceFieldUpdater<ForkJoinInner, Subscription> S =
				AtomicReferenceFieldUpdater.newUpdater(ForkJoinInner.class, Subscription.class, "s");

		ForkJoinInner(ForkJoinCoordinator<T> parent, int index) {
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
			if (done) {
				Exceptions.onNextDropped(t);
				return;
			}
			hasValue = true;
			parent.innerValue(index, t);
		}

		@Override
		public void onError(Throwable t) {
			if (done) {
				Exceptions.onErrorDropped(t);
				return;
			}
			done = true;
			parent.innerError(t);
		}

		@Override
		public void onComplete() {
			if (done) {
				return;
			}
			done = true;
			if (!hasValue) {
				parent.innerEmpty(index);
			}
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
		public boolean isStarted() {
			return s != null && !done;
		}

		@Override
		public boolean isTerminated() {
			return done;
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
