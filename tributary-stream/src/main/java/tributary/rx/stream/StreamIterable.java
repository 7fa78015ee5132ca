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

import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLongFieldUpdater;

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import tributary.core.error.Exceptions;
import tributary.core.subscription.EmptySubscription;
import tributary.core.support.BackpressureUtils;
import tributary.core.support.ReactiveState;
import tributary.rx.Stream;

/**
 * Emits the elements of an {@link Iterable}, on demand, then completes. Each subscriber gets a fresh iterator.
 *
 * @param <T> the value type
 */
public final class StreamIterable<T> extends Stream<T> implements ReactiveState.Factory {

	final Iterable<? extends T> iterable;

	public StreamIterable(Iterable<? extends T> iterable) {
		this.iterable = Objects.requireNonNull(iterable, "iterable");
	}

	@Override
	public void subscribe(Subscriber<? super T> s) {
		Iterator<? extends T> it;

		try {
			it = iterable.iterator();
		}
		catch (Throwable e) {
			Exceptions.throwIfFatal(e);
			EmptySubscription.error(s, e);
			return;
		}

		if (it == null) {
			EmptySubscription.error(s, new NullPointerException("The iterator returned is null"));
			return;
		}

		boolean b;

		try {
			b = it.hasNext();
		}
		catch (Throwable e) {
			Exceptions.throwIfFatal(e);
			EmptySubscription.error(s, e);
			return;
		}

		if (!b) {
			EmptySubscription.complete(s);
			return;
		}

		s.onSubscribe(new IterableSubscription<>(s, it));
	}

	@Override
	public String toString() {
		return "{iterable: " + iterable + "}";
	}

	static final class IterableSubscription<T> implements Subscription, Downstream, DownstreamDemand,
	                                                      ActiveDownstream {

		final Subscriber<? super T> actual;

		final Iterator<? extends T> iterator;

		volatile boolean cancelled;

		volatile long requested;
		@SuppressWarnings("rawtypes")
		static final AtomicLongFieldUpdater<IterableSubscription> REQUESTED =
				AtomicLongFieldUpdater.newUpdater(IterableSubscription.class, "requested");

		IterableSubscription(Subscriber<? super T> actual, Iterator<? extends T> iterator) {
			this.actual = actual;
			this.iterator = iterator;
		}

		@Override
		public void request(long n) {
			if (BackpressureUtils.validate(n)) {
				if (BackpressureUtils.getAndAdd(REQUESTED, this, n) == 0) {
					drain(n);
				}
			}
		}

		void drain(long n) {
			final Subscriber<? super T> a = actual;
			final Iterator<? extends T> it = iterator;

			long e = 0L;

			for (; ; ) {

				while (e != n) {
					if (cancelled) {
						return;
					}

					T t;

					try {
						t = it.next();
					}
					catch (Throwable ex) {
						Exceptions.throwIfFatal(ex);
						a.onError(ex);
						return;
					}

					if (t == null) {
						a.onError(new NullPointerException("The iterator returned a null value"));
						return;
					}

					a.onNext(t);

					if (cancelled) {
						return;
					}

					boolean b;

					try {
						b = it.hasNext();
					}
					catch (Throwable ex) {
						Exceptions.throwIfFatal(ex);
						a.onError(ex);
						return;
					}

					if (!b) {
						a.onComplete();
						return;
					}

					e++;
				}

				n = requested;

				if (n == e) {
					n = REQUESTED.addAndGet(this, -e);
					if (n == 0L) {
						return;
					}
					e = 0L;
				}
			}
		}

		@Override
		public void cancel() {
			cancelled = true;
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
		public Object downstream() {
			return actual;
		}
	}
}
