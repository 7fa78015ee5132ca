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

package tributary.rx.broadcast;

import java.util.Iterator;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLongFieldUpdater;

import org.reactivestreams.Processor;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import tributary.core.error.Exceptions;
import tributary.core.error.SpecificationExceptions;
import tributary.core.subscription.EmptySubscription;
import tributary.core.support.BackpressureUtils;
import tributary.core.support.ReactiveState;
import tributary.rx.Stream;

/**
 * A hot {@link Stream} relaying the signals given to its {@link Subscriber} side to every current subscriber. Late
 * subscribers only see signals emitted after they subscribed, or the terminal signal if already terminated. A value
 * is dropped for a subscriber without outstanding demand.
 * <p>
 * Signals must be emitted serially, as required of any {@link Subscriber}.
 *
 * @param <O> the type of values passing through the {@literal Broadcaster}
 * @author Stephane Maldini
 */
public class Broadcaster<O> extends Stream<O>
		implements Processor<O, O>, ReactiveState.LinkedDownstreams, ReactiveState.ActiveUpstream {

	/**
	 * Build a {@literal Broadcaster}, ready to broadcast values with {@link Broadcaster#onNext(Object)}, {@link
	 * Broadcaster#onError(Throwable)}, {@link Broadcaster#onComplete()}. Values broadcasted are directly consumable by
	 * subscribing to the returned instance.
	 *
	 * @param <T> the type of values passing through the {@literal Broadcaster}
	 * @return a new {@link Broadcaster}
	 */
	public static <T> Broadcaster<T> create() {
		return new Broadcaster<>();
	}

	final CopyOnWriteArrayList<BroadcastSubscription<O>> subscribers = new CopyOnWriteArrayList<>();

	volatile boolean   done;
	volatile Throwable error;

	protected Broadcaster() {
	}

	@Override
	public void subscribe(Subscriber<? super O> s) {
		if (s == null) {
			throw SpecificationExceptions.spec_2_13_exception();
		}
		BroadcastSubscription<O> bs = new BroadcastSubscription<>(this, s);
		subscribers.add(bs);
		s.onSubscribe(bs);

		if (done && subscribers.remove(bs) && !bs.cancelled) {
			Throwable e = error;
			if (e != null) {
				s.onError(e);
			}
			else {
				s.onComplete();
			}
		}
	}

	@Override
	public void onSubscribe(Subscription s) {
		if (done) {
			s.cancel();
		}
		else {
			s.request(Long.MAX_VALUE);
		}
	}

	@Override
	public void onNext(O o) {
		if (o == null) {
			throw SpecificationExceptions.spec_2_13_exception();
		}
		if (done) {
			Exceptions.onNextDropped(o);
			return;
		}
		for (BroadcastSubscription<O> bs : subscribers) {
			bs.onNext(o);
		}
	}

	@Override
	public void onError(Throwable t) {
		if (t == null) {
			throw SpecificationExceptions.spec_2_13_exception();
		}
		if (done) {
			Exceptions.onErrorDropped(t);
			return;
		}
		error = t;
		done = true;
		for (BroadcastSubscription<O> bs : subscribers) {
			if (subscribers.remove(bs) && !bs.cancelled) {
				bs.actual.onError(t);
			}
		}
	}

	@Override
	public void onComplete() {
		if (done) {
			return;
		}
		done = true;
		for (BroadcastSubscription<O> bs : subscribers) {
			if (subscribers.remove(bs) && !bs.cancelled) {
				bs.actual.onComplete();
			}
		}
	}

	/**
	 * @return true if at least one subscriber is currently attached
	 */
	public boolean hasSubscribers() {
		return !subscribers.isEmpty();
	}

	@Override
	public Iterator<?> downstreams() {
		return subscribers.iterator();
	}

	@Override
	public long downstreamsCount() {
		return subscribers.size();
	}

	@Override
	public boolean isStarted() {
		return !done;
	}

	@Override
	public boolean isTerminated() {
		return done;
	}

	static final class BroadcastSubscription<O> implements Subscription, Downstream, DownstreamDemand,
	                                                       ActiveDownstream {

		final Broadcaster<O>        parent;
		final Subscriber<? super O> actual;

		volatile boolean cancelled;

		volatile long requested;
		@SuppressWarnings("rawtypes")
		static final AtomicLongFieldUpdater<BroadcastSubscription> REQUESTED =
				AtomicLongFieldUpdater.newUpdater(BroadcastSubscription.class, "requested");

		BroadcastSubscription(Broadcaster<O> parent, Subscriber<? super O> actual) {
			this.parent = parent;
			this.actual = actual;
		}

		void onNext(O o) {
			if (cancelled) {
				return;
			}
			if (requested == 0L) {
				Exceptions.onNextDropped(o);
				return;
			}
			actual.onNext(o);
			BackpressureUtils.produced(REQUESTED, this, 1L);
		}

		@Override
		public void request(long n) {
			if (BackpressureUtils.validate(n)) {
				BackpressureUtils.getAndAdd(REQUESTED, this, n);
			}
		}

		@Override
		public void cancel() {
			if (!cancelled) {
				cancelled = true;
				parent.subscribers.remove(this);
			}
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
