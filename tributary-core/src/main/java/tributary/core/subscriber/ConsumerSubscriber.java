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

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import tributary.core.error.Exceptions;
import tributary.core.error.SpecificationExceptions;
import tributary.core.error.TributaryFatalException;
import tributary.core.support.BackpressureUtils;
import tributary.core.support.ReactiveState;
import tributary.fn.Consumer;

/**
 * A Subscriber requesting unbounded demand and forwarding each signal to the matching callback.
 *
 * @param <T> the consumed value type
 * @author Stephane Maldini
 */
public class ConsumerSubscriber<T> implements Subscriber<T>, ReactiveState.Upstream, ReactiveState.ActiveUpstream {

	private final Consumer<? super T>         consumer;
	private final Consumer<? super Throwable> errorConsumer;
	private final Consumer<Void>              completeConsumer;

	private volatile Subscription subscription;
	private volatile boolean      terminated;

	public ConsumerSubscriber() {
		this(null, null, null);
	}

	public ConsumerSubscriber(Consumer<? super T> consumer,
			Consumer<? super Throwable> errorConsumer,
			Consumer<Void> completeConsumer) {
		this.consumer = consumer;
		this.errorConsumer = errorConsumer;
		this.completeConsumer = completeConsumer;
	}

	protected void doSubscribe(Subscription s) {
		s.request(Long.MAX_VALUE);
	}

	@Override
	public final void onSubscribe(Subscription s) {
		if (BackpressureUtils.validate(subscription, s)) {
			this.subscription = s;
			try {
				doSubscribe(s);
			}
			catch (Throwable t) {
				Exceptions.throwIfFatal(t);
				s.cancel();
				onError(t);
			}
		}
	}

	@Override
	public final void onNext(T x) {
		if (x == null) {
			throw SpecificationExceptions.spec_2_13_exception();
		}
		if (terminated) {
			Exceptions.onNextDropped(x);
			return;
		}
		try {
			doNext(x);
		}
		catch (Throwable t) {
			Exceptions.throwIfFatal(t);
			Subscription s = subscription;
			if (s != null) {
				s.cancel();
			}
			onError(Exceptions.addValueAsLastCause(t, x));
		}
	}

	protected void doNext(T x) {
		if (consumer != null) {
			consumer.accept(x);
		}
	}

	@Override
	public final void onError(Throwable t) {
		if (t == null) {
			throw SpecificationExceptions.spec_2_13_exception();
		}
		if (terminated) {
			Exceptions.onErrorDropped(t);
			return;
		}
		terminated = true;
		doError(t);
	}

	protected void doError(Throwable t) {
		if (errorConsumer != null) {
			errorConsumer.accept(t);
		}
		else {
			throw TributaryFatalException.create(t);
		}
	}

	@Override
	public final void onComplete() {
		if (terminated) {
			return;
		}
		terminated = true;
		try {
			doComplete();
		}
		catch (Throwable t) {
			Exceptions.throwIfFatal(t);
			doError(t);
		}
	}

	protected void doComplete() {
		if (completeConsumer != null) {
			completeConsumer.accept(null);
		}
	}

	/**
	 * Stop consuming signals from upstream.
	 */
	public void cancel() {
		Subscription s = subscription;
		if (s != null) {
			terminated = true;
			s.cancel();
		}
	}

	@Override
	public boolean isStarted() {
		return subscription != null;
	}

	@Override
	public boolean isTerminated() {
		return terminated;
	}

	@Override
	public Object upstream() {
		return subscription;
	}
}
