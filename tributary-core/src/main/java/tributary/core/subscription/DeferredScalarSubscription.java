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

package tributary.core.subscription;

import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import tributary.core.support.BackpressureUtils;
import tributary.core.support.ReactiveState;

/**
 * A Subscription that emits at most one value, computed later, as soon as both the value is known and the downstream
 * has requested. The value is followed by {@code onComplete}.
 *
 * @param <O> the output value type
 * @author David Karnok
 * @author Stephane Maldini
 */
public class DeferredScalarSubscription<O>
		implements Subscription, ReactiveState.Downstream, ReactiveState.ActiveDownstream {

	static final int SDS_NO_REQUEST_NO_VALUE   = 0;
	static final int SDS_NO_REQUEST_HAS_VALUE  = 1;
	static final int SDS_HAS_REQUEST_NO_VALUE  = 2;
	static final int SDS_HAS_REQUEST_HAS_VALUE = 3;
	static final int SDS_CANCELLED             = 4;

	protected final Subscriber<? super O> subscriber;

	protected O value;

	volatile int state;
	@SuppressWarnings("rawtypes")
	static final AtomicIntegerFieldUpdater<DeferredScalarSubscription> STATE =
			AtomicIntegerFieldUpdater.newUpdater(DeferredScalarSubscription.class, "state");

	public DeferredScalarSubscription(Subscriber<? super O> subscriber) {
		this.subscriber = subscriber;
	}

	@Override
	public void request(long n) {
		if (BackpressureUtils.validate(n)) {
			for (; ; ) {
				int s = state;
				if (s == SDS_HAS_REQUEST_NO_VALUE || s == SDS_HAS_REQUEST_HAS_VALUE || s == SDS_CANCELLED) {
					return;
				}
				if (s == SDS_NO_REQUEST_HAS_VALUE) {
					if (STATE.compareAndSet(this, SDS_NO_REQUEST_HAS_VALUE, SDS_HAS_REQUEST_HAS_VALUE)) {
						O v = value;
						value = null;
						subscriber.onNext(v);
						if (state != SDS_CANCELLED) {
							subscriber.onComplete();
						}
					}
					return;
				}
				if (STATE.compareAndSet(this, SDS_NO_REQUEST_NO_VALUE, SDS_HAS_REQUEST_NO_VALUE)) {
					return;
				}
			}
		}
	}

	/**
	 * Emit the given value now if requested or as soon as it is requested, then complete.
	 *
	 * @param v the single value to deliver
	 */
	public final void complete(O v) {
		for (; ; ) {
			int s = state;
			if (s == SDS_NO_REQUEST_HAS_VALUE || s == SDS_HAS_REQUEST_HAS_VALUE || s == SDS_CANCELLED) {
				return;
			}
			if (s == SDS_HAS_REQUEST_NO_VALUE) {
				if (STATE.compareAndSet(this, SDS_HAS_REQUEST_NO_VALUE, SDS_HAS_REQUEST_HAS_VALUE)) {
					subscriber.onNext(v);
					if (state != SDS_CANCELLED) {
						subscriber.onComplete();
					}
				}
				return;
			}
			value = v;
			if (STATE.compareAndSet(this, SDS_NO_REQUEST_NO_VALUE, SDS_NO_REQUEST_HAS_VALUE)) {
				return;
			}
		}
	}

	@Override
	public void cancel() {
		state = SDS_CANCELLED;
		value = null;
	}

	@Override
	public final boolean isCancelled() {
		return state == SDS_CANCELLED;
	}

	@Override
	public final Object downstream() {
		return subscriber;
	}
}
