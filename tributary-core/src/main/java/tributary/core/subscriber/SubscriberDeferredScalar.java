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
import tributary.core.subscription.DeferredScalarSubscription;
import tributary.core.support.BackpressureUtils;
import tributary.core.support.ReactiveState;

/**
 * A Subscriber consuming a whole upstream sequence unbounded and producing at most one value downstream, once the
 * upstream has completed.
 *
 * @param <I> the upstream value type
 * @param <O> the produced value type
 * @author Stephane Maldini
 */
public abstract class SubscriberDeferredScalar<I, O> extends DeferredScalarSubscription<O>
		implements Subscriber<I>, ReactiveState.Upstream, ReactiveState.ActiveUpstream {

	protected Subscription s;

	protected boolean done;

	public SubscriberDeferredScalar(Subscriber<? super O> subscriber) {
		super(subscriber);
	}

	@Override
	public void onSubscribe(Subscription s) {
		if (BackpressureUtils.validate(this.s, s)) {
			this.s = s;

			subscriber.onSubscribe(this);

			s.request(Long.MAX_VALUE);
		}
	}

	@Override
	public void onError(Throwable t) {
		if (done) {
			Exceptions.onErrorDropped(t);
			return;
		}
		done = true;
		value = null;
		subscriber.onError(t);
	}

	@Override
	public void onComplete() {
		if (done) {
			return;
		}
		done = true;
		O v = value;
		if (v == null) {
			subscriber.onComplete();
			return;
		}
		complete(v);
	}

	/**
	 * Cancel upstream and report the failure of a user callback downstream.
	 *
	 * @param e the callback error
	 * @param v the value being processed
	 */
	protected final void fail(Throwable e, Object v) {
		Exceptions.throwIfFatal(e);
		s.cancel();
		onError(Exceptions.addValueAsLastCause(e, v));
	}

	@Override
	public void cancel() {
		super.cancel();
		s.cancel();
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
}
