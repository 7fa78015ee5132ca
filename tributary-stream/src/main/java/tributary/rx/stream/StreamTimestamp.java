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

import java.time.Clock;
import java.util.Objects;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import tributary.core.error.Exceptions;
import tributary.core.support.BackpressureUtils;
import tributary.rx.Timestamped;

/**
 * Tags every value with the instant of its arrival, read from a {@link Clock}.
 *
 * @param <T> the value type
 */
public final class StreamTimestamp<T> extends StreamBarrier<T, Timestamped<T>> {

	final Clock clock;

	public StreamTimestamp(Publisher<? extends T> source, Clock clock) {
		super(source);
		this.clock = Objects.requireNonNull(clock, "clock");
	}

	@Override
	public Subscriber<? super T> apply(Subscriber<? super Timestamped<T>> s) {
		return new StreamTimestampSubscriber<>(s, clock);
	}

	static final class StreamTimestampSubscriber<T> implements Subscriber<T>, Downstream, Upstream {

		final Subscriber<? super Timestamped<T>> actual;

		final Clock clock;

		Subscription s;

		boolean done;

		StreamTimestampSubscriber(Subscriber<? super Timestamped<T>> actual, Clock clock) {
			this.actual = actual;
			this.clock = clock;
		}

		@Override
		public void onSubscribe(Subscription s) {
			if (BackpressureUtils.validate(this.s, s)) {
				this.s = s;
				actual.onSubscribe(s);
			}
		}

		@Override
		public void onNext(T t) {
			if (done) {
				Exceptions.onNextDropped(t);
				return;
			}
			Timestamped<T> v;
			try {
				v = new Timestamped<>(t, clock.instant());
			}
			catch (Throwable e) {
				Exceptions.throwIfFatal(e);
				s.cancel();
				onError(e);
				return;
			}
			actual.onNext(v);
		}

		@Override
		public void onError(Throwable t) {
			if (done) {
				Exceptions.onErrorDropped(t);
				return;
			}
			done = true;
			actual.onError(t);
		}

		@Override
		public void onComplete() {
			if (done) {
				return;
			}
			done = true;
			actual.onComplete();
		}

		@Override
		public Object downstream() {
			return actual;
		}

		@Override
		public Object upstream() {
			return s;
		}
	}
}
