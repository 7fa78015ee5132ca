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

import java.util.Objects;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import tributary.core.error.Exceptions;
import tributary.core.support.BackpressureUtils;
import tributary.fn.Predicate;

/**
 * Relays only the values matching a {@link Predicate}. A rejected value is replaced by a request for one more, so
 * downstream demand is never consumed by dropped values.
 * <p>
 * Besides {@link tributary.rx.Stream#filter}, it backs the record checks ({@code whereTrue}, {@code whereFalse}) and
 * the not-before guard of {@link StreamCombineLatestOnLeft}, which drops combinations whose left value is older than
 * their right value. A throwing predicate cancels the source and fails with the rejected value attached as last
 * cause.
 *
 * @param <T> the value type
 */
public final class StreamFilter<T> extends StreamBarrier<T, T> {

	final Predicate<? super T> predicate;

	public StreamFilter(Publisher<? extends T> source, Predicate<? super T> predicate) {
		super(source);
		this.predicate = Objects.requireNonNull(predicate, "predicate");
	}

	public Predicate<? super T> predicate() {
		return predicate;
	}

	@Override
	public Subscriber<? super T> apply(Subscriber<? super T> s) {
		return new StreamFilterSubscriber<>(s, predicate);
	}

	static final class StreamFilterSubscriber<T>
			implements Subscriber<T>, Downstream, FeedbackLoop, ActiveUpstream, Upstream {

		final Subscriber<? super T> actual;

		final Predicate<? super T> predicate;

		Subscription s;

		boolean done;

		StreamFilterSubscriber(Subscriber<? super T> actual, Predicate<? super T> predicate) {
			this.actual = actual;
			this.predicate = predicate;
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

			boolean b;

			try {
				b = predicate.test(t);
			}
			catch (Throwable e) {
				Exceptions.throwIfFatal(e);
				s.cancel();

				onError(Exceptions.addValueAsLastCause(e, t));
				return;
			}
			if (b) {
				actual.onNext(t);
			}
			else {
				s.request(1);
			}
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
		public boolean isStarted() {
			return s != null && !done;
		}

		@Override
		public boolean isTerminated() {
			return done;
		}

		@Override
		public Object downstream() {
			return actual;
		}

		@Override
		public Object delegateInput() {
			return predicate;
		}

		@Override
		public Object delegateOutput() {
			return null;
		}

		@Override
		public Object upstream() {
			return s;
		}
	}
}
