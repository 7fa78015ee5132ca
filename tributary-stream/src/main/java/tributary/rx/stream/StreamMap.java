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
import tributary.fn.Function;

/**
 * Transforms each value with a {@link Function}. A null result fails the sequence.
 *
 * @param <T> the upstream value type
 * @param <R> the mapped value type
 */
public final class StreamMap<T, R> extends StreamBarrier<T, R> {

	final Function<? super T, ? extends R> mapper;

	public StreamMap(Publisher<? extends T> source, Function<? super T, ? extends R> mapper) {
		super(source);
		this.mapper = Objects.requireNonNull(mapper, "mapper");
	}

	public Function<? super T, ? extends R> mapper() {
		return mapper;
	}

	@Override
	public Subscriber<? super T> apply(Subscriber<? super R> s) {
		return new StreamMapSubscriber<>(s, mapper);
	}

	static final class StreamMapSubscriber<T, R>
			implements Subscriber<T>, Downstream, FeedbackLoop, ActiveUpstream, Upstream {

		final Subscriber<? super R> actual;

		final Function<? super T, ? extends R> mapper;

		Subscription s;

		boolean done;

		StreamMapSubscriber(Subscriber<? super R> actual, Function<? super T, ? extends R> mapper) {
			this.actual = actual;
			this.mapper = mapper;
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

			R v;

			try {
				v = mapper.apply(t);
			}
			catch (Throwable e) {
				Exceptions.throwIfFatal(e);
				s.cancel();

				onError(Exceptions.addValueAsLastCause(e, t));
				return;
			}

			if (v == null) {
				s.cancel();

				onError(new NullPointerException("The mapper returned a null value."));
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
			return mapper;
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
