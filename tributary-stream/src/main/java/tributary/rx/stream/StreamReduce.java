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
import tributary.core.error.Exceptions;
import tributary.core.subscriber.SubscriberDeferredScalar;
import tributary.fn.BiFunction;

/**
 * Folds the whole sequence from a seed and emits the accumulation once the source completes. An empty source emits
 * the seed.
 *
 * @param <T> the upstream value type
 * @param <R> the accumulated type
 */
public final class StreamReduce<T, R> extends StreamBarrier<T, R> {

	final R initialValue;

	final BiFunction<R, ? super T, R> accumulator;

	public StreamReduce(Publisher<? extends T> source, R initialValue, BiFunction<R, ? super T, R> accumulator) {
		super(source);
		this.initialValue = Objects.requireNonNull(initialValue, "initialValue");
		this.accumulator = Objects.requireNonNull(accumulator, "accumulator");
	}

	@Override
	public Subscriber<? super T> apply(Subscriber<? super R> s) {
		return new StreamReduceSubscriber<>(s, initialValue, accumulator);
	}

	static final class StreamReduceSubscriber<T, R> extends SubscriberDeferredScalar<T, R>
			implements FeedbackLoop {

		final BiFunction<R, ? super T, R> accumulator;

		StreamReduceSubscriber(Subscriber<? super R> actual, R initialValue, BiFunction<R, ? super T, R> accumulator) {
			super(actual);
			this.accumulator = accumulator;
			this.value = initialValue;
		}

		@Override
		public void onNext(T t) {
			if (done) {
				Exceptions.onNextDropped(t);
				return;
			}

			R r;

			try {
				r = accumulator.apply(value, t);
			}
			catch (Throwable e) {
				fail(e, t);
				return;
			}

			if (r == null) {
				fail(new NullPointerException("The accumulator returned a null value"), t);
				return;
			}

			value = r;
		}

		@Override
		public Object delegateInput() {
			return accumulator;
		}

		@Override
		public Object delegateOutput() {
			return null;
		}
	}
}
