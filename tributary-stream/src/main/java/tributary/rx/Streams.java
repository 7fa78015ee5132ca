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

package tributary.rx;

import java.util.Arrays;
import java.util.List;

import org.reactivestreams.Publisher;
import tributary.fn.BiFunction;
import tributary.rx.stream.StreamBarrier;
import tributary.rx.stream.StreamCombineLatest;
import tributary.rx.stream.StreamEmpty;
import tributary.rx.stream.StreamError;
import tributary.rx.stream.StreamForkJoin;
import tributary.rx.stream.StreamIterable;
import tributary.rx.stream.StreamNever;

/**
 * A public factory to build {@link Stream}.
 * <p>
 * Cold sources ({@link #just}, {@link #from}) replay their values for each new subscriber, honouring its demand.
 * Hot sources are built with {@link tributary.rx.broadcast.Broadcaster#create()}.
 *
 * @author Stephane Maldini
 * @author Jon Brisbin
 */
public class Streams {

	protected Streams() {
	}

	/**
	 * Build a {@literal Stream} emitting the given values then completing.
	 *
	 * @param values the values to emit
	 * @param <T> the type of values
	 * @return a new {@link Stream}
	 */
	@SafeVarargs
	public static <T> Stream<T> just(T... values) {
		return from(Arrays.asList(values));
	}

	/**
	 * Build a {@literal Stream} emitting every value of the given {@link Iterable} then completing. A new
	 * {@link java.util.Iterator} is obtained for each subscriber.
	 *
	 * @param values the values to emit
	 * @param <T> the type of values
	 * @return a new {@link Stream}
	 */
	public static <T> Stream<T> from(Iterable<? extends T> values) {
		return new StreamIterable<>(values);
	}

	/**
	 * @param <T> the type of values
	 * @return a {@link Stream} completing immediately
	 */
	public static <T> Stream<T> empty() {
		return StreamEmpty.instance();
	}

	/**
	 * @param error the error to signal
	 * @param <T> the type of values
	 * @return a {@link Stream} failing immediately with the given error
	 */
	public static <T> Stream<T> fail(Throwable error) {
		return new StreamError<>(error);
	}

	/**
	 * @param <T> the type of values
	 * @return a {@link Stream} never emitting nor terminating
	 */
	public static <T> Stream<T> never() {
		return StreamNever.instance();
	}

	/**
	 * Expose any {@link Publisher} with the {@link Stream} API.
	 *
	 * @param publisher the source
	 * @param <T> the type of values
	 * @return the given publisher if already a {@link Stream}, or a {@link Stream} passing its signals through
	 */
	@SuppressWarnings("unchecked")
	public static <T> Stream<T> wrap(Publisher<? extends T> publisher) {
		if (publisher instanceof Stream) {
			return (Stream<T>) publisher;
		}
		return new StreamBarrier.Identity<>(publisher);
	}

	/**
	 * Wait for every source to complete, then emit a single list holding the last value of each source, in the
	 * order of the given list, and complete.
	 * <p>
	 * All sources are subscribed as soon as the returned {@link Stream} is. The first error from any source cancels
	 * the others and is relayed. A source completing without any value prevents the emission: the returned
	 * {@link Stream} then never terminates.
	 *
	 * @param sources the sources to join, at least one
	 * @param <T> the common type of the source values
	 * @return a new {@link Stream} emitting one unmodifiable list
	 * @throws IllegalArgumentException if {@code sources} is empty
	 * @throws NullPointerException if {@code sources} or one of its elements is null
	 */
	public static <T> Stream<List<T>> forkJoin(List<? extends Publisher<? extends T>> sources) {
		return new StreamForkJoin<>(sources);
	}

	/**
	 * Combine the latest values of two sources each time either of them emits, once both have emitted.
	 *
	 * @param first the first source
	 * @param second the second source
	 * @param combiner the combination
	 * @param <T1> the type of the first source values
	 * @param <T2> the type of the second source values
	 * @param <V> the type of the combined values
	 * @return a new {@link Stream} of combined values
	 */
	public static <T1, T2, V> Stream<V> combineLatest(Publisher<? extends T1> first,
			Publisher<? extends T2> second,
			BiFunction<? super T1, ? super T2, ? extends V> combiner) {
		return new StreamCombineLatest<>(first, second, combiner);
	}
}
