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

import java.time.Clock;
import java.util.Map;
import javax.annotation.Nonnull;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import tributary.core.support.Assert;
import tributary.fn.BiFunction;
import tributary.fn.Consumer;
import tributary.fn.Function;
import tributary.fn.Predicate;
import tributary.rx.stream.StreamCombineLatest;
import tributary.rx.stream.StreamCombineLatestOnLeft;
import tributary.rx.stream.StreamFilter;
import tributary.rx.stream.StreamLast;
import tributary.rx.stream.StreamLog;
import tributary.rx.stream.StreamMap;
import tributary.rx.stream.StreamReduce;
import tributary.rx.stream.StreamTimestamp;
import tributary.rx.subscriber.Control;
import tributary.rx.subscriber.InterruptableSubscriber;

/**
 * Base class for components designed to provide a succinct API for working with future values. A Stream is a
 * {@link Publisher}: each subscription is independent and replays the whole operator chain. Operators return a new
 * Stream wrapping this one. <p> Typically, new {@code Stream} aren't created directly. To create a {@code Stream}, use
 * {@link Streams} static API.
 *
 * @param <O> The type of the output values
 * @author Stephane Maldini
 * @author Jon Brisbin
 */
public abstract class Stream<O> implements Publisher<O> {

	protected Stream() {
	}

	/**
	 * Evaluate each accepted value against the given {@link Predicate}. If the predicate test succeeds, the value is
	 * passed into the new {@code Stream}. If the predicate test fails, the value is ignored.
	 *
	 * @param p the {@link Predicate} to test values against
	 * @return a new {@link Stream} containing only values that pass the predicate test
	 */
	public final Stream<O> filter(@Nonnull final Predicate<? super O> p) {
		return new StreamFilter<>(this, p);
	}

	/**
	 * Assign the given {@link Function} to transform the incoming value {@code T} into a {@code V} and pass it into
	 * another {@code Stream}.
	 *
	 * @param fn the transformation function
	 * @param <V> the type of the return value of the transformation function
	 * @return a new {@link Stream} containing the transformed values
	 */
	public final <V> Stream<V> map(@Nonnull final Function<? super O, ? extends V> fn) {
		return new StreamMap<>(this, fn);
	}

	/**
	 * Reduce the values passing through this {@code Stream} into an object {@code A}, starting from the given seed.
	 * The accumulation is emitted once this {@code Stream} completes.
	 *
	 * @param initial the seed of the accumulation
	 * @param fn the reduce function
	 * @param <A> the type of the reduced object
	 * @return a new {@link Stream} emitting the single reduced value
	 */
	public final <A> Stream<A> reduce(@Nonnull final A initial, @Nonnull final BiFunction<A, ? super O, A> fn) {
		return new StreamReduce<>(this, initial, fn);
	}

	/**
	 * Create a new {@code Stream} whose only value will be the last value of this {@code Stream}, emitted on
	 * completion. An empty {@code Stream} stays empty.
	 *
	 * @return a new {@link Stream} emitting at most one value
	 */
	public final Stream<O> last() {
		return new StreamLast<>(this);
	}

	/**
	 * Attach the current wall-clock instant to each value.
	 *
	 * @return a new {@link Stream} of {@link Timestamped} values
	 */
	public final Stream<Timestamped<O>> timestamp() {
		return timestamp(Clock.systemUTC());
	}

	/**
	 * Attach the instant read from the given {@link Clock} to each value, on arrival.
	 *
	 * @param clock the time source
	 * @return a new {@link Stream} of {@link Timestamped} values
	 */
	public final Stream<Timestamped<O>> timestamp(@Nonnull final Clock clock) {
		return new StreamTimestamp<>(this, clock);
	}

	/**
	 * Combine the latest value of this {@code Stream} and of the given {@link Publisher} each time either emits, once
	 * both have emitted.
	 *
	 * @param other the other source
	 * @param combiner the combination of both latest values
	 * @param <T> the type of the other source values
	 * @param <V> the type of the combined values
	 * @return a new {@link Stream} of combined values
	 * @see StreamCombineLatest
	 */
	public final <T, V> Stream<V> combineLatest(@Nonnull final Publisher<? extends T> other,
			@Nonnull final BiFunction<? super O, ? super T, ? extends V> combiner) {
		return new StreamCombineLatest<>(this, other, combiner);
	}

	/**
	 * Combine each value of this {@code Stream} with the latest value of the given right {@link Publisher}, using the
	 * system UTC clock to order them.
	 *
	 * @param right the right source
	 * @param combiner the combination of a left value and the latest right value
	 * @param <R> the type of the right source values
	 * @param <V> the type of the combined values
	 * @return a new {@link Stream} of combined values
	 * @see #combineLatestOnLeft(Publisher, BiFunction, Clock)
	 */
	public final <R, V> Stream<V> combineLatestOnLeft(@Nonnull final Publisher<? extends R> right,
			@Nonnull final BiFunction<? super O, ? super R, ? extends V> combiner) {
		return combineLatestOnLeft(right, combiner, Clock.systemUTC());
	}

	/**
	 * Combine each value of this {@code Stream} with the latest value of the given right {@link Publisher}. Every value
	 * from both sides is timestamped on arrival with the given {@link Clock}; a combination is emitted only when its
	 * left value is not older than its right value. Left values arriving before any right value are not emitted.
	 *
	 * @param right the right source
	 * @param combiner the combination of a left value and the latest right value
	 * @param clock the time source
	 * @param <R> the type of the right source values
	 * @param <V> the type of the combined values
	 * @return a new {@link Stream} of combined values
	 * @see StreamCombineLatestOnLeft
	 */
	public final <R, V> Stream<V> combineLatestOnLeft(@Nonnull final Publisher<? extends R> right,
			@Nonnull final BiFunction<? super O, ? super R, ? extends V> combiner,
			@Nonnull final Clock clock) {
		return new StreamCombineLatestOnLeft<>(this, right, combiner, clock);
	}

	/**
	 * Only pass values equal to {@link Boolean#TRUE}.
	 *
	 * @return a new filtered {@link Stream}
	 */
	public final Stream<O> whereTrue() {
		return filter(Records.is(true));
	}

	/**
	 * Only pass records whose given property is {@link Boolean#TRUE}.
	 *
	 * @param property the property to check
	 * @return a new filtered {@link Stream}
	 */
	public final Stream<O> whereTrue(@Nonnull final String property) {
		return filter(Records.is(property, true));
	}

	/**
	 * Only pass values equal to {@link Boolean#FALSE}.
	 *
	 * @return a new filtered {@link Stream}
	 */
	public final Stream<O> whereFalse() {
		return filter(Records.is(false));
	}

	/**
	 * Only pass records whose given property is {@link Boolean#FALSE}.
	 *
	 * @param property the property to check
	 * @return a new filtered {@link Stream}
	 */
	public final Stream<O> whereFalse(@Nonnull final String property) {
		return filter(Records.is(property, false));
	}

	/**
	 * Wrap each value into a new record, under the given property.
	 *
	 * @param property the property name
	 * @return a new {@link Stream} of records
	 */
	public final Stream<Map<String, Object>> wrapAs(@Nonnull final String property) {
		return map(Records.<O>wrapAs(property));
	}

	/**
	 * Set the given property on each record, or wrap non record values into a new record holding only this
	 * property.
	 *
	 * @param property the property name
	 * @param data the literal or computed value to set
	 * @return a new {@link Stream} of records
	 */
	public final Stream<Map<String, Object>> appendAs(@Nonnull final String property,
			@Nonnull final Injection<? super O, ?> data) {
		return map(Records.<O>appendAs(property, data));
	}

	/**
	 * Apply a conversion to a property of each record and store the result under the same or another property.
	 * Values that are not records, or records without the source property, pass unchanged.
	 *
	 * @param from the property to read
	 * @param to the property to write
	 * @param converter the conversion
	 * @return a new {@link Stream} of converted values
	 */
	public final Stream<Object> convertProperty(@Nonnull final String from,
			@Nonnull final String to,
			@Nonnull final Function<Object, ?> converter) {
		return map(Records.convertProperty(from, to, converter));
	}

	/**
	 * Replace each record holding the given property by the value of this property. Other values pass unchanged.
	 *
	 * @param property the property to read
	 * @return a new {@link Stream} of property values
	 */
	public final Stream<Object> selectProperty(@Nonnull final String property) {
		return map(Records.selectProperty(property));
	}

	/**
	 * Replace every value with the given constant.
	 *
	 * @param value the constant
	 * @param <V> the constant type
	 * @return a new {@link Stream} of the constant
	 */
	public final <V> Stream<V> selectAs(@Nonnull final V value) {
		Assert.notNull(value, "value must not be null");
		return map(x -> value);
	}

	/**
	 * Log every signal of this {@code Stream} at info level, under this class logger.
	 *
	 * @return a new logged {@link Stream}
	 */
	public final Stream<O> log() {
		return log(null);
	}

	/**
	 * Log every signal of this {@code Stream} at info level.
	 *
	 * @param category the logger name
	 * @return a new logged {@link Stream}
	 */
	public final Stream<O> log(final String category) {
		return log(category, StreamLog.ALL);
	}

	/**
	 * Log the selected signals of this {@code Stream}.
	 *
	 * @param category the logger name
	 * @param options a combination of the {@link StreamLog} signal flags
	 * @return a new logged {@link Stream}
	 */
	public final Stream<O> log(final String category, int options) {
		return new StreamLog<>(this, category, options);
	}

	/**
	 * Start consuming this {@code Stream} without handling values. Errors are rethrown to the emitting thread.
	 *
	 * @return a {@link Control} to cancel the consumption
	 */
	public final Control consume() {
		return consume(null, null, null);
	}

	/**
	 * Start consuming this {@code Stream} with unbounded demand.
	 *
	 * @param consumer the value callback
	 * @return a {@link Control} to cancel the consumption
	 */
	public final Control consume(final Consumer<? super O> consumer) {
		return consume(consumer, null, null);
	}

	/**
	 * Start consuming this {@code Stream} with unbounded demand.
	 *
	 * @param consumer the value callback
	 * @param errorConsumer the error callback
	 * @return a {@link Control} to cancel the consumption
	 */
	public final Control consume(final Consumer<? super O> consumer, final Consumer<? super Throwable> errorConsumer) {
		return consume(consumer, errorConsumer, null);
	}

	/**
	 * Start consuming this {@code Stream} with unbounded demand.
	 *
	 * @param consumer the value callback
	 * @param errorConsumer the error callback
	 * @param completeConsumer the completion callback
	 * @return a {@link Control} to cancel the consumption
	 */
	public final Control consume(final Consumer<? super O> consumer,
			final Consumer<? super Throwable> errorConsumer,
			final Consumer<Void> completeConsumer) {
		InterruptableSubscriber<O> subscriber =
				new InterruptableSubscriber<>(consumer, errorConsumer, completeConsumer);
		subscribe(subscriber);
		return subscriber;
	}

	/**
	 * Subscribe the given {@link Subscriber} and return it, for chaining.
	 *
	 * @param subscriber the subscriber
	 * @param <E> the subscriber type
	 * @return the given subscriber
	 */
	public final <E extends Subscriber<? super O>> E subscribeWith(E subscriber) {
		subscribe(subscriber);
		return subscriber;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName();
	}
}
