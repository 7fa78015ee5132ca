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
import tributary.core.support.ReactiveState;
import tributary.fn.BiFunction;
import tributary.rx.Timestamped;

/**
 * Combines each value of the left source with the latest value of the right source.
 * <p>
 * Both sources are timestamped on arrival and combined latest-with-latest; a combination is only relayed when the left
 * timestamp is not before the right one. Nothing is emitted until the right source has emitted once. A right value
 * arriving at the same instant as the latest left value also passes, which can repeat a combination on coarse clocks.
 *
 * @param <L> the left value type
 * @param <R> the right value type
 * @param <O> the combined value type
 */
public final class StreamCombineLatestOnLeft<L, R, O> extends StreamBarrier<L, O>
		implements ReactiveState.FeedbackLoop {

	final Publisher<? extends R> right;

	final BiFunction<? super L, ? super R, ? extends O> combiner;

	final Clock clock;

	public StreamCombineLatestOnLeft(Publisher<? extends L> left,
			Publisher<? extends R> right,
			BiFunction<? super L, ? super R, ? extends O> combiner,
			Clock clock) {
		super(left);
		this.right = Objects.requireNonNull(right, "right");
		this.combiner = Objects.requireNonNull(combiner, "combiner");
		this.clock = Objects.requireNonNull(clock, "clock");
	}

	@Override
	public void subscribe(Subscriber<? super O> s) {
		StreamCombineLatest<Timestamped<L>, Timestamped<R>, LeftRight<L, R>> latest =
				new StreamCombineLatest<>(new StreamTimestamp<L>(source, clock),
						new StreamTimestamp<R>(right, clock),
						LeftRight<L, R>::new);

		new StreamMap<LeftRight<L, R>, O>(new StreamFilter<LeftRight<L, R>>(latest, LeftRight::isLeftDriven),
				p -> combiner.apply(p.left.value(), p.right.value())).subscribe(s);
	}

	@Override
	public Object delegateInput() {
		return right;
	}

	@Override
	public Object delegateOutput() {
		return combiner;
	}

	/**
	 * The latest timestamped pair of values.
	 */
	static final class LeftRight<L, R> {

		final Timestamped<L> left;
		final Timestamped<R> right;

		LeftRight(Timestamped<L> left, Timestamped<R> right) {
			this.left = left;
			this.right = right;
		}

		boolean isLeftDriven() {
			return left.isNotBefore(right);
		}

		@Override
		public String toString() {
			return "{left: " + left + ", right: " + right + "}";
		}
	}
}
