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

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import tributary.core.error.SpecificationExceptions;
import tributary.core.support.ReactiveState;
import tributary.rx.Stream;

/**
 * A {@link Stream} operator attached to a single source {@link Publisher}. Each subscribe call subscribes the source
 * with the Subscriber returned by {@link #apply(Subscriber)}, the identity by default.
 *
 * @param <I> the upstream value type
 * @param <O> the output value type
 * @author Stephane Maldini
 */
public class StreamBarrier<I, O> extends Stream<O> implements ReactiveState.Named, ReactiveState.Upstream {

	final protected Publisher<? extends I> source;

	public StreamBarrier(Publisher<? extends I> source) {
		this.source = source;
	}

	@Override
	public void subscribe(Subscriber<? super O> s) {
		if (s == null) {
			throw SpecificationExceptions.spec_2_13_exception();
		}
		source.subscribe(apply(s));
	}

	/**
	 * @param subscriber the downstream subscriber
	 * @return the subscriber to attach to the source
	 */
	@SuppressWarnings("unchecked")
	public Subscriber<? super I> apply(Subscriber<? super O> subscriber) {
		return (Subscriber<I>) subscriber;
	}

	@Override
	public String getName() {
		return getClass().getSimpleName()
		                 .replaceAll("Stream|Publisher|Operator", "");
	}

	@Override
	public final Publisher<? extends I> upstream() {
		return source;
	}

	@Override
	public String toString() {
		return "{" +
				"source: " + source.toString() +
				'}';
	}

	/**
	 * Expose a plain {@link Publisher} as a {@link Stream} without altering its signals.
	 *
	 * @param <I> the value type
	 */
	public final static class Identity<I> extends StreamBarrier<I, I> {

		public Identity(Publisher<? extends I> source) {
			super(source);
		}

		@Override
		@SuppressWarnings("unchecked")
		public void subscribe(Subscriber<? super I> s) {
			if (s == null) {
				throw SpecificationExceptions.spec_2_13_exception();
			}
			((Publisher<I>) source).subscribe(s);
		}
	}
}
