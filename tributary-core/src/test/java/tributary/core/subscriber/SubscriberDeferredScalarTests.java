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

import org.junit.Test;
import org.reactivestreams.Subscriber;
import tributary.core.subscription.EmptySubscription;

public class SubscriberDeferredScalarTests {

	@Test
	public void countIsEmittedOnCompletion() {
		TestSubscriber<Integer> ts = TestSubscriber.create();
		Counting<String> counting = new Counting<>(ts);

		counting.onSubscribe(EmptySubscription.INSTANCE);
		counting.onNext("a");
		counting.onNext("b");

		ts.assertSubscribed()
		  .assertNoValues();

		counting.onComplete();

		ts.assertValues(2)
		  .assertComplete();
	}

	@Test
	public void countIsHeldUntilRequested() {
		TestSubscriber<Integer> ts = TestSubscriber.create(0);
		Counting<String> counting = new Counting<>(ts);

		counting.onSubscribe(EmptySubscription.INSTANCE);
		counting.onNext("a");
		counting.onComplete();

		ts.assertNoValues()
		  .assertNotTerminated();

		ts.request(1);

		ts.assertValues(1)
		  .assertComplete();
	}

	@Test
	public void emptyUpstreamCompletesWithoutValue() {
		TestSubscriber<Integer> ts = TestSubscriber.create();
		Counting<String> counting = new Counting<>(ts);

		counting.onSubscribe(EmptySubscription.INSTANCE);
		counting.onComplete();

		ts.assertNoValues()
		  .assertComplete();
	}

	@Test
	public void errorIsForwardedOnce() {
		TestSubscriber<Integer> ts = TestSubscriber.create();
		Counting<String> counting = new Counting<>(ts);

		counting.onSubscribe(EmptySubscription.INSTANCE);
		counting.onNext("a");
		counting.onError(new IllegalStateException("first"));
		counting.onError(new IllegalStateException("second"));
		counting.onComplete();

		ts.assertNoValues()
		  .assertErrorMessage("first")
		  .assertNotComplete();
	}

	static final class Counting<T> extends SubscriberDeferredScalar<T, Integer> {

		Counting(Subscriber<? super Integer> subscriber) {
			super(subscriber);
		}

		@Override
		public void onNext(T t) {
			Integer v = value;
			value = v == null ? 1 : v + 1;
		}
	}
}
