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

import org.junit.Test;
import tributary.core.subscriber.TestSubscriber;
import tributary.rx.Streams;
import tributary.rx.broadcast.Broadcaster;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class StreamCombineLatestTests {

	@Test
	public void combinesOnceBothHaveEmittedThenOnEveryValue() {
		Broadcaster<String> letters = Broadcaster.create();
		Broadcaster<Integer> numbers = Broadcaster.create();
		TestSubscriber<String> ts = TestSubscriber.create();

		Streams.combineLatest(letters, numbers, (l, n) -> l + n)
		       .subscribe(ts);

		letters.onNext("a");
		letters.onNext("b");
		ts.assertNoValues();

		numbers.onNext(1);
		letters.onNext("c");
		numbers.onNext(2);

		ts.assertValues("b1", "c1", "c2");

		letters.onComplete();
		ts.assertNotTerminated();
		numbers.onComplete();
		ts.assertComplete();
	}

	@Test
	public void synchronousSourcesCombineWithTheLastOfTheFirst() {
		TestSubscriber<String> ts = TestSubscriber.create();

		Streams.just("a", "b")
		       .combineLatest(Streams.just(1, 2), (l, n) -> l + n)
		       .subscribe(ts);

		ts.assertValues("b1", "b2")
		  .assertComplete();
	}

	@Test
	public void emptySourceCompletesImmediately() {
		Broadcaster<Integer> other = Broadcaster.create();
		TestSubscriber<String> ts = TestSubscriber.create();

		Streams.<String>empty()
		       .combineLatest(other, (l, n) -> l + n)
		       .subscribe(ts);

		ts.assertNoValues()
		  .assertComplete();
		assertThat(other.hasSubscribers(), is(false));
	}

	@Test
	public void combinationsAreBufferedUntilRequested() {
		Broadcaster<String> letters = Broadcaster.create();
		Broadcaster<Integer> numbers = Broadcaster.create();
		TestSubscriber<String> ts = TestSubscriber.create(0);

		letters.combineLatest(numbers, (l, n) -> l + n)
		       .subscribe(ts);

		letters.onNext("a");
		numbers.onNext(1);
		numbers.onNext(2);
		numbers.onComplete();
		letters.onComplete();

		ts.assertNoValues();

		ts.request(1);
		ts.assertValues("a1")
		  .assertNotTerminated();

		ts.request(1);
		ts.assertValues("a1", "a2")
		  .assertComplete();
	}

	@Test
	public void nullCombinationFails() {
		TestSubscriber<String> ts = TestSubscriber.create();

		Streams.just("a")
		       .combineLatest(Streams.just(1), (String l, Integer n) -> (String) null)
		       .subscribe(ts);

		ts.assertError(NullPointerException.class)
		  .assertNoValues();
	}

	@Test
	public void onlyTheFirstErrorIsRelayed() {
		Broadcaster<String> letters = Broadcaster.create();
		Broadcaster<Integer> numbers = Broadcaster.create();
		TestSubscriber<String> ts = TestSubscriber.create();

		letters.combineLatest(numbers, (l, n) -> l + n)
		       .subscribe(ts);

		numbers.onError(new IllegalStateException("numbers failed"));
		letters.onError(new IllegalStateException("letters failed"));

		ts.assertErrorMessage("numbers failed");
		assertThat(letters.hasSubscribers(), is(false));
	}
}
