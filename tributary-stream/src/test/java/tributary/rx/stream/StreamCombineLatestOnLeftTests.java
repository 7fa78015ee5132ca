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

import java.time.Duration;
import java.util.List;

import org.junit.Before;
import org.junit.Test;
import tributary.core.subscriber.TestSubscriber;
import tributary.rx.ManualClock;
import tributary.rx.Timestamped;
import tributary.rx.broadcast.Broadcaster;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class StreamCombineLatestOnLeftTests {

	ManualClock clock;

	Broadcaster<String> left;

	Broadcaster<Integer> right;

	TestSubscriber<String> ts;

	@Before
	public void setUp() {
		clock = ManualClock.atEpochMillis(0L);
		left = Broadcaster.create();
		right = Broadcaster.create();
		ts = TestSubscriber.create();

		left.combineLatestOnLeft(right, (l, r) -> l + r, clock)
		    .subscribe(ts);
	}

	@Test
	public void leftIsCombinedWithOlderRight() {
		clock.setEpochMillis(5L);
		right.onNext(5);

		clock.setEpochMillis(10L);
		left.onNext("x");

		ts.assertValues("x5")
		  .assertNotTerminated();
	}

	@Test
	public void leftIsSuppressedUntilRightHasEmitted() {
		clock.setEpochMillis(1L);
		left.onNext("early");

		ts.assertNoValues();

		clock.setEpochMillis(2L);
		right.onNext(1);

		ts.assertNoValues();

		clock.setEpochMillis(3L);
		left.onNext("late");

		ts.assertValues("late1");
	}

	@Test
	public void everyLaterLeftReusesTheLatestRight() {
		clock.setEpochMillis(0L);
		right.onNext(1);

		clock.advance(Duration.ofMillis(1));
		left.onNext("a");

		clock.advance(Duration.ofMillis(1));
		left.onNext("b");

		ts.assertValues("a1", "b1");
	}

	@Test
	public void systemClockPairsLeftWithEarlierRight() {
		Broadcaster<String> l = Broadcaster.create();
		Broadcaster<Integer> r = Broadcaster.create();
		TestSubscriber<String> joined = TestSubscriber.create();

		l.combineLatestOnLeft(r, (a, b) -> a + b)
		 .subscribe(joined);

		l.onNext("early");
		joined.assertNoValues();

		r.onNext(1);
		joined.assertNoValues();

		l.onNext("a");
		l.onNext("b");

		joined.assertValues("a1", "b1")
		      .assertNotTerminated();
	}

	@Test
	public void systemClockTimestampsDoNotGoBackwards() {
		Broadcaster<Integer> source = Broadcaster.create();
		TestSubscriber<Timestamped<Integer>> stamped = TestSubscriber.create();

		source.timestamp()
		      .subscribe(stamped);

		for (int i = 0; i < 100; i++) {
			source.onNext(i);
		}
		source.onComplete();

		List<Timestamped<Integer>> values = stamped.assertComplete()
		                                           .assertValueCount(100)
		                                           .values();
		for (int i = 1; i < values.size(); i++) {
			assertThat(values.get(i).value(), is(i));
			assertThat(values.get(i).isNotBefore(values.get(i - 1)), is(true));
		}
	}

	@Test
	public void newerRightAloneDoesNotEmit() {
		clock.setEpochMillis(0L);
		right.onNext(1);
		clock.setEpochMillis(1L);
		left.onNext("a");

		clock.setEpochMillis(2L);
		right.onNext(2);

		ts.assertValues("a1");

		clock.setEpochMillis(3L);
		left.onNext("b");

		ts.assertValues("a1", "b2");
	}

	@Test
	public void rightAtTheSameInstantAsLeftIsEmitted() {
		clock.setEpochMillis(0L);
		right.onNext(1);

		clock.setEpochMillis(10L);
		left.onNext("a");
		right.onNext(2);

		ts.assertValues("a1", "a2");
	}

	@Test
	public void leftErrorCancelsRight() {
		right.onNext(1);

		left.onError(new IllegalStateException("left failed"));

		ts.assertErrorMessage("left failed")
		  .assertNoValues();
		assertThat(right.hasSubscribers(), is(false));
	}

	@Test
	public void rightErrorCancelsLeft() {
		right.onError(new IllegalStateException("right failed"));

		ts.assertErrorMessage("right failed");
		assertThat(left.hasSubscribers(), is(false));
	}

	@Test
	public void completesWhenBothSidesComplete() {
		right.onNext(1);
		clock.setEpochMillis(1L);
		left.onNext("a");

		left.onComplete();
		ts.assertNotTerminated();

		right.onComplete();
		ts.assertValues("a1")
		  .assertComplete();
	}

	@Test
	public void completesAtOnceWhenRightCompletesEmpty() {
		right.onComplete();

		ts.assertNoValues()
		  .assertComplete();
		assertThat(left.hasSubscribers(), is(false));
	}

	@Test
	public void cancelDetachesBothSides() {
		ts.cancel();

		assertThat(left.hasSubscribers(), is(false));
		assertThat(right.hasSubscribers(), is(false));
	}

	@Test
	public void failingCombinerIsReported() {
		TestSubscriber<String> failing = TestSubscriber.create();
		Broadcaster<String> l = Broadcaster.create();
		Broadcaster<Integer> r = Broadcaster.create();

		l.<Integer, String>combineLatestOnLeft(r, (a, b) -> {
			throw new IllegalArgumentException("cannot combine " + a);
		}, clock)
		 .subscribe(failing);

		r.onNext(1);
		clock.setEpochMillis(1L);
		l.onNext("a");

		failing.assertError(IllegalArgumentException.class)
		       .assertErrorMessage("cannot combine a");
		assertThat(l.hasSubscribers(), is(false));
		assertThat(r.hasSubscribers(), is(false));
	}
}
