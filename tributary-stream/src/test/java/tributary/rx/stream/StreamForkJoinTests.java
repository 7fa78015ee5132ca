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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Test;
import org.reactivestreams.Publisher;
import tributary.core.subscriber.TestSubscriber;
import tributary.rx.Stream;
import tributary.rx.Streams;
import tributary.rx.broadcast.Broadcaster;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class StreamForkJoinTests {

	@Test
	public void lastValueOfEachSourceIsEmittedInSourceOrder() {
		TestSubscriber<List<Integer>> ts = TestSubscriber.create();

		Streams.forkJoin(Arrays.asList(Streams.just(1), Streams.just(2, 3)))
		       .subscribe(ts);

		ts.assertValues(Arrays.asList(1, 3))
		  .assertComplete()
		  .assertNoError();
	}

	@Test
	public void orderFollowsSourcesNotCompletion() {
		Broadcaster<String> first = Broadcaster.create();
		Broadcaster<String> second = Broadcaster.create();
		Broadcaster<String> third = Broadcaster.create();
		TestSubscriber<List<String>> ts = TestSubscriber.create();

		Streams.forkJoin(Arrays.asList(first, second, third))
		       .subscribe(ts);

		third.onNext("c");
		third.onComplete();
		second.onNext("b1");
		second.onNext("b2");
		second.onComplete();

		ts.assertNoValues()
		  .assertNotTerminated();

		first.onNext("a");
		first.onComplete();

		ts.assertValues(Arrays.asList("a", "b2", "c"))
		  .assertComplete();
	}

	@Test
	public void singleSourceIsWrappedInAList() {
		TestSubscriber<List<String>> ts = TestSubscriber.create();

		Streams.forkJoin(Collections.singletonList(Streams.just("only")))
		       .subscribe(ts);

		ts.assertValues(Collections.singletonList("only"))
		  .assertComplete();
	}

	@Test
	public void emittedListIsUnmodifiable() {
		AtomicReference<List<Integer>> result = new AtomicReference<>();

		Streams.forkJoin(Arrays.asList(Streams.just(1), Streams.just(2)))
		       .consume(result::set);

		assertThat(result.get(), contains(1, 2));
		try {
			result.get().add(3);
		}
		catch (UnsupportedOperationException expected) {
			return;
		}
		throw new AssertionError("The joined list must be unmodifiable");
	}

	@Test
	public void firstErrorCancelsOtherSources() {
		Broadcaster<Integer> first = Broadcaster.create();
		Broadcaster<Integer> second = Broadcaster.create();
		Broadcaster<Integer> third = Broadcaster.create();
		TestSubscriber<List<Integer>> ts = TestSubscriber.create();

		Streams.forkJoin(Arrays.asList(first, second, third))
		       .subscribe(ts);

		second.onNext(2);
		second.onComplete();
		third.onNext(3);

		first.onError(new IllegalStateException("first failed"));

		ts.assertNoValues()
		  .assertError(IllegalStateException.class)
		  .assertErrorMessage("first failed");

		assertThat(third.hasSubscribers(), is(false));

		third.onError(new IllegalStateException("late"));

		ts.assertErrorMessage("first failed");
	}

	@Test
	public void failedSourceAtSubscriptionStopsSubscribingTheRest() {
		Broadcaster<Integer> tail = Broadcaster.create();
		TestSubscriber<List<Integer>> ts = TestSubscriber.create();

		Streams.forkJoin(Arrays.<Publisher<Integer>>asList(Streams.fail(new IllegalArgumentException("boom")),
				tail))
		       .subscribe(ts);

		ts.assertError(IllegalArgumentException.class)
		  .assertNoValues();
		assertThat(tail.hasSubscribers(), is(false));
	}

	@Test
	public void sourceCompletingEmptyPreventsAnyTerminalSignal() throws InterruptedException {
		TestSubscriber<List<Integer>> ts = TestSubscriber.create();

		Streams.forkJoin(Arrays.asList(Streams.just(1), Streams.<Integer>empty(), Streams.just(3)))
		       .subscribe(ts);

		CountDownLatch never = new CountDownLatch(1);
		assertThat(never.await(200, TimeUnit.MILLISECONDS), is(false));

		ts.assertNoValues()
		  .assertNotTerminated();
	}

	@Test
	public void neverEndingSourceHoldsTheJoin() {
		TestSubscriber<List<Integer>> ts = TestSubscriber.create();

		Streams.forkJoin(Arrays.asList(Streams.just(1), Streams.<Integer>never()))
		       .subscribe(ts);

		ts.assertSubscribed()
		  .assertNoValues()
		  .assertNotTerminated();
	}

	@Test
	public void cancellingTheJoinCancelsEverySource() {
		Broadcaster<Integer> first = Broadcaster.create();
		Broadcaster<Integer> second = Broadcaster.create();
		TestSubscriber<List<Integer>> ts = TestSubscriber.create();

		Streams.forkJoin(Arrays.asList(first, second))
		       .subscribe(ts);

		assertThat(first.hasSubscribers(), is(true));
		assertThat(second.hasSubscribers(), is(true));

		ts.cancel();

		assertThat(first.hasSubscribers(), is(false));
		assertThat(second.hasSubscribers(), is(false));

		first.onNext(1);
		first.onComplete();
		ts.assertNoValues()
		  .assertNotTerminated();
	}

	@Test
	public void resultWaitsForDownstreamDemand() {
		TestSubscriber<List<Integer>> ts = TestSubscriber.create(0);

		Streams.forkJoin(Arrays.asList(Streams.just(1), Streams.just(2)))
		       .subscribe(ts);

		ts.assertNoValues()
		  .assertNotTerminated();

		ts.request(1);

		ts.assertValues(Arrays.asList(1, 2))
		  .assertComplete();
	}

	@Test
	public void eachSubscriptionRunsItsOwnJoin() {
		Stream<List<Integer>> joined = Streams.forkJoin(Arrays.asList(Streams.just(1), Streams.just(2)));

		TestSubscriber<List<Integer>> ts1 = joined.subscribeWith(TestSubscriber.<List<Integer>>create());
		TestSubscriber<List<Integer>> ts2 = joined.subscribeWith(TestSubscriber.<List<Integer>>create());

		ts1.assertValues(Arrays.asList(1, 2)).assertComplete();
		ts2.assertValues(Arrays.asList(1, 2)).assertComplete();
	}

	@Test
	public void asyncSourcesAreJoined() throws InterruptedException {
		Broadcaster<Integer> first = Broadcaster.create();
		Broadcaster<Integer> second = Broadcaster.create();
		TestSubscriber<List<Integer>> ts = TestSubscriber.create();

		Streams.forkJoin(Arrays.asList(first, second))
		       .subscribe(ts);

		Thread t1 = new Thread(() -> {
			first.onNext(10);
			first.onComplete();
		});
		Thread t2 = new Thread(() -> {
			second.onNext(20);
			second.onComplete();
		});
		t1.start();
		t2.start();

		ts.await(5, TimeUnit.SECONDS)
		  .assertValues(Arrays.asList(10, 20))
		  .assertComplete();
	}

	@Test(expected = IllegalArgumentException.class)
	public void noSourceIsRejected() {
		Streams.forkJoin(Collections.<Publisher<Integer>>emptyList());
	}

	@Test(expected = NullPointerException.class)
	public void nullSourceIsRejected() {
		Streams.forkJoin(Arrays.asList(Streams.just(1), null));
	}
}
