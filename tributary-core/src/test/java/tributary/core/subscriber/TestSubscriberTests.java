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

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.Test;
import tributary.core.subscription.EmptySubscription;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class TestSubscriberTests {

	@Test
	public void waitForReturnsOnceConditionHolds() throws InterruptedException {
		AtomicBoolean ready = new AtomicBoolean();
		new Thread(() -> ready.set(true)).start();

		TestSubscriber.waitFor(5000, () -> "never ready", ready::get);

		assertThat(ready.get(), is(true));
	}

	@Test
	public void waitForFailsWithTheSuppliedMessage() throws InterruptedException {
		try {
			TestSubscriber.waitFor(50, () -> "still waiting", () -> false);
		}
		catch (AssertionError e) {
			assertThat(e.getMessage(), is("still waiting"));
			return;
		}
		fail("Expected an AssertionError");
	}

	@Test
	public void awaitValueCountBlocksUntilValuesArrive() throws InterruptedException {
		TestSubscriber<Integer> ts = TestSubscriber.create();
		ts.onSubscribe(EmptySubscription.INSTANCE);

		Thread producer = new Thread(() -> {
			for (int i = 0; i < 3; i++) {
				ts.onNext(i);
			}
			ts.onComplete();
		});
		producer.start();

		ts.awaitValueCount(3)
		  .await(5, TimeUnit.SECONDS)
		  .assertValues(0, 1, 2)
		  .assertTerminated()
		  .assertComplete();
	}

	@Test
	public void assertTerminatedFailsWhileRunning() {
		TestSubscriber<Integer> ts = TestSubscriber.create();
		ts.onSubscribe(EmptySubscription.INSTANCE);

		try {
			ts.assertTerminated();
		}
		catch (AssertionError e) {
			assertThat(e.getMessage(), is("Not terminated"));
			ts.onError(new IllegalStateException("failed"));
			ts.assertTerminated()
			  .assertErrorMessage("failed");
			return;
		}
		fail("Expected an AssertionError");
	}

	@Test
	public void concurrentCompletionsAreAllCounted() throws InterruptedException {
		int threads = 8;
		TestSubscriber<Integer> ts = TestSubscriber.create();
		ts.onSubscribe(EmptySubscription.INSTANCE);
		CountDownLatch start = new CountDownLatch(1);
		CountDownLatch done = new CountDownLatch(threads);

		for (int i = 0; i < threads; i++) {
			new Thread(() -> {
				try {
					start.await();
					for (int j = 0; j < 1000; j++) {
						ts.onComplete();
					}
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				finally {
					done.countDown();
				}
			}).start();
		}
		start.countDown();
		assertThat(done.await(10, TimeUnit.SECONDS), is(true));

		try {
			ts.assertComplete();
		}
		catch (AssertionError e) {
			assertThat(e.getMessage(), is("Multiple completions: " + threads * 1000));
			return;
		}
		fail("Expected an AssertionError");
	}
}
