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

package tributary.core.subscription;

import org.junit.Test;
import tributary.core.subscriber.TestSubscriber;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class DeferredScalarSubscriptionTests {

	@Test
	public void valueIsHeldUntilRequested() {
		TestSubscriber<String> ts = TestSubscriber.create(0);
		DeferredScalarSubscription<String> ds = new DeferredScalarSubscription<>(ts);
		ts.onSubscribe(ds);

		ds.complete("done");

		ts.assertNoValues()
		  .assertNotTerminated();

		ts.request(1);

		ts.assertValues("done")
		  .assertComplete()
		  .assertNoError();
	}

	@Test
	public void valueIsEmittedAtOnceWhenAlreadyRequested() {
		TestSubscriber<String> ts = TestSubscriber.create();
		DeferredScalarSubscription<String> ds = new DeferredScalarSubscription<>(ts);
		ts.onSubscribe(ds);

		ds.complete("done");

		ts.assertValues("done")
		  .assertComplete();
	}

	@Test
	public void onlyFirstCompletionIsDelivered() {
		TestSubscriber<String> ts = TestSubscriber.create();
		DeferredScalarSubscription<String> ds = new DeferredScalarSubscription<>(ts);
		ts.onSubscribe(ds);

		ds.complete("first");
		ds.complete("second");

		ts.assertValues("first")
		  .assertComplete();
	}

	@Test
	public void cancelledSubscriptionDropsValue() {
		TestSubscriber<String> ts = TestSubscriber.create(0);
		DeferredScalarSubscription<String> ds = new DeferredScalarSubscription<>(ts);
		ts.onSubscribe(ds);

		ts.cancel();
		ds.complete("late");
		ds.request(1);

		assertThat(ds.isCancelled(), is(true));
		ts.assertNoValues()
		  .assertNotTerminated();
	}
}
