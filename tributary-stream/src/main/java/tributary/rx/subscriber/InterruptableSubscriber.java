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

package tributary.rx.subscriber;

import tributary.core.subscriber.ConsumerSubscriber;
import tributary.fn.Consumer;

/**
 * A {@link ConsumerSubscriber} exposed as a {@link Control} to its caller.
 *
 * @param <T> the consumed value type
 * @author Stephane Maldini
 */
public class InterruptableSubscriber<T> extends ConsumerSubscriber<T> implements Control {

	public InterruptableSubscriber(Consumer<? super T> consumer,
			Consumer<? super Throwable> errorConsumer,
			Consumer<Void> completeConsumer) {
		super(consumer, errorConsumer, completeConsumer);
	}

	@Override
	public String toString() {
		return "{terminated: " + isTerminated() + "}";
	}
}
