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
import tributary.core.subscriber.SubscriberDeferredScalar;

/**
 * Emits only the last value of the source, once it completes. An empty source completes without value.
 *
 * @param <T> the value type
 */
public final class StreamLast<T> extends StreamBarrier<T, T> {

	public StreamLast(Publisher<? extends T> source) {
		super(source);
	}

	@Override
	public Subscriber<? super T> apply(Subscriber<? super T> s) {
		return new StreamLastSubscriber<>(s);
	}

	static final class StreamLastSubscriber<T> extends SubscriberDeferredScalar<T, T> {

		StreamLastSubscriber(Subscriber<? super T> actual) {
			super(actual);
		}

		@Override
		public void onNext(T t) {
			value = t;
		}
	}
}
