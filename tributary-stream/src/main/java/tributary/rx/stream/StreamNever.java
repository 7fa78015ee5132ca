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

import org.reactivestreams.Subscriber;
import tributary.core.subscription.EmptySubscription;
import tributary.rx.Stream;

/**
 * Never signals anything but onSubscribe.
 */
public final class StreamNever extends Stream<Object> {

	private static final StreamNever INSTANCE = new StreamNever();

	/**
	 * @param <T> the value type
	 * @return the shared never stream
	 */
	@SuppressWarnings("unchecked")
	public static <T> Stream<T> instance() {
		return (Stream<T>) (Stream<?>) INSTANCE;
	}

	private StreamNever() {
	}

	@Override
	public void subscribe(Subscriber<? super Object> s) {
		s.onSubscribe(EmptySubscription.INSTANCE);
	}
}
