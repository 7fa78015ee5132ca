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
import org.reactivestreams.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tributary.core.support.BackpressureUtils;

/**
 * Logs every signal passing through, in both directions, to an SLF4J category.
 *
 * @param <T> the value type
 * @author Stephane Maldini
 */
public final class StreamLog<T> extends StreamBarrier<T, T> {

	public static final int SUBSCRIBE    = 0b01000000;
	public static final int ON_SUBSCRIBE = 0b00100000;
	public static final int ON_NEXT      = 0b00010000;
	public static final int ON_ERROR     = 0b00001000;
	public static final int ON_COMPLETE  = 0b00000100;
	public static final int REQUEST      = 0b00000010;
	public static final int CANCEL       = 0b00000001;
	public static final int TERMINAL     = CANCEL | ON_COMPLETE | ON_ERROR;

	public static final int ALL = 0b1111111;

	private final Logger log;

	private final int options;

	public StreamLog(Publisher<? extends T> source, String category, int options) {
		super(source);
		this.log = category != null && !category.isEmpty() ?
				LoggerFactory.getLogger(category) :
				LoggerFactory.getLogger(StreamLog.class);
		this.options = options;
	}

	@Override
	public Subscriber<? super T> apply(Subscriber<? super T> subscriber) {
		if ((options & SUBSCRIBE) == SUBSCRIBE && log.isInfoEnabled()) {
			log.info("subscribe: {}", subscriber.getClass().getSimpleName());
		}
		return new LoggerBarrier<>(log, subscriber, options);
	}

	static final class LoggerBarrier<T> implements Subscriber<T>, Subscription, Downstream, Upstream {

		final Subscriber<? super T> actual;
		final Logger                log;
		final int                   options;

		Subscription s;

		LoggerBarrier(Logger log, Subscriber<? super T> actual, int options) {
			this.actual = actual;
			this.log = log;
			this.options = options;
		}

		@Override
		public void onSubscribe(Subscription s) {
			if (BackpressureUtils.validate(this.s, s)) {
				this.s = s;
				if ((options & ON_SUBSCRIBE) == ON_SUBSCRIBE && log.isInfoEnabled()) {
					log.info("onSubscribe({})", s);
				}
				actual.onSubscribe(this);
			}
		}

		@Override
		public void onNext(T t) {
			if ((options & ON_NEXT) == ON_NEXT && log.isInfoEnabled()) {
				log.info("onNext({})", t);
			}
			actual.onNext(t);
		}

		@Override
		public void onError(Throwable t) {
			if ((options & ON_ERROR) == ON_ERROR && log.isErrorEnabled()) {
				log.error("onError({})", t.toString(), t);
			}
			actual.onError(t);
		}

		@Override
		public void onComplete() {
			if ((options & ON_COMPLETE) == ON_COMPLETE && log.isInfoEnabled()) {
				log.info("onComplete()");
			}
			actual.onComplete();
		}

		@Override
		public void request(long n) {
			if ((options & REQUEST) == REQUEST && log.isInfoEnabled()) {
				log.info("request({})", Long.MAX_VALUE == n ? "unbounded" : n);
			}
			s.request(n);
		}

		@Override
		public void cancel() {
			if ((options & CANCEL) == CANCEL && log.isInfoEnabled()) {
				log.info("cancel()");
			}
			s.cancel();
		}

		@Override
		public Object downstream() {
			return actual;
		}

		@Override
		public Object upstream() {
			return s;
		}

		@Override
		public String toString() {
			return "{logger=" + log.getName() + "}";
		}
	}
}
