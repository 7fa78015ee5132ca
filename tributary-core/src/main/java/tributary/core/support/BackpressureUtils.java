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

package tributary.core.support;

import java.util.concurrent.atomic.AtomicLongFieldUpdater;

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tributary.core.error.SpecificationExceptions;

/**
 * Demand accounting and subscription validation shared by operators.
 *
 * @author Stephane Maldini
 * @author David Karnok
 */
public abstract class BackpressureUtils {

	private static final Logger log = LoggerFactory.getLogger(BackpressureUtils.class);

	/**
	 * Check Subscription current state and cancel new Subscription if current is already set, returning true if
	 * ready to subscribe.
	 *
	 * @param current current Subscription, expected to be null
	 * @param s new Subscription
	 * @return true if Subscription can be used
	 */
	public static boolean validate(Subscription current, Subscription s) {
		if (s == null) {
			throw SpecificationExceptions.spec_2_13_exception();
		}
		if (current != null) {
			s.cancel();
			reportSubscriptionSet();
			return false;
		}
		return true;
	}

	/**
	 * Evaluate if a request is strictly positive otherwise log a rule 3.09 violation.
	 *
	 * @param n the request value
	 * @return true if valid
	 */
	public static boolean validate(long n) {
		if (n <= 0L) {
			reportBadRequest(n);
			return false;
		}
		return true;
	}

	/**
	 * Throws an exception if request is 0 or negative as specified in rule 3.09 of Reactive Streams, signalling it
	 * to the given subscriber when there is one.
	 *
	 * @param n          demand to check
	 * @param subscriber Subscriber to onError if non strict positive n
	 * @return true if valid or false if specification exception occured
	 */
	public static boolean checkRequest(long n, Subscriber<?> subscriber) {
		if (n <= 0L) {
			if (null != subscriber) {
				subscriber.onError(SpecificationExceptions.spec_3_09_exception(n));
			}
			else {
				throw SpecificationExceptions.spec_3_09_exception(n);
			}
			return false;
		}
		return true;
	}

	/**
	 * Cap an addition to Long.MAX_VALUE
	 *
	 * @param a left operand
	 * @param b right operand
	 * @return Addition result or Long.MAX_VALUE if overflow
	 */
	public static long addOrLongMax(long a, long b) {
		long res = a + b;
		if (res < 0L) {
			return Long.MAX_VALUE;
		}
		return res;
	}

	/**
	 * Concurrent addition bound to Long.MAX_VALUE.
	 * Any concurrent write will "happen" before this operation.
	 *
	 * @param updater  current field updater
	 * @param instance current instance to update
	 * @param toAdd    delta to add
	 * @param <T> the instance type
	 * @return the previous value, or Long.MAX_VALUE
	 */
	public static <T> long getAndAdd(AtomicLongFieldUpdater<T> updater, T instance, long toAdd) {
		long r, u;
		do {
			r = updater.get(instance);
			if (r == Long.MAX_VALUE) {
				return Long.MAX_VALUE;
			}
			u = addOrLongMax(r, toAdd);
		}
		while (!updater.compareAndSet(instance, r, u));

		return r;
	}

	/**
	 * Concurrent substraction bound to 0, unbounded demand staying unbounded.
	 *
	 * @param updater  current field updater
	 * @param instance current instance to update
	 * @param toSub    delta to sub
	 * @param <T> the instance type
	 * @return the updated value
	 */
	public static <T> long produced(AtomicLongFieldUpdater<T> updater, T instance, long toSub) {
		long r, u;
		do {
			r = updater.get(instance);
			if (r == 0 || r == Long.MAX_VALUE) {
				return r;
			}
			u = r - toSub;
			if (u < 0L) {
				u = 0L;
			}
		}
		while (!updater.compareAndSet(instance, r, u));

		return u;
	}

	/**
	 * Log a duplicate onSubscribe, rule 2.12 of Reactive Streams.
	 */
	public static void reportSubscriptionSet() {
		log.error("Duplicate subscription", SpecificationExceptions.spec_2_12_exception());
	}

	/**
	 * Log a non strictly positive request, rule 3.09 of Reactive Streams.
	 *
	 * @param n the invalid request
	 */
	public static void reportBadRequest(long n) {
		log.error("Invalid request", SpecificationExceptions.spec_3_09_exception(n));
	}
}
