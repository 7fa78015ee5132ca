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

package tributary.rx;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import tributary.core.support.Assert;
import tributary.fn.Function;
import tributary.fn.Predicate;

/**
 * Predicates and projections over schema-less records, {@code Map<String, Object>} keyed by property name. Records
 * are never modified: a projection changing a property returns a copy.
 */
public final class Records {

	private Records() {
	}

	/**
	 * @param expected the boolean to match
	 * @return a predicate matching values equal to {@code expected}
	 */
	public static Predicate<Object> is(final boolean expected) {
		return x -> Boolean.valueOf(expected).equals(x);
	}

	/**
	 * @param property the property to read
	 * @param expected the boolean to match
	 * @return a predicate matching records whose property is equal to {@code expected}
	 */
	public static Predicate<Object> is(final String property, final boolean expected) {
		Assert.notNull(property, "property must not be null");
		return x -> x instanceof Map && Boolean.valueOf(expected).equals(((Map<?, ?>) x).get(property));
	}

	/**
	 * @param property the property to create
	 * @param <T> the wrapped value type
	 * @return a projection returning a new record holding the value under {@code property}
	 */
	public static <T> Function<T, Map<String, Object>> wrapAs(final String property) {
		Assert.notNull(property, "property must not be null");
		return x -> {
			Map<String, Object> record = new LinkedHashMap<>();
			record.put(property, x);
			return record;
		};
	}

	/**
	 * @param property the property to set
	 * @param data the value to set, resolved once per value
	 * @param <T> the value type
	 * @return a projection returning a copy of a record with {@code property} set, or a new record holding only
	 * {@code property} when the value is not a record
	 */
	public static <T> Function<T, Map<String, Object>> appendAs(final String property,
			final Injection<? super T, ?> data) {
		Assert.notNull(property, "property must not be null");
		Objects.requireNonNull(data, "data");
		return x -> {
			Map<String, Object> record = x instanceof Map ? copy((Map<?, ?>) x) : new LinkedHashMap<>();
			record.put(property, data.resolve(x));
			return record;
		};
	}

	/**
	 * @param from the property to read
	 * @param to the property to write, possibly the same
	 * @param converter the conversion to apply
	 * @return a projection returning a copy of a record holding {@code from} with {@code to} set to the converted
	 * value, and any other value unchanged
	 */
	public static Function<Object, Object> convertProperty(final String from,
			final String to,
			final Function<Object, ?> converter) {
		Assert.notNull(from, "from must not be null");
		Assert.notNull(to, "to must not be null");
		Objects.requireNonNull(converter, "converter");
		return x -> {
			if (!(x instanceof Map) || !((Map<?, ?>) x).containsKey(from)) {
				return x;
			}
			Map<String, Object> record = copy((Map<?, ?>) x);
			record.put(to, converter.apply(record.get(from)));
			return record;
		};
	}

	/**
	 * @param property the property to read
	 * @return a projection returning the property of a record holding it, and any other value unchanged
	 */
	public static Function<Object, Object> selectProperty(final String property) {
		Assert.notNull(property, "property must not be null");
		return x -> {
			if (x instanceof Map && ((Map<?, ?>) x).containsKey(property)) {
				return ((Map<?, ?>) x).get(property);
			}
			return x;
		};
	}

	static Map<String, Object> copy(Map<?, ?> source) {
		Map<String, Object> record = new LinkedHashMap<>();
		for (Map.Entry<?, ?> e : source.entrySet()) {
			record.put(String.valueOf(e.getKey()), e.getValue());
		}
		return record;
	}
}
