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

import java.util.Objects;

import tributary.fn.Function;

/**
 * Data to inject into a record: either a literal value, or a value computed from the record's source element.
 *
 * @param <T> the source element type
 * @param <V> the injected value type
 * @see Stream#appendAs(String, Injection)
 */
public abstract class Injection<T, V> {

	/**
	 * @param value the literal to inject
	 * @param <T> the source element type
	 * @param <V> the injected value type
	 * @return an injection always resolving to the given value
	 */
	public static <T, V> Injection<T, V> value(V value) {
		return new Literal<>(value);
	}

	/**
	 * @param supplier the function computing the value from each element
	 * @param <T> the source element type
	 * @param <V> the injected value type
	 * @return an injection resolving by applying the function to each element
	 */
	public static <T, V> Injection<T, V> computed(Function<? super T, ? extends V> supplier) {
		return new Computed<>(supplier);
	}

	Injection() {
	}

	/**
	 * @param element the element being projected
	 * @return the value to inject for this element
	 */
	public abstract V resolve(T element);

	static final class Literal<T, V> extends Injection<T, V> {

		final V value;

		Literal(V value) {
			this.value = value;
		}

		@Override
		public V resolve(T element) {
			return value;
		}

		@Override
		public String toString() {
			return "{value: " + value + "}";
		}
	}

	static final class Computed<T, V> extends Injection<T, V> {

		final Function<? super T, ? extends V> supplier;

		Computed(Function<? super T, ? extends V> supplier) {
			this.supplier = Objects.requireNonNull(supplier, "supplier");
		}

		@Override
		public V resolve(T element) {
			return supplier.apply(element);
		}

		@Override
		public String toString() {
			return "{computed: " + supplier + "}";
		}
	}
}
