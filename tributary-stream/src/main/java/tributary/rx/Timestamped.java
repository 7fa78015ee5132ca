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

import java.time.Instant;
import java.util.Objects;

/**
 * A value tagged with the instant it was observed.
 *
 * @param <T> the value type
 */
public final class Timestamped<T> {

	private final T       value;
	private final Instant timestamp;

	public Timestamped(T value, Instant timestamp) {
		this.value = Objects.requireNonNull(value, "value");
		this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
	}

	public T value() {
		return value;
	}

	public Instant timestamp() {
		return timestamp;
	}

	/**
	 * @param other the value to compare with
	 * @return true if this value was not observed before the other one
	 */
	public boolean isNotBefore(Timestamped<?> other) {
		return !timestamp.isBefore(other.timestamp);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Timestamped)) {
			return false;
		}
		Timestamped<?> that = (Timestamped<?>) o;
		return value.equals(that.value) && timestamp.equals(that.timestamp);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, timestamp);
	}

	@Override
	public String toString() {
		return value + "@" + timestamp;
	}
}
