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

package tributary.fn;

/**
 * Determines if the input object matches some criteria.
 *
 * @param <T> the type of object that the predicate can test
 * @author Jon Brisbin
 */
public interface Predicate<T> {

	/**
	 * Returns {@code true} if the given value matches the criteria, otherwise {@code false}.
	 *
	 * @param t The value to test
	 * @return {@code true} if the value matches, otherwise {@code false}.
	 */
	boolean test(T t);

}
