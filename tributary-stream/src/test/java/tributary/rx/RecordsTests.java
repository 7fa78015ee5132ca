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

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;
import tributary.core.subscriber.TestSubscriber;

import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertThat;

public class RecordsTests {

	static Map<String, Object> record(String key, Object value) {
		Map<String, Object> record = new LinkedHashMap<>();
		record.put(key, value);
		return record;
	}

	@Test
	public void whereTrueAndFalseMatchBooleans() {
		TestSubscriber<Object> trues = TestSubscriber.create();
		TestSubscriber<Object> falses = TestSubscriber.create();
		Stream<Object> source = Streams.<Object>just(true, "true", false, 1, Boolean.TRUE);

		source.whereTrue().subscribe(trues);
		source.whereFalse().subscribe(falses);

		trues.assertValues(true, true)
		     .assertComplete();
		falses.assertValues(false)
		      .assertComplete();
	}

	@Test
	public void whereTrueOnPropertyMatchesRecords() {
		Map<String, Object> active = record("active", true);
		Map<String, Object> inactive = record("active", false);
		Map<String, Object> unknown = record("name", "x");
		TestSubscriber<Object> trues = TestSubscriber.create();
		TestSubscriber<Object> falses = TestSubscriber.create();
		Stream<Object> source = Streams.<Object>just(active, inactive, unknown, "active");

		source.whereTrue("active").subscribe(trues);
		source.whereFalse("active").subscribe(falses);

		trues.assertValues(active);
		falses.assertValues(inactive);
	}

	@Test
	public void wrapAsBuildsARecordPerValue() {
		TestSubscriber<Map<String, Object>> ts = TestSubscriber.create();

		Streams.just(1, 2)
		       .wrapAs("count")
		       .subscribe(ts);

		ts.assertValues(record("count", 1), record("count", 2))
		  .assertComplete();
	}

	@Test
	public void appendAsCopiesRecords() {
		Map<String, Object> input = record("name", "tributary");
		TestSubscriber<Map<String, Object>> ts = TestSubscriber.create();

		Streams.<Object>just(input)
		       .appendAs("kind", Injection.value("library"))
		       .subscribe(ts);

		Map<String, Object> appended = ts.values().get(0);
		assertThat(appended, hasEntry("name", (Object) "tributary"));
		assertThat(appended, hasEntry("kind", (Object) "library"));
		assertThat(input, not(hasEntry("kind", (Object) "library")));
	}

	@Test
	public void appendAsWrapsPlainValues() {
		TestSubscriber<Map<String, Object>> ts = TestSubscriber.create();

		Streams.just("abc")
		       .appendAs("length", Injection.<String, Integer>computed(String::length))
		       .subscribe(ts);

		ts.assertValues(record("length", 3));
	}

	@Test
	public void computedInjectionIsResolvedOncePerValue() {
		int[] calls = {0};
		TestSubscriber<Map<String, Object>> ts = TestSubscriber.create();

		Streams.just(1, 2, 3)
		       .appendAs("call", Injection.<Integer, Integer>computed(i -> ++calls[0]))
		       .subscribe(ts);

		assertThat(calls[0], is(3));
		ts.assertValues(record("call", 1), record("call", 2), record("call", 3));
	}

	@Test
	public void convertPropertyWritesTheConvertedValue() {
		Map<String, Object> celsius = record("celsius", 100);
		TestSubscriber<Object> ts = TestSubscriber.create();

		Streams.<Object>just(celsius, record("other", 1), "plain")
		       .convertProperty("celsius", "fahrenheit", c -> (Integer) c * 9 / 5 + 32)
		       .subscribe(ts);

		Map<String, Object> expected = new HashMap<>();
		expected.put("celsius", 100);
		expected.put("fahrenheit", 212);

		ts.assertValues(expected, record("other", 1), "plain")
		  .assertComplete();
		assertThat(celsius.containsKey("fahrenheit"), is(false));
	}

	@Test
	public void convertPropertyCanRewriteInPlace() {
		TestSubscriber<Object> ts = TestSubscriber.create();

		Streams.<Object>just(record("name", "tributary"))
		       .convertProperty("name", "name", n -> ((String) n).toUpperCase())
		       .subscribe(ts);

		ts.assertValues(record("name", "TRIBUTARY"));
	}

	@Test
	public void selectPropertyReadsRecords() {
		TestSubscriber<Object> ts = TestSubscriber.create();

		Streams.<Object>just(record("id", 42), record("other", 1), Collections.emptyMap(), "plain")
		       .selectProperty("id")
		       .subscribe(ts);

		ts.assertValues(42, record("other", 1), Collections.emptyMap(), "plain");
	}

	@Test
	public void nullPropertyValueFails() {
		TestSubscriber<Object> ts = TestSubscriber.create();

		Streams.<Object>just(record("id", null))
		       .selectProperty("id")
		       .subscribe(ts);

		ts.assertError(NullPointerException.class);
	}
}
