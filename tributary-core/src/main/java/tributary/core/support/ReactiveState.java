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

import java.util.Iterator;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;

/**
 * A component that is forming a Publisher or Subscriber graph and can expose its links and state for introspection.
 *
 * @author Stephane Maldini
 */
public interface ReactiveState {

	/*

	Upstream State : Publisher(S), outstanding request, ...

	 */

	/**
	 * A component that is linked to a source {@link Publisher}. Useful to traverse from left to right a pipeline of
	 * reactive actions implementing this interface.
	 */
	interface Upstream extends ReactiveState {

		/**
		 * Return the direct source of data, Supports reference
		 */
		Object upstream();
	}

	/**
	 * A component that is linked to N {@link Publisher}. Useful to traverse from left to right a pipeline of reactive
	 * actions implementing this interface.
	 */
	interface LinkedUpstreams extends ReactiveState {

		/**
		 * Return the connected sources of data
		 */
		Iterator<?> upstreams();

		/**
		 * @return the number of upstreams
		 */
		long upstreamsCount();
	}

	/*

	Downstream State : Subscriber(S), Request from downstream...

	 */

	/**
	 * A component that is linked to a target {@link Subscriber}. Useful to traverse from right to left a pipeline of
	 * reactive actions implementing this interface.
	 */
	interface Downstream extends ReactiveState {

		/**
		 * Return the direct data receiver
		 */
		Object downstream();
	}

	/**
	 * A component that is linked to N target {@link Subscriber}.
	 */
	interface LinkedDownstreams extends ReactiveState {

		/**
		 * @return the connected data receivers
		 */
		Iterator<?> downstreams();

		/**
		 * @return the number of connected data receivers
		 */
		long downstreamsCount();
	}

	/**
	 * A request aware component
	 */
	interface DownstreamDemand extends ReactiveState {

		/**
		 * @return the outstanding demand from downstream
		 */
		long requestedFromDownstream();
	}

	/*

	Running State : Name, lifecycle,...

	 */

	/**
	 * An nameable component
	 */
	interface Named extends ReactiveState {

		/**
		 * Return defined name
		 */
		String getName();
	}

	/**
	 * A lifecycle backed upstream
	 */
	interface ActiveUpstream extends ReactiveState {

		boolean isStarted();

		boolean isTerminated();
	}

	/**
	 * A lifecycle backed downstream
	 */
	interface ActiveDownstream extends ReactiveState {

		boolean isCancelled();
	}

	/**
	 * A component that is delegating to a user function
	 */
	interface FeedbackLoop extends ReactiveState {

		Object delegateInput();

		Object delegateOutput();
	}

	/**
	 * A component that creates a new subscription graph on each subscribe
	 */
	interface Factory extends ReactiveState {

	}

	/*
			Core System Env
	 */

	/**
	 * Log cancellation of inner subscriptions at debug level. Set with {@code tributary.trace.cancel}.
	 */
	boolean TRACE_CANCEL = Boolean.parseBoolean(System.getProperty("tributary.trace.cancel", "false"));

	/**
	 * Default blocking wait in milliseconds used by test and await helpers. Set with
	 * {@code tributary.await.defaultTimeout}.
	 */
	long DEFAULT_TIMEOUT = Long.parseLong(System.getProperty("tributary.await.defaultTimeout", "30000"));
}
