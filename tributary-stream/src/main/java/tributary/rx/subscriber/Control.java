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

package tributary.rx.subscriber;

/**
 * A handle on a running consumption, such as returned by {@link tributary.rx.Stream#consume(tributary.fn.Consumer)}.
 *
 * @author Stephane Maldini
 */
public interface Control {

	/**
	 * Stop consuming signals from upstream. Cancel should not be considered blocking.
	 */
	void cancel();

	/**
	 * Check if the consumption has received a terminal signal or has been cancelled.
	 */
	boolean isTerminated();
}
