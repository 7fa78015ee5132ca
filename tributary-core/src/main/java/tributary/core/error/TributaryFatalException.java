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

package tributary.core.error;

/**
 * An exception that is propagated upward and considered as "fatal" as per Reactive Stream limited list of exceptions
 * allowed to bubble. It is also a checked exception wrapper for the error consumers that cannot rethrow checked
 * exceptions.
 *
 * @author Stephane Maldini
 */
public class TributaryFatalException extends RuntimeException {

	private static final long serialVersionUID = -1568341284829612487L;

	public static TributaryFatalException create(Throwable root) {
		if (TributaryFatalException.class.isAssignableFrom(root.getClass())) {
			return (TributaryFatalException) root;
		}
		return new TributaryFatalException(root);
	}

	protected TributaryFatalException(Throwable root) {
		super(root);
	}

	protected TributaryFatalException(String message) {
		super(message);
	}
}
