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

import java.util.HashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static utilities to decorate, inspect and report errors travelling along a reactive pipeline.
 *
 * @author Stephane Maldini
 */
public final class Exceptions {

	private static final Logger log = LoggerFactory.getLogger(Exceptions.class);

	private static final int MAX_DEPTH = 25;

	private Exceptions() {
	}

	/**
	 * Adds a {@code Throwable} to a causality-chain of Throwables, as an additional cause (if it does not
	 * already appear in the chain among the causes).
	 *
	 * @param e     the {@code Throwable} at the head of the causality chain
	 * @param cause the {@code Throwable} you want to add as a cause of the chain
	 */
	public static void addCause(Throwable e, Throwable cause) {
		Set<Throwable> seenCauses = new HashSet<>();

		int i = 0;
		while (e.getCause() != null) {
			if (i++ >= MAX_DEPTH) {
				// stack too deep to associate cause
				return;
			}
			e = e.getCause();
			if (!seenCauses.add(e)) {
				break;
			}
		}
		try {
			e.initCause(cause);
		}
		catch (IllegalStateException | IllegalArgumentException ise) {
			log.trace("Could not attach {} as the cause of {}", cause, e);
		}
	}

	/**
	 * Get the {@code Throwable} at the end of the causality-chain for a particular {@code Throwable}
	 *
	 * @param e the {@code Throwable} whose final cause you are curious about
	 * @return the last {@code Throwable} in the causality-chain of {@code e} (or a "Stack too deep to get
	 * final cause" {@code RuntimeException} if the chain is too long to traverse)
	 */
	public static Throwable getFinalCause(Throwable e) {
		int i = 0;
		while (e.getCause() != null) {
			if (i++ >= MAX_DEPTH) {
				return new RuntimeException("Stack too deep to get final cause");
			}
			e = e.getCause();
		}
		return e;
	}

	/**
	 * Try to find the last value at the end of the causality-chain for a particular {@code Throwable}.
	 *
	 * @param e the {@code Throwable} whose final cause you are curious about
	 * @return the value carried by a final {@link ValueCause}, or null
	 */
	public static Object getFinalValueCause(Throwable e) {
		Throwable t = getFinalCause(e);
		if (t instanceof ValueCause) {
			return ((ValueCause) t).getValue();
		}
		return null;
	}

	/**
	 * Adds the given item as the final cause of the given {@code Throwable}, wrapped in {@code ValueCause}.
	 *
	 * @param e     the {@link Throwable} to which you want to add a cause
	 * @param value the item you want to add to {@code e} as the cause of the {@code Throwable}
	 * @return the same {@code Throwable} ({@code e}) that was passed in, with {@code value} added to it as a
	 * cause
	 */
	public static Throwable addValueAsLastCause(Throwable e, Object value) {
		Throwable lastCause = getFinalCause(e);
		if (lastCause instanceof ValueCause) {
			// purposefully using == for object reference check
			if (((ValueCause) lastCause).getValue() == value) {
				return e;
			}
		}
		addCause(e, new ValueCause(value));
		return e;
	}

	/**
	 * Throws a particular {@code Throwable} only if it belongs to a set of "fatal" error varieties. These
	 * varieties are as follows:
	 * <ul>
	 * <li>{@link TributaryFatalException}</li>
	 * <li>{@code VirtualMachineError}</li>
	 * <li>{@code LinkageError}</li>
	 * </ul>
	 *
	 * @param t the error to check
	 */
	public static void throwIfFatal(Throwable t) {
		if (t instanceof TributaryFatalException) {
			throw (TributaryFatalException) t;
		}
		else if (t instanceof VirtualMachineError) {
			throw (VirtualMachineError) t;
		}
		else if (t instanceof LinkageError) {
			throw (LinkageError) t;
		}
	}

	/**
	 * An unexpected exception is about to be dropped, because the receiving subscriber has already terminated.
	 *
	 * @param e the dropped error
	 */
	public static void onErrorDropped(Throwable e) {
		throwIfFatal(e);
		log.warn("Error dropped after termination", e);
	}

	/**
	 * An unexpected event is about to be dropped, because the receiving subscriber has already terminated or has no
	 * outstanding demand.
	 *
	 * @param t the dropped value
	 * @param <T> the dropped value type
	 */
	public static <T> void onNextDropped(T t) {
		if (t != null && log.isDebugEnabled()) {
			log.debug("onNext dropped: {}", t);
		}
	}

	/**
	 * Represents an error that was encountered while trying to emit an item from a Publisher, and
	 * tries to preserve that item for future use and/or reporting.
	 */
	public static class ValueCause extends RuntimeException {

		private static final long serialVersionUID = -3454462756050397899L;

		private final Object value;

		/**
		 * Create a {@code ValueCause} error and include in its error message a string representation of
		 * the item that was intended to be emitted at the time the error was handled.
		 *
		 * @param value the item that the component was trying to emit at the time of the error
		 */
		public ValueCause(Object value) {
			super("Exception while signaling value: " + renderValue(value));
			this.value = value;
		}

		/**
		 * @return the item that the component was trying to emit at the time of the error
		 */
		public Object getValue() {
			return value;
		}

		private static String renderValue(Object value) {
			if (value == null) {
				return "null";
			}
			if (value instanceof String || value instanceof Number || value instanceof Boolean) {
				return value.toString();
			}
			if (value instanceof Enum) {
				return ((Enum<?>) value).name();
			}
			return value.getClass().getName() + ".class : " + value;
		}
	}
}
