package com.github.micycle1.spatialindex;

import java.util.Objects;

/**
 * Raised for invalid index configuration or for an entity that cannot be
 * placed inside the tree it is built into. Messages are prefixed with the
 * {@link ErrorKind}.
 */
public final class SpatialIndexException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public enum ErrorKind {
		/** Invalid configuration values or unsupported input shape. */
		CONFIGURATION,
		/**
		 * An entity fell outside the root bounds derived for it. Indicates a
		 * programming error or non-finite coordinates.
		 */
		BOUNDS_VIOLATION
	}

	private final ErrorKind kind;

	public SpatialIndexException(ErrorKind kind, String message) {
		super(formatMessage(kind, message));
		this.kind = kind;
	}

	public SpatialIndexException(ErrorKind kind, String message, Throwable cause) {
		super(formatMessage(kind, message), cause);
		this.kind = kind;
	}

	public ErrorKind getKind() {
		return kind;
	}

	private static String formatMessage(ErrorKind kind, String message) {
		return "[" + Objects.requireNonNull(kind, "kind") + "] " + Objects.requireNonNull(message, "message");
	}
}
