package org.labsuite.codonlib;

/**
 * An error in a library design request made by a user: a malformed codon, an unusable target, or an edit that the
 * library refuses. The message is meant to be shown to the user as it is.
 * @author dmyersturnbull
 */
@SuppressWarnings("serial")
public class LibraryDesignException extends Exception {

	public LibraryDesignException() {
		super();
	}

	public LibraryDesignException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
		super(message, cause, enableSuppression, writableStackTrace);
	}

	public LibraryDesignException(String message, Throwable cause) {
		super(message, cause);
	}

	public LibraryDesignException(String message) {
		super(message);
	}

	public LibraryDesignException(Throwable cause) {
		super(cause);
	}

}
