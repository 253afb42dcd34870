package org.labsuite.codonlib;

/**
 * A set of bases that has no IUPAC symbol. Only the empty set is in this situation, so this always indicates a bug.
 * @author dmyersturnbull
 */
@SuppressWarnings("serial")
public class NoCanonicalCodeException extends IllegalStateException {

	public NoCanonicalCodeException(String message) {
		super(message);
	}

}
