package org.labsuite.codonlib;

/**
 * Thrown when removing a position would leave a {@link Library} empty.
 * @author dmyersturnbull
 */
@SuppressWarnings("serial")
public class CannotRemoveLastPositionException extends LibraryDesignException {

	public CannotRemoveLastPositionException(Position position) {
		super("Cannot remove " + position.getName() + ": a library needs at least one position");
	}

}
