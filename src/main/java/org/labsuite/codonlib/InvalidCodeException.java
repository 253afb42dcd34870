package org.labsuite.codonlib;

/**
 * A character that is not one of the 15 IUPAC nucleotide codes.
 * @author dmyersturnbull
 */
@SuppressWarnings("serial")
public class InvalidCodeException extends LibraryDesignException {

	private final char symbol;

	public InvalidCodeException(char symbol) {
		super("Invalid IUPAC code: " + symbol);
		this.symbol = symbol;
	}

	/**
	 * Returns the offending character, as it was given.
	 */
	public char getSymbol() {
		return symbol;
	}

}
