package org.labsuite.codonlib;

/**
 * A degenerate codon that is not exactly 3 symbols long.
 * @author dmyersturnbull
 */
@SuppressWarnings("serial")
public class InvalidCodonLengthException extends LibraryDesignException {

	private final String codon;

	public InvalidCodonLengthException(String codon) {
		super("Codon must be exactly 3 bases long, but got \"" + codon + "\" (" + codon.length() + ")");
		this.codon = codon;
	}

	public String getCodon() {
		return codon;
	}

}
