package org.labsuite.codonlib;

/**
 * One of the four concrete DNA bases.
 * The declaration order (A, C, G, T) is the one base ordering used everywhere a tie has to be broken.
 * @author dmyersturnbull
 */
public enum Nucleotide {

	A, C, G, T;

	public char getSymbol() {
		return name().charAt(0);
	}

	/**
	 * Returns the base for {@code symbol}, ignoring case, or null if it is not one of A, C, G or T.
	 */
	public static Nucleotide fromSymbol(char symbol) {
		switch (Character.toUpperCase(symbol)) {
		case 'A':
			return A;
		case 'C':
			return C;
		case 'G':
			return G;
		case 'T':
			return T;
		default:
			return null;
		}
	}

}
