package org.labsuite.codonlib;

import java.math.BigInteger;

/**
 * How a library of a given diversity can be screened.
 * @author dmyersturnbull
 */
public enum LibraryScale {

	COMPLETE_SCREENING("Library size is manageable for complete screening"),
	SAMPLING("Library size requires sampling strategies"),
	TOO_LARGE("Very large library - consider reducing diversity");

	private static final BigInteger SAMPLING_FROM = BigInteger.TEN.pow(6);
	private static final BigInteger TOO_LARGE_FROM = BigInteger.TEN.pow(9);

	private final String recommendation;

	private LibraryScale(String recommendation) {
		this.recommendation = recommendation;
	}

	public String getRecommendation() {
		return recommendation;
	}

	public static LibraryScale of(LibraryDiversity diversity) {
		if (diversity.getValue().compareTo(SAMPLING_FROM) < 0) return COMPLETE_SCREENING;
		if (diversity.getValue().compareTo(TOO_LARGE_FROM) < 0) return SAMPLING;
		return TOO_LARGE;
	}

}
