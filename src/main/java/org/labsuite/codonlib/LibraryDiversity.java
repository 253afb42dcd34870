package org.labsuite.codonlib;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

/**
 * The number of distinct variants in a combinatorial library: the product of the codon counts of its positions.
 * The value is exact at any size; {@link #format()} switches to exponential notation from 1000 on.
 * @author dmyersturnbull
 */
public final class LibraryDiversity {

	private static final BigInteger EXPONENTIAL_FROM = BigInteger.valueOf(1000);

	// the largest integer a double holds exactly
	private static final BigInteger EXACT_DOUBLE_LIMIT = BigInteger.ONE.shiftLeft(53);

	private final BigInteger value;

	public LibraryDiversity(BigInteger value) {
		if (value.signum() < 0) throw new IllegalArgumentException("Diversity " + value + " is negative");
		this.value = value;
	}

	/**
	 * Returns the product of the codon counts of {@code analyses}.
	 */
	public static LibraryDiversity of(List<PositionAnalysis> analyses) {
		BigInteger product = BigInteger.ONE;
		for (PositionAnalysis analysis : analyses) {
			product = product.multiply(BigInteger.valueOf(analysis.getTotalCodons()));
		}
		return new LibraryDiversity(product);
	}

	public BigInteger getValue() {
		return value;
	}

	/**
	 * Returns whether the value is too large to hold exactly in a double.
	 */
	public boolean exceedsDoublePrecision() {
		return value.compareTo(EXACT_DOUBLE_LIMIT) > 0;
	}

	/**
	 * Formats the value for display: the plain integer below 1000, otherwise a mantissa with 2 decimals and a signed
	 * exponent, as in {@code 3.28e+4}. Halves round up.
	 */
	public String format() {
		if (value.compareTo(EXPONENTIAL_FROM) < 0) return value.toString();
		BigDecimal rounded = new BigDecimal(value).round(new MathContext(3, RoundingMode.HALF_UP));
		String digits = rounded.unscaledValue().toString();
		// rounding can carry into a new digit (9995 -> 1.00e+4), which shows up as the exponent
		int exponent = digits.length() - 1 - rounded.scale();
		while (digits.length() < 3) digits = digits + "0";
		return digits.charAt(0) + "." + digits.substring(1, 3) + "e+" + exponent;
	}

	@Override
	public int hashCode() {
		return value.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (!(obj instanceof LibraryDiversity)) return false;
		return value.equals(((LibraryDiversity) obj).value);
	}

	@Override
	public String toString() {
		return format();
	}

}
