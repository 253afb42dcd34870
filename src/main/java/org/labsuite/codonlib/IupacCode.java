package org.labsuite.codonlib;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * The 15 IUPAC nucleotide codes: the 4 exact bases and the 11 ambiguity codes.
 * Each code stands for exactly one non-empty set of {@link Nucleotide nucleotides}, and every non-empty set has exactly
 * one code, so {@link #forBases(Set)} is the inverse of {@link #getBases()}.
 * @author dmyersturnbull
 */
public enum IupacCode {

	A(Nucleotide.A),
	C(Nucleotide.C),
	G(Nucleotide.G),
	T(Nucleotide.T),
	R(Nucleotide.A, Nucleotide.G), // puRine
	Y(Nucleotide.C, Nucleotide.T), // pYrimidine
	S(Nucleotide.C, Nucleotide.G), // Strong
	W(Nucleotide.A, Nucleotide.T), // Weak
	K(Nucleotide.G, Nucleotide.T), // Keto
	M(Nucleotide.A, Nucleotide.C), // aMino
	B(Nucleotide.C, Nucleotide.G, Nucleotide.T), // not A
	D(Nucleotide.A, Nucleotide.G, Nucleotide.T), // not C
	H(Nucleotide.A, Nucleotide.C, Nucleotide.T), // not G
	V(Nucleotide.A, Nucleotide.C, Nucleotide.G), // not T
	N(Nucleotide.A, Nucleotide.C, Nucleotide.G, Nucleotide.T); // aNy

	private static final Map<Set<Nucleotide>, IupacCode> byBases = new HashMap<>();

	static {
		for (IupacCode code : values()) {
			byBases.put(code.bases, code);
		}
	}

	private final Set<Nucleotide> bases;

	private IupacCode(Nucleotide first, Nucleotide... rest) {
		this.bases = Collections.unmodifiableSet(EnumSet.of(first, rest));
	}

	/**
	 * Returns the concrete bases this code stands for, in ascending order.
	 */
	public Set<Nucleotide> getBases() {
		return bases;
	}

	public boolean isAmbiguous() {
		return bases.size() > 1;
	}

	public char getSymbol() {
		return name().charAt(0);
	}

	/**
	 * Returns the code for {@code symbol}, ignoring case.
	 * @throws InvalidCodeException If {@code symbol} is not one of the 15 codes
	 */
	public static IupacCode fromSymbol(char symbol) throws InvalidCodeException {
		char upper = Character.toUpperCase(symbol);
		for (IupacCode code : values()) {
			if (code.getSymbol() == upper) return code;
		}
		throw new InvalidCodeException(symbol);
	}

	/**
	 * Returns the single code that stands for exactly {@code bases}.
	 * @throws NoCanonicalCodeException If {@code bases} is empty
	 */
	public static IupacCode forBases(Set<Nucleotide> bases) {
		if (bases.isEmpty()) throw new NoCanonicalCodeException("The empty set of bases has no IUPAC code");
		IupacCode code = byBases.get(EnumSet.copyOf(bases));
		if (code == null) throw new NoCanonicalCodeException("No IUPAC code for " + bases);
		return code;
	}

	public static IupacCode forBase(Nucleotide base) {
		return valueOf(base.name());
	}

}
