package org.labsuite.codonlib;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * A codon of three {@link IupacCode IUPAC codes}, standing for every concrete codon that can be made by picking one base
 * at each position. {@code NNK}, for example, stands for 4 × 4 × 2 = 32 codons.
 * @author dmyersturnbull
 */
public final class DegenerateCodon {

	private final IupacCode[] codes;

	public DegenerateCodon(IupacCode first, IupacCode second, IupacCode third) {
		if (first == null || second == null || third == null) throw new IllegalArgumentException("A degenerate codon needs 3 codes");
		this.codes = new IupacCode[] { first, second, third };
	}

	/**
	 * Parses a 3-letter IUPAC codon such as {@code NNK}, ignoring case and surrounding whitespace.
	 * @throws InvalidCodonLengthException If {@code codon} is not exactly 3 characters long
	 * @throws InvalidCodeException For the first character that is not an IUPAC code
	 */
	public static DegenerateCodon parse(String codon) throws LibraryDesignException {
		if (codon == null) throw new InvalidCodonLengthException("");
		String trimmed = codon.trim();
		if (trimmed.length() != 3) throw new InvalidCodonLengthException(trimmed);
		return new DegenerateCodon(IupacCode.fromSymbol(trimmed.charAt(0)), IupacCode.fromSymbol(trimmed.charAt(1)),
				IupacCode.fromSymbol(trimmed.charAt(2)));
	}

	/**
	 * Returns the degenerate codon whose positions stand for exactly the given sets of bases.
	 * @throws NoCanonicalCodeException If any of the sets is empty
	 */
	public static DegenerateCodon forBases(Set<Nucleotide> first, Set<Nucleotide> second, Set<Nucleotide> third) {
		return new DegenerateCodon(IupacCode.forBases(first), IupacCode.forBases(second), IupacCode.forBases(third));
	}

	/**
	 * Returns the code at {@code position}, counting from 0.
	 */
	public IupacCode getCode(int position) {
		return codes[position];
	}

	/**
	 * Returns the number of concrete codons, which is the product of the number of bases at each position (1 to 64).
	 */
	public int size() {
		return codes[0].getBases().size() * codes[1].getBases().size() * codes[2].getBases().size();
	}

	/**
	 * Expands this codon into its concrete codons: the Cartesian product of the bases at each position, with the last
	 * position changing fastest. For {@code GCN} this is GCA, GCC, GCG, GCT.
	 */
	public List<Codon> expand() {
		List<Codon> codons = new ArrayList<>(size());
		for (Nucleotide first : codes[0].getBases()) {
			for (Nucleotide second : codes[1].getBases()) {
				for (Nucleotide third : codes[2].getBases()) {
					codons.add(Codon.of(first, second, third));
				}
			}
		}
		return Collections.unmodifiableList(codons);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(codes);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (!(obj instanceof DegenerateCodon)) return false;
		return Arrays.equals(codes, ((DegenerateCodon) obj).codes);
	}

	@Override
	public String toString() {
		return "" + codes[0].getSymbol() + codes[1].getSymbol() + codes[2].getSymbol();
	}

}
