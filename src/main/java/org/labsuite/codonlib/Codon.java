package org.labsuite.codonlib;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A concrete codon: three {@link Nucleotide nucleotides}.
 * There are exactly 64 instances, so codons can be compared with {@code ==}.
 * Codons sort lexically in the base order A, C, G, T.
 * @author dmyersturnbull
 */
public final class Codon implements Comparable<Codon> {

	private static final Codon[] codons = new Codon[64];

	private static final List<Codon> all;

	static {
		List<Codon> list = new ArrayList<>(64);
		for (Nucleotide first : Nucleotide.values()) {
			for (Nucleotide second : Nucleotide.values()) {
				for (Nucleotide third : Nucleotide.values()) {
					Codon codon = new Codon(first, second, third);
					codons[codon.index] = codon;
					list.add(codon);
				}
			}
		}
		all = Collections.unmodifiableList(list);
	}

	private final Nucleotide[] bases;
	private final int index;

	private Codon(Nucleotide first, Nucleotide second, Nucleotide third) {
		this.bases = new Nucleotide[] { first, second, third };
		this.index = first.ordinal() * 16 + second.ordinal() * 4 + third.ordinal();
	}

	public static Codon of(Nucleotide first, Nucleotide second, Nucleotide third) {
		return codons[first.ordinal() * 16 + second.ordinal() * 4 + third.ordinal()];
	}

	/**
	 * Parses a concrete 3-letter codon, ignoring case. {@code U} is read as {@code T}.
	 * @throws IllegalArgumentException If {@code codon} is not 3 concrete bases
	 */
	public static Codon of(String codon) {
		if (codon.length() != 3) throw new IllegalArgumentException("Codon " + codon + " is not 3 bases long");
		Nucleotide[] parsed = new Nucleotide[3];
		for (int i = 0; i < 3; i++) {
			char c = codon.charAt(i);
			parsed[i] = Nucleotide.fromSymbol(c == 'U' || c == 'u' ? 'T' : c);
			if (parsed[i] == null) throw new IllegalArgumentException("Codon " + codon + " does not exist");
		}
		return of(parsed[0], parsed[1], parsed[2]);
	}

	/**
	 * Returns all 64 codons in ascending order.
	 */
	public static List<Codon> all() {
		return all;
	}

	/**
	 * Returns the base at {@code position}, counting from 0.
	 */
	public Nucleotide getBase(int position) {
		return bases[position];
	}

	@Override
	public int compareTo(Codon o) {
		return Integer.compare(index, o.index);
	}

	@Override
	public String toString() {
		return "" + bases[0].getSymbol() + bases[1].getSymbol() + bases[2].getSymbol();
	}

}
