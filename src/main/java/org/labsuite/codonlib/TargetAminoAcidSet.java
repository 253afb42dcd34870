package org.labsuite.codonlib;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.Set;

/**
 * The amino acids a degenerate codon should encode: a non-empty set of standard amino acids, without stop.
 * @author dmyersturnbull
 */
public final class TargetAminoAcidSet implements Iterable<AminoAcid> {

	private final Set<AminoAcid> aminoAcids;

	private TargetAminoAcidSet(Set<AminoAcid> aminoAcids) {
		this.aminoAcids = Collections.unmodifiableSet(aminoAcids);
	}

	/**
	 * Reads the one-letter codes in {@code input}, ignoring case, duplicates, stop ({@code *}) and any other
	 * character. {@code "a, g, G"} is the set A, G.
	 * @throws EmptyTargetException If no amino acid is left
	 */
	public static TargetAminoAcidSet parse(String input) throws EmptyTargetException {
		Set<AminoAcid> set = EnumSet.noneOf(AminoAcid.class);
		if (input != null) {
			for (int i = 0; i < input.length(); i++) {
				AminoAcid aa = AminoAcid.fromSymbol(input.charAt(i));
				if (aa != null && !aa.isStop()) set.add(aa);
			}
		}
		if (set.isEmpty()) throw new EmptyTargetException(input == null ? "" : input);
		return new TargetAminoAcidSet(set);
	}

	/**
	 * Returns this set plus every amino acid that shares a {@link AminoAcidProperty category} with one of its members.
	 */
	public TargetAminoAcidSet expandByProperty() {
		Set<AminoAcidProperty> properties = EnumSet.noneOf(AminoAcidProperty.class);
		for (AminoAcid aa : aminoAcids) {
			properties.add(GeneticCode.categoryOf(aa));
		}
		Set<AminoAcid> expanded = EnumSet.copyOf(aminoAcids);
		for (AminoAcid aa : AminoAcid.values()) {
			if (!aa.isStop() && properties.contains(GeneticCode.categoryOf(aa))) expanded.add(aa);
		}
		return new TargetAminoAcidSet(expanded);
	}

	public Set<AminoAcid> getAminoAcids() {
		return aminoAcids;
	}

	public boolean contains(AminoAcid aminoAcid) {
		return aminoAcids.contains(aminoAcid);
	}

	public int size() {
		return aminoAcids.size();
	}

	@Override
	public Iterator<AminoAcid> iterator() {
		return aminoAcids.iterator();
	}

	@Override
	public int hashCode() {
		return aminoAcids.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (!(obj instanceof TargetAminoAcidSet)) return false;
		return aminoAcids.equals(((TargetAminoAcidSet) obj).aminoAcids);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (AminoAcid aa : aminoAcids) {
			sb.append(aa.getSymbol());
		}
		return sb.toString();
	}

}
