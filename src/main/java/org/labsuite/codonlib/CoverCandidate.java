package org.labsuite.codonlib;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A degenerate codon proposed for a target, with what it actually encodes. Built by {@link SolutionEvaluator}.
 * @author dmyersturnbull
 */
public class CoverCandidate {

	private final DegenerateCodon codon;
	private final int totalCodons;
	private final Map<AminoAcid, Integer> aminoAcidCounts;
	private final List<AminoAcid> extraAminoAcids;
	private final List<AminoAcid> missingAminoAcids;

	CoverCandidate(DegenerateCodon codon, int totalCodons, Map<AminoAcid, Integer> aminoAcidCounts,
			List<AminoAcid> extraAminoAcids, List<AminoAcid> missingAminoAcids) {
		this.codon = codon;
		this.totalCodons = totalCodons;
		this.aminoAcidCounts = Collections.unmodifiableMap(aminoAcidCounts);
		this.extraAminoAcids = Collections.unmodifiableList(extraAminoAcids);
		this.missingAminoAcids = Collections.unmodifiableList(missingAminoAcids);
	}

	public DegenerateCodon getCodon() {
		return codon;
	}

	public int getTotalCodons() {
		return totalCodons;
	}

	/**
	 * Returns the number of codons per symbol, in the order the symbols were met while expanding the codon.
	 */
	public Map<AminoAcid, Integer> getAminoAcidCounts() {
		return aminoAcidCounts;
	}

	/**
	 * Returns the amino acids encoded that are not in the target, stop excluded.
	 */
	public List<AminoAcid> getExtraAminoAcids() {
		return extraAminoAcids;
	}

	/**
	 * Returns the target amino acids that are not encoded.
	 */
	public List<AminoAcid> getMissingAminoAcids() {
		return missingAminoAcids;
	}

	/**
	 * Returns whether every target amino acid is encoded.
	 */
	public boolean isCover() {
		return missingAminoAcids.isEmpty();
	}

	public int getStopCount() {
		Integer count = aminoAcidCounts.get(AminoAcid.STOP);
		return count == null ? 0 : count;
	}

	/**
	 * Returns the percentage of stop codons.
	 */
	public double getStopFrequency() {
		return (double) getStopCount() / totalCodons * 100;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(codon.toString());
		sb.append(": ").append(totalCodons).append(" codons");
		if (!extraAminoAcids.isEmpty()) sb.append(", extra ").append(extraAminoAcids);
		if (!missingAminoAcids.isEmpty()) sb.append(", missing ").append(missingAminoAcids);
		if (getStopCount() > 0) sb.append(", stop ").append(String.format("%1$.1f", getStopFrequency())).append("%");
		return sb.toString();
	}

}
