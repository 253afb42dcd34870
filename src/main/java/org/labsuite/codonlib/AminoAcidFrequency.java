package org.labsuite.codonlib;

/**
 * How often one amino acid (or stop) occurs among the codons of a degenerate codon.
 * @author dmyersturnbull
 */
public class AminoAcidFrequency {

	private final AminoAcid aminoAcid;
	private final int count;
	private final double frequency;

	public AminoAcidFrequency(AminoAcid aminoAcid, int count, int totalCodons) {
		this.aminoAcid = aminoAcid;
		this.count = count;
		this.frequency = (double) count / totalCodons * 100;
	}

	public AminoAcid getAminoAcid() {
		return aminoAcid;
	}

	/**
	 * Returns the number of concrete codons encoding the amino acid.
	 */
	public int getCount() {
		return count;
	}

	/**
	 * Returns the percentage (0 to 100) of concrete codons encoding the amino acid.
	 */
	public double getFrequency() {
		return frequency;
	}

	@Override
	public String toString() {
		return aminoAcid + " " + String.format("%1$.1f", frequency) + "% (" + count + ")";
	}

}
