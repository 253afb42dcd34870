package org.labsuite.codonlib;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The amino-acid distribution of one degenerate codon. Built by {@link PositionAnalyzer}.
 * @author dmyersturnbull
 */
public class PositionAnalysis {

	private final DegenerateCodon codon;
	private final int totalCodons;
	private final List<AminoAcidFrequency> frequencies;
	private final Map<AminoAcidProperty, Double> propertyFrequencies;

	PositionAnalysis(DegenerateCodon codon, int totalCodons, List<AminoAcidFrequency> frequencies,
			Map<AminoAcidProperty, Double> propertyFrequencies) {
		this.codon = codon;
		this.totalCodons = totalCodons;
		this.frequencies = Collections.unmodifiableList(frequencies);
		this.propertyFrequencies = Collections.unmodifiableMap(propertyFrequencies);
	}

	public DegenerateCodon getCodon() {
		return codon;
	}

	/**
	 * Returns the number of concrete codons.
	 */
	public int getTotalCodons() {
		return totalCodons;
	}

	/**
	 * Returns the frequency of every symbol present, highest first.
	 * Equal frequencies keep the order in which the symbols were met while expanding the codon.
	 */
	public List<AminoAcidFrequency> getFrequencies() {
		return frequencies;
	}

	/**
	 * Returns the summed frequency per category, for the categories that occur.
	 */
	public Map<AminoAcidProperty, Double> getPropertyFrequencies() {
		return propertyFrequencies;
	}

	public int getCount(AminoAcid aminoAcid) {
		for (AminoAcidFrequency frequency : frequencies) {
			if (frequency.getAminoAcid() == aminoAcid) return frequency.getCount();
		}
		return 0;
	}

	public double getFrequency(AminoAcid aminoAcid) {
		return (double) getCount(aminoAcid) / totalCodons * 100;
	}

	public boolean hasStopCodon() {
		return getCount(AminoAcid.STOP) > 0;
	}

	/**
	 * Returns the percentage of stop codons, or 0 if there are none.
	 */
	public double getStopFrequency() {
		return hasStopCodon() ? getFrequency(AminoAcid.STOP) : 0;
	}

	/**
	 * Returns the number of distinct symbols, stop included.
	 */
	public int getUniqueSymbolCount() {
		return frequencies.size();
	}

	/**
	 * Returns the number of distinct standard amino acids, stop excluded.
	 */
	public int getAminoAcidCount() {
		return hasStopCodon() ? frequencies.size() - 1 : frequencies.size();
	}

	@Override
	public String toString() {
		return codon + ": " + totalCodons + " codons, " + getAminoAcidCount() + " amino acids"
				+ (hasStopCodon() ? ", stop " + String.format("%1$.1f", getStopFrequency()) + "%" : "");
	}

}
