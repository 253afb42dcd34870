package org.labsuite.codonlib;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Forward analysis: what amino acids a degenerate codon produces, and how often.
 * @author dmyersturnbull
 */
public final class PositionAnalyzer {

	private PositionAnalyzer() {
	}

	/**
	 * Parses and analyzes a codon such as {@code NNK}.
	 * @throws LibraryDesignException If {@code codon} is not 3 IUPAC codes
	 * @see DegenerateCodon#parse(String)
	 */
	public static PositionAnalysis analyze(String codon) throws LibraryDesignException {
		return analyze(DegenerateCodon.parse(codon));
	}

	public static PositionAnalysis analyze(DegenerateCodon codon) {

		List<Codon> codons = codon.expand();
		int total = codons.size();
		Map<AminoAcid, Integer> counts = GeneticCode.countTranslations(codons);

		List<AminoAcidFrequency> frequencies = new ArrayList<>(counts.size());
		for (Map.Entry<AminoAcid, Integer> entry : counts.entrySet()) {
			frequencies.add(new AminoAcidFrequency(entry.getKey(), entry.getValue(), total));
		}
		// stable, so ties stay in the order the symbols were met
		Collections.sort(frequencies, new Comparator<AminoAcidFrequency>() {
			@Override
			public int compare(AminoAcidFrequency o1, AminoAcidFrequency o2) {
				return Integer.compare(o2.getCount(), o1.getCount());
			}
		});

		Map<AminoAcidProperty, Double> properties = new EnumMap<>(AminoAcidProperty.class);
		for (AminoAcidFrequency frequency : frequencies) {
			AminoAcidProperty property = GeneticCode.categoryOf(frequency.getAminoAcid());
			if (property == null) continue;
			Double sum = properties.get(property);
			properties.put(property, sum == null ? frequency.getFrequency() : sum + frequency.getFrequency());
		}

		return new PositionAnalysis(codon, total, frequencies, properties);
	}

}
