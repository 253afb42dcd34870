package org.labsuite.codonlib;

import java.util.Locale;

/**
 * How {@link ReverseSynthesizer} chooses degenerate codons for a target.
 * @author dmyersturnbull
 */
public enum SynthesisStrategy {

	/**
	 * The fewest bases at each position that still cover every target amino acid.
	 */
	MINIMAL,

	/**
	 * Every single codon the required bases allow, plus the one codon that allows all of them at once.
	 */
	ALL,

	/**
	 * Codons built for the target widened by physicochemical category, ranked by stop codons and then by off-target
	 * amino acids.
	 * Only codons that encode every target amino acid are ranked. Codons that miss some are returned only when no
	 * tried codon covers the whole target.
	 */
	BALANCED;

	public String getLabel() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * Parses {@code minimal}, {@code all} or {@code balanced}, ignoring case.
	 */
	public static SynthesisStrategy fromName(String name) throws UnknownStrategyException {
		if (name == null) throw new UnknownStrategyException(name);
		for (SynthesisStrategy strategy : values()) {
			if (strategy.name().equalsIgnoreCase(name.trim())) return strategy;
		}
		throw new UnknownStrategyException(name);
	}

	@Override
	public String toString() {
		return getLabel();
	}

}
