package org.labsuite.codonlib;

import java.util.Locale;

/**
 * The 21 symbols of translation: the 20 standard amino acids and {@link #STOP}.
 * Besides its {@link AminoAcidProperty category}, each symbol carries the display descriptors used in exported tables.
 * @author dmyersturnbull
 */
public enum AminoAcid {

	ALA('A', "Alanine", AminoAcidProperty.NONPOLAR, Charge.NEUTRAL, Polarity.NONPOLAR, Size.SMALL),
	ARG('R', "Arginine", AminoAcidProperty.POSITIVE, Charge.POSITIVE, Polarity.POLAR, Size.LARGE),
	ASN('N', "Asparagine", AminoAcidProperty.POLAR, Charge.NEUTRAL, Polarity.POLAR, Size.SMALL),
	ASP('D', "Aspartic acid", AminoAcidProperty.NEGATIVE, Charge.NEGATIVE, Polarity.POLAR, Size.SMALL),
	CYS('C', "Cysteine", AminoAcidProperty.POLAR, Charge.NEUTRAL, Polarity.SLIGHTLY_POLAR, Size.SMALL),
	GLN('Q', "Glutamine", AminoAcidProperty.POLAR, Charge.NEUTRAL, Polarity.POLAR, Size.MEDIUM),
	GLU('E', "Glutamic acid", AminoAcidProperty.NEGATIVE, Charge.NEGATIVE, Polarity.POLAR, Size.MEDIUM),
	GLY('G', "Glycine", AminoAcidProperty.NONPOLAR, Charge.NEUTRAL, Polarity.NONPOLAR, Size.TINY),
	HIS('H', "Histidine", AminoAcidProperty.POSITIVE, Charge.SLIGHTLY_POSITIVE, Polarity.POLAR, Size.MEDIUM),
	ILE('I', "Isoleucine", AminoAcidProperty.NONPOLAR, Charge.NEUTRAL, Polarity.NONPOLAR, Size.MEDIUM),
	LEU('L', "Leucine", AminoAcidProperty.NONPOLAR, Charge.NEUTRAL, Polarity.NONPOLAR, Size.MEDIUM),
	LYS('K', "Lysine", AminoAcidProperty.POSITIVE, Charge.POSITIVE, Polarity.POLAR, Size.LARGE),
	MET('M', "Methionine", AminoAcidProperty.NONPOLAR, Charge.NEUTRAL, Polarity.NONPOLAR, Size.MEDIUM),
	PHE('F', "Phenylalanine", AminoAcidProperty.NONPOLAR, Charge.NEUTRAL, Polarity.NONPOLAR, Size.LARGE),
	PRO('P', "Proline", AminoAcidProperty.NONPOLAR, Charge.NEUTRAL, Polarity.NONPOLAR, Size.MEDIUM),
	SER('S', "Serine", AminoAcidProperty.POLAR, Charge.NEUTRAL, Polarity.POLAR, Size.SMALL),
	THR('T', "Threonine", AminoAcidProperty.POLAR, Charge.NEUTRAL, Polarity.POLAR, Size.SMALL),
	TRP('W', "Tryptophan", AminoAcidProperty.NONPOLAR, Charge.NEUTRAL, Polarity.NONPOLAR, Size.LARGE),
	TYR('Y', "Tyrosine", AminoAcidProperty.POLAR, Charge.NEUTRAL, Polarity.SLIGHTLY_POLAR, Size.LARGE),
	VAL('V', "Valine", AminoAcidProperty.NONPOLAR, Charge.NEUTRAL, Polarity.NONPOLAR, Size.MEDIUM),
	STOP('*', "STOP", null, Charge.NONE, Polarity.NONE, Size.NONE);

	public enum Charge {
		POSITIVE, SLIGHTLY_POSITIVE, NEGATIVE, NEUTRAL, NONE;

		@Override
		public String toString() {
			return name().toLowerCase(Locale.ROOT).replace('_', ' ');
		}
	}

	public enum Polarity {
		POLAR, SLIGHTLY_POLAR, NONPOLAR, NONE;

		@Override
		public String toString() {
			return name().toLowerCase(Locale.ROOT).replace('_', ' ');
		}
	}

	public enum Size {
		TINY, SMALL, MEDIUM, LARGE, NONE;

		@Override
		public String toString() {
			return name().toLowerCase(Locale.ROOT).replace('_', ' ');
		}
	}

	private final char symbol;
	private final String fullName;
	private final AminoAcidProperty property;
	private final Charge charge;
	private final Polarity polarity;
	private final Size size;

	private AminoAcid(char symbol, String fullName, AminoAcidProperty property, Charge charge, Polarity polarity, Size size) {
		this.symbol = symbol;
		this.fullName = fullName;
		this.property = property;
		this.charge = charge;
		this.polarity = polarity;
		this.size = size;
	}

	/**
	 * Returns the one-letter code, or {@code '*'} for stop.
	 */
	public char getSymbol() {
		return symbol;
	}

	public String getFullName() {
		return fullName;
	}

	/**
	 * Returns the category, or null for {@link #STOP}.
	 */
	public AminoAcidProperty getProperty() {
		return property;
	}

	public Charge getCharge() {
		return charge;
	}

	public Polarity getPolarity() {
		return polarity;
	}

	public Size getSize() {
		return size;
	}

	public boolean isStop() {
		return this == STOP;
	}

	/**
	 * Returns the amino acid for a one-letter code (ignoring case) or {@code '*'}, or null if there is none.
	 */
	public static AminoAcid fromSymbol(char symbol) {
		char upper = Character.toUpperCase(symbol);
		for (AminoAcid aa : values()) {
			if (aa.symbol == upper) return aa;
		}
		return null;
	}

	@Override
	public String toString() {
		return String.valueOf(symbol);
	}

}
