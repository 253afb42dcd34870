package org.labsuite.codonlib;

/**
 * The physicochemical category of a standard amino acid. Every standard amino acid belongs to exactly one; stop has none.
 * @author dmyersturnbull
 */
public enum AminoAcidProperty {

	POSITIVE("positive"), NEGATIVE("negative"), POLAR("polar"), NONPOLAR("nonpolar");

	private final String label;

	private AminoAcidProperty(String label) {
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	@Override
	public String toString() {
		return label;
	}

}
