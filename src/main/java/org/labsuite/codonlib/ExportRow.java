package org.labsuite.codonlib;

/**
 * One line of the flat table of a calculated library: one amino acid at one position.
 * @author dmyersturnbull
 */
public class ExportRow {

	private final int positionNumber;
	private final Position position;
	private final AminoAcidFrequency frequency;

	ExportRow(int positionNumber, Position position, AminoAcidFrequency frequency) {
		this.positionNumber = positionNumber;
		this.position = position;
		this.frequency = frequency;
	}

	/**
	 * Returns the 1-based index of the position in its library.
	 */
	public int getPositionNumber() {
		return positionNumber;
	}

	public String getPositionName() {
		return position.getName();
	}

	public String getCodon() {
		return position.getCodon();
	}

	public AminoAcid getAminoAcid() {
		return frequency.getAminoAcid();
	}

	public String getAminoAcidName() {
		return frequency.getAminoAcid().getFullName();
	}

	public double getFrequency() {
		return frequency.getFrequency();
	}

	public int getCount() {
		return frequency.getCount();
	}

	/**
	 * Returns the category, or null for stop.
	 */
	public AminoAcidProperty getProperty() {
		return frequency.getAminoAcid().getProperty();
	}

	public AminoAcid.Charge getCharge() {
		return frequency.getAminoAcid().getCharge();
	}

	public AminoAcid.Polarity getPolarity() {
		return frequency.getAminoAcid().getPolarity();
	}

	public AminoAcid.Size getSize() {
		return frequency.getAminoAcid().getSize();
	}

	@Override
	public String toString() {
		return positionNumber + "\t" + getPositionName() + "\t" + getCodon() + "\t" + getAminoAcid() + "\t" + getAminoAcidName()
				+ "\t" + String.format("%1$.2f", getFrequency()) + "\t" + getCount() + "\t" + getCharge() + "\t" + getPolarity()
				+ "\t" + getSize();
	}

}
