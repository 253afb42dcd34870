package org.labsuite.codonlib;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * The degenerate codons {@link ReverseSynthesizer} proposes for a target, best first where the strategy ranks them.
 * @author dmyersturnbull
 */
public class SynthesisResult {

	private final TargetAminoAcidSet target;
	private final SynthesisStrategy strategy;
	private final TargetAminoAcidSet searchedAminoAcids;
	private final List<Set<Nucleotide>> requiredBases;
	private final List<CoverCandidate> candidates;

	SynthesisResult(TargetAminoAcidSet target, SynthesisStrategy strategy, TargetAminoAcidSet searchedAminoAcids,
			List<Set<Nucleotide>> requiredBases, List<CoverCandidate> candidates) {
		this.target = target;
		this.strategy = strategy;
		this.searchedAminoAcids = searchedAminoAcids;
		this.requiredBases = Collections.unmodifiableList(requiredBases);
		this.candidates = Collections.unmodifiableList(candidates);
	}

	public TargetAminoAcidSet getTarget() {
		return target;
	}

	public SynthesisStrategy getStrategy() {
		return strategy;
	}

	/**
	 * Returns the amino acids the bases were chosen for. This is the target itself, except for
	 * {@link SynthesisStrategy#BALANCED}, which widens it by category.
	 */
	public TargetAminoAcidSet getSearchedAminoAcids() {
		return searchedAminoAcids;
	}

	/**
	 * Returns, for each of the 3 codon positions, every base used at that position by some codon of a searched amino
	 * acid.
	 */
	public List<Set<Nucleotide>> getRequiredBases() {
		return requiredBases;
	}

	public List<CoverCandidate> getCandidates() {
		return candidates;
	}

	public List<DegenerateCodon> getCodons() {
		List<DegenerateCodon> codons = new ArrayList<>(candidates.size());
		for (CoverCandidate candidate : candidates) {
			codons.add(candidate.getCodon());
		}
		return codons;
	}

	@Override
	public String toString() {
		return strategy + " for " + target + ": " + getCodons();
	}

}
