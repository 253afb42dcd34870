package org.labsuite.codonlib;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks a degenerate codon against the amino acids it was meant to encode.
 * @author dmyersturnbull
 */
public final class SolutionEvaluator {

	private SolutionEvaluator() {
	}

	public static CoverCandidate evaluate(DegenerateCodon codon, TargetAminoAcidSet target) {
		List<Codon> codons = codon.expand();
		Map<AminoAcid, Integer> counts = GeneticCode.countTranslations(codons);
		List<AminoAcid> extra = new ArrayList<>();
		for (AminoAcid aa : counts.keySet()) {
			if (!aa.isStop() && !target.contains(aa)) extra.add(aa);
		}
		List<AminoAcid> missing = new ArrayList<>();
		for (AminoAcid aa : target) {
			if (!counts.containsKey(aa)) missing.add(aa);
		}
		return new CoverCandidate(codon, codons.size(), counts, extra, missing);
	}

}
