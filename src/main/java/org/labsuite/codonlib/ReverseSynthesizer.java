package org.labsuite.codonlib;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reverse synthesis: finds degenerate codons whose expansion covers a set of target amino acids.
 * <p>
 * A set of bases <em>covers</em> a target at a codon position if every target amino acid has at least one codon with
 * one of those bases at that position. All searches are brute force over at most 4 bases per position.
 * Wherever a choice between bases has to be made, bases are tried in the order A, C, G, T.
 * @see SynthesisStrategy
 * @author dmyersturnbull
 */
public final class ReverseSynthesizer {

	/**
	 * The largest number of bases {@link SynthesisStrategy#BALANCED} tries at one position.
	 */
	public static final int BALANCED_MAX_BASES = 3;

	/**
	 * The number of codons {@link SynthesisStrategy#BALANCED} returns at most.
	 */
	public static final int BALANCED_RESULTS = 5;

	private static final Logger logger = LogManager.getLogger(ReverseSynthesizer.class.getName());

	/**
	 * Decides whether a set of bases at one position covers the target.
	 */
	private interface CoverageTest {
		boolean covers(Collection<Nucleotide> bases);
	}

	private ReverseSynthesizer() {
	}

	/**
	 * @param aminoAcids One-letter codes; anything else is ignored
	 * @param strategy {@code minimal}, {@code all} or {@code balanced}
	 * @throws EmptyTargetException If {@code aminoAcids} contains no amino acid
	 * @throws UnknownStrategyException If {@code strategy} is not a known strategy
	 */
	public static SynthesisResult synthesize(String aminoAcids, String strategy) throws LibraryDesignException {
		return synthesize(TargetAminoAcidSet.parse(aminoAcids), SynthesisStrategy.fromName(strategy));
	}

	public static SynthesisResult synthesize(String aminoAcids, SynthesisStrategy strategy) throws EmptyTargetException {
		return synthesize(TargetAminoAcidSet.parse(aminoAcids), strategy);
	}

	public static SynthesisResult synthesize(TargetAminoAcidSet target, SynthesisStrategy strategy) {
		SynthesisResult result;
		switch (strategy) {
		case MINIMAL:
			result = minimal(target);
			break;
		case ALL:
			result = all(target);
			break;
		case BALANCED:
			result = balanced(target);
			break;
		default:
			throw new IllegalArgumentException("Unknown strategy " + strategy);
		}
		logger.debug("Synthesized " + result);
		return result;
	}

	/**
	 * Returns every base found at {@code position} (0 to 2) in a codon of one of {@code aminoAcids}, in ascending order.
	 */
	public static Set<Nucleotide> requiredBases(TargetAminoAcidSet aminoAcids, int position) {
		Set<Nucleotide> bases = EnumSet.noneOf(Nucleotide.class);
		for (AminoAcid aa : aminoAcids) {
			for (Codon codon : GeneticCode.codonsOf(aa)) {
				bases.add(codon.getBase(position));
			}
		}
		return bases;
	}

	private static List<Set<Nucleotide>> requiredBases(TargetAminoAcidSet aminoAcids) {
		List<Set<Nucleotide>> bases = new ArrayList<>(3);
		for (int position = 0; position < 3; position++) {
			bases.add(Collections.unmodifiableSet(requiredBases(aminoAcids, position)));
		}
		return bases;
	}

	private static SynthesisResult minimal(final TargetAminoAcidSet target) {

		List<Set<Nucleotide>> required = requiredBases(target);

		List<Set<Nucleotide>> firsts = smallestCovers(required.get(0), positionTest(target, 0));
		List<Set<Nucleotide>> seconds = smallestCovers(required.get(1), positionTest(target, 1));

		Set<DegenerateCodon> codons = new LinkedHashSet<>();
		for (final Set<Nucleotide> first : firsts) {
			for (final Set<Nucleotide> second : seconds) {
				CoverageTest thirdTest = new CoverageTest() {
					@Override
					public boolean covers(Collection<Nucleotide> bases) {
						return coversThirdPosition(target, first, second, bases);
					}
				};
				for (Set<Nucleotide> third : smallestCovers(required.get(2), thirdTest)) {
					codons.add(DegenerateCodon.forBases(first, second, third));
				}
			}
		}

		if (codons.isEmpty()) {
			// no minimal first and second positions leave room for every target amino acid at the third
			logger.debug("No minimal cover for " + target + "; using every required base");
			codons.add(DegenerateCodon.forBases(required.get(0), required.get(1), required.get(2)));
		}

		return new SynthesisResult(target, SynthesisStrategy.MINIMAL, target, required, evaluate(codons, target));
	}

	private static SynthesisResult all(TargetAminoAcidSet target) {

		List<Set<Nucleotide>> required = requiredBases(target);

		Set<DegenerateCodon> codons = new LinkedHashSet<>();
		for (Nucleotide first : required.get(0)) {
			for (Nucleotide second : required.get(1)) {
				for (Nucleotide third : required.get(2)) {
					codons.add(new DegenerateCodon(IupacCode.forBase(first), IupacCode.forBase(second), IupacCode.forBase(third)));
				}
			}
		}
		codons.add(DegenerateCodon.forBases(required.get(0), required.get(1), required.get(2)));

		return new SynthesisResult(target, SynthesisStrategy.ALL, target, required, evaluate(codons, target));
	}

	private static SynthesisResult balanced(TargetAminoAcidSet target) {

		TargetAminoAcidSet expanded = target.expandByProperty();
		List<Set<Nucleotide>> required = requiredBases(expanded);

		List<List<List<Nucleotide>>> options = new ArrayList<>(3);
		for (Set<Nucleotide> bases : required) {
			List<Nucleotide> list = new ArrayList<>(bases);
			List<List<Nucleotide>> subsets = new ArrayList<>();
			for (int k = 1; k <= Math.min(BALANCED_MAX_BASES, list.size()); k++) {
				subsets.addAll(Combinations.combinations(list, k));
			}
			options.add(subsets);
		}

		List<CoverCandidate> candidates = new ArrayList<>();
		List<CoverCandidate> covers = new ArrayList<>();
		for (List<Nucleotide> first : options.get(0)) {
			for (List<Nucleotide> second : options.get(1)) {
				for (List<Nucleotide> third : options.get(2)) {
					DegenerateCodon codon = DegenerateCodon.forBases(EnumSet.copyOf(first), EnumSet.copyOf(second), EnumSet.copyOf(third));
					CoverCandidate candidate = SolutionEvaluator.evaluate(codon, target);
					candidates.add(candidate);
					if (candidate.isCover()) covers.add(candidate);
				}
			}
		}
		logger.debug(candidates.size() + " balanced candidates for " + target + " (widened to " + expanded + "), "
				+ covers.size() + " of them covering");

		List<CoverCandidate> ranked = covers.isEmpty() ? candidates : covers;
		// stable, so equal candidates stay in the order they were built
		Collections.sort(ranked, new Comparator<CoverCandidate>() {
			@Override
			public int compare(CoverCandidate o1, CoverCandidate o2) {
				// compares stopCount / totalCodons exactly
				int byStop = Long.compare((long) o1.getStopCount() * o2.getTotalCodons(), (long) o2.getStopCount() * o1.getTotalCodons());
				if (byStop != 0) return byStop;
				return Integer.compare(o1.getExtraAminoAcids().size(), o2.getExtraAminoAcids().size());
			}
		});

		List<CoverCandidate> best = new ArrayList<>(ranked.subList(0, Math.min(BALANCED_RESULTS, ranked.size())));
		return new SynthesisResult(target, SynthesisStrategy.BALANCED, expanded, required, best);
	}

	/**
	 * Returns the smallest sets of {@code required} that pass {@code test}.
	 * If a single base passes, only the first such base is returned; otherwise every passing set of the smallest passing
	 * size is, in {@link Combinations} order.
	 * @return An empty list if not even all of {@code required} passes
	 */
	private static List<Set<Nucleotide>> smallestCovers(Set<Nucleotide> required, CoverageTest test) {
		List<Set<Nucleotide>> covers = new ArrayList<>();
		for (Nucleotide base : required) {
			if (test.covers(Collections.singleton(base))) {
				covers.add(EnumSet.of(base));
				return covers;
			}
		}
		List<Nucleotide> bases = new ArrayList<>(required);
		for (int k = 2; k <= bases.size(); k++) {
			for (List<Nucleotide> subset : Combinations.combinations(bases, k)) {
				if (test.covers(subset)) covers.add(EnumSet.copyOf(subset));
			}
			if (!covers.isEmpty()) return covers;
		}
		return covers;
	}

	private static CoverageTest positionTest(final TargetAminoAcidSet target, final int position) {
		return new CoverageTest() {
			@Override
			public boolean covers(Collection<Nucleotide> bases) {
				for (AminoAcid aa : target) {
					boolean covered = false;
					for (Codon codon : GeneticCode.codonsOf(aa)) {
						if (bases.contains(codon.getBase(position))) {
							covered = true;
							break;
						}
					}
					if (!covered) return false;
				}
				return true;
			}
		};
	}

	/**
	 * Third-position coverage only counts codons whose first two bases were chosen too.
	 */
	private static boolean coversThirdPosition(TargetAminoAcidSet target, Set<Nucleotide> first, Set<Nucleotide> second,
			Collection<Nucleotide> third) {
		for (AminoAcid aa : target) {
			boolean covered = false;
			for (Codon codon : GeneticCode.codonsOf(aa)) {
				if (first.contains(codon.getBase(0)) && second.contains(codon.getBase(1)) && third.contains(codon.getBase(2))) {
					covered = true;
					break;
				}
			}
			if (!covered) return false;
		}
		return true;
	}

	private static List<CoverCandidate> evaluate(Collection<DegenerateCodon> codons, TargetAminoAcidSet target) {
		List<CoverCandidate> candidates = new ArrayList<>(codons.size());
		for (DegenerateCodon codon : codons) {
			candidates.add(SolutionEvaluator.evaluate(codon, target));
		}
		return candidates;
	}

}
