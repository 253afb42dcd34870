package org.labsuite.codonlib;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The standard genetic code, read once from {@code geneticcode/standard.codons} on the classpath.
 * <p>
 * The file has one block per translation symbol. A line {@code !X} opens the block for symbol {@code X} ({@code *} for
 * stop), each following line is a codon, and lines starting with {@code ;} are comments.
 * The table is checked on load: it must assign all 64 codons exactly once, to 21 symbols.
 * @author dmyersturnbull
 */
public final class GeneticCode {

	private static final String RESOURCE = "geneticcode/standard.codons";

	private static final Logger logger = LogManager.getLogger(GeneticCode.class.getName());

	private static final Map<Codon, AminoAcid> translations;
	private static final Map<AminoAcid, List<Codon>> codonsByAminoAcid;

	static {
		translations = Collections.unmodifiableMap(parse(RESOURCE));
		Map<AminoAcid, List<Codon>> inverse = new EnumMap<>(AminoAcid.class);
		for (AminoAcid aa : AminoAcid.values()) {
			inverse.put(aa, new ArrayList<Codon>());
		}
		// all() is ascending, so each list is too
		for (Codon codon : Codon.all()) {
			inverse.get(translations.get(codon)).add(codon);
		}
		for (AminoAcid aa : AminoAcid.values()) {
			inverse.put(aa, Collections.unmodifiableList(inverse.get(aa)));
		}
		codonsByAminoAcid = Collections.unmodifiableMap(inverse);
	}

	private GeneticCode() {
	}

	private static Map<Codon, AminoAcid> parse(String resource) {

		InputStream stream = GeneticCode.class.getClassLoader().getResourceAsStream(resource);
		if (stream == null) throw new IllegalStateException("Genetic code resource " + resource + " was not found");

		Map<Codon, AminoAcid> map = new HashMap<>();
		Map<AminoAcid, Integer> blockSizes = new EnumMap<>(AminoAcid.class);
		try (BufferedReader br = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
			AminoAcid aminoAcid = null;
			String line = "";
			while ((line = br.readLine()) != null) {
				line = line.trim();
				if (line.isEmpty() || line.startsWith(";")) continue;
				if (line.startsWith("!")) {
					String symbol = line.substring(1).trim();
					aminoAcid = symbol.length() == 1 ? AminoAcid.fromSymbol(symbol.charAt(0)) : null;
					if (aminoAcid == null) throw new IllegalStateException("Unknown amino acid symbol in line " + line);
					blockSizes.put(aminoAcid, 0);
				} else {
					if (aminoAcid == null) throw new IllegalStateException("Codon " + line + " appears before any amino acid");
					Codon codon;
					try {
						codon = Codon.of(line);
					} catch (IllegalArgumentException e) {
						throw new IllegalStateException("Couldn't parse line " + line, e);
					}
					AminoAcid previous = map.put(codon, aminoAcid);
					if (previous != null) {
						throw new IllegalStateException("Codon " + codon + " is assigned to both " + previous + " and " + aminoAcid);
					}
					blockSizes.put(aminoAcid, blockSizes.get(aminoAcid) + 1);
				}
			}
		} catch (IOException e) {
			throw new IllegalStateException("Couldn't read genetic code resource " + resource, e);
		}

		// sanity checks
		if (blockSizes.size() != AminoAcid.values().length) {
			throw new IllegalStateException(blockSizes.size() + " amino acids were found (including stop, should be 21)");
		}
		if (map.size() != 4*4*4) {
			throw new IllegalStateException("Only " + map.size() + " codons were found");
		}
		logger.debug("Read " + map.size() + " codons for " + blockSizes.size() + " symbols from " + resource);
		return map;
	}

	/**
	 * Returns the amino acid (or {@link AminoAcid#STOP}) that {@code codon} encodes.
	 */
	public static AminoAcid translate(Codon codon) {
		return translations.get(codon);
	}

	/**
	 * Returns every codon that translates to {@code aminoAcid}, in ascending codon order.
	 * Over all 21 symbols these lists partition the 64 codons.
	 */
	public static List<Codon> codonsOf(AminoAcid aminoAcid) {
		return codonsByAminoAcid.get(aminoAcid);
	}

	/**
	 * Returns the category of {@code aminoAcid}, or null for stop.
	 */
	public static AminoAcidProperty categoryOf(AminoAcid aminoAcid) {
		return aminoAcid.getProperty();
	}

	/**
	 * Translates each of {@code codons} and counts the codons per symbol.
	 * The returned map iterates in the order each symbol was first met, which later sorts rely on to break ties.
	 */
	public static Map<AminoAcid, Integer> countTranslations(List<Codon> codons) {
		Map<AminoAcid, Integer> counts = new LinkedHashMap<>();
		for (Codon codon : codons) {
			AminoAcid aa = translate(codon);
			Integer count = counts.get(aa);
			counts.put(aa, count == null ? 1 : count + 1);
		}
		return counts;
	}

}
