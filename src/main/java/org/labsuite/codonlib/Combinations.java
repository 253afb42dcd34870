package org.labsuite.codonlib;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.util.CombinatoricsUtils;

/**
 * Enumerates the k-element subsets of a small list.
 * @author dmyersturnbull
 */
public final class Combinations {

	private Combinations() {
	}

	/**
	 * Returns every {@code k}-element subset of {@code items}. Each subset keeps the order of {@code items}, and the
	 * subsets come in lexicographic order of their indices: for {@code [A, C, G]} and {@code k = 2} this is
	 * {@code [A, C], [A, G], [C, G]}.
	 * @return An empty list if {@code k} is less than 1 or greater than the number of items
	 */
	public static <T> List<List<T>> combinations(List<T> items, int k) {
		int n = items.size();
		if (k < 1 || k > n) return new ArrayList<>();
		if (k == 1) {
			List<List<T>> singletons = new ArrayList<>(n);
			for (T item : items) {
				singletons.add(Collections.singletonList(item));
			}
			return singletons;
		}
		if (k == n) {
			List<List<T>> whole = new ArrayList<>(1);
			whole.add(new ArrayList<>(items));
			return whole;
		}
		List<List<T>> subsets = new ArrayList<>((int) CombinatoricsUtils.binomialCoefficient(n, k));
		collect(items, k, 0, new ArrayList<T>(k), subsets);
		return subsets;
	}

	private static <T> void collect(List<T> items, int k, int start, List<T> current, List<List<T>> subsets) {
		if (current.size() == k) {
			subsets.add(new ArrayList<>(current));
			return;
		}
		// leave enough items to fill the rest of the subset
		for (int i = start; i <= items.size() - (k - current.size()); i++) {
			current.add(items.get(i));
			collect(items, k, i + 1, current, subsets);
			current.remove(current.size() - 1);
		}
	}

}
