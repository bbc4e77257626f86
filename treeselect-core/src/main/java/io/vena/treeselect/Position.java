package io.vena.treeselect;

import io.vena.treeselect.exceptions.MalformedPositionException;
import java.util.Arrays;
import java.util.List;
import lombok.EqualsAndHashCode;

import static java.lang.String.format;
import static java.util.stream.Collectors.joining;
import static java.util.stream.Collectors.toList;

/**
 * The location of a node within one indexed tree, as a sequence of ordinals.
 *
 * <p>
 * The text form joins the ordinals with dashes: <code>"0-2-1"</code> is the
 * second child of the third child of the first top-level node. Every indexed
 * tree hangs off the synthetic {@link #root()} position <code>"0"</code>, which
 * never has an entity of its own.
 *
 * <p>
 * Positions are recomputed on every index build, so they are only meaningful
 * within the {@link EntityIndex} that produced them.
 *
 * @see #isRelated(String, String)
 */
@EqualsAndHashCode
public final class Position {
	private final int[] ordinals;

	private Position(int[] ordinals) {
		this.ordinals = ordinals;
	}

	public static Position root() {
		return ROOT;
	}

	/**
	 * @throws MalformedPositionException if any dash-separated component is
	 * not a non-negative integer.
	 */
	public static Position parse(String text) {
		if (text == null || text.isEmpty()) {
			throw new MalformedPositionException("Position cannot be blank");
		}
		String[] fields = text.split(SEPARATOR, -1);
		int[] ordinals = new int[fields.length];
		for (int i = 0; i < fields.length; i++) {
			ordinals[i] = parseOrdinal(fields[i], text);
		}
		return new Position(ordinals);
	}

	private static int parseOrdinal(String field, String text) {
		// Digits only, no sign or leading zero, so the text prints back unchanged
		boolean digits = !field.isEmpty() && field.chars().allMatch(c -> c >= '0' && c <= '9');
		if (!digits || (field.length() > 1 && field.charAt(0) == '0')) {
			throw new MalformedPositionException(format("Invalid ordinal \"%s\" in position \"%s\"", field, text));
		}
		try {
			return Integer.parseInt(field);
		} catch (NumberFormatException e) {
			throw new MalformedPositionException(format("Ordinal \"%s\" out of range in position \"%s\"", field, text), e);
		}
	}

	public Position child(int index) {
		if (index < 0) {
			throw new IllegalArgumentException("Negative child index: " + index);
		}
		int[] result = Arrays.copyOf(ordinals, ordinals.length + 1);
		result[ordinals.length] = index;
		return new Position(result);
	}

	/**
	 * @return the position with the last ordinal removed
	 * @throws IllegalStateException if this position has only one ordinal
	 */
	public Position parent() {
		if (ordinals.length <= 1) {
			throw new IllegalStateException("Position has no parent: " + this);
		}
		return new Position(Arrays.copyOf(ordinals, ordinals.length - 1));
	}

	public boolean hasParent() {
		return ordinals.length > 1;
	}

	/**
	 * Number of ordinals. The {@link #root()} has depth 1, top-level nodes have depth 2.
	 */
	public int depth() {
		return ordinals.length;
	}

	public int ordinal(int index) {
		return ordinals[index];
	}

	public int lastOrdinal() {
		return ordinals[ordinals.length - 1];
	}

	public List<Integer> ordinals() {
		return Arrays.stream(ordinals).boxed().collect(toList());
	}

	/**
	 * Related positions lie on a single root-to-leaf line: one is a prefix of
	 * the other, or they are equal.
	 */
	public boolean isRelatedTo(Position other) {
		int minLength = Math.min(this.ordinals.length, other.ordinals.length);
		for (int i = 0; i < minLength; i++) {
			if (this.ordinals[i] != other.ordinals[i]) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Strict: a position is not its own ancestor.
	 */
	public boolean isAncestorOf(Position other) {
		return this.ordinals.length < other.ordinals.length && isRelatedTo(other);
	}

	/**
	 * Text-based variant of {@link #isRelatedTo}. Components are compared as
	 * strings and never validated, so this cannot throw for any non-null input.
	 *
	 * <ul>
	 *     <li><code>1-2</code> is related to <code>1-2-3</code></li>
	 *     <li><code>1-3-2</code> is related to <code>1</code></li>
	 *     <li><code>1-2</code> is not related to <code>1-21</code></li>
	 * </ul>
	 */
	public static boolean isRelated(String pos1, String pos2) {
		String[] fields1 = pos1.split(SEPARATOR, -1);
		String[] fields2 = pos2.split(SEPARATOR, -1);
		int minLength = Math.min(fields1.length, fields2.length);
		for (int i = 0; i < minLength; i++) {
			if (!fields1[i].equals(fields2[i])) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return the number of dash-separated components in <code>text</code>
	 * without parsing them.
	 */
	static int depthOf(String text) {
		return text.split(SEPARATOR, -1).length;
	}

	/**
	 * @return <code>text</code> with its last component removed, or null if
	 * it has only one.
	 */
	static String parentText(String text) {
		int lastDash = text.lastIndexOf(SEPARATOR);
		if (lastDash < 0) {
			return null;
		} else {
			return text.substring(0, lastDash);
		}
	}

	@Override
	public String toString() {
		return Arrays.stream(ordinals)
			.mapToObj(Integer::toString)
			.collect(joining(SEPARATOR));
	}

	public static final String SEPARATOR = "-";
	private static final Position ROOT = new Position(new int[]{ 0 });
}
