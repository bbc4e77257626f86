package io.vena.treeselect;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The little bit of state that outlives a single call: the one-shot
 * deprecation latch and the accessibility id counter.
 *
 * <p>
 * Hosts that want independent trees to stay independent (tests, mostly)
 * create their own context. {@link #global()} is shared by everything that
 * doesn't.
 */
public final class TreeSelectContext {
	private final AtomicBoolean labelDeprecationWarned = new AtomicBoolean(false);
	private final AtomicLong ariaId = new AtomicLong(0);

	public static TreeSelectContext global() {
		return GLOBAL;
	}

	/**
	 * @return true exactly once per context: the first time it is called.
	 */
	boolean claimLabelDeprecationWarning() {
		return !labelDeprecationWarned.getAndSet(true);
	}

	public boolean labelDeprecationWarned() {
		return labelDeprecationWarned.get();
	}

	/**
	 * @return <code>prefix + "_" + n</code> where <code>n</code> counts up from 1.
	 */
	public String generateAriaId(String prefix) {
		return prefix + "_" + ariaId.incrementAndGet();
	}

	public void resetAriaId() {
		ariaId.set(0);
	}

	private static final TreeSelectContext GLOBAL = new TreeSelectContext();
}
