package elan2py.transform;

/**
 * Output nesting depth. Closers decrement regardless of which opener is active; a closer
 * at depth zero is refused rather than going negative.
 */
public final class BlockTracker {
	private int depth;

	public int depth() {
		return depth;
	}

	public void open() {
		depth++;
	}

	/**
	 * @return false when there is no open block to close
	 */
	public boolean close() {
		if (depth == 0) {
			return false;
		}
		depth--;
		return true;
	}
}
