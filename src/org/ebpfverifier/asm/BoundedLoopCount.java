package org.ebpfverifier.asm;

import org.ebpfverifier.cfa.Label;

/**
 * Obligation that the loop headed by a label is entered at most a fixed number of times.
 */
public final class BoundedLoopCount extends Assertion {

	private final Label header;
	private final long limit;

	public BoundedLoopCount(Label header, long limit) {
		assert header != null;
		this.header = header;
		this.limit = limit;
	}

	public Label getHeader() {
		return header;
	}

	public long getLimit() {
		return limit;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof BoundedLoopCount)) {
			return false;
		}
		BoundedLoopCount b = (BoundedLoopCount) o;
		return header.equals(b.header) && limit == b.limit;
	}

	@Override
	public int hashCode() {
		return header.hashCode() ^ Long.hashCode(limit);
	}

	@Override
	public String toString() {
		return "count(" + header + ") <= " + limit;
	}
}
