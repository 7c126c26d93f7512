////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.astscope.source;

/**
 * A pair of locations in one buffer. A range is valid when its start is
 * valid. A range whose bounds are both valid never ends before it starts;
 * the constructor rejects one that would.
 *
 * <p>Ranges are immutable; {@link #widen(SourceRange)} returns a new range.</p>
 */
public final class SourceRange {
	public static final SourceRange INVALID = new SourceRange(SourceLoc.INVALID, SourceLoc.INVALID);

	private final SourceLoc start;
	private final SourceLoc end;

	public SourceRange(SourceLoc start, SourceLoc end) {
		if (start == null || end == null) {
			throw new IllegalArgumentException("SourceRange bounds must not be null");
		}
		if (start.isValid() && end.isValid() && SourceLoc.COMPARATOR.compare(end, start) < 0) {
			throw new IllegalArgumentException("SourceRange ends at " + end + " before it starts at " + start);
		}
		this.start = start;
		this.end = end;
	}

	/**
	 * Creates a zero-width range at {@code loc}.
	 */
	public SourceRange(SourceLoc loc) {
		this(loc, loc);
	}

	public SourceLoc getStart() {
		return start;
	}

	public SourceLoc getEnd() {
		return end;
	}

	public boolean isValid() {
		return start.isValid();
	}

	public boolean isInvalid() {
		return !isValid();
	}

	public SourceRange withStart(SourceLoc newStart) {
		return new SourceRange(newStart, end);
	}

	public SourceRange withEnd(SourceLoc newEnd) {
		return new SourceRange(start, newEnd);
	}

	/**
	 * Returns the smallest range covering both this range and {@code other}.
	 * An invalid receiver adopts {@code other}; an invalid {@code other}
	 * leaves the receiver unchanged.
	 */
	public SourceRange widen(SourceRange other) {
		if (isInvalid()) {
			return other;
		}
		if (other == null || other.isInvalid()) {
			return this;
		}
		SourceLoc newStart = SourceLoc.COMPARATOR.compare(other.start, start) < 0 ? other.start : start;
		SourceLoc newEnd = end;
		if (end.isInvalid() || (other.end.isValid() && SourceLoc.COMPARATOR.compare(end, other.end) < 0)) {
			newEnd = other.end;
		}
		if (newStart == start && newEnd == end) {
			return this;
		}
		return new SourceRange(newStart, newEnd);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof SourceRange)) return false;
		SourceRange other = (SourceRange) o;
		return start.equals(other.start) && end.equals(other.end);
	}

	@Override
	public int hashCode() {
		return 31 * start.hashCode() + end.hashCode();
	}

	@Override
	public String toString() {
		if (isInvalid()) {
			return "[invalid]";
		}
		return "[" + start + ", " + end + ")";
	}
}
