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

import java.util.Comparator;

/**
 * An opaque location in a single source buffer, identified by the buffer's
 * id and a zero-based character offset into it.
 *
 * <p>Locations are only ordered against locations of the same buffer.
 * Comparing locations from different buffers is a caller error and the
 * result is meaningless.</p>
 */
public final class SourceLoc {
	public static final SourceLoc INVALID = new SourceLoc(-1, -1);

	/**
	 * Orders valid locations of one buffer by offset.
	 */
	public static final Comparator<SourceLoc> COMPARATOR = (SourceLoc l1, SourceLoc l2) -> {
		return Integer.compare(l1.offset, l2.offset);
	};

	private final int bufferId;
	private final int offset;

	SourceLoc(int bufferId, int offset) {
		this.bufferId = bufferId;
		this.offset = offset;
	}

	public int getBufferId() {
		return bufferId;
	}

	public int getOffset() {
		return offset;
	}

	public boolean isValid() {
		return bufferId >= 0 && offset >= 0;
	}

	public boolean isInvalid() {
		return !isValid();
	}

	/**
	 * Returns a location {@code delta} characters after this one, in the
	 * same buffer.
	 */
	public SourceLoc getAdvancedLoc(int delta) {
		if (isInvalid()) {
			return this;
		}
		return new SourceLoc(bufferId, offset + delta);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof SourceLoc)) return false;
		SourceLoc other = (SourceLoc) o;
		return bufferId == other.bufferId && offset == other.offset;
	}

	@Override
	public int hashCode() {
		return 31 * bufferId + offset;
	}

	@Override
	public String toString() {
		if (isInvalid()) {
			return "<invalid loc>";
		}
		return "#" + bufferId + "@" + offset;
	}
}
