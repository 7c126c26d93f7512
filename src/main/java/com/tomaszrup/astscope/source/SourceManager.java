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

import java.util.ArrayList;
import java.util.List;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

/**
 * Owns the source buffers of a compilation and answers ordering questions
 * about locations inside them.
 *
 * <p>All ordering queries assume both operands come from the same buffer.</p>
 */
public class SourceManager {
	private final List<SourceBuffer> buffers = new ArrayList<>();

	/**
	 * Registers a new buffer and returns its id.
	 */
	public int addNewSourceBuffer(String name, String text) {
		if (text == null) {
			throw new IllegalArgumentException("Buffer text must not be null");
		}
		int id = buffers.size();
		buffers.add(new SourceBuffer(id, name, text));
		return id;
	}

	public SourceBuffer getBuffer(int bufferId) {
		if (bufferId < 0 || bufferId >= buffers.size()) {
			throw new IllegalArgumentException("Unknown buffer id " + bufferId);
		}
		return buffers.get(bufferId);
	}

	public SourceLoc getLocForOffset(int bufferId, int offset) {
		return getBuffer(bufferId).getLocForOffset(offset);
	}

	/**
	 * Returns the full extent of a buffer, from its first character to one
	 * past its last.
	 */
	public SourceRange getRangeForBuffer(int bufferId) {
		SourceBuffer buffer = getBuffer(bufferId);
		return new SourceRange(buffer.getStartLoc(), buffer.getEndLoc());
	}

	/**
	 * Returns true iff {@code first} is strictly before {@code second}.
	 */
	public boolean isBeforeInBuffer(SourceLoc first, SourceLoc second) {
		return SourceLoc.COMPARATOR.compare(first, second) < 0;
	}

	/**
	 * Returns true iff {@code loc} lies within {@code range}, counting both
	 * boundaries. Use {@link #rangeCoversLoc} to ask which character a
	 * location belongs to.
	 */
	public boolean rangeContainsLoc(SourceRange range, SourceLoc loc) {
		return !isBeforeInBuffer(loc, range.getStart()) && !isBeforeInBuffer(range.getEnd(), loc);
	}

	/**
	 * Returns true iff {@code loc} lies in {@code [start, end)}. The end is
	 * one past the last character, so a zero-width range covers nothing and
	 * two touching ranges never cover the same location.
	 */
	public boolean rangeCoversLoc(SourceRange range, SourceLoc loc) {
		return !isBeforeInBuffer(loc, range.getStart()) && isBeforeInBuffer(loc, range.getEnd());
	}

	/**
	 * Returns true iff {@code enclosing} fully contains {@code inner}.
	 * Shared boundaries count as contained.
	 */
	public boolean rangeContains(SourceRange enclosing, SourceRange inner) {
		return rangeContainsLoc(enclosing, inner.getStart()) && rangeContainsLoc(enclosing, inner.getEnd());
	}

	public Position getPosition(SourceLoc loc) {
		if (loc.isInvalid()) {
			return null;
		}
		return getBuffer(loc.getBufferId()).getPosition(loc.getOffset());
	}

	/**
	 * Converts a valid range into a zero-based LSP range. Returns
	 * {@code null} for invalid ranges.
	 */
	public Range toLspRange(SourceRange range) {
		if (range == null || range.isInvalid() || range.getEnd().isInvalid()) {
			return null;
		}
		return new Range(getPosition(range.getStart()), getPosition(range.getEnd()));
	}

	/**
	 * Formats a range as {@code name:line:col - line:col}, one-based, for
	 * diagnostics.
	 */
	public String getDisplayString(SourceRange range) {
		if (range == null || range.isInvalid()) {
			return "[invalid range]";
		}
		SourceBuffer buffer = getBuffer(range.getStart().getBufferId());
		StringBuilder builder = new StringBuilder();
		builder.append('[').append(buffer.getName()).append(':');
		appendLineAndColumn(builder, range.getStart());
		builder.append(" - ");
		if (range.getEnd().isValid()) {
			appendLineAndColumn(builder, range.getEnd());
		} else {
			builder.append("<invalid loc>");
		}
		builder.append(']');
		return builder.toString();
	}

	private void appendLineAndColumn(StringBuilder builder, SourceLoc loc) {
		Position position = getPosition(loc);
		builder.append(position.getLine() + 1).append(':').append(position.getCharacter() + 1);
	}
}
