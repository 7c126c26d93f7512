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
import java.util.Arrays;
import java.util.List;

import org.eclipse.lsp4j.Position;

/**
 * The text of one source file registered with a {@link SourceManager},
 * together with the offsets at which its lines start.
 */
public final class SourceBuffer {
	private final int id;
	private final String name;
	private final String text;
	private final int[] lineStarts;

	SourceBuffer(int id, String name, String text) {
		this.id = id;
		this.name = name;
		this.text = text;
		this.lineStarts = computeLineStarts(text);
	}

	private static int[] computeLineStarts(String text) {
		List<Integer> starts = new ArrayList<>();
		starts.add(0);
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
				continue;
			}
			if (c == '\n' || c == '\r') {
				starts.add(i + 1);
			}
		}
		int[] result = new int[starts.size()];
		for (int i = 0; i < result.length; i++) {
			result[i] = starts.get(i);
		}
		return result;
	}

	public int getId() {
		return id;
	}

	public String getName() {
		return name;
	}

	public String getText() {
		return text;
	}

	public int getLength() {
		return text.length();
	}

	public int getLineCount() {
		return lineStarts.length;
	}

	public SourceLoc getStartLoc() {
		return new SourceLoc(id, 0);
	}

	/**
	 * Returns the location one past the last character of the buffer.
	 */
	public SourceLoc getEndLoc() {
		return new SourceLoc(id, text.length());
	}

	public SourceLoc getLocForOffset(int offset) {
		if (offset < 0 || offset > text.length()) {
			throw new IllegalArgumentException("Offset " + offset + " is outside buffer '" + name
					+ "' of length " + text.length());
		}
		return new SourceLoc(id, offset);
	}

	/**
	 * Converts an offset into a zero-based line/character position.
	 */
	public Position getPosition(int offset) {
		int index = Arrays.binarySearch(lineStarts, offset);
		int line = index >= 0 ? index : -index - 2;
		return new Position(line, offset - lineStarts[line]);
	}

	/**
	 * Returns the text covered by {@code range}, or {@code null} if the range
	 * does not belong to this buffer.
	 */
	public String getText(SourceRange range) {
		if (range.isInvalid() || range.getEnd().isInvalid()
				|| range.getStart().getBufferId() != id || range.getEnd().getBufferId() != id) {
			return null;
		}
		int from = Math.min(range.getStart().getOffset(), text.length());
		int to = Math.min(range.getEnd().getOffset(), text.length());
		if (to < from) {
			return null;
		}
		return text.substring(from, to);
	}
}
