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
package com.tomaszrup.astscope.ast;

import com.tomaszrup.astscope.source.SourceLoc;
import com.tomaszrup.astscope.source.SourceRange;

/**
 * One comma-separated entry of a pattern binding: {@code pattern = init}
 * optionally followed by accessor braces.
 */
public class PatternBindingEntry {
	private final Pattern pattern;
	private final Expr initAsWritten;
	private final SourceRange accessorBracesRange;

	public PatternBindingEntry(Pattern pattern, Expr initAsWritten) {
		this(pattern, initAsWritten, SourceRange.INVALID);
	}

	public PatternBindingEntry(Pattern pattern, Expr initAsWritten, SourceRange accessorBracesRange) {
		this.pattern = pattern;
		this.initAsWritten = initAsWritten;
		this.accessorBracesRange = accessorBracesRange != null ? accessorBracesRange : SourceRange.INVALID;
	}

	public Pattern getPattern() {
		return pattern;
	}

	public Expr getInitAsWritten() {
		return initAsWritten;
	}

	public boolean hasInitAsWritten() {
		return initAsWritten != null;
	}

	public SourceRange getAccessorBracesRange() {
		return accessorBracesRange;
	}

	public SourceRange getSourceRange() {
		return getSourceRange(false);
	}

	/**
	 * Returns the entry's range from the pattern through the initializer, and
	 * through the accessor braces unless {@code omitAccessors} is set. The
	 * initializer contributes its nominal end location.
	 */
	public SourceRange getSourceRange(boolean omitAccessors) {
		SourceLoc start = pattern.getStartLoc();
		SourceLoc end = pattern.getEndLoc();
		if (initAsWritten != null && initAsWritten.getEndLoc().isValid()) {
			end = initAsWritten.getEndLoc();
		}
		if (!omitAccessors && accessorBracesRange.isValid()) {
			end = accessorBracesRange.getEnd();
		}
		return new SourceRange(start, end);
	}
}
