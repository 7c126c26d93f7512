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
package com.tomaszrup.astscope.scope;

import com.tomaszrup.astscope.ast.PatternBindingDecl;
import com.tomaszrup.astscope.source.SourceLoc;
import com.tomaszrup.astscope.source.SourceRange;

/**
 * Where the variables bound by a pattern entry become visible: after the
 * entry, including its accessors.
 */
public class PatternEntryUseScope extends AbstractPatternEntryScope {
	private final SourceLoc initializerEnd;

	public PatternEntryUseScope(PatternBindingDecl decl, int patternEntryIndex) {
		this(decl, patternEntryIndex, SourceLoc.INVALID);
	}

	/**
	 * @param initializerEnd the end of the cached range of the paired
	 *                       initializer scope, or an invalid location if the
	 *                       entry has none
	 */
	public PatternEntryUseScope(PatternBindingDecl decl, int patternEntryIndex, SourceLoc initializerEnd) {
		super(decl, patternEntryIndex);
		this.initializerEnd = initializerEnd != null ? initializerEnd : SourceLoc.INVALID;
	}

	public SourceLoc getInitializerEnd() {
		return initializerEnd;
	}

	@Override
	public SourceRange getChildlessSourceRange() {
		SourceRange range = new SourceRange(getPatternEntry().getSourceRange(true).getEnd(),
				getPatternEntry().getSourceRange().getEnd());
		if (initializerEnd.isValid()) {
			// the initializer scope may end past the entry when it ends in an
			// interpolated string or an editor placeholder
			range = range.widen(new SourceRange(initializerEnd)).withStart(initializerEnd);
		}
		return range;
	}
}
