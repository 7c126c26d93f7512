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
 * A variable bound by a pattern. Computed and observed variables carry the
 * range of their accessor braces.
 */
public class VarDecl extends Decl {
	private final String name;
	private SourceRange bracesRange = SourceRange.INVALID;
	private PatternBindingDecl parentPatternBinding;

	public VarDecl(String name, SourceLoc nameLoc, SourceLoc endLoc) {
		super(nameLoc, endLoc);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	public SourceRange getBracesRange() {
		return bracesRange;
	}

	public void setBracesRange(SourceRange bracesRange) {
		this.bracesRange = bracesRange != null ? bracesRange : SourceRange.INVALID;
	}

	public boolean hasAccessorBraces() {
		return bracesRange.isValid();
	}

	/**
	 * Returns the pattern binding this variable is declared by, or
	 * {@code null} for variables bound elsewhere (for instance in a
	 * {@code for} pattern).
	 */
	public PatternBindingDecl getParentPatternBinding() {
		return parentPatternBinding;
	}

	void setParentPatternBinding(PatternBindingDecl parentPatternBinding) {
		this.parentPatternBinding = parentPatternBinding;
	}
}
