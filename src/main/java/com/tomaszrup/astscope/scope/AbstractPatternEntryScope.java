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

import com.tomaszrup.astscope.ast.ASTNode;
import com.tomaszrup.astscope.ast.PatternBindingDecl;
import com.tomaszrup.astscope.ast.PatternBindingEntry;
import com.tomaszrup.astscope.ast.VarDecl;

/**
 * Base of the scopes built for one entry of a pattern binding declaration.
 */
public abstract class AbstractPatternEntryScope extends ASTScopeImpl {
	protected final PatternBindingDecl decl;
	protected final int patternEntryIndex;

	protected AbstractPatternEntryScope(PatternBindingDecl decl, int patternEntryIndex) {
		if (patternEntryIndex < 0 || patternEntryIndex >= decl.getNumPatternEntries()) {
			throw new IllegalArgumentException("pattern entry index " + patternEntryIndex + " out of range for "
					+ decl.getNumPatternEntries() + " entries");
		}
		this.decl = decl;
		this.patternEntryIndex = patternEntryIndex;
	}

	public PatternBindingDecl getDecl() {
		return decl;
	}

	public int getPatternEntryIndex() {
		return patternEntryIndex;
	}

	public PatternBindingEntry getPatternEntry() {
		return decl.getPatternEntry(patternEntryIndex);
	}

	/**
	 * Returns true for nodes the tree builder turns into pattern entry scopes
	 * of their own: pattern binding declarations and the variables they bind.
	 */
	public static boolean isCreatedDirectly(ASTNode node) {
		if (node instanceof PatternBindingDecl) {
			return true;
		}
		return node instanceof VarDecl && ((VarDecl) node).getParentPatternBinding() != null;
	}

	@Override
	public String getDescription() {
		return "entry " + patternEntryIndex;
	}
}
