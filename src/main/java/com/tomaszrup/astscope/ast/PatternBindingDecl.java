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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.tomaszrup.astscope.source.SourceLoc;

/**
 * {@code let a = 1, b = 2} or {@code var x: Int { get { ... } }}
 */
public class PatternBindingDecl extends Decl {
	private final List<PatternBindingEntry> entries;

	public PatternBindingDecl(SourceLoc introducerLoc, List<PatternBindingEntry> entries, SourceLoc endLoc) {
		super(introducerLoc, endLoc);
		this.entries = new ArrayList<>(entries);
		for (PatternBindingEntry entry : this.entries) {
			for (VarDecl var : entry.getPattern().getBoundVars()) {
				var.setParentPatternBinding(this);
			}
		}
	}

	public List<PatternBindingEntry> getPatternList() {
		return Collections.unmodifiableList(entries);
	}

	public PatternBindingEntry getPatternEntry(int index) {
		return entries.get(index);
	}

	public int getNumPatternEntries() {
		return entries.size();
	}

	@Override
	public List<ASTNode> getChildren() {
		List<ASTNode> children = new ArrayList<>();
		for (PatternBindingEntry entry : entries) {
			children.add(entry.getPattern());
			if (entry.getInitAsWritten() != null) {
				children.add(entry.getInitAsWritten());
			}
		}
		return children;
	}
}
