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
 * {@code { elements }}. Elements may be declarations, statements or
 * expressions.
 */
public class BraceStmt extends Stmt {
	private final List<ASTNode> elements;

	public BraceStmt(SourceLoc lBraceLoc, List<? extends ASTNode> elements, SourceLoc rBraceLoc) {
		super(lBraceLoc, rBraceLoc);
		this.elements = elements != null ? new ArrayList<>(elements) : new ArrayList<>();
	}

	public SourceLoc getLBraceLoc() {
		return getStartLoc();
	}

	public SourceLoc getRBraceLoc() {
		return getEndLoc();
	}

	public List<ASTNode> getElements() {
		return Collections.unmodifiableList(elements);
	}

	@Override
	public List<ASTNode> getChildren() {
		return Collections.unmodifiableList(elements);
	}
}
