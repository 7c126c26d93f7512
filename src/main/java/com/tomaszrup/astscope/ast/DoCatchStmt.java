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

public class DoCatchStmt extends Stmt {
	private final BraceStmt body;
	private final List<CatchStmt> catches;

	public DoCatchStmt(SourceLoc doLoc, BraceStmt body, List<CatchStmt> catches) {
		super(doLoc, catches.isEmpty() ? body.getEndLoc() : catches.get(catches.size() - 1).getEndLoc());
		this.body = body;
		this.catches = new ArrayList<>(catches);
	}

	public BraceStmt getBody() {
		return body;
	}

	public List<CatchStmt> getCatches() {
		return Collections.unmodifiableList(catches);
	}

	@Override
	public List<ASTNode> getChildren() {
		return childrenOf(body, catches);
	}
}
