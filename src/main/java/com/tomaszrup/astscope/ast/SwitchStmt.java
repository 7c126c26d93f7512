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

public class SwitchStmt extends Stmt {
	private final Expr subject;
	private final List<CaseStmt> cases;

	public SwitchStmt(SourceLoc switchLoc, Expr subject, List<CaseStmt> cases, SourceLoc rBraceLoc) {
		super(switchLoc, rBraceLoc);
		this.subject = subject;
		this.cases = new ArrayList<>(cases);
	}

	public Expr getSubject() {
		return subject;
	}

	public List<CaseStmt> getCases() {
		return Collections.unmodifiableList(cases);
	}

	@Override
	public List<ASTNode> getChildren() {
		return childrenOf(subject, cases);
	}
}
