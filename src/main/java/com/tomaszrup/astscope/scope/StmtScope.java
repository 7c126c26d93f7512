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

import com.tomaszrup.astscope.ast.Stmt;
import com.tomaszrup.astscope.source.SourceRange;

/**
 * A labeled or compound statement as a whole: {@code if}, {@code while},
 * {@code guard}, {@code repeat}, {@code do}, {@code do}-{@code catch},
 * {@code switch} or {@code for}-{@code in}.
 */
public class StmtScope extends ASTScopeImpl {
	private final Stmt stmt;

	public StmtScope(Stmt stmt) {
		this.stmt = stmt;
	}

	public Stmt getStmt() {
		return stmt;
	}

	@Override
	public SourceRange getChildlessSourceRange() {
		return stmt.getSourceRange();
	}

	@Override
	public String getDescription() {
		return stmt.getClass().getSimpleName();
	}
}
