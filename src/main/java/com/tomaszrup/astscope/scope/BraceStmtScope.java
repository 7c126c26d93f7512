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

import com.tomaszrup.astscope.ast.BraceStmt;
import com.tomaszrup.astscope.ast.ClosureExpr;
import com.tomaszrup.astscope.source.SourceRange;

/**
 * A braced statement list. When the braces are a closure body, the scope
 * starts at the closure's {@code in} keyword.
 */
public class BraceStmtScope extends ASTScopeImpl {
	private final BraceStmt stmt;
	private final ClosureExpr parentClosure;

	public BraceStmtScope(BraceStmt stmt) {
		this(stmt, null);
	}

	/**
	 * @param parentClosure the closure whose body {@code stmt} is, or
	 *                      {@code null}
	 */
	public BraceStmtScope(BraceStmt stmt, ClosureExpr parentClosure) {
		this.stmt = stmt;
		this.parentClosure = parentClosure;
	}

	public BraceStmt getStmt() {
		return stmt;
	}

	public ClosureExpr getParentClosure() {
		return parentClosure;
	}

	@Override
	public SourceRange getChildlessSourceRange() {
		if (parentClosure != null && parentClosure.getInLoc().isValid()) {
			return new SourceRange(parentClosure.getInLoc(), stmt.getEndLoc());
		}
		return stmt.getSourceRange();
	}

	@Override
	public String getDescription() {
		return stmt.getElements().size() + " elements";
	}
}
