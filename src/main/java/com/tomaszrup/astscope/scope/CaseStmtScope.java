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

import com.tomaszrup.astscope.ast.CaseLabelItem;
import com.tomaszrup.astscope.ast.CaseStmt;
import com.tomaszrup.astscope.source.SourceRange;

/**
 * A {@code case} of a {@code switch}. Starts at the first guard expression of
 * its label items, if any, and extends to the end of the body.
 */
public class CaseStmtScope extends ASTScopeImpl {
	private final CaseStmt stmt;

	public CaseStmtScope(CaseStmt stmt) {
		this.stmt = stmt;
	}

	public CaseStmt getStmt() {
		return stmt;
	}

	@Override
	public SourceRange getChildlessSourceRange() {
		for (CaseLabelItem item : stmt.getCaseLabelItems()) {
			if (item.getGuardExpr() != null) {
				return new SourceRange(item.getGuardExpr().getStartLoc(), stmt.getBody().getEndLoc());
			}
		}
		return stmt.getBody().getSourceRange();
	}
}
