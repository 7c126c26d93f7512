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

import com.tomaszrup.astscope.ast.ClosureExpr;
import com.tomaszrup.astscope.ast.ParameterList;
import com.tomaszrup.astscope.source.SourceLoc;

/**
 * Base of the scopes built for a closure expression.
 */
public abstract class AbstractClosureScope extends ASTScopeImpl {
	protected final ClosureExpr closureExpr;

	protected AbstractClosureScope(ClosureExpr closureExpr) {
		this.closureExpr = closureExpr;
	}

	public ClosureExpr getClosureExpr() {
		return closureExpr;
	}

	/**
	 * Returns where the closure's parameters begin. Falls back to the
	 * {@code in} keyword, then the opening brace of the body, then the start
	 * of the closure.
	 */
	static SourceLoc getStartOfFirstParam(ClosureExpr closure) {
		ParameterList params = closure.getParameters();
		if (params != null && params.size() > 0) {
			return params.get(0).getStartLoc();
		}
		if (closure.getInLoc().isValid()) {
			return closure.getInLoc();
		}
		if (closure.getBody() != null) {
			return closure.getBody().getLBraceLoc();
		}
		return closure.getStartLoc();
	}
}
