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

import com.tomaszrup.astscope.ast.CaptureListExpr;
import com.tomaszrup.astscope.source.SourceRange;

/**
 * The capture list in front of a closure, e.g. {@code [weak self]}. Runs from
 * the start of the expression to where the closure's parameters begin.
 */
public class CaptureListScope extends ASTScopeImpl {
	private final CaptureListExpr expr;

	public CaptureListScope(CaptureListExpr expr) {
		this.expr = expr;
	}

	public CaptureListExpr getExpr() {
		return expr;
	}

	@Override
	public SourceRange getChildlessSourceRange() {
		return new SourceRange(expr.getStartLoc(), AbstractClosureScope.getStartOfFirstParam(expr.getClosureBody()));
	}

	@Override
	public String getDescription() {
		return expr.getCaptureList().size() + " captures";
	}
}
