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
import com.tomaszrup.astscope.source.SourceRange;

/**
 * The explicit parameters of a closure, up to the {@code in} keyword. Only
 * built for closures that have one.
 */
public class ClosureParametersScope extends AbstractClosureScope {

	public ClosureParametersScope(ClosureExpr closureExpr) {
		super(closureExpr);
	}

	@Override
	public SourceRange getChildlessSourceRange() {
		if (closureExpr.getInLoc().isInvalid()) {
			throw new IllegalStateException("ClosureParametersScope built for a closure without 'in'");
		}
		return new SourceRange(getStartOfFirstParam(closureExpr), closureExpr.getInLoc());
	}

	@Override
	public String getDescription() {
		int count = closureExpr.getParameters() != null ? closureExpr.getParameters().size() : 0;
		return count + " params";
	}
}
