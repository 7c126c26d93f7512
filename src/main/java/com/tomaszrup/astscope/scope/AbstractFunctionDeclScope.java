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

import com.tomaszrup.astscope.ast.AbstractFunctionDecl;
import com.tomaszrup.astscope.source.SourceRange;

/**
 * A function, initializer, deinitializer or accessor declaration as a whole.
 */
public class AbstractFunctionDeclScope extends ASTScopeImpl {
	private final AbstractFunctionDecl decl;

	public AbstractFunctionDeclScope(AbstractFunctionDecl decl) {
		this.decl = decl;
	}

	public AbstractFunctionDecl getDecl() {
		return decl;
	}

	@Override
	public SourceRange getChildlessSourceRange() {
		SourceRange r = decl.getSourceRangeIncludingAttrs();
		if (r.getStart().isValid()) {
			return r;
		}
		return decl.getBodySourceRange();
	}

	@Override
	public String getDescription() {
		return FunctionScopes.describe(decl);
	}
}
