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

import com.tomaszrup.astscope.ast.ParamDecl;
import com.tomaszrup.astscope.source.SourceRange;

public class DefaultArgumentInitializerScope extends ASTScopeImpl {
	private final ParamDecl decl;

	public DefaultArgumentInitializerScope(ParamDecl decl) {
		if (!decl.hasDefaultValue()) {
			throw new IllegalArgumentException("parameter '" + decl.getName() + "' has no default value");
		}
		this.decl = decl;
	}

	public ParamDecl getDecl() {
		return decl;
	}

	@Override
	public SourceRange getChildlessSourceRange() {
		return decl.getDefaultValue().getSourceRange();
	}

	@Override
	public String getDescription() {
		return "'" + decl.getName() + "'";
	}
}
