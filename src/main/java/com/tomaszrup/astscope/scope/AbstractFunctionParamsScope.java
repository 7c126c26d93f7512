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
import com.tomaszrup.astscope.ast.AccessorDecl;
import com.tomaszrup.astscope.ast.Decl;
import com.tomaszrup.astscope.ast.DestructorDecl;
import com.tomaszrup.astscope.ast.ParameterList;
import com.tomaszrup.astscope.ast.SubscriptDecl;
import com.tomaszrup.astscope.source.SourceLoc;
import com.tomaszrup.astscope.source.SourceRange;

/**
 * The parameters of a function or subscript, in scope from the opening of
 * the parameter list to the end of the declaration.
 */
public class AbstractFunctionParamsScope extends ASTScopeImpl {
	private final ParameterList params;
	private final Decl owner;

	/**
	 * @param params the parameter list, {@code null} for declarations written
	 *               without one
	 * @param owner  the enclosing function or subscript declaration
	 */
	public AbstractFunctionParamsScope(ParameterList params, Decl owner) {
		if (!(owner instanceof AbstractFunctionDecl) && !(owner instanceof SubscriptDecl)) {
			throw new IllegalArgumentException("parameters must belong to a function or subscript, not "
					+ owner.getClass().getSimpleName());
		}
		this.params = params;
		this.owner = owner;
	}

	public ParameterList getParams() {
		return params;
	}

	public Decl getOwner() {
		return owner;
	}

	@Override
	public SourceRange getChildlessSourceRange() {
		SourceLoc endLoc = owner.getEndLoc();
		SourceLoc startLoc = getStartLoc();
		if (startLoc.isInvalid()) {
			throw new IllegalStateException("cannot find where the parameters of " + FunctionScopes.describe(owner)
					+ " start");
		}
		return new SourceRange(startLoc, endLoc);
	}

	// the parameters of accessors are implicit, and deinitializers have no parameter list
	private SourceLoc getStartLoc() {
		if (owner instanceof AccessorDecl) {
			return owner.getLoc();
		}
		if (owner instanceof DestructorDecl) {
			return ((DestructorDecl) owner).getNameLoc();
		}
		if (owner instanceof SubscriptDecl) {
			ParameterList indices = ((SubscriptDecl) owner).getIndices();
			return indices != null ? indices.getLParenLoc() : SourceLoc.INVALID;
		}
		ParameterList parameters = ((AbstractFunctionDecl) owner).getParameters();
		return parameters != null ? parameters.getLParenLoc() : SourceLoc.INVALID;
	}

	@Override
	public String getDescription() {
		return FunctionScopes.describe(owner);
	}
}
