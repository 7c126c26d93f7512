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

import java.util.List;

import com.tomaszrup.astscope.source.SourceLoc;
import com.tomaszrup.astscope.source.SourceRange;

/**
 * Common base of functions, initializers, deinitializers and accessors.
 */
public abstract class AbstractFunctionDecl extends GenericContextDecl {
	private final SourceLoc loc;
	private final ParameterList parameters;
	private final BraceStmt body;

	protected AbstractFunctionDecl(SourceLoc startLoc, SourceLoc loc, ParameterList parameters, BraceStmt body,
			SourceLoc endLoc) {
		super(startLoc, endLoc);
		this.loc = loc != null ? loc : SourceLoc.INVALID;
		this.parameters = parameters;
		this.body = body;
	}

	@Override
	public SourceLoc getLoc() {
		return loc;
	}

	/**
	 * Returns the explicit parameter list, or {@code null} for declarations
	 * that are written without one.
	 */
	public ParameterList getParameters() {
		return parameters;
	}

	public BraceStmt getBody() {
		return body;
	}

	public SourceRange getBodySourceRange() {
		return body != null ? body.getSourceRange() : SourceRange.INVALID;
	}

	@Override
	public List<ASTNode> getChildren() {
		return childrenOf(getGenericParams(), parameters, getTrailingWhereClause(), body);
	}
}
