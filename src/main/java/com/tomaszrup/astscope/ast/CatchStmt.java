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

/**
 * {@code catch pattern where guard { body }}
 */
public class CatchStmt extends Stmt {
	private final Pattern errorPattern;
	private final SourceLoc whereLoc;
	private final Expr guardExpr;
	private final BraceStmt body;

	public CatchStmt(SourceLoc catchLoc, Pattern errorPattern, SourceLoc whereLoc, Expr guardExpr, BraceStmt body) {
		super(catchLoc, body.getEndLoc());
		this.errorPattern = errorPattern;
		this.whereLoc = whereLoc != null ? whereLoc : SourceLoc.INVALID;
		this.guardExpr = guardExpr;
		this.body = body;
	}

	public Pattern getErrorPattern() {
		return errorPattern;
	}

	public SourceLoc getWhereLoc() {
		return whereLoc;
	}

	public Expr getGuardExpr() {
		return guardExpr;
	}

	public BraceStmt getBody() {
		return body;
	}

	@Override
	public List<ASTNode> getChildren() {
		return childrenOf(errorPattern, guardExpr, body);
	}
}
