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

public class RepeatWhileStmt extends Stmt {
	private final BraceStmt body;
	private final Expr cond;

	public RepeatWhileStmt(SourceLoc repeatLoc, BraceStmt body, Expr cond) {
		super(repeatLoc, cond.getEndLoc());
		this.body = body;
		this.cond = cond;
	}

	public BraceStmt getBody() {
		return body;
	}

	public Expr getCond() {
		return cond;
	}

	@Override
	public List<ASTNode> getChildren() {
		return childrenOf(body, cond);
	}
}
