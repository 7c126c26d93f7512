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

public class DoStmt extends Stmt {
	private final BraceStmt body;

	public DoStmt(SourceLoc doLoc, BraceStmt body) {
		super(doLoc, body.getEndLoc());
		this.body = body;
	}

	public BraceStmt getBody() {
		return body;
	}

	@Override
	public List<ASTNode> getChildren() {
		return childrenOf(body);
	}
}
